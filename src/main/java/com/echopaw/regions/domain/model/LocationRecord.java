package com.echopaw.regions.domain.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * An audio post from the nearby feed together with the place it was recorded.
 * Two records are the same record when all of their fields are equal.
 */
@Getter
@EqualsAndHashCode
@ToString
public class LocationRecord {
    private final String audioId;
    private final String userId;
    private final String emotion;
    private final String text;
    private final String audioUrl;
    private final String locationName;
    private final GeoPoint location;

    public LocationRecord(String audioId, String userId, String emotion, String text,
            String audioUrl, String locationName, GeoPoint location) {
        if (audioId == null || audioId.isBlank()) {
            throw new IllegalArgumentException("Audio id must not be blank");
        }
        if (location == null) {
            throw new IllegalArgumentException("Record location must not be null");
        }
        this.audioId = audioId;
        this.userId = userId;
        this.emotion = emotion;
        this.text = text;
        this.audioUrl = audioUrl;
        this.locationName = locationName;
        this.location = location;
    }
}
