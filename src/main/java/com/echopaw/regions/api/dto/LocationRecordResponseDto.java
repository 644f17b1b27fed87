package com.echopaw.regions.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class LocationRecordResponseDto {

    @JsonProperty("audioId")
    private String audioId;

    @JsonProperty("userId")
    private String userId;

    @JsonProperty("emotion")
    private String emotion;

    @JsonProperty("text")
    private String text;

    @JsonProperty("audioUrl")
    private String audioUrl;

    @JsonProperty("locationName")
    private String locationName;

    @JsonProperty("lat")
    private double lat;

    @JsonProperty("lng")
    private double lng;
}
