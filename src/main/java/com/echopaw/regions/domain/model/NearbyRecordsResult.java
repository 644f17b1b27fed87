package com.echopaw.regions.domain.model;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * Records returned for a nearby query and where they came from.
 */
@Getter
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public class NearbyRecordsResult {
    private final List<LocationRecord> records;
    private final Source source;
    /** Id of the fetch committed for this query, null when served from cache. */
    private final String requestId;

    public enum Source {
        CACHE,
        PARTIAL_CACHE,
        NETWORK
    }
}
