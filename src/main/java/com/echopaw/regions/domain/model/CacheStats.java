package com.echopaw.regions.domain.model;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Point-in-time view of the cache counters.
 */
@Getter
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public class CacheStats {
    private final long totalRequests;
    private final long cacheHits;
    private final long cacheMisses;
    private final long partialHits;
    /** Percentage of requests answered at least partly from cache, 0 to 100. */
    private final double hitRate;
    private final int cachedRegions;
}
