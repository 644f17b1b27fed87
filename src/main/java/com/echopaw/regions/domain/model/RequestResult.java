package com.echopaw.regions.domain.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * Outcome of checking a query circle against the region cache.
 *
 * <ul>
 * <li>{@link CacheHit}: a cached region fully covers the query, no fetch needed.</li>
 * <li>{@link PartialHit}: some cached regions overlap the query. The merged records
 * can be shown right away, but the caller still fetches with the returned id.</li>
 * <li>{@link CacheMiss}: nothing cached nearby, fetch with the returned id.</li>
 * </ul>
 */
public abstract class RequestResult {

    RequestResult() {
    }

    public abstract ResultType getType();

    public enum ResultType {
        HIT,
        PARTIAL_HIT,
        MISS
    }

    @Getter
    @EqualsAndHashCode(callSuper = false)
    @ToString
    public static final class CacheHit extends RequestResult {
        private final List<LocationRecord> records;
        private final CachedRegion region;

        public CacheHit(List<LocationRecord> records, CachedRegion region) {
            this.records = List.copyOf(records);
            this.region = region;
        }

        @Override
        public ResultType getType() {
            return ResultType.HIT;
        }
    }

    @Getter
    @EqualsAndHashCode(callSuper = false)
    @ToString
    public static final class PartialHit extends RequestResult {
        private final List<LocationRecord> mergedRecords;
        private final String requestId;
        private final List<CachedRegion> overlappingRegions;

        public PartialHit(List<LocationRecord> mergedRecords, String requestId,
                List<CachedRegion> overlappingRegions) {
            this.mergedRecords = List.copyOf(mergedRecords);
            this.requestId = requestId;
            this.overlappingRegions = List.copyOf(overlappingRegions);
        }

        @Override
        public ResultType getType() {
            return ResultType.PARTIAL_HIT;
        }
    }

    @Getter
    @EqualsAndHashCode(callSuper = false)
    @ToString
    public static final class CacheMiss extends RequestResult {
        private final String requestId;

        public CacheMiss(String requestId) {
            this.requestId = requestId;
        }

        @Override
        public ResultType getType() {
            return ResultType.MISS;
        }
    }
}
