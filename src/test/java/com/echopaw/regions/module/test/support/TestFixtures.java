package com.echopaw.regions.module.test.support;

import com.echopaw.regions.application.service.CacheStatsCollector;
import com.echopaw.regions.application.service.RegionDeduplicationService;
import com.echopaw.regions.application.port.out.CacheMetricsRecorder;
import com.echopaw.regions.domain.model.GeoPoint;
import com.echopaw.regions.domain.model.LocationRecord;
import com.echopaw.regions.infrastructure.cache.InMemoryRegionStore;
import com.echopaw.regions.infrastructure.config.RegionCacheProperties;
import com.echopaw.regions.infrastructure.scheduling.RegionExpiryReaper;

import java.time.Clock;
import java.time.Duration;

/**
 * Test fixtures for creating test data.
 * Provides factory methods for common test scenarios.
 */
public class TestFixtures {

    private TestFixtures() {
        // Utility class
    }

    /**
     * Create a test record at the given location.
     */
    public static LocationRecord record(String audioId, double lat, double lng) {
        return new LocationRecord(
                audioId,
                "user-" + audioId,
                "calm",
                "Recorded near " + lat + "," + lng,
                "https://cdn.echopaw.test/audio/" + audioId + ".m4a",
                "Hangzhou West Lake",
                new GeoPoint(lat, lng));
    }

    /**
     * Create region cache properties with the given expiry.
     */
    public static RegionCacheProperties properties(Duration expireTime, boolean monitoring) {
        RegionCacheProperties properties = new RegionCacheProperties();
        properties.setCacheExpireTime(expireTime);
        properties.setEnablePerformanceMonitoring(monitoring);
        return properties;
    }

    /**
     * Wire a deduplication service around a fresh in-memory store.
     */
    public static RegionDeduplicationService deduplicationService(
            InMemoryRegionStore store,
            CacheMetricsRecorder metricsRecorder,
            Clock clock,
            RegionCacheProperties properties) {
        return new RegionDeduplicationService(
                store,
                new CacheStatsCollector(),
                metricsRecorder,
                new RegionExpiryReaper(store, clock, properties),
                clock,
                properties);
    }

    /**
     * Common test coordinates.
     */
    public static class Coordinates {
        public static final GeoPoint WEST_LAKE = new GeoPoint(30.0, 120.0);
        public static final GeoPoint WEST_LAKE_NORTH_EAST = new GeoPoint(30.01, 120.01);
        public static final GeoPoint SHANGHAI_OUTSKIRTS = new GeoPoint(31.0, 121.0);
    }

    /**
     * Common test data.
     */
    public static class Common {
        public static final long EXPIRE_TIME_MS = 60_000L;
        public static final double DEFAULT_RADIUS_METERS = 1000.0;
    }
}
