package com.echopaw.regions.application.service;

import com.echopaw.regions.application.port.in.CacheRegionResultUseCase;
import com.echopaw.regions.application.port.in.CheckRegionUseCase;
import com.echopaw.regions.application.port.out.CacheMetricsRecorder;
import com.echopaw.regions.application.port.out.RegionStore;
import com.echopaw.regions.domain.model.CacheStats;
import com.echopaw.regions.domain.model.CachedRegion;
import com.echopaw.regions.domain.model.GeoPoint;
import com.echopaw.regions.domain.model.LocationRecord;
import com.echopaw.regions.domain.model.RequestResult;
import com.echopaw.regions.domain.service.GeoMath;
import com.echopaw.regions.infrastructure.config.RegionCacheProperties;
import com.echopaw.regions.infrastructure.scheduling.RegionExpiryReaper;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Application service deciding whether a map query needs a network fetch.
 *
 * Strategy: passive expiry → exact match → overlap merge → miss.
 * Committed fetches are stored as regions and regions they cover are pruned.
 */
@Service
public class RegionDeduplicationService implements CheckRegionUseCase, CacheRegionResultUseCase {

    private static final Logger logger = LoggerFactory.getLogger(RegionDeduplicationService.class);

    private final RegionStore regionStore;
    private final CacheStatsCollector statsCollector;
    private final CacheMetricsRecorder metricsRecorder;
    private final RegionExpiryReaper expiryReaper;
    private final Clock clock;
    private final RegionCacheProperties properties;
    private final long expireTimeMillis;

    public RegionDeduplicationService(
            RegionStore regionStore,
            CacheStatsCollector statsCollector,
            CacheMetricsRecorder metricsRecorder,
            RegionExpiryReaper expiryReaper,
            Clock clock,
            RegionCacheProperties properties) {
        this.regionStore = regionStore;
        this.statsCollector = statsCollector;
        this.metricsRecorder = metricsRecorder;
        this.expiryReaper = expiryReaper;
        this.clock = clock;
        this.properties = properties;
        this.expireTimeMillis = properties.getCacheExpireTimeMillis();
    }

    /**
     * Start background expiry when performance monitoring is enabled.
     */
    @PostConstruct
    public void start() {
        if (properties.isEnablePerformanceMonitoring()) {
            expiryReaper.start();
        } else {
            logger.info("Performance monitoring disabled, expiry reaper not started");
        }
    }

    @Override
    public RequestResult checkRequest(GeoPoint center) {
        return checkRequest(center, properties.getDefaultSearchRadiusMeters());
    }

    @Override
    public RequestResult checkRequest(GeoPoint center, double radiusMeters) {
        return checkRequest(center, radiusMeters, clock.millis());
    }

    @Override
    public RequestResult checkRequest(GeoPoint center, double radiusMeters, long now) {
        validateQuery(center, radiusMeters);
        statsCollector.recordRequest();

        logger.debug("Checking request for center: ({}, {}), radius: {}",
                center.getLatitude(), center.getLongitude(), radiusMeters);

        // Step 1: Passive expiry
        removeExpired(now);

        // Step 2: Exact match
        Optional<CachedRegion> exactMatch = findExactMatch(center, radiusMeters, now);
        if (exactMatch.isPresent()) {
            CachedRegion region = exactMatch.get();
            statsCollector.recordHit();
            recordMetricsHit();
            logger.debug("Cache hit: region {} covers the query with {} records",
                    region.getId(), region.getRecords().size());
            return new RequestResult.CacheHit(region.getRecords(), region);
        }

        // Step 3: Overlapping regions
        List<CachedRegion> overlapping = findOverlappingRegions(center, radiusMeters, now);
        if (!overlapping.isEmpty()) {
            List<LocationRecord> merged = mergeOverlappingRecords(overlapping, center, radiusMeters);
            String requestId = generateRequestId();
            statsCollector.recordPartialHit();
            recordMetricsHit();
            logger.debug("Partial cache hit: {} overlapping regions, {} merged records, request ID: {}",
                    overlapping.size(), merged.size(), requestId);
            return new RequestResult.PartialHit(merged, requestId, overlapping);
        }

        // Step 4: Miss
        String requestId = generateRequestId();
        statsCollector.recordMiss();
        recordMetricsMiss();
        logger.debug("Cache miss, request ID: {}", requestId);
        return new RequestResult.CacheMiss(requestId);
    }

    @Override
    public void cacheResult(String requestId, GeoPoint center, double radiusMeters, List<LocationRecord> records) {
        cacheResult(requestId, center, radiusMeters, records, clock.millis());
    }

    @Override
    public void cacheResult(String requestId, GeoPoint center, double radiusMeters,
            List<LocationRecord> records, long now) {
        CachedRegion newRegion = new CachedRegion(requestId, center, radiusMeters, records, now);

        if (properties.isBidirectionalPruning() && isCoveredByExistingRegion(newRegion, now)) {
            logger.debug("Region {} already covered by a cached region, not storing it", requestId);
            return;
        }

        regionStore.put(newRegion);
        logger.debug("Cached result for request {} with {} records", requestId, newRegion.getRecords().size());

        pruneCoveredRegions(newRegion);
        enforceCapacity(newRegion.getId());
    }

    /**
     * Request id of the form {@code req_<epochMillis>_<random>}. Ids already in
     * use by a stored region are never returned.
     */
    @Override
    public String generateRequestId() {
        String requestId;
        do {
            requestId = "req_" + clock.millis() + "_" + Long.toHexString(ThreadLocalRandom.current().nextLong());
        } while (regionStore.containsId(requestId));
        return requestId;
    }

    @Override
    public boolean isRegionCached(GeoPoint center, double radiusMeters) {
        validateQuery(center, radiusMeters);
        return findExactMatch(center, radiusMeters, clock.millis()).isPresent();
    }

    @Override
    public Optional<List<LocationRecord>> getCachedData(GeoPoint center, double radiusMeters) {
        validateQuery(center, radiusMeters);
        return findExactMatch(center, radiusMeters, clock.millis()).map(CachedRegion::getRecords);
    }

    public CacheStats getCacheStats() {
        return statsCollector.snapshot(regionStore.size());
    }

    public void resetStats() {
        statsCollector.reset();
        logger.debug("Reset cache statistics");
    }

    public void clearCache() {
        regionStore.clear();
        logger.debug("Cleared all cached regions");
    }

    public int getCacheSize() {
        return regionStore.size();
    }

    /**
     * Stop the expiry reaper and drop all regions and counters.
     */
    @PreDestroy
    public void cleanup() {
        expiryReaper.stop();
        regionStore.clear();
        statsCollector.reset();
        logger.info("Cleaned up region cache resources");
    }

    private void validateQuery(GeoPoint center, double radiusMeters) {
        if (center == null) {
            throw new IllegalArgumentException("Query center must not be null");
        }
        if (!Double.isFinite(radiusMeters) || radiusMeters < 0) {
            throw new IllegalArgumentException("Query radius must be a non-negative number of meters");
        }
    }

    private void removeExpired(long now) {
        List<CachedRegion> expired = regionStore.removeIf(region -> region.isExpired(now, expireTimeMillis));
        expired.forEach(region -> logger.debug("Removed expired cache region: {}", region.getId()));
    }

    /**
     * Freshest non-expired region containing the query, ties broken by id.
     */
    private Optional<CachedRegion> findExactMatch(GeoPoint center, double radiusMeters, long now) {
        return regionStore.snapshot().stream()
                .filter(region -> !region.isExpired(now, expireTimeMillis))
                .filter(region -> region.contains(center, radiusMeters))
                .max(Comparator.comparingLong(CachedRegion::getCreatedAt)
                        .thenComparing(CachedRegion::getId, Comparator.reverseOrder()));
    }

    private List<CachedRegion> findOverlappingRegions(GeoPoint center, double radiusMeters, long now) {
        return regionStore.snapshot().stream()
                .filter(region -> !region.isExpired(now, expireTimeMillis))
                .filter(region -> region.overlaps(center, radiusMeters))
                .sorted(Comparator.comparing(CachedRegion::getId))
                .toList();
    }

    /**
     * Union of the overlapping regions' records that lie within the query circle.
     */
    private List<LocationRecord> mergeOverlappingRecords(List<CachedRegion> regions, GeoPoint center,
            double radiusMeters) {
        Set<LocationRecord> merged = new LinkedHashSet<>();
        for (CachedRegion region : regions) {
            for (LocationRecord record : region.getRecords()) {
                if (GeoMath.distance(center, record.getLocation()) <= radiusMeters) {
                    merged.add(record);
                }
            }
        }
        return List.copyOf(merged);
    }

    private boolean isCoveredByExistingRegion(CachedRegion newRegion, long now) {
        return regionStore.snapshot().stream()
                .filter(region -> !region.getId().equals(newRegion.getId()))
                .filter(region -> !region.isExpired(now, expireTimeMillis))
                .anyMatch(region -> region.contains(newRegion.getCenter(), newRegion.getRadiusMeters()));
    }

    private void pruneCoveredRegions(CachedRegion newRegion) {
        List<CachedRegion> pruned = regionStore.removeIf(existing ->
                !existing.getId().equals(newRegion.getId())
                        && newRegion.contains(existing.getCenter(), existing.getRadiusMeters()));
        pruned.forEach(region -> logger.debug("Removing redundant cache region: {}", region.getId()));
    }

    private void enforceCapacity(String keepId) {
        int maxRegions = properties.getMaxRegions();
        if (maxRegions <= 0) {
            return;
        }
        int overflow = regionStore.size() - maxRegions;
        if (overflow <= 0) {
            return;
        }
        regionStore.snapshot().stream()
                .filter(region -> !region.getId().equals(keepId))
                .sorted(Comparator.comparingLong(CachedRegion::getCreatedAt)
                        .thenComparing(CachedRegion::getId))
                .limit(overflow)
                .filter(regionStore::remove)
                .forEach(region ->
                        logger.debug("Evicted region {} to stay within {} regions", region.getId(), maxRegions));
    }

    private void recordMetricsHit() {
        if (properties.isEnablePerformanceMonitoring()) {
            metricsRecorder.recordCacheHit();
        }
    }

    private void recordMetricsMiss() {
        if (properties.isEnablePerformanceMonitoring()) {
            metricsRecorder.recordCacheMiss();
        }
    }
}
