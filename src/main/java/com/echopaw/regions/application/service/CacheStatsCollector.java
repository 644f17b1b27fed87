package com.echopaw.regions.application.service;

import com.echopaw.regions.domain.model.CacheStats;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Request counters for the region cache, safe under concurrent callers.
 */
@Component
public class CacheStatsCollector {

    private final AtomicLong totalRequests = new AtomicLong();
    private final AtomicLong cacheHits = new AtomicLong();
    private final AtomicLong cacheMisses = new AtomicLong();
    private final AtomicLong partialHits = new AtomicLong();

    public void recordRequest() {
        totalRequests.incrementAndGet();
    }

    public void recordHit() {
        cacheHits.incrementAndGet();
    }

    public void recordMiss() {
        cacheMisses.incrementAndGet();
    }

    public void recordPartialHit() {
        partialHits.incrementAndGet();
    }

    /**
     * Build a stats view. Hit rate counts partial hits as hits.
     *
     * @param cachedRegions Current number of stored regions
     */
    public CacheStats snapshot(int cachedRegions) {
        long total = totalRequests.get();
        long hits = cacheHits.get();
        long misses = cacheMisses.get();
        long partials = partialHits.get();
        double hitRate = total > 0 ? (double) (hits + partials) / total * 100 : 0.0;
        return new CacheStats(total, hits, misses, partials, hitRate, cachedRegions);
    }

    public void reset() {
        totalRequests.set(0);
        cacheHits.set(0);
        cacheMisses.set(0);
        partialHits.set(0);
    }
}
