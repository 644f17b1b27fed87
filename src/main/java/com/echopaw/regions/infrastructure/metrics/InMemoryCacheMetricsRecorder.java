package com.echopaw.regions.infrastructure.metrics;

import com.echopaw.regions.application.port.out.CacheMetricsRecorder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.LongAdder;

/**
 * Default metrics collector keeping process-lifetime hit and miss counters.
 */
@Component
public class InMemoryCacheMetricsRecorder implements CacheMetricsRecorder {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryCacheMetricsRecorder.class);

    private final LongAdder cacheHits = new LongAdder();
    private final LongAdder cacheMisses = new LongAdder();

    @Override
    public void recordCacheHit() {
        cacheHits.increment();
        logger.trace("Recorded cache hit, total hits: {}", cacheHits.sum());
    }

    @Override
    public void recordCacheMiss() {
        cacheMisses.increment();
        logger.trace("Recorded cache miss, total misses: {}", cacheMisses.sum());
    }

    public long getCacheHits() {
        return cacheHits.sum();
    }

    public long getCacheMisses() {
        return cacheMisses.sum();
    }
}
