package com.echopaw.regions.infrastructure.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Region cache settings bound from {@code app.region-cache.*}.
 */
@ConfigurationProperties(prefix = "app.region-cache")
@Validated
@Getter
@Setter
public class RegionCacheProperties {

    /**
     * Age after which a cached region is stale.
     */
    @NotNull
    private Duration cacheExpireTime = Duration.ofMinutes(5);

    /**
     * Gates the expiry reaper and metrics recording.
     */
    private boolean enablePerformanceMonitoring = true;

    @PositiveOrZero
    private double defaultSearchRadiusMeters = 1000.0;

    /**
     * Upper bound on stored regions, 0 for no bound.
     */
    @Min(0)
    private int maxRegions = 0;

    /**
     * Also drop a newly cached region when an existing region already covers it.
     */
    private boolean bidirectionalPruning = false;

    @AssertTrue(message = "Cache expire time must be positive")
    public boolean isCacheExpireTimePositive() {
        return cacheExpireTime != null && cacheExpireTime.toMillis() > 0;
    }

    public long getCacheExpireTimeMillis() {
        return cacheExpireTime.toMillis();
    }

    /**
     * Reaper cadence: a quarter of the expiry time, at least one millisecond.
     */
    public Duration getReaperInterval() {
        return Duration.ofMillis(Math.max(1L, getCacheExpireTimeMillis() / 4));
    }
}
