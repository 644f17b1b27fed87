package com.echopaw.regions.infrastructure.config;

import com.echopaw.regions.application.port.out.NearbyRecordSource;
import com.echopaw.regions.application.service.NearbyRecordLoader;
import com.echopaw.regions.application.service.RegionDeduplicationService;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wiring for the region cache.
 */
@Configuration
@EnableConfigurationProperties(RegionCacheProperties.class)
public class RegionCacheConfig {

    /**
     * Wall clock used for region timestamps and expiry checks.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Fetch orchestration, available once a network client is registered.
     */
    @Bean
    @ConditionalOnBean(NearbyRecordSource.class)
    public NearbyRecordLoader nearbyRecordLoader(
            RegionDeduplicationService regionDeduplicationService,
            NearbyRecordSource nearbyRecordSource) {
        return new NearbyRecordLoader(regionDeduplicationService, regionDeduplicationService, nearbyRecordSource);
    }
}
