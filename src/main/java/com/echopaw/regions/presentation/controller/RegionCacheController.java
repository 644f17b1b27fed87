package com.echopaw.regions.presentation.controller;

import com.echopaw.regions.api.dto.CacheStatsResponseDto;
import com.echopaw.regions.api.dto.LocationRecordResponseDto;
import com.echopaw.regions.api.dto.RegionLookupResponseDto;
import com.echopaw.regions.application.mapper.RegionCacheMapper;
import com.echopaw.regions.application.service.RegionDeduplicationService;
import com.echopaw.regions.domain.model.GeoPoint;
import com.echopaw.regions.domain.model.LocationRecord;
import com.echopaw.regions.infrastructure.config.RegionCacheProperties;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Optional;

/**
 * Controller for inspecting and administering the region cache.
 */
@RestController
@RequestMapping("/cache")
@Validated
public class RegionCacheController {

    private static final Logger logger = LoggerFactory.getLogger(RegionCacheController.class);

    private final RegionDeduplicationService regionDeduplicationService;
    private final RegionCacheMapper regionCacheMapper;
    private final RegionCacheProperties properties;

    public RegionCacheController(
            RegionDeduplicationService regionDeduplicationService,
            RegionCacheMapper regionCacheMapper,
            RegionCacheProperties properties) {
        this.regionDeduplicationService = regionDeduplicationService;
        this.regionCacheMapper = regionCacheMapper;
        this.properties = properties;
    }

    /**
     * GET /cache/stats
     *
     * @return Request counters, hit rate and number of cached regions
     */
    @GetMapping("/stats")
    public ResponseEntity<CacheStatsResponseDto> getStats() {
        return ResponseEntity.ok(regionCacheMapper.toDto(regionDeduplicationService.getCacheStats()));
    }

    /**
     * POST /cache/stats/reset
     *
     * Zeroes the counters, cached regions are kept.
     */
    @PostMapping("/stats/reset")
    public ResponseEntity<Void> resetStats() {
        logger.info("Resetting region cache statistics");
        regionDeduplicationService.resetStats();
        return ResponseEntity.noContent().build();
    }

    /**
     * DELETE /cache
     */
    @DeleteMapping
    public ResponseEntity<Void> clearCache() {
        logger.info("Clearing region cache ({} regions)", regionDeduplicationService.getCacheSize());
        regionDeduplicationService.clearCache();
        return ResponseEntity.noContent().build();
    }

    /**
     * GET /cache/regions?lat=X&lng=Y&radius=R
     *
     * Looks up a cached region fully covering the circle without counting a request.
     *
     * @param lat Latitude (-90 to 90)
     * @param lng Longitude (-180 to 180)
     * @param radius Radius in meters, defaults to the configured search radius
     * @return Whether the circle is cached, with the cached records if so
     */
    @GetMapping("/regions")
    public ResponseEntity<RegionLookupResponseDto> lookupRegion(
        @RequestParam @NotNull(message = "Latitude is required")
        @DecimalMin(value = "-90.0", message = "Latitude must be between -90 and 90")
        @DecimalMax(value = "90.0", message = "Latitude must be between -90 and 90")
        Double lat,

        @RequestParam @NotNull(message = "Longitude is required")
        @DecimalMin(value = "-180.0", message = "Longitude must be between -180 and 180")
        @DecimalMax(value = "180.0", message = "Longitude must be between -180 and 180")
        Double lng,

        @RequestParam(required = false)
        @PositiveOrZero(message = "Radius must not be negative")
        Double radius
    ) {
        double radiusMeters = radius != null ? radius : properties.getDefaultSearchRadiusMeters();
        logger.debug("Looking up cached region: lat={}, lng={}, radius={}", lat, lng, radiusMeters);

        Optional<List<LocationRecord>> cached = regionDeduplicationService
                .getCachedData(new GeoPoint(lat, lng), radiusMeters);
        List<LocationRecordResponseDto> records = cached.orElse(List.of()).stream()
                .map(regionCacheMapper::toDto)
                .toList();

        RegionLookupResponseDto.KeyDto key = new RegionLookupResponseDto.KeyDto(lat, lng, radiusMeters);
        return ResponseEntity.ok(new RegionLookupResponseDto(key, cached.isPresent(), records));
    }
}
