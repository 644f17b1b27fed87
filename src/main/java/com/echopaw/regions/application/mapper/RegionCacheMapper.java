package com.echopaw.regions.application.mapper;

import com.echopaw.regions.api.dto.CacheStatsResponseDto;
import com.echopaw.regions.api.dto.LocationRecordResponseDto;
import com.echopaw.regions.domain.model.CacheStats;
import com.echopaw.regions.domain.model.LocationRecord;
import org.springframework.stereotype.Component;

/**
 * Mapper for converting between domain models and DTOs.
 */
@Component
public class RegionCacheMapper {

  public LocationRecordResponseDto toDto(LocationRecord record) {
    return new LocationRecordResponseDto(
        record.getAudioId(),
        record.getUserId(),
        record.getEmotion(),
        record.getText(),
        record.getAudioUrl(),
        record.getLocationName(),
        record.getLocation().getLatitude(),
        record.getLocation().getLongitude());
  }

  public CacheStatsResponseDto toDto(CacheStats stats) {
    return new CacheStatsResponseDto(
        stats.getTotalRequests(),
        stats.getCacheHits(),
        stats.getCacheMisses(),
        stats.getPartialHits(),
        stats.getHitRate(),
        stats.getCachedRegions());
  }
}
