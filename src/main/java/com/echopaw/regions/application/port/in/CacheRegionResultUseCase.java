package com.echopaw.regions.application.port.in;

import com.echopaw.regions.domain.model.GeoPoint;
import com.echopaw.regions.domain.model.LocationRecord;

import java.util.List;

/**
 * Input port for committing the result of a completed fetch.
 */
public interface CacheRegionResultUseCase {

  /**
   * Store the fetched records as a region and prune regions it makes redundant.
   *
   * @param requestId Id handed out by the preceding check
   * @param center Fetch center
   * @param radiusMeters Fetch radius in meters
   * @param records Records returned by the fetch
   * @param now Current time in epoch milliseconds
   */
  void cacheResult(String requestId, GeoPoint center, double radiusMeters,
      List<LocationRecord> records, long now);

  void cacheResult(String requestId, GeoPoint center, double radiusMeters, List<LocationRecord> records);

  /**
   * Produce a request id not used by any stored region.
   */
  String generateRequestId();
}
