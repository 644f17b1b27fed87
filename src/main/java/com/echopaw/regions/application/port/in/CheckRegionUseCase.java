package com.echopaw.regions.application.port.in;

import com.echopaw.regions.domain.model.GeoPoint;
import com.echopaw.regions.domain.model.LocationRecord;
import com.echopaw.regions.domain.model.RequestResult;

import java.util.List;
import java.util.Optional;

/**
 * Input port for deciding whether a query circle needs a real fetch.
 */
public interface CheckRegionUseCase {

  /**
   * Classify a query circle as a cache hit, partial hit or miss.
   * Runs passive expiry and updates the request counters.
   *
   * @param center Query center
   * @param radiusMeters Query radius in meters
   * @param now Current time in epoch milliseconds
   * @return Hit with cached records, partial hit with merged records and a new
   *         request id, or miss with a new request id
   */
  RequestResult checkRequest(GeoPoint center, double radiusMeters, long now);

  RequestResult checkRequest(GeoPoint center, double radiusMeters);

  /**
   * Check using the configured default search radius.
   */
  RequestResult checkRequest(GeoPoint center);

  /**
   * Whether a non-expired region fully covers the circle. Does not touch counters.
   */
  boolean isRegionCached(GeoPoint center, double radiusMeters);

  /**
   * Records of a non-expired region fully covering the circle. Does not touch counters.
   */
  Optional<List<LocationRecord>> getCachedData(GeoPoint center, double radiusMeters);
}
