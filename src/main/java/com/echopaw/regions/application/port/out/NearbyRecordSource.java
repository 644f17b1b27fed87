package com.echopaw.regions.application.port.out;

import com.echopaw.regions.domain.model.GeoPoint;
import com.echopaw.regions.domain.model.LocationRecord;

import java.util.List;

/**
 * Output port to the network client that fetches feed records for a circle.
 */
public interface NearbyRecordSource {

  /**
   * Fetch every record within the given circle.
   *
   * @param center Search center
   * @param radiusMeters Search radius in meters
   * @return Records located inside the circle
   * @throws RecordFetchException if the upstream call fails
   */
  List<LocationRecord> fetchNearby(GeoPoint center, double radiusMeters);

  /**
   * Exception thrown when fetching records from upstream fails.
   */
  class RecordFetchException extends RuntimeException {
    public RecordFetchException(String message) {
      super(message);
    }

    public RecordFetchException(String message, Throwable cause) {
      super(message, cause);
    }
  }
}
