package com.echopaw.regions.application.port.out;

import com.echopaw.regions.domain.model.CachedRegion;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Output port for the shared region map, keyed by request id.
 * Implementations must be safe for concurrent use. Scans may observe
 * concurrent inserts and removals.
 */
public interface RegionStore {

  /**
   * Insert a region, replacing any region stored under the same id.
   */
  void put(CachedRegion region);

  Optional<CachedRegion> get(String id);

  boolean containsId(String id);

  /**
   * Remove the region stored under its id, but only while that id still maps
   * to {@code expected}.
   *
   * @return true if the region was removed
   */
  boolean remove(CachedRegion expected);

  /**
   * Remove every region matching the predicate.
   *
   * @return the regions that were removed
   */
  List<CachedRegion> removeIf(Predicate<CachedRegion> predicate);

  /**
   * Copy of the regions currently stored. Iteration order carries no meaning.
   */
  Collection<CachedRegion> snapshot();

  int size();

  void clear();
}
