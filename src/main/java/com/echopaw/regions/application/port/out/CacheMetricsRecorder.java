package com.echopaw.regions.application.port.out;

/**
 * Output port to the performance metrics collector.
 */
public interface CacheMetricsRecorder {

  void recordCacheHit();

  void recordCacheMiss();
}
