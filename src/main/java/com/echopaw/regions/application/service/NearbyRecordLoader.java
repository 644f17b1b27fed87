package com.echopaw.regions.application.service;

import com.echopaw.regions.application.port.in.CacheRegionResultUseCase;
import com.echopaw.regions.application.port.in.CheckRegionUseCase;
import com.echopaw.regions.application.port.out.NearbyRecordSource;
import com.echopaw.regions.domain.model.GeoPoint;
import com.echopaw.regions.domain.model.LocationRecord;
import com.echopaw.regions.domain.model.NearbyRecordsResult;
import com.echopaw.regions.domain.model.RequestResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Loads nearby feed records for a map view.
 * Strategy: region cache first → network fetch on miss or partial hit → commit to cache
 */
public class NearbyRecordLoader {

    private static final Logger logger = LoggerFactory.getLogger(NearbyRecordLoader.class);

    private final CheckRegionUseCase checkRegionUseCase;
    private final CacheRegionResultUseCase cacheRegionResultUseCase;
    private final NearbyRecordSource nearbyRecordSource;

    public NearbyRecordLoader(
            CheckRegionUseCase checkRegionUseCase,
            CacheRegionResultUseCase cacheRegionResultUseCase,
            NearbyRecordSource nearbyRecordSource) {
        this.checkRegionUseCase = checkRegionUseCase;
        this.cacheRegionResultUseCase = cacheRegionResultUseCase;
        this.nearbyRecordSource = nearbyRecordSource;
    }

    /**
     * Load records within the circle.
     *
     * @param center Search center
     * @param radiusMeters Search radius in meters
     * @param forceRefresh Skip the cache check and always fetch
     * @return Records with their source
     * @throws NearbyRecordSource.RecordFetchException if the fetch fails and no
     *         cached records overlap the circle
     */
    public NearbyRecordsResult load(GeoPoint center, double radiusMeters, boolean forceRefresh) {
        logger.info("Loading nearby records: lat={}, lng={}, radius={}, forceRefresh={}",
                center.getLatitude(), center.getLongitude(), radiusMeters, forceRefresh);

        String requestId;
        RequestResult.PartialHit partialHit = null;

        if (forceRefresh) {
            requestId = cacheRegionResultUseCase.generateRequestId();
        } else {
            RequestResult result = checkRegionUseCase.checkRequest(center, radiusMeters);
            if (result instanceof RequestResult.CacheHit hit) {
                logger.debug("Cache hit, using {} cached records", hit.getRecords().size());
                return new NearbyRecordsResult(hit.getRecords(), NearbyRecordsResult.Source.CACHE, null);
            }
            if (result instanceof RequestResult.PartialHit partial) {
                logger.debug("Partial cache hit, {} cached records available while fetching",
                        partial.getMergedRecords().size());
                partialHit = partial;
                requestId = partial.getRequestId();
            } else {
                requestId = ((RequestResult.CacheMiss) result).getRequestId();
            }
        }

        List<LocationRecord> fetched;
        try {
            fetched = nearbyRecordSource.fetchNearby(center, radiusMeters);
        } catch (NearbyRecordSource.RecordFetchException e) {
            if (partialHit != null) {
                logger.warn("Fetch failed for request ID: {}, falling back to {} partially cached records: {}",
                        requestId, partialHit.getMergedRecords().size(), e.getMessage());
                return new NearbyRecordsResult(partialHit.getMergedRecords(),
                        NearbyRecordsResult.Source.PARTIAL_CACHE, null);
            }
            logger.error("Fetch failed for request ID: {}", requestId, e);
            throw e;
        }

        cacheRegionResultUseCase.cacheResult(requestId, center, radiusMeters, fetched);
        logger.info("Fetched and cached {} records for request ID: {}", fetched.size(), requestId);
        return new NearbyRecordsResult(fetched, NearbyRecordsResult.Source.NETWORK, requestId);
    }
}
