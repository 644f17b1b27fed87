package com.echopaw.regions.application.service;

import com.echopaw.regions.application.port.in.CacheRegionResultUseCase;
import com.echopaw.regions.application.port.in.CheckRegionUseCase;
import com.echopaw.regions.application.port.out.NearbyRecordSource;
import com.echopaw.regions.domain.model.CachedRegion;
import com.echopaw.regions.domain.model.LocationRecord;
import com.echopaw.regions.domain.model.NearbyRecordsResult;
import com.echopaw.regions.domain.model.RequestResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.echopaw.regions.module.test.support.TestFixtures.Coordinates;
import static com.echopaw.regions.module.test.support.TestFixtures.record;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class NearbyRecordLoaderTest {

    private CheckRegionUseCase checkRegionUseCase;
    private CacheRegionResultUseCase cacheRegionResultUseCase;
    private NearbyRecordSource nearbyRecordSource;
    private NearbyRecordLoader loader;

    @BeforeEach
    void setUp() {
        checkRegionUseCase = mock(CheckRegionUseCase.class);
        cacheRegionResultUseCase = mock(CacheRegionResultUseCase.class);
        nearbyRecordSource = mock(NearbyRecordSource.class);
        loader = new NearbyRecordLoader(checkRegionUseCase, cacheRegionResultUseCase, nearbyRecordSource);
    }

    @Test
    void load_CacheHit_ReturnsCachedRecordsWithoutFetching() {
        List<LocationRecord> cached = List.of(record("a", 30.0, 120.0));
        CachedRegion region = new CachedRegion("req_1", Coordinates.WEST_LAKE, 1000, cached, 0L);
        when(checkRegionUseCase.checkRequest(Coordinates.WEST_LAKE, 1000))
                .thenReturn(new RequestResult.CacheHit(cached, region));

        NearbyRecordsResult result = loader.load(Coordinates.WEST_LAKE, 1000, false);

        assertThat(result.getSource()).isEqualTo(NearbyRecordsResult.Source.CACHE);
        assertThat(result.getRecords()).isEqualTo(cached);
        assertThat(result.getRequestId()).isNull();
        verify(nearbyRecordSource, never()).fetchNearby(any(), anyDouble());
        verify(cacheRegionResultUseCase, never()).cacheResult(anyString(), any(), anyDouble(), anyList());
    }

    @Test
    void load_CacheMiss_FetchesAndCommitsUnderReturnedId() {
        List<LocationRecord> fetched = List.of(record("b", 30.0, 120.0));
        when(checkRegionUseCase.checkRequest(Coordinates.WEST_LAKE, 1000))
                .thenReturn(new RequestResult.CacheMiss("req_miss"));
        when(nearbyRecordSource.fetchNearby(Coordinates.WEST_LAKE, 1000)).thenReturn(fetched);

        NearbyRecordsResult result = loader.load(Coordinates.WEST_LAKE, 1000, false);

        assertThat(result.getSource()).isEqualTo(NearbyRecordsResult.Source.NETWORK);
        assertThat(result.getRecords()).isEqualTo(fetched);
        assertThat(result.getRequestId()).isEqualTo("req_miss");
        verify(cacheRegionResultUseCase).cacheResult("req_miss", Coordinates.WEST_LAKE, 1000, fetched);
    }

    @Test
    void load_PartialHit_FetchesAndCommitsUnderPartialId() {
        List<LocationRecord> fetched = List.of(record("c", 30.0, 120.0));
        when(checkRegionUseCase.checkRequest(Coordinates.WEST_LAKE, 1000))
                .thenReturn(new RequestResult.PartialHit(List.of(record("p", 30.0, 120.001)), "req_partial", List.of()));
        when(nearbyRecordSource.fetchNearby(Coordinates.WEST_LAKE, 1000)).thenReturn(fetched);

        NearbyRecordsResult result = loader.load(Coordinates.WEST_LAKE, 1000, false);

        assertThat(result.getSource()).isEqualTo(NearbyRecordsResult.Source.NETWORK);
        assertThat(result.getRecords()).isEqualTo(fetched);
        verify(cacheRegionResultUseCase).cacheResult("req_partial", Coordinates.WEST_LAKE, 1000, fetched);
    }

    @Test
    void load_ForceRefresh_SkipsCacheCheck() {
        when(cacheRegionResultUseCase.generateRequestId()).thenReturn("req_forced");
        when(nearbyRecordSource.fetchNearby(Coordinates.WEST_LAKE, 1000)).thenReturn(List.of());

        NearbyRecordsResult result = loader.load(Coordinates.WEST_LAKE, 1000, true);

        assertThat(result.getRequestId()).isEqualTo("req_forced");
        verify(checkRegionUseCase, never()).checkRequest(any(), anyDouble());
        verify(cacheRegionResultUseCase).cacheResult("req_forced", Coordinates.WEST_LAKE, 1000, List.of());
    }

    @Test
    void load_FetchFailsAfterPartialHit_FallsBackToMergedRecords() {
        List<LocationRecord> merged = List.of(record("p", 30.0, 120.001));
        when(checkRegionUseCase.checkRequest(Coordinates.WEST_LAKE, 1000))
                .thenReturn(new RequestResult.PartialHit(merged, "req_partial", List.of()));
        when(nearbyRecordSource.fetchNearby(Coordinates.WEST_LAKE, 1000))
                .thenThrow(new NearbyRecordSource.RecordFetchException("upstream unavailable"));

        NearbyRecordsResult result = loader.load(Coordinates.WEST_LAKE, 1000, false);

        assertThat(result.getSource()).isEqualTo(NearbyRecordsResult.Source.PARTIAL_CACHE);
        assertThat(result.getRecords()).isEqualTo(merged);
        verify(cacheRegionResultUseCase, never()).cacheResult(anyString(), any(), anyDouble(), anyList());
    }

    @Test
    void load_FetchFailsAfterMiss_Rethrows() {
        when(checkRegionUseCase.checkRequest(Coordinates.WEST_LAKE, 1000))
                .thenReturn(new RequestResult.CacheMiss("req_miss"));
        when(nearbyRecordSource.fetchNearby(Coordinates.WEST_LAKE, 1000))
                .thenThrow(new NearbyRecordSource.RecordFetchException("upstream unavailable"));

        assertThatThrownBy(() -> loader.load(Coordinates.WEST_LAKE, 1000, false))
                .isInstanceOf(NearbyRecordSource.RecordFetchException.class)
                .hasMessage("upstream unavailable");
        verify(cacheRegionResultUseCase, never()).cacheResult(anyString(), any(), anyDouble(), anyList());
    }
}
