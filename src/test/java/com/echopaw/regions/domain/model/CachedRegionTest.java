package com.echopaw.regions.domain.model;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.echopaw.regions.module.test.support.TestFixtures.Coordinates;
import static com.echopaw.regions.module.test.support.TestFixtures.record;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CachedRegionTest {

    @Test
    void constructor_NegativeRadius_Throws() {
        assertThatThrownBy(() -> new CachedRegion("req_1", Coordinates.WEST_LAKE, -1, List.of(), 0L))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void constructor_BlankId_Throws() {
        assertThatThrownBy(() -> new CachedRegion(" ", Coordinates.WEST_LAKE, 10, List.of(), 0L))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void records_AreCopiedOnConstruction() {
        List<LocationRecord> records = new ArrayList<>();
        records.add(record("a", 30.0, 120.0));
        CachedRegion region = new CachedRegion("req_1", Coordinates.WEST_LAKE, 10, records, 0L);

        records.add(record("b", 30.0, 120.0));

        assertThat(region.getRecords()).hasSize(1);
    }

    @Test
    void isExpired_StrictlyAfterExpireTime() {
        CachedRegion region = new CachedRegion("req_1", Coordinates.WEST_LAKE, 10, List.of(), 1_000L);

        assertThat(region.isExpired(1_500L, 500L)).isFalse();
        assertThat(region.isExpired(1_501L, 500L)).isTrue();
    }

    @Test
    void geoPoint_OutOfRange_Throws() {
        assertThatThrownBy(() -> new GeoPoint(91.0, 0.0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new GeoPoint(0.0, -180.5)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new GeoPoint(Double.NaN, 0.0)).isInstanceOf(IllegalArgumentException.class);
    }
}
