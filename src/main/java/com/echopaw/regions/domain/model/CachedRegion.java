package com.echopaw.regions.domain.model;

import com.echopaw.regions.domain.service.GeoMath;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * Coverage of one completed fetch: a circle on the map and the records the
 * fetch returned for it. Regions are never modified after creation.
 */
@Getter
@EqualsAndHashCode
@ToString(exclude = "records")
public class CachedRegion {
    private final String id;
    private final GeoPoint center;
    private final double radiusMeters;
    private final List<LocationRecord> records;
    private final long createdAt;

    public CachedRegion(String id, GeoPoint center, double radiusMeters,
            List<LocationRecord> records, long createdAt) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Region id must not be blank");
        }
        if (center == null) {
            throw new IllegalArgumentException("Region center must not be null");
        }
        if (!Double.isFinite(radiusMeters) || radiusMeters < 0) {
            throw new IllegalArgumentException("Region radius must be a non-negative number of meters");
        }
        this.id = id;
        this.center = center;
        this.radiusMeters = radiusMeters;
        this.records = records == null ? List.of() : List.copyOf(records);
        this.createdAt = createdAt;
    }

    public boolean isExpired(long now, long expireTimeMillis) {
        return now - createdAt > expireTimeMillis;
    }

    /**
     * True when the whole query disk lies inside this region.
     */
    public boolean contains(GeoPoint queryCenter, double queryRadiusMeters) {
        return GeoMath.contains(this, queryCenter, queryRadiusMeters);
    }

    public boolean overlaps(GeoPoint otherCenter, double otherRadiusMeters) {
        return GeoMath.overlaps(this, otherCenter, otherRadiusMeters);
    }
}
