package com.echopaw.regions.domain.service;

import com.echopaw.regions.domain.model.CachedRegion;
import com.echopaw.regions.domain.model.GeoPoint;

/**
 * Spherical geometry over circular regions.
 *
 * Distances use the haversine formula on a sphere of radius 6,371,000 m.
 */
public final class GeoMath {

    public static final double EARTH_RADIUS_METERS = 6_371_000.0;

    private GeoMath() {
        // Utility class
    }

    /**
     * Great-circle distance between two points.
     *
     * @param a First point
     * @param b Second point
     * @return Distance in meters
     */
    public static double distance(GeoPoint a, GeoPoint b) {
        double lat1 = Math.toRadians(a.getLatitude());
        double lat2 = Math.toRadians(b.getLatitude());
        double deltaLat = Math.toRadians(b.getLatitude() - a.getLatitude());
        double deltaLng = Math.toRadians(b.getLongitude() - a.getLongitude());

        double h = Math.sin(deltaLat / 2) * Math.sin(deltaLat / 2)
                + Math.cos(lat1) * Math.cos(lat2)
                * Math.sin(deltaLng / 2) * Math.sin(deltaLng / 2);
        double c = 2 * Math.atan2(Math.sqrt(h), Math.sqrt(1 - h));

        return EARTH_RADIUS_METERS * c;
    }

    /**
     * Whether the query disk lies entirely within the region's disk.
     * Center-in-circle is not enough: a partially covered query is not a safe hit.
     */
    public static boolean contains(CachedRegion region, GeoPoint queryCenter, double queryRadiusMeters) {
        return distance(region.getCenter(), queryCenter) + queryRadiusMeters <= region.getRadiusMeters();
    }

    /**
     * Whether two disks intersect. Disks that only touch do not overlap.
     */
    public static boolean overlaps(CachedRegion region, GeoPoint otherCenter, double otherRadiusMeters) {
        return distance(region.getCenter(), otherCenter) < region.getRadiusMeters() + otherRadiusMeters;
    }
}
