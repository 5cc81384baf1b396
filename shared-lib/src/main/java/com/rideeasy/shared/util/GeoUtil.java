package com.rideeasy.shared.util;

import com.rideeasy.shared.model.Location;

/**
 * Flat-plane distance helpers. Not geodesic: one degree is treated as
 * {@link #DISTANCE_UNITS_PER_DEGREE} distance units so fares stay reproducible.
 */
public final class GeoUtil {

    public static final double DISTANCE_UNITS_PER_DEGREE = 111.0;

    private GeoUtil() {}

    /** Straight-line distance in degrees. */
    public static double planarDistance(Location a, Location b) {
        double latDiff = a.getLatitude() - b.getLatitude();
        double lngDiff = a.getLongitude() - b.getLongitude();
        return Math.sqrt(latDiff * latDiff + lngDiff * lngDiff);
    }

    /** Trip distance in distance units (planar degrees scaled by 111). */
    public static double tripDistance(Location pickup, Location dropoff) {
        return planarDistance(pickup, dropoff) * DISTANCE_UNITS_PER_DEGREE;
    }
}
