package org.tripweave.planning.geo;

import lombok.experimental.UtilityClass;
import org.tripweave.planning.model.Spot;

/**
 * Flat-earth distance helpers for intra-city spans.
 *
 * <p>Coordinates are treated as a plane where one degree of latitude or longitude
 * equals {@value #KM_PER_DEGREE} km. The approximation ignores meridian convergence
 * and is only meant for ranking and budgeting within a single city.</p>
 */
@UtilityClass
public final class GeoDistance {
    public static final double KM_PER_DEGREE = 111.0d;

    /**
     * Computes the flat distance in kilometers between two spots.
     */
    public static double flatDistanceKm(Spot a, Spot b) {
        return flatDistanceKm(a.lat(), a.lon(), b.lat(), b.lon());
    }

    /**
     * Computes the flat distance in kilometers between two lat/lon pairs.
     */
    public static double flatDistanceKm(double lat1, double lon1, double lat2, double lon2) {
        double deltaLat = lat1 - lat2;
        double deltaLon = lon1 - lon2;
        return Math.sqrt(deltaLat * deltaLat + deltaLon * deltaLon) * KM_PER_DEGREE;
    }
}
