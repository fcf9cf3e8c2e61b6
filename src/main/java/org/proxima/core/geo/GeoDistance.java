package org.proxima.core.geo;

import lombok.experimental.UtilityClass;

/**
 * Spherical distance helpers shared by the spatial index and the proximity engine.
 */
@UtilityClass
public class GeoDistance {
    /** IUGG mean Earth radius (6,371,008.8 m) expressed in statute miles. */
    public static final double EARTH_MEAN_RADIUS_MILES = 6_371_008.8d / 1_609.344d;

    /** Length of one degree of latitude on the mean sphere. */
    public static final double MILES_PER_DEGREE_LATITUDE = EARTH_MEAN_RADIUS_MILES * Math.PI / 180.0d;

    /**
     * Computes great-circle distance in miles using haversine formulation.
     *
     * <p>The longitude delta is normalized first, so points on opposite sides of the
     * antimeridian resolve to the short way around.</p>
     */
    public static double greatCircleDistanceMiles(double lat1Deg, double lon1Deg, double lat2Deg, double lon2Deg) {
        double lat1Rad = Math.toRadians(lat1Deg);
        double lat2Rad = Math.toRadians(lat2Deg);
        double deltaLatRad = Math.toRadians(lat2Deg - lat1Deg);
        double deltaLonRad = Math.toRadians(normalizeDeltaLongitudeDegrees(lon2Deg - lon1Deg));

        double sinHalfLat = Math.sin(deltaLatRad * 0.5d);
        double sinHalfLon = Math.sin(deltaLonRad * 0.5d);

        double a = sinHalfLat * sinHalfLat
                + Math.cos(lat1Rad) * Math.cos(lat2Rad) * sinHalfLon * sinHalfLon;
        double c = 2.0d * Math.asin(Math.sqrt(clamp(a, 0.0d, 1.0d)));
        return EARTH_MEAN_RADIUS_MILES * c;
    }

    /**
     * Half-width in degrees of longitude of the smallest box enclosing a circle of
     * {@code radiusMiles} around a point at {@code latDeg}.
     *
     * @return half-width in degrees, or {@code 180.0} when the circle reaches a pole.
     */
    public static double longitudeHalfWidthDegrees(double latDeg, double radiusMiles) {
        double angularRadius = radiusMiles / EARTH_MEAN_RADIUS_MILES;
        double cosLat = Math.cos(Math.toRadians(latDeg));
        double ratio = Math.sin(angularRadius) / cosLat;
        if (!(ratio < 1.0d)) {
            return 180.0d;
        }
        return Math.toDegrees(Math.asin(ratio));
    }

    /**
     * Normalizes delta-longitude into the principal range {@code (-180, 180]}.
     */
    public static double normalizeDeltaLongitudeDegrees(double deltaLonDeg) {
        double normalized = ((deltaLonDeg + 540.0d) % 360.0d) - 180.0d;
        if (normalized == -180.0d) {
            return 180.0d;
        }
        return normalized;
    }

    private static double clamp(double value, double min, double max) {
        if (value < min) {
            return min;
        }
        if (value > max) {
            return max;
        }
        return value;
    }
}
