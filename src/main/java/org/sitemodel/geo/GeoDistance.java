package org.sitemodel.geo;

import lombok.experimental.UtilityClass;

/**
 * Spherical-earth distance helpers shared by the spatial index and the grid builder.
 */
@UtilityClass
public final class GeoDistance {
    public static final double EARTH_MEAN_RADIUS_KM = 6_371.0088d;

    /**
     * Length of one degree of latitude (and of longitude at the equator) in km.
     */
    public static final double KM_PER_DEGREE = EARTH_MEAN_RADIUS_KM * Math.PI / 180.0d;

    private static final double MIN_LAT = -90.0d;
    private static final double MAX_LAT = 90.0d;
    private static final double MIN_LON = -180.0d;
    private static final double MAX_LON = 180.0d;

    /**
     * Computes great-circle distance in kilometers using the haversine formulation.
     */
    public static double greatCircleDistanceKm(double lon1Deg, double lat1Deg, double lon2Deg, double lat2Deg) {
        double lat1Rad = Math.toRadians(lat1Deg);
        double lat2Rad = Math.toRadians(lat2Deg);
        double deltaLatRad = Math.toRadians(lat2Deg - lat1Deg);
        double deltaLonRad = Math.toRadians(normalizeDeltaLongitudeDegrees(lon2Deg - lon1Deg));

        double sinHalfLat = Math.sin(deltaLatRad * 0.5d);
        double sinHalfLon = Math.sin(deltaLonRad * 0.5d);

        double a = sinHalfLat * sinHalfLat
                + Math.cos(lat1Rad) * Math.cos(lat2Rad) * sinHalfLon * sinHalfLon;
        double clampedA = clamp(a, 0.0d, 1.0d);
        double c = 2.0d * Math.asin(Math.sqrt(clampedA));
        return EARTH_MEAN_RADIUS_KM * c;
    }

    /**
     * Converts a great-circle distance into the straight-line chord length on the unit sphere.
     */
    public static double chordForDistanceKm(double distanceKm) {
        double angle = distanceKm / EARTH_MEAN_RADIUS_KM;
        if (angle >= Math.PI) {
            return 2.0d;
        }
        return 2.0d * Math.sin(angle * 0.5d);
    }

    /**
     * Writes the unit-sphere cartesian position of one coordinate into {@code out[offset..offset+2]}.
     */
    public static void toUnitVector(double lonDeg, double latDeg, double[] out, int offset) {
        double lonRad = Math.toRadians(lonDeg);
        double latRad = Math.toRadians(latDeg);
        double cosLat = Math.cos(latRad);
        out[offset] = cosLat * Math.cos(lonRad);
        out[offset + 1] = cosLat * Math.sin(lonRad);
        out[offset + 2] = Math.sin(latRad);
    }

    /**
     * Normalizes delta-longitude into {@code (-180, 180]}.
     *
     * <p>Deltas already inside the range are returned unchanged so that mirrored
     * offsets stay bit-identical.</p>
     */
    public static double normalizeDeltaLongitudeDegrees(double deltaLonDeg) {
        if (deltaLonDeg > -180.0d && deltaLonDeg <= 180.0d) {
            return deltaLonDeg;
        }
        double normalized = ((deltaLonDeg + 540.0d) % 360.0d) - 180.0d;
        if (normalized == -180.0d) {
            return 180.0d;
        }
        return normalized;
    }

    /**
     * Returns true when the pair is finite and inside geographic lon/lat bounds.
     */
    public static boolean isValidCoordinate(double lonDeg, double latDeg) {
        return Double.isFinite(lonDeg) && Double.isFinite(latDeg)
                && lonDeg >= MIN_LON && lonDeg <= MAX_LON
                && latDeg >= MIN_LAT && latDeg <= MAX_LAT;
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
