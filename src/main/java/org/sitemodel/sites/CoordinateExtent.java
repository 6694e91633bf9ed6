package org.sitemodel.sites;

/**
 * Axis-aligned lon/lat bounding box of the contributing coordinates.
 */
public record CoordinateExtent(double minLon, double maxLon, double minLat, double maxLat) {

    public double width() {
        return maxLon - minLon;
    }

    public double height() {
        return maxLat - minLat;
    }

    public double midLatitude() {
        return (minLat + maxLat) * 0.5d;
    }

    public boolean contains(double lon, double lat) {
        return lon >= minLon && lon <= maxLon && lat >= minLat && lat <= maxLat;
    }

    /**
     * Computes the extent of packed {@code [lon0, lat0, lon1, lat1, ...]} coordinates.
     */
    public static CoordinateExtent of(double[] lonLat) {
        if (lonLat.length < 2 || (lonLat.length & 1) != 0) {
            throw new IllegalArgumentException("lonLat must hold at least one (lon, lat) pair");
        }
        double minLon = Double.POSITIVE_INFINITY;
        double maxLon = Double.NEGATIVE_INFINITY;
        double minLat = Double.POSITIVE_INFINITY;
        double maxLat = Double.NEGATIVE_INFINITY;
        for (int i = 0; i < lonLat.length; i += 2) {
            minLon = Math.min(minLon, lonLat[i]);
            maxLon = Math.max(maxLon, lonLat[i]);
            minLat = Math.min(minLat, lonLat[i + 1]);
            maxLat = Math.max(maxLat, lonLat[i + 1]);
        }
        return new CoordinateExtent(minLon, maxLon, minLat, maxLat);
    }
}
