package org.sitemodel.sites;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;
import org.sitemodel.core.SiteModelException;
import org.sitemodel.geo.GeoDistance;

/**
 * Regular lon/lat lattice derived from a spacing in km and a coordinate extent.
 *
 * <p>The longitude step is scaled by the cosine of the extent's mid-latitude so cells are
 * approximately square there. The occupied block of cells is centered on the extent and
 * surrounded by a one-cell margin ring; cell indices are row-major over the
 * margin-inclusive lattice, south-to-north then west-to-east.</p>
 */
@Getter
@Accessors(fluent = true)
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class GridSpec {
    private static final double STEP_COUNT_TOLERANCE = 1e-9d;
    private static final double MIN_COS_LATITUDE = 1e-3d;

    /**
     * Largest occupied row or column count; the margin ring must still fit in an int.
     */
    static final long MAX_OCCUPIED_CELLS_PER_AXIS = Integer.MAX_VALUE - 2L;

    private final double spacingKm;
    private final double originLon;
    private final double originLat;
    private final double lonStep;
    private final double latStep;
    private final int rows;
    private final int columns;

    /**
     * Lays a lattice covering the extent.
     *
     * @param spacingKm cell size in km, must be finite and > 0.
     * @param extent bounding box of the coordinates to grid.
     * @throws SiteModelException with {@link SiteModelException#REASON_INVALID_CONFIG} when the
     *         spacing is so fine that the lattice has more rows or columns than can be indexed.
     */
    public static GridSpec covering(double spacingKm, CoordinateExtent extent) {
        if (!Double.isFinite(spacingKm) || spacingKm <= 0.0d) {
            throw new IllegalArgumentException("spacingKm must be finite and > 0, got " + spacingKm);
        }
        double latStep = spacingKm / GeoDistance.KM_PER_DEGREE;
        double cosLat = Math.max(MIN_COS_LATITUDE, Math.cos(Math.toRadians(extent.midLatitude())));
        double lonStep = Math.min(360.0d, spacingKm / (GeoDistance.KM_PER_DEGREE * cosLat));

        int occupiedColumns = occupiedCells(extent.width(), lonStep, spacingKm, "columns");
        int occupiedRows = occupiedCells(extent.height(), latStep, spacingKm, "rows");

        double blockOriginLon = extent.minLon() - (occupiedColumns * lonStep - extent.width()) * 0.5d;
        double blockOriginLat = extent.minLat() - (occupiedRows * latStep - extent.height()) * 0.5d;

        return new GridSpec(
                spacingKm,
                blockOriginLon - lonStep,
                blockOriginLat - latStep,
                lonStep,
                latStep,
                occupiedRows + 2,
                occupiedColumns + 2
        );
    }

    /**
     * Column of the cell holding {@code lon}; coordinates on the far edge map to the last occupied column.
     */
    public int columnOf(double lon) {
        return 1 + clampIndex(Math.floor((lon - originLon - lonStep) / lonStep), columns - 2);
    }

    /**
     * Row of the cell holding {@code lat}; coordinates on the far edge map to the last occupied row.
     */
    public int rowOf(double lat) {
        return 1 + clampIndex(Math.floor((lat - originLat - latStep) / latStep), rows - 2);
    }

    public long cellIndex(int row, int column) {
        return (long) row * columns + column;
    }

    public int rowOfCell(long cellIndex) {
        return (int) (cellIndex / columns);
    }

    public int columnOfCell(long cellIndex) {
        return (int) (cellIndex % columns);
    }

    public double centerLon(int column) {
        return originLon + (column + 0.5d) * lonStep;
    }

    public double centerLat(int row) {
        return originLat + (row + 0.5d) * latStep;
    }

    public long cellCount() {
        return (long) rows * columns;
    }

    @Override
    public String toString() {
        return "GridSpec[spacingKm=" + spacingKm +
                ", origin=(" + originLon + ", " + originLat + ")" +
                ", step=(" + lonStep + ", " + latStep + ")" +
                ", rows=" + rows +
                ", columns=" + columns + "]";
    }

    private static int occupiedCells(double span, double step, double spacingKm, String axis) {
        double steps = Math.ceil(span / step - STEP_COUNT_TOLERANCE);
        if (!(steps <= MAX_OCCUPIED_CELLS_PER_AXIS)) {
            throw new SiteModelException(
                    SiteModelException.REASON_INVALID_CONFIG,
                    "grid spacing " + spacingKm + " km needs " + steps + " " + axis
                            + " to cover the extent, limit is " + MAX_OCCUPIED_CELLS_PER_AXIS
            );
        }
        return (int) Math.max(1.0d, steps);
    }

    private static int clampIndex(double raw, int count) {
        if (raw < 0.0d) {
            return 0;
        }
        if (raw >= count) {
            return count - 1;
        }
        return (int) raw;
    }
}
