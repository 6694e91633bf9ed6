package org.sitemodel.points;

import java.util.List;
import java.util.Objects;

/**
 * Read-only merged collection of ground-parameter points in load order.
 */
public final class GroundParameterSet {
    private final List<GroundParameterPoint> points;
    private final List<String> sourceFiles;

    /**
     * Creates a set from already ordered points.
     *
     * @param points points where {@code points.get(i).loadOrder() == i}.
     * @param sourceFiles source identifiers in load order.
     */
    public GroundParameterSet(List<GroundParameterPoint> points, List<String> sourceFiles) {
        this.points = List.copyOf(Objects.requireNonNull(points, "points"));
        this.sourceFiles = List.copyOf(Objects.requireNonNull(sourceFiles, "sourceFiles"));
        for (int i = 0; i < this.points.size(); i++) {
            if (this.points.get(i).loadOrder() != i) {
                throw new IllegalArgumentException(
                        "points[" + i + "] has loadOrder " + this.points.get(i).loadOrder());
            }
        }
    }

    /**
     * Builds a set from in-memory {@code (lon, lat, value)} triples under one source name.
     */
    public static GroundParameterSet of(String sourceFile, double[]... rows) {
        Objects.requireNonNull(sourceFile, "sourceFile");
        GroundParameterPoint[] built = new GroundParameterPoint[rows.length];
        for (int i = 0; i < rows.length; i++) {
            double[] row = rows[i];
            if (row.length != 3) {
                throw new IllegalArgumentException("row " + i + " must have 3 values, got " + row.length);
            }
            built[i] = new GroundParameterPoint(row[0], row[1], row[2], sourceFile, 0, i + 1, i);
        }
        return new GroundParameterSet(List.of(built), List.of(sourceFile));
    }

    public int size() {
        return points.size();
    }

    public boolean isEmpty() {
        return points.isEmpty();
    }

    /**
     * Returns the point with the given load order.
     */
    public GroundParameterPoint point(int loadOrder) {
        return points.get(loadOrder);
    }

    public List<GroundParameterPoint> points() {
        return points;
    }

    public List<String> sourceFiles() {
        return sourceFiles;
    }

    @Override
    public String toString() {
        return "GroundParameterSet[points=" + points.size() + ", sources=" + sourceFiles.size() + "]";
    }
}
