package org.sitemodel.spatial;

import it.unimi.dsi.fastutil.bytes.ByteArrayList;
import it.unimi.dsi.fastutil.doubles.DoubleArrayList;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntArrays;
import lombok.AccessLevel;
import lombok.RequiredArgsConstructor;
import org.sitemodel.core.NoPointsAvailableException;
import org.sitemodel.geo.GeoDistance;
import org.sitemodel.points.GroundParameterPoint;
import org.sitemodel.points.GroundParameterSet;

import java.util.Arrays;
import java.util.Objects;

/**
 * KD tree over ground-parameter points placed on the unit sphere.
 * <p>
 * Points are indexed by their 3-D unit-vector position. Straight-line chord length is
 * monotonic in great-circle distance, so axis-plane pruning in 3-D space never drops a
 * closer point; candidates themselves are ranked by haversine distance so results match
 * {@link ExhaustiveScan} exactly, including the load-order tie-break.
 * </p>
 * <p>
 * This class is immutable after construction and safe for concurrent reads.
 * </p>
 */
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class SpatialIndex implements NearestPointSearch {

    static final int LEAF_SIZE = 8;

    // Absorbs rounding differences between chord and haversine distances.
    private static final double CHORD_SLACK = 1e-12d;

    private final GroundParameterSet points;

    private final int rootIndex;
    private final double[] splitValues;
    private final int[] leftChildren;
    private final int[] rightChildren;
    private final int[] itemStartIndices;
    private final int[] itemCounts;
    private final byte[] splitAxes;
    private final byte[] leafFlags;
    private final int[] leafItems;

    /**
     * Builds the tree over all points of the set.
     *
     * @throws NoPointsAvailableException when the set is empty.
     */
    public static SpatialIndex build(GroundParameterSet points) {
        Objects.requireNonNull(points, "points");
        int pointCount = points.size();
        if (pointCount == 0) {
            throw new NoPointsAvailableException("ground-parameter point set is empty");
        }

        double[] unitVectors = new double[pointCount * 3];
        for (int i = 0; i < pointCount; i++) {
            GroundParameterPoint point = points.point(i);
            GeoDistance.toUnitVector(point.longitude(), point.latitude(), unitVectors, i * 3);
        }

        int[] leafItems = new int[pointCount];
        for (int i = 0; i < pointCount; i++) {
            leafItems[i] = i;
        }

        TreeBuilder builder = new TreeBuilder(unitVectors, leafItems);
        int rootIndex = builder.buildNode(0, pointCount);

        return new SpatialIndex(
                points,
                rootIndex,
                builder.splitValues.toDoubleArray(),
                builder.leftChildren.toIntArray(),
                builder.rightChildren.toIntArray(),
                builder.itemStartIndices.toIntArray(),
                builder.itemCounts.toIntArray(),
                builder.splitAxes.toByteArray(),
                builder.leafFlags.toByteArray(),
                leafItems
        );
    }

    /**
     * Number of tree nodes in the index.
     */
    public int treeNodeCount() {
        return splitValues.length;
    }

    @Override
    public int size() {
        return leafItems.length;
    }

    @Override
    public SpatialMatch nearest(double lon, double lat) {
        validateQuery(lon, lat);
        double[] query = new double[3];
        GeoDistance.toUnitVector(lon, lat, query, 0);

        int bestItem = -1;
        double bestDistanceKm = Double.POSITIVE_INFINITY;
        double bestChord = 2.0d;

        int[] stack = new int[Math.max(4, Math.min(64, splitValues.length))];
        int top = 0;
        stack[top++] = rootIndex;

        while (top > 0) {
            int nodeIndex = stack[--top];

            if (leafFlags[nodeIndex] != 0) {
                int start = itemStartIndices[nodeIndex];
                int end = start + itemCounts[nodeIndex];

                for (int i = start; i < end; i++) {
                    int candidate = leafItems[i];
                    GroundParameterPoint point = points.point(candidate);
                    double distanceKm = GeoDistance.greatCircleDistanceKm(
                            lon, lat, point.longitude(), point.latitude());

                    if (distanceKm < bestDistanceKm
                            || (distanceKm == bestDistanceKm && candidate < bestItem)) {
                        bestDistanceKm = distanceKm;
                        bestItem = candidate;
                        bestChord = GeoDistance.chordForDistanceKm(distanceKm);
                    }
                }
                continue;
            }

            int axis = splitAxes[nodeIndex];
            double delta = query[axis] - splitValues[nodeIndex];

            int nearChild = delta <= 0.0d ? leftChildren[nodeIndex] : rightChildren[nodeIndex];
            int farChild = delta <= 0.0d ? rightChildren[nodeIndex] : leftChildren[nodeIndex];

            if (Math.abs(delta) <= bestChord + CHORD_SLACK) {
                if (top == stack.length) {
                    stack = Arrays.copyOf(stack, stack.length << 1);
                }
                stack[top++] = farChild;
            }

            if (top == stack.length) {
                stack = Arrays.copyOf(stack, stack.length << 1);
            }
            stack[top++] = nearChild;
        }

        if (bestItem < 0) {
            throw new IllegalStateException("Spatial index contains no reachable leaf payload items");
        }
        return new SpatialMatch(points.point(bestItem), bestDistanceKm);
    }

    @Override
    public String toString() {
        return "SpatialIndex[points=" + leafItems.length +
                ", treeNodes=" + splitValues.length + "]";
    }

    static void validateQuery(double lon, double lat) {
        if (!GeoDistance.isValidCoordinate(lon, lat)) {
            throw new IllegalArgumentException(
                    "query coordinate (" + lon + ", " + lat + ") must be finite and inside [-180,180] x [-90,90]");
        }
    }

    /**
     * Median-split builder. Leaves hold at most {@link #LEAF_SIZE} items unless all of their
     * points coincide.
     */
    private static final class TreeBuilder {
        private final double[] unitVectors;
        private final int[] items;

        private final DoubleArrayList splitValues = new DoubleArrayList();
        private final IntArrayList leftChildren = new IntArrayList();
        private final IntArrayList rightChildren = new IntArrayList();
        private final IntArrayList itemStartIndices = new IntArrayList();
        private final IntArrayList itemCounts = new IntArrayList();
        private final ByteArrayList splitAxes = new ByteArrayList();
        private final ByteArrayList leafFlags = new ByteArrayList();

        private TreeBuilder(double[] unitVectors, int[] items) {
            this.unitVectors = unitVectors;
            this.items = items;
        }

        private int buildNode(int from, int to) {
            int nodeIndex = allocateNode();
            int count = to - from;
            int axis = count > LEAF_SIZE ? widestAxis(from, to) : -1;
            if (axis < 0) {
                itemStartIndices.set(nodeIndex, from);
                itemCounts.set(nodeIndex, count);
                leafFlags.set(nodeIndex, (byte) 1);
                return nodeIndex;
            }

            IntArrays.quickSort(items, from, to, (a, b) -> {
                int byCoordinate = Double.compare(unitVectors[a * 3 + axis], unitVectors[b * 3 + axis]);
                return byCoordinate != 0 ? byCoordinate : Integer.compare(a, b);
            });
            int mid = (from + to) >>> 1;

            splitAxes.set(nodeIndex, (byte) axis);
            splitValues.set(nodeIndex, unitVectors[items[mid] * 3 + axis]);
            int left = buildNode(from, mid);
            int right = buildNode(mid, to);
            leftChildren.set(nodeIndex, left);
            rightChildren.set(nodeIndex, right);
            return nodeIndex;
        }

        private int allocateNode() {
            splitValues.add(0.0d);
            leftChildren.add(-1);
            rightChildren.add(-1);
            itemStartIndices.add(0);
            itemCounts.add(0);
            splitAxes.add((byte) 0);
            leafFlags.add((byte) 0);
            return splitValues.size() - 1;
        }

        /**
         * Returns the axis with the largest spread, or -1 when every point coincides.
         */
        private int widestAxis(int from, int to) {
            int bestAxis = -1;
            double bestSpread = 0.0d;
            for (int axis = 0; axis < 3; axis++) {
                double min = Double.POSITIVE_INFINITY;
                double max = Double.NEGATIVE_INFINITY;
                for (int i = from; i < to; i++) {
                    double value = unitVectors[items[i] * 3 + axis];
                    min = Math.min(min, value);
                    max = Math.max(max, value);
                }
                double spread = max - min;
                if (spread > bestSpread) {
                    bestSpread = spread;
                    bestAxis = axis;
                }
            }
            return bestAxis;
        }
    }
}
