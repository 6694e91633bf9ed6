package org.sitemodel.spatial;

import org.sitemodel.core.NoPointsAvailableException;
import org.sitemodel.geo.GeoDistance;
import org.sitemodel.points.GroundParameterPoint;
import org.sitemodel.points.GroundParameterSet;

import java.util.Objects;

/**
 * Linear scan over every point. Used for small point sets and as the reference answer
 * when checking {@link SpatialIndex}.
 */
public final class ExhaustiveScan implements NearestPointSearch {
    private final GroundParameterSet points;

    public ExhaustiveScan(GroundParameterSet points) {
        this.points = Objects.requireNonNull(points, "points");
        if (points.isEmpty()) {
            throw new NoPointsAvailableException("ground-parameter point set is empty");
        }
    }

    @Override
    public SpatialMatch nearest(double lon, double lat) {
        SpatialIndex.validateQuery(lon, lat);
        GroundParameterPoint best = null;
        double bestDistanceKm = Double.POSITIVE_INFINITY;
        for (GroundParameterPoint candidate : points.points()) {
            double distanceKm = GeoDistance.greatCircleDistanceKm(
                    lon, lat, candidate.longitude(), candidate.latitude());
            // Points are visited in load order, so strict '<' keeps the earliest on ties.
            if (distanceKm < bestDistanceKm) {
                bestDistanceKm = distanceKm;
                best = candidate;
            }
        }
        return new SpatialMatch(best, bestDistanceKm);
    }

    @Override
    public int size() {
        return points.size();
    }

    @Override
    public String toString() {
        return "ExhaustiveScan[points=" + points.size() + "]";
    }
}
