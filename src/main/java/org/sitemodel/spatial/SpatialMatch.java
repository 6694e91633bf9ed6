package org.sitemodel.spatial;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;
import org.sitemodel.points.GroundParameterPoint;

/**
 * Immutable nearest-neighbor match result for spatial queries.
 */
@Getter
@Accessors(fluent = true)
@RequiredArgsConstructor
public final class SpatialMatch {
    private final GroundParameterPoint point;
    private final double distanceKm;
}
