package org.sitemodel.spatial;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;
import org.sitemodel.points.GroundParameterPoint;
import org.sitemodel.sites.TargetSite;

/**
 * Target site paired with its nearest ground-parameter point.
 */
@Getter
@Accessors(fluent = true)
@RequiredArgsConstructor
public final class AssociationResult {
    private final TargetSite target;
    private final GroundParameterPoint matchedPoint;
    private final double distanceKm;
}
