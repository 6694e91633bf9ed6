package org.sitemodel.policy;

import org.sitemodel.points.GroundParameterPoint;
import org.sitemodel.sites.TargetSite;

import java.util.Locale;

/**
 * Diagnostic for an association beyond a distance threshold.
 *
 * @param target site whose association was flagged.
 * @param matchedPoint nearest available ground-parameter point.
 * @param distanceKm great-circle distance to that point.
 * @param thresholdKm threshold that was exceeded.
 * @param discarded true when the site was dropped from the output.
 */
public record AssociationWarning(
        TargetSite target,
        GroundParameterPoint matchedPoint,
        double distanceKm,
        double thresholdKm,
        boolean discarded
) {
    /**
     * Human-readable warning line.
     */
    public String message() {
        return String.format(
                Locale.ROOT,
                "%s site (%s, %s): nearest ground-parameter point is %.3f km away (threshold %.3f km)",
                discarded ? "Discarded" : "Distant",
                target.longitude(),
                target.latitude(),
                distanceKm,
                thresholdKm
        );
    }
}
