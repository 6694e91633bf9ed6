package org.sitemodel.policy;

import lombok.Builder;
import lombok.Value;
import org.sitemodel.core.SiteModelException;
import org.sitemodel.spatial.AssociationResult;

/**
 * Distance thresholds that decide whether an association is kept.
 *
 * <p>Associations strictly farther than {@code maxDistanceKm} are discarded. When an
 * {@code advisoryDistanceKm} is set, kept associations strictly farther than it are
 * flagged but stay in the output.</p>
 */
@Value
@Builder
public class AcceptancePolicy {
    public static final double DEFAULT_MAX_DISTANCE_KM = 5.0d;

    @Builder.Default
    double maxDistanceKm = DEFAULT_MAX_DISTANCE_KM;

    /**
     * Optional soft threshold, at most {@code maxDistanceKm}; null disables advisory warnings.
     */
    Double advisoryDistanceKm;

    /**
     * Default policy instance.
     */
    public static AcceptancePolicy defaults() {
        return AcceptancePolicy.builder().build();
    }

    /**
     * Policy with the given hard threshold and no advisory threshold.
     */
    public static AcceptancePolicy withMaxDistance(double maxDistanceKm) {
        return AcceptancePolicy.builder().maxDistanceKm(maxDistanceKm).build();
    }

    /**
     * Evaluates one association.
     */
    public AcceptanceDecision evaluate(AssociationResult association) {
        double distanceKm = association.distanceKm();
        if (distanceKm > maxDistanceKm) {
            return AcceptanceDecision.DISCARDED;
        }
        if (advisoryDistanceKm != null && distanceKm > advisoryDistanceKm) {
            return AcceptanceDecision.ACCEPTED_WITH_WARNING;
        }
        return AcceptanceDecision.ACCEPTED;
    }

    /**
     * Checks threshold ranges.
     *
     * @throws SiteModelException with {@link SiteModelException#REASON_INVALID_CONFIG}.
     */
    public void validate() {
        if (!Double.isFinite(maxDistanceKm) || maxDistanceKm < 0.0d) {
            throw new SiteModelException(
                    SiteModelException.REASON_INVALID_CONFIG,
                    "maxDistanceKm must be finite and >= 0, got " + maxDistanceKm
            );
        }
        if (advisoryDistanceKm != null) {
            if (!Double.isFinite(advisoryDistanceKm) || advisoryDistanceKm < 0.0d) {
                throw new SiteModelException(
                        SiteModelException.REASON_INVALID_CONFIG,
                        "advisoryDistanceKm must be finite and >= 0, got " + advisoryDistanceKm
                );
            }
            if (advisoryDistanceKm > maxDistanceKm) {
                throw new SiteModelException(
                        SiteModelException.REASON_INVALID_CONFIG,
                        "advisoryDistanceKm (" + advisoryDistanceKm + ") must be <= maxDistanceKm (" + maxDistanceKm + ")"
                );
            }
        }
    }
}
