package org.sitemodel.core;

import lombok.Builder;
import lombok.Value;
import org.sitemodel.policy.AcceptancePolicy;

/**
 * Per-run configuration of site-model preparation.
 */
@Value
@Builder
public class SiteModelConfig {

    boolean deriveZ1pt0;

    boolean deriveZ2pt5;

    boolean deriveVs30Measured;

    /**
     * Grid cell size in km; 0 keeps the exact (deduplicated) locations.
     */
    @Builder.Default
    double gridSpacingKm = 0.0d;

    /**
     * Sites whose nearest ground-parameter point is farther than this are discarded.
     */
    @Builder.Default
    double maxAssociationDistanceKm = AcceptancePolicy.DEFAULT_MAX_DISTANCE_KM;

    /**
     * Optional soft threshold above which kept sites are reported; null disables it.
     */
    Double advisoryDistanceKm;

    /**
     * Worker threads used for association.
     */
    @Builder.Default
    int parallelism = 1;

    /**
     * Default configuration: deduplicated mode, 5 km association distance, no derived fields.
     */
    public static SiteModelConfig defaults() {
        return SiteModelConfig.builder().build();
    }

    public AcceptancePolicy acceptancePolicy() {
        return AcceptancePolicy.builder()
                .maxDistanceKm(maxAssociationDistanceKm)
                .advisoryDistanceKm(advisoryDistanceKm)
                .build();
    }

    /**
     * Checks value ranges.
     *
     * @throws SiteModelException with {@link SiteModelException#REASON_INVALID_CONFIG}.
     */
    public void validate() {
        if (!Double.isFinite(gridSpacingKm) || gridSpacingKm < 0.0d) {
            throw new SiteModelException(
                    SiteModelException.REASON_INVALID_CONFIG,
                    "gridSpacingKm must be finite and >= 0, got " + gridSpacingKm
            );
        }
        if (parallelism < 1) {
            throw new SiteModelException(
                    SiteModelException.REASON_INVALID_CONFIG,
                    "parallelism must be >= 1, got " + parallelism
            );
        }
        acceptancePolicy().validate();
    }
}
