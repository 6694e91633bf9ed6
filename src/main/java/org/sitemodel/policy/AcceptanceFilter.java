package org.sitemodel.policy;

import lombok.experimental.UtilityClass;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.sitemodel.spatial.AssociationResult;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Applies an {@link AcceptancePolicy} to every association and logs one WARN line per
 * flagged site.
 */
@UtilityClass
public final class AcceptanceFilter {
    private static final Logger logger = LogManager.getLogger(AcceptanceFilter.class);

    /**
     * Kept associations in input order plus the warnings raised.
     */
    public record Outcome(List<AssociationResult> accepted, List<AssociationWarning> warnings) {
        public long discardedCount() {
            return warnings.stream().filter(AssociationWarning::discarded).count();
        }
    }

    public static Outcome apply(List<AssociationResult> associations, AcceptancePolicy policy) {
        Objects.requireNonNull(associations, "associations");
        Objects.requireNonNull(policy, "policy");
        policy.validate();

        List<AssociationResult> accepted = new ArrayList<>(associations.size());
        List<AssociationWarning> warnings = new ArrayList<>();
        for (AssociationResult association : associations) {
            switch (policy.evaluate(association)) {
                case ACCEPTED -> accepted.add(association);
                case ACCEPTED_WITH_WARNING -> {
                    accepted.add(association);
                    warnings.add(warn(association, policy.getAdvisoryDistanceKm(), false));
                }
                case DISCARDED -> warnings.add(warn(association, policy.getMaxDistanceKm(), true));
            }
        }
        return new Outcome(List.copyOf(accepted), List.copyOf(warnings));
    }

    private static AssociationWarning warn(AssociationResult association, double thresholdKm, boolean discarded) {
        AssociationWarning warning = new AssociationWarning(
                association.target(),
                association.matchedPoint(),
                association.distanceKm(),
                thresholdKm,
                discarded
        );
        logger.warn(warning.message());
        return warning;
    }
}
