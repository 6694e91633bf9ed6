package org.sitemodel.policy;

/**
 * Outcome of evaluating one association against the distance thresholds.
 */
public enum AcceptanceDecision {
    ACCEPTED,
    /**
     * Kept, but farther than the advisory distance.
     */
    ACCEPTED_WITH_WARNING,
    DISCARDED
}
