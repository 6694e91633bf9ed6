package org.sitemodel.core;

/**
 * Counters describing one preparation run.
 */
public record PreparationTelemetry(
        int pointCount,
        int sourceFileCount,
        int inputLocationCount,
        int targetSiteCount,
        int acceptedCount,
        int discardedCount,
        int advisoryWarningCount,
        double maxAcceptedDistanceKm,
        long elapsedNanos
) {
}
