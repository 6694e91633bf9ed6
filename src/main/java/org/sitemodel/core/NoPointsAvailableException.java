package org.sitemodel.core;

/**
 * Thrown when the merged ground-parameter point set is empty.
 */
public final class NoPointsAvailableException extends SiteModelException {
    public static final String REASON = "SM_NO_POINTS";

    public NoPointsAvailableException(String message) {
        super(REASON, message);
    }
}
