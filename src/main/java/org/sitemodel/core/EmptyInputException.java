package org.sitemodel.core;

/**
 * Thrown when no target site could be constructed from the configured inputs.
 */
public final class EmptyInputException extends SiteModelException {
    public static final String REASON = "SM_EMPTY_INPUT";

    public EmptyInputException(String message) {
        super(REASON, message);
    }
}
