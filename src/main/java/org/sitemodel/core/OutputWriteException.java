package org.sitemodel.core;

/**
 * Thrown when the site-model table cannot be written. No partial file is left behind.
 */
public final class OutputWriteException extends SiteModelException {
    public static final String REASON = "SM_OUTPUT_WRITE_FAILED";

    public OutputWriteException(String message, Throwable cause) {
        super(REASON, message, cause);
    }
}
