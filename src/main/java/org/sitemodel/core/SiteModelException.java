package org.sitemodel.core;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Objects;

/**
 * Site-model preparation failure with a deterministic reason code.
 *
 * <p>Messages are prefixed with {@code [REASON_CODE]} so log lines and CLI output
 * identify the failing contract without parsing free text.</p>
 */
@Getter
@Accessors(fluent = true)
public class SiteModelException extends RuntimeException {
    public static final String REASON_INPUT_READ_FAILED = "SM_INPUT_READ_FAILED";
    public static final String REASON_INVALID_CONFIG = "SM_INVALID_CONFIG";
    public static final String REASON_MALFORMED_SITE_INPUT = "SM_MALFORMED_SITE_INPUT";
    public static final String REASON_INTERRUPTED = "SM_INTERRUPTED";

    private final String reasonCode;

    /**
     * @param reasonCode one of the {@code SM_*} codes; blank codes are rejected.
     * @param message what went wrong, naming the offending input where known.
     */
    public SiteModelException(String reasonCode, String message) {
        this(reasonCode, message, null);
    }

    /**
     * Same as {@link #SiteModelException(String, String)}, keeping the I/O or runtime error
     * that triggered the failure.
     */
    public SiteModelException(String reasonCode, String message, Throwable cause) {
        super(prefixed(checkedCode(reasonCode), message), cause);
        this.reasonCode = reasonCode;
    }

    private static String prefixed(String reasonCode, String message) {
        return "[" + reasonCode + "] " + Objects.requireNonNull(message, "message");
    }

    private static String checkedCode(String reasonCode) {
        Objects.requireNonNull(reasonCode, "reasonCode");
        if (reasonCode.isBlank()) {
            throw new IllegalArgumentException("site-model reason code must not be blank");
        }
        return reasonCode;
    }
}
