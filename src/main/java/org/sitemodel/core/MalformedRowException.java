package org.sitemodel.core;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Thrown when a ground-parameter row does not parse into a valid point.
 */
@Getter
@Accessors(fluent = true)
public final class MalformedRowException extends SiteModelException {
    public static final String REASON = "SM_MALFORMED_ROW";

    private final String sourceFile;
    private final int lineNumber;

    public MalformedRowException(String sourceFile, int lineNumber, String detail) {
        super(REASON, sourceFile + ":" + lineNumber + ": " + detail);
        this.sourceFile = sourceFile;
        this.lineNumber = lineNumber;
    }
}
