package com.threatlens.core.service;

/**
 * Categories of scan failures and their transport-level outcomes.
 */
public enum ErrorKind {
    /** Malformed payload or wrongly typed field. */
    INVALID_REQUEST(400, 2),
    /** Unknown fail-on or severity literal. */
    INVALID_SEVERITY(400, 2),
    /** Pack id not in the registry. */
    UNKNOWN_POLICY_PACK(400, 2),
    /** Diff above the configured size limit. */
    DIFF_TOO_LARGE(413, 2),
    /** Advisory requested without a valid credential. */
    UNAUTHENTICATED(401, 2),
    /** Overrides supplied without a valid credential. */
    FORBIDDEN_OVERRIDES(403, 2),
    /** Defect inside the pipeline. */
    INTERNAL(500, 3);

    private final int httpStatus;
    private final int exitCode;

    ErrorKind(int httpStatus, int exitCode) {
        this.httpStatus = httpStatus;
        this.exitCode = exitCode;
    }

    public int httpStatus() {
        return httpStatus;
    }

    public int exitCode() {
        return exitCode;
    }
}
