package com.threatlens.core.service;

import java.util.Optional;

/**
 * Either a {@link ScanResponse} or a {@link ScanError}, never both.
 *
 * @param response scan result, or null on failure
 * @param error failure, or null on success
 */
public record ScanOutcome(ScanResponse response, ScanError error) {

    public ScanOutcome {
        if ((response == null) == (error == null)) {
            throw new IllegalArgumentException("exactly one of response or error must be set");
        }
    }

    public static ScanOutcome success(ScanResponse response) {
        return new ScanOutcome(response, null);
    }

    public static ScanOutcome failure(ScanError error) {
        return new ScanOutcome(null, error);
    }

    public static ScanOutcome failure(ErrorKind kind, String message) {
        return failure(ScanError.of(kind, message));
    }

    public boolean isSuccess() {
        return response != null;
    }

    public Optional<ScanResponse> responseIfPresent() {
        return Optional.ofNullable(response);
    }

    public Optional<ScanError> errorIfPresent() {
        return Optional.ofNullable(error);
    }
}
