package com.threatlens.core.service;

import java.util.Objects;

/**
 * A rejected scan.
 *
 * @param kind error category
 * @param message caller-facing message naming the violated constraint
 */
public record ScanError(ErrorKind kind, String message) {

    public ScanError {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(message, "message must not be null");
    }

    public static ScanError of(ErrorKind kind, String message) {
        return new ScanError(kind, message);
    }
}
