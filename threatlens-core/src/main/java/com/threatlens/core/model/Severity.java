package com.threatlens.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * Severity of a finding, ordered {@code LOW < MEDIUM < HIGH}.
 *
 * <p>Serialized as the lower-case literal ({@code "low"}, {@code "medium"}, {@code "high"}).
 *
 * @since 1.0.0
 */
public enum Severity {
    LOW(1),
    MEDIUM(2),
    HIGH(3);

    private final int rank;

    Severity(int rank) {
        this.rank = rank;
    }

    /**
     * Returns the numeric rank used for ordering and threshold comparison.
     *
     * @return 1 for low, 2 for medium, 3 for high
     */
    public int rank() {
        return rank;
    }

    @JsonValue
    public String literal() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a severity literal.
     *
     * @param value literal such as {@code "medium"}; case-sensitive
     * @return the severity, or empty when the literal is unknown
     */
    public static Optional<Severity> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (Severity severity : values()) {
            if (severity.literal().equals(value)) {
                return Optional.of(severity);
            }
        }
        return Optional.empty();
    }

    @JsonCreator
    public static Severity fromJson(String value) {
        return parse(value).orElseThrow(() ->
            new IllegalArgumentException("Unknown severity: " + value + ". Use low, medium, or high."));
    }
}
