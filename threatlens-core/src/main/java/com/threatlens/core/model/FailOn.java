package com.threatlens.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * Fail-on threshold: the minimum severity at which deterministic findings block.
 *
 * <p>{@link #NONE} never blocks.
 *
 * @since 1.0.0
 */
public enum FailOn {
    NONE(null),
    LOW(Severity.LOW),
    MEDIUM(Severity.MEDIUM),
    HIGH(Severity.HIGH);

    private final Severity minimum;

    FailOn(Severity minimum) {
        this.minimum = minimum;
    }

    /**
     * Returns true if a finding of the given severity meets this threshold.
     *
     * @param severity finding severity
     * @return true when the severity rank is at least the threshold rank
     */
    public boolean isMetBy(Severity severity) {
        return minimum != null && severity.rank() >= minimum.rank();
    }

    @JsonValue
    public String literal() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a threshold literal ({@code none}, {@code low}, {@code medium}, {@code high}).
     *
     * @param value literal, case-sensitive
     * @return the threshold, or empty when the literal is unknown
     */
    public static Optional<FailOn> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (FailOn failOn : values()) {
            if (failOn.literal().equals(value)) {
                return Optional.of(failOn);
            }
        }
        return Optional.empty();
    }

    @JsonCreator
    public static FailOn fromJson(String value) {
        return parse(value).orElseThrow(() ->
            new IllegalArgumentException("failOn must be one of: none, low, medium, high"));
    }
}
