package com.threatlens.core.advisory;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * When to invoke the advisory collaborator.
 */
public enum AdvisoryMode {
    /** Never call. */
    OFF,
    /** Call only when {@link AdvisoryEscalationPolicy} finds the diff worth it. */
    AUTO,
    /** Call for every scan. */
    ALWAYS;

    @JsonValue
    public String literal() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a mode literal ({@code off}, {@code auto}, {@code always}).
     *
     * @param value literal, case-sensitive
     * @return the mode, or empty when unknown
     */
    public static Optional<AdvisoryMode> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (AdvisoryMode mode : values()) {
            if (mode.literal().equals(value)) {
                return Optional.of(mode);
            }
        }
        return Optional.empty();
    }
}
