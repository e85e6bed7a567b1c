package com.threatlens.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Origin of a finding.
 */
public enum FindingSource {
    /** Produced by a deterministic pattern rule. */
    RULE,
    /** Produced by the external advisory collaborator; never blocking. */
    ADVISORY;

    @JsonValue
    public String literal() {
        return name().toLowerCase(Locale.ROOT);
    }
}
