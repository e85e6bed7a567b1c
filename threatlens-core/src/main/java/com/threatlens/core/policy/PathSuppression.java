package com.threatlens.core.policy;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Pack-level suppression: rules switched off for files whose path contains a substring.
 *
 * @param contains path substring, e.g. {@code "test/"}
 * @param disableRuleIds rule ids suppressed for matching paths
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PathSuppression(
    @JsonProperty("contains") String contains,
    @JsonProperty("disableRuleIds") Set<String> disableRuleIds
) {
    /**
     * Compact constructor with validation.
     */
    public PathSuppression {
        Objects.requireNonNull(contains, "contains must not be null");
        disableRuleIds = disableRuleIds == null
            ? Set.of()
            : Collections.unmodifiableSet(new LinkedHashSet<>(disableRuleIds));
    }

    /**
     * Returns true if this suppression removes the given rule at the given path.
     *
     * @param filePath finding path
     * @param ruleId finding rule id
     * @return true if suppressed
     */
    public boolean suppresses(String filePath, String ruleId) {
        return filePath.contains(contains) && disableRuleIds.contains(ruleId);
    }
}
