package com.threatlens.core.policy;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.threatlens.core.model.Severity;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Per-request policy adjustments. Never persisted; only honored for authenticated callers.
 *
 * <p>Severity overrides can only name {@code low}, {@code medium} or {@code high}; there is
 * no way to express {@code none} here.
 *
 * @param disableRuleIds rules dropped for this request
 * @param ignorePathsContaining findings in paths containing any of these substrings are dropped
 * @param severityOverrides new severity per rule id, applied after all filters
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PolicyOverrides(
    @JsonProperty("disableRuleIds") Set<String> disableRuleIds,
    @JsonProperty("ignorePathsContaining") Set<String> ignorePathsContaining,
    @JsonProperty("severityOverrides") Map<String, Severity> severityOverrides
) {
    /**
     * Compact constructor normalizing absent collections to empty ones.
     */
    public PolicyOverrides {
        disableRuleIds = disableRuleIds == null
            ? Set.of()
            : Collections.unmodifiableSet(new LinkedHashSet<>(disableRuleIds));
        ignorePathsContaining = ignorePathsContaining == null
            ? Set.of()
            : Collections.unmodifiableSet(new LinkedHashSet<>(ignorePathsContaining));
        severityOverrides = severityOverrides == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(severityOverrides));
    }

    /**
     * Creates overrides that change nothing.
     *
     * @return empty overrides
     */
    public static PolicyOverrides none() {
        return new PolicyOverrides(null, null, null);
    }

    /**
     * Returns true if any path substring (ignoring blank entries) occurs in the path.
     *
     * @param filePath finding path
     * @return true if the path is ignored
     */
    public boolean ignoresPath(String filePath) {
        for (String part : ignorePathsContaining) {
            if (part != null && !part.isEmpty() && filePath.contains(part)) {
                return true;
            }
        }
        return false;
    }
}
