package com.threatlens.core.policy;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.threatlens.core.model.FailOn;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Named, immutable policy configuration.
 *
 * <p>Loaded from {@code policy-packs.yaml} at start-up and never modified afterwards, so one
 * instance is safely shared by concurrent scans.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * - id: startup-default
 *   name: Startup Default
 *   description: Balanced defaults for SaaS teams.
 *   defaultFailOn: high
 *   enabledRuleIds: [hardcoded-secret, open-redirect]
 *   pathSuppressions:
 *     - contains: "test/"
 *       disableRuleIds: [hardcoded-secret]
 * }</pre>
 *
 * @param id unique pack identifier
 * @param name display name
 * @param description what the pack is for
 * @param defaultFailOn threshold used when the caller supplies none
 * @param enabledRuleIds allow-listed rule ids; null means every rule is allowed
 * @param pathSuppressions path-scoped rule suppressions
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PolicyPack(
    @JsonProperty("id") String id,
    @JsonProperty("name") String name,
    @JsonProperty("description") String description,
    @JsonProperty("defaultFailOn") FailOn defaultFailOn,
    @JsonProperty("enabledRuleIds") Set<String> enabledRuleIds,
    @JsonProperty("pathSuppressions") List<PathSuppression> pathSuppressions
) {
    /**
     * Compact constructor with validation.
     */
    public PolicyPack {
        Objects.requireNonNull(id, "id must not be null");
        if (name == null) {
            name = id;
        }
        if (description == null) {
            description = "";
        }
        if (defaultFailOn == null) {
            defaultFailOn = FailOn.HIGH;
        }
        if (enabledRuleIds != null) {
            enabledRuleIds = Collections.unmodifiableSet(new LinkedHashSet<>(enabledRuleIds));
        }
        pathSuppressions = pathSuppressions == null ? List.of() : List.copyOf(pathSuppressions);
    }

    /**
     * Returns true if the pack's allow-list admits the rule.
     *
     * @param ruleId rule id
     * @return true if there is no allow-list or the rule is on it
     */
    public boolean allows(String ruleId) {
        return enabledRuleIds == null || enabledRuleIds.contains(ruleId);
    }

    /**
     * Returns true if any path suppression removes the rule at this path.
     *
     * @param filePath finding path
     * @param ruleId finding rule id
     * @return true if suppressed
     */
    public boolean suppresses(String filePath, String ruleId) {
        for (PathSuppression suppression : pathSuppressions) {
            if (suppression.suppresses(filePath, ruleId)) {
                return true;
            }
        }
        return false;
    }
}
