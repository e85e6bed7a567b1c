package com.threatlens.core.policy;

import com.threatlens.core.model.Finding;
import com.threatlens.core.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Applies a {@link PolicyPack} and optional {@link PolicyOverrides} to a finding list.
 *
 * <p><b>Filter order</b> (fixed; changing it changes results):
 * <ol>
 *   <li>Allow-list: only when {@code respectAllowList} is true, keep rules the pack enables</li>
 *   <li>Per-request disable: drop {@code overrides.disableRuleIds}</li>
 *   <li>Per-request path ignore: drop paths containing any {@code overrides.ignorePathsContaining}</li>
 *   <li>Pack path suppression: drop rules a matching {@code pathSuppressions} entry disables</li>
 *   <li>Severity remap: replace severity for rules in {@code overrides.severityOverrides}</li>
 * </ol>
 *
 * <p>The allow-list is relaxed for advisory findings, whose synthesized rule ids are never
 * part of a pack catalog; the remaining steps still apply to them.
 *
 * @since 1.0.0
 */
public class PolicyEngine {

    private static final Logger log = LoggerFactory.getLogger(PolicyEngine.class);

    /**
     * Filters and remaps findings.
     *
     * @param findings input findings; order is preserved
     * @param pack policy pack
     * @param overrides per-request overrides, or null
     * @param respectAllowList whether to enforce {@link PolicyPack#enabledRuleIds()}
     * @return surviving findings, in input order
     */
    public List<Finding> apply(List<Finding> findings, PolicyPack pack, PolicyOverrides overrides,
                               boolean respectAllowList) {
        PolicyOverrides effective = overrides != null ? overrides : PolicyOverrides.none();
        List<Finding> result = new ArrayList<>(findings.size());

        for (Finding finding : findings) {
            if (respectAllowList && !pack.allows(finding.ruleId())) {
                continue;
            }
            if (effective.disableRuleIds().contains(finding.ruleId())) {
                continue;
            }
            if (effective.ignoresPath(finding.filePath())) {
                continue;
            }
            if (pack.suppresses(finding.filePath(), finding.ruleId())) {
                continue;
            }

            Severity remapped = effective.severityOverrides().get(finding.ruleId());
            result.add(remapped != null ? finding.withSeverity(remapped) : finding);
        }

        log.debug("Policy '{}' kept {} of {} findings (allow-list {})",
            pack.id(), result.size(), findings.size(), respectAllowList ? "enforced" : "relaxed");
        return result;
    }
}
