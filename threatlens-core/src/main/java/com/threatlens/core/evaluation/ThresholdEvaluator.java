package com.threatlens.core.evaluation;

import com.threatlens.core.model.FailOn;
import com.threatlens.core.model.Finding;
import com.threatlens.core.model.FindingSource;

import java.util.List;

/**
 * Block/pass decision.
 *
 * <p>Only rule findings count. Advisory findings are ignored even if they are passed in, so
 * the advisory channel can never block a change on its own.
 */
public class ThresholdEvaluator {

    /**
     * Returns true if any rule finding meets the threshold.
     *
     * @param deterministicFindings rule findings after policy
     * @param failOn threshold; {@link FailOn#NONE} never blocks
     * @return block decision
     */
    public boolean shouldBlock(List<Finding> deterministicFindings, FailOn failOn) {
        if (failOn == null || failOn == FailOn.NONE) {
            return false;
        }
        for (Finding finding : deterministicFindings) {
            if (finding.source() == FindingSource.RULE && failOn.isMetBy(finding.severity())) {
                return true;
            }
        }
        return false;
    }
}
