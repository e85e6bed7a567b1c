package com.threatlens.core.evaluation;

import com.threatlens.core.model.Finding;
import com.threatlens.core.model.ScanSummary;
import com.threatlens.core.util.FindingRanking;

import java.util.ArrayList;
import java.util.List;

/**
 * Merges deterministic and advisory findings.
 *
 * <p>Deterministic findings come first, so on a duplicate
 * {@code (ruleId, filePath, line, evidence, source)} key the earlier one is kept.
 */
public class FindingMerger {

    /**
     * Concatenates, deduplicates and ranks both lists and summarizes each of them.
     *
     * @param deterministic policy-filtered rule findings
     * @param advisory policy-filtered advisory findings
     * @return merged result
     */
    public MergedFindings merge(List<Finding> deterministic, List<Finding> advisory) {
        List<Finding> combined = new ArrayList<>(deterministic.size() + advisory.size());
        combined.addAll(deterministic);
        combined.addAll(advisory);

        List<Finding> merged = FindingRanking.rank(FindingRanking.dedupe(combined, FindingRanking.MERGE_KEY));
        return new MergedFindings(
            merged,
            ScanSummary.of(deterministic),
            ScanSummary.of(advisory),
            ScanSummary.of(merged));
    }
}
