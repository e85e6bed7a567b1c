package com.threatlens.core.evaluation;

import com.threatlens.core.model.Finding;
import com.threatlens.core.model.ScanSummary;

import java.util.List;

/**
 * Combined finding list with per-channel summaries.
 *
 * @param findings deduplicated, ranked union of both channels
 * @param deterministicSummary counts over the rule findings
 * @param advisorySummary counts over the advisory findings
 * @param summary counts over {@code findings}
 */
public record MergedFindings(
    List<Finding> findings,
    ScanSummary deterministicSummary,
    ScanSummary advisorySummary,
    ScanSummary summary
) {
    public MergedFindings {
        findings = findings == null ? List.of() : List.copyOf(findings);
    }
}
