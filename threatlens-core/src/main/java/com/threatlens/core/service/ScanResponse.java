package com.threatlens.core.service;

import com.threatlens.core.advisory.AdvisoryMode;
import com.threatlens.core.model.FailOn;
import com.threatlens.core.model.Finding;
import com.threatlens.core.model.ScanSummary;

import java.util.List;

/**
 * Result of a successful scan.
 *
 * @param policy pack and threshold applied
 * @param shouldBlock true if a rule finding met the threshold
 * @param summary counts over {@code findings}
 * @param deterministicSummary counts over rule findings
 * @param advisorySummary counts over advisory findings
 * @param findings merged, deduplicated, ranked findings
 * @param advisory advisory channel metadata
 */
public record ScanResponse(
    PolicyInfo policy,
    boolean shouldBlock,
    ScanSummary summary,
    ScanSummary deterministicSummary,
    ScanSummary advisorySummary,
    List<Finding> findings,
    AdvisoryInfo advisory
) {
    public ScanResponse {
        findings = findings == null ? List.of() : List.copyOf(findings);
    }

    /**
     * Pack applied to the scan.
     *
     * @param id pack id
     * @param name pack display name
     * @param failOn effective threshold
     */
    public record PolicyInfo(String id, String name, FailOn failOn) {
    }

    /**
     * Advisory channel metadata.
     *
     * @param mode requested mode
     * @param attempted true if a provider call was issued
     * @param enabled true if the channel was usable
     * @param model model used, or null
     * @param message status or failure reason, or null
     * @param findingsAdded advisory findings that survived the policy
     */
    public record AdvisoryInfo(
        AdvisoryMode mode,
        boolean attempted,
        boolean enabled,
        String model,
        String message,
        int findingsAdded
    ) {
    }
}
