package com.threatlens.core.model;

import java.util.Collection;

/**
 * Per-severity counts of a finding list. {@code total} is always the sum of the buckets.
 *
 * @param total number of findings
 * @param high number of high-severity findings
 * @param medium number of medium-severity findings
 * @param low number of low-severity findings
 */
public record ScanSummary(
    int total,
    int high,
    int medium,
    int low
) {
    /**
     * Compact constructor with validation.
     */
    public ScanSummary {
        if (high < 0 || medium < 0 || low < 0) {
            throw new IllegalArgumentException("counts must not be negative");
        }
        if (total != high + medium + low) {
            throw new IllegalArgumentException("total must equal high + medium + low");
        }
    }

    /**
     * Creates a summary with all counts zero.
     *
     * @return empty summary
     */
    public static ScanSummary empty() {
        return new ScanSummary(0, 0, 0, 0);
    }

    /**
     * Counts the findings of a list per severity.
     *
     * @param findings findings to summarize
     * @return summary consistent with the given list
     */
    public static ScanSummary of(Collection<Finding> findings) {
        int high = 0;
        int medium = 0;
        int low = 0;
        for (Finding finding : findings) {
            switch (finding.severity()) {
                case HIGH -> high++;
                case MEDIUM -> medium++;
                case LOW -> low++;
            }
        }
        return new ScanSummary(high + medium + low, high, medium, low);
    }
}
