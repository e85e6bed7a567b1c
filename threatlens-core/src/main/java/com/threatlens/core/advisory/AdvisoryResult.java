package com.threatlens.core.advisory;

import com.threatlens.core.model.Finding;

import java.util.List;

/**
 * Outcome of the advisory channel for one scan.
 *
 * <p>Failures are values, not exceptions: {@code attempted} tells whether an upstream call
 * was issued, {@code enabled} whether the channel was usable at all, and {@code reason}
 * explains the outcome in plain words.
 *
 * @param attempted true if a provider call was issued
 * @param enabled true if the channel had credentials and a non-off mode
 * @param model model used, or null when no call was made
 * @param reason human-readable status or failure description
 * @param findings normalized advisory findings; empty on any failure
 */
public record AdvisoryResult(
    boolean attempted,
    boolean enabled,
    String model,
    String reason,
    List<Finding> findings
) {
    /**
     * Compact constructor normalizing findings.
     */
    public AdvisoryResult {
        findings = findings == null ? List.of() : List.copyOf(findings);
    }

    /**
     * Channel not used and not usable.
     *
     * @param reason explanation
     * @return result
     */
    public static AdvisoryResult disabled(String reason) {
        return new AdvisoryResult(false, false, null, reason, List.of());
    }

    /**
     * Channel usable but deliberately not called.
     *
     * @param reason explanation
     * @return result
     */
    public static AdvisoryResult skipped(String reason) {
        return new AdvisoryResult(false, true, null, reason, List.of());
    }

    /**
     * A call was issued but produced no usable findings.
     *
     * @param model model used
     * @param reason failure description
     * @return result
     */
    public static AdvisoryResult failed(String model, String reason) {
        return new AdvisoryResult(true, true, model, reason, List.of());
    }

    /**
     * A call succeeded.
     *
     * @param model model used
     * @param summary provider summary
     * @param findings normalized findings
     * @return result
     */
    public static AdvisoryResult completed(String model, String summary, List<Finding> findings) {
        return new AdvisoryResult(true, true, model, summary, findings);
    }
}
