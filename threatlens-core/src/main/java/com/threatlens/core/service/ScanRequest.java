package com.threatlens.core.service;

import com.threatlens.core.advisory.AdvisoryOptions;
import com.threatlens.core.model.FailOn;
import com.threatlens.core.policy.PolicyOverrides;

/**
 * One scan request, already parsed into typed values.
 *
 * @param diff unified diff text; null is treated as empty
 * @param packId policy pack id, or null for the default pack
 * @param failOn threshold override, or null for the pack default
 * @param overrides per-request policy overrides, or null
 * @param advisory advisory options, or null for off
 * @param advisoryApiKey provider key supplied by the caller, or null
 */
public record ScanRequest(
    String diff,
    String packId,
    FailOn failOn,
    PolicyOverrides overrides,
    AdvisoryOptions advisory,
    String advisoryApiKey
) {
    public ScanRequest {
        if (diff == null) {
            diff = "";
        }
        if (packId != null && packId.isBlank()) {
            packId = null;
        }
        if (advisory == null) {
            advisory = AdvisoryOptions.off();
        }
        if (advisoryApiKey != null) {
            advisoryApiKey = advisoryApiKey.isBlank() ? null : advisoryApiKey.trim();
        }
    }

    /**
     * Request with only a diff: default pack, no overrides, advisory off.
     *
     * @param diff diff text
     * @return request
     */
    public static ScanRequest of(String diff) {
        return new ScanRequest(diff, null, null, null, null, null);
    }

    public boolean hasOverrides() {
        return overrides != null;
    }

    @Override
    public String toString() {
        return "ScanRequest[packId=" + packId + ", failOn=" + failOn + ", overrides=" + overrides
            + ", advisory=" + advisory + ", diffChars=" + diff.length()
            + ", advisoryApiKey=" + (advisoryApiKey == null ? "absent" : "present") + "]";
    }
}
