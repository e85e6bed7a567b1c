package com.threatlens.core.report;

import com.threatlens.core.model.Finding;
import com.threatlens.core.model.ScanSummary;
import com.threatlens.core.service.ScanError;
import com.threatlens.core.service.ScanResponse;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Human-readable report.
 *
 * <p><b>Example output:</b>
 * <pre>
 * ThreatLens findings
 *
 * [HIGH] Possible hardcoded secret (hardcoded-secret)
 *   at api/auth.ts:14
 *   A literal token/password/secret was committed in code. Move this to a secret manager or env var.
 *   &gt; const password = "my-secret-password";
 *
 * Summary: total=1, high=1, medium=0, low=0
 * Policy: startup-default (Startup Default), failOn=high, result=BLOCK
 * Advisory: mode=off, attempted=false, findingsAdded=0 (Advisory mode is off)
 * </pre>
 */
public class TextReportFormatter implements ReportFormatter {

    static final String NO_FINDINGS = "No risky patterns found in added lines.";

    @Override
    public String getId() {
        return "pretty";
    }

    @Override
    public String format(ScanResponse response) {
        List<String> lines = new ArrayList<>();

        if (response.findings().isEmpty()) {
            lines.add(NO_FINDINGS);
        } else {
            lines.add("ThreatLens findings");
            lines.add("");
            for (Finding finding : response.findings()) {
                lines.add("[" + finding.severity().literal().toUpperCase(Locale.ROOT) + "] "
                    + finding.title() + " (" + finding.ruleId() + ")");
                lines.add("  at " + finding.filePath() + ":" + finding.line());
                lines.add("  " + finding.description());
                lines.add("  > " + finding.evidence());
                if (finding.confidence() != null) {
                    lines.add("  confidence: " + String.format(Locale.ROOT, "%.2f", finding.confidence()));
                }
                lines.add("");
            }
            lines.add(summaryLine(response.summary()));
        }

        ScanResponse.PolicyInfo policy = response.policy();
        lines.add("Policy: " + policy.id() + " (" + policy.name() + "), failOn=" + policy.failOn().literal()
            + ", result=" + (response.shouldBlock() ? "BLOCK" : "PASS"));

        ScanResponse.AdvisoryInfo advisory = response.advisory();
        StringBuilder advisoryLine = new StringBuilder("Advisory: mode=")
            .append(advisory.mode().literal())
            .append(", attempted=").append(advisory.attempted())
            .append(", findingsAdded=").append(advisory.findingsAdded());
        if (advisory.model() != null) {
            advisoryLine.append(", model=").append(advisory.model());
        }
        if (advisory.message() != null) {
            advisoryLine.append(" (").append(advisory.message()).append(')');
        }
        lines.add(advisoryLine.toString());

        return String.join("\n", lines);
    }

    @Override
    public String formatError(ScanError error) {
        return "ThreatLens error: " + error.message();
    }

    private static String summaryLine(ScanSummary summary) {
        return "Summary: total=" + summary.total() + ", high=" + summary.high()
            + ", medium=" + summary.medium() + ", low=" + summary.low();
    }
}
