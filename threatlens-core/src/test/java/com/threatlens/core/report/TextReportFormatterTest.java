package com.threatlens.core.report;

import com.threatlens.core.service.ErrorKind;
import com.threatlens.core.service.ScanError;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link TextReportFormatter}.
 */
class TextReportFormatterTest {

    private final TextReportFormatter formatter = new TextReportFormatter();

    @Test
    void format_findings_rendersBlockPerFinding() {
        String output = formatter.format(ReportFixtures.blocked());

        assertThat(output).isEqualTo(String.join("\n",
            "ThreatLens findings",
            "",
            "[HIGH] Possible hardcoded secret (hardcoded-secret)",
            "  at api/auth.ts:14",
            "  A literal token/password/secret was committed in code. Move this to a secret manager or env var.",
            "  > const password = \"my-secret-password\";",
            "",
            "[MEDIUM] Missing tenant check (advisory-authz)",
            "  at api/users.ts:8",
            "  Query is not scoped to the caller's tenant. (advisory)",
            "  > db.users.findAll()",
            "  confidence: 0.70",
            "",
            "Summary: total=2, high=1, medium=1, low=0",
            "Policy: startup-default (Startup Default), failOn=high, result=BLOCK",
            "Advisory: mode=always, attempted=true, findingsAdded=1, model=vendor/model (One issue)"));
    }

    @Test
    void format_noFindings_rendersCleanMessage() {
        String output = formatter.format(ReportFixtures.clean());

        assertThat(output.lines()).containsExactly(
            "No risky patterns found in added lines.",
            "Policy: tenant-isolation (Tenant Isolation Strict), failOn=medium, result=PASS",
            "Advisory: mode=off, attempted=false, findingsAdded=0 (Advisory mode is off)");
    }

    @Test
    void formatError_prefixesMessage() {
        assertThat(formatter.formatError(ScanError.of(ErrorKind.UNKNOWN_POLICY_PACK, "Unknown policy pack 'x'.")))
            .isEqualTo("ThreatLens error: Unknown policy pack 'x'.");
    }

    @Test
    void getId_isPretty() {
        assertThat(formatter.getId()).isEqualTo("pretty");
    }
}
