package com.threatlens.core.rule.impl.injection;

import com.threatlens.core.model.Severity;
import com.threatlens.core.rule.base.AbstractRegexRule;

import java.util.regex.Pattern;

/**
 * Flags outgoing HTTP calls whose target appears to come from request input.
 *
 * <p>Client calls recognized: {@code fetch}, {@code axios}, {@code http(s).get}, {@code got},
 * {@code request}. The target keyword must follow within 60 characters.
 */
public class SsrfUserUrlRule extends AbstractRegexRule {

    private static final Pattern USER_URL_REQUEST = Pattern.compile(
        "\\b(fetch|axios\\.(get|post|request)|axios|http\\.get|https\\.get|got|request)\\b.{0,60}"
            + "\\b(req\\.(query|params|body)|url|target|endpoint)\\b",
        Pattern.CASE_INSENSITIVE);

    public SsrfUserUrlRule() {
        super(
            "ssrf-user-url",
            "Potential SSRF from user-controlled URL",
            Severity.HIGH,
            "Outgoing request appears to use user input directly. Add URL validation and network egress controls.",
            USER_URL_REQUEST);
    }
}
