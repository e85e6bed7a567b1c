package com.threatlens.core.rule.impl.transport;

import com.threatlens.core.model.Severity;
import com.threatlens.core.rule.base.AbstractRegexRule;

import java.util.regex.Pattern;

/**
 * Flags TLS client options that turn certificate verification off.
 *
 * <p>Covers Node ({@code rejectUnauthorized: false}), Python ({@code verify=False}) and
 * {@code ssl_verify} style settings assigned {@code false}, {@code 0} or {@code null}.
 */
public class TlsVerificationDisabledRule extends AbstractRegexRule {

    private static final Pattern VERIFY_DISABLED = Pattern.compile(
        "\\b(rejectUnauthorized|ssl_verify|insecureSkipVerify|verify|checkServerIdentity)\\b\\s*[:=]\\s*(false|0|null)",
        Pattern.CASE_INSENSITIVE);

    public TlsVerificationDisabledRule() {
        super(
            "tls-verification-disabled",
            "TLS verification looks disabled",
            Severity.HIGH,
            "TLS verification appears disabled. This can expose traffic to MITM attacks.",
            VERIFY_DISABLED);
    }
}
