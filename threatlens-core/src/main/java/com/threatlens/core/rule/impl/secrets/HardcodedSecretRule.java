package com.threatlens.core.rule.impl.secrets;

import com.threatlens.core.model.Severity;
import com.threatlens.core.rule.base.AbstractRegexRule;

import java.util.regex.Pattern;

/**
 * Flags credential-like identifiers assigned a quoted literal.
 *
 * <p>Recognized names: {@code api_key}/{@code apiKey}/{@code api-key}, {@code secret},
 * {@code token}, {@code password}, {@code passwd}, {@code private_key}. The literal must be
 * at least 8 characters so placeholders such as {@code ""} or {@code "xxx"} are ignored.
 */
public class HardcodedSecretRule extends AbstractRegexRule {

    private static final Pattern SECRET_ASSIGNMENT = Pattern.compile(
        "\\b(api[_-]?key|secret|token|password|passwd|private[_-]?key)\\b\\s*[:=]\\s*[\"'][^\"']{8,}[\"']",
        Pattern.CASE_INSENSITIVE);

    public HardcodedSecretRule() {
        super(
            "hardcoded-secret",
            "Possible hardcoded secret",
            Severity.HIGH,
            "A literal token/password/secret was committed in code. Move this to a secret manager or env var.",
            SECRET_ASSIGNMENT);
    }
}
