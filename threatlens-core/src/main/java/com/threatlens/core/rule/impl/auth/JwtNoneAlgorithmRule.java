package com.threatlens.core.rule.impl.auth;

import com.threatlens.core.model.Severity;
import com.threatlens.core.rule.base.AbstractRegexRule;

import java.util.regex.Pattern;

/**
 * Flags JWT configuration that sets the signing algorithm to {@code none}.
 */
public class JwtNoneAlgorithmRule extends AbstractRegexRule {

    private static final Pattern ALG_NONE =
        Pattern.compile("\\balg\\b\\s*[:=]\\s*[\"']none[\"']", Pattern.CASE_INSENSITIVE);

    public JwtNoneAlgorithmRule() {
        super(
            "jwt-none-alg",
            "JWT algorithm set to none",
            Severity.HIGH,
            "Accepting JWT alg=none breaks signature validation and can allow forged tokens.",
            ALG_NONE);
    }
}
