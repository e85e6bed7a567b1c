package com.threatlens.core.rule.impl.injection;

import com.threatlens.core.model.Severity;
import com.threatlens.core.rule.base.AbstractRegexRule;

import java.util.regex.Pattern;

/**
 * Flags redirects whose target looks user controlled ({@code res.redirect(req.query.next)}).
 */
public class OpenRedirectRule extends AbstractRegexRule {

    private static final Pattern USER_REDIRECT = Pattern.compile(
        "\\b(redirect|location|res\\.redirect|window\\.location)\\b.{0,50}"
            + "\\b(req\\.(query|params|body)|next|returnTo|redirectUrl|url)\\b",
        Pattern.CASE_INSENSITIVE);

    public OpenRedirectRule() {
        super(
            "open-redirect",
            "Potential open redirect",
            Severity.MEDIUM,
            "Redirect target appears user-controlled. Validate against an allowlist before redirecting.",
            USER_REDIRECT);
    }
}
