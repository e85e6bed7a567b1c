package com.threatlens.core.rule.impl.auth;

import com.threatlens.core.model.Severity;
import com.threatlens.core.rule.base.AbstractRegexRule;

import java.util.regex.Pattern;

/**
 * Flags lines that appear to switch off authentication or permission checks.
 *
 * <p><b>Matches:</b>
 * <ul>
 *   <li>{@code authorization: false}, {@code permissionCheck = "off"} style toggles</li>
 *   <li>{@code skipAuth()}, {@code bypassPermission(...)}, {@code disableAcl = true}</li>
 * </ul>
 *
 * <p>The two keywords must appear within 40 characters of each other, in either order.
 */
public class AuthBypassToggleRule extends AbstractRegexRule {

    private static final Pattern AUTH_TOGGLE = Pattern.compile(
        "\\b(auth|authorization|permission|rbac|acl)\\b.{0,40}\\b(disabled?|off|false|bypass|skip)\\b"
            + "|\\b(disable|bypass|skip)\\w*\\b.{0,40}\\b(auth|authorization|permission|rbac|acl)\\b",
        Pattern.CASE_INSENSITIVE);

    public AuthBypassToggleRule() {
        super(
            "auth-bypass-toggle",
            "Auth checks look bypassed or disabled",
            Severity.HIGH,
            "Code appears to disable auth or permission checks. This is a common source of privilege escalation.",
            AUTH_TOGGLE);
    }
}
