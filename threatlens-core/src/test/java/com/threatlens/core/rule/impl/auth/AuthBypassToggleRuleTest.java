package com.threatlens.core.rule.impl.auth;

import com.threatlens.core.model.Severity;
import com.threatlens.core.rule.RuleTestBase;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class AuthBypassToggleRuleTest extends RuleTestBase {

    private final AuthBypassToggleRule rule = new AuthBypassToggleRule();

    @Test
    void metadata_matchesCatalog() {
        assertThat(rule.getId()).isEqualTo("auth-bypass-toggle");
        assertThat(rule.getSeverity()).isEqualTo(Severity.HIGH);
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "const config = { auth: false };",
        "permission check disabled for beta users",
        "  // bypass auth for internal calls",
        "rbac = off",
        "if (SKIP acl) return next();"
    })
    void match_disabledAuth_returnsTrimmedLine(String text) {
        assertThat(match(rule, "  " + text + "  ")).contains(text.trim());
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "const authorized = checkPermissions(user);",
        "enableAuth();",
        "return true;"
    })
    void match_regularCode_returnsEmpty(String text) {
        assertThat(match(rule, text)).isEmpty();
    }
}
