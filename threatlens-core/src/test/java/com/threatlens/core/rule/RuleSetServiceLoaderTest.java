package com.threatlens.core.rule;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.ServiceLoader;
import java.util.Set;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Validates SPI registration of the {@link Rule} implementations.
 *
 * <p>Guards against typos in {@code META-INF/services}, missing classes, constructor failures
 * and duplicate rule ids.
 */
class RuleSetServiceLoaderTest {

    /**
     * Expected number of rule implementations.
     * Update this constant when adding new rules.
     */
    private static final int EXPECTED_RULE_COUNT = 8;

    @Test
    void serviceLoader_discoversAllRegisteredRules() {
        List<Rule> rules = ServiceLoader.load(Rule.class).stream()
            .map(ServiceLoader.Provider::get)
            .toList();

        assertThat(rules)
            .as("ServiceLoader should discover all %d registered rules", EXPECTED_RULE_COUNT)
            .hasSize(EXPECTED_RULE_COUNT)
            .allMatch(rule -> rule.getId() != null, "All rules should have non-null ID")
            .allMatch(rule -> rule.getSeverity() != null, "All rules should have a severity");
    }

    @Test
    void serviceLoader_rulesHaveUniqueIds() {
        List<Rule> rules = ServiceLoader.load(Rule.class).stream()
            .map(ServiceLoader.Provider::get)
            .toList();

        Set<String> ids = rules.stream()
            .map(Rule::getId)
            .collect(Collectors.toSet());

        assertThat(ids).hasSize(rules.size());
    }

    @Test
    void loadDefault_keepsRegistrationOrder() {
        RuleSet ruleSet = RuleSet.loadDefault();

        assertThat(ruleSet.rules()).extracting(Rule::getId).containsExactly(
            "auth-bypass-toggle",
            "hardcoded-secret",
            "tls-verification-disabled",
            "cors-wildcard-credentials",
            "open-redirect",
            "ssrf-user-url",
            "command-exec-user-input",
            "jwt-none-alg");
        assertThat(ruleSet.contains("open-redirect")).isTrue();
        assertThat(ruleSet.contains("advisory-general")).isFalse();
    }

    @Test
    void of_duplicateIds_isRejected() {
        RuleSet defaults = RuleSet.loadDefault();
        Rule first = defaults.rules().get(0);

        assertThatThrownBy(() -> RuleSet.of(List.of(first, first)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining(first.getId());
    }
}
