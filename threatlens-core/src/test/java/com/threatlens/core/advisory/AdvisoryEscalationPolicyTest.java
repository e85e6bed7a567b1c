package com.threatlens.core.advisory;

import com.threatlens.core.TestDiffs;
import com.threatlens.core.diff.UnifiedDiffParser;
import com.threatlens.core.model.Severity;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.IntStream;

import static com.threatlens.core.TestFindings.rule;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link AdvisoryEscalationPolicy}.
 */
class AdvisoryEscalationPolicyTest {

    private static final String PLAIN_DIFF = TestDiffs.addedLines("src/math.ts", 1, "const sum = a + b;");

    private final AdvisoryEscalationPolicy policy = new AdvisoryEscalationPolicy(new UnifiedDiffParser(), 250);

    @Test
    void shouldEscalate_alwaysMode_callsEvenForEmptyDiff() {
        assertThat(policy.shouldEscalate(AdvisoryMode.ALWAYS, "", List.of())).isTrue();
    }

    @Test
    void shouldEscalate_offMode_neverCalls() {
        assertThat(policy.shouldEscalate(AdvisoryMode.OFF, PLAIN_DIFF,
            List.of(rule("hardcoded-secret", Severity.HIGH, "a.ts", 1)))).isFalse();
    }

    @Test
    void shouldEscalate_autoWithMediumFinding_calls() {
        assertThat(policy.shouldEscalate(AdvisoryMode.AUTO, PLAIN_DIFF,
            List.of(rule("open-redirect", Severity.MEDIUM, "a.ts", 1)))).isTrue();
    }

    @Test
    void shouldEscalate_autoWithOnlyLowFindingsAndPlainDiff_skips() {
        assertThat(policy.shouldEscalate(AdvisoryMode.AUTO, PLAIN_DIFF,
            List.of(rule("style", Severity.LOW, "a.ts", 1)))).isFalse();
    }

    @Test
    void shouldEscalate_autoWithNoAddedLines_skips() {
        String deletionOnly = """
            --- a/session.ts
            +++ b/session.ts
            @@ -1,2 +1,1 @@
             keep
            -const token = read();
            """;

        assertThat(policy.shouldEscalate(AdvisoryMode.AUTO, deletionOnly, List.of())).isFalse();
    }

    @Test
    void shouldEscalate_autoWithLargeChange_calls() {
        String[] lines = IntStream.range(0, 251).mapToObj(i -> "const v" + i + " = " + i + ";").toArray(String[]::new);

        assertThat(policy.shouldEscalate(AdvisoryMode.AUTO, TestDiffs.addedLines("big.ts", 1, lines), List.of())).isTrue();
    }

    @Test
    void shouldEscalate_autoAtThreshold_isNotLargeChange() {
        String[] lines = IntStream.range(0, 250).mapToObj(i -> "const v" + i + " = " + i + ";").toArray(String[]::new);

        assertThat(policy.shouldEscalate(AdvisoryMode.AUTO, TestDiffs.addedLines("big.ts", 1, lines), List.of())).isFalse();
    }

    @Test
    void shouldEscalate_autoWithSensitivePath_calls() {
        String diff = TestDiffs.addedLines("src/Tenant/Scope.ts", 1, "const sum = a + b;");

        assertThat(policy.shouldEscalate(AdvisoryMode.AUTO, diff, List.of())).isTrue();
    }

    @Test
    void shouldEscalate_autoWithSensitiveText_calls() {
        String diff = TestDiffs.addedLines("src/client.ts", 1, "const data = await AXIOS.get(base);");

        assertThat(policy.shouldEscalate(AdvisoryMode.AUTO, diff, List.of())).isTrue();
    }
}
