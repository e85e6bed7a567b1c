package com.threatlens.core.rule.impl.injection;

import com.threatlens.core.rule.RuleTestBase;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class CommandExecUserInputRuleTest extends RuleTestBase {

    private final CommandExecUserInputRule rule = new CommandExecUserInputRule();

    @ParameterizedTest
    @ValueSource(strings = {
        "exec(`ls ${req.query.dir}`);",
        "spawnSync('git', ['checkout', req.body.ref]);",
        "execSync(\"convert \" + req.params.file);"
    })
    void match_userInputInCommand_returnsEvidence(String text) {
        assertThat(match(rule, text)).contains(text);
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "exec('ls -la');",
        "const executor = req.query.name;"
    })
    void match_constantCommand_returnsEmpty(String text) {
        assertThat(match(rule, text)).isEmpty();
    }
}
