package com.threatlens.core.rule.impl.injection;

import com.threatlens.core.model.Severity;
import com.threatlens.core.rule.base.AbstractRegexRule;

import java.util.regex.Pattern;

/**
 * Flags process execution that interpolates request input.
 */
public class CommandExecUserInputRule extends AbstractRegexRule {

    private static final Pattern EXEC_WITH_INPUT = Pattern.compile(
        "\\b(exec|execSync|spawn|spawnSync)\\b.{0,120}(req\\.(query|params|body)|\\$\\{.*req\\.)",
        Pattern.CASE_INSENSITIVE);

    public CommandExecUserInputRule() {
        super(
            "command-exec-user-input",
            "Potential command injection",
            Severity.HIGH,
            "Command execution appears to interpolate user input. Use safe APIs and strict argument handling.",
            EXEC_WITH_INPUT);
    }
}
