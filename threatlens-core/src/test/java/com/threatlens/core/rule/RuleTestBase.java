package com.threatlens.core.rule;

import com.threatlens.core.model.AddedLine;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Base class for rule tests.
 *
 * <p>Wraps plain line texts into {@link AddedLine}s of a single file so each test only states
 * the code it feeds to the rule.
 */
public abstract class RuleTestBase {

    protected static final String FILE = "src/server.ts";

    /**
     * Evaluates a rule against a single added line.
     *
     * @param rule rule under test
     * @param text line text
     * @return evidence, if the rule matched
     */
    protected Optional<String> match(Rule rule, String text) {
        return matchAt(rule, List.of(text), 0);
    }

    /**
     * Evaluates a rule against one line of a file's added lines.
     *
     * @param rule rule under test
     * @param texts added line texts of the file, in order
     * @param index line to evaluate
     * @return evidence, if the rule matched
     */
    protected Optional<String> matchAt(Rule rule, List<String> texts, int index) {
        List<AddedLine> lines = new ArrayList<>();
        for (int i = 0; i < texts.size(); i++) {
            lines.add(new AddedLine(FILE, i + 1, texts.get(i)));
        }
        return rule.match(lines.get(index), new RuleContext(lines, index));
    }
}
