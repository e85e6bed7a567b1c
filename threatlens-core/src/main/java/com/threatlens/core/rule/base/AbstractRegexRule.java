package com.threatlens.core.rule.base;

import com.threatlens.core.model.AddedLine;
import com.threatlens.core.model.Severity;
import com.threatlens.core.rule.RuleContext;

import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Base class for rules that match a single added line against one precompiled pattern.
 *
 * <p>The pattern is searched (not fully matched) in the raw line text. On a match the
 * trimmed line becomes the evidence.
 *
 * <p>Rules that need surrounding lines (e.g., a signal split over two lines) should extend
 * {@link AbstractRule} directly and use {@link RuleContext#window(int)}.
 *
 * @see AbstractRule
 * @since 1.0.0
 */
public abstract class AbstractRegexRule extends AbstractRule {

    private final Pattern pattern;

    /**
     * Creates a single-pattern rule.
     *
     * @param id unique kebab-case identifier
     * @param title report title
     * @param severity default severity
     * @param description risk explanation and remediation hint
     * @param pattern compiled pattern searched in each added line
     */
    protected AbstractRegexRule(String id, String title, Severity severity, String description, Pattern pattern) {
        super(id, title, severity, description);
        this.pattern = Objects.requireNonNull(pattern, "pattern must not be null");
    }

    @Override
    public Optional<String> match(AddedLine line, RuleContext context) {
        return matches(pattern, line.text()) ? evidence(line) : noMatch();
    }

    /**
     * Checks if a pattern matches anywhere in the text.
     *
     * @param pattern compiled regex pattern
     * @param text text to search
     * @return true if pattern matches
     */
    protected boolean matches(Pattern pattern, String text) {
        return text != null && pattern.matcher(text).find();
    }
}
