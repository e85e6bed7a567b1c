package com.threatlens.core.rule.base;

import com.threatlens.core.model.AddedLine;
import com.threatlens.core.model.Severity;
import com.threatlens.core.rule.Rule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * Abstract base class for rule implementations providing common functionality.
 *
 * <p>This class reduces code duplication across rules by providing:
 * <ul>
 *   <li>Logger initialization (one logger per rule class)</li>
 *   <li>Storage of the rule metadata (id, title, severity, description)</li>
 *   <li>Evidence helpers ({@link #evidence(AddedLine)}, {@link #noMatch()})</li>
 * </ul>
 *
 * @see Rule
 * @since 1.0.0
 */
public abstract class AbstractRule implements Rule {

    /**
     * Logger instance for this rule.
     * Automatically initialized with the concrete rule class name.
     */
    protected final Logger log;

    private final String id;
    private final String title;
    private final Severity severity;
    private final String description;

    /**
     * Creates a rule with the given metadata.
     *
     * @param id unique kebab-case identifier
     * @param title report title
     * @param severity default severity
     * @param description risk explanation and remediation hint
     */
    protected AbstractRule(String id, String title, Severity severity, String description) {
        this.log = LoggerFactory.getLogger(getClass());
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.title = Objects.requireNonNull(title, "title must not be null");
        this.severity = Objects.requireNonNull(severity, "severity must not be null");
        this.description = Objects.requireNonNull(description, "description must not be null");
    }

    @Override
    public final String getId() {
        return id;
    }

    @Override
    public final String getTitle() {
        return title;
    }

    @Override
    public final Severity getSeverity() {
        return severity;
    }

    @Override
    public final String getDescription() {
        return description;
    }

    /**
     * Builds the standard evidence for a match: the line text, trimmed.
     *
     * @param line matching line
     * @return evidence
     */
    protected Optional<String> evidence(AddedLine line) {
        return Optional.of(line.text().trim());
    }

    /**
     * Result for a non-matching line.
     *
     * @return empty optional
     */
    protected Optional<String> noMatch() {
        return Optional.empty();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + id + "]";
    }
}
