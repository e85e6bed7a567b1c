package com.threatlens.core.rule;

import com.threatlens.core.model.AddedLine;
import com.threatlens.core.model.Severity;

import java.util.Optional;

/**
 * A named security pattern matcher evaluated against added diff lines.
 *
 * <p>Rules are discovered via Java Service Provider Interface (SPI) and executed by
 * {@link com.threatlens.core.scanner.DiffScanner} for every added line of every file.
 * Implementations must be stateless and side-effect free so that one instance can be
 * shared by concurrent scans.
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.threatlens.core.rule.Rule}
 *
 * @see RuleContext
 * @see RuleSet
 */
public interface Rule {

    /**
     * Returns the unique rule identifier.
     *
     * <p>Kebab-case (e.g., "hardcoded-secret"). Policy packs reference rules by this id.
     *
     * @return unique rule identifier
     */
    String getId();

    /**
     * Returns the human-readable title used in reports.
     *
     * @return title
     */
    String getTitle();

    /**
     * Returns the default severity of findings produced by this rule.
     *
     * @return severity
     */
    Severity getSeverity();

    /**
     * Returns a description of the risk and how to fix it.
     *
     * @return description
     */
    String getDescription();

    /**
     * Evaluates the rule against one added line.
     *
     * <p>The context exposes the other added lines of the same file so a rule can look
     * at a window around the current line. Only added lines are visible; unchanged lines
     * of the original file are not.
     *
     * <p>Implementations should not throw. The scanner isolates failures anyway, but a
     * throwing rule loses its result for that line.
     *
     * @param line line under evaluation
     * @param context added lines of the same file and the index of {@code line}
     * @return evidence text if the rule matches, otherwise empty
     */
    Optional<String> match(AddedLine line, RuleContext context);
}
