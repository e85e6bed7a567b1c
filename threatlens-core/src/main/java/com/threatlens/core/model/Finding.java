package com.threatlens.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Objects;

/**
 * One rule or advisory match against an added line.
 *
 * @param ruleId id of the matching rule, or an {@code advisory-<slug>} id
 * @param title short human-readable title
 * @param severity severity after policy remapping
 * @param description explanation and remediation hint
 * @param filePath file the evidence was found in
 * @param line 1-based line in the new file
 * @param evidence matched text, usually the trimmed line
 * @param source whether a rule or the advisory channel produced the finding
 * @param confidence advisory confidence in [0,1]; null for rule findings
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Finding(
    String ruleId,
    String title,
    Severity severity,
    String description,
    String filePath,
    int line,
    String evidence,
    FindingSource source,
    Double confidence
) {
    /**
     * Compact constructor with validation.
     */
    public Finding {
        Objects.requireNonNull(ruleId, "ruleId must not be null");
        Objects.requireNonNull(severity, "severity must not be null");
        Objects.requireNonNull(filePath, "filePath must not be null");
        Objects.requireNonNull(source, "source must not be null");
        if (title == null) {
            title = ruleId;
        }
        if (description == null) {
            description = "";
        }
        if (evidence == null) {
            evidence = "";
        }
    }

    /**
     * Returns a copy of this finding with a different severity.
     *
     * @param newSeverity replacement severity
     * @return remapped finding
     */
    public Finding withSeverity(Severity newSeverity) {
        return new Finding(ruleId, title, newSeverity, description, filePath, line, evidence, source, confidence);
    }
}
