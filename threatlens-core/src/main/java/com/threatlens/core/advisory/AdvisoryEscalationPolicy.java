package com.threatlens.core.advisory;

import com.threatlens.core.diff.UnifiedDiffParser;
import com.threatlens.core.model.AddedLine;
import com.threatlens.core.model.Finding;
import com.threatlens.core.model.Severity;

import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Decides whether the advisory collaborator is worth calling.
 *
 * <p><b>Decision order:</b>
 * <ol>
 *   <li>{@code always} → call; {@code off} → don't</li>
 *   <li>{@code auto}: any deterministic finding above {@code low} → call</li>
 *   <li>no added lines → don't call</li>
 *   <li>more added lines than the large-change threshold → call</li>
 *   <li>any added line whose path or text mentions a sensitive term → call</li>
 *   <li>otherwise → don't call</li>
 * </ol>
 */
public class AdvisoryEscalationPolicy {

    private static final Pattern SENSITIVE_TERMS = Pattern.compile(
        "auth|permission|tenant|session|token|redirect|fetch|axios|proxy|admin",
        Pattern.CASE_INSENSITIVE);

    private final UnifiedDiffParser parser;
    private final int largeChangeThreshold;

    public AdvisoryEscalationPolicy(UnifiedDiffParser parser, int largeChangeThreshold) {
        this.parser = Objects.requireNonNull(parser, "parser must not be null");
        this.largeChangeThreshold = largeChangeThreshold;
    }

    /**
     * Returns true if the collaborator should be called.
     *
     * @param mode requested mode
     * @param diffText diff under review
     * @param deterministicFindings findings that survived the policy
     * @return escalation decision
     */
    public boolean shouldEscalate(AdvisoryMode mode, String diffText, List<Finding> deterministicFindings) {
        if (mode == AdvisoryMode.ALWAYS) {
            return true;
        }
        if (mode == AdvisoryMode.OFF) {
            return false;
        }

        for (Finding finding : deterministicFindings) {
            if (finding.severity() != Severity.LOW) {
                return true;
            }
        }

        List<AddedLine> addedLines = parser.parse(diffText);
        if (addedLines.isEmpty()) {
            return false;
        }
        if (addedLines.size() > largeChangeThreshold) {
            return true;
        }

        for (AddedLine line : addedLines) {
            if (SENSITIVE_TERMS.matcher(line.filePath() + " " + line.text()).find()) {
                return true;
            }
        }
        return false;
    }
}
