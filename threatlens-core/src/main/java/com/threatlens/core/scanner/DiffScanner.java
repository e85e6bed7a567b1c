package com.threatlens.core.scanner;

import com.threatlens.core.diff.UnifiedDiffParser;
import com.threatlens.core.model.AddedLine;
import com.threatlens.core.model.Finding;
import com.threatlens.core.model.FindingSource;
import com.threatlens.core.rule.Rule;
import com.threatlens.core.rule.RuleContext;
import com.threatlens.core.rule.RuleSet;
import com.threatlens.core.util.FindingRanking;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Runs a {@link RuleSet} over the added lines of a diff.
 *
 * <p><b>Algorithm:</b>
 * <ol>
 *   <li>Parse the diff into added lines ({@link UnifiedDiffParser})</li>
 *   <li>Group lines by file, keeping diff order</li>
 *   <li>For each line of each file, evaluate every rule with the file's added lines as context</li>
 *   <li>Deduplicate on {@link FindingRanking#SCAN_KEY} and rank with {@link FindingRanking#RANKING}</li>
 * </ol>
 *
 * <p>A rule that throws is skipped for that line only; the remaining rules and lines are still
 * evaluated. The scanner is stateless apart from its immutable collaborators and can be shared
 * across threads.
 *
 * @since 1.0.0
 */
public class DiffScanner {

    private static final Logger log = LoggerFactory.getLogger(DiffScanner.class);

    private final UnifiedDiffParser parser;
    private final RuleSet ruleSet;

    public DiffScanner(UnifiedDiffParser parser, RuleSet ruleSet) {
        this.parser = Objects.requireNonNull(parser, "parser must not be null");
        this.ruleSet = Objects.requireNonNull(ruleSet, "ruleSet must not be null");
    }

    /**
     * Parses and scans diff text.
     *
     * @param diffText unified diff text
     * @return deduplicated, ranked rule findings
     */
    public List<Finding> scan(String diffText) {
        return scan(parser.parse(diffText));
    }

    /**
     * Scans already parsed added lines.
     *
     * @param addedLines added lines in diff order
     * @return deduplicated, ranked rule findings
     */
    public List<Finding> scan(List<AddedLine> addedLines) {
        List<Finding> findings = new ArrayList<>();

        for (Map.Entry<String, List<AddedLine>> file : groupByFile(addedLines).entrySet()) {
            List<AddedLine> linesInFile = file.getValue();
            for (int index = 0; index < linesInFile.size(); index++) {
                AddedLine line = linesInFile.get(index);
                RuleContext context = new RuleContext(linesInFile, index);
                for (Rule rule : ruleSet.rules()) {
                    evaluate(rule, line, context).ifPresent(evidence ->
                        findings.add(toFinding(rule, line, evidence)));
                }
            }
        }

        List<Finding> ranked = FindingRanking.rank(FindingRanking.dedupe(findings, FindingRanking.SCAN_KEY));
        log.debug("Rule pass over {} added lines produced {} findings", addedLines.size(), ranked.size());
        return ranked;
    }

    private Optional<String> evaluate(Rule rule, AddedLine line, RuleContext context) {
        try {
            Optional<String> evidence = rule.match(line, context);
            if (evidence == null) {
                return Optional.empty();
            }
            // blank evidence counts as no match
            return evidence.filter(text -> !text.isEmpty());
        } catch (RuntimeException e) {
            log.warn("Rule {} failed on {}:{}, skipping: {}",
                rule.getId(), line.filePath(), line.lineNumber(), e.toString());
            return Optional.empty();
        }
    }

    private Finding toFinding(Rule rule, AddedLine line, String evidence) {
        return new Finding(
            rule.getId(),
            rule.getTitle(),
            rule.getSeverity(),
            rule.getDescription(),
            line.filePath(),
            line.lineNumber(),
            evidence,
            FindingSource.RULE,
            null
        );
    }

    private Map<String, List<AddedLine>> groupByFile(List<AddedLine> addedLines) {
        Map<String, List<AddedLine>> byFile = new LinkedHashMap<>();
        for (AddedLine line : addedLines) {
            byFile.computeIfAbsent(line.filePath(), path -> new ArrayList<>()).add(line);
        }
        return byFile;
    }
}
