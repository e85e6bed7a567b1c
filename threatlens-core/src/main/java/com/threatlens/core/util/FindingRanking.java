package com.threatlens.core.util;

import com.threatlens.core.model.Finding;
import com.threatlens.core.model.FindingSource;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;

/**
 * Ordering and deduplication of finding lists.
 *
 * <p>Ranking order: severity descending, then file path ascending (lexicographic by UTF-16
 * code unit), then line ascending. The sort is stable, so findings equal under this order
 * keep their generation order.
 *
 * <p>Two dedup keys exist:
 * <ul>
 *   <li>{@link #SCAN_KEY} {@code (ruleId, filePath, line, evidence)}, used inside one rule pass
 *       where every finding has source {@code rule}</li>
 *   <li>{@link #MERGE_KEY} {@code (ruleId, filePath, line, evidence, source)}, the canonical key
 *       for any list handed to a caller</li>
 * </ul>
 *
 * @since 1.0.0
 */
public final class FindingRanking {

    /** Severity descending, file path ascending, line ascending. */
    public static final Comparator<Finding> RANKING = Comparator
        .comparingInt((Finding finding) -> finding.severity().rank()).reversed()
        .thenComparing(Finding::filePath)
        .thenComparingInt(Finding::line);

    /** Dedup key within a single rule pass. */
    public static final Function<Finding, Object> SCAN_KEY =
        finding -> new ScanKey(finding.ruleId(), finding.filePath(), finding.line(), finding.evidence());

    /** Canonical dedup key for merged output. */
    public static final Function<Finding, Object> MERGE_KEY =
        finding -> new MergeKey(finding.ruleId(), finding.filePath(), finding.line(), finding.evidence(), finding.source());

    private FindingRanking() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    /**
     * Removes later findings whose key equals an earlier finding's key.
     *
     * @param findings findings in priority order (first occurrence wins)
     * @param key key extractor, usually {@link #SCAN_KEY} or {@link #MERGE_KEY}
     * @return new list without duplicates, order preserved
     */
    public static List<Finding> dedupe(List<Finding> findings, Function<Finding, Object> key) {
        Set<Object> seen = new HashSet<>();
        List<Finding> result = new ArrayList<>(findings.size());
        for (Finding finding : findings) {
            if (seen.add(key.apply(finding))) {
                result.add(finding);
            }
        }
        return result;
    }

    /**
     * Returns a ranked copy of the list.
     *
     * @param findings findings to sort
     * @return new sorted list
     */
    public static List<Finding> rank(List<Finding> findings) {
        List<Finding> sorted = new ArrayList<>(findings);
        sorted.sort(RANKING);
        return sorted;
    }

    private record ScanKey(String ruleId, String filePath, int line, String evidence) {}

    private record MergeKey(String ruleId, String filePath, int line, String evidence, FindingSource source) {}
}
