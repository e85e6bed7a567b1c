package com.threatlens.core.advisory;

import com.fasterxml.jackson.databind.JsonNode;
import com.threatlens.core.model.Finding;
import com.threatlens.core.model.FindingSource;
import com.threatlens.core.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Validates raw advisory candidates and converts them into {@link Finding}s.
 *
 * <p><b>Per candidate:</b>
 * <ul>
 *   <li>Required: string {@code title}, {@code filePath}, {@code evidence}, {@code rationale},
 *       {@code category}; numeric {@code line} and {@code confidence}; {@code severity} one of
 *       low/medium/high. A candidate missing any of them is dropped, the rest are kept.</li>
 *   <li>{@code line} is floored and raised to at least 1</li>
 *   <li>{@code confidence} is clamped to [0,1] and rounded to two decimals</li>
 *   <li>rule id is {@code advisory-<slug(category)>}</li>
 *   <li>description is the rationale followed by {@value #ADVISORY_MARKER}</li>
 * </ul>
 *
 * <p>At most {@code maxFindings} valid candidates are returned, in input order.
 */
public class AdvisoryResultNormalizer {

    private static final Logger log = LoggerFactory.getLogger(AdvisoryResultNormalizer.class);

    public static final String RULE_ID_PREFIX = "advisory-";
    static final String ADVISORY_MARKER = " (advisory)";
    static final int MAX_SLUG_LENGTH = 48;
    static final String FALLBACK_SLUG = "general";

    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^a-z0-9]+");
    private static final Pattern EDGE_SEPARATORS = Pattern.compile("^-+|-+$");

    private final int maxFindings;

    /**
     * Creates a normalizer.
     *
     * @param maxFindings cap on returned findings, clamped to
     *                    [{@value AdvisoryOptions#MIN_FINDINGS}, {@value AdvisoryOptions#MAX_FINDINGS}]
     */
    public AdvisoryResultNormalizer(int maxFindings) {
        this.maxFindings = AdvisoryOptions.clamp(maxFindings, AdvisoryOptions.MIN_FINDINGS, AdvisoryOptions.MAX_FINDINGS);
    }

    /**
     * Normalizes candidates.
     *
     * @param candidates raw candidate objects from the provider payload
     * @return valid findings, capped
     */
    public List<Finding> normalize(List<JsonNode> candidates) {
        List<Finding> findings = new ArrayList<>();
        int dropped = 0;

        for (JsonNode candidate : candidates) {
            Optional<Finding> finding = normalize(candidate);
            if (finding.isEmpty()) {
                dropped++;
                continue;
            }
            if (findings.size() < maxFindings) {
                findings.add(finding.get());
            }
        }

        if (dropped > 0) {
            log.warn("Dropped {} advisory candidates that failed validation", dropped);
        }
        return findings;
    }

    /**
     * Normalizes a single candidate.
     *
     * @param candidate raw candidate
     * @return finding, or empty if the candidate is invalid
     */
    public Optional<Finding> normalize(JsonNode candidate) {
        if (candidate == null || !candidate.isObject()) {
            return Optional.empty();
        }

        String title = text(candidate, "title");
        String filePath = text(candidate, "filePath");
        String evidence = text(candidate, "evidence");
        String rationale = text(candidate, "rationale");
        String category = text(candidate, "category");
        Optional<Severity> severity = Severity.parse(text(candidate, "severity"));
        JsonNode line = candidate.get("line");
        JsonNode confidence = candidate.get("confidence");

        if (title == null || filePath == null || evidence == null || rationale == null || category == null
            || severity.isEmpty() || !isNumber(line) || !isNumber(confidence)) {
            return Optional.empty();
        }

        return Optional.of(new Finding(
            RULE_ID_PREFIX + slug(category),
            title,
            severity.get(),
            rationale + ADVISORY_MARKER,
            filePath,
            clampLine(line.asDouble()),
            evidence,
            FindingSource.ADVISORY,
            clampConfidence(confidence.asDouble())
        ));
    }

    /**
     * Lower-cases, collapses non-alphanumeric runs into single dashes, trims dashes and
     * truncates to {@value #MAX_SLUG_LENGTH} characters.
     *
     * @param category free-form category
     * @return slug, or {@value #FALLBACK_SLUG} when nothing alphanumeric remains
     */
    static String slug(String category) {
        String slug = NON_ALPHANUMERIC.matcher(category.toLowerCase(Locale.ROOT)).replaceAll("-");
        slug = EDGE_SEPARATORS.matcher(slug).replaceAll("");
        if (slug.length() > MAX_SLUG_LENGTH) {
            slug = slug.substring(0, MAX_SLUG_LENGTH);
        }
        return slug.isEmpty() ? FALLBACK_SLUG : slug;
    }

    private static int clampLine(double value) {
        double floored = Math.floor(value);
        if (floored >= Integer.MAX_VALUE) {
            return Integer.MAX_VALUE;
        }
        return (int) Math.max(1, floored);
    }

    private static double clampConfidence(double value) {
        double clamped = Math.max(0.0, Math.min(1.0, value));
        return Math.round(clamped * 100.0) / 100.0;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isTextual() ? value.asText() : null;
    }

    private static boolean isNumber(JsonNode node) {
        return node != null && node.isNumber() && Double.isFinite(node.asDouble());
    }
}
