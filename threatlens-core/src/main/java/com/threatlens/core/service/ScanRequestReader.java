package com.threatlens.core.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.threatlens.core.advisory.AdvisoryMode;
import com.threatlens.core.advisory.AdvisoryOptions;
import com.threatlens.core.model.FailOn;
import com.threatlens.core.model.Severity;
import com.threatlens.core.policy.PolicyOverrides;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Parses a JSON scan request document.
 *
 * <p><b>Shape:</b>
 * <pre>{@code
 * {
 *   "diff": "diff --git ...",
 *   "packId": "startup-default",
 *   "failOn": "high",
 *   "overrides": {
 *     "disableRuleIds": ["hardcoded-secret"],
 *     "ignorePathsContaining": ["fixtures/"],
 *     "severityOverrides": {"open-redirect": "high"}
 *   },
 *   "advisory": {"mode": "auto", "model": "openai/gpt-5-mini", "timeoutMs": 8000, "maxFindings": 4}
 * }
 * }</pre>
 *
 * <p>Each violated constraint yields a {@link ScanError} with its own message; nothing is thrown.
 * {@code overrides.disableRules} is accepted as an alias of {@code disableRuleIds}.
 */
public class ScanRequestReader {

    static final int MAX_MODEL_LENGTH = 80;

    private static final ObjectMapper MAPPER = new ObjectMapper();

    /**
     * Parse result: exactly one of {@code request} and {@code error} is set.
     *
     * @param request parsed request, or null
     * @param error validation failure, or null
     */
    public record Result(ScanRequest request, ScanError error) {

        static Result ok(ScanRequest request) {
            return new Result(request, null);
        }

        static Result invalid(ErrorKind kind, String message) {
            return new Result(null, ScanError.of(kind, message));
        }

        public boolean isValid() {
            return request != null;
        }
    }

    /**
     * Parses a request document.
     *
     * @param json request body
     * @param advisoryApiKey provider key supplied out of band (e.g. a header or CLI flag), or null
     * @return parsed request or validation error
     */
    public Result read(String json, String advisoryApiKey) {
        JsonNode root;
        try {
            root = json == null ? null : MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            return Result.invalid(ErrorKind.INVALID_REQUEST, "Invalid JSON body");
        }
        if (root == null || !root.isObject()) {
            return Result.invalid(ErrorKind.INVALID_REQUEST, "Body must be a JSON object");
        }

        JsonNode diff = root.get("diff");
        if (diff == null || !diff.isTextual()) {
            return Result.invalid(ErrorKind.INVALID_REQUEST, "Missing required field: diff (string)");
        }

        JsonNode packId = root.get("packId");
        if (isPresent(packId) && !packId.isTextual()) {
            return Result.invalid(ErrorKind.INVALID_REQUEST, "packId must be a string");
        }

        FailOn failOn = null;
        JsonNode failOnNode = root.get("failOn");
        if (isPresent(failOnNode)) {
            Optional<FailOn> parsed = failOnNode.isTextual() ? FailOn.parse(failOnNode.asText()) : Optional.empty();
            if (parsed.isEmpty()) {
                return Result.invalid(ErrorKind.INVALID_SEVERITY, "failOn must be one of: none, low, medium, high");
            }
            failOn = parsed.get();
        }

        PolicyOverrides overrides = null;
        JsonNode overridesNode = root.get("overrides");
        if (isPresent(overridesNode)) {
            if (!overridesNode.isObject()) {
                return Result.invalid(ErrorKind.INVALID_REQUEST, "overrides must be an object");
            }
            JsonNode disable = overridesNode.has("disableRuleIds")
                ? overridesNode.get("disableRuleIds")
                : overridesNode.get("disableRules");
            Set<String> disableRuleIds = readStrings(disable);
            if (disableRuleIds == null) {
                return Result.invalid(ErrorKind.INVALID_REQUEST, "overrides.disableRuleIds must be an array of strings");
            }
            Set<String> ignorePaths = readStrings(overridesNode.get("ignorePathsContaining"));
            if (ignorePaths == null) {
                return Result.invalid(ErrorKind.INVALID_REQUEST,
                    "overrides.ignorePathsContaining must be an array of strings");
            }

            Map<String, Severity> severityOverrides = new LinkedHashMap<>();
            JsonNode severities = overridesNode.get("severityOverrides");
            if (isPresent(severities)) {
                if (!severities.isObject()) {
                    return Result.invalid(ErrorKind.INVALID_REQUEST, "overrides.severityOverrides must be an object");
                }
                Iterator<Map.Entry<String, JsonNode>> fields = severities.fields();
                while (fields.hasNext()) {
                    Map.Entry<String, JsonNode> entry = fields.next();
                    if (!entry.getValue().isTextual()) {
                        return Result.invalid(ErrorKind.INVALID_REQUEST, "Invalid overrides.severityOverrides entry");
                    }
                    Optional<Severity> level = Severity.parse(entry.getValue().asText());
                    if (level.isEmpty()) {
                        return Result.invalid(ErrorKind.INVALID_SEVERITY,
                            "Invalid severity override for '" + entry.getKey() + "'. Use low, medium, or high.");
                    }
                    severityOverrides.put(entry.getKey(), level.get());
                }
            }
            overrides = new PolicyOverrides(disableRuleIds, ignorePaths, severityOverrides);
        }

        AdvisoryOptions advisory = null;
        JsonNode advisoryNode = root.get("advisory");
        if (isPresent(advisoryNode)) {
            if (!advisoryNode.isObject()) {
                return Result.invalid(ErrorKind.INVALID_REQUEST, "advisory must be an object");
            }

            AdvisoryMode mode = AdvisoryMode.OFF;
            JsonNode modeNode = advisoryNode.get("mode");
            if (isPresent(modeNode)) {
                Optional<AdvisoryMode> parsed = modeNode.isTextual()
                    ? AdvisoryMode.parse(modeNode.asText())
                    : Optional.empty();
                if (parsed.isEmpty()) {
                    return Result.invalid(ErrorKind.INVALID_REQUEST, "advisory.mode must be one of: off, auto, always");
                }
                mode = parsed.get();
            }

            String model = null;
            JsonNode modelNode = advisoryNode.get("model");
            if (isPresent(modelNode)) {
                if (!modelNode.isTextual() || modelNode.asText().length() > MAX_MODEL_LENGTH) {
                    return Result.invalid(ErrorKind.INVALID_REQUEST, "advisory.model must be a string up to 80 chars");
                }
                model = modelNode.asText();
            }

            JsonNode timeoutNode = advisoryNode.get("timeoutMs");
            if (isPresent(timeoutNode) && !timeoutNode.isNumber()) {
                return Result.invalid(ErrorKind.INVALID_REQUEST, "advisory.timeoutMs must be a number");
            }
            JsonNode maxFindingsNode = advisoryNode.get("maxFindings");
            if (isPresent(maxFindingsNode) && !maxFindingsNode.isNumber()) {
                return Result.invalid(ErrorKind.INVALID_REQUEST, "advisory.maxFindings must be a number");
            }

            advisory = new AdvisoryOptions(
                mode,
                model,
                isPresent(timeoutNode) ? toInt(timeoutNode) : null,
                isPresent(maxFindingsNode) ? toInt(maxFindingsNode) : null);
        }

        return Result.ok(new ScanRequest(
            diff.asText(),
            isPresent(packId) ? packId.asText() : null,
            failOn,
            overrides,
            advisory,
            advisoryApiKey));
    }

    private static boolean isPresent(JsonNode node) {
        return node != null && !node.isNull();
    }

    /**
     * Reads an optional array of strings.
     *
     * @return the strings, an empty set when absent, or null when malformed
     */
    private static Set<String> readStrings(JsonNode node) {
        Set<String> values = new LinkedHashSet<>();
        if (!isPresent(node)) {
            return values;
        }
        if (!node.isArray()) {
            return null;
        }
        for (JsonNode item : node) {
            if (!item.isTextual()) {
                return null;
            }
            values.add(item.asText());
        }
        return values;
    }

    private static int toInt(JsonNode number) {
        double value = Math.floor(number.asDouble());
        if (value > Integer.MAX_VALUE) {
            return Integer.MAX_VALUE;
        }
        if (value < Integer.MIN_VALUE) {
            return Integer.MIN_VALUE;
        }
        return (int) value;
    }
}
