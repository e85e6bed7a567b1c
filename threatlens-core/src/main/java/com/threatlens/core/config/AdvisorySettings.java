package com.threatlens.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Advisory channel settings.
 *
 * <p>Absent values fall back to the defaults in {@link #defaults()}.
 *
 * @param apiKey provider credential; null disables the advisory channel
 * @param baseUrl provider API base URL (chat completions live under {@code /chat/completions})
 * @param defaultModel model used when a request names none
 * @param provider optional upstream provider pin
 * @param referer value of the {@code HTTP-Referer} header
 * @param title value of the {@code X-Title} header
 * @param defaultTimeoutMs timeout used when a request names none
 * @param defaultMaxFindings finding cap used when a request names none
 * @param largeChangeThreshold added-line count above which auto mode always escalates
 * @param maxPromptDiffChars diff characters sent to the provider before trimming
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AdvisorySettings(
    @JsonProperty("apiKey") String apiKey,
    @JsonProperty("baseUrl") String baseUrl,
    @JsonProperty("defaultModel") String defaultModel,
    @JsonProperty("provider") String provider,
    @JsonProperty("referer") String referer,
    @JsonProperty("title") String title,
    @JsonProperty("defaultTimeoutMs") Integer defaultTimeoutMs,
    @JsonProperty("defaultMaxFindings") Integer defaultMaxFindings,
    @JsonProperty("largeChangeThreshold") Integer largeChangeThreshold,
    @JsonProperty("maxPromptDiffChars") Integer maxPromptDiffChars
) {
    public static final String DEFAULT_BASE_URL = "https://openrouter.ai/api/v1";
    public static final String DEFAULT_MODEL = "openai/gpt-5-mini";
    public static final int DEFAULT_TIMEOUT_MS = 16_000;
    public static final int DEFAULT_MAX_FINDINGS = 4;
    public static final int DEFAULT_LARGE_CHANGE_THRESHOLD = 250;
    public static final int DEFAULT_MAX_PROMPT_DIFF_CHARS = 14_000;

    /**
     * Compact constructor filling in defaults.
     */
    public AdvisorySettings {
        apiKey = blankToNull(apiKey);
        baseUrl = blankToNull(baseUrl) == null ? DEFAULT_BASE_URL : stripTrailingSlash(baseUrl.trim());
        defaultModel = blankToNull(defaultModel) == null ? DEFAULT_MODEL : defaultModel.trim();
        provider = blankToNull(provider);
        referer = blankToNull(referer) == null ? "https://threatlens.local" : referer;
        title = blankToNull(title) == null ? "ThreatLens" : title;
        if (defaultTimeoutMs == null) {
            defaultTimeoutMs = DEFAULT_TIMEOUT_MS;
        }
        if (defaultMaxFindings == null) {
            defaultMaxFindings = DEFAULT_MAX_FINDINGS;
        }
        if (largeChangeThreshold == null) {
            largeChangeThreshold = DEFAULT_LARGE_CHANGE_THRESHOLD;
        }
        if (maxPromptDiffChars == null) {
            maxPromptDiffChars = DEFAULT_MAX_PROMPT_DIFF_CHARS;
        }
    }

    /**
     * Creates settings with every default and no credential.
     *
     * @return default settings
     */
    public static AdvisorySettings defaults() {
        return new AdvisorySettings(null, null, null, null, null, null, null, null, null, null);
    }

    /**
     * Returns true if a provider credential is configured.
     *
     * @return true if {@link #apiKey()} is present
     */
    public boolean hasApiKey() {
        return apiKey != null;
    }

    /**
     * Returns a copy with a different credential.
     *
     * @param newApiKey credential, may be null
     * @return updated settings
     */
    public AdvisorySettings withApiKey(String newApiKey) {
        return new AdvisorySettings(newApiKey, baseUrl, defaultModel, provider, referer, title,
            defaultTimeoutMs, defaultMaxFindings, largeChangeThreshold, maxPromptDiffChars);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }

    private static String stripTrailingSlash(String value) {
        return value.endsWith("/") ? value.substring(0, value.length() - 1) : value;
    }
}
