package com.threatlens.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Process-wide configuration, built once at start-up by {@link ConfigLoader}.
 *
 * <p><b>Example YAML ({@code threatlens.yaml}):</b>
 * <pre>{@code
 * apiKey: "change-me"          # secret callers present to use overrides/advisory modes
 * maxDiffChars: 800000
 * advisory:
 *   defaultModel: openai/gpt-5-mini
 *   defaultTimeoutMs: 16000
 *   largeChangeThreshold: 250
 * }</pre>
 *
 * @param apiKey caller secret; null means no caller can authenticate
 * @param maxDiffChars largest accepted diff, in characters
 * @param advisory advisory channel settings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ThreatLensConfig(
    @JsonProperty("apiKey") String apiKey,
    @JsonProperty("maxDiffChars") Integer maxDiffChars,
    @JsonProperty("advisory") AdvisorySettings advisory
) {
    public static final int DEFAULT_MAX_DIFF_CHARS = 800_000;

    /**
     * Compact constructor filling in defaults.
     */
    public ThreatLensConfig {
        if (apiKey != null && apiKey.isBlank()) {
            apiKey = null;
        }
        if (maxDiffChars == null || maxDiffChars <= 0) {
            maxDiffChars = DEFAULT_MAX_DIFF_CHARS;
        }
        if (advisory == null) {
            advisory = AdvisorySettings.defaults();
        }
    }

    /**
     * Creates the default configuration: no secrets, default limits.
     *
     * @return default configuration
     */
    public static ThreatLensConfig defaults() {
        return new ThreatLensConfig(null, null, null);
    }

    /**
     * Returns true if a caller secret is configured.
     *
     * @return true if {@link #apiKey()} is present
     */
    public boolean hasApiKey() {
        return apiKey != null;
    }
}
