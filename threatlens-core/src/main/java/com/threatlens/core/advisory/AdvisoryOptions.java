package com.threatlens.core.advisory;

/**
 * Per-request advisory options.
 *
 * <p>Numeric values are clamped when resolved against the configured defaults:
 * timeout to [{@value #MIN_TIMEOUT_MS}, {@value #MAX_TIMEOUT_MS}] ms, finding cap to
 * [{@value #MIN_FINDINGS}, {@value #MAX_FINDINGS}].
 *
 * @param mode advisory mode; null means {@link AdvisoryMode#OFF}
 * @param model model override, or null for the configured default
 * @param timeoutMs timeout override, or null
 * @param maxFindings finding cap override, or null
 */
public record AdvisoryOptions(
    AdvisoryMode mode,
    String model,
    Integer timeoutMs,
    Integer maxFindings
) {
    public static final int MIN_TIMEOUT_MS = 1_000;
    public static final int MAX_TIMEOUT_MS = 30_000;
    public static final int MIN_FINDINGS = 1;
    public static final int MAX_FINDINGS = 10;

    /**
     * Compact constructor with defaults.
     */
    public AdvisoryOptions {
        if (mode == null) {
            mode = AdvisoryMode.OFF;
        }
        if (model != null && model.isBlank()) {
            model = null;
        }
    }

    /**
     * Options with the advisory channel switched off.
     *
     * @return off options
     */
    public static AdvisoryOptions off() {
        return new AdvisoryOptions(AdvisoryMode.OFF, null, null, null);
    }

    /**
     * Returns the effective timeout.
     *
     * @param defaultTimeoutMs configured default
     * @return timeout clamped to the allowed range
     */
    public int resolveTimeoutMs(int defaultTimeoutMs) {
        return clamp(timeoutMs != null ? timeoutMs : defaultTimeoutMs, MIN_TIMEOUT_MS, MAX_TIMEOUT_MS);
    }

    /**
     * Returns the effective finding cap.
     *
     * @param defaultMaxFindings configured default
     * @return cap clamped to the allowed range
     */
    public int resolveMaxFindings(int defaultMaxFindings) {
        return clamp(maxFindings != null ? maxFindings : defaultMaxFindings, MIN_FINDINGS, MAX_FINDINGS);
    }

    /**
     * Returns the effective model.
     *
     * @param defaultModel configured default
     * @return request model if present, else the default
     */
    public String resolveModel(String defaultModel) {
        return model != null ? model : defaultModel;
    }

    static int clamp(int value, int min, int max) {
        return Math.min(max, Math.max(min, value));
    }
}
