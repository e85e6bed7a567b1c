package com.threatlens.core.advisory;

import com.threatlens.core.config.AdvisorySettings;
import com.threatlens.core.model.Finding;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Gatekeeper in front of an {@link AdvisoryClient}.
 *
 * <p>Resolves mode, credential and escalation before issuing at most one call. A per-request
 * provider key (already authorized by the caller) wins over the configured key.
 */
public class AdvisoryRunner {

    private static final Logger log = LoggerFactory.getLogger(AdvisoryRunner.class);

    static final String REASON_OFF = "Advisory mode is off";
    static final String REASON_NO_KEY = "OPENROUTER_API_KEY is not configured";
    static final String REASON_NOT_ESCALATED = "Auto mode did not meet escalation criteria";

    private final AdvisorySettings settings;
    private final AdvisoryClient client;
    private final AdvisoryEscalationPolicy escalationPolicy;

    public AdvisoryRunner(AdvisorySettings settings, AdvisoryClient client, AdvisoryEscalationPolicy escalationPolicy) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.escalationPolicy = Objects.requireNonNull(escalationPolicy, "escalationPolicy must not be null");
    }

    /**
     * Runs the advisory channel for one scan.
     *
     * @param diffText diff under review
     * @param deterministicFindings policy-filtered rule findings
     * @param options per-request options
     * @param apiKeyOverride provider key supplied with the request, or null
     * @return advisory outcome; never null
     */
    public AdvisoryResult run(String diffText, List<Finding> deterministicFindings, AdvisoryOptions options,
                              String apiKeyOverride) {
        AdvisoryOptions effective = options != null ? options : AdvisoryOptions.off();
        if (effective.mode() == AdvisoryMode.OFF) {
            return AdvisoryResult.disabled(REASON_OFF);
        }

        String apiKey = apiKeyOverride != null && !apiKeyOverride.isBlank() ? apiKeyOverride : settings.apiKey();
        if (apiKey == null) {
            log.info("Advisory requested ({}) but no provider key is configured", effective.mode().literal());
            return AdvisoryResult.disabled(REASON_NO_KEY);
        }

        if (!escalationPolicy.shouldEscalate(effective.mode(), diffText, deterministicFindings)) {
            log.debug("Advisory escalation criteria not met");
            return AdvisoryResult.skipped(REASON_NOT_ESCALATED);
        }

        AdvisoryRequest request = new AdvisoryRequest(
            diffText,
            deterministicFindings,
            effective.resolveModel(settings.defaultModel()),
            effective.resolveTimeoutMs(settings.defaultTimeoutMs()),
            effective.resolveMaxFindings(settings.defaultMaxFindings()),
            apiKey);
        log.debug("Issuing advisory request: {}", request);

        AdvisoryResult result;
        try {
            result = client.review(request);
        } catch (RuntimeException e) {
            log.warn("Advisory client failed: {}", e.getMessage(), e);
            return AdvisoryResult.failed(request.model(), "Advisory unavailable: " + describe(e));
        }
        if (result == null) {
            return AdvisoryResult.failed(request.model(), "Advisory unavailable: client returned no result");
        }
        log.info("Advisory finished: attempted={}, findings={}, reason={}",
            result.attempted(), result.findings().size(), result.reason());
        return result;
    }

    private static String describe(RuntimeException e) {
        String message = e.getMessage();
        return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
    }
}
