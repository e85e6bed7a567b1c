package com.threatlens.core.advisory;

import com.threatlens.core.model.Finding;

import java.util.List;
import java.util.Objects;

/**
 * Input handed to an {@link AdvisoryClient} for one scan.
 *
 * @param diffText full diff text; the client trims it for the prompt
 * @param deterministicFindings findings that survived the policy, used as prompt context
 * @param model resolved model id
 * @param timeoutMs resolved timeout, already clamped
 * @param maxFindings resolved finding cap, already clamped
 * @param apiKey provider credential to use
 */
public record AdvisoryRequest(
    String diffText,
    List<Finding> deterministicFindings,
    String model,
    int timeoutMs,
    int maxFindings,
    String apiKey
) {
    /**
     * Compact constructor with validation.
     */
    public AdvisoryRequest {
        Objects.requireNonNull(model, "model must not be null");
        Objects.requireNonNull(apiKey, "apiKey must not be null");
        if (diffText == null) {
            diffText = "";
        }
        deterministicFindings = deterministicFindings == null ? List.of() : List.copyOf(deterministicFindings);
    }

    @Override
    public String toString() {
        return "AdvisoryRequest[model=" + model + ", timeoutMs=" + timeoutMs + ", maxFindings=" + maxFindings
            + ", diffChars=" + diffText.length() + ", findings=" + deterministicFindings.size() + "]";
    }
}
