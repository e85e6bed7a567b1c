package com.threatlens.core.service;

import com.threatlens.core.advisory.AdvisoryMode;
import com.threatlens.core.config.ThreatLensConfig;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Objects;
import java.util.Optional;

/**
 * Checks a presented caller credential against the configured secret.
 *
 * <ul>
 *   <li>overrides need a valid credential; with no secret configured they are always refused</li>
 *   <li>advisory modes other than off need a valid credential only when a secret is configured</li>
 *   <li>a per-request provider key is only honored for a valid credential</li>
 * </ul>
 */
public class RequestAuthorizer {

    static final String OVERRIDES_FORBIDDEN = "overrides are only available for authenticated requests";
    static final String ADVISORY_UNAUTHENTICATED = "Missing or invalid API key for advisory mode.";
    static final String PROVIDER_KEY_UNAUTHENTICATED =
        "A provider API key may only be supplied by authenticated requests.";

    private final ThreatLensConfig config;

    public RequestAuthorizer(ThreatLensConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    /**
     * Returns true if the credential matches the configured secret.
     *
     * @param presentedKey credential presented by the caller, may be null
     * @return false when no secret is configured or the credential differs
     */
    public boolean isAuthenticated(String presentedKey) {
        if (!config.hasApiKey() || presentedKey == null) {
            return false;
        }
        return MessageDigest.isEqual(
            presentedKey.getBytes(StandardCharsets.UTF_8),
            config.apiKey().getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Authorizes a request.
     *
     * @param request parsed request
     * @param presentedKey caller credential, may be null
     * @return the rejection, or empty when the request may proceed
     */
    public Optional<ScanError> authorize(ScanRequest request, String presentedKey) {
        boolean authenticated = isAuthenticated(presentedKey);

        if (request.hasOverrides() && !authenticated) {
            return Optional.of(ScanError.of(ErrorKind.FORBIDDEN_OVERRIDES, OVERRIDES_FORBIDDEN));
        }
        if (request.advisory().mode() != AdvisoryMode.OFF && config.hasApiKey() && !authenticated) {
            return Optional.of(ScanError.of(ErrorKind.UNAUTHENTICATED, ADVISORY_UNAUTHENTICATED));
        }
        if (request.advisoryApiKey() != null && !authenticated) {
            return Optional.of(ScanError.of(ErrorKind.UNAUTHENTICATED, PROVIDER_KEY_UNAUTHENTICATED));
        }
        return Optional.empty();
    }
}
