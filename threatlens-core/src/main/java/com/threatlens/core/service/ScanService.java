package com.threatlens.core.service;

import com.threatlens.core.advisory.AdvisoryClient;
import com.threatlens.core.advisory.AdvisoryEscalationPolicy;
import com.threatlens.core.advisory.AdvisoryResult;
import com.threatlens.core.advisory.AdvisoryRunner;
import com.threatlens.core.advisory.OpenRouterAdvisoryClient;
import com.threatlens.core.config.ThreatLensConfig;
import com.threatlens.core.diff.UnifiedDiffParser;
import com.threatlens.core.evaluation.FindingMerger;
import com.threatlens.core.evaluation.MergedFindings;
import com.threatlens.core.evaluation.ThresholdEvaluator;
import com.threatlens.core.model.FailOn;
import com.threatlens.core.model.Finding;
import com.threatlens.core.policy.PolicyEngine;
import com.threatlens.core.policy.PolicyPack;
import com.threatlens.core.policy.PolicyPackRegistry;
import com.threatlens.core.rule.RuleSet;
import com.threatlens.core.scanner.DiffScanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Entry point of the scan pipeline.
 *
 * <p><b>Order:</b>
 * <ol>
 *   <li>Diff size check</li>
 *   <li>Authorization of overrides and advisory options</li>
 *   <li>Pack resolution</li>
 *   <li>Rule scan, then policy with the allow-list enforced</li>
 *   <li>Advisory run, then policy with the allow-list relaxed</li>
 *   <li>Merge, then threshold on the rule findings only</li>
 * </ol>
 *
 * <p>Validation failures come back as {@link ScanError} values. The service holds only
 * immutable collaborators and may be called from many threads at once.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ScanService service = ScanService.create(ConfigLoader.load(null, System.getenv()));
 * ScanOutcome outcome = service.evaluate(ScanRequest.of(diffText), null);
 * }</pre>
 */
public class ScanService {

    private static final Logger log = LoggerFactory.getLogger(ScanService.class);

    static final String INTERNAL_ERROR_MESSAGE = "Unexpected internal error";

    private final ThreatLensConfig config;
    private final PolicyPackRegistry registry;
    private final DiffScanner scanner;
    private final PolicyEngine policyEngine;
    private final AdvisoryRunner advisoryRunner;
    private final FindingMerger merger;
    private final ThresholdEvaluator thresholdEvaluator;
    private final RequestAuthorizer authorizer;

    public ScanService(ThreatLensConfig config, PolicyPackRegistry registry, DiffScanner scanner,
                       PolicyEngine policyEngine, AdvisoryRunner advisoryRunner, FindingMerger merger,
                       ThresholdEvaluator thresholdEvaluator) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.scanner = Objects.requireNonNull(scanner, "scanner must not be null");
        this.policyEngine = Objects.requireNonNull(policyEngine, "policyEngine must not be null");
        this.advisoryRunner = Objects.requireNonNull(advisoryRunner, "advisoryRunner must not be null");
        this.merger = Objects.requireNonNull(merger, "merger must not be null");
        this.thresholdEvaluator = Objects.requireNonNull(thresholdEvaluator, "thresholdEvaluator must not be null");
        this.authorizer = new RequestAuthorizer(config);
    }

    /**
     * Wires the default rule set, pack catalog and HTTP advisory client.
     *
     * @param config process configuration
     * @return ready service
     */
    public static ScanService create(ThreatLensConfig config) {
        return create(config, new OpenRouterAdvisoryClient(config.advisory()));
    }

    /**
     * Wires the default rule set and pack catalog with the given advisory client.
     *
     * @param config process configuration
     * @param advisoryClient advisory collaborator
     * @return ready service
     */
    public static ScanService create(ThreatLensConfig config, AdvisoryClient advisoryClient) {
        UnifiedDiffParser parser = new UnifiedDiffParser();
        AdvisoryRunner runner = new AdvisoryRunner(
            config.advisory(),
            advisoryClient,
            new AdvisoryEscalationPolicy(parser, config.advisory().largeChangeThreshold()));
        return new ScanService(
            config,
            PolicyPackRegistry.loadDefault(),
            new DiffScanner(parser, RuleSet.loadDefault()),
            new PolicyEngine(),
            runner,
            new FindingMerger(),
            new ThresholdEvaluator());
    }

    /**
     * Evaluates one request.
     *
     * @param request parsed request
     * @param presentedKey caller credential, or null
     * @return response or error; never throws
     */
    public ScanOutcome evaluate(ScanRequest request, String presentedKey) {
        try {
            return doEvaluate(request, presentedKey);
        } catch (RuntimeException e) {
            log.error("Scan failed unexpectedly", e);
            return ScanOutcome.failure(ErrorKind.INTERNAL, INTERNAL_ERROR_MESSAGE);
        }
    }

    /**
     * Returns the registered packs in registration order.
     *
     * @return pack catalog
     */
    public List<PolicyPackListing> listPacks() {
        return registry.list().stream()
            .map(PolicyPackListing::of)
            .toList();
    }

    private ScanOutcome doEvaluate(ScanRequest request, String presentedKey) {
        if (request.diff().length() > config.maxDiffChars()) {
            return ScanOutcome.failure(ErrorKind.DIFF_TOO_LARGE,
                "Diff too large. Max supported size is " + (config.maxDiffChars() / 1000) + "KB.");
        }

        Optional<ScanError> rejection = authorizer.authorize(request, presentedKey);
        if (rejection.isPresent()) {
            log.info("Scan rejected: {}", rejection.get().message());
            return ScanOutcome.failure(rejection.get());
        }

        Optional<PolicyPack> resolved = request.packId() == null
            ? Optional.of(registry.defaultPack())
            : registry.find(request.packId());
        if (resolved.isEmpty()) {
            return ScanOutcome.failure(ErrorKind.UNKNOWN_POLICY_PACK,
                "Unknown policy pack '" + request.packId() + "'. Available packs: " + String.join(", ", registry.ids()));
        }
        PolicyPack pack = resolved.get();
        FailOn failOn = request.failOn() != null ? request.failOn() : pack.defaultFailOn();
        log.info("Scanning {} chars of diff with pack '{}' (failOn {})",
            request.diff().length(), pack.id(), failOn.literal());

        List<Finding> deterministic = policyEngine.apply(
            scanner.scan(request.diff()), pack, request.overrides(), true);

        AdvisoryResult advisoryResult = advisoryRunner.run(
            request.diff(), deterministic, request.advisory(), request.advisoryApiKey());
        List<Finding> advisory = policyEngine.apply(
            advisoryResult.findings(), pack, request.overrides(), false);

        MergedFindings merged = merger.merge(deterministic, advisory);
        boolean shouldBlock = thresholdEvaluator.shouldBlock(deterministic, failOn);
        log.info("Scan complete: {} findings ({} rule, {} advisory), shouldBlock={}",
            merged.findings().size(), deterministic.size(), advisory.size(), shouldBlock);

        return ScanOutcome.success(new ScanResponse(
            new ScanResponse.PolicyInfo(pack.id(), pack.name(), failOn),
            shouldBlock,
            merged.summary(),
            merged.deterministicSummary(),
            merged.advisorySummary(),
            merged.findings(),
            new ScanResponse.AdvisoryInfo(
                request.advisory().mode(),
                advisoryResult.attempted(),
                advisoryResult.enabled(),
                advisoryResult.model(),
                advisoryResult.reason(),
                advisory.size())));
    }
}
