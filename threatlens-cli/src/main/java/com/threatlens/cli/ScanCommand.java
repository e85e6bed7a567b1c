package com.threatlens.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.threatlens.core.config.ConfigLoader;
import com.threatlens.core.config.ThreatLensConfig;
import com.threatlens.core.report.JsonReportFormatter;
import com.threatlens.core.report.ReportFormatter;
import com.threatlens.core.report.TextReportFormatter;
import com.threatlens.core.service.ErrorKind;
import com.threatlens.core.service.ScanError;
import com.threatlens.core.service.ScanOutcome;
import com.threatlens.core.service.ScanRequestReader;
import com.threatlens.core.service.ScanService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Command to scan a unified diff.
 *
 * <p>Builds a request document from the options, validates it with {@link ScanRequestReader}
 * and runs it through {@link ScanService}.
 *
 * <p><b>Exit codes:</b> 0 when the scan passes, 1 when it blocks, and
 * {@link ErrorKind#exitCode()} when the request is rejected.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Scan a diff from stdin
 * git diff origin/main... | threatlens scan
 *
 * # Scan a patch file, fail on medium findings
 * threatlens scan --input change.patch --fail-on medium
 *
 * # Ask the advisory reviewer for a second opinion
 * threatlens scan --input change.patch --advisory auto --api-key "$THREATLENS_CLIENT_KEY"
 * }</pre>
 */
@Command(
    name = "scan",
    description = "Scan the added lines of a unified diff for risky security patterns",
    mixinStandardHelpOptions = true
)
public class ScanCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ScanCommand.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    static final String ENV_CLIENT_KEY = "THREATLENS_CLIENT_KEY";

    @Spec
    private CommandSpec spec;

    @Option(names = {"-i", "--input"}, description = "Diff file to scan (default: read stdin)")
    private Path input;

    @Option(names = {"-p", "--pack"}, description = "Policy pack id (default: first registered pack)")
    private String packId;

    @Option(names = {"--fail-on"}, description = "Block threshold: none, low, medium, high (default: pack default)")
    private String failOn;

    @Option(names = {"--overrides"}, description = "JSON file with policy overrides (requires --api-key)")
    private Path overridesFile;

    @Option(names = {"--api-key"}, description = "Caller credential (default: $" + ENV_CLIENT_KEY + ")")
    private String apiKey;

    @Option(names = {"--advisory"}, description = "Advisory mode: off, auto, always", defaultValue = "off")
    private String advisoryMode;

    @Option(names = {"--advisory-model"}, description = "Advisory model id")
    private String advisoryModel;

    @Option(names = {"--advisory-timeout"}, description = "Advisory timeout in ms (1000-30000)")
    private Integer advisoryTimeoutMs;

    @Option(names = {"--advisory-max-findings"}, description = "Maximum advisory findings (1-10)")
    private Integer advisoryMaxFindings;

    @Option(names = {"-f", "--format"}, description = "Output format: pretty, json", defaultValue = "pretty")
    private String format;

    @Option(names = {"-c", "--config"}, description = "Configuration file (default: threatlens.yaml)")
    private Path configPath = Paths.get("threatlens.yaml");

    private final InputStream stdin;
    private final Map<String, String> environment;

    public ScanCommand() {
        this(System.in, System.getenv());
    }

    ScanCommand(InputStream stdin, Map<String, String> environment) {
        this.stdin = stdin;
        this.environment = environment;
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        ReportFormatter formatter = resolveFormatter();
        if (formatter == null) {
            err.println("Unknown format: " + format + ". Use: pretty, json");
            err.flush();
            return ErrorKind.INVALID_REQUEST.exitCode();
        }

        try {
            ThreatLensConfig config = ConfigLoader.load(configPath, environment);
            String diff = readDiff();
            log.info("Read {} chars of diff from {}", diff.length(), input != null ? input : "stdin");

            ScanRequestReader.Result parsed = new ScanRequestReader().read(buildRequestDocument(diff), null);
            if (!parsed.isValid()) {
                return reportError(formatter, parsed.error(), out, err);
            }

            ScanOutcome outcome = ScanService.create(config).evaluate(parsed.request(), resolveApiKey());
            if (!outcome.isSuccess()) {
                return reportError(formatter, outcome.error(), out, err);
            }

            out.println(formatter.format(outcome.response()));
            out.flush();
            return outcome.response().shouldBlock() ? 1 : 0;

        } catch (IOException e) {
            log.error("Could not read scan input", e);
            return reportError(formatter,
                ScanError.of(ErrorKind.INVALID_REQUEST, "Could not read input: " + e.getMessage()), out, err);
        }
    }

    private ReportFormatter resolveFormatter() {
        return switch (format.toLowerCase(Locale.ROOT)) {
            case "pretty", "text" -> new TextReportFormatter();
            case "json" -> new JsonReportFormatter();
            default -> null;
        };
    }

    private String readDiff() throws IOException {
        if (input != null) {
            return Files.readString(input, StandardCharsets.UTF_8);
        }
        return new String(stdin.readAllBytes(), StandardCharsets.UTF_8);
    }

    /**
     * Builds the JSON request document the options describe.
     */
    private String buildRequestDocument(String diff) throws IOException {
        ObjectNode request = MAPPER.createObjectNode();
        request.put("diff", diff);
        if (packId != null) {
            request.put("packId", packId);
        }
        if (failOn != null) {
            request.put("failOn", failOn);
        }
        if (overridesFile != null) {
            JsonNode overrides = MAPPER.readTree(Files.readString(overridesFile, StandardCharsets.UTF_8));
            request.set("overrides", overrides);
        }

        ObjectNode advisory = request.putObject("advisory");
        advisory.put("mode", advisoryMode);
        if (advisoryModel != null) {
            advisory.put("model", advisoryModel);
        }
        if (advisoryTimeoutMs != null) {
            advisory.put("timeoutMs", advisoryTimeoutMs);
        }
        if (advisoryMaxFindings != null) {
            advisory.put("maxFindings", advisoryMaxFindings);
        }
        return MAPPER.writeValueAsString(request);
    }

    private String resolveApiKey() {
        if (apiKey != null && !apiKey.isBlank()) {
            return apiKey;
        }
        return environment.get(ENV_CLIENT_KEY);
    }

    private int reportError(ReportFormatter formatter, ScanError error, PrintWriter out, PrintWriter err) {
        log.debug("Scan rejected ({}): {}", error.kind(), error.message());
        if (formatter instanceof JsonReportFormatter) {
            out.println(formatter.formatError(error));
            out.flush();
        } else {
            err.println(formatter.formatError(error));
            err.flush();
        }
        return error.kind().exitCode();
    }
}
