package com.threatlens.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ScanCommand}.
 */
class ScanCommandTest {

    private static final String SECRET_DIFF = String.join("\n",
        "diff --git a/api/auth.ts b/api/auth.ts",
        "--- a/api/auth.ts",
        "+++ b/api/auth.ts",
        "@@ -13,0 +14,1 @@",
        "+const password = \"my-secret-password\";",
        "");

    private static final String CLEAN_DIFF = String.join("\n",
        "diff --git a/src/math.ts b/src/math.ts",
        "--- a/src/math.ts",
        "+++ b/src/math.ts",
        "@@ -1,0 +1,1 @@",
        "+export const add = (a: number, b: number) => a + b;",
        "");

    @TempDir
    Path tempDir;

    private StringWriter out;
    private StringWriter err;

    @BeforeEach
    void setUp() {
        out = new StringWriter();
        err = new StringWriter();
    }

    private int run(String stdin, Map<String, String> environment, String... args) {
        ScanCommand command = new ScanCommand(
            new ByteArrayInputStream(stdin.getBytes(StandardCharsets.UTF_8)), environment);
        CommandLine commandLine = new CommandLine(command);
        commandLine.setOut(new PrintWriter(out));
        commandLine.setErr(new PrintWriter(err));

        List<String> allArgs = new ArrayList<>(List.of("--config", tempDir.resolve("absent.yaml").toString()));
        allArgs.addAll(List.of(args));
        return commandLine.execute(allArgs.toArray(new String[0]));
    }

    private int run(String stdin, String... args) {
        return run(stdin, Map.of(), args);
    }

    @Test
    void scan_secretOnStdin_blocksWithExitOne() {
        int exitCode = run(SECRET_DIFF);

        assertThat(exitCode).isEqualTo(1);
        assertThat(out.toString())
            .contains("[HIGH] Possible hardcoded secret (hardcoded-secret)")
            .contains("  at api/auth.ts:14")
            .contains("result=BLOCK");
    }

    @Test
    void scan_cleanDiff_passesWithExitZero() {
        int exitCode = run(CLEAN_DIFF);

        assertThat(exitCode).isZero();
        assertThat(out.toString()).startsWith("No risky patterns found in added lines.");
    }

    @Test
    void scan_inputFile_isReadInsteadOfStdin() throws IOException {
        Path patch = tempDir.resolve("change.patch");
        Files.writeString(patch, SECRET_DIFF);

        int exitCode = run("", "--input", patch.toString());

        assertThat(exitCode).isEqualTo(1);
    }

    @Test
    void scan_failOnNone_passesDespiteFindings() {
        int exitCode = run(SECRET_DIFF, "--fail-on", "none");

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("failOn=none, result=PASS");
    }

    @Test
    void scan_unknownPack_exitsTwoWithKnownPacks() {
        int exitCode = run(CLEAN_DIFF, "--pack", "nope");

        assertThat(exitCode).isEqualTo(2);
        assertThat(err.toString())
            .contains("ThreatLens error: Unknown policy pack 'nope'. Available packs: startup-default, tenant-isolation");
    }

    @Test
    void scan_invalidFailOn_exitsTwo() {
        int exitCode = run(CLEAN_DIFF, "--fail-on", "critical");

        assertThat(exitCode).isEqualTo(2);
        assertThat(err.toString()).contains("failOn must be one of: none, low, medium, high");
    }

    @Test
    void scan_jsonFormat_writesResponseDocument() throws IOException {
        int exitCode = run(SECRET_DIFF, "--format", "json");

        JsonNode root = new ObjectMapper().readTree(out.toString());
        assertThat(exitCode).isEqualTo(1);
        assertThat(root.path("shouldBlock").asBoolean()).isTrue();
        assertThat(root.path("findings").get(0).path("ruleId").asText()).isEqualTo("hardcoded-secret");
        assertThat(root.path("advisory").path("mode").asText()).isEqualTo("off");
    }

    @Test
    void scan_jsonFormatError_writesErrorDocumentToStdout() throws IOException {
        int exitCode = run(CLEAN_DIFF, "--format", "json", "--pack", "nope");

        JsonNode root = new ObjectMapper().readTree(out.toString());
        assertThat(exitCode).isEqualTo(2);
        assertThat(root.path("status").asInt()).isEqualTo(400);
        assertThat(root.path("error").asText()).startsWith("Unknown policy pack 'nope'.");
    }

    @Test
    void scan_unknownFormat_exitsTwo() {
        int exitCode = run(CLEAN_DIFF, "--format", "xml");

        assertThat(exitCode).isEqualTo(2);
        assertThat(err.toString()).contains("Unknown format: xml");
    }

    @Test
    void scan_overridesWithoutCredential_areRejected() throws IOException {
        Path overrides = tempDir.resolve("overrides.json");
        Files.writeString(overrides, "{\"disableRuleIds\": [\"hardcoded-secret\"]}");

        int exitCode = run(SECRET_DIFF, "--overrides", overrides.toString());

        assertThat(exitCode).isEqualTo(2);
        assertThat(err.toString()).contains("overrides are only available for authenticated requests");
    }

    @Test
    void scan_overridesWithCredentialFromEnvironment_areApplied() throws IOException {
        Path overrides = tempDir.resolve("overrides.json");
        Files.writeString(overrides, "{\"disableRuleIds\": [\"hardcoded-secret\"]}");
        Map<String, String> environment = Map.of(
            "THREATLENS_API_KEY", "team-secret",
            ScanCommand.ENV_CLIENT_KEY, "team-secret");

        int exitCode = run(SECRET_DIFF, environment, "--overrides", overrides.toString());

        assertThat(exitCode).isZero();
        assertThat(out.toString()).startsWith("No risky patterns found in added lines.");
    }

    @Test
    void scan_advisoryWithoutProviderKey_reportsDisabledAdvisory() {
        int exitCode = run(SECRET_DIFF, "--advisory", "always");

        assertThat(exitCode).isEqualTo(1);
        assertThat(out.toString())
            .contains("Advisory: mode=always, attempted=false, findingsAdded=0 (OPENROUTER_API_KEY is not configured)");
    }

    @Test
    void scan_missingInputFile_exitsTwo() {
        int exitCode = run("", "--input", tempDir.resolve("missing.patch").toString());

        assertThat(exitCode).isEqualTo(2);
        assertThat(err.toString()).contains("Could not read input");
    }

    @Test
    void scan_uppercaseFormat_isAcceptedUnderTurkishLocale() throws IOException {
        Locale previous = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
        try {
            int exitCode = run(SECRET_DIFF, "--format", "JSON");

            assertThat(exitCode).isEqualTo(1);
            assertThat(new ObjectMapper().readTree(out.toString()).path("shouldBlock").asBoolean()).isTrue();
        } finally {
            Locale.setDefault(previous);
        }
    }
}
