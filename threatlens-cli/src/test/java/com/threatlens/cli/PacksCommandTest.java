package com.threatlens.cli;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.threatlens.core.config.ThreatLensConfig;
import com.threatlens.core.service.PolicyPackListing;
import com.threatlens.core.service.ScanService;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link PacksCommand}.
 */
class PacksCommandTest {

    private final StringWriter out = new StringWriter();

    private int run(String... args) {
        CommandLine commandLine = new CommandLine(new PacksCommand());
        commandLine.setOut(new PrintWriter(out));
        return commandLine.execute(args);
    }

    @Test
    void packs_listsBundledPacks() {
        int exitCode = run();

        assertThat(exitCode).isZero();
        assertThat(out.toString())
            .contains("Available Policy Packs:")
            .contains("startup-default - Startup Default")
            .contains("tenant-isolation - Tenant Isolation Strict")
            .contains("Default fail-on: medium");
    }

    @Test
    void packs_json_writesListing() throws Exception {
        int exitCode = run("--json");

        JsonNode root = new ObjectMapper().readTree(out.toString());
        assertThat(exitCode).isZero();
        assertThat(root.isArray()).isTrue();
        assertThat(root.get(0).path("id").asText()).isEqualTo("startup-default");
        assertThat(root.get(0).path("defaultFailOn").asText()).isEqualTo("high");
        assertThat(root.get(1).path("description").asText()).startsWith("Stricter profile");
    }

    @Test
    void packs_json_matchesServiceListing() throws Exception {
        run("--json");

        List<PolicyPackListing> listed = new ObjectMapper().readValue(out.toString(),
            new TypeReference<List<PolicyPackListing>>() { });
        assertThat(listed).isEqualTo(ScanService.create(ThreatLensConfig.defaults()).listPacks());
    }
}
