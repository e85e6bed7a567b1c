package com.threatlens.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.threatlens.core.config.ThreatLensConfig;
import com.threatlens.core.service.PolicyPackListing;
import com.threatlens.core.service.ScanService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command to list the registered policy packs.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * threatlens packs
 * threatlens packs --json
 * }</pre>
 */
@Command(
    name = "packs",
    description = "List available policy packs",
    mixinStandardHelpOptions = true
)
public class PacksCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(PacksCommand.class);

    @Spec
    private CommandSpec spec;

    @Option(names = {"--json"}, description = "Print the packs as JSON")
    private boolean json;

    @Override
    public Integer call() throws JsonProcessingException {
        PrintWriter out = spec.commandLine().getOut();
        List<PolicyPackListing> packs = ScanService.create(ThreatLensConfig.defaults()).listPacks();
        log.debug("Listing {} policy packs", packs.size());

        if (json) {
            ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
            out.println(mapper.writeValueAsString(packs));
            out.flush();
            return 0;
        }

        out.println("Available Policy Packs:");
        out.println();
        for (PolicyPackListing pack : packs) {
            out.printf("  • %s - %s%n", pack.id(), pack.name());
            out.printf("    %s%n", pack.description());
            out.printf("    Default fail-on: %s%n", pack.defaultFailOn().literal());
            out.println();
        }
        out.flush();
        return 0;
    }
}
