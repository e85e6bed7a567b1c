package com.threatlens;

import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ThreatLensCLI}.
 */
class ThreatLensCLITest {

    @Test
    void commandLine_registersSubcommands() {
        assertThat(ThreatLensCLI.commandLine().getSubcommands()).containsOnlyKeys("scan", "packs");
    }

    @Test
    void execute_packsSubcommand_runsWithGlobalQuietFlag() {
        StringWriter out = new StringWriter();
        CommandLine commandLine = ThreatLensCLI.commandLine();
        commandLine.getSubcommands().get("packs").setOut(new PrintWriter(out));

        int exitCode = commandLine.execute("-q", "packs");

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("startup-default");
        assertThat(commandLine.<ThreatLensCLI>getCommand().isQuiet()).isTrue();
    }

    @Test
    void execute_verboseFlag_isParsed() {
        CommandLine commandLine = ThreatLensCLI.commandLine();
        commandLine.getSubcommands().get("packs").setOut(new PrintWriter(new StringWriter()));

        commandLine.execute("--verbose", "packs");

        assertThat(commandLine.<ThreatLensCLI>getCommand().isVerbose()).isTrue();
    }
}
