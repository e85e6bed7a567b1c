package com.threatlens;

import ch.qos.logback.classic.Level;
import com.threatlens.cli.PacksCommand;
import com.threatlens.cli.ScanCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Main CLI entry point for ThreatLens.
 *
 * <p>ThreatLens scans the added lines of a unified diff for risky security patterns and
 * decides whether the change should be blocked.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code scan} - Scan a diff from a file or stdin</li>
 *   <li>{@code packs} - List available policy packs</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all output except errors</li>
 *   <li>{@code --help} - Show help information</li>
 *   <li>{@code --version} - Show version information</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * # Scan the working tree changes
 * git diff | threatlens scan
 *
 * # Scan a patch file with a stricter pack and JSON output
 * threatlens scan --input change.patch --pack tenant-isolation --format json
 *
 * # List policy packs
 * threatlens packs
 * }</pre>
 */
@Command(
    name = "threatlens",
    mixinStandardHelpOptions = true,
    version = "ThreatLens 1.0.0-SNAPSHOT",
    description = "Security guardrail for pull request diffs",
    subcommands = {
        ScanCommand.class,
        PacksCommand.class
    }
)
public class ThreatLensCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(ThreatLensCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return;
        }

        System.out.println("ThreatLens - Security guardrail for pull request diffs");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'threatlens --help' to see available commands");
        System.out.println("Use 'threatlens <command> --help' for command-specific help");
    }

    /**
     * Applies the global logging switches, then runs the most specific command.
     *
     * @param parseResult parsed command line
     * @return exit code
     */
    private int executionStrategy(CommandLine.ParseResult parseResult) {
        configureLogging();
        log.debug("Logging configured (verbose={}, quiet={})", verbose, quiet);
        return new CommandLine.RunLast().execute(parseResult);
    }

    /**
     * Configures logging level based on global options.
     */
    private void configureLogging() {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.INFO);
        }
    }

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Builds the command line with the logging-aware execution strategy.
     *
     * @return configured command line
     */
    public static CommandLine commandLine() {
        ThreatLensCLI cli = new ThreatLensCLI();
        return new CommandLine(cli).setExecutionStrategy(cli::executionStrategy);
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }
}
