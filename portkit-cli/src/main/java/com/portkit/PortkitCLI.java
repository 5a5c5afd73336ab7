package com.portkit;

import com.portkit.cli.PlanCommand;
import com.portkit.cli.ResetCommand;
import com.portkit.cli.RunCommand;
import com.portkit.cli.StatusCommand;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ch.qos.logback.classic.Level;

/**
 * Main CLI entry point for PortKit.
 *
 * <p>PortKit ports a codebase one symbol at a time: it orders symbols by their
 * dependencies, asks a generation backend for each unit's artifacts, validates
 * them by compiling and differential testing, and checkpoints every step so an
 * interrupted run can resume.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code run} - Start or resume porting</li>
 *   <li>{@code plan} - Validate the symbol facts and print the processing order</li>
 *   <li>{@code status} - Show checkpointed unit status</li>
 *   <li>{@code reset} - Force units back to unstarted</li>
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
 * # Show the processing order
 * portkit plan
 *
 * # Port with four units in flight
 * portkit run --concurrency 4
 *
 * # Retry a unit from scratch
 * portkit reset ZopfliGetLengthSymbol
 * }</pre>
 */
@Command(
    name = "portkit",
    mixinStandardHelpOptions = true,
    version = "PortKit 1.0.0-SNAPSHOT",
    description = "Incremental, dependency-ordered code porting with checkpoint/resume",
    subcommands = {
        RunCommand.class,
        PlanCommand.class,
        StatusCommand.class,
        ResetCommand.class
    }
)
public class PortkitCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(PortkitCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)", scope = CommandLine.ScopeType.INHERIT)
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors", scope = CommandLine.ScopeType.INHERIT)
    private boolean quiet;

    @Override
    public void run() {
        configureLogging();

        if (quiet) {
            return;
        }

        System.out.println("PortKit - Incremental Code Porting Orchestrator");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'portkit --help' to see available commands");
        System.out.println("Use 'portkit <command> --help' for command-specific help");
    }

    /**
     * Configures logging level based on global options.
     */
    void configureLogging() {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.INFO);
        }
        log.debug("Logging configured (verbose={}, quiet={})", verbose, quiet);
    }

    /**
     * Creates the command line with logging configured before any subcommand runs.
     *
     * @return configured command line
     */
    public static CommandLine commandLine() {
        PortkitCLI cli = new PortkitCLI();
        CommandLine commandLine = new CommandLine(cli);
        commandLine.setExecutionStrategy(parseResult -> {
            cli.configureLogging();
            return new CommandLine.RunLast().execute(parseResult);
        });
        return commandLine;
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
