package com.stubforge;

import ch.qos.logback.classic.Level;
import com.stubforge.cli.GenerateCommand;
import com.stubforge.cli.ListCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

/**
 * Main CLI entry point for StubForge.
 *
 * <p>StubForge turns stub generator text (the small input-format language of puzzle
 * statements) into starter code that reads the input and prints placeholder output.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code generate} - Generate a stub in one language</li>
 *   <li>{@code list} - List available languages or rewrite passes</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all output except errors</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * # Generate a Python stub from a file
 * stubforge generate python -f stub.txt
 *
 * # Generate from standard input with debug logging
 * cat stub.txt | stubforge -v generate ruby
 *
 * # List bundled and user languages
 * stubforge list languages
 * }</pre>
 */
@Command(
    name = "stubforge",
    mixinStandardHelpOptions = true,
    version = "StubForge 1.0.0-SNAPSHOT",
    description = "Generates starter code from stub generator text",
    subcommands = {
        GenerateCommand.class,
        ListCommand.class
    }
)
public class StubForgeCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(StubForgeCLI.class);

    @Spec
    private CommandSpec spec;

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)",
        scope = CommandLine.ScopeType.INHERIT)
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors",
        scope = CommandLine.ScopeType.INHERIT)
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return;
        }
        spec.commandLine().getOut().println("StubForge - stub generator");
        spec.commandLine().getOut().println("Use 'stubforge --help' to see available commands");
    }

    /**
     * Configures the root logger level based on global options.
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
     * Builds the command line with logging configured before any subcommand runs.
     *
     * @return configured command line
     */
    public static CommandLine commandLine() {
        StubForgeCLI cli = new StubForgeCLI();
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
