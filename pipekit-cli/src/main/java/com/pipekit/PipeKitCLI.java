package com.pipekit;

import ch.qos.logback.classic.Level;
import com.pipekit.cli.ListCommand;
import com.pipekit.cli.ParseCommand;
import com.pipekit.cli.TrainCommand;
import com.pipekit.cli.ValidateCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Main CLI entry point for PipeKit.
 *
 * <p>PipeKit assembles text-processing pipelines from pluggable components, validates
 * them before anything runs, trains them and parses texts with the trained model.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code list} - List available components or pipeline templates</li>
 *   <li>{@code validate} - Validate the component registry and a pipeline configuration</li>
 *   <li>{@code train} - Train a pipeline and persist the model</li>
 *   <li>{@code parse} - Parse a text with a persisted model</li>
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
 * # Check that the configured pipeline resolves
 * pipekit validate pipekit.yaml
 *
 * # Train and persist
 * pipekit train data/training.json -c pipekit.yaml -o models/current
 *
 * # Parse a text
 * pipekit parse models/current "show me chinese restaurants"
 * }</pre>
 */
@Command(
    name = "pipekit",
    mixinStandardHelpOptions = true,
    version = "PipeKit 1.0.0-SNAPSHOT",
    description = "Component pipeline assembly, validation and execution",
    subcommands = {
        ListCommand.class,
        ValidateCommand.class,
        TrainCommand.class,
        ParseCommand.class
    }
)
public class PipeKitCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(PipeKitCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        configureLogging();

        if (quiet) {
            return; // Suppress banner in quiet mode
        }

        System.out.println("PipeKit - Component Pipeline Runtime");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'pipekit --help' to see available commands");
        System.out.println("Use 'pipekit <command> --help' for command-specific help");
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
        log.debug("Root log level set to {}", root.getLevel());
    }

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Creates the command line with the logging options applied before any subcommand runs.
     *
     * @return configured command line
     */
    public static CommandLine commandLine() {
        PipeKitCLI cli = new PipeKitCLI();
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
