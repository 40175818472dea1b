package com.qualitygate;

import ch.qos.logback.classic.Level;
import com.qualitygate.cli.CacheCommand;
import com.qualitygate.cli.CheckCommand;
import com.qualitygate.cli.ValidateCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Main CLI entry point for QualityGate.
 *
 * <p>QualityGate runs code quality, test coverage, architecture and security analyzers
 * concurrently over a project, folds their results into one weighted score and fails the
 * build when the score is below the passing threshold.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code check} - Analyze a project and report the quality score</li>
 *   <li>{@code cache} - Show statistics of, clear or clean up the result cache</li>
 *   <li>{@code validate} - Validate the configuration file</li>
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
 * # Check the current directory
 * quality-gate check
 *
 * # Check with verbose output
 * quality-gate -v check ../storefront
 *
 * # Drop expired cache entries
 * quality-gate cache cleanup
 * }</pre>
 */
@Command(
    name = "quality-gate",
    mixinStandardHelpOptions = true,
    version = "QualityGate 1.0.0-SNAPSHOT",
    description = "Automated code quality gate with weighted scoring",
    subcommands = {
        CheckCommand.class,
        CacheCommand.class,
        ValidateCommand.class
    }
)
public class QualityGateCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(QualityGateCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return;
        }

        System.out.println("QualityGate - Automated Code Quality Gate");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'quality-gate --help' to see available commands");
        System.out.println("Use 'quality-gate <command> --help' for command-specific help");
    }

    /**
     * Configures the logging level from the global options.
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

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Creates the command line, applying the global logging options before any subcommand runs.
     *
     * @return configured command line
     */
    public static CommandLine commandLine() {
        QualityGateCLI cli = new QualityGateCLI();
        CommandLine commandLine = new CommandLine(cli);
        commandLine.setCaseInsensitiveEnumValuesAllowed(true);
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
