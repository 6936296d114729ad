package com.codesentry;

import ch.qos.logback.classic.Level;
import com.codesentry.cli.AnalyzeCommand;
import com.codesentry.cli.HistoryCommand;
import com.codesentry.cli.ListCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Main CLI entry point for CodeSentry.
 *
 * <p>CodeSentry runs a set of static-analysis techniques over a project, reuses
 * results of unchanged files between runs and keeps a history of run metrics.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code analyze} - Analyze a project and print the findings</li>
 *   <li>{@code list} - List the available techniques</li>
 *   <li>{@code history} - Show aggregated metrics of previous runs</li>
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
 * # Analyze current directory
 * codesentry analyze
 *
 * # Analyze with the worker pool and verbose output
 * codesentry -v analyze --mode parallel /path/to/project
 *
 * # Show per-technique timings of previous runs
 * codesentry history
 * }</pre>
 */
@Command(
    name = "codesentry",
    mixinStandardHelpOptions = true,
    version = "CodeSentry 1.0.0-SNAPSHOT",
    description = "Static-analysis execution engine with incremental caching",
    subcommands = {
        AnalyzeCommand.class,
        ListCommand.class,
        HistoryCommand.class
    }
)
public class CodeSentryCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(CodeSentryCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return;
        }

        System.out.println("CodeSentry - Static-Analysis Execution Engine");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'codesentry --help' to see available commands");
        System.out.println("Use 'codesentry <command> --help' for command-specific help");
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
     * Returns whether verbose mode is enabled.
     *
     * @return true if verbose mode is enabled
     */
    public boolean isVerbose() {
        return verbose;
    }

    /**
     * Returns whether quiet mode is enabled.
     *
     * @return true if quiet mode is enabled
     */
    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Creates the command line with logging configured before any subcommand runs.
     *
     * @return command line ready to execute
     */
    public static CommandLine createCommandLine() {
        CodeSentryCLI cli = new CodeSentryCLI();
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
        int exitCode = createCommandLine().execute(args);
        System.exit(exitCode);
    }
}
