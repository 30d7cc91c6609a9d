package com.codesentinel;

import ch.qos.logback.classic.Level;
import com.codesentinel.cli.AnalyzeCommand;
import com.codesentinel.cli.BatchCommand;
import com.codesentinel.cli.CompareCommand;
import com.codesentinel.cli.ListCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Main CLI entry point for CodeSentinel.
 *
 * <p>CodeSentinel statically analyzes Python source for security vulnerabilities,
 * performance bottlenecks, code smells, complexity and syntax problems, scores the
 * result and proposes deterministic fixes.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code analyze} - Analyze one file or a JSON analysis request</li>
 *   <li>{@code batch} - Analyze up to 20 files</li>
 *   <li>{@code compare} - Compare two versions of the same code</li>
 *   <li>{@code list} - List rules, categories, or renderers</li>
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
 * # Analyze a file, security checks only
 * codesentinel analyze app.py --only security
 *
 * # Fail a CI step on any error or worse
 * codesentinel analyze app.py --fail-on error
 *
 * # List the rule catalog
 * codesentinel list rules
 * }</pre>
 */
@Command(
    name = "codesentinel",
    mixinStandardHelpOptions = true,
    version = "CodeSentinel 1.0.0-SNAPSHOT",
    description = "Deterministic static analysis for Python source code",
    subcommands = {
        AnalyzeCommand.class,
        BatchCommand.class,
        CompareCommand.class,
        ListCommand.class
    }
)
public class CodeSentinelCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(CodeSentinelCLI.class);

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

        System.out.println("CodeSentinel - Deterministic Static Code Analysis");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'codesentinel --help' to see available commands");
        System.out.println("Use 'codesentinel <command> --help' for command-specific help");
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
        log.debug("Logging configured (verbose: {}, quiet: {})", verbose, quiet);
    }

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Builds the command line with the global logging options applied before any
     * subcommand runs.
     *
     * @return configured command line
     */
    public static CommandLine commandLine() {
        CodeSentinelCLI cli = new CodeSentinelCLI();
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
