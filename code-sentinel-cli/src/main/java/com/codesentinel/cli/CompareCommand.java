package com.codesentinel.cli;

import com.codesentinel.core.analysis.CodeAnalyzer;
import com.codesentinel.core.config.SentinelConfig;
import com.codesentinel.core.model.AnalysisOptions;
import com.codesentinel.core.model.ComparisonResult;
import com.codesentinel.core.model.SourceUnit;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command to compare two versions of the same source file.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * codesentinel compare old/app.py new/app.py
 * codesentinel compare old/app.py new/app.py -f json
 * }</pre>
 */
@Command(
    name = "compare",
    description = "Compare the analysis of two versions of a file",
    mixinStandardHelpOptions = true
)
public class CompareCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(CompareCommand.class);

    @Parameters(index = "0", description = "Original version")
    private Path before;

    @Parameters(index = "1", description = "Changed version")
    private Path after;

    @Option(
        names = {"--only"},
        split = ",",
        description = "Categories to scan"
    )
    private List<String> only;

    @Option(
        names = {"--skip"},
        split = ",",
        description = "Categories to leave out"
    )
    private List<String> skip;

    @Option(
        names = {"-f", "--format"},
        description = "Output format: text or json (default: text)",
        defaultValue = "text"
    )
    private String format;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: codesentinel.yaml if present)"
    )
    private Path configPath;

    @Override
    public Integer call() {
        try {
            SentinelConfig config = AnalyzeCommand.loadConfiguration(configPath);
            AnalysisOptions options = CategorySelection.resolve(config.analysis().toOptions(), only, skip);

            SourceUnit beforeUnit = SourceUnit.of(Files.readString(before), before.getFileName().toString());
            SourceUnit afterUnit = SourceUnit.of(Files.readString(after), after.getFileName().toString());

            ComparisonResult result = CodeAnalyzer.fromConfig(config).compare(beforeUnit, afterUnit, options);

            if ("json".equalsIgnoreCase(format)) {
                System.out.println(new ObjectMapper()
                    .enable(SerializationFeature.INDENT_OUTPUT)
                    .writeValueAsString(result));
            } else {
                printText(result);
            }
            return 0;

        } catch (IOException | IllegalArgumentException e) {
            log.error("Comparison failed", e);
            System.err.println("✗ Comparison failed: " + e.getMessage());
            return 1;
        }
    }

    private void printText(ComparisonResult result) {
        System.out.println("Comparison: " + before + " -> " + after);
        System.out.println();
        System.out.printf("  Issues:       %d -> %d%n",
            result.before().totalIssues(), result.after().totalIssues());
        System.out.printf("  Security:     %d -> %d (%+d)%n",
            result.before().securityScore(), result.after().securityScore(), result.securityImprovement());
        System.out.printf("  Performance:  %d -> %d (%+d)%n",
            result.before().performanceScore(), result.after().performanceScore(), result.performanceImprovement());
        System.out.printf("  Complexity:   %+d%n", result.complexityChange());
        System.out.println();
        System.out.println(result.summary());
    }
}
