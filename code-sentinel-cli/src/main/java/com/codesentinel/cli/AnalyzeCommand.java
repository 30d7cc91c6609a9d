package com.codesentinel.cli;

import com.codesentinel.core.analysis.CodeAnalyzer;
import com.codesentinel.core.config.ConfigLoader;
import com.codesentinel.core.config.SentinelConfig;
import com.codesentinel.core.model.AnalysisOptions;
import com.codesentinel.core.model.AnalysisReport;
import com.codesentinel.core.model.AnalysisRequest;
import com.codesentinel.core.model.Severity;
import com.codesentinel.core.report.render.RenderContext;
import com.codesentinel.core.report.render.ReportRenderer;
import com.codesentinel.core.report.render.ReportRenderers;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Command to analyze one source file or one JSON analysis request.
 *
 * <p><b>Exit codes:</b>
 * <ul>
 *   <li>0 - analysis succeeded (and no issue reached {@code --fail-on})</li>
 *   <li>1 - the source was invalid, unreadable, or the arguments were wrong</li>
 *   <li>2 - at least one issue at or above the {@code --fail-on} severity</li>
 * </ul>
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Analyze a file with the configured categories
 * codesentinel analyze app.py
 *
 * # Only security and performance, as JSON, into a file
 * codesentinel analyze app.py --only security,performance -f json -o report.json
 *
 * # Analyze a request document: {"code": "...", "file_name": "...", "options": {...}}
 * codesentinel analyze --request request.json
 * }</pre>
 */
@Command(
    name = "analyze",
    description = "Analyze a source file for issues",
    mixinStandardHelpOptions = true
)
public class AnalyzeCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(AnalyzeCommand.class);
    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_THRESHOLD = 2;

    @Parameters(
        index = "0",
        arity = "0..1",
        description = "Source file to analyze"
    )
    private Path file;

    @Option(
        names = {"--request"},
        description = "JSON analysis request instead of a source file"
    )
    private Path requestFile;

    @Option(
        names = {"--only"},
        split = ",",
        description = "Categories to scan (security, performance, quality, complexity, dead_code, type_hints, syntax)"
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
        description = "Output format: text, json, or markdown (default: from config, else text)"
    )
    private String format;

    @Option(
        names = {"-o", "--output"},
        description = "Write the report to this file instead of stdout"
    )
    private Path output;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: codesentinel.yaml if present)"
    )
    private Path configPath;

    @Option(
        names = {"--no-color"},
        description = "Disable ANSI colors in text output"
    )
    private boolean noColor;

    @Option(
        names = {"--fail-on"},
        description = "Exit with code 2 if an issue at or above this severity is found (critical, error, warning, info)"
    )
    private String failOn;

    @Override
    public Integer call() {
        try {
            if ((file == null) == (requestFile == null)) {
                System.err.println("✗ Specify either a source file or --request <file>");
                return EXIT_FAILED;
            }
            Severity threshold = failOn == null ? null : Severity.fromString(failOn);

            SentinelConfig config = loadConfiguration(configPath);
            String formatId = format != null ? format : config.output().format();
            Optional<ReportRenderer> renderer = ReportRenderers.byId(formatId);
            if (renderer.isEmpty()) {
                System.err.println("✗ Unknown format: " + formatId + ". Use: text, json, or markdown");
                return EXIT_FAILED;
            }

            CodeAnalyzer analyzer = CodeAnalyzer.fromConfig(config);
            AnalysisReport report = requestFile != null
                ? analyzeRequest(analyzer)
                : analyzeFile(analyzer, CategorySelection.resolve(config.analysis().toOptions(), only, skip));

            boolean colors = !noColor && output == null && config.output().colors();
            RenderContext context = new RenderContext(Map.of("console.colors", String.valueOf(colors)));
            writeOutput(renderer.get().render(report, context), output);

            if (!report.success()) {
                return EXIT_FAILED;
            }
            if (threshold != null && report.hasIssuesAtLeast(threshold)) {
                log.info("Found issues at or above {}", threshold.wireName());
                return EXIT_THRESHOLD;
            }
            return EXIT_OK;

        } catch (IOException | IllegalArgumentException e) {
            log.error("Analysis failed", e);
            System.err.println("✗ Analysis failed: " + e.getMessage());
            return EXIT_FAILED;
        }
    }

    private AnalysisReport analyzeFile(CodeAnalyzer analyzer, AnalysisOptions options) throws IOException {
        log.debug("Analyzing {} with categories {}", file, options.enabledCategories());
        byte[] content = Files.readAllBytes(file);
        return analyzer.analyzeBytes(content, file.getFileName().toString(), options);
    }

    private AnalysisReport analyzeRequest(CodeAnalyzer analyzer) throws IOException {
        log.debug("Reading analysis request from {}", requestFile);
        AnalysisRequest request = JSON_MAPPER.readValue(requestFile.toFile(), AnalysisRequest.class);
        return analyzer.analyze(request);
    }

    /**
     * Loads configuration from the given file, or from {@code codesentinel.yaml} in the
     * working directory when no file is given.
     */
    static SentinelConfig loadConfiguration(Path configPath) {
        if (configPath != null) {
            return ConfigLoader.load(configPath);
        }
        return ConfigLoader.loadFromDirectory(Paths.get("."));
    }

    static void writeOutput(String content, Path output) throws IOException {
        if (output == null) {
            System.out.print(content);
            if (!content.endsWith("\n")) {
                System.out.println();
            }
            return;
        }
        Path parent = output.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(output, content);
        log.info("Report written to {}", output);
    }
}
