package com.codesentinel.cli;

import com.codesentinel.core.analysis.CodeAnalyzer;
import com.codesentinel.core.config.SentinelConfig;
import com.codesentinel.core.model.AnalysisOptions;
import com.codesentinel.core.model.BatchEntry;
import com.codesentinel.core.model.BatchReport;
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
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command to analyze up to {@value CodeAnalyzer#MAX_BATCH_SIZE} files with the same options.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * codesentinel batch a.py b.py c.py --only security
 * codesentinel batch src/*.py -f json
 * }</pre>
 */
@Command(
    name = "batch",
    description = "Analyze several source files with the same options",
    mixinStandardHelpOptions = true
)
public class BatchCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(BatchCommand.class);

    @Parameters(
        arity = "1..*",
        description = "Source files to analyze"
    )
    private List<Path> files;

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
        names = {"-o", "--output"},
        description = "Write the result to this file instead of stdout"
    )
    private Path output;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: codesentinel.yaml if present)"
    )
    private Path configPath;

    @Override
    public Integer call() {
        try {
            if (!"text".equalsIgnoreCase(format) && !"json".equalsIgnoreCase(format)) {
                System.err.println("✗ Unknown format: " + format + ". Use: text or json");
                return 1;
            }
            if (files.size() > CodeAnalyzer.MAX_BATCH_SIZE) {
                System.err.println("✗ Maximum " + CodeAnalyzer.MAX_BATCH_SIZE
                    + " files per batch, got " + files.size());
                return 1;
            }

            SentinelConfig config = AnalyzeCommand.loadConfiguration(configPath);
            AnalysisOptions options = CategorySelection.resolve(config.analysis().toOptions(), only, skip);

            List<SourceUnit> units = new ArrayList<>(files.size());
            for (Path file : files) {
                log.debug("Reading {}", file);
                units.add(SourceUnit.of(Files.readString(file), file.getFileName().toString()));
            }

            BatchReport batch = CodeAnalyzer.fromConfig(config).analyzeBatch(units, options);
            String rendered = "json".equalsIgnoreCase(format) ? toJson(batch) : toText(batch);
            AnalyzeCommand.writeOutput(rendered, output);

            return batch.failed() > 0 ? 1 : 0;

        } catch (IOException | IllegalArgumentException e) {
            log.error("Batch analysis failed", e);
            System.err.println("✗ Batch analysis failed: " + e.getMessage());
            return 1;
        }
    }

    private static String toJson(BatchReport batch) throws IOException {
        return new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .writeValueAsString(batch);
    }

    static String toText(BatchReport batch) {
        StringBuilder sb = new StringBuilder();
        for (BatchEntry entry : batch.results()) {
            if (entry.success()) {
                sb.append("[OK] ").append(entry.fileName()).append(": ")
                    .append(entry.report().summary()).append('\n');
            } else {
                sb.append("[FAILED] ").append(entry.fileName()).append(": ")
                    .append(entry.error()).append('\n');
            }
        }
        sb.append('\n')
            .append("Processed: ").append(batch.totalProcessed())
            .append(", successful: ").append(batch.successful())
            .append(", failed: ").append(batch.failed())
            .append('\n');
        return sb.toString();
    }
}
