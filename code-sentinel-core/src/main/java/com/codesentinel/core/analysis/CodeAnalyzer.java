package com.codesentinel.core.analysis;

import com.codesentinel.core.config.SentinelConfig;
import com.codesentinel.core.exception.InvalidSourceException;
import com.codesentinel.core.fix.FixSuggestionEngine;
import com.codesentinel.core.fix.SuggestionOutcome;
import com.codesentinel.core.model.AnalysisOptions;
import com.codesentinel.core.model.AnalysisReport;
import com.codesentinel.core.model.AnalysisRequest;
import com.codesentinel.core.model.BatchEntry;
import com.codesentinel.core.model.BatchReport;
import com.codesentinel.core.model.CodeMetrics;
import com.codesentinel.core.model.ComparisonResult;
import com.codesentinel.core.model.ComplexityMetrics;
import com.codesentinel.core.model.Issue;
import com.codesentinel.core.model.LineContext;
import com.codesentinel.core.model.RuleFault;
import com.codesentinel.core.model.SourceUnit;
import com.codesentinel.core.report.ReportComparator;
import com.codesentinel.core.report.ResultAggregator;
import com.codesentinel.core.rule.RuleRegistry;
import com.codesentinel.core.scanner.ScanEngine;
import com.codesentinel.core.scanner.ScanOutcome;
import com.codesentinel.core.scoring.CodeMetricsCalculator;
import com.codesentinel.core.scoring.ComplexityCalculator;
import com.codesentinel.core.scoring.ScoringEngine;
import com.codesentinel.core.structure.StructuralExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Entry point of the analysis engine.
 *
 * <p>Runs the pipeline validate, extract, scan, fix, score, aggregate. Only an invalid
 * source unit (empty, blank, binary or undecodable) yields {@code success=false}; every
 * other fault is absorbed by the stage that owns it. A {@link CodeAnalyzer} is immutable
 * and safe to share between threads.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * CodeAnalyzer analyzer = new CodeAnalyzer();
 * AnalysisReport report = analyzer.analyze(
 *     SourceUnit.of("password = \"admin123\""),
 *     AnalysisOptions.of(Category.SECURITY));
 * }</pre>
 *
 * @since 1.0.0
 */
public class CodeAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(CodeAnalyzer.class);

    /**
     * Largest number of units accepted by {@link #analyzeBatch(List, AnalysisOptions)}.
     */
    public static final int MAX_BATCH_SIZE = 20;

    private final StructuralExtractor extractor;
    private final ScanEngine scanEngine;
    private final FixSuggestionEngine fixEngine;
    private final ScoringEngine scoringEngine;
    private final ResultAggregator aggregator;
    private final ReportComparator comparator;

    /**
     * Creates an analyzer over the default rule registry, default weights and sequential scanning.
     */
    public CodeAnalyzer() {
        this(RuleRegistry.defaultRegistry(), new ScoringEngine(), 1);
    }

    public CodeAnalyzer(RuleRegistry registry) {
        this(registry, new ScoringEngine(), 1);
    }

    /**
     * Creates an analyzer.
     *
     * @param registry rule catalog
     * @param scoringEngine scoring engine
     * @param parallelism category passes run at once
     */
    public CodeAnalyzer(RuleRegistry registry, ScoringEngine scoringEngine, int parallelism) {
        Objects.requireNonNull(registry, "registry must not be null");
        this.extractor = new StructuralExtractor();
        this.scanEngine = new ScanEngine(registry, parallelism);
        this.fixEngine = new FixSuggestionEngine();
        this.scoringEngine = Objects.requireNonNull(scoringEngine, "scoringEngine must not be null");
        this.aggregator = new ResultAggregator(registry);
        this.comparator = new ReportComparator();
    }

    /**
     * Creates an analyzer from configuration, over the default rule registry.
     *
     * @param config configuration
     * @return analyzer
     */
    public static CodeAnalyzer fromConfig(SentinelConfig config) {
        return new CodeAnalyzer(
            RuleRegistry.defaultRegistry(),
            new ScoringEngine(config.scoring().weights().toSeverityWeights()),
            config.engine().parallelism()
        );
    }

    public RuleRegistry registry() {
        return scanEngine.registry();
    }

    /**
     * Analyzes one source unit.
     *
     * @param unit source unit
     * @param options enabled categories
     * @return report; {@code success=false} only for an invalid unit
     * @throws com.codesentinel.core.exception.ScanExecutionException if a parallel scan
     *         worker fails or the calling thread is interrupted
     */
    public AnalysisReport analyze(SourceUnit unit, AnalysisOptions options) {
        Objects.requireNonNull(unit, "unit must not be null");
        Objects.requireNonNull(options, "options must not be null");

        try {
            validate(unit);
        } catch (InvalidSourceException e) {
            log.warn("Rejected source {}: {}", unit.fileNameOr("<input>"), e.getMessage());
            return AnalysisReport.failed(unit.fileName(), e.getMessage());
        }

        long start = System.nanoTime();
        List<LineContext> lines = extractor.extract(unit);
        ScanOutcome outcome = scanEngine.scan(lines, options);
        SuggestionOutcome suggestions = fixEngine.build(outcome.matches());
        List<Issue> issues = suggestions.issues();
        List<RuleFault> faults = new ArrayList<>(outcome.faults());
        faults.addAll(suggestions.faults());

        Map<String, Integer> categoryScores = scoringEngine.categoryScores(issues);
        CodeMetrics codeMetrics = CodeMetricsCalculator.calculate(lines);
        ComplexityMetrics complexityMetrics = ComplexityCalculator.calculate(lines, codeMetrics);

        AnalysisReport report = aggregator.aggregate(
            unit.fileName(), issues, categoryScores, complexityMetrics, codeMetrics, faults);

        log.info("Analyzed {} ({} lines, {} categories): {} issues, {} rule faults in {} ms",
            unit.fileNameOr("<input>"), lines.size(), outcome.scannedCategories().size(),
            report.totalIssues(), faults.size(), (System.nanoTime() - start) / 1_000_000);
        return report;
    }

    /**
     * Analyzes a boundary request.
     *
     * @param request request with code, file name and category switches
     * @return report
     */
    public AnalysisReport analyze(AnalysisRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        return analyze(request.toSourceUnit(), request.options().toOptions());
    }

    /**
     * Decodes raw bytes as UTF-8 and analyzes them.
     *
     * @param content raw file content
     * @param fileName file name, may be null
     * @param options enabled categories
     * @return report; {@code success=false} when the bytes are not text
     */
    public AnalysisReport analyzeBytes(byte[] content, String fileName, AnalysisOptions options) {
        SourceUnit unit;
        try {
            unit = SourceUnit.decode(content, fileName);
        } catch (InvalidSourceException e) {
            log.warn("Rejected source {}: {}", fileName, e.getMessage());
            return AnalysisReport.failed(fileName, e.getMessage());
        }
        return analyze(unit, options);
    }

    /**
     * Analyzes several units with the same options.
     *
     * <p>A unit that cannot be analyzed is recorded as a failed entry; it never aborts
     * the rest of the batch.
     *
     * @param units at most {@link #MAX_BATCH_SIZE} units
     * @param options enabled categories
     * @return batch report in submission order
     * @throws IllegalArgumentException if more than {@link #MAX_BATCH_SIZE} units are given
     */
    public BatchReport analyzeBatch(List<SourceUnit> units, AnalysisOptions options) {
        Objects.requireNonNull(units, "units must not be null");
        if (units.size() > MAX_BATCH_SIZE) {
            throw new IllegalArgumentException(
                "Maximum " + MAX_BATCH_SIZE + " files per batch, got " + units.size());
        }

        List<BatchEntry> entries = new ArrayList<>(units.size());
        for (int i = 0; i < units.size(); i++) {
            SourceUnit unit = units.get(i);
            String fileName = unit == null ? batchFileName(i) : unit.fileNameOr(batchFileName(i));
            try {
                AnalysisReport report = analyze(unit, options);
                entries.add(new BatchEntry(i, fileName, report, report.success() ? null : report.summary()));
            } catch (RuntimeException e) {
                log.error("Batch entry {} ({}) failed: {}", i, fileName, e.getMessage());
                entries.add(new BatchEntry(i, fileName, null, e.getMessage() == null ? e.toString() : e.getMessage()));
            }
        }

        BatchReport batch = BatchReport.of(entries);
        log.info("Batch analyzed: {} processed, {} successful, {} failed",
            batch.totalProcessed(), batch.successful(), batch.failed());
        return batch;
    }

    /**
     * Analyzes two versions of the same code and compares the reports.
     *
     * @param before original version
     * @param after changed version
     * @param options enabled categories, used for both
     * @return comparison
     */
    public ComparisonResult compare(SourceUnit before, SourceUnit after, AnalysisOptions options) {
        return comparator.compare(analyze(before, options), analyze(after, options));
    }

    private void validate(SourceUnit unit) {
        String text = unit.text();
        if (text.isBlank()) {
            throw new InvalidSourceException("Source text is empty");
        }
        if (text.indexOf('\0') >= 0) {
            throw new InvalidSourceException("Source contains NUL characters and is not text");
        }
    }

    private static String batchFileName(int index) {
        return "file_" + index + ".py";
    }
}
