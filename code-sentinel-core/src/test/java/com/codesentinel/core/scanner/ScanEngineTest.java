package com.codesentinel.core.scanner;

import com.codesentinel.core.model.AnalysisOptions;
import com.codesentinel.core.model.Category;
import com.codesentinel.core.model.LineContext;
import com.codesentinel.core.model.RuleFault;
import com.codesentinel.core.model.Severity;
import com.codesentinel.core.model.SourceUnit;
import com.codesentinel.core.rule.PatternMatcher;
import com.codesentinel.core.rule.Rule;
import com.codesentinel.core.rule.RuleRegistry;
import com.codesentinel.core.rule.StructuralPredicate;
import com.codesentinel.core.structure.StructuralExtractor;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link ScanEngine}.
 */
class ScanEngineTest {

    private static final String SAMPLE = """
        import os
        password = "admin123"
        def load(items=[]):
            result = []
            for i in range(len(items)):
                result += [items[i]]
            return result
            print("never")
        if x > 1
            y = eval(data)
        """;

    private static List<LineContext> lines(String code) {
        return new StructuralExtractor().extract(SourceUnit.of(code));
    }

    @Test
    void scan_throwingRule_isRecordedAsFaultAndOtherRulesStillRun() {
        // Given: one rule that throws on line 2 and one that always fires
        Rule faulty = new Rule("faulty", Category.QUALITY, Severity.INFO,
            new StructuralPredicate(line -> {
                if (line.lineNumber() == 2) {
                    throw new IllegalStateException("boom");
                }
                return false;
            }), null, "faulty", null);
        Rule healthy = new Rule("healthy", Category.QUALITY, Severity.INFO,
            PatternMatcher.of("."), null, "healthy", null);
        ScanEngine engine = new ScanEngine(RuleRegistry.of(faulty, healthy));

        // When
        ScanOutcome outcome = engine.scan(lines("a = 1\nb = 2\nc = 3"), AnalysisOptions.all());

        // Then: only the (faulty, line 2) pair is lost
        assertThat(outcome.faults()).hasSize(1);
        RuleFault fault = outcome.faults().get(0);
        assertThat(fault.ruleId()).isEqualTo("faulty");
        assertThat(fault.lineNumber()).isEqualTo(2);
        assertThat(fault.message()).contains("boom");
        assertThat(outcome.matches()).extracting(RuleMatch::lineNumber).containsExactly(1, 2, 3);
    }

    @Test
    void scan_disabledCategory_isNeverEvaluated() {
        AtomicInteger securityCalls = new AtomicInteger();
        Rule security = new Rule("sec", Category.SECURITY, Severity.CRITICAL,
            new StructuralPredicate(line -> {
                securityCalls.incrementAndGet();
                return true;
            }), null, "sec", null);
        Rule performance = new Rule("perf", Category.PERFORMANCE, Severity.INFO,
            PatternMatcher.of("x"), null, "perf", null);
        ScanEngine engine = new ScanEngine(RuleRegistry.of(security, performance));

        ScanOutcome outcome = engine.scan(lines("x = 1\ny = 2"), AnalysisOptions.of(Category.PERFORMANCE));

        assertThat(securityCalls).hasValue(0);
        assertThat(outcome.scannedCategories()).containsExactly(Category.PERFORMANCE);
        assertThat(outcome.matches()).extracting(match -> match.rule().id()).containsExactly("perf");
    }

    @Test
    void scan_noEnabledCategory_returnsEmptyOutcome() {
        ScanEngine engine = new ScanEngine(RuleRegistry.defaultRegistry());

        ScanOutcome outcome = engine.scan(lines(SAMPLE), AnalysisOptions.of());

        assertThat(outcome.matches()).isEmpty();
        assertThat(outcome.scannedCategories()).isEmpty();
    }

    @Test
    void scan_parallel_matchesSequential() {
        List<LineContext> lines = lines(SAMPLE);
        ScanEngine sequential = new ScanEngine(RuleRegistry.defaultRegistry(), 1);
        ScanEngine parallel = new ScanEngine(RuleRegistry.defaultRegistry(), 4);

        ScanOutcome expected = sequential.scan(lines, AnalysisOptions.all());
        ScanOutcome actual = parallel.scan(lines, AnalysisOptions.all());

        assertThat(expected.matches()).isNotEmpty();
        assertThat(actual).isEqualTo(expected);
    }

    @Test
    void constructor_rejectsNonPositiveParallelism() {
        assertThatThrownBy(() -> new ScanEngine(RuleRegistry.defaultRegistry(), 0))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
