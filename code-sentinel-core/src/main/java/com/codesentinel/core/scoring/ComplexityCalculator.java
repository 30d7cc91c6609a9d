package com.codesentinel.core.scoring;

import com.codesentinel.core.model.CodeMetrics;
import com.codesentinel.core.model.ComplexityMetrics;
import com.codesentinel.core.model.Construct;
import com.codesentinel.core.model.LineContext;
import com.codesentinel.core.structure.ConstructPatterns;

import java.util.List;

/**
 * Cyclomatic complexity and maintainability index, computed purely from line facts.
 *
 * <p>Cyclomatic complexity is {@code 1} plus one per {@code if}/{@code elif}, loop
 * header, {@code except} clause and {@code and}/{@code or} operator.
 *
 * <p>The maintainability index uses the published formula
 * {@code 171 - 5.2 ln(V) - 0.23 CC - 16.2 ln(LOC) + 50 sin(sqrt(2.4 r))},
 * with {@code V} from {@link HalsteadEstimator} and {@code r} the comment ratio,
 * rescaled to {@code [0, 100]} and rounded to two decimals.
 *
 * @since 1.0.0
 */
public final class ComplexityCalculator {

    private static final double MI_SCALE = 100.0 / 171.0;

    private ComplexityCalculator() {
        // Utility class
    }

    /**
     * Computes both complexity metrics.
     *
     * @param lines line facts
     * @param codeMetrics line counts of the same unit
     * @return complexity metrics
     */
    public static ComplexityMetrics calculate(List<LineContext> lines, CodeMetrics codeMetrics) {
        int cyclomatic = cyclomaticComplexity(lines);
        double volume = HalsteadEstimator.volume(lines);
        return new ComplexityMetrics(
            cyclomatic,
            maintainabilityIndex(volume, cyclomatic, codeMetrics.codeLines(), codeMetrics.commentRatio())
        );
    }

    public static int cyclomaticComplexity(List<LineContext> lines) {
        int complexity = 1;
        for (LineContext line : lines) {
            if (line.has(Construct.CONDITIONAL)) {
                complexity++;
            }
            if (line.has(Construct.LOOP)) {
                complexity++;
            }
            if (line.has(Construct.EXCEPTION_HANDLER)) {
                complexity++;
            }
            if (line.has(Construct.BOOLEAN_OPERATOR)) {
                complexity += ConstructPatterns.countBooleanOperators(line.codeText());
            }
        }
        return complexity;
    }

    /**
     * Computes the rescaled maintainability index.
     *
     * @param volume Halstead volume
     * @param cyclomatic cyclomatic complexity
     * @param linesOfCode code lines
     * @param commentRatio comment lines over code and comment lines, in {@code [0, 1]}
     * @return index in {@code [0, 100]}, 100 for a unit without code
     */
    public static double maintainabilityIndex(double volume, int cyclomatic, int linesOfCode, double commentRatio) {
        if (linesOfCode <= 0) {
            return 100.0;
        }
        double raw = 171.0
            - 5.2 * Math.log(Math.max(1.0, volume))
            - 0.23 * cyclomatic
            - 16.2 * Math.log(linesOfCode)
            + 50.0 * Math.sin(Math.sqrt(2.4 * Math.max(0.0, commentRatio)));
        double scaled = Math.max(0.0, Math.min(100.0, raw * MI_SCALE));
        return Math.round(scaled * 100.0) / 100.0;
    }
}
