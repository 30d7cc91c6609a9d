package com.codesentinel.core.scoring;

import com.codesentinel.core.model.CodeMetrics;
import com.codesentinel.core.model.Construct;
import com.codesentinel.core.model.LineContext;

import java.util.List;

/**
 * Line counts for an analyzed unit.
 *
 * <p>A line is blank when it holds only whitespace, a comment line when it holds
 * only a comment or lies inside a multi-line string, and a code line otherwise.
 *
 * @since 1.0.0
 */
public final class CodeMetricsCalculator {

    private CodeMetricsCalculator() {
        // Utility class
    }

    public static CodeMetrics calculate(List<LineContext> lines) {
        int blank = 0;
        int comment = 0;
        int code = 0;
        for (LineContext line : lines) {
            if (line.isBlank()) {
                blank++;
            } else if (isCommentLine(line)) {
                comment++;
            } else {
                code++;
            }
        }
        int documented = code + comment;
        double ratio = documented == 0 ? 0.0 : (double) comment / documented;
        return new CodeMetrics(lines.size(), code, comment, blank, round(ratio));
    }

    private static boolean isCommentLine(LineContext line) {
        if (line.has(Construct.DOCSTRING)) {
            return true;
        }
        return line.has(Construct.COMMENT) && line.codeText().isBlank();
    }

    private static double round(double value) {
        return Math.round(value * 10000.0) / 10000.0;
    }
}
