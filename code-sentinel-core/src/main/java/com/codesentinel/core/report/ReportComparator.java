package com.codesentinel.core.report;

import com.codesentinel.core.model.AnalysisReport;
import com.codesentinel.core.model.ComparisonResult;

import java.util.Locale;

/**
 * Compares the reports of two versions of the same code.
 *
 * <p>Positive values mean the "after" version is better: fewer issues, higher scores.
 * {@code complexity_change} is the raw difference of cyclomatic complexity
 * (negative when the code got simpler).
 *
 * @since 1.0.0
 */
public class ReportComparator {

    public ComparisonResult compare(AnalysisReport before, AnalysisReport after) {
        int issuesFixed = before.totalIssues() - after.totalIssues();
        int security = after.securityScore() - before.securityScore();
        int performance = after.performanceScore() - before.performanceScore();
        int complexity = after.complexityMetrics().cyclomaticComplexity()
            - before.complexityMetrics().cyclomaticComplexity();

        String summary = String.format(Locale.ROOT, "Fixed %d issues. Security improved by %.1f%%",
            issuesFixed, (double) security);
        return new ComparisonResult(before, after, issuesFixed, security, performance, complexity, summary);
    }
}
