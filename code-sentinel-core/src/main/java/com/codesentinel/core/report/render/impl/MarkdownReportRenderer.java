package com.codesentinel.core.report.render.impl;

import com.codesentinel.core.model.AnalysisReport;
import com.codesentinel.core.model.Issue;
import com.codesentinel.core.model.ScoreRating;
import com.codesentinel.core.report.render.RenderContext;
import com.codesentinel.core.report.render.ReportRenderer;

import java.util.Locale;
import java.util.Map;

/**
 * Markdown report with metric and issue tables, suitable for pull request comments.
 */
public class MarkdownReportRenderer implements ReportRenderer {

    @Override
    public String getId() {
        return "markdown";
    }

    @Override
    public String getFileExtension() {
        return "md";
    }

    @Override
    public String render(AnalysisReport report, RenderContext context) {
        StringBuilder md = new StringBuilder();
        md.append("# Code Analysis Report");
        if (report.fileName() != null) {
            md.append(": `").append(report.fileName()).append('`');
        }
        md.append("\n\n");
        md.append("**Status:** ").append(report.status().label()).append("\n\n");
        md.append(report.summary()).append("\n\n");

        if (!report.success()) {
            return md.toString();
        }

        md.append("## Scores\n\n");
        md.append("| Category | Score | Rating |\n");
        md.append("|----------|-------|--------|\n");
        for (Map.Entry<String, Integer> entry : report.categoryScores().entrySet()) {
            md.append("| ").append(entry.getKey())
                .append(" | ").append(entry.getValue())
                .append(" | ").append(ScoreRating.of(entry.getValue()).label())
                .append(" |\n");
        }
        md.append('\n');

        md.append("## Metrics\n\n");
        md.append("| Metric | Value |\n");
        md.append("|--------|-------|\n");
        md.append("| Total lines | ").append(report.codeMetrics().totalLines()).append(" |\n");
        md.append("| Code lines | ").append(report.codeMetrics().codeLines()).append(" |\n");
        md.append("| Comment lines | ").append(report.codeMetrics().commentLines()).append(" |\n");
        md.append("| Cyclomatic complexity | ").append(report.complexityMetrics().cyclomaticComplexity()).append(" |\n");
        md.append("| Maintainability index | ")
            .append(String.format(Locale.ROOT, "%.2f", report.complexityMetrics().maintainabilityIndex()))
            .append(" |\n\n");

        if (!report.issues().isEmpty()) {
            md.append("## Issues\n\n");
            md.append("| Line | Severity | Category | Description | CWE | Suggested fix |\n");
            md.append("|------|----------|----------|-------------|-----|---------------|\n");
            for (Issue issue : report.issues()) {
                md.append("| ").append(issue.lineNumber())
                    .append(" | ").append(issue.severity().wireName())
                    .append(" | ").append(issue.category().wireName())
                    .append(" | ").append(escape(issue.description()))
                    .append(" | ").append(issue.cweId() == null ? "" : issue.cweId())
                    .append(" | ").append(issue.suggestedFix() == null ? "" : "`" + escape(issue.suggestedFix()) + "`")
                    .append(" |\n");
            }
            md.append('\n');
        }

        md.append("## Recommendations\n\n");
        for (String recommendation : report.recommendations()) {
            md.append("- ").append(recommendation).append('\n');
        }
        return md.toString();
    }

    private String escape(String text) {
        return text.replace("|", "\\|").replace("\n", " ");
    }
}
