package com.codesentinel.core.report.render.impl;

import com.codesentinel.core.model.AnalysisReport;
import com.codesentinel.core.model.Issue;
import com.codesentinel.core.model.ReportStatus;
import com.codesentinel.core.model.ScoreRating;
import com.codesentinel.core.model.Severity;
import com.codesentinel.core.report.render.RenderContext;
import com.codesentinel.core.report.render.ReportRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * Console report with optional ANSI color formatting.
 *
 * <p><b>Configuration Settings:</b>
 * <ul>
 *   <li>{@code console.colors} - Enable/disable ANSI colors ("true"/"false", default: "false")</li>
 *   <li>{@code console.showFixes} - Print suggested fixes under each issue ("true"/"false", default: "true")</li>
 * </ul>
 */
public class TextReportRenderer implements ReportRenderer {

    private static final Logger logger = LoggerFactory.getLogger(TextReportRenderer.class);

    // ANSI color codes
    private static final String ANSI_RESET = "\u001B[0m";
    private static final String ANSI_BOLD = "\u001B[1m";
    private static final String ANSI_RED = "\u001B[31m";
    private static final String ANSI_GREEN = "\u001B[32m";
    private static final String ANSI_YELLOW = "\u001B[33m";
    private static final String ANSI_CYAN = "\u001B[36m";

    private static final String RULE = "=".repeat(60);

    @Override
    public String getId() {
        return "text";
    }

    @Override
    public String getFileExtension() {
        return "txt";
    }

    @Override
    public String render(AnalysisReport report, RenderContext context) {
        boolean useColors = Boolean.parseBoolean(context.getSettingOrDefault("console.colors", "false"));
        boolean showFixes = Boolean.parseBoolean(context.getSettingOrDefault("console.showFixes", "true"));
        logger.debug("Rendering text report with {} issues (colors: {})", report.totalIssues(), useColors);

        StringBuilder out = new StringBuilder();
        String title = report.fileName() == null ? "CODE ANALYSIS REPORT" : "CODE ANALYSIS REPORT: " + report.fileName();
        out.append(RULE).append('\n');
        out.append(color(title, ANSI_BOLD, useColors)).append('\n');
        out.append(RULE).append("\n\n");

        if (!report.success()) {
            out.append(color("Status: " + ReportStatus.FAILED.label(), ANSI_RED, useColors)).append('\n');
            out.append(report.summary()).append('\n');
            return out.toString();
        }

        appendOverview(out, report, useColors);
        appendMetrics(out, report);
        appendScores(out, report, useColors);
        appendIssues(out, report, useColors, showFixes);
        appendRecommendations(out, report);
        out.append('\n').append(report.summary()).append('\n');
        return out.toString();
    }

    private void appendOverview(StringBuilder out, AnalysisReport report, boolean useColors) {
        out.append("OVERVIEW\n");
        out.append("  Status: ").append(color(report.status().label(), statusColor(report.status()), useColors)).append('\n');
        out.append("  Total Issues: ").append(report.totalIssues()).append('\n');
        out.append("    Critical: ").append(report.critical()).append('\n');
        out.append("    Errors:   ").append(report.errors()).append('\n');
        out.append("    Warnings: ").append(report.warnings()).append('\n');
        out.append("    Info:     ").append(report.info()).append("\n\n");
    }

    private void appendMetrics(StringBuilder out, AnalysisReport report) {
        out.append("CODE METRICS\n");
        out.append("  Lines of Code: ").append(report.codeMetrics().codeLines()).append('\n');
        out.append("  Comment Lines: ").append(report.codeMetrics().commentLines()).append('\n');
        out.append("  Cyclomatic Complexity: ").append(report.complexityMetrics().cyclomaticComplexity()).append('\n');
        out.append("  Maintainability: ")
            .append(String.format(Locale.ROOT, "%.2f", report.complexityMetrics().maintainabilityIndex()))
            .append("/100\n\n");
    }

    private void appendScores(StringBuilder out, AnalysisReport report, boolean useColors) {
        out.append(scoreLine("SECURITY SCORE", report.securityScore(), useColors)).append('\n');
        out.append(scoreLine("PERFORMANCE SCORE", report.performanceScore(), useColors)).append("\n\n");
    }

    private String scoreLine(String label, int score, boolean useColors) {
        ScoreRating rating = ScoreRating.of(score);
        String ratingColor = switch (rating) {
            case EXCELLENT -> ANSI_GREEN;
            case GOOD -> ANSI_YELLOW;
            default -> ANSI_RED;
        };
        return label + ": " + score + "/100  " + color(rating.label(), ratingColor, useColors);
    }

    private void appendIssues(StringBuilder out, AnalysisReport report, boolean useColors, boolean showFixes) {
        if (report.issues().isEmpty()) {
            return;
        }
        out.append("ISSUES\n");
        for (Issue issue : report.issues()) {
            String severity = String.format(Locale.ROOT, "%-8s", issue.severity().wireName().toUpperCase(Locale.ROOT));
            out.append("  ")
                .append(color(severity, severityColor(issue.severity()), useColors))
                .append(" line ").append(issue.lineNumber())
                .append(" [").append(issue.category().wireName()).append("] ")
                .append(issue.description());
            if (issue.cweId() != null) {
                out.append(" (").append(issue.cweId()).append(')');
            }
            out.append('\n');
            if (!issue.codeSnippet().isEmpty()) {
                out.append("           ").append(color(issue.codeSnippet(), ANSI_CYAN, useColors)).append('\n');
            }
            if (showFixes && issue.suggestedFix() != null) {
                out.append("           fix: ").append(issue.suggestedFix()).append('\n');
            }
        }
        out.append('\n');
    }

    private void appendRecommendations(StringBuilder out, AnalysisReport report) {
        out.append("RECOMMENDATIONS\n");
        for (String recommendation : report.recommendations()) {
            out.append("  - ").append(recommendation).append('\n');
        }
    }

    private String statusColor(ReportStatus status) {
        return switch (status) {
            case GOOD -> ANSI_GREEN;
            case NEEDS_ATTENTION -> ANSI_YELLOW;
            default -> ANSI_RED;
        };
    }

    private String severityColor(Severity severity) {
        return switch (severity) {
            case CRITICAL, ERROR -> ANSI_RED;
            case WARNING -> ANSI_YELLOW;
            case INFO -> ANSI_CYAN;
        };
    }

    private String color(String text, String ansi, boolean useColors) {
        return useColors ? ansi + text + ANSI_RESET : text;
    }
}
