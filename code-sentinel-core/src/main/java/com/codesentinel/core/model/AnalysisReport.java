package com.codesentinel.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Final, immutable result of one analysis call.
 *
 * <p>The JSON form follows the response shape of the analysis API: snake_case field
 * names, lower-case severities and categories.
 *
 * @param success false only when the source unit itself was invalid
 * @param fileName file name of the analyzed unit, may be null
 * @param totalIssues number of issues, info included
 * @param critical number of critical issues
 * @param errors number of error issues
 * @param warnings number of warning issues
 * @param info number of info issues
 * @param securityScore 0-100 score of the security category
 * @param performanceScore 0-100 score of the performance category
 * @param categoryScores 0-100 score for every scanned category, keyed by category wire name
 * @param complexityMetrics cyclomatic complexity and maintainability index
 * @param codeMetrics line counts
 * @param status overall verdict
 * @param issues issues sorted by line, severity (descending) and rule order
 * @param recommendations short follow-up recommendations
 * @param ruleFaults rules that raised during evaluation and were skipped
 * @param summary fixed-template one-line summary
 */
@JsonPropertyOrder({"success", "file_name", "total_issues", "critical", "errors", "warnings", "info",
    "security_score", "performance_score", "category_scores", "complexity_metrics", "code_metrics",
    "status", "issues", "recommendations", "rule_faults", "summary"})
public record AnalysisReport(
    @JsonProperty("success") boolean success,
    @JsonProperty("file_name") String fileName,
    @JsonProperty("total_issues") int totalIssues,
    @JsonProperty("critical") int critical,
    @JsonProperty("errors") int errors,
    @JsonProperty("warnings") int warnings,
    @JsonProperty("info") int info,
    @JsonProperty("security_score") int securityScore,
    @JsonProperty("performance_score") int performanceScore,
    @JsonProperty("category_scores") Map<String, Integer> categoryScores,
    @JsonProperty("complexity_metrics") ComplexityMetrics complexityMetrics,
    @JsonProperty("code_metrics") CodeMetrics codeMetrics,
    @JsonProperty("status") ReportStatus status,
    @JsonProperty("issues") List<Issue> issues,
    @JsonProperty("recommendations") List<String> recommendations,
    @JsonProperty("rule_faults") List<RuleFault> ruleFaults,
    @JsonProperty("summary") String summary
) {
    /**
     * Score reported for categories that were not scanned or found nothing.
     */
    public static final int PERFECT_SCORE = 100;

    public AnalysisReport {
        categoryScores = categoryScores == null || categoryScores.isEmpty()
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(categoryScores));
        if (complexityMetrics == null) {
            complexityMetrics = ComplexityMetrics.none();
        }
        if (codeMetrics == null) {
            codeMetrics = CodeMetrics.empty();
        }
        if (status == null) {
            status = success ? ReportStatus.of(critical, errors) : ReportStatus.FAILED;
        }
        issues = issues == null ? List.of() : List.copyOf(issues);
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
        ruleFaults = ruleFaults == null ? List.of() : List.copyOf(ruleFaults);
        if (summary == null) {
            summary = "";
        }
    }

    /**
     * Creates the report for an invalid source unit: no issues, scores at 100, zero metrics.
     *
     * @param fileName file name, may be null
     * @param reason why the unit was rejected
     * @return failed report
     */
    public static AnalysisReport failed(String fileName, String reason) {
        return new AnalysisReport(
            false,
            fileName,
            0, 0, 0, 0, 0,
            PERFECT_SCORE,
            PERFECT_SCORE,
            Map.of(),
            ComplexityMetrics.none(),
            CodeMetrics.empty(),
            ReportStatus.FAILED,
            List.of(),
            List.of(),
            List.of(),
            "Analysis failed: " + reason
        );
    }

    /**
     * Returns a copy with the given issues, keeping every count and score.
     *
     * <p>Used when merging externally proposed fixes into an already built report.
     *
     * @param replacement issues in the same order and number
     * @return new report
     */
    public AnalysisReport withIssues(List<Issue> replacement) {
        return new AnalysisReport(success, fileName, totalIssues, critical, errors, warnings, info,
            securityScore, performanceScore, categoryScores, complexityMetrics, codeMetrics, status,
            replacement, recommendations, ruleFaults, summary);
    }

    /**
     * Returns true if any issue is at least as severe as the threshold.
     *
     * @param threshold minimum severity
     * @return true if such an issue exists
     */
    public boolean hasIssuesAtLeast(Severity threshold) {
        return issues.stream().anyMatch(issue -> issue.severity().isAtLeast(threshold));
    }

    /**
     * Returns the score of a category, or {@link #PERFECT_SCORE} when it was not scanned.
     *
     * @param category category
     * @return 0-100 score
     */
    public int scoreOf(Category category) {
        return categoryScores.getOrDefault(category.wireName(), PERFECT_SCORE);
    }

    /**
     * Returns the issues of one category, in report order.
     *
     * @param category category to select
     * @return matching issues
     */
    public List<Issue> issuesOf(Category category) {
        return issues.stream().filter(issue -> issue.category() == category).toList();
    }
}
