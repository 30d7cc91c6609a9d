package com.codesentinel.core.report;

import com.codesentinel.core.model.AnalysisReport;
import com.codesentinel.core.model.Category;
import com.codesentinel.core.model.CodeMetrics;
import com.codesentinel.core.model.ComplexityMetrics;
import com.codesentinel.core.model.Issue;
import com.codesentinel.core.model.ReportStatus;
import com.codesentinel.core.model.RuleFault;
import com.codesentinel.core.rule.RuleRegistry;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Merges, sorts, counts and summarizes issues into the final {@link AnalysisReport}.
 *
 * <p>Issues are ordered by line (ascending), severity (most severe first) and the
 * originating rule's registry insertion order.
 *
 * @since 1.0.0
 */
public class ResultAggregator {

    public static final String SUMMARY_TEMPLATE = "Found %d issues. Security score: %d/100";

    public static final String RECOMMEND_SECURITY = "Fix security vulnerabilities immediately";
    public static final String RECOMMEND_PERFORMANCE = "Optimize performance bottlenecks";
    public static final String RECOMMEND_SYNTAX = "Resolve syntax errors before further review";
    public static final String RECOMMEND_NONE = "Code quality is good! Keep it up!";

    private final Comparator<Issue> issueOrder;

    public ResultAggregator(RuleRegistry registry) {
        Objects.requireNonNull(registry, "registry must not be null");
        this.issueOrder = Comparator.comparingInt(Issue::lineNumber)
            .thenComparing(Comparator.comparingInt((Issue issue) -> issue.severity().rank()).reversed())
            .thenComparingInt(issue -> registry.ordinal(issue.ruleId()));
    }

    /**
     * Builds the report of a successfully analyzed unit.
     *
     * @param fileName file name, may be null
     * @param issues issues of all scanned categories, in any order
     * @param categoryScores scores keyed by category wire name
     * @param complexityMetrics complexity metrics
     * @param codeMetrics line counts
     * @param faults rule faults recorded during the scan
     * @return report
     */
    public AnalysisReport aggregate(String fileName,
                                    List<Issue> issues,
                                    Map<String, Integer> categoryScores,
                                    ComplexityMetrics complexityMetrics,
                                    CodeMetrics codeMetrics,
                                    List<RuleFault> faults) {
        List<Issue> sorted = sort(issues);

        int critical = 0;
        int errors = 0;
        int warnings = 0;
        int info = 0;
        for (Issue issue : sorted) {
            switch (issue.severity()) {
                case CRITICAL -> critical++;
                case ERROR -> errors++;
                case WARNING -> warnings++;
                case INFO -> info++;
            }
        }

        int securityScore = categoryScores.getOrDefault(Category.SECURITY.wireName(), AnalysisReport.PERFECT_SCORE);
        int performanceScore = categoryScores.getOrDefault(Category.PERFORMANCE.wireName(), AnalysisReport.PERFECT_SCORE);

        return new AnalysisReport(
            true,
            fileName,
            sorted.size(),
            critical,
            errors,
            warnings,
            info,
            securityScore,
            performanceScore,
            categoryScores,
            complexityMetrics,
            codeMetrics,
            ReportStatus.of(critical, errors),
            sorted,
            recommendations(sorted),
            faults,
            summary(sorted.size(), securityScore)
        );
    }

    /**
     * Sorts issues into report order.
     *
     * @param issues issues
     * @return new sorted list
     */
    public List<Issue> sort(List<Issue> issues) {
        List<Issue> sorted = new ArrayList<>(issues);
        sorted.sort(issueOrder);
        return sorted;
    }

    static List<String> recommendations(List<Issue> issues) {
        boolean security = false;
        boolean performance = false;
        boolean syntax = false;
        for (Issue issue : issues) {
            switch (issue.category()) {
                case SECURITY -> security = true;
                case PERFORMANCE -> performance = true;
                case SYNTAX -> syntax = true;
                default -> {
                    // no dedicated recommendation
                }
            }
        }

        List<String> recommendations = new ArrayList<>();
        if (security) {
            recommendations.add(RECOMMEND_SECURITY);
        }
        if (performance) {
            recommendations.add(RECOMMEND_PERFORMANCE);
        }
        if (syntax) {
            recommendations.add(RECOMMEND_SYNTAX);
        }
        if (recommendations.isEmpty()) {
            recommendations.add(RECOMMEND_NONE);
        }
        return recommendations;
    }

    static String summary(int totalIssues, int securityScore) {
        return String.format(SUMMARY_TEMPLATE, totalIssues, securityScore);
    }
}
