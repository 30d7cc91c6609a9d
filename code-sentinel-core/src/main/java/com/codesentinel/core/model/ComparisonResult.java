package com.codesentinel.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Difference between a "before" and an "after" analysis of the same code.
 *
 * @param before report of the original code
 * @param after report of the changed code
 * @param issuesFixed {@code before.totalIssues - after.totalIssues}, negative when issues were added
 * @param securityImprovement change of the security score
 * @param performanceImprovement change of the performance score
 * @param complexityChange change of cyclomatic complexity
 * @param summary one-line summary
 */
public record ComparisonResult(
    @JsonProperty("before") AnalysisReport before,
    @JsonProperty("after") AnalysisReport after,
    @JsonProperty("issues_fixed") int issuesFixed,
    @JsonProperty("security_improvement") int securityImprovement,
    @JsonProperty("performance_improvement") int performanceImprovement,
    @JsonProperty("complexity_change") int complexityChange,
    @JsonProperty("summary") String summary
) {
}
