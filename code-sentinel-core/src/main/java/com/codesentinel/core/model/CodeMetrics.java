package com.codesentinel.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Line-count metrics for an analyzed unit.
 *
 * @param totalLines physical lines
 * @param codeLines lines holding code
 * @param commentLines comment-only or docstring lines
 * @param blankLines whitespace-only lines
 * @param commentRatio {@code commentLines / (codeLines + commentLines)}, 0 when both are 0
 */
public record CodeMetrics(
    @JsonProperty("total_lines") int totalLines,
    @JsonProperty("code_lines") int codeLines,
    @JsonProperty("comment_lines") int commentLines,
    @JsonProperty("blank_lines") int blankLines,
    @JsonProperty("comment_ratio") double commentRatio
) {
    /**
     * Metrics for a unit that was never analyzed.
     *
     * @return zero metrics
     */
    public static CodeMetrics empty() {
        return new CodeMetrics(0, 0, 0, 0, 0.0);
    }
}
