package com.codesentinel.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Complexity metrics computed purely from structural facts.
 *
 * @param cyclomaticComplexity 1 + number of decision points
 * @param maintainabilityIndex composite maintainability in {@code [0, 100]}
 */
public record ComplexityMetrics(
    @JsonProperty("cyclomatic_complexity") int cyclomaticComplexity,
    @JsonProperty("maintainability_index") double maintainabilityIndex
) {
    public ComplexityMetrics {
        if (cyclomaticComplexity < 0) {
            cyclomaticComplexity = 0;
        }
        if (Double.isNaN(maintainabilityIndex)) {
            maintainabilityIndex = 0.0;
        }
        maintainabilityIndex = Math.max(0.0, Math.min(100.0, maintainabilityIndex));
    }

    /**
     * Metrics for a unit that was never analyzed.
     *
     * @return zero metrics
     */
    public static ComplexityMetrics none() {
        return new ComplexityMetrics(0, 0.0);
    }
}
