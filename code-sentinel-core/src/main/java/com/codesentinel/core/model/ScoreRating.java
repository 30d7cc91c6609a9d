package com.codesentinel.core.model;

/**
 * Label bands for 0-100 scores.
 *
 * @since 1.0.0
 */
public enum ScoreRating {
    EXCELLENT("Excellent", 80),
    GOOD("Good", 60),
    NEEDS_IMPROVEMENT("Needs Improvement", 40),
    CRITICAL("Critical", 0);

    private final String label;
    private final int threshold;

    ScoreRating(String label, int threshold) {
        this.label = label;
        this.threshold = threshold;
    }

    public String label() {
        return label;
    }

    /**
     * Returns the lowest score that still earns this rating.
     *
     * @return inclusive lower bound
     */
    public int threshold() {
        return threshold;
    }

    /**
     * Rates a score.
     *
     * @param score score in {@code [0, 100]}
     * @return first rating whose threshold the score reaches
     */
    public static ScoreRating of(double score) {
        for (ScoreRating rating : values()) {
            if (score >= rating.threshold) {
                return rating;
            }
        }
        return CRITICAL;
    }
}
