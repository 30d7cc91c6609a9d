package com.codesentinel.core.scoring;

import com.codesentinel.core.model.Severity;

/**
 * Score penalty per issue severity.
 *
 * @param critical penalty of a critical issue
 * @param error penalty of an error
 * @param warning penalty of a warning
 * @param info penalty of an info issue
 */
public record SeverityWeights(int critical, int error, int warning, int info) {

    public SeverityWeights {
        if (critical < 0 || error < 0 || warning < 0 || info < 0) {
            throw new IllegalArgumentException("Severity weights must not be negative");
        }
    }

    /**
     * Default table: critical 25, error 15, warning 5, info 1.
     *
     * @return default weights
     */
    public static SeverityWeights defaults() {
        return new SeverityWeights(25, 15, 5, 1);
    }

    public int weightOf(Severity severity) {
        return switch (severity) {
            case CRITICAL -> critical;
            case ERROR -> error;
            case WARNING -> warning;
            case INFO -> info;
        };
    }
}
