package com.codesentinel.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Overall verdict attached to a report.
 *
 * @since 1.0.0
 */
public enum ReportStatus {
    /** At least one critical issue. */
    CRITICAL("CRITICAL"),
    /** No critical issue but at least one error. */
    NEEDS_ATTENTION("NEEDS ATTENTION"),
    /** Neither critical issues nor errors. */
    GOOD("GOOD"),
    /** The source unit was invalid and was not analyzed. */
    FAILED("FAILED");

    private final String label;

    ReportStatus(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    /**
     * Derives the status from severity counts.
     *
     * @param critical number of critical issues
     * @param errors number of error issues
     * @return status
     */
    public static ReportStatus of(int critical, int errors) {
        if (critical > 0) {
            return CRITICAL;
        }
        if (errors > 0) {
            return NEEDS_ATTENTION;
        }
        return GOOD;
    }
}
