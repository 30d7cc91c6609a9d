package com.codesentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Issue severity, totally ordered: {@code critical > error > warning > info}.
 *
 * <p>Declaration order runs from most to least severe, so {@link #compareTo(Enum)}
 * sorts the most severe first.
 *
 * @since 1.0.0
 */
public enum Severity {
    /**
     * Exploitable or data-losing defect, fix before merging.
     */
    CRITICAL("critical", 4),

    /**
     * Definite defect that breaks behavior.
     */
    ERROR("error", 3),

    /**
     * Probable defect or significant smell.
     */
    WARNING("warning", 2),

    /**
     * Stylistic or informational finding.
     */
    INFO("info", 1);

    private final String wireName;
    private final int rank;

    Severity(String wireName, int rank) {
        this.wireName = wireName;
        this.rank = rank;
    }

    /**
     * Returns the lower-case name used in reports and configuration.
     *
     * @return wire name, e.g. {@code "critical"}
     */
    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * Returns the numeric rank (4 = critical ... 1 = info).
     *
     * @return rank, higher is more severe
     */
    public int rank() {
        return rank;
    }

    /**
     * Returns true if this severity is at least as severe as {@code other}.
     *
     * @param other severity to compare against
     * @return true if {@code this >= other}
     */
    public boolean isAtLeast(Severity other) {
        return this.rank >= other.rank;
    }

    /**
     * Parses a wire name or enum constant name, ignoring case.
     *
     * @param value text such as {@code "warning"} or {@code "WARNING"}
     * @return matching severity
     * @throws IllegalArgumentException if the value names no severity
     */
    @JsonCreator
    public static Severity fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Severity must not be null");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (Severity severity : values()) {
            if (severity.wireName.equals(normalized)) {
                return severity;
            }
        }
        throw new IllegalArgumentException("Unknown severity: " + value);
    }
}
