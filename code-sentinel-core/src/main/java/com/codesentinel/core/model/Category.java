package com.codesentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Rule category. Each category is scanned in its own pass and can be switched off
 * as a whole through {@link AnalysisOptions}.
 *
 * @since 1.0.0
 */
public enum Category {
    SECURITY("security", "Security"),
    PERFORMANCE("performance", "Performance"),
    QUALITY("quality", "Code Quality"),
    COMPLEXITY("complexity", "Complexity"),
    DEAD_CODE("dead_code", "Dead Code"),
    TYPE_HINTS("type_hints", "Type Hints"),
    SYNTAX("syntax", "Syntax");

    private final String wireName;
    private final String displayName;

    Category(String wireName, String displayName) {
        this.wireName = wireName;
        this.displayName = displayName;
    }

    /**
     * Returns the snake_case name used in reports ({@code issue_type}) and configuration.
     *
     * @return wire name
     */
    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * Returns a human-readable name for CLI output.
     *
     * @return display name
     */
    public String displayName() {
        return displayName;
    }

    /**
     * Parses a wire name, enum constant name, or the boundary alias {@code code_smells}.
     *
     * @param value category text, case-insensitive, dashes accepted for underscores
     * @return matching category
     * @throws IllegalArgumentException if the value names no category
     */
    @JsonCreator
    public static Category fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Category must not be null");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        if ("code_smells".equals(normalized) || "style".equals(normalized)) {
            return QUALITY;
        }
        if ("type_hint".equals(normalized)) {
            return TYPE_HINTS;
        }
        for (Category category : values()) {
            if (category.wireName.equals(normalized)) {
                return category;
            }
        }
        throw new IllegalArgumentException("Unknown category: " + value);
    }
}
