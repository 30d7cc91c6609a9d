package com.codesentinel.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.EnumSet;

/**
 * Boolean per-category switches as they arrive at the request boundary.
 *
 * <p>Absent switches default to {@code true}. {@code code_smells} maps to
 * {@link Category#QUALITY}.
 *
 * @param syntax syntax checks
 * @param security security checks
 * @param performance performance checks
 * @param codeSmells code smell checks
 * @param complexity complexity checks
 * @param deadCode unused and unreachable code checks
 * @param typeHints missing type hint checks
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AnalysisFlags(
    @JsonProperty("syntax") Boolean syntax,
    @JsonProperty("security") Boolean security,
    @JsonProperty("performance") Boolean performance,
    @JsonProperty("code_smells") Boolean codeSmells,
    @JsonProperty("complexity") Boolean complexity,
    @JsonProperty("dead_code") Boolean deadCode,
    @JsonProperty("type_hints") Boolean typeHints
) {
    public AnalysisFlags {
        syntax = syntax == null || syntax;
        security = security == null || security;
        performance = performance == null || performance;
        codeSmells = codeSmells == null || codeSmells;
        complexity = complexity == null || complexity;
        deadCode = deadCode == null || deadCode;
        typeHints = typeHints == null || typeHints;
    }

    /**
     * Flags with every switch on.
     *
     * @return default flags
     */
    public static AnalysisFlags defaults() {
        return new AnalysisFlags(true, true, true, true, true, true, true);
    }

    /**
     * Converts the switches into analysis options.
     *
     * @return options enabling every category whose switch is on
     */
    public AnalysisOptions toOptions() {
        EnumSet<Category> enabled = EnumSet.noneOf(Category.class);
        if (syntax) {
            enabled.add(Category.SYNTAX);
        }
        if (security) {
            enabled.add(Category.SECURITY);
        }
        if (performance) {
            enabled.add(Category.PERFORMANCE);
        }
        if (codeSmells) {
            enabled.add(Category.QUALITY);
        }
        if (complexity) {
            enabled.add(Category.COMPLEXITY);
        }
        if (deadCode) {
            enabled.add(Category.DEAD_CODE);
        }
        if (typeHints) {
            enabled.add(Category.TYPE_HINTS);
        }
        return new AnalysisOptions(enabled);
    }
}
