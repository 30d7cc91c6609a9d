package com.codesentinel.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * A single finding produced by one rule on one line.
 *
 * <p>Created by the scanner, enriched once with a suggested fix, then frozen inside an
 * {@link AnalysisReport}.
 *
 * <p><b>Example:</b>
 * <pre>{@code
 * Issue issue = new Issue(
 *     3, Severity.CRITICAL, Category.SECURITY,
 *     "Hardcoded credential in 'password'",
 *     "password = \"admin123\"",
 *     "password = os.getenv(\"PASSWORD\")",
 *     "CWE-798",
 *     "hardcoded-credentials"
 * );
 * }</pre>
 *
 * @param lineNumber 1-based line the rule matched on
 * @param severity severity of the originating rule
 * @param category category of the originating rule, serialized as {@code issue_type} with the
 *        category's wire name: {@code security}, {@code performance}, {@code quality},
 *        {@code complexity}, {@code dead_code}, {@code type_hints} or {@code syntax}
 * @param description human-readable description
 * @param codeSnippet trimmed source line
 * @param suggestedFix deterministic fix text, or null when none exists
 * @param cweId CWE identifier, or null
 * @param ruleId id of the originating rule
 */
@JsonPropertyOrder({"line_number", "severity", "issue_type", "description", "code_snippet",
    "suggested_fix", "cwe_id", "rule_id"})
@JsonInclude(JsonInclude.Include.ALWAYS)
public record Issue(
    @JsonProperty("line_number") int lineNumber,
    @JsonProperty("severity") Severity severity,
    @JsonProperty("issue_type") Category category,
    @JsonProperty("description") String description,
    @JsonProperty("code_snippet") String codeSnippet,
    @JsonProperty("suggested_fix") String suggestedFix,
    @JsonProperty("cwe_id") String cweId,
    @JsonProperty("rule_id") String ruleId
) {
    public Issue {
        if (lineNumber < 1) {
            throw new IllegalArgumentException("lineNumber must be >= 1, was " + lineNumber);
        }
        Objects.requireNonNull(severity, "severity must not be null");
        Objects.requireNonNull(category, "category must not be null");
        Objects.requireNonNull(description, "description must not be null");
        Objects.requireNonNull(ruleId, "ruleId must not be null");
        if (codeSnippet == null) {
            codeSnippet = "";
        }
    }

    /**
     * Returns a copy carrying the given fix.
     *
     * @param fix suggested fix text, may be null
     * @return new issue
     */
    public Issue withSuggestedFix(String fix) {
        return new Issue(lineNumber, severity, category, description, codeSnippet, fix, cweId, ruleId);
    }

    /**
     * Returns true if no deterministic fix exists, so a caller may hand the issue to an
     * external fix model.
     *
     * @return true when {@code suggestedFix} is null
     */
    @JsonIgnore
    public boolean isDelegable() {
        return suggestedFix == null;
    }
}
