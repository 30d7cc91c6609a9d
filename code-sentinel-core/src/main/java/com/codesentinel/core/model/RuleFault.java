package com.codesentinel.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A rule that raised while being evaluated against one line. The pair was skipped and
 * scanning continued.
 *
 * @param ruleId failing rule
 * @param lineNumber line being evaluated
 * @param message exception type and message
 */
public record RuleFault(
    @JsonProperty("rule_id") String ruleId,
    @JsonProperty("line_number") int lineNumber,
    @JsonProperty("message") String message
) {
    public RuleFault {
        Objects.requireNonNull(ruleId, "ruleId must not be null");
        if (message == null) {
            message = "";
        }
    }
}
