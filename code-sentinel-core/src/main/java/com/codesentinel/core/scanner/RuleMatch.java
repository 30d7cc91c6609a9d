package com.codesentinel.core.scanner;

import com.codesentinel.core.model.LineContext;
import com.codesentinel.core.rule.Rule;

import java.util.List;
import java.util.Objects;

/**
 * One rule firing on one line.
 *
 * @param rule rule that fired
 * @param line line it fired on
 * @param groups capture groups of a pattern match (index 0 is the whole match, groups that
 *               did not participate are empty strings); empty for structural rules
 */
public record RuleMatch(Rule rule, LineContext line, List<String> groups) {

    public RuleMatch {
        Objects.requireNonNull(rule, "rule must not be null");
        Objects.requireNonNull(line, "line must not be null");
        groups = groups == null
            ? List.of()
            : groups.stream().map(group -> group == null ? "" : group).toList();
    }

    public int lineNumber() {
        return line.lineNumber();
    }
}
