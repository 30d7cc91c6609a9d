package com.codesentinel.core.rule.impl;

import com.codesentinel.core.model.Category;
import com.codesentinel.core.model.Construct;
import com.codesentinel.core.model.Severity;
import com.codesentinel.core.rule.Rule;
import com.codesentinel.core.rule.base.AbstractRuleProvider;
import com.codesentinel.core.rule.base.LinePredicates;
import com.codesentinel.core.structure.ConstructPatterns;

import java.util.List;

/**
 * Complexity rules: nesting depth, condition size and parameter count.
 *
 * @since 1.0.0
 */
public class ComplexityRules extends AbstractRuleProvider {

    /**
     * Conditions with at least this many {@code and}/{@code or} operators are reported.
     */
    public static final int MAX_BOOLEAN_OPERATORS = 3;

    @Override
    public String getId() {
        return "complexity-rules";
    }

    @Override
    public String getDisplayName() {
        return "Complexity Rules";
    }

    @Override
    public Category getCategory() {
        return Category.COMPLEXITY;
    }

    @Override
    public int getPriority() {
        return 40;
    }

    @Override
    protected List<Rule> defineRules() {
        return List.of(
            structural("deep-nesting", Severity.WARNING,
                LinePredicates.has(Construct.DEEP_NESTING),
                null,
                "Code nested too deeply (4 or more control-flow levels)",
                "Extract the inner block into a function or return early"),
            structural("complex-condition", Severity.WARNING,
                LinePredicates.hasAny(Construct.CONDITIONAL, Construct.LOOP)
                    .and(line -> ConstructPatterns.countBooleanOperators(line.codeText()) >= MAX_BOOLEAN_OPERATORS),
                null,
                "Complex boolean condition",
                "Split the condition into named boolean variables"),
            pattern("long-parameter-list", Severity.INFO,
                "\\bdef\\s+(\\w+)\\s*\\((?=(?:[^,()]*+,){5})([^()]*+)\\)",
                null,
                "Function '{1}' has too many parameters",
                null)
        );
    }
}
