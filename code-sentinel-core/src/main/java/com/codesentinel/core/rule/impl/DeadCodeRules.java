package com.codesentinel.core.rule.impl;

import com.codesentinel.core.model.Category;
import com.codesentinel.core.model.Construct;
import com.codesentinel.core.model.Severity;
import com.codesentinel.core.rule.Rule;
import com.codesentinel.core.rule.base.AbstractRuleProvider;
import com.codesentinel.core.rule.base.LinePredicates;

import java.util.List;

/**
 * Dead code rules, reported at the line of the unused definition or the
 * unreachable statement.
 *
 * @since 1.0.0
 */
public class DeadCodeRules extends AbstractRuleProvider {

    @Override
    public String getId() {
        return "dead-code-rules";
    }

    @Override
    public String getDisplayName() {
        return "Dead Code Rules";
    }

    @Override
    public Category getCategory() {
        return Category.DEAD_CODE;
    }

    @Override
    public int getPriority() {
        return 50;
    }

    @Override
    protected List<Rule> defineRules() {
        return List.of(
            structural("unused-definition", Severity.INFO,
                LinePredicates.has(Construct.UNUSED_DEFINITION),
                null,
                "Unused variable or function",
                "Remove the unused definition or prefix it with _ if intentional"),
            structural("unreachable-code", Severity.WARNING,
                LinePredicates.has(Construct.UNREACHABLE),
                null,
                "Unreachable code after return, raise, break or continue",
                "Remove the unreachable statement")
        );
    }
}
