package com.codesentinel.core.rule.impl;

import com.codesentinel.core.model.Category;
import com.codesentinel.core.model.Severity;
import com.codesentinel.core.rule.Rule;
import com.codesentinel.core.rule.base.AbstractRuleProvider;

import java.util.List;

/**
 * Type hint suggestions for single-line function signatures.
 *
 * @since 1.0.0
 */
public class TypeHintRules extends AbstractRuleProvider {

    @Override
    public String getId() {
        return "type-hint-rules";
    }

    @Override
    public String getDisplayName() {
        return "Type Hint Rules";
    }

    @Override
    public Category getCategory() {
        return Category.TYPE_HINTS;
    }

    @Override
    public int getPriority() {
        return 60;
    }

    @Override
    protected List<Rule> defineRules() {
        return List.of(
            // no annotation anywhere: parameters contain no ':' and there is no '->'
            pattern("missing-type-hints", Severity.INFO,
                "^\\s*(?:async\\s+)?def\\s+(\\w+)\\s*\\(([^):]*)\\)\\s*:",
                null,
                "Function '{1}' missing type hints",
                "def {1}(param: str) -> int:"),
            pattern("missing-return-type", Severity.INFO,
                "^\\s*(?:async\\s+)?def\\s+(\\w+)\\s*\\(([^):]*+:[^)]*+)\\)\\s*:",
                null,
                "Function '{1}' missing return type annotation",
                "def {1}({2}) -> ReturnType:")
        );
    }
}
