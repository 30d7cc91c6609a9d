package com.codesentinel.core.rule.impl;

import com.codesentinel.core.model.Category;
import com.codesentinel.core.model.Construct;
import com.codesentinel.core.model.Severity;
import com.codesentinel.core.rule.Rule;
import com.codesentinel.core.rule.base.AbstractRuleProvider;
import com.codesentinel.core.rule.base.LinePredicates;

import java.util.List;

/**
 * Lexical syntax checks. These do not replace a parser: they report the
 * bracket, string, colon and indentation problems visible to the structural pass.
 *
 * @since 1.0.0
 */
public class SyntaxRules extends AbstractRuleProvider {

    @Override
    public String getId() {
        return "syntax-rules";
    }

    @Override
    public String getDisplayName() {
        return "Syntax Rules";
    }

    @Override
    public Category getCategory() {
        return Category.SYNTAX;
    }

    @Override
    public int getPriority() {
        return 70;
    }

    @Override
    protected List<Rule> defineRules() {
        return List.of(
            structural("unclosed-bracket", Severity.ERROR,
                LinePredicates.has(Construct.UNCLOSED_BRACKET),
                null,
                "Bracket opened here is never closed",
                "Check for unclosed brackets, quotes, or parentheses"),
            structural("unmatched-bracket", Severity.ERROR,
                LinePredicates.has(Construct.UNMATCHED_BRACKET),
                null,
                "Closing bracket without a matching opening bracket",
                null),
            structural("missing-colon", Severity.ERROR,
                LinePredicates.has(Construct.MISSING_COLON),
                null,
                "Missing ':' at the end of a block header",
                "{snippet}:"),
            structural("unterminated-string", Severity.ERROR,
                LinePredicates.has(Construct.UNTERMINATED_STRING),
                null,
                "Unterminated string literal",
                null),
            structural("mixed-indentation", Severity.WARNING,
                LinePredicates.has(Construct.MIXED_INDENTATION),
                null,
                "Indentation mixes tabs and spaces",
                "Indent with spaces only")
        );
    }
}
