package com.codesentinel.core.rule.impl;

import com.codesentinel.core.model.Category;
import com.codesentinel.core.model.Construct;
import com.codesentinel.core.model.LineContext;
import com.codesentinel.core.model.Severity;
import com.codesentinel.core.rule.LinePredicate;
import com.codesentinel.core.rule.Rule;
import com.codesentinel.core.rule.base.AbstractRuleProvider;
import com.codesentinel.core.rule.base.LinePredicates;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Performance rules: quadratic concatenation in loops, global lookups and
 * iteration idioms that do more work than needed.
 *
 * @since 1.0.0
 */
public class PerformanceRules extends AbstractRuleProvider {

    private static final Pattern LIST_CONCAT = Pattern.compile("\\+=\\s*(?:\\[|list\\s*\\()");
    private static final Pattern SLEEP_CALL = Pattern.compile("\\btime\\.sleep\\s*\\(|^\\s*sleep\\s*\\(");

    /**
     * More {@code +} operators than this on a line with a string literal is reported.
     */
    static final int MAX_STRING_CONCATENATIONS = 2;

    @Override
    public String getId() {
        return "performance-rules";
    }

    @Override
    public String getDisplayName() {
        return "Performance Rules";
    }

    @Override
    public Category getCategory() {
        return Category.PERFORMANCE;
    }

    @Override
    public int getPriority() {
        return 20;
    }

    @Override
    protected List<Rule> defineRules() {
        LinePredicate inLoop = LinePredicates.has(Construct.LOOP_BODY);

        return List.of(
            structural("list-concat-in-loop", Severity.WARNING,
                LinePredicates.has(Construct.AUGMENTED_ASSIGNMENT)
                    .and(inLoop)
                    .and(LinePredicates.codeMatches(LIST_CONCAT)),
                null,
                "Inefficient list concatenation in loop",
                "Use list.append() or list comprehension"),
            structural("string-concatenation", Severity.INFO,
                LinePredicates.has(Construct.LITERAL_STRING).and(PerformanceRules::hasManyConcatenations),
                null,
                "Multiple string concatenations",
                "Use f-string or str.join(): f\"{var1}{var2}{var3}\""),
            structural("global-variable", Severity.WARNING,
                LinePredicates.has(Construct.GLOBAL_DECL),
                null,
                "Global variable usage affects performance",
                "Use local variables or pass as parameters"),
            pattern("range-len-iteration", Severity.INFO,
                "\\bfor\\s+(\\w+)\\s+in\\s+range\\s*\\(\\s*len\\s*\\(\\s*([\\w.]+)\\s*\\)\\s*\\)",
                null,
                "Index-based iteration over {2}",
                "for {1}, item in enumerate({2}):"),
            pattern("dict-keys-membership", Severity.INFO,
                "\\bin\\s+([\\w.]+)\\.keys\\(\\)",
                null,
                "Redundant .keys() call on {1}",
                "in {1}"),
            structural("sleep-in-loop", Severity.WARNING,
                inLoop.and(LinePredicates.codeMatches(SLEEP_CALL)),
                null,
                "Blocking sleep inside a loop",
                null)
        );
    }

    private static boolean hasManyConcatenations(LineContext line) {
        String code = line.codeText();
        int count = 0;
        for (int i = 0; i < code.length(); i++) {
            if (code.charAt(i) == '+' && (i + 1 >= code.length() || code.charAt(i + 1) != '=')) {
                count++;
            }
        }
        return count > MAX_STRING_CONCATENATIONS;
    }
}
