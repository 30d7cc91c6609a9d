package com.codesentinel.core.rule.impl;

import com.codesentinel.core.model.Category;
import com.codesentinel.core.model.Construct;
import com.codesentinel.core.model.Severity;
import com.codesentinel.core.rule.Rule;
import com.codesentinel.core.rule.base.AbstractRuleProvider;
import com.codesentinel.core.rule.base.LinePredicates;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Code quality rules (code smells and style).
 *
 * @since 1.0.0
 */
public class QualityRules extends AbstractRuleProvider {

    public static final int MAX_LINE_LENGTH = 120;

    private static final Pattern MAGIC_NUMBER = Pattern.compile("(?<![\\w.])\\d{4,}(?![\\w.])");
    private static final Pattern COMMENTED_CODE = Pattern.compile(
        "^\\s*#\\s*(?:[\\w.]+\\s*\\(.*\\)|[\\w.\\[\\]]+\\s*=[^=]|(?:import|from|return|def|class|if|for|while)\\s)"
    );
    private static final Pattern PRINT_CALL = Pattern.compile("^\\s*print\\s*\\(");

    @Override
    public String getId() {
        return "quality-rules";
    }

    @Override
    public String getDisplayName() {
        return "Code Quality Rules";
    }

    @Override
    public Category getCategory() {
        return Category.QUALITY;
    }

    @Override
    public int getPriority() {
        return 30;
    }

    @Override
    protected List<Rule> defineRules() {
        return List.of(
            structural("long-line", Severity.INFO,
                LinePredicates.longerThan(MAX_LINE_LENGTH),
                null,
                "Line too long (>" + MAX_LINE_LENGTH + " characters)",
                "Break into multiple lines or refactor"),
            structural("magic-number", Severity.INFO,
                LinePredicates.codeMatches(MAGIC_NUMBER).and(LinePredicates.has(Construct.RETURN).negate()),
                null,
                "Magic number detected",
                "Define as named constant: MAX_RETRIES = 1000"),
            structural("commented-out-code", Severity.INFO,
                LinePredicates.commentOnly().and(LinePredicates.rawMatches(COMMENTED_CODE)),
                null,
                "Commented out code",
                "Remove commented code, use version control"),
            structural("multiple-statements", Severity.WARNING,
                LinePredicates.has(Construct.STATEMENT_SEPARATOR),
                null,
                "Multiple statements on one line",
                "Put each statement on separate line"),
            structural("bare-except", Severity.WARNING,
                LinePredicates.has(Construct.BARE_EXCEPT),
                "CWE-396",
                "Bare except clause catches every exception",
                "except Exception as e:"),
            pattern("unused-exception", Severity.INFO,
                "^\\s*except\\s+(Exception|BaseException)\\s*:",
                null,
                "Catching {1} without using it",
                "except {1} as e:  # Use e for logging"),
            pattern("todo-comment", Severity.INFO,
                "#\\s*(TODO|FIXME|XXX|HACK)\\b:?\\s*(.*)",
                null,
                "{1} comment: {2}",
                null),
            structural("print-statement", Severity.INFO,
                LinePredicates.codeMatches(PRINT_CALL),
                null,
                "print() call left in code",
                "Use the logging module instead of print()"),
            pattern("mutable-default-argument", Severity.WARNING,
                "^(?>.*?\\bdef\\s+\\w+\\s*(?=\\())"
                    + ".*?[(,]\\s*(\\w+)\\s*(?::\\s*[\\w.]+(?:\\[[^\\[\\]=]*+\\])?\\s*)?=\\s*(\\[\\]|\\{\\}|list\\(\\)|dict\\(\\)|set\\(\\))",
                null,
                "Mutable default argument '{1}'",
                "{1}=None, then inside the function: if {1} is None: {1} = {2}"),
            pattern("none-comparison", Severity.INFO,
                "(==|!=)\\s*None\\b",
                null,
                "Comparison to None with '{1}'",
                "Use 'is None' or 'is not None'")
        );
    }
}
