package com.codesentinel.core.structure;

import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Shared, precompiled recognizers for line-level constructs.
 *
 * <p>All patterns are applied to the trimmed code text of a line (string contents
 * blanked, comments removed), never to the raw text.
 *
 * @since 1.0.0
 */
public final class ConstructPatterns {

    public static final Pattern IMPORT = Pattern.compile("^(?:import|from)\\s+\\S");

    public static final Pattern FUNCTION_DEF = Pattern.compile("^(?:async\\s+)?def\\s+([A-Za-z_]\\w*)");

    public static final Pattern CLASS_DEF = Pattern.compile("^class\\s+([A-Za-z_]\\w*)");

    public static final Pattern DECORATOR = Pattern.compile("^@[A-Za-z_]");

    public static final Pattern CONDITIONAL = Pattern.compile("^(?:if|elif)\\b");

    public static final Pattern LOOP = Pattern.compile("^(?:async\\s+)?(?:for|while)\\b");

    public static final Pattern EXCEPTION_HANDLER = Pattern.compile("^except\\b");

    public static final Pattern BARE_EXCEPT = Pattern.compile("^except\\s*:");

    public static final Pattern RETURN = Pattern.compile("^return\\b");

    public static final Pattern TERMINATOR = Pattern.compile("^(?:return|raise|break|continue)\\b");

    public static final Pattern GLOBAL_DECL = Pattern.compile("^(?:global|nonlocal)\\s+[A-Za-z_]");

    public static final Pattern BLOCK_HEADER =
        Pattern.compile("^(?:async\\s+)?(?:def|class|if|elif|else|for|while|try|except|finally|with)\\b");

    /**
     * Clauses that continue the previous compound statement at the same indentation.
     */
    public static final Pattern CONTINUATION_CLAUSE = Pattern.compile("^(?:elif|else|except|finally)\\b");

    /**
     * Plain or annotated assignment to a name, attribute, subscript or tuple of names.
     */
    public static final Pattern ASSIGNMENT = Pattern.compile(
        "^([A-Za-z_][\\w.]*(?:\\[[^\\]]*\\])?(?:\\s*,\\s*[A-Za-z_][\\w.]*)*+)\\s*(?::\\s*[^=]+)?=(?!=)"
    );

    public static final Pattern AUGMENTED_ASSIGNMENT = Pattern.compile(
        "^[A-Za-z_][\\w.]*(?:\\[[^\\]]*\\])?\\s*(?:\\*\\*|//|>>|<<|[-+*/%@&|^])="
    );

    /**
     * Assignment to a single bare name. Group 1 is the name.
     */
    public static final Pattern SIMPLE_DEFINITION =
        Pattern.compile("^([A-Za-z_]\\w*)\\s*(?::\\s*[^=]+)?=(?!=)");

    public static final Pattern BOOLEAN_OPERATOR = Pattern.compile("\\b(?:and|or)\\b");

    public static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_]\\w*");

    /**
     * Reserved words that can never be the target of an assignment.
     */
    public static final Set<String> KEYWORDS = Set.of(
        "False", "None", "True", "and", "as", "assert", "async", "await", "break", "class",
        "continue", "def", "del", "elif", "else", "except", "finally", "for", "from", "global",
        "if", "import", "in", "is", "lambda", "nonlocal", "not", "or", "pass", "raise",
        "return", "try", "while", "with", "yield"
    );

    private ConstructPatterns() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    /**
     * Counts {@code and}/{@code or} operators in a code text.
     *
     * @param codeText code text with strings and comments masked
     * @return number of boolean operators
     */
    public static int countBooleanOperators(String codeText) {
        int count = 0;
        Matcher matcher = BOOLEAN_OPERATOR.matcher(codeText);
        while (matcher.find()) {
            count++;
        }
        return count;
    }

    /**
     * Returns the first identifier of a code text, or the empty string.
     *
     * @param code trimmed code text
     * @return leading identifier
     */
    public static String leadingIdentifier(String code) {
        Matcher matcher = IDENTIFIER.matcher(code);
        return matcher.lookingAt() ? matcher.group() : "";
    }
}
