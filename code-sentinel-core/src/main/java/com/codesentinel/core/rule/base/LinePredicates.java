package com.codesentinel.core.rule.base;

import com.codesentinel.core.model.Construct;
import com.codesentinel.core.rule.LinePredicate;

import java.util.regex.Pattern;

/**
 * Factory for common line predicates.
 *
 * <p><b>Example usage:</b></p>
 * <pre>{@code
 * LinePredicate stringConcatInLoop =
 *     LinePredicates.has(Construct.AUGMENTED_ASSIGNMENT)
 *         .and(LinePredicates.has(Construct.LOOP_BODY))
 *         .and(LinePredicates.codeMatches(Pattern.compile("\\+=\\s*[\"']")));
 * }</pre>
 *
 * @since 1.0.0
 */
public final class LinePredicates {

    private LinePredicates() {
        // Utility class - prevent instantiation
    }

    // ===== Structural Tags =====

    /**
     * Line carries the given tag.
     *
     * @param construct tag
     * @return predicate
     */
    public static LinePredicate has(Construct construct) {
        return line -> line.has(construct);
    }

    /**
     * Line carries at least one of the given tags.
     *
     * @param constructs tags
     * @return predicate
     */
    public static LinePredicate hasAny(Construct... constructs) {
        return line -> {
            for (Construct construct : constructs) {
                if (line.has(construct)) {
                    return true;
                }
            }
            return false;
        };
    }

    // ===== Text =====

    /**
     * Code text (strings blanked, comments removed) contains a match of the pattern.
     *
     * @param pattern pattern
     * @return predicate
     */
    public static LinePredicate codeMatches(Pattern pattern) {
        return line -> pattern.matcher(line.codeText()).find();
    }

    /**
     * Raw text contains a match of the pattern.
     *
     * @param pattern pattern
     * @return predicate
     */
    public static LinePredicate rawMatches(Pattern pattern) {
        return line -> pattern.matcher(line.rawText()).find();
    }

    /**
     * Raw text is longer than the given number of characters.
     *
     * @param maxLength maximum allowed length
     * @return predicate
     */
    public static LinePredicate longerThan(int maxLength) {
        return line -> line.rawText().length() > maxLength;
    }

    /**
     * Line is a comment-only line (no code before the {@code #}).
     *
     * @return predicate
     */
    public static LinePredicate commentOnly() {
        return line -> line.has(Construct.COMMENT) && line.codeText().isBlank();
    }
}
