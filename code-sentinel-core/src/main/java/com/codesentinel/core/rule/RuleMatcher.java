package com.codesentinel.core.rule;

/**
 * How a {@link Rule} recognizes a line.
 *
 * <p>Exactly two variants exist: {@link PatternMatcher} (regular expression over the raw
 * line text, capture groups feed the templates) and {@link StructuralPredicate} (test over
 * the line's structural tags). The scanner dispatches on the variant type; matchers carry
 * no evaluation logic of their own.
 *
 * @see PatternMatcher
 * @see StructuralPredicate
 * @since 1.0.0
 */
public interface RuleMatcher {

    /**
     * Short label of the matcher kind, used in listings.
     *
     * @return "pattern" or "structural"
     */
    String kind();
}
