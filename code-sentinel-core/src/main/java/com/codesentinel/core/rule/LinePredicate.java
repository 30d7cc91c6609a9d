package com.codesentinel.core.rule;

import com.codesentinel.core.model.LineContext;

/**
 * Test over the structural facts of a single line.
 *
 * <p>Supports composition via {@link #and(LinePredicate)}, {@link #or(LinePredicate)}
 * and {@link #negate()} so structural rules can be declared from small building
 * blocks in {@link com.codesentinel.core.rule.base.LinePredicates}.
 *
 * <p><b>Example usage:</b></p>
 * <pre>{@code
 * LinePredicate predicate = LinePredicates.has(Construct.AUGMENTED_ASSIGNMENT)
 *     .and(LinePredicates.has(Construct.LOOP_BODY));
 * }</pre>
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface LinePredicate {

    /**
     * Checks the line.
     *
     * @param line line facts
     * @return {@code true} if the rule fires on this line
     */
    boolean test(LineContext line);

    /**
     * Combine this predicate with another using AND logic.
     *
     * @param other the other predicate
     * @return predicate that is true only when both are true
     */
    default LinePredicate and(LinePredicate other) {
        return line -> this.test(line) && other.test(line);
    }

    /**
     * Combine this predicate with another using OR logic.
     *
     * @param other the other predicate
     * @return predicate that is true when either is true
     */
    default LinePredicate or(LinePredicate other) {
        return line -> this.test(line) || other.test(line);
    }

    /**
     * Negate this predicate.
     *
     * @return the logical negation of this predicate
     */
    default LinePredicate negate() {
        return line -> !this.test(line);
    }
}
