package com.codesentinel.core.rule;

import java.util.Objects;

/**
 * Matcher testing the structural facts of each line.
 *
 * @param predicate line predicate
 */
public record StructuralPredicate(LinePredicate predicate) implements RuleMatcher {

    public StructuralPredicate {
        Objects.requireNonNull(predicate, "predicate must not be null");
    }

    @Override
    public String kind() {
        return "structural";
    }
}
