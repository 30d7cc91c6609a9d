package com.codesentinel.core.rule;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Matcher applying a regular expression to the raw text of each line.
 *
 * <p>Group 0 is the whole match; numbered groups are available to the rule's
 * description and fix templates as {@code {1}}, {@code {2}}, ...
 *
 * @param pattern compiled pattern, searched (not fully matched) against the line
 */
public record PatternMatcher(Pattern pattern) implements RuleMatcher {

    public PatternMatcher {
        Objects.requireNonNull(pattern, "pattern must not be null");
    }

    /**
     * Compiles a pattern matcher.
     *
     * @param regex regular expression
     * @return new matcher
     */
    public static PatternMatcher of(String regex) {
        return new PatternMatcher(Pattern.compile(regex));
    }

    @Override
    public String kind() {
        return "pattern";
    }

    @Override
    public String toString() {
        return "PatternMatcher[" + pattern.pattern() + "]";
    }
}
