package com.codesentinel.core.scanner;

import com.codesentinel.core.model.Issue;
import com.codesentinel.core.model.LineContext;
import com.codesentinel.core.rule.PatternMatcher;
import com.codesentinel.core.rule.Rule;
import com.codesentinel.core.rule.RuleMatcher;
import com.codesentinel.core.rule.StructuralPredicate;
import com.codesentinel.core.util.TemplateRenderer;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;

/**
 * Evaluates a single rule against a single line and turns matches into issues.
 *
 * <p>Dispatches on the matcher variant: pattern rules search the raw text, structural
 * rules test the line's tags. Stateless and thread-safe.
 *
 * @since 1.0.0
 */
public class RuleEvaluator {

    /**
     * Longest code snippet kept on an issue before it is cut with "...".
     */
    public static final int MAX_SNIPPET_LENGTH = 120;

    /**
     * Evaluates one rule on one line.
     *
     * @param rule rule
     * @param line line facts
     * @return the match, or empty if the rule does not fire
     * @throws IllegalStateException if the matcher variant is unknown
     */
    public Optional<RuleMatch> evaluate(Rule rule, LineContext line) {
        RuleMatcher matcher = rule.matcher();
        if (matcher instanceof PatternMatcher patternMatcher) {
            Matcher m = patternMatcher.pattern().matcher(line.rawText());
            if (!m.find()) {
                return Optional.empty();
            }
            List<String> groups = new ArrayList<>(m.groupCount() + 1);
            for (int i = 0; i <= m.groupCount(); i++) {
                groups.add(m.group(i));
            }
            return Optional.of(new RuleMatch(rule, line, groups));
        }
        if (matcher instanceof StructuralPredicate structural) {
            return structural.predicate().test(line)
                ? Optional.of(new RuleMatch(rule, line, List.of()))
                : Optional.empty();
        }
        throw new IllegalStateException("Unsupported matcher type: " + matcher.getClass().getName());
    }

    /**
     * Builds the raw issue for a match. The suggested fix is left null; fixes are
     * attached by the fix suggestion engine.
     *
     * @param match rule match
     * @return issue without a suggested fix
     */
    public Issue toIssue(RuleMatch match) {
        Rule rule = match.rule();
        String snippet = snippet(match.line());
        return new Issue(
            match.lineNumber(),
            rule.severity(),
            rule.category(),
            TemplateRenderer.render(rule.descriptionTemplate(), match.groups(), snippet),
            snippet,
            null,
            rule.cweId(),
            rule.id()
        );
    }

    /**
     * Returns the trimmed line, cut to {@link #MAX_SNIPPET_LENGTH} characters.
     *
     * @param line line facts
     * @return code snippet
     */
    public static String snippet(LineContext line) {
        String trimmed = line.trimmed();
        if (trimmed.length() <= MAX_SNIPPET_LENGTH) {
            return trimmed;
        }
        return trimmed.substring(0, MAX_SNIPPET_LENGTH) + "...";
    }
}
