package com.codesentinel.core.fix;

import com.codesentinel.core.model.Issue;
import com.codesentinel.core.model.RuleFault;
import com.codesentinel.core.rule.Rule;
import com.codesentinel.core.scanner.RuleEvaluator;
import com.codesentinel.core.scanner.RuleMatch;
import com.codesentinel.core.util.TemplateRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Derives deterministic fix text from a match and its rule's fix template.
 *
 * <p>Issues of rules without a template keep a null fix and are thereby delegable
 * (see {@link Issue#isDelegable()}).
 *
 * <p><b>Example:</b> the hardcoded-credentials template {@code {1} = os.getenv("{1:upper}")}
 * turns {@code db_password = "s3cret"} into {@code db_password = os.getenv("DB_PASSWORD")}.
 *
 * <p>Each match is built in isolation: a match whose description or fix fails to
 * render is logged and recorded as a {@link RuleFault}, and the other matches still
 * become issues.
 *
 * @since 1.0.0
 */
public class FixSuggestionEngine {

    private static final Logger log = LoggerFactory.getLogger(FixSuggestionEngine.class);

    private final RuleEvaluator evaluator;

    public FixSuggestionEngine() {
        this(new RuleEvaluator());
    }

    public FixSuggestionEngine(RuleEvaluator evaluator) {
        this.evaluator = evaluator;
    }

    /**
     * Renders the fix of one match.
     *
     * @param match rule match
     * @return fix text, or null when the rule has no fix template
     */
    public String suggest(RuleMatch match) {
        Rule rule = match.rule();
        if (!rule.hasFixTemplate()) {
            return null;
        }
        return TemplateRenderer.render(rule.fixTemplate(), match.groups(), match.line().trimmed());
    }

    /**
     * Builds the final issue of every match, fix included.
     *
     * @param matches rule matches
     * @return issues in match order, without the matches that failed to render
     */
    public List<Issue> toIssues(List<RuleMatch> matches) {
        return build(matches).issues();
    }

    /**
     * Builds the final issue of every match and records a fault for each match that
     * fails to render.
     *
     * @param matches rule matches
     * @return issues in match order and render faults
     */
    public SuggestionOutcome build(List<RuleMatch> matches) {
        List<Issue> issues = new ArrayList<>(matches.size());
        List<RuleFault> faults = new ArrayList<>();
        for (RuleMatch match : matches) {
            try {
                issues.add(evaluator.toIssue(match).withSuggestedFix(suggest(match)));
            } catch (RuntimeException e) {
                log.warn("Rule {} failed to render on line {}: {}",
                    match.rule().id(), match.lineNumber(), e.toString());
                faults.add(new RuleFault(match.rule().id(), match.lineNumber(), e.toString()));
            }
        }
        return new SuggestionOutcome(issues, faults);
    }
}
