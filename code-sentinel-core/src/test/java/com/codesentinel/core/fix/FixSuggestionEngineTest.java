package com.codesentinel.core.fix;

import com.codesentinel.core.model.Category;
import com.codesentinel.core.model.Issue;
import com.codesentinel.core.model.LineContext;
import com.codesentinel.core.model.Severity;
import com.codesentinel.core.rule.PatternMatcher;
import com.codesentinel.core.rule.Rule;
import com.codesentinel.core.scanner.RuleEvaluator;
import com.codesentinel.core.scanner.RuleMatch;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link FixSuggestionEngine}.
 */
class FixSuggestionEngineTest {

    private final FixSuggestionEngine engine = new FixSuggestionEngine();

    private static RuleMatch match(String fixTemplate, String rawLine, List<String> groups) {
        Rule rule = new Rule("r", Category.SECURITY, Severity.CRITICAL, PatternMatcher.of("x"),
            "CWE-798", "desc {1}", fixTemplate);
        return new RuleMatch(rule, LineContext.of(4, rawLine, Set.of()), groups);
    }

    @Test
    void suggest_rendersTemplateWithGroups() {
        RuleMatch match = match("{1} = os.getenv(\"{1:upper}\")", "  secret = 'abc'", List.of("secret = 'abc'", "secret"));

        assertThat(engine.suggest(match)).isEqualTo("secret = os.getenv(\"SECRET\")");
    }

    @Test
    void suggest_withoutTemplate_isNull() {
        assertThat(engine.suggest(match(null, "x", List.of()))).isNull();
    }

    @Test
    void toIssues_attachesFixAndKeepsMatchOrder() {
        List<Issue> issues = engine.toIssues(List.of(
            match("{snippet}:", "  if x", List.of()),
            match(null, "y", List.of("y", "y"))
        ));

        assertThat(issues).hasSize(2);
        assertThat(issues.get(0).suggestedFix()).isEqualTo("if x:");
        assertThat(issues.get(0).lineNumber()).isEqualTo(4);
        assertThat(issues.get(1).suggestedFix()).isNull();
        assertThat(issues.get(1).description()).isEqualTo("desc y");
    }

    @Test
    void suggest_isDeterministic() {
        RuleMatch match = match("{1}https://{2}{1}", "u = 'http://a.b'", List.of("'http://a.b", "'", "a.b"));

        assertThat(engine.suggest(match)).isEqualTo(engine.suggest(match)).isEqualTo("'https://a.b'");
    }

    @Test
    void build_renderFailure_isRecordedAsFaultAndOtherMatchesSurvive() {
        // Given: an evaluator that cannot build the issue of rule "bad"
        RuleEvaluator failing = new RuleEvaluator() {
            @Override
            public Issue toIssue(RuleMatch match) {
                if (match.rule().id().equals("bad")) {
                    throw new IllegalStateException("render failed");
                }
                return super.toIssue(match);
            }
        };
        Rule bad = new Rule("bad", Category.QUALITY, Severity.INFO, PatternMatcher.of("x"), null, "bad", null);
        Rule good = new Rule("good", Category.QUALITY, Severity.INFO, PatternMatcher.of("x"), null, "good", null);
        LineContext line = LineContext.of(1, "x = 1", Set.of());

        // When
        SuggestionOutcome outcome = new FixSuggestionEngine(failing).build(List.of(
            new RuleMatch(bad, line, List.of("x")),
            new RuleMatch(good, line, List.of("x"))
        ));

        // Then: the good match becomes an issue, the bad one a fault
        assertThat(outcome.issues()).extracting(Issue::ruleId).containsExactly("good");
        assertThat(outcome.faults()).hasSize(1);
        assertThat(outcome.faults().get(0).ruleId()).isEqualTo("bad");
        assertThat(outcome.faults().get(0).lineNumber()).isEqualTo(1);
        assertThat(outcome.faults().get(0).message()).contains("render failed");
    }
}
