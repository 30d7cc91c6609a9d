package com.codesentinel.core.scanner;

import com.codesentinel.core.model.Category;
import com.codesentinel.core.model.Issue;
import com.codesentinel.core.model.LineContext;
import com.codesentinel.core.model.Severity;
import com.codesentinel.core.rule.PatternMatcher;
import com.codesentinel.core.rule.Rule;
import org.junit.jupiter.api.Test;

import java.util.Optional;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link RuleEvaluator}.
 */
class RuleEvaluatorTest {

    private final RuleEvaluator evaluator = new RuleEvaluator();

    @Test
    void evaluate_patternRule_capturesGroupsAndRendersDescription() {
        Rule rule = new Rule("eval", Category.SECURITY, Severity.CRITICAL,
            PatternMatcher.of("\\b(eval|exec)\\s*\\((\\w+)?"), "CWE-95", "Dangerous {1}() on {2}", null);
        LineContext line = LineContext.of(7, "    eval()", Set.of());

        Optional<RuleMatch> match = evaluator.evaluate(rule, line);

        assertThat(match).isPresent();
        assertThat(match.get().groups()).containsExactly("eval(", "eval", "");

        Issue issue = evaluator.toIssue(match.get());
        assertThat(issue.lineNumber()).isEqualTo(7);
        assertThat(issue.description()).isEqualTo("Dangerous eval() on ");
        assertThat(issue.codeSnippet()).isEqualTo("eval()");
        assertThat(issue.suggestedFix()).isNull();
    }

    @Test
    void evaluate_unknownMatcher_isRejected() {
        Rule rule = new Rule("odd", Category.QUALITY, Severity.INFO, () -> "odd", null, "odd", null);

        assertThatThrownBy(() -> evaluator.evaluate(rule, LineContext.of(1, "x", Set.of())))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("Unsupported matcher type");
    }

    @Test
    void snippet_longLine_isCut() {
        LineContext line = LineContext.of(1, "x".repeat(200), Set.of());

        String snippet = RuleEvaluator.snippet(line);

        assertThat(snippet).hasSize(RuleEvaluator.MAX_SNIPPET_LENGTH + 3).endsWith("...");
    }
}
