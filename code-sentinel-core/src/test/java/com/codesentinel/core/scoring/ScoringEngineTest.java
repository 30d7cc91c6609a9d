package com.codesentinel.core.scoring;

import com.codesentinel.core.model.Category;
import com.codesentinel.core.model.Issue;
import com.codesentinel.core.model.Severity;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link ScoringEngine}.
 */
class ScoringEngineTest {

    private final ScoringEngine engine = new ScoringEngine();

    private static Issue issue(Category category, Severity severity) {
        return new Issue(1, severity, category, "d", "s", null, null, "rule");
    }

    @Test
    void score_noIssues_isPerfect() {
        assertThat(engine.score(Category.SECURITY, List.of())).isEqualTo(100);
    }

    @Test
    void score_subtractsDefaultWeights() {
        List<Issue> issues = List.of(
            issue(Category.SECURITY, Severity.CRITICAL),
            issue(Category.SECURITY, Severity.ERROR),
            issue(Category.SECURITY, Severity.WARNING),
            issue(Category.SECURITY, Severity.INFO),
            issue(Category.PERFORMANCE, Severity.CRITICAL)
        );

        assertThat(engine.score(Category.SECURITY, issues)).isEqualTo(100 - 25 - 15 - 5 - 1);
        assertThat(engine.score(Category.PERFORMANCE, issues)).isEqualTo(75);
    }

    @Test
    void score_isClampedAtZero() {
        List<Issue> issues = Collections.nCopies(5, issue(Category.SECURITY, Severity.CRITICAL));

        assertThat(engine.score(Category.SECURITY, issues)).isZero();
    }

    @Test
    void score_neverIncreasesWhenIssuesAreAdded() {
        List<Issue> fewer = List.of(issue(Category.QUALITY, Severity.INFO));
        List<Issue> more = List.of(issue(Category.QUALITY, Severity.INFO), issue(Category.QUALITY, Severity.INFO));

        assertThat(engine.score(Category.QUALITY, more)).isLessThanOrEqualTo(engine.score(Category.QUALITY, fewer));
    }

    @Test
    void categoryScores_coversEveryCategoryInDeclarationOrder() {
        Map<String, Integer> scores = engine.categoryScores(List.of(issue(Category.SYNTAX, Severity.ERROR)));

        assertThat(scores.keySet()).containsExactly(
            "security", "performance", "quality", "complexity", "dead_code", "type_hints", "syntax");
        assertThat(scores.get("syntax")).isEqualTo(85);
        assertThat(scores.get("security")).isEqualTo(100);
    }

    @Test
    void customWeights_areApplied() {
        ScoringEngine custom = new ScoringEngine(new SeverityWeights(50, 10, 2, 0));

        assertThat(custom.score(Category.SECURITY, List.of(issue(Category.SECURITY, Severity.CRITICAL)))).isEqualTo(50);
        assertThat(custom.score(Category.SECURITY, List.of(issue(Category.SECURITY, Severity.INFO)))).isEqualTo(100);
    }

    @Test
    void negativeWeight_isRejected() {
        assertThatThrownBy(() -> new SeverityWeights(25, -1, 5, 1))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
