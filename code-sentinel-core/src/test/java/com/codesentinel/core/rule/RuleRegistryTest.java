package com.codesentinel.core.rule;

import com.codesentinel.core.model.Category;
import com.codesentinel.core.model.Severity;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link RuleRegistry}.
 */
class RuleRegistryTest {

    private static Rule rule(String id, Category category) {
        return new Rule(id, category, Severity.INFO, PatternMatcher.of("x"), null, "desc", null);
    }

    @Test
    void of_groupsRulesByCategoryInInsertionOrder() {
        RuleRegistry registry = RuleRegistry.of(
            rule("b-rule", Category.SECURITY),
            rule("a-rule", Category.SECURITY),
            rule("perf", Category.PERFORMANCE)
        );

        assertThat(registry.rulesFor(Category.SECURITY))
            .extracting(Rule::id)
            .containsExactly("b-rule", "a-rule");
        assertThat(registry.rulesFor(Category.SYNTAX)).isEmpty();
        assertThat(registry.allCategories()).containsExactlyInAnyOrder(Category.SECURITY, Category.PERFORMANCE);
        assertThat(registry.size()).isEqualTo(3);
    }

    @Test
    void of_duplicateId_isRejected() {
        assertThatThrownBy(() -> RuleRegistry.of(
            rule("same", Category.SECURITY),
            rule("same", Category.QUALITY)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Duplicate rule id: same");
    }

    @Test
    void ordinal_followsInsertionOrder() {
        RuleRegistry registry = RuleRegistry.of(rule("first", Category.QUALITY), rule("second", Category.SECURITY));

        assertThat(registry.ordinal("first")).isZero();
        assertThat(registry.ordinal("second")).isEqualTo(1);
        assertThat(registry.ordinal("unknown")).isEqualTo(Integer.MAX_VALUE);
    }

    @Test
    void findRule_returnsEmptyForUnknownId() {
        RuleRegistry registry = RuleRegistry.of(rule("known", Category.QUALITY));

        assertThat(registry.findRule("known")).isPresent();
        assertThat(registry.findRule("missing")).isEmpty();
    }

    @Test
    void fromProviders_ordersByPriority() {
        RuleRegistry registry = RuleRegistry.fromProviders(List.of(
            new StubProvider("late", 90, rule("late-rule", Category.QUALITY)),
            new StubProvider("early", 10, rule("early-rule", Category.QUALITY))
        ));

        assertThat(registry.allRules()).extracting(Rule::id).containsExactly("early-rule", "late-rule");
    }

    @Test
    void defaultRegistry_coversEveryCategory() {
        RuleRegistry registry = RuleRegistry.defaultRegistry();

        assertThat(registry.allCategories()).containsExactlyInAnyOrder(Category.values());
        assertThat(registry.findRule("hardcoded-credentials")).isPresent();
        assertThat(RuleRegistry.defaultRegistry()).isSameAs(registry);
    }

    private record StubProvider(String id, int priority, Rule rule) implements RuleProvider {
        @Override
        public String getId() {
            return id;
        }

        @Override
        public String getDisplayName() {
            return id;
        }

        @Override
        public Category getCategory() {
            return rule.category();
        }

        @Override
        public int getPriority() {
            return priority;
        }

        @Override
        public List<Rule> rules() {
            return List.of(rule);
        }
    }
}
