package com.codesentinel.core.rule.impl;

import com.codesentinel.core.model.Issue;
import com.codesentinel.core.rule.RuleProvider;
import com.codesentinel.core.rule.RuleTestBase;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Functional tests for {@link TypeHintRules}.
 */
class TypeHintRulesTest extends RuleTestBase {

    @Override
    protected RuleProvider provider() {
        return new TypeHintRules();
    }

    @Test
    void unannotatedFunction_isMissingTypeHints() {
        List<Issue> issues = scan("def add(a, b):");

        assertThat(issues).extracting(Issue::ruleId).containsExactly("missing-type-hints");
        assertThat(issues.get(0).description()).isEqualTo("Function 'add' missing type hints");
    }

    @Test
    void annotatedParametersWithoutReturnType_isMissingReturnType() {
        List<Issue> issues = scan("def add(a: int, b: int):");

        assertThat(issues).extracting(Issue::ruleId).containsExactly("missing-return-type");
        assertThat(issues.get(0).suggestedFix()).isEqualTo("def add(a: int, b: int) -> ReturnType:");
    }

    @Test
    void fullyAnnotatedFunction_isClean() {
        assertThat(scan("def add(a: int, b: int) -> int:")).isEmpty();
    }
}
