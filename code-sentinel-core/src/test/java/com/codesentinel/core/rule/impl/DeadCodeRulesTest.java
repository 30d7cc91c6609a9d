package com.codesentinel.core.rule.impl;

import com.codesentinel.core.model.Issue;
import com.codesentinel.core.rule.RuleProvider;
import com.codesentinel.core.rule.RuleTestBase;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Functional tests for {@link DeadCodeRules}.
 */
class DeadCodeRulesTest extends RuleTestBase {

    @Override
    protected RuleProvider provider() {
        return new DeadCodeRules();
    }

    @Test
    void unusedFunction_isReportedAtDefinition() {
        List<Issue> issues = scan("""
            def helper():
                return 1

            def main():
                return 2
            """, "unused-definition");

        assertThat(issues).extracting(Issue::lineNumber).containsExactly(1);
    }

    @Test
    void usedVariable_isNotReported() {
        assertThat(scan("""
            limit = 10
            check(limit)
            """, "unused-definition")).isEmpty();
    }

    @Test
    void statementAfterRaise_isUnreachable() {
        List<Issue> issues = scan("""
            def fail():
                raise ValueError()
                cleanup()
            fail()
            """, "unreachable-code");

        assertThat(issues).extracting(Issue::lineNumber).containsExactly(3);
    }
}
