package com.codesentinel.core.rule.impl;

import com.codesentinel.core.model.Category;
import com.codesentinel.core.model.Issue;
import com.codesentinel.core.rule.RuleProvider;
import com.codesentinel.core.rule.RuleTestBase;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Functional tests for {@link QualityRules}.
 */
class QualityRulesTest extends RuleTestBase {

    @Override
    protected RuleProvider provider() {
        return new QualityRules();
    }

    @Test
    void lineLongerThanLimit_isReported() {
        String longLine = "total = " + "1 + ".repeat(40) + "1";

        assertThat(scan(longLine, "long-line")).hasSize(1);
        assertThat(scan("total = 1 + 1", "long-line")).isEmpty();
    }

    @Test
    void magicNumber_isReportedOutsideReturn() {
        assertThat(scan("timeout = 3600", "magic-number")).hasSize(1);
        assertThat(scan("return 3600", "magic-number")).isEmpty();
        assertThat(scan("ratio = 1.2345", "magic-number")).isEmpty();
    }

    @Test
    void commentedOutCode_isDistinguishedFromProse() {
        assertThat(scan("# x = compute(1)", "commented-out-code")).hasSize(1);
        assertThat(scan("# This is a note", "commented-out-code")).isEmpty();
    }

    @Test
    void semicolonSeparatedStatements_areReported() {
        assertThat(scan("x = 1; y = 2", "multiple-statements")).hasSize(1);
        assertThat(scan("s = \"a; b\"", "multiple-statements")).isEmpty();
    }

    @Test
    void bareExcept_carriesCweAndFix() {
        List<Issue> issues = scan("""
            try:
                run()
            except:
                pass
            """, "bare-except");

        assertThat(issues).hasSize(1);
        assertThat(issues.get(0).lineNumber()).isEqualTo(3);
        assertThat(issues.get(0).cweId()).isEqualTo("CWE-396");
        assertThat(issues.get(0).suggestedFix()).isEqualTo("except Exception as e:");
    }

    @Test
    void broadExceptWithoutBinding_isReported() {
        List<Issue> issues = scan("except Exception:", "unused-exception");

        assertThat(issues).hasSize(1);
        assertThat(issues.get(0).suggestedFix()).isEqualTo("except Exception as e:  # Use e for logging");
    }

    @Test
    void todoComment_isDelegable() {
        List<Issue> issues = scan("x = 1  # TODO: remove this", "todo-comment");

        assertThat(issues).hasSize(1);
        assertThat(issues.get(0).description()).isEqualTo("TODO comment: remove this");
        assertThat(issues.get(0).isDelegable()).isTrue();
    }

    @Test
    void printCall_isReported() {
        assertThat(scan("print(\"hi\")", "print-statement")).hasSize(1);
        assertThat(scan("printer(\"hi\")", "print-statement")).isEmpty();
    }

    @Test
    void mutableDefaultArgument_namesTheParameter() {
        List<Issue> issues = scan("def add(item, items=[]):", "mutable-default-argument");

        assertThat(issues).hasSize(1);
        assertThat(issues.get(0).description()).isEqualTo("Mutable default argument 'items'");
        assertThat(issues.get(0).suggestedFix())
            .isEqualTo("items=None, then inside the function: if items is None: items = []");
    }

    @Test
    void equalityWithNone_isReported() {
        List<Issue> issues = scan("if value == None:", "none-comparison");

        assertThat(issues).hasSize(1);
        assertThat(issues.get(0).description()).isEqualTo("Comparison to None with '=='");
        assertThat(scan("if value is None:", "none-comparison")).isEmpty();
    }

    @Test
    void everyRule_belongsToQuality() {
        assertThat(provider().rules())
            .hasSize(10)
            .allMatch(rule -> rule.category() == Category.QUALITY);
    }
}
