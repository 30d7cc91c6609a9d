package com.codesentinel.core.report;

import com.codesentinel.core.analysis.CodeAnalyzer;
import com.codesentinel.core.model.AnalysisOptions;
import com.codesentinel.core.model.Category;
import com.codesentinel.core.model.ComparisonResult;
import com.codesentinel.core.model.SourceUnit;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ReportComparator}.
 */
class ReportComparatorTest {

    private final CodeAnalyzer analyzer = new CodeAnalyzer();

    @Test
    void compare_fixedCredential_improvesSecurity() {
        // Given: a hardcoded password replaced by an environment lookup
        SourceUnit before = SourceUnit.of("password = \"admin123\"\nconnect(password)");
        SourceUnit after = SourceUnit.of("password = os.getenv(\"PASSWORD\")\nconnect(password)");

        // When
        ComparisonResult result = analyzer.compare(before, after, AnalysisOptions.of(Category.SECURITY));

        // Then
        assertThat(result.issuesFixed()).isEqualTo(1);
        assertThat(result.securityImprovement()).isEqualTo(25);
        assertThat(result.performanceImprovement()).isZero();
        assertThat(result.summary()).isEqualTo("Fixed 1 issues. Security improved by 25.0%");
    }

    @Test
    void compare_addedIssues_isNegative() {
        SourceUnit before = SourceUnit.of("x = compute()\nuse(x)");
        SourceUnit after = SourceUnit.of("x = eval(data)\nuse(x)");

        ComparisonResult result = analyzer.compare(before, after, AnalysisOptions.of(Category.SECURITY));

        assertThat(result.issuesFixed()).isEqualTo(-1);
        assertThat(result.securityImprovement()).isEqualTo(-25);
    }

    @Test
    void compare_simplerCode_hasNegativeComplexityChange() {
        SourceUnit before = SourceUnit.of("if a:\n    b()\nelif c:\n    d()");
        SourceUnit after = SourceUnit.of("b()");

        ComparisonResult result = analyzer.compare(before, after, AnalysisOptions.all());

        assertThat(result.complexityChange()).isEqualTo(-2);
    }
}
