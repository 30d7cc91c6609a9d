package com.codesentinel.core.report.render.impl;

import com.codesentinel.core.analysis.CodeAnalyzer;
import com.codesentinel.core.model.AnalysisOptions;
import com.codesentinel.core.model.AnalysisReport;
import com.codesentinel.core.model.SourceUnit;
import com.codesentinel.core.report.render.RenderContext;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link TextReportRenderer}.
 */
class TextReportRendererTest {

    private final TextReportRenderer renderer = new TextReportRenderer();
    private final AnalysisReport report = new CodeAnalyzer()
        .analyze(SourceUnit.of("password = \"admin123\"", "settings.py"), AnalysisOptions.all());

    @Test
    void render_plain_containsSectionsIssuesAndFixes() {
        String output = renderer.render(report, RenderContext.defaults());

        assertThat(output)
            .contains("CODE ANALYSIS REPORT: settings.py")
            .contains("Status: CRITICAL")
            .contains("SECURITY SCORE: 75/100  Good")
            .contains("line 1 [security] Hardcoded credentials detected in 'password' (CWE-798)")
            .contains("fix: password = os.getenv(\"PASSWORD\")")
            .contains("Fix security vulnerabilities immediately")
            .doesNotContain("\u001B[");
    }

    @Test
    void render_withColors_emitsAnsiCodes() {
        String output = renderer.render(report, new RenderContext(Map.of("console.colors", "true")));

        assertThat(output).contains("\u001B[");
    }

    @Test
    void render_withoutFixes_omitsFixLines() {
        String output = renderer.render(report, new RenderContext(Map.of("console.showFixes", "false")));

        assertThat(output).doesNotContain("fix: ");
    }

    @Test
    void render_failedReport_showsReasonOnly() {
        String output = renderer.render(AnalysisReport.failed("empty.py", "Source text is empty"),
            RenderContext.defaults());

        assertThat(output)
            .contains("Status: FAILED")
            .contains("Analysis failed: Source text is empty")
            .doesNotContain("ISSUES");
    }
}
