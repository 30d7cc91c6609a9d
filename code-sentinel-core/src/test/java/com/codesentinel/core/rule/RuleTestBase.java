package com.codesentinel.core.rule;

import com.codesentinel.core.fix.FixSuggestionEngine;
import com.codesentinel.core.model.Issue;
import com.codesentinel.core.model.LineContext;
import com.codesentinel.core.model.SourceUnit;
import com.codesentinel.core.scanner.CategoryScanResult;
import com.codesentinel.core.scanner.CategoryScanner;
import com.codesentinel.core.scanner.RuleEvaluator;
import com.codesentinel.core.structure.StructuralExtractor;

import java.util.List;

/**
 * Base class for rule provider tests.
 *
 * <p>Runs one provider's rules over a code fixture through the same extraction, scan
 * and fix steps the analyzer uses, so subclasses only write fixtures and assertions.
 *
 * @since 1.0.0
 */
public abstract class RuleTestBase {

    private final StructuralExtractor extractor = new StructuralExtractor();
    private final CategoryScanner scanner = new CategoryScanner(new RuleEvaluator());
    private final FixSuggestionEngine fixEngine = new FixSuggestionEngine();

    /**
     * Returns the provider under test.
     *
     * @return provider
     */
    protected abstract RuleProvider provider();

    /**
     * Scans code with the provider's rules.
     *
     * @param code source text
     * @return issues with fixes, in scan order
     */
    protected List<Issue> scan(String code) {
        List<LineContext> lines = extractor.extract(SourceUnit.of(code));
        CategoryScanResult result = scanner.scan(provider().getCategory(), provider().rules(), lines);
        return fixEngine.toIssues(result.matches());
    }

    /**
     * Scans code and keeps only the issues of one rule.
     *
     * @param code source text
     * @param ruleId rule id
     * @return issues of that rule
     */
    protected List<Issue> scan(String code, String ruleId) {
        return scan(code).stream()
            .filter(issue -> issue.ruleId().equals(ruleId))
            .toList();
    }
}
