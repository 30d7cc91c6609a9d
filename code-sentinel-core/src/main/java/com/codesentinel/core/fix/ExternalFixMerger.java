package com.codesentinel.core.fix;

import com.codesentinel.core.model.AnalysisReport;
import com.codesentinel.core.model.Issue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Applies a {@link FixModel} to a finished report.
 *
 * <p>Only delegable issues are offered to the model; deterministic fixes are never
 * replaced. A model failure on one issue is logged and leaves that issue's fix null.
 * Issue order, counts and scores are unchanged.
 *
 * @since 1.0.0
 */
public class ExternalFixMerger {

    private static final Logger log = LoggerFactory.getLogger(ExternalFixMerger.class);

    private final FixModel model;

    public ExternalFixMerger(FixModel model) {
        this.model = Objects.requireNonNull(model, "model must not be null");
    }

    /**
     * Returns a copy of the report with model-proposed fixes merged in.
     *
     * @param report finished report
     * @return report with fixes for delegable issues where the model proposed one
     */
    public AnalysisReport merge(AnalysisReport report) {
        List<Issue> merged = new ArrayList<>(report.issues().size());
        int proposed = 0;
        int failed = 0;

        for (Issue issue : report.issues()) {
            if (!issue.isDelegable()) {
                merged.add(issue);
                continue;
            }
            try {
                String fix = model.propose(issue);
                if (fix != null) {
                    proposed++;
                }
                merged.add(issue.withSuggestedFix(fix));
            } catch (RuntimeException e) {
                failed++;
                log.warn("Fix model failed for rule {} at line {}: {}",
                    issue.ruleId(), issue.lineNumber(), e.getMessage());
                merged.add(issue);
            }
        }

        log.debug("Fix model proposed {} fixes ({} failures)", proposed, failed);
        return report.withIssues(merged);
    }
}
