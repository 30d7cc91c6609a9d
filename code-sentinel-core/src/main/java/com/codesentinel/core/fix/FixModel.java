package com.codesentinel.core.fix;

import com.codesentinel.core.model.Issue;

/**
 * External fixer for issues without a deterministic fix, typically backed by a
 * generative model.
 *
 * <p>The analysis core never calls a fix model. Callers apply one to a finished report
 * with {@link ExternalFixMerger}, outside the scan path, so analysis latency and
 * failure modes stay independent of any network dependency.
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface FixModel {

    /**
     * Proposes a fix for one issue.
     *
     * @param issue delegable issue
     * @return fix text, or null when the model has no proposal
     */
    String propose(Issue issue);
}
