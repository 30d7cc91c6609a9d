package com.codesentinel.core.fix;

import com.codesentinel.core.model.Issue;
import com.codesentinel.core.model.RuleFault;

import java.util.List;

/**
 * Issues built from the matches of one scan, plus the matches that could not be turned
 * into issues.
 *
 * @param issues issues in match order
 * @param faults one fault per match whose description or fix failed to render
 */
public record SuggestionOutcome(List<Issue> issues, List<RuleFault> faults) {

    public SuggestionOutcome {
        issues = issues == null ? List.of() : List.copyOf(issues);
        faults = faults == null ? List.of() : List.copyOf(faults);
    }
}
