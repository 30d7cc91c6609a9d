package com.codesentinel.core.scanner;

import com.codesentinel.core.model.Category;
import com.codesentinel.core.model.RuleFault;

import java.util.List;
import java.util.Objects;

/**
 * Output of one category pass.
 *
 * @param category scanned category
 * @param matches rule matches in line order, then rule order
 * @param faults (rule, line) pairs that raised and were skipped
 * @param rulesEvaluated number of rules of the category
 */
public record CategoryScanResult(
    Category category,
    List<RuleMatch> matches,
    List<RuleFault> faults,
    int rulesEvaluated
) {
    public CategoryScanResult {
        Objects.requireNonNull(category, "category must not be null");
        matches = matches == null ? List.of() : List.copyOf(matches);
        faults = faults == null ? List.of() : List.copyOf(faults);
    }
}
