package com.codesentinel.core.scanner;

import com.codesentinel.core.model.Category;
import com.codesentinel.core.model.RuleFault;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Merged output of every category pass of one scan.
 *
 * @param matches matches of all categories, in category order
 * @param faults faults of all categories, in category order
 * @param scannedCategories categories that were actually evaluated
 */
public record ScanOutcome(
    List<RuleMatch> matches,
    List<RuleFault> faults,
    Set<Category> scannedCategories
) {
    public ScanOutcome {
        matches = matches == null ? List.of() : List.copyOf(matches);
        faults = faults == null ? List.of() : List.copyOf(faults);
        scannedCategories = scannedCategories == null || scannedCategories.isEmpty()
            ? Collections.emptySet()
            : Collections.unmodifiableSet(EnumSet.copyOf(scannedCategories));
    }

    /**
     * Merges category results in the order given.
     *
     * @param results per-category results
     * @return merged outcome
     */
    public static ScanOutcome merge(List<CategoryScanResult> results) {
        List<RuleMatch> matches = new ArrayList<>();
        List<RuleFault> faults = new ArrayList<>();
        Set<Category> categories = EnumSet.noneOf(Category.class);
        for (CategoryScanResult result : results) {
            matches.addAll(result.matches());
            faults.addAll(result.faults());
            categories.add(result.category());
        }
        return new ScanOutcome(matches, faults, categories);
    }

    public static ScanOutcome empty() {
        return new ScanOutcome(List.of(), List.of(), Set.of());
    }
}
