package com.codesentinel.cli;

import com.codesentinel.core.model.AnalysisOptions;
import com.codesentinel.core.model.Category;

import java.util.EnumSet;
import java.util.List;

/**
 * Applies {@code --only} and {@code --skip} category lists to a base selection.
 */
final class CategorySelection {

    private CategorySelection() {
        // Utility class
    }

    /**
     * Narrows the base options.
     *
     * @param base options from configuration
     * @param only categories to keep, null or empty keeps the base selection
     * @param skip categories to remove, may be null
     * @return resulting options
     * @throws IllegalArgumentException if a category name is unknown
     */
    static AnalysisOptions resolve(AnalysisOptions base, List<String> only, List<String> skip) {
        EnumSet<Category> enabled = EnumSet.noneOf(Category.class);
        if (only != null && !only.isEmpty()) {
            for (String name : only) {
                enabled.add(Category.fromString(name));
            }
        } else {
            enabled.addAll(base.enabledCategories());
        }
        if (skip != null) {
            for (String name : skip) {
                enabled.remove(Category.fromString(name));
            }
        }
        return new AnalysisOptions(enabled);
    }
}
