package com.codesentinel.core.model;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Per-call analysis options.
 *
 * @param enabledCategories categories to scan; categories not listed are never evaluated
 */
public record AnalysisOptions(Set<Category> enabledCategories) {

    public AnalysisOptions {
        enabledCategories = enabledCategories == null || enabledCategories.isEmpty()
            ? Collections.emptySet()
            : Collections.unmodifiableSet(EnumSet.copyOf(enabledCategories));
    }

    /**
     * Options with every category enabled.
     *
     * @return all-categories options
     */
    public static AnalysisOptions all() {
        return new AnalysisOptions(EnumSet.allOf(Category.class));
    }

    /**
     * Options with exactly the given categories enabled.
     *
     * @param categories enabled categories
     * @return options
     */
    public static AnalysisOptions of(Category... categories) {
        return new AnalysisOptions(categories.length == 0
            ? EnumSet.noneOf(Category.class)
            : EnumSet.copyOf(Arrays.asList(categories)));
    }

    /**
     * Options with exactly the given categories enabled.
     *
     * @param categories enabled categories
     * @return options
     */
    public static AnalysisOptions of(Collection<Category> categories) {
        return new AnalysisOptions(categories.isEmpty()
            ? EnumSet.noneOf(Category.class)
            : EnumSet.copyOf(categories));
    }

    /**
     * Returns true if the category is enabled.
     *
     * @param category category to test
     * @return true if enabled
     */
    public boolean isEnabled(Category category) {
        return enabledCategories.contains(category);
    }

    /**
     * Returns a copy with the given category removed.
     *
     * @param category category to disable
     * @return new options
     */
    public AnalysisOptions without(Category category) {
        EnumSet<Category> remaining = EnumSet.noneOf(Category.class);
        remaining.addAll(enabledCategories);
        remaining.remove(category);
        return new AnalysisOptions(remaining);
    }
}
