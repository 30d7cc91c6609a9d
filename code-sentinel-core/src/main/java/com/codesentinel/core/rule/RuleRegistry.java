package com.codesentinel.core.rule;

import com.codesentinel.core.model.Category;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.Set;

/**
 * Immutable catalog of detection rules, grouped by category.
 *
 * <p>A registry is a value: it is built once and passed into the scanner engine.
 * No write path exists after construction, so concurrent readers need no locking.
 *
 * <p>{@link #defaultRegistry()} collects every {@link RuleProvider} found on the class
 * path. Tests build minimal catalogs with {@link #of(Rule...)}.
 *
 * @since 1.0.0
 */
public final class RuleRegistry {

    private static final Logger log = LoggerFactory.getLogger(RuleRegistry.class);

    private final Map<Category, List<Rule>> rulesByCategory;
    private final Map<String, Rule> rulesById;
    private final Map<String, Integer> ordinals;
    private final List<Rule> rules;

    private RuleRegistry(List<Rule> rules) {
        Map<Category, List<Rule>> byCategory = new EnumMap<>(Category.class);
        Map<String, Rule> byId = new LinkedHashMap<>();
        Map<String, Integer> order = new HashMap<>();

        for (Rule rule : rules) {
            if (byId.putIfAbsent(rule.id(), rule) != null) {
                throw new IllegalArgumentException("Duplicate rule id: " + rule.id());
            }
            order.put(rule.id(), order.size());
            byCategory.computeIfAbsent(rule.category(), c -> new ArrayList<>()).add(rule);
        }

        Map<Category, List<Rule>> frozen = new EnumMap<>(Category.class);
        byCategory.forEach((category, list) -> frozen.put(category, List.copyOf(list)));

        this.rulesByCategory = Collections.unmodifiableMap(frozen);
        this.rulesById = Collections.unmodifiableMap(byId);
        this.ordinals = Collections.unmodifiableMap(order);
        this.rules = List.copyOf(rules);
    }

    /**
     * Builds a registry from explicit rules, in the given insertion order.
     *
     * @param rules rules
     * @return new registry
     * @throws IllegalArgumentException if two rules share an id
     */
    public static RuleRegistry of(Rule... rules) {
        return new RuleRegistry(Arrays.asList(rules));
    }

    /**
     * Builds a registry from explicit rules, in iteration order.
     *
     * @param rules rules
     * @return new registry
     * @throws IllegalArgumentException if two rules share an id
     */
    public static RuleRegistry of(Collection<Rule> rules) {
        return new RuleRegistry(new ArrayList<>(rules));
    }

    /**
     * Builds a registry from providers, ordered by priority then id.
     *
     * @param providers rule providers
     * @return new registry
     */
    public static RuleRegistry fromProviders(Collection<? extends RuleProvider> providers) {
        List<RuleProvider> ordered = new ArrayList<>(providers);
        ordered.sort(Comparator.comparingInt(RuleProvider::getPriority).thenComparing(RuleProvider::getId));

        List<Rule> collected = new ArrayList<>();
        for (RuleProvider provider : ordered) {
            List<Rule> contributed = provider.rules();
            log.debug("Provider {} contributed {} rules", provider.getId(), contributed.size());
            collected.addAll(contributed);
        }
        return new RuleRegistry(collected);
    }

    /**
     * Returns the process-wide registry built from every {@link RuleProvider} on the class path.
     *
     * <p>Built once, on first use.
     *
     * @return default registry
     */
    public static RuleRegistry defaultRegistry() {
        return DefaultHolder.INSTANCE;
    }

    /**
     * Discovers rule providers via {@link ServiceLoader}.
     *
     * @return discovered providers
     */
    public static List<RuleProvider> discoverProviders() {
        List<RuleProvider> providers = new ArrayList<>();
        ServiceLoader.load(RuleProvider.class).forEach(providers::add);
        return providers;
    }

    /**
     * Returns the rules of a category in insertion order.
     *
     * @param category category
     * @return rules, empty if the category has none
     */
    public List<Rule> rulesFor(Category category) {
        return rulesByCategory.getOrDefault(category, List.of());
    }

    /**
     * Returns the categories that have at least one rule.
     *
     * @return categories
     */
    public Set<Category> allCategories() {
        return rulesByCategory.isEmpty()
            ? Collections.emptySet()
            : Collections.unmodifiableSet(EnumSet.copyOf(rulesByCategory.keySet()));
    }

    /**
     * Looks up a rule by id.
     *
     * @param id rule id
     * @return rule if registered
     */
    public Optional<Rule> findRule(String id) {
        return Optional.ofNullable(rulesById.get(id));
    }

    /**
     * Returns the global insertion position of a rule.
     *
     * @param id rule id
     * @return 0-based position, or {@link Integer#MAX_VALUE} for unknown ids
     */
    public int ordinal(String id) {
        return ordinals.getOrDefault(id, Integer.MAX_VALUE);
    }

    /**
     * Returns every rule in insertion order.
     *
     * @return all rules
     */
    public List<Rule> allRules() {
        return rules;
    }

    public int size() {
        return rules.size();
    }

    private static final class DefaultHolder {
        private static final RuleRegistry INSTANCE = build();

        private static RuleRegistry build() {
            RuleRegistry registry = fromProviders(discoverProviders());
            log.info("Rule registry initialized with {} rules in {} categories",
                registry.size(), registry.allCategories().size());
            return registry;
        }
    }
}
