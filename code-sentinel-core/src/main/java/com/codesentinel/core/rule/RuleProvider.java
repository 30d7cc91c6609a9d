package com.codesentinel.core.rule;

import com.codesentinel.core.model.Category;

import java.util.List;

/**
 * Contributes the rules of one category to the {@link RuleRegistry}.
 *
 * <p>Providers are discovered via Java Service Provider Interface (SPI) and read once
 * when the default registry is built. Providers are ordered by priority (lower first),
 * and that order together with each provider's list order fixes the global rule
 * insertion order used to break ties when sorting issues.
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.codesentinel.core.rule.RuleProvider}
 *
 * @see RuleRegistry
 * @since 1.0.0
 */
public interface RuleProvider {

    /**
     * Returns unique identifier for this provider. Should be kebab-case
     * (e.g., "security-rules").
     *
     * @return unique provider identifier
     */
    String getId();

    /**
     * Returns human-readable display name, used in CLI listings.
     *
     * @return display name
     */
    String getDisplayName();

    /**
     * Returns the category every contributed rule belongs to.
     *
     * @return rule category
     */
    Category getCategory();

    /**
     * Returns registration priority. Lower values register first.
     *
     * @return priority value
     */
    int getPriority();

    /**
     * Returns the rules of this provider, in insertion order.
     *
     * @return rules, never null
     */
    List<Rule> rules();
}
