package com.codesentinel.core.rule.base;

import com.codesentinel.core.model.Severity;
import com.codesentinel.core.rule.LinePredicate;
import com.codesentinel.core.rule.PatternMatcher;
import com.codesentinel.core.rule.Rule;
import com.codesentinel.core.rule.RuleProvider;
import com.codesentinel.core.rule.StructuralPredicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Abstract base class for rule providers.
 *
 * <p>Provides:
 * <ul>
 *   <li>Logger initialization (one logger per provider class)</li>
 *   <li>Rule builders for both matcher variants ({@link #pattern}, {@link #structural})</li>
 *   <li>Lazy, cached rule list built once from {@link #defineRules()}</li>
 * </ul>
 *
 * <p>Concrete providers implement {@link #defineRules()} and the identity methods;
 * the category of every built rule is taken from {@link #getCategory()}.
 *
 * @see RuleProvider
 * @since 1.0.0
 */
public abstract class AbstractRuleProvider implements RuleProvider {

    /**
     * Logger instance for this provider.
     * Automatically initialized with the concrete provider class name.
     */
    protected final Logger log;

    private volatile List<Rule> rules;

    protected AbstractRuleProvider() {
        this.log = LoggerFactory.getLogger(getClass());
    }

    @Override
    public final List<Rule> rules() {
        List<Rule> result = rules;
        if (result == null) {
            synchronized (this) {
                result = rules;
                if (result == null) {
                    result = List.copyOf(defineRules());
                    rules = result;
                    log.debug("Defined {} {} rules", result.size(), getCategory().wireName());
                }
            }
        }
        return result;
    }

    /**
     * Builds this provider's rules, in insertion order.
     *
     * @return rule definitions
     */
    protected abstract List<Rule> defineRules();

    // ==================== Rule Builders ====================

    /**
     * Creates a rule applying a regular expression to the raw line text.
     *
     * @param id rule id
     * @param severity severity
     * @param regex regular expression
     * @param cweId CWE id or null
     * @param description description template
     * @param fix fix template or null
     * @return rule
     */
    protected Rule pattern(String id, Severity severity, String regex, String cweId,
                           String description, String fix) {
        return new Rule(id, getCategory(), severity, PatternMatcher.of(regex), cweId, description, fix);
    }

    /**
     * Creates a rule testing the structural facts of the line.
     *
     * @param id rule id
     * @param severity severity
     * @param predicate line predicate
     * @param cweId CWE id or null
     * @param description description template
     * @param fix fix template or null
     * @return rule
     */
    protected Rule structural(String id, Severity severity, LinePredicate predicate, String cweId,
                              String description, String fix) {
        return new Rule(id, getCategory(), severity, new StructuralPredicate(predicate), cweId, description, fix);
    }
}
