package com.codesentinel.core.rule;

import com.codesentinel.core.model.Category;
import com.codesentinel.core.model.Severity;

import java.util.Objects;

/**
 * Immutable detection rule.
 *
 * <p>Conceptually a pure function from one line to zero or one match. Templates may
 * reference capture groups ({@code {0}}, {@code {1}}, {@code {1:upper}}, {@code {1:lower}})
 * and the trimmed line ({@code {snippet}}); see
 * {@link com.codesentinel.core.util.TemplateRenderer}.
 *
 * @param id unique kebab-case identifier (e.g. "hardcoded-credentials")
 * @param category category the rule belongs to
 * @param severity severity of every issue the rule emits
 * @param matcher pattern or structural matcher
 * @param cweId CWE identifier such as "CWE-798", or null
 * @param descriptionTemplate issue description template
 * @param fixTemplate deterministic fix template, or null when no fix can be computed
 */
public record Rule(
    String id,
    Category category,
    Severity severity,
    RuleMatcher matcher,
    String cweId,
    String descriptionTemplate,
    String fixTemplate
) {
    public Rule {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(category, "category must not be null");
        Objects.requireNonNull(severity, "severity must not be null");
        Objects.requireNonNull(matcher, "matcher must not be null");
        Objects.requireNonNull(descriptionTemplate, "descriptionTemplate must not be null");
        if (id.isBlank()) {
            throw new IllegalArgumentException("id must not be blank");
        }
    }

    /**
     * Returns true if the rule can compute a fix on its own.
     *
     * @return true when a fix template is present
     */
    public boolean hasFixTemplate() {
        return fixTemplate != null;
    }
}
