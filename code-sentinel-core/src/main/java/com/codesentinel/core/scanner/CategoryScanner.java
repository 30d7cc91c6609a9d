package com.codesentinel.core.scanner;

import com.codesentinel.core.model.Category;
import com.codesentinel.core.model.LineContext;
import com.codesentinel.core.model.RuleFault;
import com.codesentinel.core.rule.Rule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Runs every rule of one category over every line.
 *
 * <p>A rule that throws on a line is isolated: the fault is logged, recorded as a
 * {@link RuleFault}, and only that (rule, line) pair is skipped.
 *
 * @since 1.0.0
 */
public class CategoryScanner {

    private static final Logger log = LoggerFactory.getLogger(CategoryScanner.class);

    private final RuleEvaluator evaluator;

    public CategoryScanner(RuleEvaluator evaluator) {
        this.evaluator = evaluator;
    }

    /**
     * Scans the lines with the rules of one category.
     *
     * @param category category being scanned
     * @param rules rules of the category, in insertion order
     * @param lines line facts of the unit
     * @return matches and faults of this pass
     */
    public CategoryScanResult scan(Category category, List<Rule> rules, List<LineContext> lines) {
        List<RuleMatch> matches = new ArrayList<>();
        List<RuleFault> faults = new ArrayList<>();

        for (LineContext line : lines) {
            for (Rule rule : rules) {
                try {
                    Optional<RuleMatch> match = evaluator.evaluate(rule, line);
                    match.ifPresent(matches::add);
                } catch (RuntimeException | StackOverflowError e) {
                    log.warn("Rule {} failed on line {}: {}", rule.id(), line.lineNumber(), e.toString());
                    faults.add(new RuleFault(rule.id(), line.lineNumber(), e.toString()));
                }
            }
        }

        log.debug("Category {} produced {} matches ({} faults) over {} lines",
            category.wireName(), matches.size(), faults.size(), lines.size());
        return new CategoryScanResult(category, matches, faults, rules.size());
    }
}
