package com.codesentinel.core.scoring;

import com.codesentinel.core.model.Category;
import com.codesentinel.core.model.Issue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Reduces issue sets into 0-100 category scores.
 *
 * <p>{@code score = clamp(100 - sum(weight(severity)), 0, 100)} over the issues of one
 * category. A score is therefore non-increasing in the multiset of severities found.
 * Pure: no side effects beyond a DEBUG line when a penalty is clamped.
 *
 * @since 1.0.0
 */
public class ScoringEngine {

    private static final Logger log = LoggerFactory.getLogger(ScoringEngine.class);

    public static final int MAX_SCORE = 100;
    public static final int MIN_SCORE = 0;

    private final SeverityWeights weights;

    public ScoringEngine() {
        this(SeverityWeights.defaults());
    }

    public ScoringEngine(SeverityWeights weights) {
        this.weights = Objects.requireNonNull(weights, "weights must not be null");
    }

    public SeverityWeights weights() {
        return weights;
    }

    /**
     * Scores one category.
     *
     * @param category category to score
     * @param issues issues of any category; only those of {@code category} count
     * @return score in {@code [0, 100]}
     */
    public int score(Category category, Collection<Issue> issues) {
        long penalty = 0;
        for (Issue issue : issues) {
            if (issue.category() == category) {
                penalty += weights.weightOf(issue.severity());
            }
        }
        return clamp(category, penalty);
    }

    /**
     * Scores every category, in {@link Category} declaration order.
     *
     * @param issues all issues of the unit
     * @return scores keyed by category wire name
     */
    public Map<String, Integer> categoryScores(List<Issue> issues) {
        Map<Category, Long> penalties = new EnumMap<>(Category.class);
        for (Issue issue : issues) {
            penalties.merge(issue.category(), (long) weights.weightOf(issue.severity()), Long::sum);
        }

        Map<String, Integer> scores = new LinkedHashMap<>();
        for (Category category : Category.values()) {
            scores.put(category.wireName(), clamp(category, penalties.getOrDefault(category, 0L)));
        }
        return scores;
    }

    private int clamp(Category category, long penalty) {
        long raw = MAX_SCORE - penalty;
        if (raw < MIN_SCORE) {
            log.debug("Score of {} clamped from {} to {}", category.wireName(), raw, MIN_SCORE);
            return MIN_SCORE;
        }
        if (raw > MAX_SCORE) {
            log.debug("Score of {} clamped from {} to {}", category.wireName(), raw, MAX_SCORE);
            return MAX_SCORE;
        }
        return (int) raw;
    }
}
