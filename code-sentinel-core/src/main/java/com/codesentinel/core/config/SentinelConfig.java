package com.codesentinel.core.config;

import com.codesentinel.core.model.AnalysisOptions;
import com.codesentinel.core.model.Category;
import com.codesentinel.core.scoring.SeverityWeights;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.EnumSet;
import java.util.List;

/**
 * Root configuration for CodeSentinel.
 *
 * <p>Loaded from {@code codesentinel.yaml}. Every section is optional; missing sections
 * and fields take the values of {@link #defaults()}.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * analysis:
 *   categories:
 *     - security
 *     - performance
 *   disabled:
 *     - type_hints
 *
 * scoring:
 *   weights:
 *     critical: 25
 *     error: 15
 *     warning: 5
 *     info: 1
 *
 * engine:
 *   parallelism: 4
 *
 * output:
 *   format: markdown
 *   colors: false
 * }</pre>
 *
 * @param analysis category selection
 * @param scoring score weights
 * @param engine scan engine settings
 * @param output report output settings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SentinelConfig(
    @JsonProperty("analysis") AnalysisSettings analysis,
    @JsonProperty("scoring") ScoringSettings scoring,
    @JsonProperty("engine") EngineSettings engine,
    @JsonProperty("output") OutputSettings output
) {
    public SentinelConfig {
        if (analysis == null) {
            analysis = new AnalysisSettings(List.of(), List.of());
        }
        if (scoring == null) {
            scoring = new ScoringSettings(null);
        }
        if (engine == null) {
            engine = new EngineSettings(null);
        }
        if (output == null) {
            output = new OutputSettings(null, null);
        }
    }

    /**
     * Creates the default configuration: every category, default weights, sequential
     * scanning, colored text output.
     *
     * @return default configuration
     */
    public static SentinelConfig defaults() {
        return new SentinelConfig(null, null, null, null);
    }

    /**
     * Category selection.
     *
     * @param categories categories to scan; empty means all
     * @param disabled categories removed from the selection
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record AnalysisSettings(
        @JsonProperty("categories") List<Category> categories,
        @JsonProperty("disabled") List<Category> disabled
    ) {
        public AnalysisSettings {
            categories = categories == null ? List.of() : List.copyOf(categories);
            disabled = disabled == null ? List.of() : List.copyOf(disabled);
        }

        /**
         * Returns the enabled categories as analysis options.
         *
         * @return analysis options
         */
        public AnalysisOptions toOptions() {
            EnumSet<Category> enabled = categories.isEmpty()
                ? EnumSet.allOf(Category.class)
                : EnumSet.copyOf(categories);
            disabled.forEach(enabled::remove);
            return new AnalysisOptions(enabled);
        }
    }

    /**
     * Scoring settings.
     *
     * @param weights severity weights, defaults for missing entries
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ScoringSettings(
        @JsonProperty("weights") WeightSettings weights
    ) {
        public ScoringSettings {
            if (weights == null) {
                weights = new WeightSettings(null, null, null, null);
            }
        }
    }

    /**
     * Penalty per severity.
     *
     * @param critical critical weight
     * @param error error weight
     * @param warning warning weight
     * @param info info weight
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record WeightSettings(
        @JsonProperty("critical") Integer critical,
        @JsonProperty("error") Integer error,
        @JsonProperty("warning") Integer warning,
        @JsonProperty("info") Integer info
    ) {
        /**
         * Converts to severity weights, taking defaults for missing entries.
         *
         * @return severity weights
         * @throws IllegalArgumentException if a weight is negative
         */
        public SeverityWeights toSeverityWeights() {
            SeverityWeights defaults = SeverityWeights.defaults();
            return new SeverityWeights(
                critical == null ? defaults.critical() : critical,
                error == null ? defaults.error() : error,
                warning == null ? defaults.warning() : warning,
                info == null ? defaults.info() : info
            );
        }
    }

    /**
     * Scan engine settings.
     *
     * @param parallelism category passes run at once; 1 (default) scans sequentially
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record EngineSettings(
        @JsonProperty("parallelism") Integer parallelism
    ) {
        public EngineSettings {
            if (parallelism == null || parallelism < 1) {
                parallelism = 1;
            }
        }
    }

    /**
     * Output settings.
     *
     * @param format renderer id ("text", "json", "markdown")
     * @param colors ANSI colors in text output
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record OutputSettings(
        @JsonProperty("format") String format,
        @JsonProperty("colors") Boolean colors
    ) {
        public OutputSettings {
            if (format == null || format.isBlank()) {
                format = "text";
            }
            if (colors == null) {
                colors = Boolean.TRUE;
            }
        }
    }
}
