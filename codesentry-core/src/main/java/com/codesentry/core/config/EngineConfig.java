package com.codesentry.core.config;

import com.codesentry.core.execution.ExecutionMode;
import com.codesentry.core.execution.ExecutionOptions;
import com.codesentry.core.incremental.IncrementalCache;
import com.codesentry.core.metrics.MetricsHistory;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Root configuration of a CodeSentry project.
 *
 * <p>Loaded from {@code codesentry.yaml} in the project root. Every section is
 * optional; missing sections and fields fall back to the defaults of
 * {@link #defaults()}.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * analysis:
 *   mode: parallel
 *   timeoutMs: 10000
 *   globalTimeoutMs: 60000
 *
 * incremental:
 *   enabled: true
 *   statePath: ".codesentry/incremental.json"
 *
 * metrics:
 *   enabled: true
 *   historyPath: ".codesentry/metrics-history.json"
 *   historyMax: 200
 *
 * workers:
 *   maxWorkers: 4
 *   batchSize: 10
 *
 * techniques:
 *   enabled:
 *     - todo-comments
 *     - oversized-file
 *   settings:
 *     oversized-file:
 *       maxLines: 800
 *
 * output:
 *   jsonReport: "build/codesentry-report.json"
 * }</pre>
 *
 * @param analysis execution settings
 * @param incremental incremental store settings
 * @param metrics metrics and history settings
 * @param workers worker pool settings
 * @param techniques technique selection and settings
 * @param output report settings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EngineConfig(
    @JsonProperty("analysis") AnalysisConfig analysis,
    @JsonProperty("incremental") IncrementalConfig incremental,
    @JsonProperty("metrics") MetricsConfig metrics,
    @JsonProperty("workers") WorkersConfig workers,
    @JsonProperty("techniques") TechniquesConfig techniques,
    @JsonProperty("output") OutputConfig output
) {
    /**
     * Default location of the incremental store, relative to the project root.
     */
    public static final String DEFAULT_STATE_PATH = ".codesentry/incremental.json";

    /**
     * Default location of the metrics history, relative to the project root.
     */
    public static final String DEFAULT_HISTORY_PATH = ".codesentry/metrics-history.json";

    /**
     * Compact constructor filling missing sections with defaults.
     */
    public EngineConfig {
        if (analysis == null) {
            analysis = new AnalysisConfig(null, null, null);
        }
        if (incremental == null) {
            incremental = new IncrementalConfig(null, null);
        }
        if (metrics == null) {
            metrics = new MetricsConfig(null, null, null);
        }
        if (workers == null) {
            workers = new WorkersConfig(null, null);
        }
        if (techniques == null) {
            techniques = new TechniquesConfig(null, null);
        }
        if (output == null) {
            output = new OutputConfig(null);
        }
    }

    /**
     * Creates the default configuration: sequential mode, 30 s budgets, incremental
     * mode and metrics history enabled under {@code .codesentry/}, all techniques enabled.
     *
     * @return default configuration
     */
    public static EngineConfig defaults() {
        return new EngineConfig(null, null, null, null, null, null);
    }

    /**
     * Builds run options, resolving relative state paths against the project root.
     *
     * @param baseDir project root
     * @return options; callers add listener and syntax tree builder via {@link ExecutionOptions#toBuilder()}
     */
    public ExecutionOptions toOptions(Path baseDir) {
        ExecutionOptions.Builder builder = ExecutionOptions.builder()
            .mode(analysis.effectiveMode())
            .timeoutMs(analysis.effectiveTimeoutMs())
            .globalTimeoutMs(analysis.effectiveGlobalTimeoutMs())
            .metricsEnabled(metrics.isEnabled())
            .workerCount(workers.maxWorkers())
            .batchSize(workers.effectiveBatchSize());

        if (incremental.isEnabled()) {
            builder.incrementalCache(new IncrementalCache(baseDir.resolve(incremental.effectiveStatePath())));
        }
        if (metrics.isEnabled()) {
            builder.metricsHistory(new MetricsHistory(
                baseDir.resolve(metrics.effectiveHistoryPath()), metrics.effectiveHistoryMax()));
        }
        return builder.build();
    }

    /**
     * Execution settings.
     *
     * @param mode {@code sequential} (default) or {@code parallel}
     * @param timeoutMs budget per technique per file, 0 disables it
     * @param globalTimeoutMs budget per global technique, 0 disables it
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record AnalysisConfig(
        @JsonProperty("mode") String mode,
        @JsonProperty("timeoutMs") Long timeoutMs,
        @JsonProperty("globalTimeoutMs") Long globalTimeoutMs
    ) {
        public ExecutionMode effectiveMode() {
            return "parallel".equalsIgnoreCase(mode) ? ExecutionMode.PARALLEL : ExecutionMode.SEQUENTIAL;
        }

        public long effectiveTimeoutMs() {
            return timeoutMs != null ? timeoutMs : ExecutionOptions.DEFAULT_TIMEOUT_MS;
        }

        public long effectiveGlobalTimeoutMs() {
            return globalTimeoutMs != null ? globalTimeoutMs : ExecutionOptions.DEFAULT_TIMEOUT_MS;
        }
    }

    /**
     * Incremental store settings.
     *
     * @param enabled whether unchanged files are skipped (default true)
     * @param statePath store location relative to the project root
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record IncrementalConfig(
        @JsonProperty("enabled") Boolean enabled,
        @JsonProperty("statePath") String statePath
    ) {
        public boolean isEnabled() {
            return enabled == null || enabled;
        }

        public String effectiveStatePath() {
            return statePath == null || statePath.isBlank() ? DEFAULT_STATE_PATH : statePath;
        }
    }

    /**
     * Metrics settings.
     *
     * @param enabled whether metrics are collected (default true)
     * @param historyPath history location relative to the project root
     * @param historyMax entries kept in the history
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record MetricsConfig(
        @JsonProperty("enabled") Boolean enabled,
        @JsonProperty("historyPath") String historyPath,
        @JsonProperty("historyMax") Integer historyMax
    ) {
        public boolean isEnabled() {
            return enabled == null || enabled;
        }

        public String effectiveHistoryPath() {
            return historyPath == null || historyPath.isBlank() ? DEFAULT_HISTORY_PATH : historyPath;
        }

        public int effectiveHistoryMax() {
            return historyMax != null && historyMax > 0 ? historyMax : MetricsHistory.DEFAULT_MAX_ENTRIES;
        }
    }

    /**
     * Worker pool settings, used in parallel mode only.
     *
     * @param maxWorkers worker threads, {@code null} for the number of processors
     * @param batchSize files per batch
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record WorkersConfig(
        @JsonProperty("maxWorkers") Integer maxWorkers,
        @JsonProperty("batchSize") Integer batchSize
    ) {
        public int effectiveBatchSize() {
            return batchSize != null ? batchSize : ExecutionOptions.DEFAULT_BATCH_SIZE;
        }
    }

    /**
     * Technique selection.
     *
     * @param enabled ids of the techniques to run; empty means all registered techniques
     * @param settings technique-specific settings keyed by technique id
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record TechniquesConfig(
        @JsonProperty("enabled") List<String> enabled,
        @JsonProperty("settings") Map<String, Map<String, Object>> settings
    ) {
        /**
         * Compact constructor with defaults.
         */
        public TechniquesConfig {
            enabled = enabled == null
                ? List.of()
                : enabled.stream().filter(Objects::nonNull).map(String::trim).toList();
            Map<String, Map<String, Object>> nonNull = new LinkedHashMap<>();
            if (settings != null) {
                settings.forEach((id, values) -> nonNull.put(id, values == null ? Map.of() : values));
            }
            settings = Collections.unmodifiableMap(nonNull);
        }

        /**
         * Returns the settings of one technique.
         *
         * @param techniqueId technique id
         * @return settings, empty when none are configured
         */
        public Map<String, Object> settingsFor(String techniqueId) {
            Map<String, Object> values = settings.get(techniqueId);
            return values == null ? Map.of() : values;
        }
    }

    /**
     * Report settings.
     *
     * @param jsonReport path of the JSON report to write, or {@code null} for none
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record OutputConfig(
        @JsonProperty("jsonReport") String jsonReport
    ) {}
}
