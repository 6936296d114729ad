package com.codesentry.core.execution;

import com.codesentry.core.incremental.IncrementalCache;
import com.codesentry.core.metrics.MetricsHistory;

/**
 * Options of a run.
 *
 * <p><b>Usage Example:</b></p>
 * <pre>{@code
 * ExecutionOptions options = ExecutionOptions.builder()
 *     .mode(ExecutionMode.PARALLEL)
 *     .timeoutMs(5_000)
 *     .incrementalCache(new IncrementalCache(Path.of(".codesentry/incremental.json")))
 *     .metricsHistory(new MetricsHistory(Path.of(".codesentry/metrics-history.json"), 200))
 *     .build();
 * }</pre>
 *
 * @param mode execution strategy
 * @param timeoutMs budget per technique per file, 0 disables the timer
 * @param globalTimeoutMs budget per global technique, 0 disables the timer
 * @param incrementalEnabled whether unchanged files are served from the incremental store
 * @param metricsEnabled whether metrics are collected and appended to the history
 * @param workerCount worker threads in parallel mode, or {@code null} for available processors
 * @param batchSize files per worker batch in parallel mode
 * @param incrementalCache caller-owned cache, required for hits across runs
 * @param metricsHistory history to append to, or {@code null} to skip persistence
 * @param syntaxTreeBuilder lazily invoked parser for files without a tree
 * @param listener progress listener
 */
public record ExecutionOptions(
    ExecutionMode mode,
    long timeoutMs,
    long globalTimeoutMs,
    boolean incrementalEnabled,
    boolean metricsEnabled,
    Integer workerCount,
    int batchSize,
    IncrementalCache incrementalCache,
    MetricsHistory metricsHistory,
    SyntaxTreeBuilder syntaxTreeBuilder,
    ExecutionListener listener
) {
    /**
     * Default budget per technique invocation.
     */
    public static final long DEFAULT_TIMEOUT_MS = 30_000;

    /**
     * Default number of files per worker batch.
     */
    public static final int DEFAULT_BATCH_SIZE = 10;

    /**
     * Compact constructor with validation and defaults.
     */
    public ExecutionOptions {
        if (mode == null) {
            mode = ExecutionMode.SEQUENTIAL;
        }
        if (timeoutMs < 0) {
            throw new IllegalArgumentException("timeoutMs must not be negative: " + timeoutMs);
        }
        if (globalTimeoutMs < 0) {
            throw new IllegalArgumentException("globalTimeoutMs must not be negative: " + globalTimeoutMs);
        }
        if (workerCount != null && workerCount < 1) {
            throw new IllegalArgumentException("workerCount must be positive: " + workerCount);
        }
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be positive: " + batchSize);
        }
        if (incrementalEnabled && incrementalCache == null) {
            incrementalCache = IncrementalCache.inMemory();
        }
        if (syntaxTreeBuilder == null) {
            syntaxTreeBuilder = SyntaxTreeBuilder.NONE;
        }
        if (listener == null) {
            listener = ExecutionListener.NONE;
        }
    }

    /**
     * Creates options with every default: sequential, 30 s budgets, incremental off,
     * metrics on without persisted history.
     *
     * @return default options
     */
    public static ExecutionOptions defaults() {
        return builder().build();
    }

    /**
     * Creates a new builder.
     *
     * @return builder holding the defaults
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns the effective number of worker threads.
     *
     * @return configured count, or the number of available processors
     */
    public int effectiveWorkerCount() {
        return workerCount != null ? workerCount : Math.max(1, Runtime.getRuntime().availableProcessors());
    }

    /**
     * Returns a builder initialized from these options.
     *
     * @return builder
     */
    public Builder toBuilder() {
        return new Builder()
            .mode(mode)
            .timeoutMs(timeoutMs)
            .globalTimeoutMs(globalTimeoutMs)
            .incrementalCache(incrementalCache)
            .incrementalEnabled(incrementalEnabled)
            .metricsEnabled(metricsEnabled)
            .workerCount(workerCount)
            .batchSize(batchSize)
            .metricsHistory(metricsHistory)
            .syntaxTreeBuilder(syntaxTreeBuilder)
            .listener(listener);
    }

    /**
     * Builder for {@link ExecutionOptions}.
     */
    public static class Builder {
        private ExecutionMode mode = ExecutionMode.SEQUENTIAL;
        private long timeoutMs = DEFAULT_TIMEOUT_MS;
        private long globalTimeoutMs = DEFAULT_TIMEOUT_MS;
        private boolean incrementalEnabled = false;
        private boolean metricsEnabled = true;
        private Integer workerCount;
        private int batchSize = DEFAULT_BATCH_SIZE;
        private IncrementalCache incrementalCache;
        private MetricsHistory metricsHistory;
        private SyntaxTreeBuilder syntaxTreeBuilder = SyntaxTreeBuilder.NONE;
        private ExecutionListener listener = ExecutionListener.NONE;

        public Builder mode(ExecutionMode mode) {
            this.mode = mode;
            return this;
        }

        public Builder timeoutMs(long timeoutMs) {
            this.timeoutMs = timeoutMs;
            return this;
        }

        public Builder globalTimeoutMs(long globalTimeoutMs) {
            this.globalTimeoutMs = globalTimeoutMs;
            return this;
        }

        public Builder incrementalEnabled(boolean incrementalEnabled) {
            this.incrementalEnabled = incrementalEnabled;
            return this;
        }

        public Builder metricsEnabled(boolean metricsEnabled) {
            this.metricsEnabled = metricsEnabled;
            return this;
        }

        public Builder workerCount(Integer workerCount) {
            this.workerCount = workerCount;
            return this;
        }

        public Builder batchSize(int batchSize) {
            this.batchSize = batchSize;
            return this;
        }

        /**
         * Sets the incremental cache and enables incremental mode.
         *
         * @param incrementalCache caller-owned cache, or {@code null}
         * @return this builder
         */
        public Builder incrementalCache(IncrementalCache incrementalCache) {
            this.incrementalCache = incrementalCache;
            if (incrementalCache != null) {
                this.incrementalEnabled = true;
            }
            return this;
        }

        public Builder metricsHistory(MetricsHistory metricsHistory) {
            this.metricsHistory = metricsHistory;
            return this;
        }

        public Builder syntaxTreeBuilder(SyntaxTreeBuilder syntaxTreeBuilder) {
            this.syntaxTreeBuilder = syntaxTreeBuilder;
            return this;
        }

        public Builder listener(ExecutionListener listener) {
            this.listener = listener;
            return this;
        }

        public ExecutionOptions build() {
            return new ExecutionOptions(
                mode,
                timeoutMs,
                globalTimeoutMs,
                incrementalEnabled,
                metricsEnabled,
                workerCount,
                batchSize,
                incrementalCache,
                metricsHistory,
                syntaxTreeBuilder,
                listener
            );
        }
    }
}
