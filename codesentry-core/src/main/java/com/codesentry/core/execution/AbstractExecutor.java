package com.codesentry.core.execution;

import com.codesentry.core.incremental.IncrementalRecord;
import com.codesentry.core.incremental.IncrementalStore;
import com.codesentry.core.metrics.ExecutionMetrics;
import com.codesentry.core.metrics.MetricsAggregator;
import com.codesentry.core.model.FileEntry;
import com.codesentry.core.model.Occurrence;
import com.codesentry.core.technique.ExecutionContext;
import com.codesentry.core.technique.Technique;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;

/**
 * Skeleton shared by the sequential and the parallel executor.
 *
 * <p>A run always follows the same phases: global techniques on the coordinating
 * thread, per-file processing (the only phase subclasses implement), then
 * finalization. Finalization merges the file outcomes in scan order, aggregates
 * metrics, appends the history entry, commits the incremental store and notifies
 * the listener.</p>
 *
 * <p>Executors are not reentrant: one run at a time per instance.</p>
 */
public abstract class AbstractExecutor {

    /**
     * Ambient flag set when unchanged files are served from the incremental store.
     */
    public static final String FLAG_INCREMENTAL = "incremental";

    /**
     * Ambient flag set when metrics are collected.
     */
    public static final String FLAG_METRICS = "metrics";

    /**
     * Ambient flag set when files are analyzed by the worker pool.
     */
    public static final String FLAG_PARALLEL = "parallel";

    protected final Logger log = LoggerFactory.getLogger(getClass());

    protected final ExecutorService invocationPool;

    private volatile ExecutorState state = ExecutorState.IDLE;

    /**
     * Creates an executor.
     *
     * @param invocationPool pool used to race technique invocations against their budget
     */
    protected AbstractExecutor(ExecutorService invocationPool) {
        this.invocationPool = Objects.requireNonNull(invocationPool, "invocationPool must not be null");
    }

    /**
     * Returns the phase of the current (or last) run.
     *
     * @return executor state
     */
    public ExecutorState state() {
        return state;
    }

    /**
     * Runs the given techniques over the given files.
     *
     * @param files files in scan order
     * @param techniques validated techniques in registration order
     * @param baseDir project base directory
     * @param options run options
     * @return result of the run
     */
    public ExecutionResult execute(List<FileEntry> files, List<Technique> techniques, String baseDir,
                                   ExecutionOptions options) {
        Objects.requireNonNull(files, "files must not be null");
        Objects.requireNonNull(techniques, "techniques must not be null");
        Objects.requireNonNull(options, "options must not be null");

        long startNanos = System.nanoTime();
        MetricsAggregator aggregator = new MetricsAggregator();
        ExecutionContext context = ExecutionContext.of(baseDir, files, Map.of(
            FLAG_INCREMENTAL, options.incrementalEnabled(),
            FLAG_METRICS, options.metricsEnabled(),
            FLAG_PARALLEL, options.mode() == ExecutionMode.PARALLEL
        ));

        List<Technique> globals = techniques.stream().filter(Technique::isGlobal).toList();
        List<Technique> perFile = techniques.stream().filter(technique -> !technique.isGlobal()).toList();
        log.info("Analyzing {} files with {} per-file and {} global techniques ({} mode)",
            files.size(), perFile.size(), globals.size(), options.mode().name().toLowerCase());

        state = ExecutorState.RUNNING_GLOBAL;
        List<Occurrence> occurrences = new ArrayList<>(runGlobalTechniques(globals, context, options, aggregator));

        state = ExecutorState.RUNNING_PER_FILE;
        IncrementalStore previous = options.incrementalEnabled() ? options.incrementalCache().previous() : null;
        FileProcessor processor = new FileProcessor(perFile, newInvoker(), previous,
            options.syntaxTreeBuilder(), options.timeoutMs());
        List<FileOutcome> outcomes = processFiles(files, processor, context, options);

        state = ExecutorState.FINALIZING;
        IncrementalStore.Builder storeBuilder = new IncrementalStore.Builder();
        for (FileOutcome outcome : outcomes) {
            occurrences.addAll(outcome.occurrences());
            merge(outcome, aggregator, storeBuilder);
        }

        double durationMs = (System.nanoTime() - startNanos) / 1_000_000.0;
        long timestamp = System.currentTimeMillis();
        ExecutionMetrics metrics = options.metricsEnabled() ? aggregator.snapshot(files.size(), durationMs) : null;
        ExecutionResult result = new ExecutionResult(
            occurrences,
            metrics,
            files.size(),
            files.stream().map(FileEntry::relPath).toList(),
            timestamp,
            durationMs
        );

        if (metrics != null && options.metricsHistory() != null) {
            options.metricsHistory().append(metrics, timestamp);
        }
        if (options.incrementalEnabled()) {
            options.incrementalCache().commit(storeBuilder.build(durationMs));
        }
        log.info("Analysis complete: {} occurrences in {} files ({} ms, {} cache hits)",
            occurrences.size(), files.size(), String.format("%.1f", durationMs), aggregator.cacheHits());

        notifyListener(() -> options.listener().onAnalysisComplete(result));
        state = ExecutorState.DONE;
        return result;
    }

    /**
     * Processes every file and returns the outcomes in scan order.
     *
     * <p>Implementations report each outcome to the listener via
     * {@link #fileProcessed(ExecutionOptions, FileOutcome)} as soon as it is known,
     * always from the coordinating thread.</p>
     *
     * @param files files in scan order
     * @param processor processor configured for this run
     * @param context context of the run, including the side-channel reporter if any
     * @param options run options
     * @return one outcome per file, ordered by scan position
     */
    protected abstract List<FileOutcome> processFiles(List<FileEntry> files, FileProcessor processor,
                                                      ExecutionContext context, ExecutionOptions options);

    /**
     * Creates the invoker used for per-file techniques.
     *
     * @return invoker
     */
    protected abstract TechniqueInvoker newInvoker();

    /**
     * Notifies the listener that a file is done.
     *
     * @param options run options holding the listener
     * @param outcome outcome of the file
     */
    protected void fileProcessed(ExecutionOptions options, FileOutcome outcome) {
        notifyListener(() -> options.listener().onFileProcessed(outcome.relPath(), outcome.occurrences().size()));
    }

    private List<Occurrence> runGlobalTechniques(List<Technique> globals, ExecutionContext context,
                                                 ExecutionOptions options, MetricsAggregator aggregator) {
        TechniqueInvoker coordinator = new TechniqueInvoker(invocationPool, true);
        List<Occurrence> occurrences = new ArrayList<>();
        for (Technique technique : globals) {
            InvocationOutcome outcome = coordinator.invokeGlobal(technique, context, options.globalTimeoutMs());
            occurrences.addAll(outcome.occurrences());
            aggregator.recordTechnique(outcome.techniqueId(), outcome.durationMs(), outcome.producedCount(), true);
        }
        return occurrences;
    }

    private void merge(FileOutcome outcome, MetricsAggregator aggregator, IncrementalStore.Builder storeBuilder) {
        if (outcome.cacheHit()) {
            aggregator.recordCacheHit();
            storeBuilder.reuse(outcome.relPath(), outcome.reused());
            return;
        }
        aggregator.recordCacheMiss();
        aggregator.addParseTime(outcome.parseNanos());
        aggregator.recordAll(outcome.metrics());
        if (outcome.recordable()) {
            storeBuilder.processed(outcome.relPath(), IncrementalRecord.fresh(
                outcome.fingerprint(), outcome.occurrences(), outcome.timings()));
        }
    }

    private void notifyListener(Runnable notification) {
        try {
            notification.run();
        } catch (RuntimeException e) {
            log.warn("Execution listener failed: {}", e.getMessage());
        }
    }
}
