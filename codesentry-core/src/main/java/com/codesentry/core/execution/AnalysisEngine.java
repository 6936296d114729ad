package com.codesentry.core.execution;

import com.codesentry.core.model.FileEntry;
import com.codesentry.core.technique.Technique;
import com.codesentry.core.technique.TechniqueRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Entry point of the engine.
 *
 * <p>Owns the invocation pool shared by all runs and dispatches each run to the
 * {@link SequentialExecutor} or the {@link ParallelExecutor} according to
 * {@link ExecutionOptions#mode()}. Close the engine to release its threads.</p>
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * try (AnalysisEngine engine = new AnalysisEngine()) {
 *     ExecutionResult result = engine.run(files, registry.list(), baseDir, options);
 *     result.occurrences().forEach(System.out::println);
 * }
 * }</pre>
 */
public class AnalysisEngine implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(AnalysisEngine.class);

    private final AtomicInteger invocationCounter = new AtomicInteger();
    private final ExecutorService invocationPool;
    private final SequentialExecutor sequential;
    private final ParallelExecutor parallel;

    public AnalysisEngine() {
        this.invocationPool = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "codesentry-invocation-" + invocationCounter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        this.sequential = new SequentialExecutor(invocationPool);
        this.parallel = new ParallelExecutor(invocationPool);
    }

    /**
     * Runs techniques over files.
     *
     * <p>The techniques are validated as if they were registered in a fresh
     * {@link TechniqueRegistry}; their order is the execution order.</p>
     *
     * @param files files in scan order
     * @param techniques techniques to run
     * @param baseDir project base directory
     * @param options run options
     * @return result of the run
     * @throws com.codesentry.core.technique.TechniqueRegistrationException if a technique is malformed
     *     or two techniques share an id
     */
    public ExecutionResult run(List<FileEntry> files, Collection<? extends Technique> techniques, String baseDir,
                               ExecutionOptions options) {
        Objects.requireNonNull(techniques, "techniques must not be null");
        TechniqueRegistry registry = new TechniqueRegistry().registerAll(techniques).freeze();
        return run(files, registry, baseDir, options);
    }

    /**
     * Runs every technique of a registry over files.
     *
     * @param files files in scan order
     * @param registry registered techniques
     * @param baseDir project base directory
     * @param options run options, {@code null} for defaults
     * @return result of the run
     */
    public ExecutionResult run(List<FileEntry> files, TechniqueRegistry registry, String baseDir,
                               ExecutionOptions options) {
        Objects.requireNonNull(registry, "registry must not be null");
        if (invocationPool.isShutdown()) {
            throw new IllegalStateException("AnalysisEngine is closed");
        }
        ExecutionOptions effective = options == null ? ExecutionOptions.defaults() : options;
        return executorFor(effective.mode()).execute(files, registry.list(), baseDir, effective);
    }

    /**
     * Returns the phase of the executor that handles the given mode.
     *
     * @param mode execution mode
     * @return state of its current or last run
     */
    public ExecutorState state(ExecutionMode mode) {
        return executorFor(mode).state();
    }

    @Override
    public void close() {
        invocationPool.shutdownNow();
        try {
            if (!invocationPool.awaitTermination(1, TimeUnit.SECONDS)) {
                log.debug("Invocation pool still has running techniques after shutdown");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private AbstractExecutor executorFor(ExecutionMode mode) {
        return mode == ExecutionMode.PARALLEL ? parallel : sequential;
    }
}
