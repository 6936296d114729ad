package com.codesentry.core.metrics;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Thread-safe accumulator of per-run metrics.
 *
 * <p>Both executors feed one aggregator per run; parallel workers may record
 * concurrently. {@link #snapshot(int, double)} freezes the values into an
 * {@link ExecutionMetrics}.</p>
 */
public class MetricsAggregator {

    private final List<TechniqueMetric> techniques = new ArrayList<>();
    private final AtomicInteger cacheHits = new AtomicInteger();
    private final AtomicInteger cacheMisses = new AtomicInteger();
    private final AtomicLong parseNanos = new AtomicLong();

    /**
     * Records one technique invocation.
     *
     * @param name technique id
     * @param durationMs duration in milliseconds
     * @param occurrenceCount occurrences produced
     * @param global whether the technique is global
     */
    public void recordTechnique(String name, double durationMs, int occurrenceCount, boolean global) {
        TechniqueMetric metric = new TechniqueMetric(name, durationMs, occurrenceCount, global);
        synchronized (techniques) {
            techniques.add(metric);
        }
    }

    /**
     * Records several invocations, keeping their order.
     *
     * @param metrics metrics to append
     */
    public void recordAll(List<TechniqueMetric> metrics) {
        synchronized (techniques) {
            techniques.addAll(metrics);
        }
    }

    public void recordCacheHit() {
        cacheHits.incrementAndGet();
    }

    public void recordCacheMiss() {
        cacheMisses.incrementAndGet();
    }

    /**
     * Adds time spent building syntax trees.
     *
     * @param nanos elapsed nanoseconds
     */
    public void addParseTime(long nanos) {
        parseNanos.addAndGet(nanos);
    }

    public int cacheHits() {
        return cacheHits.get();
    }

    public int cacheMisses() {
        return cacheMisses.get();
    }

    /**
     * Freezes the accumulated values.
     *
     * @param totalFiles files handed to the run
     * @param analysisTimeMs wall-clock duration of the run
     * @return immutable metrics
     */
    public ExecutionMetrics snapshot(int totalFiles, double analysisTimeMs) {
        List<TechniqueMetric> copy;
        synchronized (techniques) {
            copy = List.copyOf(techniques);
        }
        return new ExecutionMetrics(
            totalFiles,
            parseNanos.get() / 1_000_000.0,
            analysisTimeMs,
            cacheHits.get(),
            cacheMisses.get(),
            copy
        );
    }
}
