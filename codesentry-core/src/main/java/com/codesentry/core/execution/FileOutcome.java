package com.codesentry.core.execution;

import com.codesentry.core.incremental.IncrementalRecord;
import com.codesentry.core.incremental.TechniqueTiming;
import com.codesentry.core.metrics.TechniqueMetric;
import com.codesentry.core.model.Occurrence;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Plain-data result of processing one file, produced on a worker or the coordinator
 * and merged by the coordinator.
 *
 * @param index position of the file in scan order
 * @param relPath relative path
 * @param fingerprint content fingerprint, or {@code null} when the file could not be processed
 * @param occurrences occurrences of the file
 * @param timings per-technique timings of a fresh analysis, in invocation order
 * @param metrics invocation metrics of a fresh analysis, in invocation order
 * @param reused previous record served from the incremental store, or {@code null} on a miss
 * @param parseNanos time spent building the syntax tree
 */
public record FileOutcome(
    int index,
    String relPath,
    String fingerprint,
    List<Occurrence> occurrences,
    Map<String, TechniqueTiming> timings,
    List<TechniqueMetric> metrics,
    IncrementalRecord reused,
    long parseNanos
) {
    /**
     * Compact constructor with validation.
     */
    public FileOutcome {
        Objects.requireNonNull(relPath, "relPath must not be null");
        occurrences = occurrences == null ? List.of() : List.copyOf(occurrences);
        timings = timings == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(timings));
        metrics = metrics == null ? List.of() : List.copyOf(metrics);
    }

    /**
     * Creates the outcome of a file served from the incremental store.
     *
     * @param index scan position
     * @param relPath relative path
     * @param previous matching record
     * @return outcome re-emitting the stored occurrences
     */
    public static FileOutcome cacheHit(int index, String relPath, IncrementalRecord previous) {
        return new FileOutcome(index, relPath, previous.fingerprint(), previous.occurrences(),
            previous.perTechnique(), List.of(), previous, 0L);
    }

    /**
     * Creates the outcome of a file whose worker batch failed.
     *
     * @param index scan position
     * @param relPath relative path
     * @param failure batch failure
     * @return outcome carrying a single synthetic error and no fingerprint
     */
    public static FileOutcome failed(int index, String relPath, Throwable failure) {
        return new FileOutcome(index, relPath, null,
            List.of(SyntheticOccurrences.workerFailure(relPath, failure)), Map.of(), List.of(), null, 0L);
    }

    public boolean cacheHit() {
        return reused != null;
    }

    /**
     * Returns true if this outcome should be written to the new incremental store.
     *
     * @return false for failed batches
     */
    public boolean recordable() {
        return fingerprint != null;
    }
}
