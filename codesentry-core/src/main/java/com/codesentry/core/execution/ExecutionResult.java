package com.codesentry.core.execution;

import com.codesentry.core.metrics.ExecutionMetrics;
import com.codesentry.core.model.Occurrence;
import com.codesentry.core.model.Severity;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of a run, handed to report renderers.
 *
 * @param occurrences every occurrence of the run, in insertion order
 * @param metrics run metrics, or {@code null} when metrics are disabled
 * @param totalFiles files handed to the run
 * @param analyzedFiles relative paths of the files, in scan order
 * @param timestamp epoch milliseconds at which the run finished
 * @param durationMs wall-clock duration of the run
 */
public record ExecutionResult(
    List<Occurrence> occurrences,
    ExecutionMetrics metrics,
    int totalFiles,
    List<String> analyzedFiles,
    long timestamp,
    double durationMs
) {
    /**
     * Compact constructor with defaults.
     */
    public ExecutionResult {
        occurrences = occurrences == null ? List.of() : List.copyOf(occurrences);
        analyzedFiles = analyzedFiles == null ? List.of() : List.copyOf(analyzedFiles);
    }

    /**
     * Returns the metrics, if they were collected.
     *
     * @return metrics of the run
     */
    public Optional<ExecutionMetrics> metricsIfEnabled() {
        return Optional.ofNullable(metrics);
    }

    /**
     * Lists the occurrences of one file.
     *
     * @param relPath relative path
     * @return occurrences of that file, in order
     */
    public List<Occurrence> occurrencesFor(String relPath) {
        return occurrences.stream().filter(o -> o.filePath().equals(relPath)).toList();
    }

    /**
     * Counts occurrences of the given severity.
     *
     * @param severity severity to count
     * @return number of matching occurrences
     */
    public long count(Severity severity) {
        return occurrences.stream().filter(o -> o.severity() == severity).count();
    }

    /**
     * Returns true if any occurrence has ERROR severity.
     *
     * @return true when at least one error was reported
     */
    public boolean hasErrors() {
        return count(Severity.ERROR) > 0;
    }
}
