package com.codesentry.core.metrics;

/**
 * Aggregate of one technique across the metrics history.
 *
 * @param name technique id
 * @param invocations recorded invocations
 * @param totalDurationMs summed duration
 * @param totalOccurrences summed occurrences
 */
public record TechniqueSummary(
    String name,
    int invocations,
    double totalDurationMs,
    int totalOccurrences
) {
    /**
     * Calculates the mean duration of an invocation.
     *
     * @return average duration in milliseconds, or 0 without invocations
     */
    public double averageDurationMs() {
        return invocations == 0 ? 0.0 : totalDurationMs / invocations;
    }
}
