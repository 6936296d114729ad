package com.codesentry.core.metrics;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * One persisted run in the metrics history.
 *
 * @param metrics metrics of the run
 * @param timestamp epoch milliseconds at which the run finished
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record HistoryEntry(
    @JsonProperty("metrics") ExecutionMetrics metrics,
    @JsonProperty("timestamp") long timestamp
) {
    /**
     * Compact constructor with validation.
     */
    public HistoryEntry {
        Objects.requireNonNull(metrics, "metrics must not be null");
    }
}
