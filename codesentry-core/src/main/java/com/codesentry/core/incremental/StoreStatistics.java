package com.codesentry.core.incremental;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Counters of the run that produced an {@link IncrementalStore}.
 *
 * @param totalReuses files served from the previous store
 * @param totalProcessed files analyzed from scratch
 * @param lastDurationMs duration of the run in milliseconds
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record StoreStatistics(
    @JsonProperty("totalReuses") int totalReuses,
    @JsonProperty("totalProcessed") int totalProcessed,
    @JsonProperty("lastDurationMs") double lastDurationMs
) {
    /**
     * Creates zeroed statistics.
     *
     * @return empty statistics
     */
    public static StoreStatistics empty() {
        return new StoreStatistics(0, 0, 0);
    }
}
