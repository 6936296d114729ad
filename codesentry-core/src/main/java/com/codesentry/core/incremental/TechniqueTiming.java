package com.codesentry.core.incremental;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Duration and result count of one technique on one file.
 *
 * @param durationMs wall-clock duration in milliseconds
 * @param occurrenceCount occurrences the technique produced
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TechniqueTiming(
    @JsonProperty("durationMs") double durationMs,
    @JsonProperty("occurrenceCount") int occurrenceCount
) {
    /**
     * Compact constructor with validation and defaults.
     */
    public TechniqueTiming {
        if (durationMs < 0) {
            durationMs = 0;
        }
        if (occurrenceCount < 0) {
            occurrenceCount = 0;
        }
    }
}
