package com.codesentry.core.metrics;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Duration and result count of one technique invocation.
 *
 * @param name technique id
 * @param durationMs wall-clock duration in milliseconds
 * @param occurrenceCount occurrences produced
 * @param global whether the technique is global
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TechniqueMetric(
    @JsonProperty("name") String name,
    @JsonProperty("durationMs") double durationMs,
    @JsonProperty("occurrenceCount") int occurrenceCount,
    @JsonProperty("global") boolean global
) {
    /**
     * Compact constructor with validation.
     */
    public TechniqueMetric {
        Objects.requireNonNull(name, "name must not be null");
        if (durationMs < 0) {
            durationMs = 0;
        }
        if (occurrenceCount < 0) {
            occurrenceCount = 0;
        }
    }
}
