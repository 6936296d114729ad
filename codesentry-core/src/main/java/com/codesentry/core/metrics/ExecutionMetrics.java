package com.codesentry.core.metrics;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Aggregate metrics of one run.
 *
 * @param totalFiles files handed to the run
 * @param parseTimeMs time spent building syntax trees
 * @param analysisTimeMs wall-clock duration of the run
 * @param cacheHits files served from the incremental store
 * @param cacheMisses files analyzed from scratch
 * @param perTechnique one entry per technique invocation, in execution order
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ExecutionMetrics(
    @JsonProperty("totalFiles") int totalFiles,
    @JsonProperty("parseTimeMs") double parseTimeMs,
    @JsonProperty("analysisTimeMs") double analysisTimeMs,
    @JsonProperty("cacheHits") int cacheHits,
    @JsonProperty("cacheMisses") int cacheMisses,
    @JsonProperty("perTechnique") List<TechniqueMetric> perTechnique
) {
    /**
     * Compact constructor with defaults.
     */
    public ExecutionMetrics {
        perTechnique = perTechnique == null ? List.of() : List.copyOf(perTechnique);
    }

    /**
     * Sums the occurrences of every recorded invocation.
     *
     * @return total occurrence count
     */
    public int totalOccurrences() {
        return perTechnique.stream().mapToInt(TechniqueMetric::occurrenceCount).sum();
    }

    /**
     * Calculates the incremental hit rate.
     *
     * @return hit rate as percentage (0.0 to 100.0), or 0 if no file was looked up
     */
    public double cacheHitRate() {
        int lookups = cacheHits + cacheMisses;
        if (lookups == 0) {
            return 0.0;
        }
        return (cacheHits * 100.0) / lookups;
    }

    /**
     * Returns a human-readable summary.
     *
     * @return summary string
     */
    public String summary() {
        return String.format(
            "Files: %d, Analysis: %.1f ms, Parsing: %.1f ms, Cache hits: %d (%.1f%%), Misses: %d, Invocations: %d",
            totalFiles,
            analysisTimeMs,
            parseTimeMs,
            cacheHits,
            cacheHitRate(),
            cacheMisses,
            perTechnique.size()
        );
    }
}
