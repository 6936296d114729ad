package com.codesentry.core.incremental;

import com.codesentry.core.model.Occurrence;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Cached analysis result of one file.
 *
 * <p>Invariant: {@code fingerprint} is the fingerprint of the content that produced
 * {@code occurrences}. When a file's current fingerprint matches, the stored
 * occurrences are authoritative and the file is not analyzed again.</p>
 *
 * @param fingerprint content fingerprint (see {@link Fingerprint})
 * @param occurrences occurrences produced by the file's per-file techniques
 * @param perTechnique timing per technique id
 * @param lastRunEpochMs time the file was last analyzed
 * @param reuseCount consecutive runs that reused this record
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record IncrementalRecord(
    @JsonProperty("fingerprint") String fingerprint,
    @JsonProperty("occurrences") List<Occurrence> occurrences,
    @JsonProperty("perTechnique") Map<String, TechniqueTiming> perTechnique,
    @JsonProperty("lastRunEpochMs") long lastRunEpochMs,
    @JsonProperty("reuseCount") int reuseCount
) {
    /**
     * Compact constructor with validation.
     */
    public IncrementalRecord {
        Objects.requireNonNull(fingerprint, "fingerprint must not be null");
        occurrences = occurrences == null ? List.of() : List.copyOf(occurrences);
        perTechnique = perTechnique == null ? Map.of() : Map.copyOf(perTechnique);
    }

    /**
     * Creates a record for a freshly analyzed file.
     *
     * @param fingerprint content fingerprint
     * @param occurrences occurrences produced
     * @param perTechnique timings per technique
     * @return record with reuse count 0 stamped with the current time
     */
    public static IncrementalRecord fresh(String fingerprint, List<Occurrence> occurrences,
                                          Map<String, TechniqueTiming> perTechnique) {
        return new IncrementalRecord(fingerprint, occurrences, perTechnique, System.currentTimeMillis(), 0);
    }

    /**
     * Returns a copy carried forward after a cache hit.
     *
     * @return record with reuse count incremented
     */
    public IncrementalRecord reused() {
        return new IncrementalRecord(fingerprint, occurrences, perTechnique, lastRunEpochMs, reuseCount + 1);
    }

    /**
     * Checks whether the record was produced from content with the given fingerprint.
     *
     * @param currentFingerprint fingerprint of the current content
     * @return true if the record is still valid
     */
    public boolean matches(String currentFingerprint) {
        return fingerprint.equals(currentFingerprint);
    }
}
