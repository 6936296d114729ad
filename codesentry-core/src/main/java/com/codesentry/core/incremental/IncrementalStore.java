package com.codesentry.core.incremental;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Persisted map from relative file path to the file's cached analysis result.
 *
 * <p>A store is immutable. During a run the engine collects records in a
 * {@link Builder}; the resulting store fully replaces the previous one, so files
 * deleted or renamed since the last run simply drop out.</p>
 *
 * @param schemaVersion layout version; a mismatch makes a loaded store count as empty
 * @param records cached results keyed by relative path
 * @param stats counters of the producing run
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record IncrementalStore(
    @JsonProperty("schemaVersion") int schemaVersion,
    @JsonProperty("records") Map<String, IncrementalRecord> records,
    @JsonProperty("stats") StoreStatistics stats
) {
    /**
     * Layout version written by this engine.
     */
    public static final int SCHEMA_VERSION = 1;

    /**
     * Compact constructor with validation and defaults.
     */
    public IncrementalStore {
        records = records == null ? Map.of() : Map.copyOf(records);
        if (stats == null) {
            stats = StoreStatistics.empty();
        }
    }

    /**
     * Creates an empty store of the current schema version.
     *
     * @return empty store
     */
    public static IncrementalStore empty() {
        return new IncrementalStore(SCHEMA_VERSION, Map.of(), StoreStatistics.empty());
    }

    /**
     * Looks up the record of a file.
     *
     * @param relPath relative path
     * @return the record, if present
     */
    public Optional<IncrementalRecord> find(String relPath) {
        return Optional.ofNullable(records.get(relPath));
    }

    /**
     * Looks up a record that is still valid for the given content fingerprint.
     *
     * @param relPath relative path
     * @param fingerprint fingerprint of the current content
     * @return the record, if present and unchanged
     */
    public Optional<IncrementalRecord> findValid(String relPath, String fingerprint) {
        return find(relPath).filter(record -> record.matches(fingerprint));
    }

    /**
     * Returns true if this store was written with the current layout.
     *
     * @return true when compatible
     */
    public boolean isCurrentSchema() {
        return schemaVersion == SCHEMA_VERSION;
    }

    /**
     * Returns the number of cached files.
     *
     * @return record count
     */
    public int size() {
        return records.size();
    }

    /**
     * Builder collecting the records of a run.
     *
     * <p>Not thread-safe; only the coordinating thread adds records.</p>
     */
    public static class Builder {
        private final Map<String, IncrementalRecord> records = new LinkedHashMap<>();
        private int totalReuses = 0;
        private int totalProcessed = 0;

        /**
         * Carries a previous record forward after a cache hit.
         *
         * @param relPath relative path
         * @param previous the matching record of the previous store
         * @return this builder
         */
        public Builder reuse(String relPath, IncrementalRecord previous) {
            records.put(relPath, previous.reused());
            totalReuses++;
            return this;
        }

        /**
         * Stores the record of a freshly analyzed file.
         *
         * @param relPath relative path
         * @param record new record
         * @return this builder
         */
        public Builder processed(String relPath, IncrementalRecord record) {
            records.put(relPath, record);
            totalProcessed++;
            return this;
        }

        public IncrementalStore build(double durationMs) {
            return new IncrementalStore(
                SCHEMA_VERSION,
                records,
                new StoreStatistics(totalReuses, totalProcessed, durationMs)
            );
        }
    }
}
