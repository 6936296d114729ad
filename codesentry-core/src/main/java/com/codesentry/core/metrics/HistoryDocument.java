package com.codesentry.core.metrics;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * On-disk layout of the metrics history.
 *
 * @param schemaVersion layout version; a mismatch makes a loaded history count as empty
 * @param entries runs, oldest first
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record HistoryDocument(
    @JsonProperty("schemaVersion") int schemaVersion,
    @JsonProperty("entries") List<HistoryEntry> entries
) {
    /**
     * Layout version written by this engine.
     */
    public static final int SCHEMA_VERSION = 1;

    /**
     * Compact constructor with defaults.
     */
    public HistoryDocument {
        entries = entries == null ? List.of() : entries.stream().filter(Objects::nonNull).toList();
    }

    public static HistoryDocument of(List<HistoryEntry> entries) {
        return new HistoryDocument(SCHEMA_VERSION, entries);
    }

    public static HistoryDocument empty() {
        return of(List.of());
    }

    @JsonIgnore
    public boolean isCurrentSchema() {
        return schemaVersion == SCHEMA_VERSION;
    }
}
