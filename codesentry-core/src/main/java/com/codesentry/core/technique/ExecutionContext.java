package com.codesentry.core.technique;

import com.codesentry.core.model.FileEntry;
import com.codesentry.core.model.Occurrence;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Shared, read-mostly state handed to every technique invocation of a run.
 *
 * <p>The file list and ambient flags are unmodifiable copies: techniques cannot
 * mutate them. The optional {@link OccurrenceReporter} is the only sanctioned
 * mutation path and is stripped via {@link #withoutReporter()} before the
 * context crosses a thread boundary.</p>
 *
 * @param baseDir project base directory
 * @param files all files of the run, in scan order
 * @param ambientFlags run-wide boolean flags (e.g. "incremental", "parallel")
 * @param reporter side-channel reporter, or {@code null} when unavailable
 */
public record ExecutionContext(
    String baseDir,
    List<FileEntry> files,
    Map<String, Boolean> ambientFlags,
    OccurrenceReporter reporter
) {
    /**
     * Compact constructor with validation.
     */
    public ExecutionContext {
        Objects.requireNonNull(baseDir, "baseDir must not be null");
        files = files == null ? List.of() : List.copyOf(files);
        ambientFlags = ambientFlags == null ? Map.of() : Map.copyOf(ambientFlags);
    }

    /**
     * Creates a context without a reporter.
     *
     * @param baseDir project base directory
     * @param files all files of the run
     * @param ambientFlags run-wide flags
     * @return new context
     */
    public static ExecutionContext of(String baseDir, List<FileEntry> files, Map<String, Boolean> ambientFlags) {
        return new ExecutionContext(baseDir, files, ambientFlags, null);
    }

    /**
     * Returns a copy of this context that reports through the given reporter.
     *
     * @param newReporter reporter to attach
     * @return new context sharing files and flags
     */
    public ExecutionContext withReporter(OccurrenceReporter newReporter) {
        return new ExecutionContext(baseDir, files, ambientFlags, newReporter);
    }

    /**
     * Returns a plain-data copy of this context with the reporter removed.
     *
     * @return context safe to share with worker threads
     */
    public ExecutionContext withoutReporter() {
        return reporter == null ? this : new ExecutionContext(baseDir, files, ambientFlags, null);
    }

    /**
     * Returns true if a side-channel reporter is attached.
     *
     * @return true when {@link #report(Occurrence)} delivers occurrences
     */
    public boolean canReport() {
        return reporter != null;
    }

    /**
     * Reports an occurrence through the side channel, if one is attached.
     *
     * @param occurrence finding to report
     */
    public void report(Occurrence occurrence) {
        if (reporter != null) {
            reporter.report(occurrence);
        }
    }

    /**
     * Gets an ambient flag.
     *
     * @param key flag name
     * @return flag value, false when absent
     */
    public boolean flag(String key) {
        return Boolean.TRUE.equals(ambientFlags.get(key));
    }

    /**
     * Finds a file of the run by its relative path.
     *
     * @param relPath relative path
     * @return the entry, if part of the run
     */
    public Optional<FileEntry> findFile(String relPath) {
        return files.stream()
            .filter(entry -> entry.relPath().equals(relPath))
            .findFirst();
    }
}
