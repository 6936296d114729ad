package com.codesentry.core.metrics;

import com.codesentry.core.persistence.JsonStateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Bounded, persisted list of per-run metrics used for trend reporting.
 *
 * <p>Each {@link #append(ExecutionMetrics, long)} adds one entry and evicts the
 * oldest entries beyond {@code maxEntries}. The file carries a schema version; a
 * history written with another version is discarded. Persistence failures are
 * logged and never propagate.</p>
 */
public class MetricsHistory {

    /**
     * Default number of runs kept.
     */
    public static final int DEFAULT_MAX_ENTRIES = 200;

    private static final Logger log = LoggerFactory.getLogger(MetricsHistory.class);

    private final Path historyPath;
    private final int maxEntries;

    /**
     * Creates a history persisted at the given path.
     *
     * @param historyPath JSON file holding the history
     * @param maxEntries maximum number of runs kept (at least 1)
     */
    public MetricsHistory(Path historyPath, int maxEntries) {
        this.historyPath = Objects.requireNonNull(historyPath, "historyPath must not be null");
        this.maxEntries = Math.max(1, maxEntries);
    }

    /**
     * Reads the persisted history, oldest entry first.
     *
     * @return entries, or an empty list if none could be read or the file was written
     *     with another schema version
     */
    public List<HistoryEntry> load() {
        HistoryDocument document = JsonStateStore.load(historyPath, HistoryDocument.class, HistoryDocument.empty());
        if (!document.isCurrentSchema()) {
            log.info("Ignoring metrics history {} with schema version {} (expected {})",
                historyPath, document.schemaVersion(), HistoryDocument.SCHEMA_VERSION);
            return List.of();
        }
        return document.entries();
    }

    /**
     * Appends the metrics of a finished run and persists the trimmed history.
     *
     * @param metrics metrics of the run
     * @param timestamp epoch milliseconds of the run
     * @return the history after appending (never longer than the configured maximum)
     */
    public List<HistoryEntry> append(ExecutionMetrics metrics, long timestamp) {
        List<HistoryEntry> entries = new ArrayList<>(load());
        entries.add(new HistoryEntry(metrics, timestamp));
        if (entries.size() > maxEntries) {
            entries = new ArrayList<>(entries.subList(entries.size() - maxEntries, entries.size()));
        }

        try {
            JsonStateStore.save(historyPath, HistoryDocument.of(entries));
        } catch (IOException e) {
            log.error("Failed to persist metrics history to {}: {}", historyPath, e.getMessage());
        }
        return List.copyOf(entries);
    }

    /**
     * Aggregates the history per technique, slowest total first.
     *
     * @return one summary per technique name
     */
    public List<TechniqueSummary> summarize() {
        Map<String, double[]> totals = new LinkedHashMap<>();
        for (HistoryEntry entry : load()) {
            for (TechniqueMetric metric : entry.metrics().perTechnique()) {
                double[] acc = totals.computeIfAbsent(metric.name(), name -> new double[3]);
                acc[0]++;
                acc[1] += metric.durationMs();
                acc[2] += metric.occurrenceCount();
            }
        }

        return totals.entrySet().stream()
            .map(e -> new TechniqueSummary(e.getKey(), (int) e.getValue()[0], e.getValue()[1], (int) e.getValue()[2]))
            .sorted(Comparator.comparingDouble(TechniqueSummary::totalDurationMs).reversed())
            .toList();
    }

    public Path historyPath() {
        return historyPath;
    }

    public int maxEntries() {
        return maxEntries;
    }
}
