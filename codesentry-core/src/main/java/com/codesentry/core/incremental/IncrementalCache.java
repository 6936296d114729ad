package com.codesentry.core.incremental;

import com.codesentry.core.persistence.JsonStateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Caller-owned holder of the incremental store across runs.
 *
 * <p>Create one per process and pass it to every run. The previous store is read
 * from disk once, on first use; after each successful run the engine
 * {@link #commit(IncrementalStore) commits} the new store, which is written to disk
 * and kept in memory for the next run of the same process.</p>
 *
 * <p>A store whose schema version differs from {@link IncrementalStore#SCHEMA_VERSION},
 * or that cannot be read, is treated as empty. Failing to save is logged and never
 * fails the run.</p>
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * IncrementalCache cache = new IncrementalCache(Path.of(".codesentry/incremental.json"));
 * ExecutionOptions options = ExecutionOptions.builder().incrementalCache(cache).build();
 * }</pre>
 */
public class IncrementalCache {

    private static final Logger log = LoggerFactory.getLogger(IncrementalCache.class);

    private final Path statePath;
    private IncrementalStore current;

    /**
     * Creates a cache persisted at the given path.
     *
     * @param statePath JSON file holding the store, or {@code null} for a memory-only cache
     */
    public IncrementalCache(Path statePath) {
        this.statePath = statePath;
    }

    /**
     * Creates a cache that never touches the disk.
     *
     * @return memory-only cache
     */
    public static IncrementalCache inMemory() {
        return new IncrementalCache(null);
    }

    /**
     * Returns the store of the previous run, loading it from disk on first access.
     *
     * @return previous store, or an empty one
     */
    public synchronized IncrementalStore previous() {
        if (current == null) {
            current = load();
        }
        return current;
    }

    /**
     * Replaces the previous store with the store of a finished run and persists it.
     *
     * @param store store built by the finished run
     */
    public synchronized void commit(IncrementalStore store) {
        current = store;
        if (statePath == null) {
            return;
        }
        try {
            JsonStateStore.save(statePath, store);
            log.debug("Saved incremental store: {} files, {} reused, {} processed",
                store.size(), store.stats().totalReuses(), store.stats().totalProcessed());
        } catch (IOException e) {
            log.error("Failed to save incremental store to {}: {}", statePath, e.getMessage());
        }
    }

    /**
     * Forgets all cached results, in memory and on disk.
     */
    public synchronized void reset() {
        current = IncrementalStore.empty();
        if (statePath == null) {
            return;
        }
        try {
            Files.deleteIfExists(statePath);
        } catch (IOException e) {
            log.warn("Failed to delete incremental store {}: {}", statePath, e.getMessage());
        }
    }

    /**
     * Returns the backing file.
     *
     * @return state path, or {@code null} for memory-only caches
     */
    public Path statePath() {
        return statePath;
    }

    private IncrementalStore load() {
        if (statePath == null) {
            return IncrementalStore.empty();
        }
        IncrementalStore loaded = JsonStateStore.load(statePath, IncrementalStore.class, IncrementalStore.empty());
        if (!loaded.isCurrentSchema()) {
            log.info("Ignoring incremental store {} with schema version {} (expected {})",
                statePath, loaded.schemaVersion(), IncrementalStore.SCHEMA_VERSION);
            return IncrementalStore.empty();
        }
        log.debug("Loaded incremental store with {} files from {}", loaded.size(), statePath);
        return loaded;
    }
}
