package com.codesentry.core.incremental;

import com.codesentry.core.model.Occurrence;
import com.codesentry.core.model.Severity;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link IncrementalCache} and {@link IncrementalStore}.
 */
class IncrementalCacheTest {

    @TempDir
    Path tempDir;

    private static IncrementalStore storeWith(String relPath, String content) {
        Occurrence occurrence = new Occurrence("todo-pending", Severity.INFO, "Pending", relPath, 3, 4, "todo-comments");
        return new IncrementalStore.Builder()
            .processed(relPath, IncrementalRecord.fresh(Fingerprint.of(content), List.of(occurrence),
                Map.of("todo-comments", new TechniqueTiming(1.5, 1))))
            .build(12.0);
    }

    @Test
    void previous_missingFile_returnsEmptyStore() {
        IncrementalCache cache = new IncrementalCache(tempDir.resolve("missing.json"));

        assertThat(cache.previous().size()).isZero();
        assertThat(cache.previous().isCurrentSchema()).isTrue();
    }

    @Test
    void commit_persistsStoreReadableByNewCache() {
        Path statePath = tempDir.resolve("state/incremental.json");
        new IncrementalCache(statePath).commit(storeWith("a.ts", "// TODO"));

        IncrementalStore loaded = new IncrementalCache(statePath).previous();

        assertThat(loaded.size()).isEqualTo(1);
        assertThat(loaded.findValid("a.ts", Fingerprint.of("// TODO"))).hasValueSatisfying(record -> {
            assertThat(record.occurrences()).singleElement().satisfies(o -> {
                assertThat(o.line()).isEqualTo(3);
                assertThat(o.column()).isEqualTo(4);
            });
            assertThat(record.perTechnique()).containsKey("todo-comments");
            assertThat(record.reuseCount()).isZero();
        });
        assertThat(loaded.stats().totalProcessed()).isEqualTo(1);
        assertThat(loaded.stats().lastDurationMs()).isEqualTo(12.0);
    }

    @Test
    void findValid_changedFingerprint_returnsEmpty() {
        IncrementalStore store = storeWith("a.ts", "// TODO");

        assertThat(store.findValid("a.ts", Fingerprint.of("// TODO!"))).isEmpty();
        assertThat(store.find("a.ts")).isPresent();
    }

    @Test
    void previous_schemaMismatch_returnsEmptyStore() throws IOException {
        Path statePath = tempDir.resolve("incremental.json");
        Files.writeString(statePath, """
            {
              "schemaVersion": 0,
              "records": {
                "a.ts": { "fingerprint": "0000000000000000", "occurrences": [] }
              }
            }
            """);

        assertThat(new IncrementalCache(statePath).previous().size()).isZero();
    }

    @Test
    void previous_corruptFile_returnsEmptyStore() throws IOException {
        Path statePath = tempDir.resolve("incremental.json");
        Files.writeString(statePath, "{ not json");

        assertThat(new IncrementalCache(statePath).previous().size()).isZero();
    }

    @Test
    void reset_discardsMemoryAndDisk() {
        Path statePath = tempDir.resolve("incremental.json");
        IncrementalCache cache = new IncrementalCache(statePath);
        cache.commit(storeWith("a.ts", "x"));

        cache.reset();

        assertThat(cache.previous().size()).isZero();
        assertThat(statePath).doesNotExist();
    }

    @Test
    void builder_reuse_incrementsReuseCountAndStatistics() {
        IncrementalRecord previous = storeWith("a.ts", "x").find("a.ts").orElseThrow();

        IncrementalStore next = new IncrementalStore.Builder().reuse("a.ts", previous).build(1.0);

        assertThat(next.find("a.ts")).hasValueSatisfying(record -> {
            assertThat(record.reuseCount()).isEqualTo(1);
            assertThat(record.fingerprint()).isEqualTo(previous.fingerprint());
            assertThat(record.occurrences()).isEqualTo(previous.occurrences());
        });
        assertThat(next.stats().totalReuses()).isEqualTo(1);
        assertThat(next.stats().totalProcessed()).isZero();
    }
}
