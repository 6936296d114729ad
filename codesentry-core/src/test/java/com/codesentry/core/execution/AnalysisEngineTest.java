package com.codesentry.core.execution;

import com.codesentry.core.incremental.IncrementalCache;
import com.codesentry.core.incremental.IncrementalStore;
import com.codesentry.core.metrics.HistoryEntry;
import com.codesentry.core.metrics.MetricsHistory;
import com.codesentry.core.model.Occurrence;
import com.codesentry.core.persistence.JsonStateStore;
import com.codesentry.core.technique.TechniqueRegistrationException;
import com.codesentry.core.technique.TechniqueRegistry;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link AnalysisEngine}.
 */
class AnalysisEngineTest extends ExecutionTestBase {

    @Test
    void run_duplicateTechniqueIds_throwsRegistrationException() {
        assertThatThrownBy(() -> engine.run(files(1),
            List.of(new TestTechniques.TodoFinder(), new TestTechniques.TodoFinder()),
            baseDir(), ExecutionOptions.defaults()))
            .isInstanceOf(TechniqueRegistrationException.class)
            .hasMessageContaining("todo-finder");
    }

    @Test
    void run_blankTechniqueId_throwsRegistrationException() {
        assertThatThrownBy(() -> engine.run(files(1), List.of(TestTechniques.lambda(" ", false)),
            baseDir(), ExecutionOptions.defaults()))
            .isInstanceOf(TechniqueRegistrationException.class);
    }

    @Test
    void run_registry_executesInRegistrationOrder() {
        TechniqueRegistry registry = new TechniqueRegistry()
            .register(new TestTechniques.ExtensionMarker("second", "ts"))
            .register(new TestTechniques.ExtensionMarker("first", "ts"))
            .freeze();

        ExecutionResult result = engine.run(List.of(file("a.ts", "x")), registry, baseDir(), null);

        assertThat(result.occurrences()).extracting(Occurrence::sourceTechnique).containsExactly("second", "first");
    }

    @Test
    void run_afterClose_throwsIllegalState() {
        engine.close();

        assertThatThrownBy(() -> engine.run(files(1), List.of(new TestTechniques.TodoFinder()),
            baseDir(), ExecutionOptions.defaults()))
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void run_persistsStoreAndHistory() {
        Path statePath = tempDir.resolve(".codesentry/incremental.json");
        Path historyPath = tempDir.resolve(".codesentry/metrics-history.json");
        ExecutionOptions options = ExecutionOptions.builder()
            .incrementalCache(new IncrementalCache(statePath))
            .metricsHistory(new MetricsHistory(historyPath, 10))
            .build();

        engine.run(files(3), List.of(new TestTechniques.TodoFinder()), baseDir(), options);

        assertThat(statePath).exists();
        assertThat(historyPath).exists();
        IncrementalStore stored = JsonStateStore.load(statePath, IncrementalStore.class, IncrementalStore.empty());
        assertThat(stored.size()).isEqualTo(3);
        assertThat(stored.stats().totalProcessed()).isEqualTo(3);
        List<HistoryEntry> history = new MetricsHistory(historyPath, 10).load();
        assertThat(history).hasSize(1);
        assertThat(history.get(0).metrics().totalFiles()).isEqualTo(3);
    }

    @Test
    void run_newCacheInstance_reusesPersistedStore() {
        Path statePath = tempDir.resolve("state.json");
        TestTechniques.TodoFinder technique = new TestTechniques.TodoFinder();

        engine.run(files(2), List.of(technique), baseDir(),
            ExecutionOptions.builder().incrementalCache(new IncrementalCache(statePath)).build());
        ExecutionResult second = engine.run(files(2), List.of(technique), baseDir(),
            ExecutionOptions.builder().incrementalCache(new IncrementalCache(statePath)).build());

        assertThat(technique.invocations.get()).isEqualTo(2);
        assertThat(second.metrics().cacheHits()).isEqualTo(2);
        assertThat(second.occurrences()).hasSize(1);
    }

    @Test
    void run_storeWithOtherSchemaVersion_isTreatedAsEmpty() throws IOException {
        Path statePath = tempDir.resolve("state.json");
        TestTechniques.TodoFinder technique = new TestTechniques.TodoFinder();
        engine.run(files(2), List.of(technique), baseDir(),
            ExecutionOptions.builder().incrementalCache(new IncrementalCache(statePath)).build());
        Files.writeString(statePath, Files.readString(statePath)
            .replaceAll("\"schemaVersion\"\\s*:\\s*1", "\"schemaVersion\": 99"));

        ExecutionResult second = engine.run(files(2), List.of(technique), baseDir(),
            ExecutionOptions.builder().incrementalCache(new IncrementalCache(statePath)).build());

        assertThat(technique.invocations.get()).isEqualTo(4);
        assertThat(second.metrics().cacheHits()).isZero();
    }

    @Test
    void run_metricsDisabled_doesNotAppendHistory() {
        Path historyPath = tempDir.resolve("history.json");
        ExecutionOptions options = ExecutionOptions.builder()
            .metricsEnabled(false)
            .metricsHistory(new MetricsHistory(historyPath, 10))
            .build();

        engine.run(files(1), List.of(new TestTechniques.TodoFinder()), baseDir(), options);

        assertThat(historyPath).doesNotExist();
    }

    @Test
    void run_removedFile_dropsOutOfStore() {
        IncrementalCache cache = IncrementalCache.inMemory();
        ExecutionOptions options = ExecutionOptions.builder().incrementalCache(cache).build();

        engine.run(files(3), List.of(new TestTechniques.TodoFinder()), baseDir(), options);
        engine.run(files(2), List.of(new TestTechniques.TodoFinder()), baseDir(), options);

        assertThat(cache.previous().size()).isEqualTo(2);
        assertThat(cache.previous().find("src/file002.ts")).isEmpty();
    }
}
