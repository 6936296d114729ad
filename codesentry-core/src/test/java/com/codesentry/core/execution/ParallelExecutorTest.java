package com.codesentry.core.execution;

import com.codesentry.core.incremental.IncrementalCache;
import com.codesentry.core.model.FileEntry;
import com.codesentry.core.model.Occurrence;
import com.codesentry.core.model.Severity;
import com.codesentry.core.technique.Technique;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ParallelExecutor} through {@link AnalysisEngine}.
 */
class ParallelExecutorTest extends ExecutionTestBase {

    private static ExecutionOptions.Builder parallel() {
        return ExecutionOptions.builder()
            .mode(ExecutionMode.PARALLEL)
            .workerCount(4)
            .batchSize(3);
    }

    @Test
    void run_withoutGlobalTechniques_matchesSequentialOccurrences() {
        List<FileEntry> files = files(25);
        List<Technique> techniques = List.of(
            new TestTechniques.TodoFinder(),
            new TestTechniques.ExtensionMarker("ts-marker", "ts"));

        ExecutionResult sequential = engine.run(files, techniques, baseDir(), ExecutionOptions.defaults());
        ExecutionResult parallel = engine.run(files, techniques, baseDir(), parallel().build());

        assertThat(parallel.occurrences()).containsExactlyInAnyOrderElementsOf(sequential.occurrences());
        assertThat(parallel.totalFiles()).isEqualTo(25);
    }

    @Test
    void run_mergesOutcomesInScanOrder() {
        List<FileEntry> files = files(25);
        List<Technique> techniques = List.of(new TestTechniques.TodoFinder());

        ExecutionResult sequential = engine.run(files, techniques, baseDir(), ExecutionOptions.defaults());
        ExecutionResult parallel = engine.run(files, techniques, baseDir(), parallel().build());

        assertThat(parallel.occurrences()).containsExactlyElementsOf(sequential.occurrences());
    }

    @Test
    void run_globalTechnique_runsOnCoordinatorFirst() {
        TestTechniques.FileCounter counter = new TestTechniques.FileCounter();

        ExecutionResult result = engine.run(files(7), List.of(counter, new TestTechniques.TodoFinder()),
            baseDir(), parallel().build());

        assertThat(counter.invocations.get()).isEqualTo(1);
        assertThat(result.occurrences().get(0).kind()).isEqualTo("file-count");
        assertThat(result.occurrences()).hasSize(1 + 4);
    }

    @Test
    void run_workersHaveNoSideChannel() {
        ExecutionResult result = engine.run(files(4), List.of(new TestTechniques.SideChannelReporter()),
            baseDir(), parallel().build());

        assertThat(result.occurrences()).hasSize(4)
            .extracting(Occurrence::kind).containsOnly("returned");
    }

    @Test
    void run_throwingTechnique_isolatedPerFile() {
        ExecutionResult result = engine.run(files(5),
            List.of(new TestTechniques.AlwaysThrows(), new TestTechniques.TodoFinder()),
            baseDir(), parallel().build());

        assertThat(result.count(Severity.ERROR)).isEqualTo(5);
        assertThat(result.occurrences()).filteredOn(o -> o.kind().equals("todo-pending")).hasSize(3);
    }

    @Test
    void run_throwingFilePredicate_isolatedPerTechnique() {
        ExecutionResult result = engine.run(files(5),
            List.of(new TestTechniques.ThrowingPredicate(), new TestTechniques.TodoFinder()),
            baseDir(), parallel().build());

        assertThat(result.occurrences()).filteredOn(o -> o.severity() == Severity.ERROR)
            .hasSize(5)
            .allSatisfy(o -> assertThat(o.sourceTechnique()).isEqualTo("throwing-predicate"));
        assertThat(result.occurrences()).filteredOn(o -> o.kind().equals("todo-pending")).hasSize(3);
    }

    @Test
    void run_errorThrownInline_isolatedPerFile() {
        ExecutionResult result = engine.run(files(5),
            List.of(new TestTechniques.ThrowsError(), new TestTechniques.TodoFinder()),
            baseDir(), parallel().timeoutMs(0).build());

        assertThat(result.occurrences()).filteredOn(o -> o.severity() == Severity.ERROR)
            .hasSize(5)
            .allSatisfy(o -> assertThat(o.sourceTechnique()).isEqualTo("throws-error"));
        assertThat(result.occurrences()).filteredOn(o -> o.kind().equals("todo-pending")).hasSize(3);
    }

    @Test
    void run_timeout_appliesInWorkers() {
        ExecutionResult result = engine.run(files(2), List.of(new TestTechniques.InfiniteLoop()),
            baseDir(), parallel().timeoutMs(50).build());

        assertThat(result.occurrences()).hasSize(2)
            .allSatisfy(o -> assertThat(o.kind()).isEqualTo(SyntheticOccurrences.TECHNIQUE_TIMEOUT));
    }

    @Test
    void run_incrementalCache_sharedWithSequentialMode() {
        IncrementalCache cache = IncrementalCache.inMemory();
        TestTechniques.TodoFinder technique = new TestTechniques.TodoFinder();
        List<FileEntry> files = files(10);

        ExecutionResult first = engine.run(files, List.of(technique), baseDir(),
            parallel().incrementalCache(cache).build());
        ExecutionResult second = engine.run(files, List.of(technique), baseDir(),
            ExecutionOptions.builder().incrementalCache(cache).build());

        assertThat(technique.invocations.get()).isEqualTo(10);
        assertThat(first.metrics().cacheMisses()).isEqualTo(10);
        assertThat(second.metrics().cacheHits()).isEqualTo(10);
        assertThat(second.occurrences()).containsExactlyElementsOf(first.occurrences());
        assertThat(cache.previous().size()).isEqualTo(10);
    }

    @Test
    void run_listenerCalledOncePerFileOnCoordinator() {
        List<String> processed = Collections.synchronizedList(new ArrayList<>());
        Thread caller = Thread.currentThread();
        List<Thread> threads = Collections.synchronizedList(new ArrayList<>());
        ExecutionOptions options = parallel()
            .listener(new ExecutionListener() {
                @Override
                public void onFileProcessed(String relPath, int occurrenceCount) {
                    processed.add(relPath);
                    threads.add(Thread.currentThread());
                }
            })
            .build();

        engine.run(files(10), List.of(new TestTechniques.TodoFinder()), baseDir(), options);

        assertThat(processed).hasSize(10).doesNotHaveDuplicates();
        assertThat(threads).containsOnly(caller);
    }

    @Test
    void run_noFiles_returnsEmptyResult() {
        ExecutionResult result = engine.run(List.of(), List.of(new TestTechniques.TodoFinder()),
            baseDir(), parallel().build());

        assertThat(result.occurrences()).isEmpty();
        assertThat(result.totalFiles()).isZero();
        assertThat(engine.state(ExecutionMode.PARALLEL)).isEqualTo(ExecutorState.DONE);
    }

    @Test
    void run_singleWorker_processesAllBatches() {
        ExecutionResult result = engine.run(files(9), List.of(new TestTechniques.TodoFinder()),
            baseDir(), parallel().workerCount(1).batchSize(2).build());

        assertThat(result.occurrences()).hasSize(5);
        assertThat(result.metrics().cacheMisses()).isEqualTo(9);
    }
}
