package com.codesentry.core.execution;

import com.codesentry.core.model.FileEntry;
import com.codesentry.core.technique.ExecutionContext;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Executes per-file techniques on a fixed pool of worker threads.
 *
 * <p>Files are cut into batches of {@link ExecutionOptions#batchSize()} files in scan
 * order. Each batch is processed by one worker with the reporter stripped from the
 * context; workers share nothing but immutable inputs and return plain
 * {@link FileOutcome}s. The coordinator collects batches as they complete, notifies
 * the listener, and finally orders all outcomes by scan position, so the merged
 * occurrence list does not depend on thread scheduling.</p>
 *
 * <p>A fresh pool of {@code min(workerCount, batches)} threads is created for every run
 * and shut down when the run ends.</p>
 */
public class ParallelExecutor extends AbstractExecutor {

    private final AtomicInteger workerCounter = new AtomicInteger();

    public ParallelExecutor(ExecutorService invocationPool) {
        super(invocationPool);
    }

    @Override
    protected TechniqueInvoker newInvoker() {
        return new TechniqueInvoker(invocationPool, false);
    }

    @Override
    protected List<FileOutcome> processFiles(List<FileEntry> files, FileProcessor processor,
                                             ExecutionContext context, ExecutionOptions options) {
        if (files.isEmpty()) {
            return List.of();
        }

        List<Batch> batches = partition(files, options.batchSize());
        int threads = Math.min(options.effectiveWorkerCount(), batches.size());
        log.debug("Submitting {} batches of up to {} files to {} workers",
            batches.size(), options.batchSize(), threads);

        ExecutionContext workerContext = context.withoutReporter();
        FileOutcome[] ordered = new FileOutcome[files.size()];
        ExecutorService workers = Executors.newFixedThreadPool(threads, runnable -> {
            Thread thread = new Thread(runnable, "codesentry-worker-" + workerCounter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        try {
            CompletionService<List<FileOutcome>> completion = new ExecutorCompletionService<>(workers);
            Map<Future<List<FileOutcome>>, Batch> submitted = new HashMap<>();
            for (Batch batch : batches) {
                submitted.put(completion.submit(() -> batch.process(processor, workerContext)), batch);
            }

            for (int done = 0; done < batches.size(); done++) {
                Future<List<FileOutcome>> future = completion.take();
                Batch batch = submitted.get(future);
                for (FileOutcome outcome : collect(future, batch)) {
                    ordered[outcome.index()] = outcome;
                    fileProcessed(options, outcome);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for workers, remaining files are reported as failed");
            fillMissing(ordered, files, e);
        } finally {
            workers.shutdownNow();
        }
        return Arrays.asList(ordered);
    }

    private List<FileOutcome> collect(Future<List<FileOutcome>> future, Batch batch) throws InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("Worker batch starting at file {} failed: {}", batch.firstIndex(), cause.getMessage());
            return batch.failed(cause);
        }
    }

    private static void fillMissing(FileOutcome[] ordered, List<FileEntry> files, Throwable cause) {
        for (int i = 0; i < ordered.length; i++) {
            if (ordered[i] == null) {
                ordered[i] = FileOutcome.failed(i, files.get(i).relPath(), cause);
            }
        }
    }

    private static List<Batch> partition(List<FileEntry> files, int batchSize) {
        List<Batch> batches = new ArrayList<>();
        for (int start = 0; start < files.size(); start += batchSize) {
            int end = Math.min(start + batchSize, files.size());
            batches.add(new Batch(start, files.subList(start, end)));
        }
        return batches;
    }

    /**
     * Contiguous slice of the scan order processed by one worker.
     */
    private record Batch(int firstIndex, List<FileEntry> files) {

        List<FileOutcome> process(FileProcessor processor, ExecutionContext context) {
            List<FileOutcome> outcomes = new ArrayList<>(files.size());
            for (int i = 0; i < files.size(); i++) {
                outcomes.add(processor.process(firstIndex + i, files.get(i), context));
            }
            return outcomes;
        }

        List<FileOutcome> failed(Throwable cause) {
            List<FileOutcome> outcomes = new ArrayList<>(files.size());
            for (int i = 0; i < files.size(); i++) {
                outcomes.add(FileOutcome.failed(firstIndex + i, files.get(i).relPath(), cause));
            }
            return outcomes;
        }
    }
}
