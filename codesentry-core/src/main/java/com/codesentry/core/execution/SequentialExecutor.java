package com.codesentry.core.execution;

import com.codesentry.core.model.FileEntry;
import com.codesentry.core.technique.ExecutionContext;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;

/**
 * Executes techniques file by file on the calling thread.
 *
 * <p>Per-file techniques see the context with a live side-channel reporter. Only
 * technique invocations are handed to the invocation pool, and only so that they
 * can be abandoned when they exceed their budget.</p>
 */
public class SequentialExecutor extends AbstractExecutor {

    private volatile int currentFileIndex = -1;

    public SequentialExecutor(ExecutorService invocationPool) {
        super(invocationPool);
    }

    /**
     * Returns the scan position of the file being analyzed.
     *
     * @return index of the current file, or -1 outside the per-file phase
     */
    public int currentFileIndex() {
        return currentFileIndex;
    }

    @Override
    protected TechniqueInvoker newInvoker() {
        return new TechniqueInvoker(invocationPool, true);
    }

    @Override
    protected List<FileOutcome> processFiles(List<FileEntry> files, FileProcessor processor,
                                             ExecutionContext context, ExecutionOptions options) {
        List<FileOutcome> outcomes = new ArrayList<>(files.size());
        try {
            for (int i = 0; i < files.size(); i++) {
                currentFileIndex = i;
                FileOutcome outcome = processor.process(i, files.get(i), context);
                outcomes.add(outcome);
                fileProcessed(options, outcome);
            }
        } finally {
            currentFileIndex = -1;
        }
        return outcomes;
    }
}
