package com.codesentry.cli;

import com.codesentry.core.execution.ExecutionListener;
import com.codesentry.core.execution.ExecutionResult;

import java.io.PrintStream;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Prints analysis progress to the console.
 *
 * <p>In verbose mode every file is listed with its occurrence count; otherwise a
 * single summary line is printed when the run completes. Quiet mode prints nothing.</p>
 */
public class ConsoleProgressListener implements ExecutionListener {

    private final PrintStream out;
    private final boolean verbose;
    private final boolean quiet;
    private final AtomicInteger processed = new AtomicInteger();

    public ConsoleProgressListener(PrintStream out, boolean verbose, boolean quiet) {
        this.out = out;
        this.verbose = verbose;
        this.quiet = quiet;
    }

    @Override
    public void onFileProcessed(String relPath, int occurrenceCount) {
        int count = processed.incrementAndGet();
        if (verbose && !quiet) {
            out.printf("  [%d] %s (%d)%n", count, relPath, occurrenceCount);
        }
    }

    @Override
    public void onAnalysisComplete(ExecutionResult result) {
        if (!quiet) {
            out.printf("✓ Analyzed %d files (%.1f ms)%n", processed.get(), result.durationMs());
        }
    }

    public int processedFiles() {
        return processed.get();
    }
}
