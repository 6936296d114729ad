package com.codesentry.core.execution;

/**
 * Optional, advisory progress notifications of a run.
 *
 * <p>Listeners are always called from the coordinating thread. Exceptions thrown by a
 * listener are logged and ignored; the absence of a listener never changes the
 * result of a run.</p>
 */
public interface ExecutionListener {

    /**
     * Listener that ignores every event.
     */
    ExecutionListener NONE = new ExecutionListener() {};

    /**
     * Called once per file after it was analyzed or served from the incremental store.
     *
     * @param relPath relative path of the file
     * @param occurrenceCount occurrences recorded for the file
     */
    default void onFileProcessed(String relPath, int occurrenceCount) {
    }

    /**
     * Called once when the run has finished.
     *
     * @param result the complete result
     */
    default void onAnalysisComplete(ExecutionResult result) {
    }
}
