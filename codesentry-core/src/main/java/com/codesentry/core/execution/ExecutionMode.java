package com.codesentry.core.execution;

/**
 * Top-level execution strategy of a run.
 */
public enum ExecutionMode {
    /**
     * One coordinator thread; files in scan order, techniques in registration order.
     */
    SEQUENTIAL,

    /**
     * Per-file techniques spread over a bounded worker pool; results merged in scan order.
     */
    PARALLEL
}
