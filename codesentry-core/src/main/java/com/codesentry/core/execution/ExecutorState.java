package com.codesentry.core.execution;

/**
 * Lifecycle of a single run.
 *
 * <p>{@code IDLE -> RUNNING_GLOBAL -> RUNNING_PER_FILE -> FINALIZING -> DONE}</p>
 */
public enum ExecutorState {
    IDLE,
    RUNNING_GLOBAL,
    RUNNING_PER_FILE,
    FINALIZING,
    DONE
}
