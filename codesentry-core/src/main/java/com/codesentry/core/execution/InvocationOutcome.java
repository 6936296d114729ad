package com.codesentry.core.execution;

import com.codesentry.core.model.Occurrence;

import java.util.List;
import java.util.Objects;

/**
 * Result of one technique invocation on one file (or on the project, for global techniques).
 *
 * @param techniqueId invoked technique
 * @param status how the invocation ended
 * @param occurrences side-channel reports followed by returned occurrences, or the
 *     synthetic error/timeout occurrence
 * @param producedCount occurrences produced by the technique itself (0 unless completed)
 * @param durationMs wall-clock duration in milliseconds
 */
public record InvocationOutcome(
    String techniqueId,
    Status status,
    List<Occurrence> occurrences,
    int producedCount,
    double durationMs
) {
    /**
     * How an invocation ended.
     */
    public enum Status {
        /** The technique returned normally. */
        COMPLETED,
        /** The technique threw. */
        FAILED,
        /** The technique exceeded its budget and was abandoned. */
        TIMED_OUT
    }

    /**
     * Compact constructor with validation.
     */
    public InvocationOutcome {
        Objects.requireNonNull(techniqueId, "techniqueId must not be null");
        Objects.requireNonNull(status, "status must not be null");
        occurrences = occurrences == null ? List.of() : List.copyOf(occurrences);
    }

    public boolean completed() {
        return status == Status.COMPLETED;
    }
}
