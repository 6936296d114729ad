package com.codesentry.core.execution;

import com.codesentry.core.model.Occurrence;
import com.codesentry.core.model.Severity;

/**
 * Occurrences synthesized by the engine for faults it recovered from.
 */
public final class SyntheticOccurrences {

    /**
     * Kind of the occurrence emitted when a technique throws.
     */
    public static final String TECHNIQUE_ERROR = "technique-error";

    /**
     * Kind of the occurrence emitted when a technique exceeds its time budget.
     */
    public static final String TECHNIQUE_TIMEOUT = "technique-timeout";

    /**
     * File path placeholder for occurrences of global techniques.
     */
    public static final String GLOBAL_PATH = "[global]";

    /**
     * Source technique of occurrences about a failing side channel.
     */
    public static final String REPORTER = "reporter";

    /**
     * Source technique of occurrences about a failed worker batch.
     */
    public static final String WORKER_POOL = "worker-pool";

    private SyntheticOccurrences() {
        // Utility class
    }

    /**
     * Creates the ERROR occurrence for a technique that threw.
     *
     * @param techniqueId failing technique
     * @param relPath file being analyzed, or empty for global techniques
     * @param failure the failure
     * @return synthetic occurrence
     */
    public static Occurrence error(String techniqueId, String relPath, Throwable failure) {
        String path = pathOrGlobal(relPath);
        String message = isGlobal(relPath)
            ? String.format("Global technique '%s' failed: %s", techniqueId, describe(failure))
            : String.format("Technique '%s' failed on %s: %s", techniqueId, path, describe(failure));
        return Occurrence.at(TECHNIQUE_ERROR, Severity.ERROR, message, path, techniqueId);
    }

    /**
     * Creates the WARNING occurrence for a technique that ran out of time.
     *
     * @param techniqueId slow technique
     * @param relPath file being analyzed, or empty for global techniques
     * @param budgetMs the exceeded budget
     * @return synthetic occurrence
     */
    public static Occurrence timeout(String techniqueId, String relPath, long budgetMs) {
        String path = pathOrGlobal(relPath);
        String message = isGlobal(relPath)
            ? String.format("Timeout in global technique '%s': %d ms exceeded", techniqueId, budgetMs)
            : String.format("Timeout in technique '%s' on %s: %d ms exceeded", techniqueId, path, budgetMs);
        return Occurrence.at(TECHNIQUE_TIMEOUT, Severity.WARNING, message, path, techniqueId);
    }

    /**
     * Creates the ERROR occurrence for a report the side channel could not accept.
     *
     * @param relPath file being analyzed
     * @param reason why the report was rejected
     * @return synthetic occurrence
     */
    public static Occurrence reporterFailure(String relPath, String reason) {
        return Occurrence.at(TECHNIQUE_ERROR, Severity.ERROR, "Reporter failure: " + reason,
            pathOrGlobal(relPath), REPORTER);
    }

    /**
     * Creates the ERROR occurrence for a file whose worker batch failed as a whole.
     *
     * @param relPath file of the failed batch
     * @param failure the failure
     * @return synthetic occurrence
     */
    public static Occurrence workerFailure(String relPath, Throwable failure) {
        return Occurrence.at(TECHNIQUE_ERROR, Severity.ERROR,
            "Worker failed while analyzing " + relPath + ": " + describe(failure), relPath, WORKER_POOL);
    }

    private static boolean isGlobal(String relPath) {
        return relPath == null || relPath.isEmpty();
    }

    private static String pathOrGlobal(String relPath) {
        return isGlobal(relPath) ? GLOBAL_PATH : relPath;
    }

    private static String describe(Throwable failure) {
        if (failure == null) {
            return "unknown error";
        }
        String message = failure.getMessage();
        return message == null || message.isBlank() ? failure.getClass().getSimpleName() : message;
    }
}
