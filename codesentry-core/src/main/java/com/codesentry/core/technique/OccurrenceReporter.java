package com.codesentry.core.technique;

import com.codesentry.core.model.Occurrence;

/**
 * Side channel a technique may use to emit occurrences outside of its return value.
 *
 * <p>Only available on the coordinating thread's context. Contexts handed to
 * parallel workers never carry a reporter.</p>
 */
@FunctionalInterface
public interface OccurrenceReporter {

    /**
     * Emits an occurrence.
     *
     * @param occurrence the finding to report
     */
    void report(Occurrence occurrence);
}
