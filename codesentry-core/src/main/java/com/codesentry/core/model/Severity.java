package com.codesentry.core.model;

/**
 * Severity level of an {@link Occurrence}.
 *
 * @since 1.0.0
 */
public enum Severity {
    /**
     * Informational - no action required, just for awareness.
     */
    INFO,

    /**
     * Warning - potential issue that should be reviewed.
     */
    WARNING,

    /**
     * Error - a defect, or a technique that failed while analyzing a file.
     */
    ERROR
}
