package com.codesentry.core.technique;

import com.codesentry.core.model.Occurrence;
import com.codesentry.core.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Abstract base class for technique implementations providing common functionality.
 *
 * <p>This class reduces duplication across techniques by providing:
 * <ul>
 *   <li>Logger initialization (one logger per technique class)</li>
 *   <li>Occurrence creation helpers stamped with this technique's id
 *       ({@link #occurrence}, {@link #info}, {@link #warning}, {@link #error})</li>
 *   <li>Line helpers ({@link #lines(String)}, {@link #lineOf(String, int)})</li>
 * </ul>
 *
 * @see Technique
 * @since 1.0.0
 */
public abstract class AbstractTechnique implements Technique {

    /**
     * Logger instance for this technique.
     * Automatically initialized with the concrete technique class name.
     */
    protected final Logger log;

    /**
     * Constructor that initializes the logger for the concrete technique class.
     */
    protected AbstractTechnique() {
        this.log = LoggerFactory.getLogger(getClass());
    }

    // ==================== Occurrence Creation Helpers ====================

    /**
     * Creates an occurrence attributed to this technique.
     *
     * @param kind finding type
     * @param severity severity level
     * @param message description
     * @param relPath relative file path
     * @param line 1-based line, or null
     * @param column 1-based column, or null
     * @return new occurrence
     */
    protected Occurrence occurrence(String kind, Severity severity, String message, String relPath,
                                    Integer line, Integer column) {
        return new Occurrence(kind, severity, message, relPath, line, column, getId());
    }

    /**
     * Creates an INFO occurrence at the given line.
     *
     * @param kind finding type
     * @param message description
     * @param relPath relative file path
     * @param line 1-based line, or null
     * @return new occurrence
     */
    protected Occurrence info(String kind, String message, String relPath, Integer line) {
        return occurrence(kind, Severity.INFO, message, relPath, line, null);
    }

    /**
     * Creates a WARNING occurrence at the given line.
     *
     * @param kind finding type
     * @param message description
     * @param relPath relative file path
     * @param line 1-based line, or null
     * @return new occurrence
     */
    protected Occurrence warning(String kind, String message, String relPath, Integer line) {
        return occurrence(kind, Severity.WARNING, message, relPath, line, null);
    }

    /**
     * Creates an ERROR occurrence at the given line.
     *
     * @param kind finding type
     * @param message description
     * @param relPath relative file path
     * @param line 1-based line, or null
     * @return new occurrence
     */
    protected Occurrence error(String kind, String message, String relPath, Integer line) {
        return occurrence(kind, Severity.ERROR, message, relPath, line, null);
    }

    // ==================== Line Helpers ====================

    /**
     * Splits content into lines, accepting {@code \n} and {@code \r\n}.
     *
     * @param content file text
     * @return lines (empty list for empty content)
     */
    protected List<String> lines(String content) {
        if (content == null || content.isEmpty()) {
            return List.of();
        }
        return content.lines().toList();
    }

    /**
     * Computes the 1-based line number of a character offset.
     *
     * @param content file text
     * @param offset character offset
     * @return 1-based line number
     */
    protected int lineOf(String content, int offset) {
        int line = 1;
        int limit = Math.min(offset, content.length());
        for (int i = 0; i < limit; i++) {
            if (content.charAt(i) == '\n') {
                line++;
            }
        }
        return line;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + getId() + (isGlobal() ? ", global" : "") + "]";
    }
}
