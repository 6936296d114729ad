package com.codesentry.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A single finding reported by a technique, or synthesized by the engine when a
 * technique fails or times out.
 *
 * <p>Occurrences are the common currency of the whole system: techniques return them,
 * the incremental store persists them and report renderers consume them.</p>
 *
 * <p><b>Example:</b></p>
 * <pre>{@code
 * Occurrence todo = new Occurrence(
 *     "todo-pending",
 *     Severity.INFO,
 *     "Pending TODO comment",
 *     "src/app.ts",
 *     3,
 *     5,
 *     "todo-comments"
 * );
 * }</pre>
 *
 * @param kind machine-readable finding type (e.g. "todo-pending")
 * @param severity severity level
 * @param message human-readable description
 * @param filePath path of the file relative to the project root
 * @param line 1-based line, or {@code null} when not applicable
 * @param column 1-based column, or {@code null} when not applicable
 * @param sourceTechnique id of the technique that produced the finding
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Occurrence(
    @JsonProperty("kind") String kind,
    @JsonProperty("severity") Severity severity,
    @JsonProperty("message") String message,
    @JsonProperty("filePath") String filePath,
    @JsonProperty("line") Integer line,
    @JsonProperty("column") Integer column,
    @JsonProperty("sourceTechnique") String sourceTechnique
) {
    /**
     * Compact constructor with validation.
     */
    public Occurrence {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(severity, "severity must not be null");
        Objects.requireNonNull(sourceTechnique, "sourceTechnique must not be null");
        if (message == null) {
            message = "";
        }
        if (filePath == null) {
            filePath = "";
        }
        if (line != null && line < 1) {
            line = null;
        }
        if (column != null && column < 1) {
            column = null;
        }
    }

    /**
     * Creates an occurrence without a source location.
     *
     * @param kind finding type
     * @param severity severity level
     * @param message description
     * @param filePath relative file path
     * @param sourceTechnique producing technique id
     * @return new occurrence with no line or column
     */
    public static Occurrence at(String kind, Severity severity, String message, String filePath, String sourceTechnique) {
        return new Occurrence(kind, severity, message, filePath, null, null, sourceTechnique);
    }

    /**
     * Returns true if this occurrence points at a specific line.
     *
     * @return true when a line is available
     */
    public boolean hasLocation() {
        return line != null;
    }
}
