package com.codesentry.core.technique;

import com.codesentry.core.model.Occurrence;

import java.util.List;

/**
 * Contract every analysis rule satisfies.
 *
 * <p>A technique is either <em>global</em>, invoked once per run against the whole
 * project, or <em>per-file</em>, invoked once for every file accepted by its
 * {@link #getFilePredicate() predicate}. Techniques are registered explicitly in a
 * {@link TechniqueRegistry} before any run starts.</p>
 *
 * <p>Implementations must not mutate the content they receive, the context's file
 * list, or any other technique's state. Failures and timeouts are isolated by the
 * engine: an exception thrown from {@link #apply} becomes a synthetic error
 * occurrence and never aborts the run.</p>
 *
 * @see AbstractTechnique
 * @see ExecutionContext
 */
public interface Technique {

    /**
     * Returns unique identifier for this technique.
     *
     * <p>Must be kebab-case (e.g., "todo-comments", "duplicate-files"). The id names
     * the technique in occurrences, metrics and configuration.
     *
     * @return unique technique identifier
     */
    String getId();

    /**
     * Returns human-readable description of what the technique detects.
     *
     * @return description, used by the CLI {@code list} command
     */
    default String getDescription() {
        return getId();
    }

    /**
     * Returns whether the technique runs once per project instead of once per file.
     *
     * @return true for global techniques
     */
    default boolean isGlobal() {
        return false;
    }

    /**
     * Returns the file selection of a per-file technique.
     *
     * <p>The default implementation returns {@code null}, which means "all files".
     * Ignored for global techniques.</p>
     *
     * @return predicate over relative paths, or {@code null} for all files
     */
    default FilePredicate getFilePredicate() {
        return null;
    }

    /**
     * Checks if this technique runs on the given file.
     *
     * @param relPath file path relative to the project root
     * @return true if the technique applies
     */
    default boolean appliesTo(String relPath) {
        FilePredicate predicate = getFilePredicate();
        return predicate == null || predicate.test(relPath);
    }

    /**
     * Analyzes one file (or the whole project, for global techniques).
     *
     * <p>Global techniques receive empty content and path and {@code null} tree and
     * full path; they read {@link ExecutionContext#files()} instead.</p>
     *
     * @param content file text, never null
     * @param relPath relative path
     * @param syntaxTree opaque syntax tree, or {@code null}
     * @param fullPath absolute path, or {@code null} for global techniques
     * @param context shared execution context
     * @return occurrences found, or {@code null}/empty when nothing to report
     * @throws Exception on any failure; converted to an error occurrence by the engine
     */
    List<Occurrence> apply(String content, String relPath, Object syntaxTree, String fullPath, ExecutionContext context)
        throws Exception;
}
