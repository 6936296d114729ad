package com.codesentry.core.execution;

/**
 * Turns source text into an opaque, language-specific syntax tree.
 *
 * <p>The engine invokes the builder lazily, only for files that are actually
 * analyzed (never for incremental cache hits), and passes the handle to
 * techniques without inspecting it. Returning {@code null} means "no tree".</p>
 */
@FunctionalInterface
public interface SyntaxTreeBuilder {

    /**
     * Builder that never produces a tree.
     */
    SyntaxTreeBuilder NONE = (content, extension) -> null;

    /**
     * Builds a syntax tree.
     *
     * @param content file text
     * @param extension file extension without dot (may be empty)
     * @return tree handle, or {@code null} when the file cannot or need not be parsed
     * @throws Exception on parser failure; the engine logs it and continues without a tree
     */
    Object build(String content, String extension) throws Exception;
}
