package com.codesentry.core.model;

import java.util.Objects;

/**
 * A source file handed to the engine by the scanner.
 *
 * <p>The engine only reads entries, it never mutates them. The syntax tree is an
 * opaque handle produced by a {@code SyntaxTreeBuilder}; the engine passes it to
 * techniques unchanged.</p>
 *
 * @param relPath path relative to the project base directory (uses {@code /} separators)
 * @param fullPath absolute path on disk
 * @param content file text, or {@code null} when it could not be read
 * @param syntaxTree opaque syntax tree, or {@code null} when not (yet) parsed
 */
public record FileEntry(
    String relPath,
    String fullPath,
    String content,
    Object syntaxTree
) {
    /**
     * Compact constructor with validation.
     */
    public FileEntry {
        Objects.requireNonNull(relPath, "relPath must not be null");
        if (fullPath == null) {
            fullPath = relPath;
        }
    }

    /**
     * Creates an entry without a syntax tree.
     *
     * @param relPath relative path
     * @param fullPath absolute path
     * @param content file text
     * @return new file entry
     */
    public static FileEntry of(String relPath, String fullPath, String content) {
        return new FileEntry(relPath, fullPath, content, null);
    }

    /**
     * Returns a copy of this entry carrying the given syntax tree.
     *
     * @param tree syntax tree handle
     * @return new entry with the tree attached
     */
    public FileEntry withSyntaxTree(Object tree) {
        return new FileEntry(relPath, fullPath, content, tree);
    }

    /**
     * Returns the content length in characters (0 when content is absent).
     *
     * @return content size
     */
    public int size() {
        return content == null ? 0 : content.length();
    }

    /**
     * Gets the file extension.
     *
     * @return extension without dot, or empty string if none
     */
    public String extension() {
        int slash = relPath.lastIndexOf('/');
        String fileName = slash >= 0 ? relPath.substring(slash + 1) : relPath;
        int lastDot = fileName.lastIndexOf('.');
        return lastDot > 0 ? fileName.substring(lastDot + 1) : "";
    }
}
