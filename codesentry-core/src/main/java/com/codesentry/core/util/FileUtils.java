package com.codesentry.core.util;

import java.io.IOException;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Utility class for file operations.
 */
public final class FileUtils {

    private FileUtils() {
        // Utility class
    }

    /**
     * Converts a path to the relative form used in occurrences and the incremental store.
     *
     * @param rootPath project root
     * @param path file below the root
     * @return relative path with {@code /} separators
     */
    public static String relativePath(Path rootPath, Path path) {
        return rootPath.toAbsolutePath().normalize()
            .relativize(path.toAbsolutePath().normalize())
            .toString()
            .replace('\\', '/');
    }

    /**
     * Reads a file as UTF-8 text.
     *
     * @param path path to file
     * @return content, or empty if the file is not valid UTF-8 or contains NUL characters
     * @throws IOException if reading fails
     */
    public static Optional<String> readText(Path path) throws IOException {
        String content;
        try {
            content = Files.readString(path, StandardCharsets.UTF_8);
        } catch (CharacterCodingException e) {
            return Optional.empty();
        }
        return content.indexOf('\0') >= 0 ? Optional.empty() : Optional.of(content);
    }

    /**
     * Gets the file extension.
     *
     * @param path file path
     * @return file extension without dot, or empty string if no extension
     */
    public static String getExtension(Path path) {
        String fileName = path.getFileName().toString();
        int lastDot = fileName.lastIndexOf('.');
        return lastDot > 0 ? fileName.substring(lastDot + 1) : "";
    }
}
