package com.codesentry.core.technique;

import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.Arrays;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Factory for common {@link FilePredicate} instances.
 *
 * <p>Provides reusable file selections so techniques declare which files they
 * analyze instead of re-implementing path checks.</p>
 *
 * <p><b>Example usage:</b></p>
 * <pre>{@code
 * // TypeScript sources outside of test folders
 * FilePredicate predicate =
 *     FilePredicates.hasExtension("ts", "tsx")
 *         .and(FilePredicates.excludeTests());
 * }</pre>
 *
 * @since 1.0.0
 */
public final class FilePredicates {

    private static final Pattern TEST_PATH = Pattern.compile(
        "(^|/)(test|tests|__tests__|spec|specs)/|\\.(test|spec)\\.[a-z0-9]+$|Test\\.java$|Tests\\.java$",
        Pattern.CASE_INSENSITIVE
    );

    private FilePredicates() {
        // Utility class - prevent instantiation
    }

    /**
     * Predicate that matches every file.
     *
     * @return predicate that always applies
     */
    public static FilePredicate all() {
        return relPath -> true;
    }

    /**
     * Predicate that matches no file.
     *
     * @return predicate that never applies
     */
    public static FilePredicate none() {
        return relPath -> false;
    }

    /**
     * Match files by extension (case-insensitive, without the dot).
     *
     * @param extensions accepted extensions (e.g. "ts", "java")
     * @return predicate that tests the file extension
     */
    public static FilePredicate hasExtension(String... extensions) {
        Set<String> accepted = Arrays.stream(extensions)
            .map(ext -> ext.startsWith(".") ? ext.substring(1) : ext)
            .map(ext -> ext.toLowerCase(Locale.ROOT))
            .collect(Collectors.toUnmodifiableSet());
        return relPath -> accepted.contains(extensionOf(relPath));
    }

    /**
     * Match files against any of the given glob patterns.
     *
     * <p>Patterns are evaluated against the relative path, e.g. {@code src/**}{@code /*.ts}.</p>
     *
     * @param patterns glob patterns
     * @return predicate that tests the relative path against the globs
     */
    public static FilePredicate matchesGlob(String... patterns) {
        PathMatcher[] matchers = Arrays.stream(patterns)
            .map(pattern -> FileSystems.getDefault().getPathMatcher("glob:" + pattern))
            .toArray(PathMatcher[]::new);
        return relPath -> {
            Path path = Path.of(relPath);
            for (PathMatcher matcher : matchers) {
                if (matcher.matches(path)) {
                    return true;
                }
            }
            return false;
        };
    }

    /**
     * Reject files that look like tests or specs.
     *
     * @return predicate that is false for test sources
     */
    public static FilePredicate excludeTests() {
        return relPath -> !TEST_PATH.matcher(relPath).find();
    }

    private static String extensionOf(String relPath) {
        int slash = relPath.lastIndexOf('/');
        String fileName = slash >= 0 ? relPath.substring(slash + 1) : relPath;
        int lastDot = fileName.lastIndexOf('.');
        return lastDot > 0 ? fileName.substring(lastDot + 1).toLowerCase(Locale.ROOT) : "";
    }
}
