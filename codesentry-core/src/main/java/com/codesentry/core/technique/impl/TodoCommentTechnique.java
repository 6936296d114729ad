package com.codesentry.core.technique.impl;

import com.codesentry.core.model.Occurrence;
import com.codesentry.core.model.Severity;
import com.codesentry.core.technique.AbstractTechnique;
import com.codesentry.core.technique.ExecutionContext;
import com.codesentry.core.technique.FilePredicate;
import com.codesentry.core.technique.FilePredicates;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Technique reporting pending-work markers (TODO, FIXME) left in comments.
 *
 * <p>Only comments count: a marker inside a string literal or in plain code is
 * ignored. Line comments ({@code //}) and block comments ({@code /* ... *}{@code /},
 * possibly spanning lines) are recognized, which covers the C-family languages
 * listed in {@link #DEFAULT_EXTENSIONS}. Test sources are skipped.</p>
 *
 * <p><b>Example:</b>
 * <pre>{@code
 * const a = 1;
 * const b = "TODO: not a comment";   // ignored
 * // TODO: handle empty input        -> todo-pending at line 3, column 4
 * }</pre>
 *
 * @since 1.0.0
 */
public class TodoCommentTechnique extends AbstractTechnique {

    /**
     * Kind of the reported occurrences.
     */
    public static final String KIND = "todo-pending";

    /**
     * Markers reported when none are configured.
     */
    public static final List<String> DEFAULT_MARKERS = List.of("TODO", "FIXME");

    /**
     * Extensions of the files analyzed by default.
     */
    public static final List<String> DEFAULT_EXTENSIONS = List.of(
        "java", "kt", "scala", "groovy", "js", "jsx", "ts", "tsx", "go", "c", "h", "cpp", "cs", "swift", "rs"
    );

    private static final int LINE = 0;
    private static final int BLOCK = 1;

    private final List<String> markers;
    private final Pattern markerPattern;
    private final FilePredicate predicate;

    public TodoCommentTechnique() {
        this(DEFAULT_MARKERS, DEFAULT_EXTENSIONS);
    }

    /**
     * Creates the technique with custom markers and extensions.
     *
     * @param markers words reported when found in a comment
     * @param extensions extensions of the analyzed files
     */
    public TodoCommentTechnique(List<String> markers, List<String> extensions) {
        this.markers = markers == null || markers.isEmpty() ? DEFAULT_MARKERS : List.copyOf(markers);
        this.markerPattern = Pattern.compile(this.markers.stream()
            .map(Pattern::quote)
            .collect(Collectors.joining("|", "\\b(", ")\\b")));
        List<String> accepted = extensions == null || extensions.isEmpty() ? DEFAULT_EXTENSIONS : extensions;
        this.predicate = FilePredicates.hasExtension(accepted.toArray(String[]::new))
            .and(FilePredicates.excludeTests());
    }

    @Override
    public String getId() {
        return "todo-comments";
    }

    @Override
    public String getDescription() {
        return "Reports " + String.join("/", markers) + " markers left in comments";
    }

    @Override
    public FilePredicate getFilePredicate() {
        return predicate;
    }

    @Override
    public List<Occurrence> apply(String content, String relPath, Object syntaxTree, String fullPath,
                                  ExecutionContext context) {
        List<Occurrence> occurrences = new ArrayList<>();
        List<String> lines = lines(content);
        boolean inBlock = false;

        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            int commentStart;
            int commentEnd = line.length();

            if (inBlock) {
                commentStart = 0;
                int close = line.indexOf("*/");
                if (close >= 0) {
                    commentEnd = close;
                    inBlock = false;
                }
            } else {
                int[] marker = findCommentStart(line);
                if (marker == null) {
                    continue;
                }
                commentStart = marker[0];
                if (marker[1] == BLOCK) {
                    int close = line.indexOf("*/", commentStart + 2);
                    if (close >= 0) {
                        commentEnd = close;
                    } else {
                        inBlock = true;
                    }
                }
            }

            Matcher matcher = markerPattern.matcher(line).region(commentStart, commentEnd);
            if (matcher.find()) {
                String found = matcher.group(1);
                occurrences.add(occurrence(KIND, Severity.INFO,
                    found + " comment: " + line.substring(matcher.start(), commentEnd).trim(),
                    relPath, i + 1, matcher.start() + 1));
            }
        }

        if (!occurrences.isEmpty()) {
            log.debug("Found {} pending markers in {}", occurrences.size(), relPath);
        }
        return occurrences;
    }

    /**
     * Locates the first comment opener outside string literals.
     *
     * @return {offset, LINE|BLOCK}, or null when the line has no comment
     */
    private static int[] findCommentStart(String line) {
        char quote = 0;
        for (int i = 0; i < line.length() - 1; i++) {
            char ch = line.charAt(i);
            if (quote != 0) {
                if (ch == '\\') {
                    i++;
                } else if (ch == quote) {
                    quote = 0;
                }
                continue;
            }
            if (ch == '"' || ch == '\'' || ch == '`') {
                quote = ch;
                continue;
            }
            if (ch == '/') {
                char next = line.charAt(i + 1);
                if (next == '/') {
                    return new int[] {i, LINE};
                }
                if (next == '*') {
                    return new int[] {i, BLOCK};
                }
            }
        }
        return null;
    }
}
