package com.codesentry.core.technique.impl;

import com.codesentry.core.technique.Technique;
import com.codesentry.core.technique.TechniqueRegistry;

import java.util.List;
import java.util.Map;

/**
 * Explicit list of the techniques shipped with CodeSentry.
 *
 * <p>There is no classpath discovery: callers register the built-ins, then their
 * own techniques, in the order they should run.</p>
 */
public final class BuiltInTechniques {

    private BuiltInTechniques() {
        // Utility class
    }

    /**
     * Registers every built-in technique with default settings.
     *
     * @param registry target registry
     * @return the registry
     */
    public static TechniqueRegistry registerAll(TechniqueRegistry registry) {
        return registerAll(registry, Map.of());
    }

    /**
     * Registers every built-in technique.
     *
     * @param registry target registry
     * @param settings technique settings keyed by technique id
     * @return the registry
     */
    public static TechniqueRegistry registerAll(TechniqueRegistry registry, Map<String, Map<String, Object>> settings) {
        return registry.registerAll(create(settings));
    }

    /**
     * Instantiates the built-in techniques in registration order.
     *
     * <p>Recognized settings: {@code todo-comments.markers} and
     * {@code todo-comments.extensions} (lists of strings),
     * {@code oversized-file.maxLines} (integer).</p>
     *
     * @param settings technique settings keyed by technique id
     * @return new technique instances
     */
    public static List<Technique> create(Map<String, Map<String, Object>> settings) {
        Map<String, Object> todo = settingsFor(settings, "todo-comments");
        Map<String, Object> oversized = settingsFor(settings, "oversized-file");

        return List.of(
            new DuplicateFilesTechnique(),
            new TodoCommentTechnique(stringList(todo.get("markers")), stringList(todo.get("extensions"))),
            new OversizedFileTechnique(intValue(oversized.get("maxLines"), OversizedFileTechnique.DEFAULT_MAX_LINES))
        );
    }

    private static Map<String, Object> settingsFor(Map<String, Map<String, Object>> settings, String id) {
        if (settings == null) {
            return Map.of();
        }
        Map<String, Object> values = settings.get(id);
        return values == null ? Map.of() : values;
    }

    private static List<String> stringList(Object value) {
        if (value instanceof List<?> list) {
            return list.stream().map(String::valueOf).toList();
        }
        if (value instanceof String text && !text.isBlank()) {
            return List.of(text.split("\\s*,\\s*"));
        }
        return List.of();
    }

    private static int intValue(Object value, int defaultValue) {
        if (value instanceof Number number) {
            return number.intValue();
        }
        if (value instanceof String text) {
            try {
                return Integer.parseInt(text.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Not an integer: " + text, e);
            }
        }
        return defaultValue;
    }
}
