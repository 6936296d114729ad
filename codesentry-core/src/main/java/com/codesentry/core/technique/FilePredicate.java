package com.codesentry.core.technique;

/**
 * Predicate deciding whether a per-file technique runs on a given file.
 *
 * <p>Predicates compose via {@link #and(FilePredicate)}, {@link #or(FilePredicate)}
 * and {@link #negate()}, so techniques can declare their file selection
 * declaratively with {@link FilePredicates}.</p>
 *
 * <p><b>Example usage:</b></p>
 * <pre>{@code
 * FilePredicate predicate =
 *     FilePredicates.hasExtension("ts", "js")
 *         .and(FilePredicates.excludeTests());
 * }</pre>
 *
 * @see FilePredicates
 * @since 1.0.0
 */
@FunctionalInterface
public interface FilePredicate {

    /**
     * Check if the technique should run on the file.
     *
     * @param relPath file path relative to the project root
     * @return {@code true} if the technique applies, {@code false} otherwise
     */
    boolean test(String relPath);

    /**
     * Combine this predicate with another using AND logic.
     *
     * @param other the other predicate to combine with
     * @return a predicate that is the logical AND of both
     */
    default FilePredicate and(FilePredicate other) {
        return relPath -> this.test(relPath) && other.test(relPath);
    }

    /**
     * Combine this predicate with another using OR logic.
     *
     * @param other the other predicate to combine with
     * @return a predicate that is the logical OR of both
     */
    default FilePredicate or(FilePredicate other) {
        return relPath -> this.test(relPath) || other.test(relPath);
    }

    /**
     * Negate this predicate.
     *
     * @return a predicate that is the logical negation of this one
     */
    default FilePredicate negate() {
        return relPath -> !this.test(relPath);
    }
}
