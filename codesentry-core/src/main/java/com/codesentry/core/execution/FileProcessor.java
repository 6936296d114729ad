package com.codesentry.core.execution;

import com.codesentry.core.incremental.Fingerprint;
import com.codesentry.core.incremental.IncrementalRecord;
import com.codesentry.core.incremental.IncrementalStore;
import com.codesentry.core.incremental.TechniqueTiming;
import com.codesentry.core.metrics.TechniqueMetric;
import com.codesentry.core.model.FileEntry;
import com.codesentry.core.model.Occurrence;
import com.codesentry.core.technique.ExecutionContext;
import com.codesentry.core.technique.Technique;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Analyzes one file with every matching per-file technique.
 *
 * <p>Steps: fingerprint the content, consult the previous incremental store, build
 * the syntax tree lazily on a miss, then invoke the matching techniques in
 * registration order. A file predicate that throws counts as a failure of its
 * technique on that file. The processor only reads shared state and returns plain data,
 * so the same instance can be used by several workers at once.</p>
 */
public class FileProcessor {

    private static final Logger log = LoggerFactory.getLogger(FileProcessor.class);

    private final List<Technique> perFileTechniques;
    private final TechniqueInvoker invoker;
    private final IncrementalStore previous;
    private final SyntaxTreeBuilder syntaxTreeBuilder;
    private final long timeoutMs;

    /**
     * Creates a processor.
     *
     * @param perFileTechniques per-file techniques in registration order
     * @param invoker invoker used for every technique call
     * @param previous store of the previous run, or {@code null} when incremental mode is off
     * @param syntaxTreeBuilder parser for files without a tree
     * @param timeoutMs budget per invocation, 0 for none
     */
    public FileProcessor(List<Technique> perFileTechniques, TechniqueInvoker invoker, IncrementalStore previous,
                         SyntaxTreeBuilder syntaxTreeBuilder, long timeoutMs) {
        this.perFileTechniques = List.copyOf(perFileTechniques);
        this.invoker = Objects.requireNonNull(invoker, "invoker must not be null");
        this.previous = previous;
        this.syntaxTreeBuilder = syntaxTreeBuilder == null ? SyntaxTreeBuilder.NONE : syntaxTreeBuilder;
        this.timeoutMs = timeoutMs;
    }

    /**
     * Processes one file.
     *
     * @param index position of the file in scan order
     * @param entry the file
     * @param context context handed to the techniques
     * @return outcome of the file
     */
    public FileOutcome process(int index, FileEntry entry, ExecutionContext context) {
        String relPath = entry.relPath();
        String fingerprint = Fingerprint.of(entry.content());

        if (previous != null) {
            Optional<IncrementalRecord> hit = previous.findValid(relPath, fingerprint);
            if (hit.isPresent()) {
                log.debug("Cache hit for {} ({})", relPath, fingerprint);
                return FileOutcome.cacheHit(index, relPath, hit.get());
            }
        }

        Map<Technique, Throwable> predicateFailures = new HashMap<>();
        List<Technique> matching = new ArrayList<>();
        for (Technique technique : perFileTechniques) {
            try {
                if (technique.appliesTo(relPath)) {
                    matching.add(technique);
                }
            } catch (Throwable e) {
                TechniqueInvoker.rethrowIfFatal(e);
                log.error("File predicate of '{}' failed on {}: {}", technique.getId(), relPath, e.getMessage());
                predicateFailures.put(technique, e);
            }
        }

        long parseNanos = 0L;
        Object syntaxTree = entry.syntaxTree();
        if (syntaxTree == null && !matching.isEmpty() && syntaxTreeBuilder != SyntaxTreeBuilder.NONE) {
            long start = System.nanoTime();
            syntaxTree = buildSyntaxTree(entry);
            parseNanos = System.nanoTime() - start;
        }

        List<Occurrence> occurrences = new ArrayList<>();
        Map<String, TechniqueTiming> timings = new LinkedHashMap<>();
        List<TechniqueMetric> metrics = new ArrayList<>();
        for (Technique technique : perFileTechniques) {
            InvocationOutcome outcome;
            Throwable predicateFailure = predicateFailures.get(technique);
            if (predicateFailure != null) {
                outcome = new InvocationOutcome(technique.getId(), InvocationOutcome.Status.FAILED,
                    List.of(SyntheticOccurrences.error(technique.getId(), relPath, predicateFailure)), 0, 0.0);
            } else if (matching.contains(technique)) {
                outcome = invoker.invokeOnFile(technique, entry, syntaxTree, context, timeoutMs);
            } else {
                continue;
            }
            occurrences.addAll(outcome.occurrences());
            timings.put(outcome.techniqueId(),
                new TechniqueTiming(outcome.durationMs(), outcome.producedCount()));
            metrics.add(new TechniqueMetric(outcome.techniqueId(), outcome.durationMs(),
                outcome.producedCount(), false));
        }

        return new FileOutcome(index, relPath, fingerprint, occurrences, timings, metrics, null, parseNanos);
    }

    private Object buildSyntaxTree(FileEntry entry) {
        try {
            return syntaxTreeBuilder.build(entry.content() == null ? "" : entry.content(), entry.extension());
        } catch (Exception e) {
            log.warn("Failed to build syntax tree for {}: {}", entry.relPath(), e.getMessage());
            return null;
        }
    }
}
