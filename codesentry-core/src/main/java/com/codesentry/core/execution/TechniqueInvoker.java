package com.codesentry.core.execution;

import com.codesentry.core.model.FileEntry;
import com.codesentry.core.model.Occurrence;
import com.codesentry.core.technique.ExecutionContext;
import com.codesentry.core.technique.OccurrenceReporter;
import com.codesentry.core.technique.Technique;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs a single technique against a single file with timeout enforcement and fault isolation.
 *
 * <p>The invocation is submitted to the invocation pool and raced against its budget
 * with {@link Future#get(long, TimeUnit)}. If the budget elapses first, the future is
 * cancelled with interruption and a synthetic timeout occurrence is returned; a
 * technique that ignores interruption keeps running on its daemon thread, but its
 * result is discarded. Any exception or error thrown by the technique, inline or on
 * the pool, becomes a synthetic error occurrence. A budget of 0 runs the technique
 * inline without a timer.</p>
 *
 * <p>When the side channel is enabled, the technique sees a context whose reporter
 * feeds a per-invocation queue. The queue is drained into the outcome (before the
 * returned occurrences) and closed once the invocation ends, whichever branch wins;
 * reports arriving later are dropped.</p>
 */
public class TechniqueInvoker {

    private static final Logger log = LoggerFactory.getLogger(TechniqueInvoker.class);

    private final ExecutorService invocationPool;
    private final boolean sideChannel;

    /**
     * Creates an invoker.
     *
     * @param invocationPool pool running technique invocations; must not be bounded below
     *     the number of concurrently waiting callers
     * @param sideChannel whether techniques may report through {@link ExecutionContext#report}
     */
    public TechniqueInvoker(ExecutorService invocationPool, boolean sideChannel) {
        this.invocationPool = Objects.requireNonNull(invocationPool, "invocationPool must not be null");
        this.sideChannel = sideChannel;
    }

    /**
     * Invokes a global technique once for the whole project.
     *
     * @param technique global technique
     * @param context shared context
     * @param timeoutMs budget, 0 for none
     * @return outcome of the invocation
     */
    public InvocationOutcome invokeGlobal(Technique technique, ExecutionContext context, long timeoutMs) {
        return invoke(technique, "", "", null, null, context, timeoutMs);
    }

    /**
     * Invokes a per-file technique on one file.
     *
     * @param technique per-file technique
     * @param entry file to analyze
     * @param syntaxTree tree of the file, or {@code null}
     * @param context shared context
     * @param timeoutMs budget, 0 for none
     * @return outcome of the invocation
     */
    public InvocationOutcome invokeOnFile(Technique technique, FileEntry entry, Object syntaxTree,
                                          ExecutionContext context, long timeoutMs) {
        String content = entry.content() == null ? "" : entry.content();
        return invoke(technique, content, entry.relPath(), syntaxTree, entry.fullPath(), context, timeoutMs);
    }

    private InvocationOutcome invoke(Technique technique, String content, String relPath, Object syntaxTree,
                                     String fullPath, ExecutionContext context, long timeoutMs) {
        String id = technique.getId();
        ReportChannel channel = sideChannel ? new ReportChannel(relPath) : null;
        ExecutionContext invocationContext = channel != null
            ? context.withReporter(channel)
            : context.withoutReporter();
        Callable<List<Occurrence>> call =
            () -> technique.apply(content, relPath, syntaxTree, fullPath, invocationContext);

        long start = System.nanoTime();
        try {
            List<Occurrence> returned = timeoutMs > 0 ? callWithTimeout(call, timeoutMs) : call.call();
            double durationMs = elapsedMs(start);

            List<Occurrence> produced = new ArrayList<>();
            if (channel != null) {
                channel.close();
                channel.drainTo(produced);
            }
            if (returned != null) {
                returned.stream().filter(Objects::nonNull).forEach(produced::add);
            }
            log.debug("technique={} file={} durationMs={} occurrences={}",
                id, displayPath(relPath), String.format("%.2f", durationMs), produced.size());
            return new InvocationOutcome(id, InvocationOutcome.Status.COMPLETED, produced, produced.size(), durationMs);

        } catch (TimeoutException e) {
            log.warn("Technique '{}' exceeded {} ms on {}", id, timeoutMs, displayPath(relPath));
            return new InvocationOutcome(id, InvocationOutcome.Status.TIMED_OUT,
                List.of(SyntheticOccurrences.timeout(id, relPath, timeoutMs)), 0, elapsedMs(start));

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for technique '{}' on {}", id, displayPath(relPath));
            return new InvocationOutcome(id, InvocationOutcome.Status.FAILED,
                List.of(SyntheticOccurrences.error(id, relPath, e)), 0, elapsedMs(start));

        } catch (Throwable e) {
            Throwable cause = e instanceof ExecutionException && e.getCause() != null ? e.getCause() : e;
            rethrowIfFatal(cause);
            log.error("Technique '{}' failed on {}: {}", id, displayPath(relPath), cause.getMessage());
            log.debug("Stack trace of '{}' failure", id, cause);
            return new InvocationOutcome(id, InvocationOutcome.Status.FAILED,
                List.of(SyntheticOccurrences.error(id, relPath, cause)), 0, elapsedMs(start));

        } finally {
            if (channel != null) {
                channel.close();
            }
        }
    }

    private List<Occurrence> callWithTimeout(Callable<List<Occurrence>> call, long timeoutMs)
            throws InterruptedException, ExecutionException, TimeoutException {
        Future<List<Occurrence>> future = invocationPool.submit(call);
        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException | InterruptedException e) {
            future.cancel(true);
            throw e;
        }
    }

    /**
     * Rethrows failures the JVM cannot recover from. A stack overflow is confined to the
     * failing call and is treated like any other technique fault.
     */
    static void rethrowIfFatal(Throwable failure) {
        if (failure instanceof VirtualMachineError && !(failure instanceof StackOverflowError)) {
            throw (VirtualMachineError) failure;
        }
    }

    private static double elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000.0;
    }

    private static String displayPath(String relPath) {
        return relPath.isEmpty() ? SyntheticOccurrences.GLOBAL_PATH : relPath;
    }

    /**
     * Single-producer queue behind a technique's side channel.
     */
    private static final class ReportChannel implements OccurrenceReporter {
        private final Queue<Occurrence> queue = new ConcurrentLinkedQueue<>();
        private final String relPath;
        private volatile boolean open = true;

        ReportChannel(String relPath) {
            this.relPath = relPath;
        }

        @Override
        public void report(Occurrence occurrence) {
            if (!open) {
                log.debug("Dropping report after invocation ended for {}", displayPath(relPath));
                return;
            }
            if (occurrence == null) {
                queue.add(SyntheticOccurrences.reporterFailure(relPath, "null occurrence reported"));
                return;
            }
            queue.add(occurrence);
        }

        void close() {
            open = false;
        }

        void drainTo(List<Occurrence> target) {
            Occurrence next;
            while ((next = queue.poll()) != null) {
                target.add(next);
            }
        }
    }
}
