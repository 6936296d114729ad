package com.codesentry.cli;

import com.codesentry.core.config.ConfigLoader;
import com.codesentry.core.config.EngineConfig;
import com.codesentry.core.metrics.HistoryEntry;
import com.codesentry.core.metrics.MetricsHistory;
import com.codesentry.core.metrics.TechniqueSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command to show the metrics history of a project.
 *
 * <p>Prints the most recent runs and the per-technique totals aggregated over the
 * whole history, slowest technique first.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * codesentry history
 * codesentry history --last 10 /path/to/project
 * }</pre>
 */
@Command(
    name = "history",
    description = "Show metrics of previous runs",
    mixinStandardHelpOptions = true
)
public class HistoryCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(HistoryCommand.class);

    @Parameters(
        index = "0",
        description = "Project directory (default: current directory)",
        defaultValue = "."
    )
    private Path projectPath;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: codesentry.yaml)"
    )
    private Path configPath = Paths.get(ConfigLoader.DEFAULT_FILE_NAME);

    @Option(
        names = {"-n", "--last"},
        description = "Number of recent runs to show (default: ${DEFAULT-VALUE})",
        defaultValue = "5"
    )
    private int last;

    @Override
    public Integer call() {
        Path absoluteConfigPath = configPath.isAbsolute() ? configPath : projectPath.resolve(configPath);
        EngineConfig config = ConfigLoader.load(absoluteConfigPath);
        Path historyPath = projectPath.resolve(config.metrics().effectiveHistoryPath());
        MetricsHistory history = new MetricsHistory(historyPath, config.metrics().effectiveHistoryMax());

        List<HistoryEntry> entries = history.load();
        log.debug("Loaded {} history entries from {}", entries.size(), historyPath);
        if (entries.isEmpty()) {
            System.out.println("No metrics history found at: " + historyPath);
            return 0;
        }

        System.out.println("Recent Runs:");
        System.out.println();
        int from = Math.max(0, entries.size() - Math.max(1, last));
        for (HistoryEntry entry : entries.subList(from, entries.size())) {
            System.out.printf("  %s  %s%n", Instant.ofEpochMilli(entry.timestamp()), entry.metrics().summary());
        }

        System.out.println();
        System.out.printf("Techniques (%d runs):%n", entries.size());
        System.out.println();
        System.out.printf("  %-24s %8s %12s %10s %12s%n", "TECHNIQUE", "CALLS", "TOTAL MS", "AVG MS", "OCCURRENCES");
        for (TechniqueSummary summary : history.summarize()) {
            System.out.printf("  %-24s %8d %12.1f %10.2f %12d%n",
                summary.name(),
                summary.invocations(),
                summary.totalDurationMs(),
                summary.averageDurationMs(),
                summary.totalOccurrences());
        }

        return 0;
    }
}
