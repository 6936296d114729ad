package com.codesentry.cli;

import com.codesentry.CodeSentryCLI;
import com.codesentry.core.config.ConfigLoader;
import com.codesentry.core.config.EngineConfig;
import com.codesentry.core.execution.AnalysisEngine;
import com.codesentry.core.execution.ExecutionMode;
import com.codesentry.core.execution.ExecutionOptions;
import com.codesentry.core.execution.ExecutionResult;
import com.codesentry.core.model.FileEntry;
import com.codesentry.core.model.Occurrence;
import com.codesentry.core.model.Severity;
import com.codesentry.core.persistence.JsonStateStore;
import com.codesentry.core.technique.TechniqueRegistrationException;
import com.codesentry.core.technique.TechniqueRegistry;
import com.codesentry.core.technique.impl.BuiltInTechniques;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Command to analyze a project.
 *
 * <p>Orchestrates a full run:
 * <ol>
 *   <li>Load {@code codesentry.yaml} (defaults when absent)</li>
 *   <li>Register the built-in techniques and apply the enabled list</li>
 *   <li>Scan the project files</li>
 *   <li>Run the engine, sequentially or on the worker pool</li>
 *   <li>Print the findings and optionally write a JSON report</li>
 * </ol>
 *
 * <p><b>Exit codes:</b> 0 on success, 1 on failure (or on ERROR findings with
 * {@code --fail-on-error}), 2 when a technique cannot be registered.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Analyze current directory
 * codesentry analyze
 *
 * # Analyze in parallel, ignoring cached results
 * codesentry analyze --mode parallel --no-incremental /path/to/project
 *
 * # Only report pending TODOs, as JSON
 * codesentry analyze -t todo-comments --json build/report.json
 * }</pre>
 */
@Command(
    name = "analyze",
    description = "Analyze a project and report findings",
    mixinStandardHelpOptions = true
)
public class AnalyzeCommand implements Callable<Integer> {

    /**
     * Exit code of a run aborted by an invalid technique.
     */
    public static final int EXIT_REGISTRATION_FAULT = 2;

    private static final Logger log = LoggerFactory.getLogger(AnalyzeCommand.class);

    @ParentCommand
    private CodeSentryCLI parent;

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
        names = {"-m", "--mode"},
        description = "Execution mode: ${COMPLETION-CANDIDATES} (overrides config)"
    )
    private ExecutionMode mode;

    @Option(
        names = {"--timeout"},
        description = "Budget per technique per file in ms, 0 disables it (overrides config)"
    )
    private Long timeoutMs;

    @Option(
        names = {"--workers"},
        description = "Worker threads in parallel mode (overrides config)"
    )
    private Integer workers;

    @Option(
        names = {"--batch-size"},
        description = "Files per worker batch (overrides config)"
    )
    private Integer batchSize;

    @Option(
        names = {"-t", "--technique"},
        split = ",",
        description = "Techniques to run (overrides config, default: all)"
    )
    private List<String> techniques;

    @Option(
        names = {"--no-incremental"},
        description = "Analyze every file, ignoring and not updating the incremental store"
    )
    private boolean noIncremental;

    @Option(
        names = {"--reset-cache"},
        description = "Discard the incremental store before the run"
    )
    private boolean resetCache;

    @Option(
        names = {"--no-metrics"},
        description = "Do not collect metrics nor append to the history"
    )
    private boolean noMetrics;

    @Option(
        names = {"--json"},
        description = "Write the result as JSON to this file (overrides config)"
    )
    private Path jsonReport;

    @Option(
        names = {"--fail-on-error"},
        description = "Exit with code 1 when an ERROR occurrence is reported"
    )
    private boolean failOnError;

    @Override
    public Integer call() {
        try {
            log.info("Starting analysis of: {}", projectPath.toAbsolutePath());
            println("Analyzing project: " + projectPath.toAbsolutePath());
            println("");

            EngineConfig config = loadConfiguration();

            TechniqueRegistry registry = createRegistry(config);
            println("✓ Registered " + registry.size() + " techniques");

            List<FileEntry> files = new ProjectScanner().scan(projectPath);
            println("✓ Scanned " + files.size() + " files");

            ExecutionOptions options = createOptions(config);
            if (resetCache && options.incrementalCache() != null) {
                options.incrementalCache().reset();
                println("✓ Reset incremental store");
            }

            ExecutionResult result;
            try (AnalysisEngine engine = new AnalysisEngine()) {
                result = engine.run(files, registry, projectPath.toAbsolutePath().toString(), options);
            }

            printFindings(result);
            writeReport(config, result);

            println("");
            println("✓ Analysis complete");
            return failOnError && result.hasErrors() ? 1 : 0;

        } catch (TechniqueRegistrationException e) {
            log.error("Invalid technique: {}", e.getMessage());
            System.err.println("✗ Invalid technique: " + e.getMessage());
            return EXIT_REGISTRATION_FAULT;

        } catch (Exception e) {
            log.error("Analysis failed", e);
            System.err.println("✗ Analysis failed: " + e.getMessage());
            return 1;
        }
    }

    /**
     * Loads project configuration from YAML file.
     */
    private EngineConfig loadConfiguration() {
        Path absoluteConfigPath = configPath.isAbsolute()
            ? configPath
            : projectPath.resolve(configPath);

        log.debug("Loading configuration from: {}", absoluteConfigPath);
        return ConfigLoader.load(absoluteConfigPath);
    }

    private TechniqueRegistry createRegistry(EngineConfig config) {
        TechniqueRegistry registry = new TechniqueRegistry();
        BuiltInTechniques.registerAll(registry, config.techniques().settings());
        registry.freeze();

        List<String> enabled = techniques != null && !techniques.isEmpty()
            ? techniques
            : config.techniques().enabled();
        TechniqueRegistry selected = registry.filter(enabled);
        if (log.isDebugEnabled()) {
            selected.list().forEach(t -> log.debug("  - {} ({})", t.getId(), t.isGlobal() ? "global" : "per-file"));
        }
        return selected;
    }

    private ExecutionOptions createOptions(EngineConfig config) {
        ExecutionOptions.Builder builder = config.toOptions(projectPath).toBuilder();
        if (mode != null) {
            builder.mode(mode);
        }
        if (timeoutMs != null) {
            builder.timeoutMs(timeoutMs);
        }
        if (workers != null) {
            builder.workerCount(workers);
        }
        if (batchSize != null) {
            builder.batchSize(batchSize);
        }
        if (noIncremental) {
            builder.incrementalEnabled(false);
        }
        if (noMetrics) {
            builder.metricsEnabled(false);
        }
        builder.listener(new ConsoleProgressListener(System.out, isVerbose(), isQuiet()));
        return builder.build();
    }

    private void printFindings(ExecutionResult result) {
        if (isQuiet()) {
            return;
        }
        Map<String, List<Occurrence>> byFile = new LinkedHashMap<>();
        for (Occurrence occurrence : result.occurrences()) {
            byFile.computeIfAbsent(occurrence.filePath(), key -> new ArrayList<>()).add(occurrence);
        }

        System.out.println();
        byFile.forEach((file, occurrences) -> {
            System.out.println(file);
            for (Occurrence occurrence : occurrences) {
                System.out.printf("  %-7s %s%s [%s]%n",
                    occurrence.severity(),
                    location(occurrence),
                    occurrence.message(),
                    occurrence.sourceTechnique());
            }
        });

        System.out.println();
        System.out.printf("✓ Found %d occurrences (%d errors, %d warnings, %d info)%n",
            result.occurrences().size(),
            result.count(Severity.ERROR),
            result.count(Severity.WARNING),
            result.count(Severity.INFO));
        result.metricsIfEnabled().ifPresent(metrics -> System.out.println("✓ " + metrics.summary()));
    }

    private void writeReport(EngineConfig config, ExecutionResult result) throws IOException {
        Path target = jsonReport;
        if (target == null && config.output().jsonReport() != null) {
            target = projectPath.resolve(config.output().jsonReport());
        }
        if (target == null) {
            return;
        }
        JsonStateStore.save(target, result);
        println("✓ Wrote JSON report to: " + target);
    }

    private static String location(Occurrence occurrence) {
        if (occurrence.line() == null) {
            return "";
        }
        return occurrence.column() == null
            ? occurrence.line() + ": "
            : occurrence.line() + ":" + occurrence.column() + ": ";
    }

    private void println(String line) {
        if (!isQuiet()) {
            System.out.println(line);
        }
    }

    private boolean isVerbose() {
        return parent != null && parent.isVerbose();
    }

    private boolean isQuiet() {
        return parent != null && parent.isQuiet();
    }
}
