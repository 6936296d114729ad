package com.codesentry.core.config;

import com.codesentry.core.execution.ExecutionMode;
import com.codesentry.core.execution.ExecutionOptions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ConfigLoader} and {@link EngineConfig}.
 */
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void load_validYaml_returnsConfig() throws IOException {
        Path configFile = tempDir.resolve("codesentry.yaml");
        Files.writeString(configFile, """
            analysis:
              mode: parallel
              timeoutMs: 5000
              globalTimeoutMs: 60000

            incremental:
              enabled: true
              statePath: "cache/state.json"

            metrics:
              enabled: true
              historyPath: "cache/history.json"
              historyMax: 50

            workers:
              maxWorkers: 4
              batchSize: 20

            techniques:
              enabled:
                - todo-comments
              settings:
                oversized-file:
                  maxLines: 800

            output:
              jsonReport: "build/report.json"
            """);

        EngineConfig config = ConfigLoader.load(configFile);

        assertThat(config.analysis().effectiveMode()).isEqualTo(ExecutionMode.PARALLEL);
        assertThat(config.analysis().effectiveTimeoutMs()).isEqualTo(5000);
        assertThat(config.analysis().effectiveGlobalTimeoutMs()).isEqualTo(60000);
        assertThat(config.incremental().effectiveStatePath()).isEqualTo("cache/state.json");
        assertThat(config.metrics().effectiveHistoryMax()).isEqualTo(50);
        assertThat(config.workers().maxWorkers()).isEqualTo(4);
        assertThat(config.workers().effectiveBatchSize()).isEqualTo(20);
        assertThat(config.techniques().enabled()).containsExactly("todo-comments");
        assertThat(config.techniques().settingsFor("oversized-file")).containsEntry("maxLines", 800);
        assertThat(config.output().jsonReport()).isEqualTo("build/report.json");
    }

    @Test
    void load_minimalYaml_fillsDefaults() throws IOException {
        Path configFile = tempDir.resolve("codesentry.yaml");
        Files.writeString(configFile, """
            analysis:
              timeoutMs: 0
            """);

        EngineConfig config = ConfigLoader.load(configFile);

        assertThat(config.analysis().effectiveMode()).isEqualTo(ExecutionMode.SEQUENTIAL);
        assertThat(config.analysis().effectiveTimeoutMs()).isZero();
        assertThat(config.incremental().isEnabled()).isTrue();
        assertThat(config.incremental().effectiveStatePath()).isEqualTo(EngineConfig.DEFAULT_STATE_PATH);
        assertThat(config.techniques().enabled()).isEmpty();
        assertThat(config.techniques().settingsFor("todo-comments")).isEmpty();
        assertThat(config.output().jsonReport()).isNull();
    }

    @Test
    void load_missingFile_returnsDefaults() {
        EngineConfig config = ConfigLoader.load(tempDir.resolve("missing.yaml"));

        assertThat(config).isEqualTo(EngineConfig.defaults());
    }

    @Test
    void load_invalidYaml_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("codesentry.yaml");
        Files.writeString(configFile, "analysis: [unclosed");

        assertThat(ConfigLoader.load(configFile)).isEqualTo(EngineConfig.defaults());
    }

    @Test
    void load_unknownKeys_areIgnored() throws IOException {
        Path configFile = tempDir.resolve("codesentry.yaml");
        Files.writeString(configFile, """
            futureSection:
              anything: true
            workers:
              batchSize: 7
              unknown: 1
            """);

        assertThat(ConfigLoader.load(configFile).workers().effectiveBatchSize()).isEqualTo(7);
    }

    @Test
    void toOptions_resolvesStatePathsAgainstProjectRoot() {
        ExecutionOptions options = EngineConfig.defaults().toOptions(tempDir);

        assertThat(options.mode()).isEqualTo(ExecutionMode.SEQUENTIAL);
        assertThat(options.timeoutMs()).isEqualTo(ExecutionOptions.DEFAULT_TIMEOUT_MS);
        assertThat(options.incrementalEnabled()).isTrue();
        assertThat(options.incrementalCache().statePath())
            .isEqualTo(tempDir.resolve(EngineConfig.DEFAULT_STATE_PATH));
        assertThat(options.metricsHistory().historyPath())
            .isEqualTo(tempDir.resolve(EngineConfig.DEFAULT_HISTORY_PATH));
        assertThat(options.metricsHistory().maxEntries()).isEqualTo(200);
    }

    @Test
    void toOptions_disabledSections_leaveNoCacheOrHistory() {
        EngineConfig config = new EngineConfig(
            null,
            new EngineConfig.IncrementalConfig(false, null),
            new EngineConfig.MetricsConfig(false, null, null),
            null, null, null);

        ExecutionOptions options = config.toOptions(tempDir);

        assertThat(options.incrementalEnabled()).isFalse();
        assertThat(options.incrementalCache()).isNull();
        assertThat(options.metricsEnabled()).isFalse();
        assertThat(options.metricsHistory()).isNull();
    }
}
