package com.codesentry.core.execution;

import com.codesentry.core.model.FileEntry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Base class for engine tests.
 *
 * <p>Provides an {@link AnalysisEngine} closed after each test and helpers for
 * in-memory file entries.
 */
abstract class ExecutionTestBase {

    @TempDir
    protected Path tempDir;

    protected AnalysisEngine engine;

    @BeforeEach
    void createEngine() {
        engine = new AnalysisEngine();
    }

    @AfterEach
    void closeEngine() {
        engine.close();
    }

    protected static FileEntry file(String relPath, String content) {
        return FileEntry.of(relPath, "/project/" + relPath, content);
    }

    /**
     * Creates {@code count} TypeScript files, every other one containing a TODO.
     */
    protected static List<FileEntry> files(int count) {
        List<FileEntry> files = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            String content = i % 2 == 0
                ? "const a" + i + " = 1;\n// TODO: file " + i + "\n"
                : "const b" + i + " = 2;\n";
            files.add(file(String.format("src/file%03d.ts", i), content));
        }
        return files;
    }

    protected String baseDir() {
        return tempDir.toString();
    }
}
