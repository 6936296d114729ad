package com.codesentry.cli;

import com.codesentry.core.model.FileEntry;
import com.codesentry.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Collects the text files of a project in a stable scan order.
 *
 * <p>Walks the project directory, skips VCS, build output and dependency folders,
 * and reads every regular text file up to {@link #DEFAULT_MAX_FILE_SIZE} bytes.
 * Binary or unreadable files are skipped with a debug log. The result is sorted by
 * relative path so that two scans of the same tree produce the same order.</p>
 */
public class ProjectScanner {

    private static final Logger log = LoggerFactory.getLogger(ProjectScanner.class);

    /**
     * Files larger than this are not analyzed.
     */
    public static final long DEFAULT_MAX_FILE_SIZE = 1_048_576;

    /**
     * Directory names never descended into.
     */
    public static final Set<String> IGNORED_DIRECTORIES = Set.of(
        ".git", ".hg", ".svn", ".idea", ".vscode", ".codesentry",
        "node_modules", "target", "build", "dist", "out", ".gradle"
    );

    private final long maxFileSize;

    public ProjectScanner() {
        this(DEFAULT_MAX_FILE_SIZE);
    }

    public ProjectScanner(long maxFileSize) {
        this.maxFileSize = maxFileSize;
    }

    /**
     * Scans a project directory.
     *
     * @param projectDir project root
     * @return file entries sorted by relative path
     * @throws IOException if the directory cannot be walked
     */
    public List<FileEntry> scan(Path projectDir) throws IOException {
        Path root = projectDir.toAbsolutePath().normalize();
        if (!Files.isDirectory(root)) {
            throw new IOException("Not a directory: " + root);
        }

        List<FileEntry> entries = new ArrayList<>();
        Files.walkFileTree(root, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                if (!dir.equals(root) && IGNORED_DIRECTORIES.contains(dir.getFileName().toString())) {
                    return FileVisitResult.SKIP_SUBTREE;
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                if (attrs.isRegularFile()) {
                    read(root, file, attrs.size()).ifPresent(entries::add);
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException e) {
                log.warn("Cannot access {}: {}", file, e.getMessage());
                return FileVisitResult.CONTINUE;
            }
        });

        entries.sort(Comparator.comparing(FileEntry::relPath));
        log.debug("Scanned {} files under {}", entries.size(), root);
        return entries;
    }

    private Optional<FileEntry> read(Path root, Path file, long size) {
        String relPath = FileUtils.relativePath(root, file);
        if (size > maxFileSize) {
            log.debug("Skipping {} ({} bytes exceeds {})", relPath, size, maxFileSize);
            return Optional.empty();
        }
        try {
            Optional<String> content = FileUtils.readText(file);
            if (content.isEmpty()) {
                log.debug("Skipping binary file {}", relPath);
                return Optional.empty();
            }
            return Optional.of(FileEntry.of(relPath, file.toString(), content.get()));
        } catch (IOException e) {
            log.warn("Failed to read {}: {}", relPath, e.getMessage());
            return Optional.empty();
        }
    }
}
