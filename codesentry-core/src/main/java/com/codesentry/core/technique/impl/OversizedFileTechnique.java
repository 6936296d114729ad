package com.codesentry.core.technique.impl;

import com.codesentry.core.model.Occurrence;
import com.codesentry.core.technique.AbstractTechnique;
import com.codesentry.core.technique.ExecutionContext;

import java.util.List;

/**
 * Technique flagging files longer than a line threshold.
 */
public class OversizedFileTechnique extends AbstractTechnique {

    public static final String KIND = "oversized-file";
    public static final int DEFAULT_MAX_LINES = 500;

    private final int maxLines;

    public OversizedFileTechnique() {
        this(DEFAULT_MAX_LINES);
    }

    /**
     * Creates the technique with a custom threshold.
     *
     * @param maxLines largest accepted line count
     */
    public OversizedFileTechnique(int maxLines) {
        if (maxLines < 1) {
            throw new IllegalArgumentException("maxLines must be positive: " + maxLines);
        }
        this.maxLines = maxLines;
    }

    @Override
    public String getId() {
        return "oversized-file";
    }

    @Override
    public String getDescription() {
        return "Flags files with more than " + maxLines + " lines";
    }

    @Override
    public List<Occurrence> apply(String content, String relPath, Object syntaxTree, String fullPath,
                                  ExecutionContext context) {
        int count = lines(content).size();
        if (count <= maxLines) {
            return List.of();
        }
        return List.of(warning(KIND,
            String.format("File has %d lines (limit %d)", count, maxLines), relPath, null));
    }

    public int maxLines() {
        return maxLines;
    }
}
