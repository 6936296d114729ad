package com.codesentry.core.technique.impl;

import com.codesentry.core.incremental.Fingerprint;
import com.codesentry.core.model.FileEntry;
import com.codesentry.core.model.Occurrence;
import com.codesentry.core.technique.AbstractTechnique;
import com.codesentry.core.technique.ExecutionContext;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Global technique reporting files whose content is identical to an earlier file.
 *
 * <p>Files are compared by content fingerprint in scan order; the first file of each
 * group is considered the original and every later copy is reported. Blank files are
 * ignored.</p>
 */
public class DuplicateFilesTechnique extends AbstractTechnique {

    public static final String KIND = "duplicate-content";

    @Override
    public String getId() {
        return "duplicate-files";
    }

    @Override
    public String getDescription() {
        return "Reports files whose content duplicates another file";
    }

    @Override
    public boolean isGlobal() {
        return true;
    }

    @Override
    public List<Occurrence> apply(String content, String relPath, Object syntaxTree, String fullPath,
                                  ExecutionContext context) {
        Map<String, String> firstByFingerprint = new HashMap<>();
        List<Occurrence> occurrences = new ArrayList<>();

        for (FileEntry file : context.files()) {
            if (file.content() == null || file.content().isBlank()) {
                continue;
            }
            String fingerprint = Fingerprint.of(file.content());
            String original = firstByFingerprint.putIfAbsent(fingerprint, file.relPath());
            if (original != null) {
                occurrences.add(warning(KIND, "Identical content to " + original, file.relPath(), null));
            }
        }

        log.debug("Compared {} files, {} duplicates", context.files().size(), occurrences.size());
        return occurrences;
    }
}
