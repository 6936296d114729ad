package com.codesentry.core.persistence;

import com.fasterxml.jackson.core.type.TypeReference;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link JsonStateStore}.
 */
class JsonStateStoreTest {

    @TempDir
    Path tempDir;

    @Test
    void save_createsParentDirectoriesAndSortsKeys() throws IOException {
        Path target = tempDir.resolve("nested/dir/state.json");

        JsonStateStore.save(target, Map.of("zeta", 1, "alpha", 2));

        String json = Files.readString(target);
        assertThat(json.indexOf("alpha")).isLessThan(json.indexOf("zeta"));
        try (var files = Files.list(target.getParent())) {
            assertThat(files).containsExactly(target);
        }
    }

    @Test
    void load_roundTripsGenericType() throws IOException {
        Path target = tempDir.resolve("list.json");
        JsonStateStore.save(target, List.of("a", "b"));

        List<String> loaded = JsonStateStore.load(target, new TypeReference<List<String>>() {}, List.of());

        assertThat(loaded).containsExactly("a", "b");
    }

    @Test
    void load_missingFile_returnsDefault() {
        assertThat(JsonStateStore.load(tempDir.resolve("none.json"), String.class, "fallback")).isEqualTo("fallback");
    }

    @Test
    void load_invalidJson_returnsDefault() throws IOException {
        Path target = tempDir.resolve("broken.json");
        Files.writeString(target, "[1, 2");

        assertThat(JsonStateStore.load(target, new TypeReference<List<Integer>>() {}, List.of())).isEmpty();
    }
}
