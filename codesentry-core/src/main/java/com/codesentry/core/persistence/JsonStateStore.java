package com.codesentry.core.persistence;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Persistence layer for engine state (incremental store, metrics history).
 *
 * <p>Uses Jackson to read and write JSON documents. Output is stable: object
 * properties and map entries are written in sorted order, so two saves of equal
 * state produce identical files.</p>
 *
 * <p>Loading never throws: a missing, unreadable or malformed file yields the
 * caller's default value. Saving writes to a temporary sibling file and moves it
 * over the target, so readers never observe a half-written document.</p>
 */
public final class JsonStateStore {

    private static final Logger log = LoggerFactory.getLogger(JsonStateStore.class);

    private static final ObjectMapper JSON_MAPPER = JsonMapper.builder()
        .enable(SerializationFeature.INDENT_OUTPUT)
        .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
        .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
        .build();

    private JsonStateStore() {
        // Utility class
    }

    /**
     * Returns the shared mapper, for callers that serialize engine records themselves.
     *
     * @return configured JSON mapper
     */
    public static ObjectMapper mapper() {
        return JSON_MAPPER;
    }

    /**
     * Loads a JSON document.
     *
     * @param path file to read
     * @param type target type
     * @param defaultValue value returned when the file is missing or invalid
     * @param <T> target type
     * @return loaded value, or the default
     */
    public static <T> T load(Path path, Class<T> type, T defaultValue) {
        return load(path, JSON_MAPPER.constructType(type), defaultValue);
    }

    /**
     * Loads a JSON document into a generic type.
     *
     * @param path file to read
     * @param type target type reference (e.g. {@code new TypeReference<List<X>>() {}})
     * @param defaultValue value returned when the file is missing or invalid
     * @param <T> target type
     * @return loaded value, or the default
     */
    public static <T> T load(Path path, TypeReference<T> type, T defaultValue) {
        return load(path, JSON_MAPPER.getTypeFactory().constructType(type), defaultValue);
    }

    private static <T> T load(Path path, JavaType type, T defaultValue) {
        if (path == null || !Files.isRegularFile(path)) {
            log.debug("State file not found: {}. Starting empty.", path);
            return defaultValue;
        }

        try {
            T value = JSON_MAPPER.readValue(path.toFile(), type);
            return value != null ? value : defaultValue;
        } catch (IOException e) {
            log.warn("Failed to read state file: {}. Starting empty. Error: {}", path, e.getMessage());
            return defaultValue;
        }
    }

    /**
     * Saves a value as a JSON document, replacing the file atomically where supported.
     *
     * @param path target file; parent directories are created as needed
     * @param value value to write
     * @throws IOException if the document cannot be written
     */
    public static void save(Path path, Object value) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }

        Path temp = Files.createTempFile(parent, ".tmp-" + path.getFileName(), ".json");
        try {
            JSON_MAPPER.writeValue(temp.toFile(), value);
            try {
                Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
            }
            log.debug("Saved state file: {}", path);
        } finally {
            Files.deleteIfExists(temp);
        }
    }
}
