package com.pipekit.core.model;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Metadata of a persisted model.
 *
 * <p>Opaque to the runtime beyond named lookups. The trainer stores the pipeline, the
 * language and one state entry per pipeline step; the interpreter reads them back to
 * restore components through {@link com.pipekit.core.component.ComponentFactory#load}.
 *
 * <p>Stored as {@code metadata.json} inside the model directory.
 *
 * @param properties metadata entries
 * @param modelDir directory the model was persisted to, null for in-memory metadata
 */
public record ModelMetadata(Map<String, Object> properties, Path modelDir) {

    public static final String FILE_NAME = "metadata.json";
    public static final String PIPELINE = "pipeline";
    public static final String LANGUAGE = "language";
    public static final String TRAINED_AT = "trained_at";
    public static final String COMPONENTS = "components";

    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();

    public ModelMetadata {
        properties = properties == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(properties));
    }

    /**
     * Gets a metadata entry.
     *
     * @param key entry name
     * @return entry value or null if absent
     */
    public Object get(String key) {
        return properties.get(key);
    }

    /**
     * Gets a metadata entry with a default.
     *
     * @param key entry name
     * @param defaultValue value returned when the entry is absent
     * @return entry value or default
     */
    public Object getOrDefault(String key, Object defaultValue) {
        return properties.getOrDefault(key, defaultValue);
    }

    /**
     * Returns the component names of the persisted pipeline, in order.
     *
     * @return pipeline component names
     */
    public List<String> pipeline() {
        if (properties.get(PIPELINE) instanceof List<?> names) {
            return names.stream().map(String::valueOf).toList();
        }
        return List.of();
    }

    public String language() {
        Object language = properties.get(LANGUAGE);
        return language == null ? null : language.toString();
    }

    /**
     * Returns the persisted state of the pipeline step at the given position.
     *
     * @param index pipeline position
     * @return component state, empty if none was persisted
     */
    @SuppressWarnings("unchecked")
    public Map<String, Object> componentState(int index) {
        if (properties.get(COMPONENTS) instanceof List<?> states
            && index >= 0 && index < states.size()
            && states.get(index) instanceof Map<?, ?> state) {
            return (Map<String, Object>) state;
        }
        return Map.of();
    }

    /**
     * Identifies the model this metadata belongs to. Used to key loaded component instances.
     *
     * @return model directory or trained-at stamp
     */
    public String modelId() {
        if (modelDir != null) {
            return modelDir.toAbsolutePath().normalize().toString();
        }
        return String.valueOf(properties.get(TRAINED_AT));
    }

    /**
     * Writes {@code metadata.json} into the given directory.
     *
     * @param directory model directory, created if missing
     * @return metadata bound to the directory
     * @throws IllegalStateException if the file cannot be written
     */
    public ModelMetadata write(Path directory) {
        Path file = directory.resolve(FILE_NAME);
        try {
            Files.createDirectories(directory);
            JSON_MAPPER.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), properties);
            return new ModelMetadata(properties, directory);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write model metadata: " + file, e);
        }
    }

    /**
     * Reads {@code metadata.json} from the given model directory.
     *
     * @param directory model directory
     * @return loaded metadata
     * @throws IllegalStateException if the file is missing or invalid
     */
    public static ModelMetadata read(Path directory) {
        Path file = directory.resolve(FILE_NAME);
        try {
            Map<String, Object> properties = JSON_MAPPER.readValue(
                file.toFile(), new TypeReference<Map<String, Object>>() {});
            return new ModelMetadata(properties, directory);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read model metadata: " + file, e);
        }
    }
}
