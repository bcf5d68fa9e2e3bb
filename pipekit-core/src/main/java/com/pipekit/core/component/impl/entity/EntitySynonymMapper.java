package com.pipekit.core.component.impl.entity;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pipekit.core.component.AbstractComponent;
import com.pipekit.core.component.Component;
import com.pipekit.core.component.ComponentDescriptor;
import com.pipekit.core.component.ComponentFactory;
import com.pipekit.core.component.LifecycleStage;
import com.pipekit.core.component.StageArguments;
import com.pipekit.core.model.Entity;
import com.pipekit.core.model.ModelMetadata;
import com.pipekit.core.model.TrainingData;
import com.pipekit.core.model.TrainingExample;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Replaces extracted entity values with their canonical form.
 *
 * <p>A synonym is learned whenever an annotated entity's covered text differs from its
 * annotated value, e.g. "NYC" annotated as "New York City". Synonyms are persisted to
 * {@code entity_synonyms.json} in the model directory.
 */
public class EntitySynonymMapper extends AbstractComponent {

    public static final String NAME = "ner_synonyms";
    public static final String SYNONYMS_FILE = "entity_synonyms.json";
    static final String SYNONYMS_FILE_KEY = "synonyms_file";

    static final ComponentDescriptor DESCRIPTOR = ComponentDescriptor.builder(NAME)
        .requires(LifecycleStage.TRAIN, "training_data")
        .requires(LifecycleStage.PROCESS, "entities")
        .provides(LifecycleStage.PROCESS, "entities")
        .requires(LifecycleStage.PERSIST, "model_dir")
        .provides(LifecycleStage.PERSIST, SYNONYMS_FILE_KEY)
        .packageRequirements("com.fasterxml.jackson.databind.ObjectMapper")
        .build();

    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();

    private Map<String, String> synonyms;

    public EntitySynonymMapper() {
        this(Map.of());
    }

    EntitySynonymMapper(Map<String, String> synonyms) {
        super(DESCRIPTOR);
        this.synonyms = Collections.unmodifiableMap(new TreeMap<>(synonyms));
    }

    public Map<String, String> synonyms() {
        return synonyms;
    }

    @Override
    public Map<String, Object> train(StageArguments args) {
        TrainingData data = args.get("training_data", TrainingData.class);

        Map<String, String> learned = new TreeMap<>();
        for (TrainingExample example : data.entityExamples()) {
            for (Entity entity : example.entities()) {
                String original = example.coveredText(entity);
                if (!original.equals(entity.value())) {
                    learned.put(original.toLowerCase(Locale.ROOT), entity.value());
                }
            }
        }
        this.synonyms = Collections.unmodifiableMap(learned);
        log.info("Learned {} entity synonyms", learned.size());
        return Map.of();
    }

    @Override
    public Map<String, Object> process(StageArguments args) {
        List<Entity> entities = DictionaryEntityExtractor.entityList(args.get("entities")).stream()
            .map(this::replace)
            .toList();
        return provided("entities", entities);
    }

    @Override
    public Map<String, Object> persist(StageArguments args) {
        Path modelDir = toPath(args.get("model_dir"));
        if (synonyms.isEmpty() || modelDir == null) {
            return provided(SYNONYMS_FILE_KEY, null);
        }

        Path file = modelDir.resolve(SYNONYMS_FILE);
        try {
            Files.createDirectories(modelDir);
            JSON_MAPPER.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), synonyms);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write entity synonyms: " + file, e);
        }
        return provided(SYNONYMS_FILE_KEY, SYNONYMS_FILE);
    }

    private Entity replace(Entity entity) {
        String canonical = synonyms.get(entity.value().toLowerCase(Locale.ROOT));
        if (canonical == null || canonical.equals(entity.value())) {
            return entity;
        }
        return entity.withValue(canonical);
    }

    private static Path toPath(Object value) {
        if (value instanceof Path path) {
            return path;
        }
        return value == null ? null : Paths.get(value.toString());
    }

    /**
     * Restores synonyms written by {@link #persist(StageArguments)}.
     *
     * @param metadata model metadata locating the model directory
     * @param state persisted component state
     * @return this mapper
     * @throws IllegalStateException if the synonyms file exists but cannot be read
     */
    EntitySynonymMapper restore(ModelMetadata metadata, Map<String, Object> state) {
        Object fileName = state.get(SYNONYMS_FILE_KEY);
        if (fileName == null || metadata.modelDir() == null) {
            return this;
        }

        Path file = metadata.modelDir().resolve(fileName.toString());
        if (!Files.exists(file)) {
            log.warn("Entity synonyms file not found: {}, continuing without synonyms", file);
            return this;
        }
        try {
            Map<String, String> restored = JSON_MAPPER.readValue(file.toFile(), new TypeReference<Map<String, String>>() {});
            this.synonyms = Collections.unmodifiableMap(new TreeMap<>(restored));
            log.debug("Restored {} entity synonyms from {}", synonyms.size(), file);
            return this;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read entity synonyms: " + file, e);
        }
    }

    /**
     * SPI entry point.
     */
    public static final class Factory implements ComponentFactory {

        @Override
        public ComponentDescriptor descriptor() {
            return DESCRIPTOR;
        }

        @Override
        public Component create(Map<String, Object> config) {
            return new EntitySynonymMapper();
        }

        @Override
        public Component load(Map<String, Object> config, Map<String, Object> state, ModelMetadata metadata) {
            return new EntitySynonymMapper().restore(metadata, state);
        }
    }
}
