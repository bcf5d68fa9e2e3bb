package com.pipekit.core.component.impl.entity;

import com.pipekit.core.component.AbstractComponent;
import com.pipekit.core.component.Component;
import com.pipekit.core.component.ComponentDescriptor;
import com.pipekit.core.component.ComponentFactory;
import com.pipekit.core.component.LifecycleStage;
import com.pipekit.core.component.StageArguments;
import com.pipekit.core.component.impl.nlp.TextNormalizer;
import com.pipekit.core.model.Entity;
import com.pipekit.core.model.ModelMetadata;
import com.pipekit.core.model.TrainingData;
import com.pipekit.core.model.TrainingExample;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Extracts entities by looking up phrases seen in the training annotations.
 *
 * <p>Matching is case-insensitive and respects word boundaries. Longer phrases are tried
 * first and matches never overlap. Found entities are appended to the {@code entities}
 * produced by earlier extractors.
 */
public class DictionaryEntityExtractor extends AbstractComponent {

    public static final String NAME = "ner_dictionary";
    static final String DICTIONARY = "entity_dictionary";

    static final ComponentDescriptor DESCRIPTOR = ComponentDescriptor.builder(NAME)
        .requires(LifecycleStage.TRAIN, "training_data", "nlp")
        .requires(LifecycleStage.PROCESS, "text", "entities", "nlp")
        .provides(LifecycleStage.PROCESS, "entities")
        .provides(LifecycleStage.PERSIST, DICTIONARY)
        .build();

    private Map<String, String> dictionary;

    public DictionaryEntityExtractor() {
        this(Map.of());
    }

    DictionaryEntityExtractor(Map<String, String> dictionary) {
        super(DESCRIPTOR);
        this.dictionary = Collections.unmodifiableMap(new TreeMap<>(dictionary));
    }

    public Map<String, String> dictionary() {
        return dictionary;
    }

    @Override
    public Map<String, Object> train(StageArguments args) {
        TrainingData data = args.get("training_data", TrainingData.class);
        TextNormalizer nlp = args.get("nlp", TextNormalizer.class);

        Map<String, String> learned = new TreeMap<>();
        for (TrainingExample example : data.entityExamples()) {
            for (Entity entity : example.entities()) {
                String phrase = nlp.normalize(example.coveredText(entity)).strip();
                if (!phrase.isEmpty()) {
                    learned.putIfAbsent(phrase, entity.entity());
                }
            }
        }
        this.dictionary = Collections.unmodifiableMap(learned);
        log.info("Learned {} entity phrases", learned.size());
        return Map.of();
    }

    @Override
    public Map<String, Object> process(StageArguments args) {
        String text = args.get("text", String.class);
        TextNormalizer nlp = args.get("nlp", TextNormalizer.class);
        List<Entity> entities = new ArrayList<>(entityList(args.get("entities")));

        if (text != null && !dictionary.isEmpty()) {
            entities.addAll(find(nlp.normalize(text), text));
        }
        return provided("entities", Collections.unmodifiableList(entities));
    }

    @Override
    public Map<String, Object> persist(StageArguments args) {
        return Map.of(DICTIONARY, new TreeMap<>(dictionary));
    }

    private List<Entity> find(String normalized, String original) {
        List<String> phrases = new ArrayList<>(dictionary.keySet());
        phrases.sort(Comparator.comparingInt(String::length).reversed().thenComparing(Comparator.naturalOrder()));

        boolean[] taken = new boolean[normalized.length()];
        List<Entity> found = new ArrayList<>();
        for (String phrase : phrases) {
            int from = 0;
            int index;
            while ((index = normalized.indexOf(phrase, from)) >= 0) {
                int end = index + phrase.length();
                if (isWordBoundary(normalized, index, end) && isFree(taken, index, end)) {
                    markTaken(taken, index, end);
                    found.add(new Entity(dictionary.get(phrase), original.substring(index, end), index, end, NAME));
                }
                from = index + 1;
            }
        }
        found.sort(Comparator.comparingInt(Entity::start));
        return found;
    }

    private static boolean isWordBoundary(String text, int start, int end) {
        boolean before = start == 0 || !Character.isLetterOrDigit(text.charAt(start - 1));
        boolean after = end == text.length() || !Character.isLetterOrDigit(text.charAt(end));
        return before && after;
    }

    private static boolean isFree(boolean[] taken, int start, int end) {
        for (int i = start; i < end; i++) {
            if (taken[i]) {
                return false;
            }
        }
        return true;
    }

    private static void markTaken(boolean[] taken, int start, int end) {
        for (int i = start; i < end; i++) {
            taken[i] = true;
        }
    }

    static List<Entity> entityList(Object value) {
        if (!(value instanceof List<?> list)) {
            return List.of();
        }
        return list.stream()
            .filter(Entity.class::isInstance)
            .map(Entity.class::cast)
            .toList();
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
            return new DictionaryEntityExtractor();
        }

        @Override
        public Component load(Map<String, Object> config, Map<String, Object> state, ModelMetadata metadata) {
            return new DictionaryEntityExtractor(stateMap(state, DICTIONARY));
        }
    }
}
