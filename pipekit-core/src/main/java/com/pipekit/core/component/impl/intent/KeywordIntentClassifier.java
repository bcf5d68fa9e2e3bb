package com.pipekit.core.component.impl.intent;

import com.pipekit.core.component.AbstractComponent;
import com.pipekit.core.component.Component;
import com.pipekit.core.component.ComponentDescriptor;
import com.pipekit.core.component.ComponentFactory;
import com.pipekit.core.component.LifecycleStage;
import com.pipekit.core.component.StageArguments;
import com.pipekit.core.component.impl.nlp.TextNormalizer;
import com.pipekit.core.model.ModelMetadata;
import com.pipekit.core.model.Token;
import com.pipekit.core.model.TrainingData;
import com.pipekit.core.model.TrainingExample;

import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Recognizes the {@code intent} of a text by keyword lookup.
 *
 * <p>Training keeps every token key that occurs in the examples of exactly one intent.
 * At process time the first token that is a keyword decides the intent; without a match
 * the intent is null.
 */
public class KeywordIntentClassifier extends AbstractComponent {

    public static final String NAME = "intent_classifier_keyword";
    static final String KEYWORDS = "intent_keywords";

    static final ComponentDescriptor DESCRIPTOR = ComponentDescriptor.builder(NAME)
        .requires(LifecycleStage.TRAIN, "training_data", "nlp")
        .requires(LifecycleStage.PROCESS, "tokens", "nlp")
        .provides(LifecycleStage.PROCESS, "intent")
        .provides(LifecycleStage.PERSIST, KEYWORDS)
        .build();

    private Map<String, String> keywords;

    public KeywordIntentClassifier() {
        this(Map.of());
    }

    KeywordIntentClassifier(Map<String, String> keywords) {
        super(DESCRIPTOR);
        this.keywords = Collections.unmodifiableMap(new TreeMap<>(keywords));
    }

    public Map<String, String> keywords() {
        return keywords;
    }

    @Override
    public Map<String, Object> train(StageArguments args) {
        TrainingData data = args.get("training_data", TrainingData.class);
        TextNormalizer nlp = args.get("nlp", TextNormalizer.class);

        Map<String, Set<String>> intentsByKey = new HashMap<>();
        for (TrainingExample example : data.intentExamples()) {
            for (Token token : nlp.tokenize(example.text())) {
                String key = nlp.keyOf(token.text());
                if (!key.isEmpty()) {
                    intentsByKey.computeIfAbsent(key, k -> new HashSet<>()).add(example.intent());
                }
            }
        }

        Map<String, String> learned = new TreeMap<>();
        intentsByKey.forEach((key, intents) -> {
            if (intents.size() == 1) {
                learned.put(key, intents.iterator().next());
            }
        });
        this.keywords = Collections.unmodifiableMap(learned);
        log.info("Learned {} keywords for {} intents", learned.size(), new HashSet<>(learned.values()).size());
        return Map.of();
    }

    @Override
    public Map<String, Object> process(StageArguments args) {
        @SuppressWarnings("unchecked")
        List<Token> tokens = (List<Token>) args.get("tokens");
        TextNormalizer nlp = args.get("nlp", TextNormalizer.class);

        String intent = null;
        for (Token token : tokens) {
            String match = keywords.get(nlp.keyOf(token.text()));
            if (match != null) {
                intent = match;
                break;
            }
        }
        return provided("intent", intent);
    }

    @Override
    public Map<String, Object> persist(StageArguments args) {
        return Map.of(KEYWORDS, new TreeMap<>(keywords));
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
            return new KeywordIntentClassifier();
        }

        @Override
        public Component load(Map<String, Object> config, Map<String, Object> state, ModelMetadata metadata) {
            return new KeywordIntentClassifier(stateMap(state, KEYWORDS));
        }
    }
}
