package com.pipekit.core.component.impl.intent;

import com.pipekit.core.component.LifecycleStage;
import com.pipekit.core.component.StageArguments;
import com.pipekit.core.component.impl.nlp.TextNormalizer;
import com.pipekit.core.model.TrainingData;
import com.pipekit.core.model.TrainingExample;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link KeywordIntentClassifier}.
 */
class KeywordIntentClassifierTest {

    private static final TextNormalizer NLP = new TextNormalizer("en");

    private static final TrainingData DATA = new TrainingData(List.of(
        new TrainingExample("Hello there", "greet", List.of()),
        new TrainingExample("goodbye there", "farewell", List.of()),
        new TrainingExample("bye!", "farewell", List.of()),
        new TrainingExample("no intent here", null, List.of())
    ));

    private static StageArguments processArgs(String text) {
        return new StageArguments(List.of("tokens", "nlp"), List.of(NLP.tokenize(text), NLP));
    }

    @Test
    void train_keepsTokensUniqueToOneIntent() {
        KeywordIntentClassifier classifier = new KeywordIntentClassifier();

        classifier.train(new StageArguments(List.of("training_data", "nlp"), List.of(DATA, NLP)));

        assertThat(classifier.keywords())
            .containsEntry("hello", "greet")
            .containsEntry("bye", "farewell")
            .containsEntry("goodbye", "farewell")
            .doesNotContainKey("there")
            .doesNotContainKey("intent");
    }

    @Test
    void process_firstKeywordDecides() {
        KeywordIntentClassifier classifier = new KeywordIntentClassifier(Map.of("hello", "greet", "bye", "farewell"));

        Map<String, Object> provided = classifier.invoke(LifecycleStage.PROCESS, processArgs("well HELLO and bye"));

        assertThat(provided).containsEntry("intent", "greet");
    }

    @Test
    void process_noKeyword_providesNullIntent() {
        KeywordIntentClassifier classifier = new KeywordIntentClassifier(Map.of("hello", "greet"));

        Map<String, Object> provided = classifier.process(processArgs("what is this"));

        assertThat(provided).containsKey("intent");
        assertThat(provided.get("intent")).isNull();
    }

    @Test
    void persistThenLoad_restoresKeywords() {
        KeywordIntentClassifier trained = new KeywordIntentClassifier(Map.of("hello", "greet"));

        Map<String, Object> state = trained.persist(StageArguments.empty());
        KeywordIntentClassifier restored = (KeywordIntentClassifier) new KeywordIntentClassifier.Factory()
            .load(Map.of(), state, null);

        assertThat(restored.keywords()).isEqualTo(trained.keywords());
    }
}
