package com.pipekit.core.component.impl.entity;

import com.pipekit.core.component.StageArguments;
import com.pipekit.core.model.Entity;
import com.pipekit.core.model.ModelMetadata;
import com.pipekit.core.model.TrainingData;
import com.pipekit.core.model.TrainingExample;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link EntitySynonymMapper}.
 */
class EntitySynonymMapperTest {

    @TempDir
    Path tempDir;

    @Test
    void train_learnsSynonymsWhereTextAndValueDiffer() {
        EntitySynonymMapper mapper = new EntitySynonymMapper();
        TrainingData data = new TrainingData(List.of(
            new TrainingExample("flights to NYC", null, List.of(new Entity("city", "New York City", 11, 14, null))),
            new TrainingExample("flights to Paris", null, List.of(new Entity("city", "Paris", 11, 16, null)))));

        mapper.train(new StageArguments(List.of("training_data"), List.of(data)));

        assertThat(mapper.synonyms()).containsExactly(Map.entry("nyc", "New York City"));
    }

    @Test
    void process_replacesKnownValuesOnly() {
        EntitySynonymMapper mapper = new EntitySynonymMapper(Map.of("nyc", "New York City"));
        Entity nyc = new Entity("city", "NYC", 0, 3, "ner_dictionary");
        Entity paris = new Entity("city", "Paris", 8, 13, "ner_dictionary");

        Map<String, Object> provided = mapper.process(
            new StageArguments(List.of("entities"), List.of(List.of(nyc, paris))));

        assertThat(provided.get("entities")).isEqualTo(List.of(nyc.withValue("New York City"), paris));
    }

    @Test
    void persistThenLoad_roundTripsThroughModelDirectory() {
        EntitySynonymMapper mapper = new EntitySynonymMapper(Map.of("nyc", "New York City"));

        Map<String, Object> state = mapper.persist(new StageArguments(List.of("model_dir"), List.of(tempDir)));
        EntitySynonymMapper restored = (EntitySynonymMapper) new EntitySynonymMapper.Factory()
            .load(Map.of(), state, new ModelMetadata(Map.of(), tempDir));

        assertThat(tempDir.resolve(EntitySynonymMapper.SYNONYMS_FILE)).exists();
        assertThat(restored.synonyms()).isEqualTo(mapper.synonyms());
    }

    @Test
    void persist_noSynonyms_writesNothing() {
        Map<String, Object> state = new EntitySynonymMapper()
            .persist(new StageArguments(List.of("model_dir"), List.of(tempDir.toString())));

        assertThat(state).containsKey("synonyms_file");
        assertThat(state.get("synonyms_file")).isNull();
        assertThat(tempDir.resolve(EntitySynonymMapper.SYNONYMS_FILE)).doesNotExist();
    }

    @Test
    void load_missingFile_continuesWithoutSynonyms() {
        EntitySynonymMapper restored = (EntitySynonymMapper) new EntitySynonymMapper.Factory()
            .load(Map.of(), Map.of("synonyms_file", "gone.json"), new ModelMetadata(Map.of(), tempDir));

        assertThat(restored.synonyms()).isEmpty();
    }

    @Test
    void load_corruptFile_fails() throws IOException {
        Files.writeString(tempDir.resolve(EntitySynonymMapper.SYNONYMS_FILE), "{not json");

        assertThatThrownBy(() -> new EntitySynonymMapper.Factory().load(Map.of(),
                Map.of("synonyms_file", EntitySynonymMapper.SYNONYMS_FILE), new ModelMetadata(Map.of(), tempDir)))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining(EntitySynonymMapper.SYNONYMS_FILE);
    }
}
