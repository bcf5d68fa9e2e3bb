package com.pipekit.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Training data handed to the {@code train} stage under the {@code training_data} key.
 *
 * @param examples annotated examples
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TrainingData(
    @JsonProperty("examples") List<TrainingExample> examples
) {
    public TrainingData {
        examples = examples == null ? List.of() : List.copyOf(examples);
    }

    /**
     * Returns the examples annotated with an intent.
     *
     * @return intent examples
     */
    public List<TrainingExample> intentExamples() {
        return examples.stream()
            .filter(example -> example.intent() != null)
            .toList();
    }

    /**
     * Returns the examples carrying at least one entity annotation.
     *
     * @return entity examples
     */
    public List<TrainingExample> entityExamples() {
        return examples.stream()
            .filter(example -> !example.entities().isEmpty())
            .toList();
    }
}
