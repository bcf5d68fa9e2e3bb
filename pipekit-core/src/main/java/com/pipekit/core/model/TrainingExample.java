package com.pipekit.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * A single annotated training utterance.
 *
 * @param text utterance text
 * @param intent annotated intent, null if the example only carries entities
 * @param entities annotated entities
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TrainingExample(
    @JsonProperty("text") String text,
    @JsonProperty("intent") String intent,
    @JsonProperty("entities") List<Entity> entities
) {
    public TrainingExample {
        Objects.requireNonNull(text, "text must not be null");
        entities = entities == null ? List.of() : List.copyOf(entities);
        for (Entity entity : entities) {
            if (entity.end() > text.length()) {
                throw new IllegalArgumentException("Entity " + entity.entity() + " span [" + entity.start()
                    + ", " + entity.end() + ") lies outside training example \"" + text + "\"");
            }
        }
    }

    /**
     * Returns the substring of {@link #text()} covered by the given entity.
     *
     * @param entity annotated entity of this example
     * @return covered text
     * @throws IllegalArgumentException if the span lies outside the text
     */
    public String coveredText(Entity entity) {
        if (entity.end() > text.length()) {
            throw new IllegalArgumentException("Entity span [" + entity.start() + ", " + entity.end()
                + ") lies outside training example \"" + text + "\"");
        }
        return text.substring(entity.start(), entity.end());
    }
}
