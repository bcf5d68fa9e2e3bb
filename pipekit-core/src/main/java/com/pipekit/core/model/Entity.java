package com.pipekit.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * An entity mention inside a text.
 *
 * @param entity entity type (e.g., "cuisine", "location")
 * @param value entity value, possibly normalized by a synonym mapper
 * @param start start offset in the text (inclusive)
 * @param end end offset in the text (exclusive)
 * @param extractor name of the component that produced this entity, null for training annotations
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Entity(
    @JsonProperty("entity") String entity,
    @JsonProperty("value") String value,
    @JsonProperty("start") int start,
    @JsonProperty("end") int end,
    @JsonProperty("extractor") String extractor
) {
    public Entity {
        Objects.requireNonNull(entity, "entity must not be null");
        Objects.requireNonNull(value, "value must not be null");
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid entity span: [" + start + ", " + end + ")");
        }
    }

    /**
     * Returns a copy with a different value, keeping the span.
     *
     * @param newValue replacement value
     * @return entity with the new value
     */
    public Entity withValue(String newValue) {
        return new Entity(entity, newValue, start, end, extractor);
    }
}
