package com.pipekit.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Output of parsing a single text.
 *
 * @param text parsed text
 * @param intent recognized intent, null if none
 * @param entities extracted entities
 */
public record ParseResult(
    @JsonProperty("text") String text,
    @JsonProperty("intent") String intent,
    @JsonProperty("entities") List<Entity> entities
) {
    public ParseResult {
        entities = entities == null ? List.of() : List.copyOf(entities);
    }
}
