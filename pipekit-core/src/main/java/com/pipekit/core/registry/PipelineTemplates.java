package com.pipekit.core.registry;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Named, ordered component lists that form ready-to-use pipelines.
 *
 * <p>Selecting a template in the configuration saves listing every component:
 * <pre>{@code
 * template: keyword
 * }</pre>
 *
 * <p>The {@value #ALL_COMPONENTS} template lists every registered component exactly once
 * in a runnable order; it backs the train-persist-load-parse round trip.
 *
 * @since 1.0.0
 */
public final class PipelineTemplates {

    public static final String ALL_COMPONENTS = "all_components";

    /**
     * Built-in templates.
     */
    public static final PipelineTemplates DEFAULTS = new PipelineTemplates(defaults());

    private final Map<String, List<String>> templates;

    private static Map<String, List<String>> defaults() {
        Map<String, List<String>> templates = new LinkedHashMap<>();
        templates.put("keyword", List.of(
            "nlp_basic",
            "tokenizer_whitespace",
            "intent_classifier_keyword"
        ));
        templates.put("dictionary", List.of(
            "nlp_basic",
            "ner_dictionary",
            "ner_synonyms"
        ));
        templates.put(ALL_COMPONENTS, List.of(
            "nlp_basic",
            "tokenizer_whitespace",
            "intent_classifier_keyword",
            "ner_dictionary",
            "ner_synonyms"
        ));
        return templates;
    }

    public PipelineTemplates(Map<String, List<String>> templates) {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        templates.forEach((name, components) -> copy.put(name, List.copyOf(components)));
        this.templates = Collections.unmodifiableMap(copy);
    }

    /**
     * Returns the component names of a template.
     *
     * @param name template name
     * @return ordered component names, or empty if no such template
     */
    public Optional<List<String>> get(String name) {
        return Optional.ofNullable(templates.get(name));
    }

    public Set<String> names() {
        return templates.keySet();
    }

    public Map<String, List<String>> asMap() {
        return templates;
    }
}
