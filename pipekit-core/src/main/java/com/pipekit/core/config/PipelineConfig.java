package com.pipekit.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.pipekit.core.registry.PipelineTemplates;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Root configuration of a pipeline build.
 *
 * <p>Loaded from {@code pipekit.yaml}. Read-only during execution: the flat mapping
 * returned by {@link #asMap()} is what argument resolution falls back to when a
 * parameter is not in the pipeline context.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * name: "restaurant-bot"
 * language: "en"
 *
 * # either a template ...
 * template: keyword
 *
 * # ... or an explicit component list (wins over the template)
 * pipeline:
 *   - nlp_basic
 *   - tokenizer_whitespace
 *   - intent_classifier_keyword
 *
 * settings:
 *   entity_case_sensitive: false
 *
 * requirements: "requirements-components.txt"
 * }</pre>
 *
 * @param name model name
 * @param language language code passed to components as {@code language}
 * @param template pipeline template name
 * @param pipeline explicit ordered component names; null entries mark empty slots
 * @param settings component settings, exposed flat through {@link #asMap()}
 * @param requirements optional requirements manifest path for remediation messages
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PipelineConfig(
    @JsonProperty("name") String name,
    @JsonProperty("language") String language,
    @JsonProperty("template") String template,
    @JsonProperty("pipeline") List<String> pipeline,
    @JsonProperty("settings") Map<String, Object> settings,
    @JsonProperty("requirements") String requirements
) {
    public static final String DEFAULT_TEMPLATE = "keyword";
    public static final String DEFAULT_LANGUAGE = "en";

    /**
     * Creates a default configuration using the keyword template in English.
     *
     * @return default configuration
     */
    public static PipelineConfig defaults() {
        return new PipelineConfig("default", DEFAULT_LANGUAGE, DEFAULT_TEMPLATE, null, Map.of(), null);
    }

    /**
     * Returns the flat configuration mapping consumed by argument resolution.
     *
     * <p>Contains every settings entry plus {@code language}. The explicit
     * {@code language} field wins over a {@code language} setting.
     *
     * @return unmodifiable configuration mapping
     */
    public Map<String, Object> asMap() {
        Map<String, Object> values = new LinkedHashMap<>();
        if (settings != null) {
            values.putAll(settings);
        }
        values.put("language", language != null ? language : values.getOrDefault("language", DEFAULT_LANGUAGE));
        return Collections.unmodifiableMap(values);
    }

    /**
     * Resolves the ordered component names of the configured pipeline.
     *
     * <p>An explicit {@code pipeline} list wins; otherwise the {@code template} (or the
     * default template when none is set) is expanded.
     *
     * @param templates known templates
     * @return component names, null entries preserved
     * @throws IllegalArgumentException if the template does not exist
     */
    public List<String> componentNames(PipelineTemplates templates) {
        if (pipeline != null && !pipeline.isEmpty()) {
            return Collections.unmodifiableList(new ArrayList<>(pipeline));
        }
        String templateName = template != null ? template : DEFAULT_TEMPLATE;
        return templates.get(templateName)
            .orElseThrow(() -> new IllegalArgumentException(
                "Unknown pipeline template '" + templateName + "'. Available templates: " + templates.names()));
    }
}
