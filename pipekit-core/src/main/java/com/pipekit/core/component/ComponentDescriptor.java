package com.pipekit.core.component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Static metadata describing a component.
 *
 * <p>The descriptor is the contract between a component and the runtime. It is read by
 * the registry, the builder, the argument resolver and the validation tooling without
 * instantiating the component.
 *
 * <p><b>Example:</b>
 * <pre>{@code
 * ComponentDescriptor descriptor = ComponentDescriptor.builder("tokenizer_whitespace")
 *     .requires(LifecycleStage.PROCESS, "text")
 *     .provides(LifecycleStage.PROCESS, "tokens")
 *     .build();
 * }</pre>
 *
 * @param name unique component name, referenced by pipeline definitions
 * @param provides context keys added after each stage, in declaration order
 * @param requires parameter names of each stage method, in positional order
 * @param packageRequirements class or package names that must resolve on the classpath
 * @param configKeys configuration entries relevant to this component, part of the cache key
 * @param cacheable whether the builder may share one instance between requests; only for
 *                  components that keep no trained state on the instance
 * @since 1.0.0
 */
public record ComponentDescriptor(
    String name,
    Map<LifecycleStage, List<String>> provides,
    Map<LifecycleStage, List<String>> requires,
    Set<String> packageRequirements,
    List<String> configKeys,
    boolean cacheable
) {
    static final String ENTITIES = "entities";

    /**
     * Compact constructor with validation and defensive copies.
     */
    public ComponentDescriptor {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Component name must not be blank");
        }
        provides = copyStageMap(provides);
        requires = copyStageMap(requires);
        packageRequirements = packageRequirements == null
            ? Set.of()
            : Collections.unmodifiableSet(new LinkedHashSet<>(packageRequirements));
        configKeys = configKeys == null ? List.of() : List.copyOf(configKeys);
    }

    /**
     * Returns the context keys this component provides after the given stage.
     *
     * @param stage lifecycle stage
     * @return provided keys, empty if none
     */
    public List<String> providesFor(LifecycleStage stage) {
        return provides.getOrDefault(stage, List.of());
    }

    /**
     * Returns the parameter names of the given stage method.
     *
     * @param stage lifecycle stage
     * @return required parameter names, empty if none
     */
    public List<String> requiresFor(LifecycleStage stage) {
        return requires.getOrDefault(stage, List.of());
    }

    /**
     * Tells whether this component is an entity extractor, that is, it provides
     * {@code entities} during {@code process}.
     *
     * @return true for entity extractors
     */
    public boolean isEntityExtractor() {
        return providesFor(LifecycleStage.PROCESS).contains(ENTITIES);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    private static Map<LifecycleStage, List<String>> copyStageMap(Map<LifecycleStage, List<String>> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        Map<LifecycleStage, List<String>> copy = new EnumMap<>(LifecycleStage.class);
        source.forEach((stage, keys) -> {
            Objects.requireNonNull(stage, "stage must not be null");
            copy.put(stage, keys == null ? List.of() : List.copyOf(keys));
        });
        return Collections.unmodifiableMap(copy);
    }

    /**
     * Fluent builder for descriptors declared by component factories.
     */
    public static final class Builder {
        private final String name;
        private final Map<LifecycleStage, List<String>> provides = new EnumMap<>(LifecycleStage.class);
        private final Map<LifecycleStage, List<String>> requires = new EnumMap<>(LifecycleStage.class);
        private final Set<String> packageRequirements = new LinkedHashSet<>();
        private final List<String> configKeys = new ArrayList<>();
        private boolean cacheable;

        private Builder(String name) {
            this.name = name;
        }

        public Builder provides(LifecycleStage stage, String... keys) {
            provides.computeIfAbsent(stage, s -> new ArrayList<>()).addAll(List.of(keys));
            return this;
        }

        public Builder requires(LifecycleStage stage, String... parameterNames) {
            requires.computeIfAbsent(stage, s -> new ArrayList<>()).addAll(List.of(parameterNames));
            return this;
        }

        public Builder packageRequirements(String... names) {
            packageRequirements.addAll(List.of(names));
            return this;
        }

        public Builder configKeys(String... keys) {
            configKeys.addAll(List.of(keys));
            return this;
        }

        /**
         * Marks the component as shareable, keyed by the given configuration entries.
         *
         * @param keys configuration entries that select an instance
         * @return this builder
         */
        public Builder cachedBy(String... keys) {
            cacheable = true;
            return configKeys(keys);
        }

        public ComponentDescriptor build() {
            return new ComponentDescriptor(name, provides, requires, packageRequirements, configKeys, cacheable);
        }
    }
}
