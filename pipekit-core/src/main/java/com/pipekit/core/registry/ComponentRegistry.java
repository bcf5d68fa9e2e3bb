package com.pipekit.core.registry;

import com.pipekit.core.component.ComponentDescriptor;
import com.pipekit.core.component.ComponentFactory;
import org.apache.commons.text.similarity.LevenshteinDistance;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.ServiceLoader;

/**
 * Read-only table of all known components, keyed by name.
 *
 * <p>A registry is assembled once through {@link #builder()} and never changes
 * afterwards: entries are neither removed nor overwritten. The process-wide instance
 * returned by {@link #defaultRegistry()} is built from the factories registered via SPI.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ComponentRegistry registry = ComponentRegistry.builder()
 *     .register(new WhitespaceTokenizer.Factory())
 *     .build();
 *
 * registry.lookup("tokenizer_whitespace").ifPresent(d -> ...);
 * }</pre>
 *
 * @see ComponentFactory
 * @since 1.0.0
 */
public final class ComponentRegistry {

    private static final Logger log = LoggerFactory.getLogger(ComponentRegistry.class);

    private final Map<String, ComponentFactory> factories;

    private ComponentRegistry(Map<String, ComponentFactory> factories) {
        this.factories = Collections.unmodifiableMap(new LinkedHashMap<>(factories));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns the process-wide registry, built from SPI on first access.
     *
     * @return default registry
     * @throws IllegalArgumentException if two discovered factories share a name
     */
    public static ComponentRegistry defaultRegistry() {
        return DefaultRegistryHolder.INSTANCE;
    }

    /**
     * Discovers every {@link ComponentFactory} registered in {@code META-INF/services}.
     *
     * <p>Returns the raw list, duplicates included, so validation tooling can report them.
     *
     * @return discovered factories in service-loader order
     */
    public static List<ComponentFactory> discoverFactories() {
        List<ComponentFactory> discovered = new ArrayList<>();
        ServiceLoader.load(ComponentFactory.class).forEach(discovered::add);
        log.debug("Discovered {} component factories via ServiceLoader", discovered.size());
        return discovered;
    }

    /**
     * Looks up a descriptor by component name.
     *
     * @param name component name
     * @return descriptor, or empty if no component has that name
     */
    public Optional<ComponentDescriptor> lookup(String name) {
        return factory(name).map(ComponentFactory::descriptor);
    }

    /**
     * Looks up the factory registered under the given name.
     *
     * @param name component name
     * @return factory, or empty if unknown
     */
    public Optional<ComponentFactory> factory(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(factories.get(name));
    }

    public boolean contains(String name) {
        return name != null && factories.containsKey(name);
    }

    /**
     * Returns every registered descriptor in registration order.
     *
     * @return all descriptors
     */
    public List<ComponentDescriptor> all() {
        return factories.values().stream()
            .map(ComponentFactory::descriptor)
            .toList();
    }

    public List<String> names() {
        return List.copyOf(factories.keySet());
    }

    public int size() {
        return factories.size();
    }

    /**
     * Returns registered names closest to the given one, for "did you mean" hints.
     *
     * <p>Candidates are ranked by Levenshtein distance; names further away than half of
     * the longer name's length are dropped.
     *
     * @param name unresolved name
     * @param limit maximum number of suggestions
     * @return closest names, best first
     */
    public List<String> closestNames(String name, int limit) {
        if (name == null || name.isEmpty() || limit <= 0) {
            return List.of();
        }
        record Candidate(String name, int distance) {}
        LevenshteinDistance levenshtein = LevenshteinDistance.getDefaultInstance();

        return factories.keySet().stream()
            .map(candidate -> new Candidate(candidate, levenshtein.apply(name, candidate)))
            .filter(candidate -> candidate.distance() <= Math.max(name.length(), candidate.name().length()) / 2)
            .sorted(Comparator.comparingInt(Candidate::distance).thenComparing(Candidate::name))
            .limit(limit)
            .map(Candidate::name)
            .toList();
    }

    /**
     * Collects factories and freezes them into a registry.
     */
    public static final class Builder {
        private final Map<String, ComponentFactory> factories = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * Registers a factory under its descriptor's name.
         *
         * @param factory component factory
         * @return this builder
         * @throws IllegalArgumentException if the name is already registered
         */
        public Builder register(ComponentFactory factory) {
            String name = factory.descriptor().name();
            if (factories.containsKey(name)) {
                throw new IllegalArgumentException("Component name already registered: " + name);
            }
            factories.put(name, factory);
            return this;
        }

        public Builder registerAll(Iterable<? extends ComponentFactory> toRegister) {
            toRegister.forEach(this::register);
            return this;
        }

        public ComponentRegistry build() {
            return new ComponentRegistry(factories);
        }
    }

    private static final class DefaultRegistryHolder {
        private static final ComponentRegistry INSTANCE = createDefault();

        private static ComponentRegistry createDefault() {
            ComponentRegistry registry = builder().registerAll(discoverFactories()).build();
            log.info("Component registry initialized with {} components", registry.size());
            return registry;
        }
    }
}
