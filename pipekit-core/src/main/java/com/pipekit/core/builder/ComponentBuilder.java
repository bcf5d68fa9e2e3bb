package com.pipekit.core.builder;

import com.pipekit.core.PipelineException;
import com.pipekit.core.component.Component;
import com.pipekit.core.component.ComponentFactory;
import com.pipekit.core.dependency.DependencyChecker;
import com.pipekit.core.dependency.RequirementsManifest;
import com.pipekit.core.model.ModelMetadata;
import com.pipekit.core.registry.ComponentRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Supplier;

/**
 * Resolves component names into component instances.
 *
 * <p>Every request walks the same path:
 * <ol>
 *   <li>look the name up in the {@link ComponentRegistry} ({@link UnknownComponentException})</li>
 *   <li>check the descriptor's package requirements ({@link MissingDependencyException})</li>
 *   <li>instantiate through the factory, or return the cached instance</li>
 * </ol>
 * A failure at any step is terminal for that request. A null name is not an error: it
 * yields {@link Optional#empty()} so optional pipeline slots can be expressed uniformly.
 *
 * <p><b>Caching:</b> only components whose descriptor is
 * {@link com.pipekit.core.component.ComponentDescriptor#cacheable() cacheable} are shared;
 * every other request gets a fresh instance, so trained state never leaks between
 * pipelines. Shared instances are keyed by {@link ComponentCacheKey}. Creation for a key
 * happens at most once even under concurrent first use; concurrent callers wait for the
 * first and observe the same instance. Failed creations are not cached. Cache scope is
 * the builder: share a builder to share instances across builds.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ComponentBuilder builder = new ComponentBuilder(ComponentRegistry.defaultRegistry());
 * Component tokenizer = builder.createComponent("tokenizer_whitespace", config).orElseThrow();
 * }</pre>
 */
public class ComponentBuilder {

    private static final Logger log = LoggerFactory.getLogger(ComponentBuilder.class);
    private static final int MAX_SUGGESTIONS = 3;
    private static final String LOADED_ORIGIN_PREFIX = "model:";

    private final ComponentRegistry registry;
    private final DependencyChecker dependencyChecker;
    private final boolean useCache;
    private final Map<String, List<String>> requirementsManifest;
    private final ConcurrentMap<ComponentCacheKey, CompletableFuture<Component>> cache = new ConcurrentHashMap<>();

    public ComponentBuilder(ComponentRegistry registry) {
        this(registry, DependencyChecker.classpath(), true);
    }

    public ComponentBuilder(ComponentRegistry registry, DependencyChecker dependencyChecker, boolean useCache) {
        this(registry, dependencyChecker, useCache, null);
    }

    /**
     * Creates a builder that enriches dependency errors with install names.
     *
     * @param registry component registry
     * @param dependencyChecker requirement checker
     * @param useCache whether instances are cached
     * @param requirementsManifest manifest file, or null for none
     * @throws com.pipekit.core.dependency.ManifestReadException if the manifest cannot be parsed
     */
    public ComponentBuilder(ComponentRegistry registry,
                            DependencyChecker dependencyChecker,
                            boolean useCache,
                            Path requirementsManifest) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.dependencyChecker = Objects.requireNonNull(dependencyChecker, "dependencyChecker must not be null");
        this.useCache = useCache;
        this.requirementsManifest = requirementsManifest == null
            ? Map.of()
            : RequirementsManifest.cached(requirementsManifest);
    }

    /**
     * Creates (or reuses) a fresh component.
     *
     * @param name component name, null for "no component"
     * @param config static configuration
     * @return the component, or empty when {@code name} is null
     * @throws UnknownComponentException if the name is not registered
     * @throws MissingDependencyException if a package requirement is unavailable
     */
    public Optional<Component> createComponent(String name, Map<String, Object> config) {
        if (name == null) {
            log.debug("No component requested, skipping creation");
            return Optional.empty();
        }
        Map<String, Object> cfg = config == null ? Map.of() : config;
        ComponentFactory factory = resolve(name);
        ComponentCacheKey key = ComponentCacheKey.of(factory.descriptor(), cfg, ComponentCacheKey.CREATED);
        return Optional.of(instantiate(factory, key, () -> factory.create(cfg)));
    }

    /**
     * Restores (or reuses) a component from state persisted by an earlier training run.
     *
     * @param name component name, null for "no component"
     * @param config static configuration
     * @param state persisted component state
     * @param metadata persisted model metadata
     * @return the component, or empty when {@code name} is null
     * @throws UnknownComponentException if the name is not registered
     * @throws MissingDependencyException if a package requirement is unavailable
     */
    public Optional<Component> loadComponent(String name,
                                             Map<String, Object> config,
                                             Map<String, Object> state,
                                             ModelMetadata metadata) {
        if (name == null) {
            log.debug("No component requested, skipping load");
            return Optional.empty();
        }
        Map<String, Object> cfg = config == null ? Map.of() : config;
        Map<String, Object> componentState = state == null ? Map.of() : state;
        ModelMetadata modelMetadata = metadata == null ? new ModelMetadata(Map.of(), null) : metadata;

        ComponentFactory factory = resolve(name);
        ComponentCacheKey key = ComponentCacheKey.of(
            factory.descriptor(), cfg, LOADED_ORIGIN_PREFIX + modelMetadata.modelId(), componentState);
        return Optional.of(instantiate(factory, key, () -> factory.load(cfg, componentState, modelMetadata)));
    }

    /**
     * Returns the number of cached instances.
     *
     * @return cache size
     */
    public int cachedInstances() {
        return cache.size();
    }

    private ComponentFactory resolve(String name) {
        ComponentFactory factory = registry.factory(name)
            .orElseThrow(() -> new UnknownComponentException(name, registry.closestNames(name, MAX_SUGGESTIONS)));

        Set<String> missing = dependencyChecker.unavailable(factory.descriptor().packageRequirements());
        if (!missing.isEmpty()) {
            throw new MissingDependencyException(
                name, missing, RequirementsManifest.installNamesFor(requirementsManifest, missing));
        }
        return factory;
    }

    private Component instantiate(ComponentFactory factory, ComponentCacheKey key, Supplier<Component> creator) {
        if (!useCache || !factory.descriptor().cacheable()) {
            return create(key, creator);
        }

        CompletableFuture<Component> pending = new CompletableFuture<>();
        CompletableFuture<Component> existing = cache.putIfAbsent(key, pending);
        if (existing != null) {
            log.debug("Reusing cached component '{}' ({})", key.name(), key.origin());
            return await(existing);
        }

        try {
            Component component = create(key, creator);
            pending.complete(component);
            return component;
        } catch (RuntimeException | Error e) {
            cache.remove(key, pending);
            pending.completeExceptionally(e);
            throw e;
        }
    }

    private static Component create(ComponentCacheKey key, Supplier<Component> creator) {
        log.info("Instantiating component '{}' ({})", key.name(), key.origin());
        Component component = creator.get();
        if (component == null) {
            throw new PipelineException("Factory for component '" + key.name() + "' returned no instance");
        }
        return component;
    }

    private static Component await(CompletableFuture<Component> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            if (e.getCause() instanceof Error error) {
                throw error;
            }
            throw e;
        }
    }
}
