package com.pipekit.core.builder;

import com.pipekit.core.component.ComponentDescriptor;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Key of the component instance cache.
 *
 * <p>Made of the component name, a canonical projection of the configuration entries
 * the component declares relevant, the origin of the instance ({@value #CREATED} for
 * fresh components, the model identity for loaded ones) and, for loaded instances, the
 * persisted state they were restored from. Projections are sorted and deeply immutable,
 * so equal configurations always produce equal keys regardless of map implementation or
 * entry order.
 *
 * @param name component name
 * @param projection relevant configuration slice
 * @param origin {@value #CREATED} or a model identity
 * @param state canonical persisted state, empty for created instances
 */
public record ComponentCacheKey(String name, Map<String, Object> projection, String origin, Map<String, Object> state) {

    public static final String CREATED = "created";

    public ComponentCacheKey {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(origin, "origin must not be null");
        projection = projection == null ? Map.of() : projection;
        state = state == null ? Map.of() : state;
    }

    /**
     * Derives the cache key for a component.
     *
     * @param descriptor component descriptor declaring the relevant config keys
     * @param config full configuration
     * @param origin {@value #CREATED} or a model identity
     * @return cache key
     */
    public static ComponentCacheKey of(ComponentDescriptor descriptor, Map<String, ?> config, String origin) {
        return of(descriptor, config, origin, Map.of());
    }

    /**
     * Derives the cache key for a component restored from persisted state.
     *
     * @param descriptor component descriptor declaring the relevant config keys
     * @param config full configuration
     * @param origin model identity
     * @param state persisted component state
     * @return cache key
     */
    @SuppressWarnings("unchecked")
    public static ComponentCacheKey of(ComponentDescriptor descriptor,
                                       Map<String, ?> config,
                                       String origin,
                                       Map<String, ?> state) {
        return new ComponentCacheKey(descriptor.name(), project(descriptor.configKeys(), config), origin,
            state == null ? Map.of() : (Map<String, Object>) canonical(state));
    }

    /**
     * Projects the configuration onto the given keys. Absent keys are left out, so a
     * missing entry and an explicit null differ.
     *
     * @param keys relevant keys
     * @param config full configuration
     * @return sorted, deeply immutable projection
     */
    static Map<String, Object> project(Collection<String> keys, Map<String, ?> config) {
        if (config == null || keys.isEmpty()) {
            return Map.of();
        }
        TreeMap<String, Object> projection = new TreeMap<>();
        for (String key : keys) {
            if (config.containsKey(key)) {
                projection.put(key, canonical(config.get(key)));
            }
        }
        return Collections.unmodifiableMap(projection);
    }

    private static Object canonical(Object value) {
        if (value instanceof Map<?, ?> map) {
            TreeMap<String, Object> sorted = new TreeMap<>();
            map.forEach((k, v) -> sorted.put(String.valueOf(k), canonical(v)));
            return Collections.unmodifiableMap(sorted);
        }
        if (value instanceof Set<?> set) {
            // Set iteration order is not part of its identity
            return Collections.unmodifiableList(set.stream()
                .map(ComponentCacheKey::canonical)
                .sorted(Comparator.comparing(String::valueOf))
                .collect(Collectors.toList()));
        }
        if (value instanceof Collection<?> collection) {
            return Collections.unmodifiableList(collection.stream()
                .map(ComponentCacheKey::canonical)
                .collect(Collectors.toList()));
        }
        if (value instanceof Object[] array) {
            return canonical(Arrays.asList(array));
        }
        return value;
    }
}
