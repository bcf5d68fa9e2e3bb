package com.pipekit.core.component;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Abstract base class for component implementations providing common functionality.
 *
 * <p>This class reduces code duplication across components by providing:
 * <ul>
 *   <li>Logger initialization (one logger per component class)</li>
 *   <li>Descriptor storage ({@link #descriptor()})</li>
 *   <li>Result helpers that tolerate null values ({@link #provided(String, Object)})</li>
 *   <li>Typed access to persisted state ({@link #stateList(Map, String)})</li>
 * </ul>
 *
 * @see Component
 * @since 1.0.0
 */
public abstract class AbstractComponent implements Component {

    /**
     * Logger instance for this component.
     * Automatically initialized with the concrete component class name.
     */
    protected final Logger log;

    private final ComponentDescriptor descriptor;

    protected AbstractComponent(ComponentDescriptor descriptor) {
        this.descriptor = Objects.requireNonNull(descriptor, "descriptor must not be null");
        this.log = LoggerFactory.getLogger(getClass());
    }

    @Override
    public final ComponentDescriptor descriptor() {
        return descriptor;
    }

    /**
     * Creates a single-entry result map. The value may be null.
     *
     * @param key context key
     * @param value provided value
     * @return unmodifiable result map
     */
    protected Map<String, Object> provided(String key, Object value) {
        Map<String, Object> result = new HashMap<>();
        result.put(key, value);
        return Collections.unmodifiableMap(result);
    }

    /**
     * Reads a list entry from persisted component state.
     *
     * @param state persisted state, may be null
     * @param key state entry
     * @return list value or empty list if absent
     */
    @SuppressWarnings("unchecked")
    protected static <T> List<T> stateList(Map<String, Object> state, String key) {
        if (state == null || !(state.get(key) instanceof List<?> list)) {
            return List.of();
        }
        return (List<T>) list;
    }

    /**
     * Reads a map entry from persisted component state.
     *
     * @param state persisted state, may be null
     * @param key state entry
     * @return map value or empty map if absent
     */
    @SuppressWarnings("unchecked")
    protected static <V> Map<String, V> stateMap(Map<String, Object> state, String key) {
        if (state == null || !(state.get(key) instanceof Map<?, ?> map)) {
            return Map.of();
        }
        return (Map<String, V>) map;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + descriptor.name() + "]";
    }
}
