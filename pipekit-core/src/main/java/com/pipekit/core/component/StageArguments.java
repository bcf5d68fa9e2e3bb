package com.pipekit.core.component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Arguments bound for a single lifecycle call.
 *
 * <p>Values are positional, one per declared parameter name. Values may be null when
 * the context holds a null entry (for instance the {@code intent} base key).
 *
 * @param names declared parameter names
 * @param values resolved values, same order and size as {@code names}
 * @since 1.0.0
 */
public record StageArguments(List<String> names, List<Object> values) {

    public StageArguments {
        names = names == null ? List.of() : List.copyOf(names);
        values = values == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(values));
        if (names.size() != values.size()) {
            throw new IllegalArgumentException(
                "Argument count mismatch: " + names.size() + " names, " + values.size() + " values");
        }
    }

    public static StageArguments empty() {
        return new StageArguments(List.of(), List.of());
    }

    public int size() {
        return names.size();
    }

    /**
     * Returns the value bound at the given position.
     *
     * @param index parameter position
     * @return bound value, possibly null
     */
    public Object get(int index) {
        return values.get(index);
    }

    /**
     * Returns the value bound to the given parameter name.
     *
     * @param name parameter name
     * @return bound value, possibly null
     * @throws IllegalArgumentException if the name was not declared
     */
    public Object get(String name) {
        int index = names.indexOf(name);
        if (index < 0) {
            throw new IllegalArgumentException("Parameter not declared: " + name);
        }
        return values.get(index);
    }

    /**
     * Returns the value bound to the given parameter name cast to the expected type.
     *
     * @param name parameter name
     * @param type expected type
     * @param <T> expected type
     * @return bound value, possibly null
     * @throws ClassCastException if the value has an unexpected type
     */
    public <T> T get(String name, Class<T> type) {
        return type.cast(get(name));
    }
}
