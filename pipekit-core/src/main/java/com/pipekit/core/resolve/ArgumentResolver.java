package com.pipekit.core.resolve;

import com.pipekit.core.component.StageArguments;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Binds declared parameter names to values.
 *
 * <p>Precedence per name: the context wins over the configuration. A name present with
 * a null value counts as present. The resolver is pure: it never mutates its inputs and
 * identical inputs always produce identical results or identical failures.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * List<Object> args = ArgumentResolver.fillArgs(
 *     List.of("a", "b"), Map.of("a", 1), Map.of("b", 2));   // [1, 2]
 * }</pre>
 */
public final class ArgumentResolver {

    private ArgumentResolver() {
        // Utility class
    }

    /**
     * Resolves every required name from the context, then from the configuration.
     *
     * @param requiredNames declared parameter names, in positional order
     * @param context values accumulated by earlier components
     * @param config static configuration
     * @return resolved values, one per required name, in the same order
     * @throws MissingArgumentException listing exactly the names that could not be resolved
     */
    public static List<Object> fillArgs(List<String> requiredNames,
                                        Map<String, ?> context,
                                        Map<String, ?> config) {
        Objects.requireNonNull(requiredNames, "requiredNames must not be null");
        Map<String, ?> ctx = context == null ? Map.of() : context;
        Map<String, ?> cfg = config == null ? Map.of() : config;

        List<Object> values = new ArrayList<>(requiredNames.size());
        Set<String> missing = new LinkedHashSet<>();

        for (String name : requiredNames) {
            if (ctx.containsKey(name)) {
                values.add(ctx.get(name));
            } else if (cfg.containsKey(name)) {
                values.add(cfg.get(name));
            } else {
                missing.add(name);
            }
        }

        if (!missing.isEmpty()) {
            throw new MissingArgumentException(new ArrayList<>(missing));
        }
        return Collections.unmodifiableList(values);
    }

    /**
     * Resolves the required names and pairs them with their values.
     *
     * @param requiredNames declared parameter names
     * @param context values accumulated by earlier components
     * @param config static configuration
     * @return bound stage arguments
     * @throws MissingArgumentException listing exactly the names that could not be resolved
     */
    public static StageArguments bind(List<String> requiredNames,
                                      Map<String, ?> context,
                                      Map<String, ?> config) {
        return new StageArguments(requiredNames, fillArgs(requiredNames, context, config));
    }
}
