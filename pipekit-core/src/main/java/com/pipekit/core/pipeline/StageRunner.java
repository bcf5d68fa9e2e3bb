package com.pipekit.core.pipeline;

import com.pipekit.core.component.Component;
import com.pipekit.core.component.ComponentDescriptor;
import com.pipekit.core.component.LifecycleStage;
import com.pipekit.core.component.StageArguments;
import com.pipekit.core.resolve.ArgumentResolver;
import com.pipekit.core.resolve.MissingArgumentException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Runs one lifecycle stage over an ordered list of components.
 *
 * <p>For each component, in order: bind its declared parameters from the context and
 * the configuration, invoke the stage method, verify every declared key was provided,
 * then fold the provided values into the context. Each component therefore only sees
 * keys added by components before it.
 *
 * <p>{@link #checkOrdering} performs the same traversal on keys alone, so a pipeline
 * can be rejected before any component runs.
 */
public final class StageRunner {

    private static final Logger log = LoggerFactory.getLogger(StageRunner.class);

    private StageRunner() {
        // Utility class
    }

    /**
     * Runs a stage over every component.
     *
     * @param stage lifecycle stage
     * @param components components in pipeline order
     * @param context context to read from and extend
     * @param config static configuration
     * @return the extended context
     * @throws MissingArgumentException if a component's parameters cannot be bound
     * @throws ContractViolationException if a component omits a declared key
     */
    public static PipelineContext run(LifecycleStage stage,
                                      List<Component> components,
                                      PipelineContext context,
                                      Map<String, Object> config) {
        log.debug("Running stage {} over {} components", stage, components.size());
        for (Component component : components) {
            invoke(stage, component, context, config);
        }
        return context;
    }

    /**
     * Runs a stage for a single component.
     *
     * @param stage lifecycle stage
     * @param component component to invoke
     * @param context context to read from and extend
     * @param config static configuration
     * @return the values the component provided
     * @throws MissingArgumentException if the component's parameters cannot be bound
     * @throws ContractViolationException if the component omits a declared key
     */
    public static Map<String, Object> invoke(LifecycleStage stage,
                                             Component component,
                                             PipelineContext context,
                                             Map<String, Object> config) {
        ComponentDescriptor descriptor = component.descriptor();
        StageArguments args = bind(descriptor, stage, context.asMap(), config);

        log.debug("Calling {}.{} with {}", descriptor.name(), stage, args.names());
        Map<String, Object> provided = component.invoke(stage, args);
        Map<String, Object> updates = provided == null ? Map.of() : provided;

        List<String> missing = descriptor.providesFor(stage).stream()
            .filter(key -> !updates.containsKey(key))
            .toList();
        if (!missing.isEmpty()) {
            throw new ContractViolationException(descriptor.name(), stage, missing);
        }

        updates.forEach(context::provide);
        return updates;
    }

    /**
     * Walks a stage over descriptors using keys only, without invoking anything.
     *
     * @param stage lifecycle stage
     * @param descriptors descriptors in pipeline order
     * @param initialKeys keys present before the first component runs
     * @param config static configuration
     * @return keys present after the last component
     * @throws MissingArgumentException naming the first component whose parameters cannot be bound
     */
    public static Set<String> checkOrdering(LifecycleStage stage,
                                            Collection<ComponentDescriptor> descriptors,
                                            Collection<String> initialKeys,
                                            Map<String, Object> config) {
        Map<String, Object> keys = new LinkedHashMap<>();
        initialKeys.forEach(key -> keys.put(key, null));
        stage.baseContextKeys().forEach(key -> keys.put(key, null));

        for (ComponentDescriptor descriptor : descriptors) {
            bind(descriptor, stage, keys, config);
            descriptor.providesFor(stage).forEach(key -> keys.put(key, null));
        }
        return Collections.unmodifiableSet(keys.keySet());
    }

    private static StageArguments bind(ComponentDescriptor descriptor,
                                       LifecycleStage stage,
                                       Map<String, Object> context,
                                       Map<String, Object> config) {
        try {
            return ArgumentResolver.bind(descriptor.requiresFor(stage), context, config);
        } catch (MissingArgumentException e) {
            throw new MissingArgumentException(e.missingNames(),
                "component '" + descriptor.name() + "' during " + stage.id());
        }
    }
}
