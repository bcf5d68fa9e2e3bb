package com.pipekit.core.registry;

import com.pipekit.core.component.ComponentDescriptor;
import com.pipekit.core.component.LifecycleStage;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds the superset contexts used for static soundness checks.
 *
 * <p>The superset holds every key that could exist when a stage runs under <em>some</em>
 * pipeline ordering: the stage's base keys, every descriptor's {@code pipeline_init}
 * keys and every descriptor's keys for the stage itself. Values are null; only the keys
 * matter.
 *
 * <p>The live traversal in {@link com.pipekit.core.pipeline.StageRunner} enforces one
 * concrete ordering instead.
 */
public final class StaticContexts {

    private StaticContexts() {
        // Utility class
    }

    /**
     * Computes the superset context for a stage.
     *
     * @param stage lifecycle stage
     * @param descriptors every registered descriptor
     * @return key → null map
     */
    public static Map<String, Object> superset(LifecycleStage stage, Collection<ComponentDescriptor> descriptors) {
        Map<String, Object> context = new LinkedHashMap<>();
        stage.baseContextKeys().forEach(key -> context.put(key, null));
        for (ComponentDescriptor descriptor : descriptors) {
            descriptor.providesFor(LifecycleStage.PIPELINE_INIT).forEach(key -> context.put(key, null));
            descriptor.providesFor(stage).forEach(key -> context.put(key, null));
        }
        return context;
    }
}
