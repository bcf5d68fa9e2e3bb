package com.pipekit.core.component;

import java.util.Map;

/**
 * A named, pluggable processing unit taking part in a pipeline.
 *
 * <p>Components never compute their own arguments. The runtime resolves every parameter
 * declared in {@link ComponentDescriptor#requiresFor(LifecycleStage)} from the pipeline
 * context or the static configuration and passes them as {@link StageArguments}.
 *
 * <p>Each lifecycle method returns the context values it produces. The returned map must
 * contain every key declared in {@link ComponentDescriptor#providesFor(LifecycleStage)};
 * it may contain null values. Components that take no part in a stage keep the default
 * implementation, which provides nothing.
 *
 * <p>Instances are created by a {@link ComponentFactory} through the builder and may be
 * shared between pipelines that use the same configuration, so implementations should
 * keep training state confined to the instance they were trained on.
 *
 * @see ComponentFactory
 * @see ComponentDescriptor
 * @since 1.0.0
 */
public interface Component {

    /**
     * Returns the static descriptor of this component.
     *
     * @return descriptor, never null
     */
    ComponentDescriptor descriptor();

    default String name() {
        return descriptor().name();
    }

    /**
     * Called once when the pipeline is assembled.
     *
     * @param args arguments bound from {@code requires[pipeline_init]}
     * @return provided context values
     */
    default Map<String, Object> pipelineInit(StageArguments args) {
        return Map.of();
    }

    /**
     * Called once per training run, in pipeline order.
     *
     * @param args arguments bound from {@code requires[train]}
     * @return provided context values
     */
    default Map<String, Object> train(StageArguments args) {
        return Map.of();
    }

    /**
     * Called once per parse request, in pipeline order.
     *
     * @param args arguments bound from {@code requires[process]}
     * @return provided context values
     */
    default Map<String, Object> process(StageArguments args) {
        return Map.of();
    }

    /**
     * Called after training. The returned map is stored as this component's state in
     * the model metadata and handed back to {@link ComponentFactory#load} later.
     *
     * @param args arguments bound from {@code requires[persist]}
     * @return component state to persist
     */
    default Map<String, Object> persist(StageArguments args) {
        return Map.of();
    }

    /**
     * Dispatches to the lifecycle method of the given stage.
     *
     * @param stage lifecycle stage
     * @param args bound arguments
     * @return provided context values
     */
    default Map<String, Object> invoke(LifecycleStage stage, StageArguments args) {
        return switch (stage) {
            case PIPELINE_INIT -> pipelineInit(args);
            case TRAIN -> train(args);
            case PROCESS -> process(args);
            case PERSIST -> persist(args);
        };
    }
}
