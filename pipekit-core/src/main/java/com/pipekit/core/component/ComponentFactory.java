package com.pipekit.core.component;

import com.pipekit.core.model.ModelMetadata;

import java.util.Map;

/**
 * Service Provider Interface for component implementations.
 *
 * <p>Factories are discovered via Java Service Provider Interface (SPI) and collected
 * into the {@link com.pipekit.core.registry.ComponentRegistry}. A factory exposes the
 * component's descriptor without instantiating anything, so registry validation stays
 * cheap.
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.pipekit.core.component.ComponentFactory}
 *
 * @see Component
 * @see com.pipekit.core.builder.ComponentBuilder
 * @since 1.0.0
 */
public interface ComponentFactory {

    /**
     * Returns the descriptor of the components this factory creates.
     *
     * <p>Must return the same descriptor on every call.
     *
     * @return component descriptor
     */
    ComponentDescriptor descriptor();

    /**
     * Creates a fresh, untrained component.
     *
     * @param config static configuration mapping
     * @return new component
     */
    Component create(Map<String, Object> config);

    /**
     * Restores a component from state produced by an earlier training run.
     *
     * <p>The default implementation ignores the state and creates a fresh component,
     * which suits stateless components.
     *
     * @param config static configuration mapping
     * @param state state previously returned by {@link Component#persist(StageArguments)}
     * @param metadata persisted model metadata
     * @return restored component
     */
    default Component load(Map<String, Object> config, Map<String, Object> state, ModelMetadata metadata) {
        return create(config);
    }
}
