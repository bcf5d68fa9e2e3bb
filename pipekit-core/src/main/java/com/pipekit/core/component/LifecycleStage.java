package com.pipekit.core.component;

import java.util.List;

/**
 * Lifecycle stages a component takes part in.
 *
 * <p>Each stage has a wire identifier (used in configuration files and persisted
 * metadata) and a list of base context keys the runtime seeds before the first
 * component of a traversal runs.
 *
 * @since 1.0.0
 */
public enum LifecycleStage {

    /** Runs once when a pipeline is assembled. No base keys. */
    PIPELINE_INIT("pipeline_init", List.of()),

    /** Runs once per training run. */
    TRAIN("train", List.of("training_data")),

    /** Runs once per parse request. */
    PROCESS("process", List.of("text", "intent", "entities")),

    /** Runs once after training to collect component state. */
    PERSIST("persist", List.of("model_dir"));

    private final String id;
    private final List<String> baseContextKeys;

    LifecycleStage(String id, List<String> baseContextKeys) {
        this.id = id;
        this.baseContextKeys = baseContextKeys;
    }

    /**
     * Returns the wire identifier of this stage (e.g. {@code "pipeline_init"}).
     *
     * @return stage identifier
     */
    public String id() {
        return id;
    }

    /**
     * Returns the keys seeded into the context before this stage's traversal.
     *
     * @return base context keys, never null
     */
    public List<String> baseContextKeys() {
        return baseContextKeys;
    }

    @Override
    public String toString() {
        return id;
    }
}
