package com.pipekit.core.pipeline;

import com.pipekit.core.component.LifecycleStage;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Values accumulated while a pipeline traverses a stage.
 *
 * <p>Scoped to one invocation (a training run or a parse request) and never persisted.
 * Keys are only ever added: a value may be replaced by a later component, but a key once
 * present stays visible to every subsequent component. Null values are allowed.
 */
public final class PipelineContext {

    private final Map<String, Object> values;

    public PipelineContext() {
        this.values = new LinkedHashMap<>();
    }

    private PipelineContext(Map<String, Object> values) {
        this.values = new LinkedHashMap<>(values);
    }

    /**
     * Seeds the base keys of a stage.
     *
     * <p>Every base key of the stage is added; keys absent from {@code baseValues} are
     * seeded with null.
     *
     * @param stage lifecycle stage
     * @param baseValues values for the stage's base keys
     * @return this context
     */
    public PipelineContext seed(LifecycleStage stage, Map<String, ?> baseValues) {
        for (String key : stage.baseContextKeys()) {
            values.put(key, baseValues == null ? null : baseValues.get(key));
        }
        return this;
    }

    /**
     * Adds or replaces a value.
     *
     * @param key context key
     * @param value value, may be null
     */
    public void provide(String key, Object value) {
        values.put(key, value);
    }

    public boolean containsKey(String key) {
        return values.containsKey(key);
    }

    public Object get(String key) {
        return values.get(key);
    }

    public Set<String> keys() {
        return Collections.unmodifiableSet(values.keySet());
    }

    /**
     * Returns a read-only view of the current values.
     *
     * @return live unmodifiable view
     */
    public Map<String, Object> asMap() {
        return Collections.unmodifiableMap(values);
    }

    /**
     * Returns an independent copy, used to branch per-request contexts off the
     * context built during {@code pipeline_init}.
     *
     * @return copy of this context
     */
    public PipelineContext copy() {
        return new PipelineContext(values);
    }

    @Override
    public String toString() {
        return "PipelineContext" + values.keySet();
    }
}
