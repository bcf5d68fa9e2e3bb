package com.pipekit.core.testing;

import com.pipekit.core.component.Component;
import com.pipekit.core.component.ComponentDescriptor;
import com.pipekit.core.component.ComponentFactory;
import com.pipekit.core.component.LifecycleStage;
import com.pipekit.core.component.StageArguments;
import com.pipekit.core.model.ModelMetadata;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Configurable factory for tests.
 *
 * <p>Counts instantiations, can block or fail them, and produces components that by
 * default provide every declared key with the value {@code "<name>.<key>"} and record
 * each call in {@link #calls()}.
 */
public class StubFactory implements ComponentFactory {

    private final ComponentDescriptor descriptor;
    private final AtomicInteger creations = new AtomicInteger();
    private final AtomicInteger failuresLeft = new AtomicInteger();
    private final Map<LifecycleStage, Function<StageArguments, Map<String, Object>>> behaviors =
        new EnumMap<>(LifecycleStage.class);
    private final List<String> calls = Collections.synchronizedList(new ArrayList<>());
    private volatile CountDownLatch gate;
    private volatile Map<String, Object> lastLoadedState;

    public StubFactory(ComponentDescriptor descriptor) {
        this.descriptor = descriptor;
    }

    public static StubFactory of(ComponentDescriptor descriptor) {
        return new StubFactory(descriptor);
    }

    public StubFactory on(LifecycleStage stage, Function<StageArguments, Map<String, Object>> behavior) {
        behaviors.put(stage, behavior);
        return this;
    }

    public StubFactory failingTimes(int times) {
        failuresLeft.set(times);
        return this;
    }

    public StubFactory blockingUntil(CountDownLatch latch) {
        this.gate = latch;
        return this;
    }

    public int creations() {
        return creations.get();
    }

    public List<String> calls() {
        return calls;
    }

    public Map<String, Object> lastLoadedState() {
        return lastLoadedState;
    }

    @Override
    public ComponentDescriptor descriptor() {
        return descriptor;
    }

    @Override
    public Component create(Map<String, Object> config) {
        creations.incrementAndGet();
        awaitGate();
        if (failuresLeft.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
            throw new IllegalStateException("Stub creation failed for " + descriptor.name());
        }
        return new StubComponent();
    }

    @Override
    public Component load(Map<String, Object> config, Map<String, Object> state, ModelMetadata metadata) {
        lastLoadedState = state;
        return create(config);
    }

    private void awaitGate() {
        CountDownLatch latch = gate;
        if (latch == null) {
            return;
        }
        try {
            if (!latch.await(5, TimeUnit.SECONDS)) {
                throw new IllegalStateException("Gate was not opened");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }

    private final class StubComponent implements Component {

        @Override
        public ComponentDescriptor descriptor() {
            return descriptor;
        }

        @Override
        public Map<String, Object> invoke(LifecycleStage stage, StageArguments args) {
            calls.add(descriptor.name() + "." + stage.id() + args.names());
            Function<StageArguments, Map<String, Object>> behavior = behaviors.get(stage);
            if (behavior != null) {
                return behavior.apply(args);
            }
            Map<String, Object> provided = new HashMap<>();
            descriptor.providesFor(stage).forEach(key -> provided.put(key, descriptor.name() + "." + key));
            return provided;
        }
    }
}
