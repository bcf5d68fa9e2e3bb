package com.pipekit.core.pipeline;

import com.pipekit.core.builder.ComponentBuilder;
import com.pipekit.core.component.Component;
import com.pipekit.core.component.LifecycleStage;
import com.pipekit.core.config.PipelineConfig;
import com.pipekit.core.model.Entity;
import com.pipekit.core.model.ModelMetadata;
import com.pipekit.core.model.ParseResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Parses texts with a trained pipeline.
 *
 * <p>The context produced by {@code pipeline_init} is kept; every {@link #parse(String)}
 * call branches a fresh copy of it, seeds the {@code process} base keys ({@code text},
 * {@code intent} = null, {@code entities} = empty) and runs the process stage.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * Interpreter interpreter = Interpreter.load(Paths.get("models/current"), config, builder);
 * ParseResult result = interpreter.parse("show me chinese restaurants");
 * }</pre>
 */
public class Interpreter {

    private static final Logger log = LoggerFactory.getLogger(Interpreter.class);

    private final List<Component> pipeline;
    private final PipelineContext initContext;
    private final Map<String, Object> configValues;

    Interpreter(List<Component> pipeline, PipelineContext initContext, Map<String, Object> configValues) {
        this.pipeline = List.copyOf(pipeline);
        this.initContext = initContext;
        this.configValues = configValues;
    }

    /**
     * Loads a persisted model from its directory.
     *
     * @param modelDir model directory holding {@code metadata.json}
     * @param config pipeline configuration
     * @param builder component builder
     * @return ready interpreter
     */
    public static Interpreter load(Path modelDir, PipelineConfig config, ComponentBuilder builder) {
        return load(ModelMetadata.read(modelDir), config, builder);
    }

    /**
     * Restores every persisted component and runs {@code pipeline_init}.
     *
     * <p>All components are restored and the stage ordering is checked before
     * {@code pipeline_init} runs.
     *
     * @param metadata persisted model metadata
     * @param config pipeline configuration
     * @param builder component builder
     * @return ready interpreter
     */
    public static Interpreter load(ModelMetadata metadata, PipelineConfig config, ComponentBuilder builder) {
        Map<String, Object> configValues = config.asMap();
        if (metadata.language() != null && !metadata.language().equals(configValues.get("language"))) {
            log.warn("Model was trained for language '{}' but configuration says '{}'",
                metadata.language(), configValues.get("language"));
        }

        List<String> names = metadata.pipeline();
        List<Component> components = new ArrayList<>();
        for (int i = 0; i < names.size(); i++) {
            builder.loadComponent(names.get(i), configValues, metadata.componentState(i), metadata)
                .ifPresent(components::add);
        }
        Trainer.checkOrderings(components, configValues, false);

        PipelineContext initContext = new PipelineContext();
        StageRunner.run(LifecycleStage.PIPELINE_INIT, components, initContext, configValues);
        log.info("Loaded pipeline {} from {}", Trainer.names(components), metadata.modelDir());
        return new Interpreter(components, initContext, configValues);
    }

    public List<Component> pipeline() {
        return pipeline;
    }

    /**
     * Runs the process stage on a text.
     *
     * @param text text to parse
     * @return recognized intent and entities
     */
    public ParseResult parse(String text) {
        PipelineContext context = initContext.copy();
        Map<String, Object> base = new HashMap<>();
        base.put("text", text);
        base.put("intent", null);
        base.put("entities", List.of());
        context.seed(LifecycleStage.PROCESS, base);

        StageRunner.run(LifecycleStage.PROCESS, pipeline, context, configValues);

        Object intent = context.get("intent");
        return new ParseResult(text, intent == null ? null : intent.toString(), entities(context.get("entities")));
    }

    private static List<Entity> entities(Object value) {
        if (!(value instanceof List<?> list)) {
            return Collections.emptyList();
        }
        return list.stream()
            .filter(Entity.class::isInstance)
            .map(Entity.class::cast)
            .toList();
    }
}
