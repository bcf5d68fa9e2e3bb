package com.pipekit.core.pipeline;

import com.pipekit.core.builder.ComponentBuilder;
import com.pipekit.core.component.Component;
import com.pipekit.core.component.ComponentDescriptor;
import com.pipekit.core.component.LifecycleStage;
import com.pipekit.core.config.PipelineConfig;
import com.pipekit.core.model.ModelMetadata;
import com.pipekit.core.model.TrainingData;
import com.pipekit.core.registry.PipelineTemplates;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Builds a pipeline from configuration and trains it.
 *
 * <p>Construction resolves every configured component through the builder and checks
 * the ordering of every stage. Nothing runs until all of that succeeded: a pipeline
 * either fully resolves or the build fails before any stage executes.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * Trainer trainer = new Trainer(config, new ComponentBuilder(registry));
 * trainer.train(trainingData);
 * ModelMetadata metadata = trainer.persist(Paths.get("models/current"));
 * }</pre>
 */
public class Trainer {

    private static final Logger log = LoggerFactory.getLogger(Trainer.class);

    private final PipelineConfig config;
    private final Map<String, Object> configValues;
    private final List<Component> pipeline;
    private PipelineContext trainedContext;

    public Trainer(PipelineConfig config, ComponentBuilder builder) {
        this(config, builder, PipelineTemplates.DEFAULTS);
    }

    /**
     * Resolves and validates the configured pipeline.
     *
     * @param config pipeline configuration
     * @param builder component builder
     * @param templates templates the configuration may refer to
     * @throws com.pipekit.core.PipelineException if any component cannot be resolved or
     *         any stage's arguments cannot be satisfied in the configured order
     */
    public Trainer(PipelineConfig config, ComponentBuilder builder, PipelineTemplates templates) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.configValues = config.asMap();

        List<Component> components = new ArrayList<>();
        for (String name : config.componentNames(templates)) {
            builder.createComponent(name, configValues).ifPresent(components::add);
        }
        this.pipeline = Collections.unmodifiableList(components);

        checkOrderings(pipeline, configValues, true);
        log.info("Pipeline resolved: {}", names(pipeline));
    }

    public List<Component> pipeline() {
        return pipeline;
    }

    /**
     * Runs {@code pipeline_init} then {@code train} over the pipeline.
     *
     * @param trainingData training data, exposed as {@code training_data}
     * @return the context after training
     */
    public PipelineContext train(TrainingData trainingData) {
        PipelineContext context = new PipelineContext();
        StageRunner.run(LifecycleStage.PIPELINE_INIT, pipeline, context, configValues);

        context.seed(LifecycleStage.TRAIN, Map.of("training_data", trainingData));
        log.info("Training pipeline on {} examples", trainingData.examples().size());
        StageRunner.run(LifecycleStage.TRAIN, pipeline, context, configValues);

        this.trainedContext = context;
        return context;
    }

    /**
     * Runs {@code persist} over the trained pipeline and writes the model metadata.
     *
     * @param modelDir directory to persist into, exposed as {@code model_dir}
     * @return written metadata
     * @throws IllegalStateException if the pipeline has not been trained
     */
    public ModelMetadata persist(Path modelDir) {
        PipelineContext context = requireTrained().copy();
        context.seed(LifecycleStage.PERSIST, Map.of("model_dir", modelDir));

        List<Map<String, Object>> states = new ArrayList<>();
        for (Component component : pipeline) {
            states.add(new LinkedHashMap<>(StageRunner.invoke(LifecycleStage.PERSIST, component, context, configValues)));
        }

        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("name", config.name());
        properties.put(ModelMetadata.LANGUAGE, configValues.get("language"));
        properties.put(ModelMetadata.PIPELINE, names(pipeline));
        properties.put(ModelMetadata.TRAINED_AT, Instant.now().toString());
        properties.put(ModelMetadata.COMPONENTS, states);

        ModelMetadata metadata = new ModelMetadata(properties, null).write(modelDir);
        log.info("Persisted model to {}", modelDir);
        return metadata;
    }

    /**
     * Returns an interpreter over the trained, in-memory pipeline.
     *
     * @return interpreter sharing this trainer's components
     * @throws IllegalStateException if the pipeline has not been trained
     */
    public Interpreter interpreter() {
        requireTrained();
        PipelineContext initContext = new PipelineContext();
        StageRunner.run(LifecycleStage.PIPELINE_INIT, pipeline, initContext, configValues);
        return new Interpreter(pipeline, initContext, configValues);
    }

    /**
     * Checks the ordering of every stage the pipeline will run.
     *
     * @param pipeline components in order
     * @param config static configuration
     * @param training whether train and persist are checked too
     */
    static void checkOrderings(List<Component> pipeline, Map<String, Object> config, boolean training) {
        List<ComponentDescriptor> descriptors = pipeline.stream().map(Component::descriptor).toList();
        Set<String> initKeys = StageRunner.checkOrdering(LifecycleStage.PIPELINE_INIT, descriptors, Set.of(), config);
        if (training) {
            StageRunner.checkOrdering(LifecycleStage.TRAIN, descriptors, initKeys, config);
            StageRunner.checkOrdering(LifecycleStage.PERSIST, descriptors, initKeys, config);
        }
        StageRunner.checkOrdering(LifecycleStage.PROCESS, descriptors, initKeys, config);
    }

    static List<String> names(List<Component> pipeline) {
        return pipeline.stream().map(Component::name).toList();
    }

    private PipelineContext requireTrained() {
        if (trainedContext == null) {
            throw new IllegalStateException("Pipeline has not been trained");
        }
        return trainedContext;
    }
}
