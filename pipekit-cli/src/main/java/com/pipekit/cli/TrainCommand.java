package com.pipekit.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pipekit.core.builder.ComponentBuilder;
import com.pipekit.core.config.ConfigLoader;
import com.pipekit.core.config.PipelineConfig;
import com.pipekit.core.dependency.DependencyChecker;
import com.pipekit.core.model.ModelMetadata;
import com.pipekit.core.model.TrainingData;
import com.pipekit.core.pipeline.Trainer;
import com.pipekit.core.registry.ComponentRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.Callable;

/**
 * Command to train a pipeline and persist the model.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * pipekit train data/training.json -c pipekit.yaml -o models/current
 * }</pre>
 *
 * <p>Training data is JSON of the form
 * {@code {"examples": [{"text": "...", "intent": "...", "entities": [...]}]}}.
 */
@Command(
    name = "train",
    description = "Train a pipeline and persist the model",
    mixinStandardHelpOptions = true
)
public class TrainCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(TrainCommand.class);
    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();

    @Parameters(index = "0", description = "Training data (JSON)")
    private Path dataFile;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: pipekit.yaml)"
    )
    private Path configPath = Paths.get("pipekit.yaml");

    @Option(
        names = {"-o", "--output"},
        description = "Model directory (default: models/<name>)"
    )
    private Path outputDir;

    @Option(
        names = {"-r", "--requirements"},
        description = "Requirements manifest used for install hints (overrides config)"
    )
    private Path requirements;

    @Override
    public Integer call() {
        try {
            PipelineConfig config = ConfigLoader.load(configPath);
            TrainingData data = JSON_MAPPER.readValue(dataFile.toFile(), TrainingData.class);
            System.out.println("Training on " + data.examples().size() + " examples");

            ComponentBuilder builder = new ComponentBuilder(ComponentRegistry.defaultRegistry(),
                DependencyChecker.classpath(), true, ValidateCommand.manifestPath(configPath, config, requirements));
            Trainer trainer = new Trainer(config, builder);
            trainer.train(data);

            Path modelDir = outputDir != null ? outputDir : Paths.get("models", config.name());
            ModelMetadata metadata = trainer.persist(modelDir);
            System.out.println("✓ Trained pipeline " + metadata.pipeline());
            System.out.println("✓ Model written to: " + modelDir.toAbsolutePath());
            return 0;

        } catch (Exception e) {
            log.error("Training failed", e);
            System.err.println("✗ Training failed: " + e.getMessage());
            return 1;
        }
    }
}
