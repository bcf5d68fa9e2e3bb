package com.pipekit.cli;

import com.pipekit.core.PipelineException;
import com.pipekit.core.builder.ComponentBuilder;
import com.pipekit.core.config.ConfigLoader;
import com.pipekit.core.config.PipelineConfig;
import com.pipekit.core.dependency.DependencyChecker;
import com.pipekit.core.pipeline.Trainer;
import com.pipekit.core.registry.ComponentRegistry;
import com.pipekit.core.registry.PipelineTemplates;
import com.pipekit.core.registry.RegistryValidator;
import com.pipekit.core.registry.ValidationReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Command to validate the component registry and a pipeline configuration.
 *
 * <p>Runs the registry checks (unique names, template validity, lifecycle soundness)
 * and then resolves the configured pipeline exactly as training would, without running
 * any stage. Exits with 1 on any problem.
 */
@Command(
    name = "validate",
    description = "Validate the component registry and a pipeline configuration",
    mixinStandardHelpOptions = true
)
public class ValidateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ValidateCommand.class);

    @Parameters(index = "0", description = "Config file to validate", defaultValue = "pipekit.yaml")
    private Path configFile;

    @Option(
        names = {"-r", "--requirements"},
        description = "Requirements manifest used for install hints (overrides config)"
    )
    private Path requirements;

    @Override
    public Integer call() {
        log.info("Validating configuration: {}", configFile);
        PipelineConfig config = ConfigLoader.load(configFile);

        ValidationReport report = RegistryValidator.validate(
            ComponentRegistry.discoverFactories(), PipelineTemplates.DEFAULTS, config.asMap());
        if (!report.isValid()) {
            System.err.println("✗ Component registry is invalid:");
            report.errors().forEach(error -> System.err.println("  - " + error));
            return 1;
        }
        System.out.println("✓ Component registry is valid");

        try {
            ComponentBuilder builder = new ComponentBuilder(
                ComponentRegistry.defaultRegistry(), DependencyChecker.classpath(), true,
                manifestPath(configFile, config, requirements));
            Trainer trainer = new Trainer(config, builder);
            System.out.println("✓ Pipeline resolves: " + trainer.pipeline().stream()
                .map(component -> component.name())
                .toList());
            return 0;
        } catch (PipelineException | IllegalArgumentException e) {
            log.debug("Pipeline resolution failed", e);
            System.err.println("✗ Pipeline is invalid: " + e.getMessage());
            return 1;
        }
    }

    /**
     * Resolves the requirements manifest for a command. A relative path in the
     * configuration is resolved against the configuration file's directory.
     *
     * @param configFile configuration file the config was loaded from
     * @param config loaded configuration
     * @param override manifest given on the command line, or null
     * @return manifest path, or null when none is configured
     */
    static Path manifestPath(Path configFile, PipelineConfig config, Path override) {
        if (override != null) {
            return override;
        }
        if (config.requirements() == null) {
            return null;
        }
        Path configured = Path.of(config.requirements());
        Path parent = configFile.toAbsolutePath().getParent();
        return configured.isAbsolute() || parent == null ? configured : parent.resolve(configured);
    }
}
