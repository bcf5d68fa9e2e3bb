package com.pipekit.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pipekit.core.builder.ComponentBuilder;
import com.pipekit.core.config.ConfigLoader;
import com.pipekit.core.config.PipelineConfig;
import com.pipekit.core.dependency.DependencyChecker;
import com.pipekit.core.model.ParseResult;
import com.pipekit.core.pipeline.Interpreter;
import com.pipekit.core.registry.ComponentRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command to parse a text with a persisted model and print the result as JSON.
 */
@Command(
    name = "parse",
    description = "Parse a text with a persisted model",
    mixinStandardHelpOptions = true
)
public class ParseCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ParseCommand.class);
    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();

    @Parameters(index = "0", description = "Model directory")
    private Path modelDir;

    @Parameters(index = "1..*", arity = "1..*", description = "Text to parse")
    private List<String> words;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: pipekit.yaml)"
    )
    private Path configPath = Paths.get("pipekit.yaml");

    @Option(
        names = {"-r", "--requirements"},
        description = "Requirements manifest used for install hints (overrides config)"
    )
    private Path requirements;

    @Override
    public Integer call() {
        try {
            PipelineConfig config = ConfigLoader.load(configPath);
            ComponentBuilder builder = new ComponentBuilder(ComponentRegistry.defaultRegistry(),
                DependencyChecker.classpath(), true, ValidateCommand.manifestPath(configPath, config, requirements));
            Interpreter interpreter = Interpreter.load(modelDir, config, builder);

            ParseResult result = interpreter.parse(String.join(" ", words));
            System.out.println(JSON_MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(result));
            return 0;

        } catch (Exception e) {
            log.error("Parsing failed", e);
            System.err.println("✗ Parsing failed: " + e.getMessage());
            return 1;
        }
    }
}
