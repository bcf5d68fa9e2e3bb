package com.pipekit.cli;

import com.pipekit.PipeKitCLI;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * End-to-end tests of the picocli commands.
 */
class CommandsTest {

    private static final String TRAINING_DATA = """
        {
          "examples": [
            {"text": "hello there", "intent": "greet"},
            {"text": "show me chinese restaurants", "intent": "restaurant_search",
             "entities": [{"entity": "cuisine", "value": "chinese", "start": 8, "end": 15}]},
            {"text": "i want NYC food", "intent": "restaurant_search",
             "entities": [{"entity": "location", "value": "New York City", "start": 7, "end": 10}]}
          ]
        }
        """;

    @TempDir
    Path tempDir;

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();
    private PrintStream originalOut;
    private PrintStream originalErr;

    @BeforeEach
    void captureOutput() {
        originalOut = System.out;
        originalErr = System.err;
        System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
        System.setErr(new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    @AfterEach
    void restoreOutput() {
        System.setOut(originalOut);
        System.setErr(originalErr);
    }

    private int run(String... args) {
        return PipeKitCLI.commandLine().execute(args);
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String stderr() {
        return err.toString(StandardCharsets.UTF_8);
    }

    @Test
    void list_components_showsEveryRegisteredComponent() {
        int exitCode = run("list", "components");

        assertThat(exitCode).isZero();
        assertThat(stdout())
            .contains("nlp_basic")
            .contains("tokenizer_whitespace")
            .contains("intent_classifier_keyword")
            .contains("ner_dictionary")
            .contains("ner_synonyms")
            .contains("com.fasterxml.jackson.databind.ObjectMapper")
            .contains("Shared per: [language]");
    }

    @Test
    void list_templates_showsAllComponentsTemplate() {
        assertThat(run("list", "templates")).isZero();
        assertThat(stdout()).contains("all_components").contains("keyword").contains("dictionary");
    }

    @Test
    void list_unknownType_fails() {
        assertThat(run("list", "widgets")).isEqualTo(1);
    }

    @Test
    void validate_validConfig_succeeds() throws IOException {
        Path config = writeConfig("template: all_components\n");

        assertThat(run("validate", config.toString())).isZero();
        assertThat(stdout()).contains("Pipeline resolves");
    }

    @Test
    void validate_unknownComponent_failsWithSuggestion() throws IOException {
        Path config = writeConfig("""
            pipeline:
              - nlp_basic
              - tokenizer_whitespaces
            """);

        assertThat(run("validate", config.toString())).isEqualTo(1);
        assertThat(stderr()).contains("tokenizer_whitespaces").contains("tokenizer_whitespace");
    }

    @Test
    void validate_misorderedPipeline_fails() throws IOException {
        Path config = writeConfig("""
            pipeline:
              - nlp_basic
              - intent_classifier_keyword
              - tokenizer_whitespace
            """);

        assertThat(run("validate", config.toString())).isEqualTo(1);
        assertThat(stderr()).contains("intent_classifier_keyword").contains("tokens");
    }

    @Test
    void validate_missingManifest_fails() throws IOException {
        Path config = writeConfig("template: keyword\n");

        int exitCode = run("validate", config.toString(), "--requirements", tempDir.resolve("absent.txt").toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(stderr()).contains("absent.txt");
    }

    @Test
    void validate_shippedExampleConfig_succeeds() throws IOException {
        Path config = tempDir.resolve("pipekit-example.yaml");
        try (InputStream example = PipeKitCLI.class.getResourceAsStream("/pipekit-example.yaml")) {
            assertThat(example).as("Example configuration on the classpath").isNotNull();
            Files.copy(example, config);
        }

        assertThat(run("validate", config.toString())).isZero();
        assertThat(stdout()).contains("Component registry is valid").contains("ner_synonyms");
    }

    @Test
    void train_configuredManifestIsRead() throws IOException {
        Path config = writeConfig("template: keyword\nrequirements: absent-requirements.txt\n");
        Path data = tempDir.resolve("training.json");
        Files.writeString(data, TRAINING_DATA);

        int exitCode = run("train", data.toString(), "-c", config.toString(), "-o", tempDir.resolve("m").toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(stderr()).contains("Training failed").contains("absent-requirements.txt");
    }

    @Test
    void parse_requirementsOptionIsRead() throws IOException {
        Path config = writeConfig("template: keyword\n");
        Path data = tempDir.resolve("training.json");
        Files.writeString(data, TRAINING_DATA);
        Path modelDir = tempDir.resolve("model");
        assertThat(run("train", data.toString(), "-c", config.toString(), "-o", modelDir.toString())).isZero();

        int exitCode = run("parse", modelDir.toString(), "hello",
            "-c", config.toString(), "-r", tempDir.resolve("absent.txt").toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(stderr()).contains("Parsing failed").contains("absent.txt");
    }

    @Test
    void trainThenParse_printsRecognizedIntentAndEntities() throws IOException {
        Path config = writeConfig("template: all_components\n");
        Path data = tempDir.resolve("training.json");
        Files.writeString(data, TRAINING_DATA);
        Path modelDir = tempDir.resolve("model");

        int trainExit = run("train", data.toString(), "-c", config.toString(), "-o", modelDir.toString());
        int parseExit = run("parse", modelDir.toString(), "chinese", "food", "in", "NYC", "-c", config.toString());

        assertThat(trainExit).isZero();
        assertThat(parseExit).isZero();
        assertThat(modelDir.resolve("metadata.json")).exists();
        assertThat(stdout())
            .contains("\"intent\" : \"restaurant_search\"")
            .contains("\"value\" : \"New York City\"");
    }

    @Test
    void train_missingData_fails() throws IOException {
        Path config = writeConfig("template: keyword\n");

        assertThat(run("train", tempDir.resolve("none.json").toString(), "-c", config.toString())).isEqualTo(1);
        assertThat(stderr()).contains("Training failed");
    }

    private Path writeConfig(String yaml) throws IOException {
        Path config = tempDir.resolve("pipekit.yaml");
        Files.writeString(config, "name: test\nlanguage: en\n" + yaml);
        return config;
    }
}
