package com.pipekit.core.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ConfigLoader}.
 */
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void load_validYaml_returnsConfig() throws IOException {
        Path configFile = tempDir.resolve("pipekit.yaml");
        Files.writeString(configFile, """
            name: "restaurant-bot"
            language: "de"
            pipeline:
              - nlp_basic
              - ~
              - tokenizer_whitespace
            settings:
              max_tokens: 64
              stopwords: [der, die, das]
            requirements: "requirements-components.txt"
            unknown_field: ignored
            """);

        PipelineConfig config = ConfigLoader.load(configFile);

        assertThat(config.name()).isEqualTo("restaurant-bot");
        assertThat(config.language()).isEqualTo("de");
        assertThat(config.pipeline()).containsExactly("nlp_basic", null, "tokenizer_whitespace");
        assertThat(config.settings()).containsEntry("max_tokens", 64);
        assertThat(config.requirements()).isEqualTo("requirements-components.txt");
    }

    @Test
    void load_templateOnly_returnsConfigWithNulls() throws IOException {
        Path configFile = tempDir.resolve("pipekit.yaml");
        Files.writeString(configFile, """
            template: dictionary
            """);

        PipelineConfig config = ConfigLoader.load(configFile);

        assertThat(config.template()).isEqualTo("dictionary");
        assertThat(config.pipeline()).isNull();
        assertThat(config.language()).isNull();
        assertThat(config.asMap()).containsEntry("language", PipelineConfig.DEFAULT_LANGUAGE);
    }

    @Test
    void load_missingFile_returnsDefaults() {
        PipelineConfig config = ConfigLoader.load(tempDir.resolve("nonexistent.yaml"));

        assertThat(config).isEqualTo(PipelineConfig.defaults());
    }

    @Test
    void load_invalidYaml_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("pipekit.yaml");
        Files.writeString(configFile, """
            pipeline: [nlp_basic
            settings: {{{
            """);

        assertThat(ConfigLoader.load(configFile)).isEqualTo(PipelineConfig.defaults());
    }

    @Test
    void load_emptyFile_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("pipekit.yaml");
        Files.writeString(configFile, "");

        assertThat(ConfigLoader.load(configFile)).isEqualTo(PipelineConfig.defaults());
    }

    @Test
    void load_directory_returnsDefaults() {
        assertThat(ConfigLoader.load(tempDir)).isEqualTo(PipelineConfig.defaults());
    }
}
