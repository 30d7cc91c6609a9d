package com.codesentinel.core.config;

import com.codesentinel.core.model.Category;
import com.codesentinel.core.scoring.SeverityWeights;
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
        Path configFile = tempDir.resolve("codesentinel.yaml");
        Files.writeString(configFile, """
            analysis:
              categories:
                - security
                - performance
                - code_smells
              disabled:
                - performance

            scoring:
              weights:
                critical: 40
                info: 0

            engine:
              parallelism: 4

            output:
              format: markdown
              colors: false
            """);

        SentinelConfig config = ConfigLoader.load(configFile);

        assertThat(config.analysis().toOptions().enabledCategories())
            .containsExactlyInAnyOrder(Category.SECURITY, Category.QUALITY);
        assertThat(config.scoring().weights().toSeverityWeights())
            .isEqualTo(new SeverityWeights(40, 15, 5, 0));
        assertThat(config.engine().parallelism()).isEqualTo(4);
        assertThat(config.output().format()).isEqualTo("markdown");
        assertThat(config.output().colors()).isFalse();
    }

    @Test
    void load_minimalYaml_fillsDefaults() throws IOException {
        Path configFile = tempDir.resolve("codesentinel.yaml");
        Files.writeString(configFile, """
            output:
              format: json
            """);

        SentinelConfig config = ConfigLoader.load(configFile);

        assertThat(config.output().format()).isEqualTo("json");
        assertThat(config.output().colors()).isTrue();
        assertThat(config.analysis().toOptions().enabledCategories()).containsExactlyInAnyOrder(Category.values());
        assertThat(config.scoring().weights().toSeverityWeights()).isEqualTo(SeverityWeights.defaults());
        assertThat(config.engine().parallelism()).isEqualTo(1);
    }

    @Test
    void load_fileDoesNotExist_returnsDefaults() {
        SentinelConfig config = ConfigLoader.load(tempDir.resolve("nonexistent.yaml"));

        assertThat(config).isEqualTo(SentinelConfig.defaults());
    }

    @Test
    void load_invalidYaml_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("codesentinel.yaml");
        Files.writeString(configFile, "invalid: yaml: syntax: [[[");

        assertThat(ConfigLoader.load(configFile)).isEqualTo(SentinelConfig.defaults());
    }

    @Test
    void load_unknownCategory_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("codesentinel.yaml");
        Files.writeString(configFile, """
            analysis:
              categories:
                - astrology
            """);

        assertThat(ConfigLoader.load(configFile)).isEqualTo(SentinelConfig.defaults());
    }

    @Test
    void load_negativeWeight_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("codesentinel.yaml");
        Files.writeString(configFile, """
            scoring:
              weights:
                warning: -5
            """);

        assertThat(ConfigLoader.load(configFile)).isEqualTo(SentinelConfig.defaults());
    }

    @Test
    void loadFromDirectory_withoutFile_returnsDefaults() {
        assertThat(ConfigLoader.loadFromDirectory(tempDir)).isEqualTo(SentinelConfig.defaults());
    }

    @Test
    void loadFromDirectory_withFile_loadsIt() throws IOException {
        Files.writeString(tempDir.resolve(ConfigLoader.DEFAULT_FILE_NAME), """
            engine:
              parallelism: 2
            """);

        assertThat(ConfigLoader.loadFromDirectory(tempDir).engine().parallelism()).isEqualTo(2);
    }
}
