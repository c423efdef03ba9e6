package com.pathwaygraph.core.config;

import com.pathwaygraph.core.generator.Orientation;
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
        Path configFile = tempDir.resolve("pathwaygraph.yaml");
        Files.writeString(configFile, """
            diagrams:
              styling: false
              orientation: horizontal
              formats:
                - dot

            output:
              directory: "./out"
              console: true
            """);

        ProjectConfig config = ConfigLoader.load(configFile);

        assertThat(config.diagrams().styling()).isFalse();
        assertThat(config.diagrams().orientation()).isEqualTo("horizontal");
        assertThat(config.diagrams().formats()).containsExactly("dot");
        assertThat(config.output().directory()).isEqualTo("./out");
        assertThat(config.output().isConsole()).isTrue();
    }

    @Test
    void load_minimalYaml_fillsMissingSectionsWithDefaults() throws IOException {
        Path configFile = tempDir.resolve("pathwaygraph.yaml");
        Files.writeString(configFile, """
            output:
              console: true
            """);

        ProjectConfig config = ConfigLoader.load(configFile);

        assertThat(config.output().isConsole()).isTrue();
        assertThat(config.diagrams().formats()).containsExactly("mermaid", "dot");
        assertThat(config.output().directory()).isEqualTo("./pathway-diagrams");
    }

    @Test
    void load_outputSectionWithoutDirectory_usesDefaultDirectory() throws IOException {
        Path configFile = tempDir.resolve("pathwaygraph.yaml");
        Files.writeString(configFile, """
            output:
              console: false
            """);

        ProjectConfig config = ConfigLoader.load(configFile);

        assertThat(config.output().directory()).isEqualTo(ProjectConfig.OutputConfig.DEFAULT_DIRECTORY);
        assertThat(config.output().isConsole()).isFalse();
    }

    @Test
    void load_unknownKeys_areIgnored() throws IOException {
        Path configFile = tempDir.resolve("pathwaygraph.yaml");
        Files.writeString(configFile, """
            project:
              name: "Syncope"
            output:
              directory: "./syncope"
              owner: "ED"
            theme: dark
            """);

        assertThat(ConfigLoader.load(configFile).output().directory()).isEqualTo("./syncope");
    }

    @Test
    void load_nonExistentFile_returnsDefaults() {
        ProjectConfig config = ConfigLoader.load(tempDir.resolve("missing.yaml"));

        assertThat(config).isEqualTo(ProjectConfig.defaults());
    }

    @Test
    void load_directory_returnsDefaults() {
        assertThat(ConfigLoader.load(tempDir)).isEqualTo(ProjectConfig.defaults());
    }

    @Test
    void load_emptyFile_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("pathwaygraph.yaml");
        Files.writeString(configFile, "");

        assertThat(ConfigLoader.load(configFile)).isEqualTo(ProjectConfig.defaults());
    }

    @Test
    void load_invalidYaml_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("pathwaygraph.yaml");
        Files.writeString(configFile, "project: [unclosed");

        ProjectConfig config = ConfigLoader.load(configFile);

        assertThat(config).isEqualTo(ProjectConfig.defaults());
        assertThat(config.diagrams().toGeneratorConfig("pathway").orientation()).isEqualTo(Orientation.VERTICAL);
    }
}
