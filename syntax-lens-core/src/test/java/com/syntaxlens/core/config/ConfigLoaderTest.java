package com.syntaxlens.core.config;

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
        Path configFile = tempDir.resolve("syntaxlens.yaml");
        Files.writeString(configFile, """
            javascript:
              jsx: true
              tolerant: false

            css:
              indent: "    "
              browserCompliant: false

            output:
              format: json
              jsonIndent: 4
              colors: false
            """);

        AnalyzerConfig config = ConfigLoader.load(configFile);

        assertThat(config.javascript().jsx()).isTrue();
        assertThat(config.javascript().tolerant()).isFalse();
        assertThat(config.css().indent()).isEqualTo("    ");
        assertThat(config.css().browserCompliant()).isFalse();
        assertThat(config.output().format()).isEqualTo("json");
        assertThat(config.output().jsonIndent()).isEqualTo(4);
        assertThat(config.output().colors()).isFalse();
    }

    @Test
    void load_partialYaml_fillsMissingSectionsWithDefaults() throws IOException {
        Path configFile = tempDir.resolve("syntaxlens.yaml");
        Files.writeString(configFile, """
            output:
              format: json
            """);

        AnalyzerConfig config = ConfigLoader.load(configFile);

        assertThat(config.output().format()).isEqualTo("json");
        assertThat(config.output().jsonIndent()).isEqualTo(2);
        assertThat(config.javascript()).isEqualTo(AnalyzerConfig.JavaScriptConfig.defaults());
        assertThat(config.css()).isEqualTo(AnalyzerConfig.CssConfig.defaults());
    }

    @Test
    void load_unknownKeys_areIgnored() throws IOException {
        Path configFile = tempDir.resolve("syntaxlens.yaml");
        Files.writeString(configFile, """
            project:
              name: ignored
            javascript:
              jsx: true
              ecmaVersion: 2020
            """);

        AnalyzerConfig config = ConfigLoader.load(configFile);

        assertThat(config.javascript().jsx()).isTrue();
        assertThat(config.javascript().tolerant()).isTrue();
    }

    @Test
    void load_nonExistentFile_returnsDefaults() {
        Path configFile = tempDir.resolve("nonexistent.yaml");

        AnalyzerConfig config = ConfigLoader.load(configFile);

        assertThat(config).isEqualTo(AnalyzerConfig.defaults());
    }

    @Test
    void load_nullPath_returnsDefaults() {
        assertThat(ConfigLoader.load(null)).isEqualTo(AnalyzerConfig.defaults());
    }

    @Test
    void load_invalidYaml_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("syntaxlens.yaml");
        Files.writeString(configFile, "javascript: [unclosed\n  jsx: {");

        AnalyzerConfig config = ConfigLoader.load(configFile);

        assertThat(config).isEqualTo(AnalyzerConfig.defaults());
    }

    @Test
    void load_emptyFile_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("syntaxlens.yaml");
        Files.writeString(configFile, "");

        assertThat(ConfigLoader.load(configFile)).isEqualTo(AnalyzerConfig.defaults());
    }

    @Test
    void load_directory_returnsDefaults() {
        assertThat(ConfigLoader.load(tempDir)).isEqualTo(AnalyzerConfig.defaults());
    }

    @Test
    void loadFromDirectory_findsDefaultFileName() throws IOException {
        Files.writeString(tempDir.resolve(ConfigLoader.DEFAULT_FILE_NAME), """
            css:
              indent: "\\t"
            """);

        AnalyzerConfig config = ConfigLoader.loadFromDirectory(tempDir);

        assertThat(config.css().indent()).isEqualTo("\t");
    }
}
