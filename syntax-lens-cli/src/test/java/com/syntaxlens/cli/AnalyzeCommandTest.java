package com.syntaxlens.cli;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link AnalyzeCommand}.
 */
class AnalyzeCommandTest {

    @TempDir
    Path tempDir;

    private Path config;

    @BeforeEach
    void writeConfig() throws IOException {
        config = Files.writeString(tempDir.resolve("syntaxlens.yaml"), """
            output:
              colors: false
            """);
    }

    @Test
    void analyze_cssConsole_printsSelectors() throws IOException {
        Path file = Files.writeString(tempDir.resolve("site.css"), ".card { color: blue; }");

        CommandTestSupport.Execution execution = CommandTestSupport.run(
            "analyze", file.toString(), "-c", config.toString());

        assertThat(execution.exitCode()).isEqualTo(ExitCodes.OK);
        assertThat(execution.output()).contains("site.css (css)").contains("- .card").contains("- blue");
    }

    @Test
    void analyze_javaScriptJson_printsReport() throws IOException {
        Path file = Files.writeString(tempDir.resolve("app.js"), "function hello(name) { return name; }");

        CommandTestSupport.Execution execution = CommandTestSupport.run(
            "analyze", file.toString(), "--format", "json", "-c", config.toString());

        assertThat(execution.exitCode()).isEqualTo(ExitCodes.OK);
        assertThat(execution.output()).contains("\"source\" : \"app.js\"").contains("\"hello\"");
    }

    @Test
    void analyze_unparsableJavaScript_exitsOne() throws IOException {
        Path file = Files.writeString(tempDir.resolve("bad.js"), "function (");

        CommandTestSupport.Execution execution = CommandTestSupport.run(
            "analyze", file.toString(), "-c", config.toString());

        assertThat(execution.exitCode()).isEqualTo(ExitCodes.INVALID);
        assertThat(execution.output()).contains("error: Failed to parse JavaScript");
    }

    @Test
    void analyze_unknownFormat_exitsTwo() throws IOException {
        Path file = Files.writeString(tempDir.resolve("site.css"), "a { color: red; }");

        assertThat(CommandTestSupport.run("analyze", file.toString(), "-f", "xml", "-c", config.toString()).exitCode())
            .isEqualTo(ExitCodes.UNSUPPORTED);
    }

    @Test
    void analyze_unsupportedFile_exitsTwo() throws IOException {
        Path file = Files.writeString(tempDir.resolve("readme.md"), "# title");

        assertThat(CommandTestSupport.run("analyze", file.toString(), "-c", config.toString()).exitCode())
            .isEqualTo(ExitCodes.UNSUPPORTED);
    }
}
