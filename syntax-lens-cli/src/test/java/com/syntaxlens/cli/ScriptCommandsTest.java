package com.syntaxlens.cli;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link AstCommand} and {@link TokensCommand}.
 */
class ScriptCommandsTest {

    @TempDir
    Path tempDir;

    @Test
    void ast_script_printsProgramJson() throws IOException {
        Path file = Files.writeString(tempDir.resolve("a.js"), "let a = 1;");

        CommandTestSupport.Execution execution = CommandTestSupport.run("ast", file.toString(), "--indent", "0");

        assertThat(execution.exitCode()).isEqualTo(ExitCodes.OK);
        assertThat(execution.output()).startsWith("{\"type\":\"Program\"").contains("\"VariableDeclaration\"");
    }

    @Test
    void ast_moduleFlag_parsesAsModule() throws IOException {
        Path file = Files.writeString(tempDir.resolve("m.js"), "export const a = 1;");

        CommandTestSupport.Execution execution = CommandTestSupport.run("ast", file.toString(), "--module");

        assertThat(execution.exitCode()).isEqualTo(ExitCodes.OK);
        assertThat(execution.output()).contains("\"sourceType\" : \"module\"");
    }

    @Test
    void ast_syntaxError_exitsOne() throws IOException {
        Path file = Files.writeString(tempDir.resolve("bad.js"), "function (");

        assertThat(CommandTestSupport.run("ast", file.toString()).exitCode()).isEqualTo(ExitCodes.INVALID);
    }

    @Test
    void tokens_printsPositionTypeAndValue() throws IOException {
        Path file = Files.writeString(tempDir.resolve("a.js"), "var x = 'y';");

        CommandTestSupport.Execution execution = CommandTestSupport.run("tokens", file.toString());

        assertThat(execution.exitCode()).isEqualTo(ExitCodes.OK);
        assertThat(execution.output().lines())
            .containsExactly("1:0\tKeyword\tvar", "1:4\tIdentifier\tx", "1:6\tPunctuator\t=",
                "1:8\tString\t'y'", "1:11\tPunctuator\t;");
    }

    @Test
    void tokens_cssFile_exitsTwo() throws IOException {
        Path file = Files.writeString(tempDir.resolve("a.css"), "a {}");

        assertThat(CommandTestSupport.run("tokens", file.toString()).exitCode()).isEqualTo(ExitCodes.UNSUPPORTED);
    }
}
