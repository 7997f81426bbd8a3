package com.syntaxlens.cli;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ListCommand} and the root command.
 */
class ListCommandTest {

    @Test
    void list_analyzers_printsRegisteredAnalyzers() {
        CommandTestSupport.Execution execution = CommandTestSupport.run("list", "analyzers");

        assertThat(execution.exitCode()).isZero();
        assertThat(execution.output())
            .contains("(ID: css)")
            .contains("(ID: javascript)")
            .contains("Extensions: [cjs, js, jsx, mjs]");
    }

    @Test
    void list_renderers_printsRendererIds() {
        CommandTestSupport.Execution execution = CommandTestSupport.run("list", "renderers");

        assertThat(execution.exitCode()).isZero();
        assertThat(execution.output()).contains("• console").contains("• json");
    }

    @Test
    void list_unknownType_exitsOne() {
        assertThat(CommandTestSupport.run("list", "widgets").exitCode()).isEqualTo(1);
    }

    @Test
    void root_withoutSubcommand_printsBanner() {
        CommandTestSupport.Execution execution = CommandTestSupport.run();

        assertThat(execution.exitCode()).isZero();
        assertThat(execution.output()).contains("syntax-lens - Structural analysis");
    }

    @Test
    void root_quiet_suppressesBanner() {
        assertThat(CommandTestSupport.run("-q").output()).isEmpty();
    }
}
