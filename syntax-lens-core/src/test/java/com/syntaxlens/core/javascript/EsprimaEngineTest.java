package com.syntaxlens.core.javascript;

import com.syntaxlens.core.syntax.SyntaxNode;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link EsprimaEngine}.
 */
class EsprimaEngineTest {

    private static EsprimaEngine engine;

    @BeforeAll
    static void startEngine() {
        engine = new EsprimaEngine();
    }

    @AfterAll
    static void stopEngine() {
        engine.close();
    }

    @Test
    void constructor_missingParserResource_throwsIllegalStateException() {
        assertThatThrownBy(() -> new EsprimaEngine("webjars/missing/esprima.js"))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("webjars/missing/esprima.js");
    }

    @Test
    void parse_withRangeAndLoc_attachesPositions() {
        SyntaxNode program = engine.parse("let a = 1;", JsGrammar.SCRIPT, JsParseOptions.defaults());

        SyntaxNode declaration = program.nodes("body").get(0);
        assertThat(declaration.type()).isEqualTo("VariableDeclaration");
        assertThat(declaration.list("range")).hasSize(2);
        assertThat(declaration.node("loc").node("start").get("line")).isEqualTo(1);
    }

    @Test
    void parse_regexLiteral_hasNullValueAndRegexDetails() {
        SyntaxNode program = engine.parse("/ab+c/gi;", JsGrammar.SCRIPT, JsParseOptions.strict());

        SyntaxNode literal = program.nodes("body").get(0).node("expression");
        assertThat(literal.get("value")).isNull();
        assertThat(literal.node("regex").string("pattern")).isEqualTo("ab+c");
        assertThat(literal.node("regex").string("flags")).isEqualTo("gi");
    }

    @Test
    void parse_syntaxError_carriesPosition() {
        assertThatThrownBy(() -> engine.parse("var = 1;", JsGrammar.SCRIPT, JsParseOptions.strict()))
            .isInstanceOfSatisfying(JsParseException.class, e -> {
                assertThat(e.getLineNumber()).isEqualTo(1);
                assertThat(e.getIndex()).isEqualTo(4);
                assertThat(e.getDescription()).isNotBlank();
                assertThat(e.getMessage()).startsWith("Line 1: ");
            });
    }

    @Test
    void tokenize_template_returnsTokenNodes() {
        List<SyntaxNode> tokens = engine.tokenize("const s = `a${b}c`;");

        assertThat(tokens).isNotEmpty();
        assertThat(tokens.get(0).type()).isEqualTo("Keyword");
        assertThat(tokens).anyMatch(token -> token.is("Template"));
    }
}
