package com.syntaxlens.core.css;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link CssGrammar}.
 */
class CssGrammarTest {

    @Test
    void atKeyword_serializedAtRules_returnsLowerCaseKeywordWithoutAt() {
        assertThat(CssGrammar.atKeyword("@import url(a.css);")).isEqualTo("import");
        assertThat(CssGrammar.atKeyword("@font-face{font-family:x}")).isEqualTo("font-face");
        assertThat(CssGrammar.atKeyword("@MEDIA print{a{color:red}}")).isEqualTo("media");
        assertThat(CssGrammar.atKeyword("a{color:red}")).isEmpty();
    }

    @Test
    void atPrelude_serializedAtRules_returnsTextBeforeBlockOrSemicolon() {
        assertThat(CssGrammar.atPrelude("@import url(a.css);", "import")).isEqualTo("url(a.css)");
        assertThat(CssGrammar.atPrelude("@keyframes spin{from{opacity:0}}", "keyframes")).isEqualTo("spin");
        assertThat(CssGrammar.atPrelude("@font-face{font-family:x}", "font-face")).isEmpty();
    }

    @Test
    void read_wellFormedStylesheet_reportsNoErrors() {
        List<String> errors = new ArrayList<>();

        assertThat(new CssGrammar().read("a { color: red; }", errors)).isNotNull();
        assertThat(errors).isEmpty();
    }

    @Test
    void readDeclarations_blankInput_returnsEmptyList() {
        assertThat(new CssGrammar().readDeclarations("  ")).isEmpty();
    }

    @Test
    void readDeclarations_onlyMalformedEntries_returnsEmptyList() {
        assertThat(new CssGrammar().readDeclarations("width 10px; :;")).isEmpty();
    }

    @Test
    void splitDeclarations_semicolonsInsideStringsAndParens_areKept() {
        List<String> entries = CssGrammar.splitDeclarations(
            "content: \"a;b\"; background: url(data:image/png;base64,xyz); ; margin: 0");

        assertThat(entries).containsExactly(
            "content: \"a;b\"", "background: url(data:image/png;base64,xyz)", "margin: 0");
    }
}
