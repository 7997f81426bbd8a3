package com.syntaxlens.core.css;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link Stylesheets}.
 */
class StylesheetsTest {

    @Test
    void extractCssColors_stylesheet_returnsColors() {
        assertThat(Stylesheets.extractCssColors("a { color: red; } b { background: blue; }"))
            .containsExactly("red", "blue");
    }

    @Test
    void parseInlineStyle_styleAttribute_returnsPropertyMap() {
        assertThat(Stylesheets.parseInlineStyle("color: red; font-size: 14px;"))
            .containsEntry("color", "red")
            .containsEntry("font-size", "14px");
    }

    @Test
    void validateCss_wellFormed_isValidWithoutMessage() {
        assertThat(Stylesheets.validateCss("p { margin: 0; }").message()).isNull();
    }
}
