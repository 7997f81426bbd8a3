package com.syntaxlens.core.css;

import com.syntaxlens.core.model.ValidationResult;

import java.util.List;
import java.util.Map;

/**
 * Static shortcuts over a shared {@link CssRuleWalker}.
 */
public final class Stylesheets {

    private static final CssRuleWalker WALKER = new CssRuleWalker();

    private Stylesheets() {
    }

    public static List<String> extractCssColors(String text) {
        return WALKER.extractColors(text);
    }

    public static Map<String, String> parseInlineStyle(String text) {
        return WALKER.parseInlineStyle(text);
    }

    public static ValidationResult validateCss(String text) {
        return WALKER.validateCss(text);
    }
}
