package com.syntaxlens.core.model;

import java.util.Locale;

/**
 * Keyword of a variable declaration statement.
 */
public enum DeclarationKind {
    CONST,
    LET,
    VAR;

    /**
     * @return the keyword as written in source
     */
    public String keyword() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a declaration keyword.
     *
     * @param keyword "const", "let" or "var"
     * @return the kind
     * @throws IllegalArgumentException for any other keyword
     */
    public static DeclarationKind fromKeyword(String keyword) {
        if (keyword == null) {
            throw new IllegalArgumentException("Declaration keyword must not be null");
        }
        return valueOf(keyword.toUpperCase(Locale.ROOT));
    }
}
