package com.syntaxlens.core.model;

import java.util.Objects;

/**
 * A single {@code property: value} pair from a CSS rule body.
 *
 * @param property property name as written in the source
 * @param value serialized value without the {@code !important} marker
 * @param important true if the declaration carried {@code !important}
 */
public record CssDeclaration(
    String property,
    String value,
    boolean important
) {
    public CssDeclaration {
        Objects.requireNonNull(property, "property must not be null");
        if (value == null) {
            value = "";
        }
    }

    /**
     * Renders the declaration the way a rule body writes it, without the trailing semicolon.
     *
     * @return {@code property: value} with {@code !important} appended when set
     */
    public String toCssText() {
        return property + ": " + value + (important ? " !important" : "");
    }
}
