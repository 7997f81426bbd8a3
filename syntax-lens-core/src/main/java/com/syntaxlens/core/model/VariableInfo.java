package com.syntaxlens.core.model;

import java.util.Objects;

/**
 * One declarator of a {@code const}/{@code let}/{@code var} statement.
 *
 * @param declKind keyword inherited from the enclosing statement
 * @param name bound name; null when the declarator uses a destructuring pattern
 */
public record VariableInfo(
    DeclarationKind declKind,
    String name
) {
    public VariableInfo {
        Objects.requireNonNull(declKind, "declKind must not be null");
    }
}
