package com.syntaxlens.core.model;

import java.util.Objects;

/**
 * A class found in a JavaScript syntax tree.
 *
 * @param kind declaration or expression
 * @param name class name; null for anonymous class expressions
 * @param superclassName superclass name, present only when the {@code extends}
 *                       clause is a bare identifier
 */
public record ClassInfo(
    ClassKind kind,
    String name,
    String superclassName
) {
    public ClassInfo {
        Objects.requireNonNull(kind, "kind must not be null");
    }
}
