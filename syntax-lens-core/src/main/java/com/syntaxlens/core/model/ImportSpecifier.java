package com.syntaxlens.core.model;

import java.util.Objects;

/**
 * One binding of an import declaration.
 *
 * @param kind default, named or namespace
 * @param importedName exported name on the source module; only set for named specifiers
 * @param localName name bound in the importing module
 */
public record ImportSpecifier(
    SpecifierKind kind,
    String importedName,
    String localName
) {
    public ImportSpecifier {
        Objects.requireNonNull(kind, "kind must not be null");
    }
}
