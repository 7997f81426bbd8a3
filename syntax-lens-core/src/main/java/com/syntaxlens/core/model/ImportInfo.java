package com.syntaxlens.core.model;

import java.util.List;

/**
 * An ES module import declaration.
 *
 * <p>Example:
 * <pre>{@code
 * import React, { useState } from 'react';
 * // source = "react", specifiers = [DEFAULT React, NAMED useState]
 * }</pre>
 *
 * @param source module specifier string
 * @param specifiers bindings in source order; empty for side-effect imports
 */
public record ImportInfo(
    String source,
    List<ImportSpecifier> specifiers
) {
    public ImportInfo {
        specifiers = specifiers != null ? List.copyOf(specifiers) : List.of();
    }
}
