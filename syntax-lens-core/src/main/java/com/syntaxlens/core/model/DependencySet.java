package com.syntaxlens.core.model;

import java.util.List;

/**
 * Module dependencies of a JavaScript source, in encounter order, duplicates kept.
 *
 * @param imports sources of ES module import declarations
 * @param requires string arguments of CommonJS {@code require} calls
 */
public record DependencySet(
    List<String> imports,
    List<String> requires
) {
    public DependencySet {
        imports = imports != null ? List.copyOf(imports) : List.of();
        requires = requires != null ? List.copyOf(requires) : List.of();
    }

    public static DependencySet empty() {
        return new DependencySet(List.of(), List.of());
    }

    /**
     * @return true if neither imports nor requires were found
     */
    public boolean isEmpty() {
        return imports.isEmpty() && requires.isEmpty();
    }
}
