package com.syntaxlens.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A function found in a JavaScript syntax tree.
 *
 * <p>Example:
 * <pre>{@code
 * async function load(url, options) { ... }   // DECLARATION, "load", [url, options], async
 * const add = (a, b) => a + b;                // ARROW, no name, [a, b]
 * }</pre>
 *
 * @param kind declaration, expression or arrow
 * @param name function name; null for arrows and anonymous expressions
 * @param params names of plain identifier parameters; destructured, rest and
 *               defaulted parameters are left out
 * @param isAsync true for {@code async} functions
 * @param isGenerator true for {@code function*}; always false for arrows
 */
public record FunctionInfo(
    FunctionKind kind,
    String name,
    List<String> params,
    boolean isAsync,
    boolean isGenerator
) {
    public FunctionInfo {
        Objects.requireNonNull(kind, "kind must not be null");
        params = params != null ? List.copyOf(params) : List.of();
        if (kind == FunctionKind.ARROW) {
            name = null;
            isGenerator = false;
        }
    }

    /**
     * @return true if the function carries a name
     */
    public boolean hasName() {
        return name != null && !name.isEmpty();
    }
}
