package com.syntaxlens.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A qualified rule: a selector list followed by a declaration block.
 *
 * <p>Example:
 * <pre>{@code
 * h1, h2 { color: blue; margin: 0 !important; }
 * }</pre>
 *
 * @param selector the entire serialized selector list (a grouped selector stays one string)
 * @param declarations declarations in source order
 */
public record CssRule(
    String selector,
    List<CssDeclaration> declarations
) implements CssTopLevelRule {
    public CssRule {
        Objects.requireNonNull(selector, "selector must not be null");
        declarations = declarations != null ? List.copyOf(declarations) : List.of();
    }

    @Override
    public String prelude() {
        return selector;
    }
}
