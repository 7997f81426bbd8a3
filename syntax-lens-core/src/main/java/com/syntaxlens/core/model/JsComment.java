package com.syntaxlens.core.model;

/**
 * A comment captured while parsing.
 *
 * @param type "Line" or "Block"
 * @param value comment text without the delimiters
 * @param range character offsets, may be null
 * @param loc line/column span, may be null
 */
public record JsComment(
    String type,
    String value,
    SourceRange range,
    SourceLocation loc
) {
    public boolean isBlock() {
        return "Block".equals(type);
    }
}
