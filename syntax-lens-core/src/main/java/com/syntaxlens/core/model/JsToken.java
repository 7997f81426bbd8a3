package com.syntaxlens.core.model;

/**
 * A lexical token of JavaScript source.
 *
 * @param type token class: Boolean, Identifier, Keyword, Null, Numeric, Punctuator,
 *             String, RegularExpression or Template
 * @param value raw token text; string tokens keep their quotes
 * @param range character offsets, may be null
 * @param loc line/column span, may be null
 */
public record JsToken(
    String type,
    String value,
    SourceRange range,
    SourceLocation loc
) {
    public static final String IDENTIFIER = "Identifier";
    public static final String STRING = "String";

    public boolean is(String tokenType) {
        return tokenType.equals(type);
    }
}
