package com.syntaxlens.core.model;

/**
 * Line/column span of a token or comment.
 *
 * @param start first position
 * @param end position just past the last character
 */
public record SourceLocation(SourcePosition start, SourcePosition end) {}
