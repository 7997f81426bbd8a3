package com.syntaxlens.core.model;

/**
 * @param line 1-based line
 * @param column 0-based column
 */
public record SourcePosition(int line, int column) {}
