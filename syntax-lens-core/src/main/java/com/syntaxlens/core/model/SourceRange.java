package com.syntaxlens.core.model;

/**
 * Character offsets of a token or comment, end exclusive.
 *
 * @param start offset of the first character
 * @param end offset just past the last character
 */
public record SourceRange(int start, int end) {

    public int length() {
        return end - start;
    }
}
