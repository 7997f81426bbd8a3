package com.syntaxlens.core.model;

/**
 * One occurrence of a looked-up property.
 *
 * @param selector selector of the rule holding the declaration
 * @param value serialized declaration value
 */
public record PropertyMatch(
    String selector,
    String value
) {}
