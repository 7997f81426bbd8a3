package com.syntaxlens.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A {@code @media} block with the selectors of its directly nested rules.
 *
 * @param condition serialized media query list (e.g., "(max-width: 768px)")
 * @param ruleSelectors selectors of the qualified rules one level inside the block
 */
public record MediaQuery(
    String condition,
    List<String> ruleSelectors
) {
    public MediaQuery {
        Objects.requireNonNull(condition, "condition must not be null");
        ruleSelectors = ruleSelectors != null ? List.copyOf(ruleSelectors) : List.of();
    }
}
