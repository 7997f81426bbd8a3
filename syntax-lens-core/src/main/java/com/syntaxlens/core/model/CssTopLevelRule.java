package com.syntaxlens.core.model;

/**
 * An entry of a parsed stylesheet: either a qualified rule or an at-rule.
 *
 * @see CssRule
 * @see CssAtRule
 */
public sealed interface CssTopLevelRule permits CssRule, CssAtRule {

    /**
     * Returns the serialized prelude: the selector list for qualified rules,
     * the condition for at-rules.
     *
     * @return prelude text, never null
     */
    String prelude();
}
