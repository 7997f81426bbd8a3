package com.syntaxlens.core.model;

import java.util.Objects;

/**
 * An at-rule such as {@code @media}, {@code @font-face} or {@code @keyframes}.
 *
 * @param keyword at-keyword without the leading {@code @} (e.g., "media")
 * @param prelude serialized text between the keyword and the block or semicolon
 * @param text the whole rule serialized on a single line
 */
public record CssAtRule(
    String keyword,
    String prelude,
    String text
) implements CssTopLevelRule {
    public CssAtRule {
        Objects.requireNonNull(keyword, "keyword must not be null");
        if (prelude == null) {
            prelude = "";
        }
        if (text == null) {
            text = "";
        }
    }

    /**
     * Checks the at-keyword, ignoring case.
     *
     * @param name keyword without {@code @}
     * @return true if this rule uses the given keyword
     */
    public boolean hasKeyword(String name) {
        return keyword.equalsIgnoreCase(name);
    }
}
