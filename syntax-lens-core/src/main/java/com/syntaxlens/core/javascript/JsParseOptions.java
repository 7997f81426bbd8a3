package com.syntaxlens.core.javascript;

/**
 * Options handed to the ECMAScript grammar.
 *
 * @param jsx accept JSX elements
 * @param tolerant recover from local syntax errors and record them on the program
 * @param range attach {@code [start, end]} offsets to every node
 * @param loc attach line/column locations to every node
 * @param tokens attach the token list to the program
 * @param comment attach the comment list to the program
 */
public record JsParseOptions(
    boolean jsx,
    boolean tolerant,
    boolean range,
    boolean loc,
    boolean tokens,
    boolean comment
) {
    /**
     * Tolerant parsing with ranges and locations, no JSX, no token or comment capture.
     *
     * @return default options used by {@link JsTreeWalker#parse(String)}
     */
    public static JsParseOptions defaults() {
        return new JsParseOptions(false, true, true, true, false, false);
    }

    /**
     * Non-tolerant options used for syntax validation.
     *
     * @return strict options without location data
     */
    public static JsParseOptions strict() {
        return new JsParseOptions(false, false, false, false, false, false);
    }

    public JsParseOptions withJsx(boolean enabled) {
        return new JsParseOptions(enabled, tolerant, range, loc, tokens, comment);
    }

    public JsParseOptions withTolerant(boolean enabled) {
        return new JsParseOptions(jsx, enabled, range, loc, tokens, comment);
    }

    public JsParseOptions withComments(boolean enabled) {
        return new JsParseOptions(jsx, tolerant, range, loc, tokens, enabled);
    }

    public JsParseOptions withRange(boolean enabled) {
        return new JsParseOptions(jsx, tolerant, enabled, loc, tokens, comment);
    }
}
