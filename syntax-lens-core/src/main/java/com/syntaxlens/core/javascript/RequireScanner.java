package com.syntaxlens.core.javascript;

import com.syntaxlens.core.model.JsToken;

import java.util.ArrayList;
import java.util.List;

/**
 * Finds {@code require('x')} targets in a token stream.
 */
final class RequireScanner {

    /** Tokens inspected after {@code require} when looking for its argument. */
    static final int LOOKAHEAD = 4;

    private RequireScanner() {
    }

    /**
     * @param tokens tokens in source order
     * @return unquoted module names, in encounter order, duplicates kept
     */
    static List<String> scan(List<JsToken> tokens) {
        List<String> requires = new ArrayList<>();
        for (int i = 0; i < tokens.size(); i++) {
            JsToken token = tokens.get(i);
            if (!token.is(JsToken.IDENTIFIER) || !"require".equals(token.value())) {
                continue;
            }
            int end = Math.min(i + 1 + LOOKAHEAD, tokens.size());
            for (int j = i + 1; j < end; j++) {
                JsToken candidate = tokens.get(j);
                if (candidate.is(JsToken.STRING)) {
                    String module = unquote(candidate.value());
                    if (!module.isEmpty()) {
                        requires.add(module);
                    }
                    break;
                }
            }
        }
        return requires;
    }

    static String unquote(String literal) {
        if (literal == null) {
            return "";
        }
        int start = 0;
        int end = literal.length();
        while (start < end && isQuote(literal.charAt(start))) {
            start++;
        }
        while (end > start && isQuote(literal.charAt(end - 1))) {
            end--;
        }
        return literal.substring(start, end);
    }

    private static boolean isQuote(char c) {
        return c == '\'' || c == '"';
    }
}
