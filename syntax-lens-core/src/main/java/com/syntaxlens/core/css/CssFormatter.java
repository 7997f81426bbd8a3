package com.syntaxlens.core.css;

import com.syntaxlens.core.model.CssAtRule;
import com.syntaxlens.core.model.CssDeclaration;
import com.syntaxlens.core.model.CssRule;
import com.syntaxlens.core.model.CssTopLevelRule;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Writes stylesheets back out, either compact or one declaration per line.
 *
 * <p>{@link #minify(String)} is a re-serialization through the grammar's compact
 * writer. It keeps the stylesheet's meaning; any size reduction comes from that
 * writer dropping optional whitespace and comments.
 */
public class CssFormatter {

    public static final String DEFAULT_INDENT = "  ";

    private final CssGrammar grammar;

    public CssFormatter() {
        this(new CssGrammar());
    }

    public CssFormatter(CssGrammar grammar) {
        this.grammar = Objects.requireNonNull(grammar, "grammar must not be null");
    }

    /**
     * @param text stylesheet text
     * @return the parsed stylesheet written without optional whitespace
     */
    public String minify(String text) {
        return grammar.write(grammar.read(text), true);
    }

    public String prettify(String text) {
        return prettify(text, DEFAULT_INDENT);
    }

    /**
     * Writes each style rule as a block with one indented declaration per line and
     * each at-rule on a single compact line. Blocks are separated by a blank line.
     *
     * @param text stylesheet text
     * @param indent prefix of each declaration line
     * @return formatted stylesheet
     */
    public String prettify(String text, String indent) {
        String prefix = indent != null ? indent : DEFAULT_INDENT;
        List<String> parts = new ArrayList<>();

        for (CssTopLevelRule rule : grammar.parse(text)) {
            if (rule instanceof CssRule styleRule) {
                parts.add(styleRule.selector() + " {");
                for (CssDeclaration declaration : styleRule.declarations()) {
                    parts.add(prefix + declaration.toCssText() + ";");
                }
                parts.add("}\n");
            } else if (rule instanceof CssAtRule atRule) {
                parts.add(atRule.text() + "\n");
            }
        }
        return String.join("\n", parts);
    }
}
