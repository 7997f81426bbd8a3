package com.syntaxlens.core.css;

import com.helger.css.decl.CSSMediaRule;
import com.helger.css.decl.CascadingStyleSheet;
import com.syntaxlens.core.model.CssDeclaration;
import com.syntaxlens.core.model.CssRule;
import com.syntaxlens.core.model.CssTopLevelRule;
import com.syntaxlens.core.model.MediaQuery;
import com.syntaxlens.core.model.PropertyMatch;
import com.syntaxlens.core.model.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Flattens stylesheets into selectors, declarations, media queries and colors.
 *
 * <p>Only top-level style rules feed the selector, color, property and declaration
 * extractors; rules nested inside at-rules are reached through
 * {@link #parseMediaQueries(String)}. Malformed constructs are dropped by the grammar,
 * so none of the extractors fail on bad input. Instances are stateless and may be
 * shared between threads.
 */
public class CssRuleWalker {

    private static final Logger log = LoggerFactory.getLogger(CssRuleWalker.class);

    /** Substrings that mark a property as carrying a color. */
    static final List<String> COLOR_PROPERTY_KEYWORDS = List.of("color", "background", "border", "fill", "stroke");

    private final CssGrammar grammar;
    private final CssFormatter formatter;

    public CssRuleWalker() {
        this(new CssGrammar());
    }

    public CssRuleWalker(CssGrammar grammar) {
        this.grammar = Objects.requireNonNull(grammar, "grammar must not be null");
        this.formatter = new CssFormatter(grammar);
    }

    /**
     * @param text stylesheet text; comments are skipped
     * @return top-level rules and at-rules; empty for empty input
     */
    public List<CssTopLevelRule> parseStylesheet(String text) {
        return grammar.parse(text);
    }

    /**
     * @param text text holding exactly one rule
     * @return the rule, or empty if the text holds none or several
     */
    public Optional<CssTopLevelRule> parseRule(String text) {
        List<CssTopLevelRule> rules = grammar.parse(text);
        return rules.size() == 1 ? Optional.of(rules.get(0)) : Optional.empty();
    }

    /**
     * @param text declaration block body
     * @return declarations in order
     */
    public List<CssDeclaration> parseDeclarationList(String text) {
        return grammar.readDeclarations(text);
    }

    /**
     * @param text a single declaration such as {@code "color: red"}
     * @return the declaration, or empty if the text is not exactly one declaration
     */
    public Optional<CssDeclaration> parseOneDeclaration(String text) {
        List<CssDeclaration> declarations = grammar.readDeclarations(text);
        return declarations.size() == 1 ? Optional.of(declarations.get(0)) : Optional.empty();
    }

    /**
     * @param text value of a {@code style} attribute
     * @return property to value; a repeated property keeps its last value
     */
    public Map<String, String> parseInlineStyle(String text) {
        Map<String, String> style = new LinkedHashMap<>();
        for (CssDeclaration declaration : grammar.readDeclarations(text)) {
            style.put(declaration.property(), declaration.value());
        }
        return style;
    }

    /**
     * @param text stylesheet text
     * @return one full selector group per top-level style rule
     */
    public List<String> extractSelectors(String text) {
        List<String> selectors = new ArrayList<>();
        for (CssRule rule : styleRules(text)) {
            selectors.add(rule.selector());
        }
        return selectors;
    }

    /**
     * Values of declarations whose property name mentions color, background, border, fill or stroke.
     *
     * @param text stylesheet text
     * @return values in document order, duplicates kept
     */
    public List<String> extractColors(String text) {
        List<String> colors = new ArrayList<>();
        for (CssRule rule : styleRules(text)) {
            for (CssDeclaration declaration : rule.declarations()) {
                if (isColorProperty(declaration.property())) {
                    colors.add(declaration.value());
                }
            }
        }
        return colors;
    }

    /**
     * @param text stylesheet text
     * @param property property name, matched case-insensitively
     * @return selector and value of every matching declaration
     */
    public List<PropertyMatch> extractProperty(String text, String property) {
        List<PropertyMatch> matches = new ArrayList<>();
        for (CssRule rule : styleRules(text)) {
            for (CssDeclaration declaration : rule.declarations()) {
                if (declaration.property().equalsIgnoreCase(property)) {
                    matches.add(new PropertyMatch(rule.selector(), declaration.value()));
                }
            }
        }
        return matches;
    }

    /**
     * Groups declarations by selector. A selector that occurs in several rules collects
     * the declarations of all of them.
     *
     * @param text stylesheet text
     * @return selector to declarations, in first-occurrence order
     */
    public Map<String, List<CssDeclaration>> getAllDeclarations(String text) {
        Map<String, List<CssDeclaration>> bySelector = new LinkedHashMap<>();
        for (CssRule rule : styleRules(text)) {
            bySelector.computeIfAbsent(rule.selector(), selector -> new ArrayList<>())
                .addAll(rule.declarations());
        }
        return bySelector;
    }

    /**
     * @param text stylesheet text
     * @return one entry per top-level {@code @media} block with the selectors directly inside it
     */
    public List<MediaQuery> parseMediaQueries(String text) {
        CascadingStyleSheet sheet = grammar.read(text);
        List<MediaQuery> queries = new ArrayList<>();
        for (CSSMediaRule mediaRule : sheet.getAllMediaRules()) {
            queries.add(new MediaQuery(grammar.conditionOf(mediaRule), grammar.nestedSelectorsOf(mediaRule)));
        }
        return queries;
    }

    /**
     * @see CssFormatter#minify(String)
     */
    public String minifyCss(String text) {
        return formatter.minify(text);
    }

    /**
     * @see CssFormatter#prettify(String, String)
     */
    public String prettifyCss(String text, String indent) {
        return formatter.prettify(text, indent);
    }

    public String prettifyCss(String text) {
        return formatter.prettify(text);
    }

    /**
     * Syntactic check only: any value that parses as the value of {@code color} passes.
     *
     * @param value candidate color
     * @return true if {@code "color: <value>"} yields a declaration
     */
    public boolean validateColor(String value) {
        if (value == null || value.isBlank()) {
            return false;
        }
        return !grammar.readDeclarations("color: " + value).isEmpty();
    }

    /**
     * @param text stylesheet text
     * @return valid, or invalid with the first error the grammar reported
     */
    public ValidationResult validateCss(String text) {
        List<String> errors = new ArrayList<>();
        CascadingStyleSheet sheet = grammar.read(text, errors);
        if (sheet == null) {
            return ValidationResult.invalid(errors.isEmpty() ? "Stylesheet could not be parsed" : errors.get(0));
        }
        if (!errors.isEmpty()) {
            log.debug("Stylesheet has {} syntax error(s)", errors.size());
            return ValidationResult.invalid(errors.get(0));
        }
        return ValidationResult.ok();
    }

    private List<CssRule> styleRules(String text) {
        List<CssRule> rules = new ArrayList<>();
        for (CssTopLevelRule rule : grammar.parse(text)) {
            if (rule instanceof CssRule styleRule) {
                rules.add(styleRule);
            }
        }
        return rules;
    }

    private static boolean isColorProperty(String property) {
        String normalized = property.toLowerCase(Locale.ROOT);
        for (String keyword : COLOR_PROPERTY_KEYWORDS) {
            if (normalized.contains(keyword)) {
                return true;
            }
        }
        return false;
    }
}
