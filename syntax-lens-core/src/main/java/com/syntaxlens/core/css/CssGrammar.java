package com.syntaxlens.core.css;

import com.helger.css.ECSSVersion;
import com.helger.css.ICSSWriteable;
import com.helger.css.decl.CSSDeclaration;
import com.helger.css.decl.CSSDeclarationList;
import com.helger.css.decl.CSSMediaExpression;
import com.helger.css.decl.CSSMediaQuery;
import com.helger.css.decl.CSSMediaRule;
import com.helger.css.decl.CSSSelector;
import com.helger.css.decl.CSSStyleRule;
import com.helger.css.decl.CascadingStyleSheet;
import com.helger.css.decl.ECSSSelectorCombinator;
import com.helger.css.decl.ICSSSelectorMember;
import com.helger.css.decl.ICSSTopLevelRule;
import com.helger.css.reader.CSSReader;
import com.helger.css.reader.CSSReaderDeclarationList;
import com.helger.css.reader.CSSReaderSettings;
import com.helger.css.reader.errorhandler.CSSParseError;
import com.helger.css.reader.errorhandler.CollectingCSSParseErrorHandler;
import com.helger.css.writer.CSSWriter;
import com.helger.css.writer.CSSWriterSettings;
import com.syntaxlens.core.model.CssAtRule;
import com.syntaxlens.core.model.CssDeclaration;
import com.syntaxlens.core.model.CssRule;
import com.syntaxlens.core.model.CssTopLevelRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Adapter over the ph-css CSS 3 grammar.
 *
 * <p>Reads stylesheets and declaration lists, serializes any node back to text and
 * maps ph-css rules onto the {@code CssTopLevelRule} model. In browser-compliant
 * mode malformed constructs are skipped the way browsers skip them.
 */
public class CssGrammar {

    private static final Logger log = LoggerFactory.getLogger(CssGrammar.class);

    static final ECSSVersion VERSION = ECSSVersion.CSS30;

    private final boolean browserCompliant;
    private final CSSWriterSettings readableSettings = new CSSWriterSettings(VERSION, false);
    private final CSSWriterSettings compactSettings = new CSSWriterSettings(VERSION, true);

    public CssGrammar() {
        this(true);
    }

    /**
     * @param browserCompliant skip malformed constructs instead of failing the read
     */
    public CssGrammar(boolean browserCompliant) {
        this.browserCompliant = browserCompliant;
    }

    /**
     * Reads a stylesheet, collecting grammar errors into {@code errors}.
     *
     * @param text stylesheet text
     * @param errors receives one message per error the grammar reported
     * @return the stylesheet, or null if the grammar gave up
     */
    public CascadingStyleSheet read(String text, List<String> errors) {
        if (text == null || text.isBlank()) {
            return new CascadingStyleSheet();
        }

        CollectingCSSParseErrorHandler errorHandler = new CollectingCSSParseErrorHandler();
        CascadingStyleSheet sheet = CSSReader.readFromStringReader(text, readerSettings(errorHandler, errors));
        collectErrors(errorHandler, errors);
        if (!errors.isEmpty()) {
            log.debug("Stylesheet read with {} error(s)", errors.size());
        }
        return sheet;
    }

    private CSSReaderSettings readerSettings(CollectingCSSParseErrorHandler errorHandler, List<String> fatalErrors) {
        return new CSSReaderSettings()
            .setCSSVersion(VERSION)
            .setBrowserCompliantMode(browserCompliant)
            .setCustomErrorHandler(errorHandler)
            .setCustomExceptionHandler(exception -> fatalErrors.add(exception.getMessage()));
    }

    private static void collectErrors(CollectingCSSParseErrorHandler errorHandler, List<String> errors) {
        for (CSSParseError error : errorHandler.getAllParseErrors()) {
            errors.add(error.getErrorMessage());
        }
    }

    /**
     * Reads a stylesheet, treating an unreadable one as empty.
     *
     * @param text stylesheet text
     * @return the stylesheet; never null
     */
    public CascadingStyleSheet read(String text) {
        CascadingStyleSheet sheet = read(text, new ArrayList<>());
        if (sheet == null) {
            log.debug("Stylesheet could not be read, treating as empty");
            return new CascadingStyleSheet();
        }
        return sheet;
    }

    /**
     * @param text stylesheet text
     * @return top-level rules: {@code @import} and {@code @namespace} first, then document order
     */
    public List<CssTopLevelRule> parse(String text) {
        List<CssTopLevelRule> rules = new ArrayList<>();
        for (ICSSWriteable rule : topLevelRules(read(text))) {
            rules.add(toModel(rule));
        }
        return rules;
    }

    /**
     * @param sheet stylesheet
     * @return every top-level construct in the order it must be written
     */
    public List<ICSSWriteable> topLevelRules(CascadingStyleSheet sheet) {
        List<ICSSWriteable> rules = new ArrayList<>();
        rules.addAll(sheet.getAllImportRules());
        rules.addAll(sheet.getAllNamespaceRules());
        rules.addAll(sheet.getAllRules());
        return rules;
    }

    /**
     * Reads the body of a style rule or an inline {@code style} attribute.
     *
     * <p>A malformed declaration drops only itself: when the list as a whole reports
     * errors, each {@code ;}-separated entry is read on its own.
     *
     * @param text declarations such as {@code "color: red; margin: 0"}
     * @return declarations in order; empty if none parse
     */
    public List<CssDeclaration> readDeclarations(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        List<String> errors = new ArrayList<>();
        CSSDeclarationList list = readDeclarationList(text, errors);
        if (list != null && errors.isEmpty()) {
            return toModel(list);
        }

        log.debug("Declaration list has {} error(s), reading entries one by one", errors.size());
        List<CssDeclaration> declarations = new ArrayList<>();
        for (String entry : splitDeclarations(text)) {
            List<String> entryErrors = new ArrayList<>();
            CSSDeclarationList single = readDeclarationList(entry, entryErrors);
            if (single != null && entryErrors.isEmpty()) {
                declarations.addAll(toModel(single));
            } else {
                log.debug("Skipping malformed declaration: {}", entryErrors);
            }
        }
        return declarations;
    }

    private CSSDeclarationList readDeclarationList(String text, List<String> errors) {
        CollectingCSSParseErrorHandler errorHandler = new CollectingCSSParseErrorHandler();
        CSSDeclarationList list = CSSReaderDeclarationList.readFromString(text, readerSettings(errorHandler, errors));
        collectErrors(errorHandler, errors);
        return list;
    }

    private List<CssDeclaration> toModel(CSSDeclarationList list) {
        List<CssDeclaration> declarations = new ArrayList<>();
        for (CSSDeclaration declaration : list.getAllDeclarations()) {
            declarations.add(toModel(declaration));
        }
        return declarations;
    }

    /**
     * Splits a declaration list on {@code ;} outside strings and parentheses.
     * Blank entries are dropped.
     */
    static List<String> splitDeclarations(String text) {
        List<String> entries = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        char quote = 0;
        int depth = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quote != 0) {
                if (c == '\\' && i + 1 < text.length()) {
                    current.append(c).append(text.charAt(++i));
                    continue;
                }
                if (c == quote) {
                    quote = 0;
                }
            } else if (c == '"' || c == '\'') {
                quote = c;
            } else if (c == '(') {
                depth++;
            } else if (c == ')' && depth > 0) {
                depth--;
            } else if (c == ';' && depth == 0) {
                addEntry(entries, current);
                continue;
            }
            current.append(c);
        }
        addEntry(entries, current);
        return entries;
    }

    private static void addEntry(List<String> entries, StringBuilder current) {
        String entry = current.toString().trim();
        if (!entry.isEmpty()) {
            entries.add(entry);
        }
        current.setLength(0);
    }

    /**
     * Serializes the selector group on one line: selectors joined with {@code ", "},
     * combinators other than the descendant one surrounded by single spaces.
     *
     * @param rule a style rule
     * @return its full selector group, e.g. {@code "h1, h2, h3"} or {@code ".card > p"}
     */
    public String selectorOf(CSSStyleRule rule) {
        return rule.getAllSelectors().stream()
            .map(this::selectorText)
            .collect(Collectors.joining(", "));
    }

    private String selectorText(CSSSelector selector) {
        StringBuilder text = new StringBuilder();
        for (ICSSSelectorMember member : selector.getAllMembers()) {
            if (member instanceof ECSSSelectorCombinator combinator) {
                String symbol = combinator.getAsCSSString(readableSettings, 0).trim();
                text.append(symbol.isEmpty() ? " " : " " + symbol + " ");
            } else {
                text.append(member.getAsCSSString(readableSettings, 0).trim());
            }
        }
        return text.toString().trim();
    }

    /**
     * @param rule a media rule
     * @return its media query list joined with {@code ", "}, e.g.
     *         {@code "screen and (max-width: 600px)"}
     */
    public String conditionOf(CSSMediaRule rule) {
        return rule.getAllMediaQueries().stream()
            .map(this::mediaQueryText)
            .collect(Collectors.joining(", "));
    }

    private String mediaQueryText(CSSMediaQuery query) {
        List<String> parts = new ArrayList<>();
        if (query.getMedium() != null && !query.getMedium().isEmpty()) {
            String modifier = query.isNot() ? "not " : query.isOnly() ? "only " : "";
            parts.add(modifier + query.getMedium());
        }
        for (CSSMediaExpression expression : query.getAllMediaExpressions()) {
            String feature = expression.getFeature();
            parts.add(expression.getValue() != null
                ? "(" + feature + ": " + readable(expression.getValue()) + ")"
                : "(" + feature + ")");
        }
        return String.join(" and ", parts);
    }

    /**
     * @param rule a media rule
     * @return selectors of the style rules directly inside it
     */
    public List<String> nestedSelectorsOf(CSSMediaRule rule) {
        List<String> selectors = new ArrayList<>();
        for (ICSSTopLevelRule nested : rule.getAllRules()) {
            if (nested instanceof CSSStyleRule styleRule) {
                selectors.add(selectorOf(styleRule));
            }
        }
        return selectors;
    }

    /**
     * @param sheet stylesheet
     * @param optimized drop optional whitespace
     * @return serialized stylesheet without a header comment
     */
    public String write(CascadingStyleSheet sheet, boolean optimized) {
        CSSWriter writer = new CSSWriter(optimized ? compactSettings : readableSettings)
            .setWriteHeaderText(false);
        return writer.getCSSAsString(sheet);
    }

    String readable(ICSSWriteable node) {
        return node.getAsCSSString(readableSettings, 0).trim();
    }

    String compact(ICSSWriteable node) {
        return node.getAsCSSString(compactSettings, 0).trim();
    }

    CssTopLevelRule toModel(ICSSWriteable rule) {
        if (rule instanceof CSSStyleRule styleRule) {
            List<CssDeclaration> declarations = new ArrayList<>();
            for (CSSDeclaration declaration : styleRule.getAllDeclarations()) {
                declarations.add(toModel(declaration));
            }
            return new CssRule(selectorOf(styleRule), declarations);
        }

        String text = compact(rule);
        String keyword = atKeyword(text);
        String prelude = rule instanceof CSSMediaRule mediaRule
            ? conditionOf(mediaRule)
            : atPrelude(text, keyword);
        return new CssAtRule(keyword, prelude, text);
    }

    CssDeclaration toModel(CSSDeclaration declaration) {
        return new CssDeclaration(
            declaration.getProperty(),
            readable(declaration.getExpression()),
            declaration.isImportant());
    }

    /**
     * Keyword of a serialized at-rule without the {@code @}, lower-cased.
     */
    static String atKeyword(String text) {
        if (!text.startsWith("@")) {
            return "";
        }
        int end = 1;
        while (end < text.length() && isKeywordChar(text.charAt(end))) {
            end++;
        }
        return text.substring(1, end).toLowerCase(Locale.ROOT);
    }

    /**
     * Text between the keyword and the block or terminating semicolon.
     */
    static String atPrelude(String text, String keyword) {
        int start = Math.min(text.length(), keyword.length() + 1);
        int end = start;
        while (end < text.length() && text.charAt(end) != '{' && text.charAt(end) != ';') {
            end++;
        }
        return text.substring(start, end).trim();
    }

    private static boolean isKeywordChar(char c) {
        return Character.isLetterOrDigit(c) || c == '-' || c == '_';
    }
}
