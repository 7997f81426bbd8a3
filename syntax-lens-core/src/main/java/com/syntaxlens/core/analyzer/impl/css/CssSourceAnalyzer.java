package com.syntaxlens.core.analyzer.impl.css;

import com.helger.css.decl.CascadingStyleSheet;
import com.syntaxlens.core.analyzer.AnalysisContext;
import com.syntaxlens.core.analyzer.AnalysisReport;
import com.syntaxlens.core.analyzer.CssReport;
import com.syntaxlens.core.analyzer.base.AbstractSourceAnalyzer;
import com.syntaxlens.core.css.CssGrammar;
import com.syntaxlens.core.css.CssRuleWalker;
import com.syntaxlens.core.model.CssTopLevelRule;
import com.syntaxlens.core.model.SourceLanguage;

import java.util.ArrayList;
import java.util.List;

/**
 * Reports rules, selectors, colors, media queries and declarations of a stylesheet.
 */
public class CssSourceAnalyzer extends AbstractSourceAnalyzer {

    @Override
    public String getId() {
        return "css";
    }

    @Override
    public String getDisplayName() {
        return "CSS Stylesheet Analyzer";
    }

    @Override
    public SourceLanguage getLanguage() {
        return SourceLanguage.CSS;
    }

    @Override
    protected AnalysisReport doAnalyze(AnalysisContext context) {
        CssGrammar grammar = new CssGrammar(context.config().css().browserCompliant());
        CssRuleWalker walker = new CssRuleWalker(grammar);
        String content = context.content();

        List<String> warnings = new ArrayList<>();
        CascadingStyleSheet sheet = grammar.read(content, warnings);
        if (sheet == null) {
            return failedReport(context, warnings.isEmpty() ? List.of("Stylesheet could not be parsed") : warnings);
        }

        List<CssTopLevelRule> rules = walker.parseStylesheet(content);
        log.debug("{}: {} top-level rule(s), {} warning(s)", context.sourceName(), rules.size(), warnings.size());

        return new CssReport(
            context.sourceName(),
            true,
            rules,
            walker.extractSelectors(content),
            walker.extractColors(content),
            walker.parseMediaQueries(content),
            walker.getAllDeclarations(content),
            warnings,
            List.of());
    }

    @Override
    protected AnalysisReport failedReport(AnalysisContext context, List<String> errors) {
        return CssReport.failed(context.sourceName(), errors);
    }
}
