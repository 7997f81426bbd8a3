package com.syntaxlens.core.analyzer.impl.javascript;

import com.syntaxlens.core.analyzer.AnalysisContext;
import com.syntaxlens.core.analyzer.AnalysisReport;
import com.syntaxlens.core.analyzer.JsReport;
import com.syntaxlens.core.analyzer.base.AbstractSourceAnalyzer;
import com.syntaxlens.core.javascript.JsParseException;
import com.syntaxlens.core.javascript.JsStructure;
import com.syntaxlens.core.javascript.JsTreeWalker;
import com.syntaxlens.core.javascript.ParseResult;
import com.syntaxlens.core.model.DependencySet;
import com.syntaxlens.core.model.ImportInfo;
import com.syntaxlens.core.model.SourceLanguage;

import java.util.ArrayList;
import java.util.List;

/**
 * Reports functions, variables, classes, module structure and complexity of a JavaScript source.
 *
 * <p>Each call starts its own grammar engine and closes it when done, so one analyzer
 * instance can serve several threads.
 */
public class JavaScriptSourceAnalyzer extends AbstractSourceAnalyzer {

    @Override
    public String getId() {
        return "javascript";
    }

    @Override
    public String getDisplayName() {
        return "JavaScript Analyzer";
    }

    @Override
    public SourceLanguage getLanguage() {
        return SourceLanguage.JAVASCRIPT;
    }

    @Override
    protected AnalysisReport doAnalyze(AnalysisContext context) {
        String content = context.content();

        try (JsTreeWalker walker = new JsTreeWalker()) {
            ParseResult result;
            try {
                result = walker.parseBestGoal(content, context.config().javascript().toParseOptions());
            } catch (JsParseException e) {
                log.debug("{} does not parse: {}", context.sourceName(), e.getMessage());
                return failedReport(context, List.of(e.getMessage()));
            }

            JsStructure structure = walker.analyze(result);
            List<String> warnings = new ArrayList<>(result.recoveredErrors());

            List<String> importSources = new ArrayList<>();
            for (ImportInfo info : structure.imports()) {
                importSources.add(info.source());
            }
            List<String> requires;
            try {
                requires = walker.findRequires(content);
            } catch (JsParseException e) {
                warnings.add("Token scan skipped: " + e.getMessage());
                requires = List.of();
            }

            return new JsReport(
                context.sourceName(),
                true,
                result.sourceType(),
                walker.detectModuleType(content),
                structure.toMetrics(content),
                structure.functions(),
                structure.variables(),
                structure.classes(),
                structure.imports(),
                structure.exports(),
                new DependencySet(importSources, requires),
                walker.extractComments(content),
                warnings,
                List.of());
        }
    }

    @Override
    protected AnalysisReport failedReport(AnalysisContext context, List<String> errors) {
        return JsReport.failed(context.sourceName(), errors);
    }
}
