package com.syntaxlens.core.analyzer.base;

import com.syntaxlens.core.analyzer.AnalysisContext;
import com.syntaxlens.core.analyzer.AnalysisReport;
import com.syntaxlens.core.analyzer.SourceAnalyzer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Base class for analyzers.
 *
 * <p>Matches files by extension and turns unexpected runtime failures into failed
 * reports, so {@link #analyze(AnalysisContext)} never throws. Subclasses implement
 * {@link #doAnalyze(AnalysisContext)} and {@link #failedReport(AnalysisContext, List)}.
 */
public abstract class AbstractSourceAnalyzer implements SourceAnalyzer {

    /**
     * Logger named after the concrete analyzer class.
     */
    protected final Logger log;

    protected AbstractSourceAnalyzer() {
        this.log = LoggerFactory.getLogger(getClass());
    }

    @Override
    public Set<String> getSupportedExtensions() {
        return getLanguage().extensions();
    }

    @Override
    public boolean appliesTo(AnalysisContext context) {
        return getSupportedExtensions().contains(context.extension().toLowerCase(Locale.ROOT));
    }

    @Override
    public final AnalysisReport analyze(AnalysisContext context) {
        log.debug("Analyzing {} with {}", context.file(), getId());
        try {
            return doAnalyze(context);
        } catch (RuntimeException e) {
            log.error("Analyzer {} failed on {}: {}", getId(), context.file(), e.getMessage(), e);
            return failedReport(context, List.of(e.getMessage() != null ? e.getMessage() : e.toString()));
        }
    }

    /**
     * Performs the analysis.
     *
     * @param context file under analysis
     * @return analysis report
     */
    protected abstract AnalysisReport doAnalyze(AnalysisContext context);

    /**
     * @param context file under analysis
     * @param errors failure reasons
     * @return report marking the analysis as failed
     */
    protected abstract AnalysisReport failedReport(AnalysisContext context, List<String> errors);
}
