package com.syntaxlens.core.analyzer;

import com.syntaxlens.core.model.SourceLanguage;

import java.util.Set;

/**
 * Analyzes one source file and reports its structure.
 *
 * <p>Analyzers are discovered via Java Service Provider Interface (SPI). Each analyzer
 * handles one language and produces an {@link AnalysisReport} describing what it found.
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.syntaxlens.core.analyzer.SourceAnalyzer}
 *
 * @see AnalysisContext
 * @see AnalysisReport
 */
public interface SourceAnalyzer {

    /**
     * Returns unique identifier for this analyzer.
     *
     * <p>Used in CLI output and for selecting an analyzer explicitly (e.g., "css", "javascript").
     *
     * @return unique analyzer identifier
     */
    String getId();

    /**
     * Returns human-readable display name for this analyzer.
     *
     * @return display name
     */
    String getDisplayName();

    /**
     * @return language this analyzer handles
     */
    SourceLanguage getLanguage();

    /**
     * Returns file extensions (without dot) this analyzer accepts.
     *
     * @return lower-case extensions
     */
    Set<String> getSupportedExtensions();

    /**
     * Determines whether this analyzer should run on the given file.
     *
     * @param context file under analysis
     * @return true if the analyzer accepts the file
     */
    boolean appliesTo(AnalysisContext context);

    /**
     * Analyzes the file.
     *
     * <p>Implementations report failures through {@link AnalysisReport#success()} and
     * {@link AnalysisReport#errors()} instead of throwing.
     *
     * @param context file under analysis
     * @return analysis report
     */
    AnalysisReport analyze(AnalysisContext context);
}
