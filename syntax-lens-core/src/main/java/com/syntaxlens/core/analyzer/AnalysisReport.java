package com.syntaxlens.core.analyzer;

import com.syntaxlens.core.model.SourceLanguage;

import java.util.List;

/**
 * Result of analyzing one source file.
 */
public interface AnalysisReport {

    /**
     * @return name of the analyzed source
     */
    String source();

    SourceLanguage language();

    /**
     * @return false if the source could not be analyzed at all
     */
    boolean success();

    /**
     * @return problems the grammar recovered from
     */
    List<String> warnings();

    /**
     * @return reasons the analysis failed; empty when {@link #success()} is true
     */
    List<String> errors();
}
