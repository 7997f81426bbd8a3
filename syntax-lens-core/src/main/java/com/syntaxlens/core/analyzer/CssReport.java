package com.syntaxlens.core.analyzer;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.syntaxlens.core.model.CssDeclaration;
import com.syntaxlens.core.model.CssTopLevelRule;
import com.syntaxlens.core.model.MediaQuery;
import com.syntaxlens.core.model.SourceLanguage;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Structure of one stylesheet.
 *
 * @param source name of the stylesheet
 * @param success whether the stylesheet was analyzed
 * @param rules top-level rules and at-rules
 * @param selectors selector group of each top-level style rule
 * @param colors values of color-bearing declarations
 * @param mediaQueries top-level {@code @media} blocks
 * @param declarations declarations grouped by selector
 * @param warnings grammar errors that were skipped
 * @param errors failure reasons
 */
public record CssReport(
    String source,
    boolean success,
    List<CssTopLevelRule> rules,
    List<String> selectors,
    List<String> colors,
    List<MediaQuery> mediaQueries,
    Map<String, List<CssDeclaration>> declarations,
    List<String> warnings,
    List<String> errors
) implements AnalysisReport {

    public CssReport {
        Objects.requireNonNull(source, "source must not be null");
        if (rules == null) {
            rules = List.of();
        }
        if (selectors == null) {
            selectors = List.of();
        }
        if (colors == null) {
            colors = List.of();
        }
        if (mediaQueries == null) {
            mediaQueries = List.of();
        }
        if (declarations == null) {
            declarations = Map.of();
        }
        if (warnings == null) {
            warnings = List.of();
        }
        if (errors == null) {
            errors = List.of();
        }
    }

    public static CssReport failed(String source, List<String> errors) {
        return new CssReport(source, false, null, null, null, null, null, null, errors);
    }

    @Override
    @JsonProperty("language")
    public SourceLanguage language() {
        return SourceLanguage.CSS;
    }
}
