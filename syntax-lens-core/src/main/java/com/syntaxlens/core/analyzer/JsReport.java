package com.syntaxlens.core.analyzer;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.syntaxlens.core.model.ClassInfo;
import com.syntaxlens.core.model.ComplexityMetrics;
import com.syntaxlens.core.model.DependencySet;
import com.syntaxlens.core.model.ExportInfo;
import com.syntaxlens.core.model.FunctionInfo;
import com.syntaxlens.core.model.ImportInfo;
import com.syntaxlens.core.model.JsComment;
import com.syntaxlens.core.model.ModuleType;
import com.syntaxlens.core.model.SourceLanguage;
import com.syntaxlens.core.model.VariableInfo;

import java.util.List;
import java.util.Objects;

/**
 * Structure of one JavaScript source.
 *
 * @param source name of the source
 * @param success whether the source parsed
 * @param sourceType "script" or "module", whichever grammar accepted the source
 * @param moduleType module system guessed from the text
 * @param metrics complexity metrics
 * @param functions functions in source order
 * @param variables variable declarators in source order
 * @param classes classes in source order
 * @param imports import declarations
 * @param exports export declarations
 * @param dependencies import sources and require targets
 * @param comments comments, when the source also parses strictly as a script
 * @param warnings errors the tolerant parse skipped over
 * @param errors failure reasons
 */
public record JsReport(
    String source,
    boolean success,
    String sourceType,
    ModuleType moduleType,
    ComplexityMetrics metrics,
    List<FunctionInfo> functions,
    List<VariableInfo> variables,
    List<ClassInfo> classes,
    List<ImportInfo> imports,
    List<ExportInfo> exports,
    DependencySet dependencies,
    List<JsComment> comments,
    List<String> warnings,
    List<String> errors
) implements AnalysisReport {

    public JsReport {
        Objects.requireNonNull(source, "source must not be null");
        if (moduleType == null) {
            moduleType = ModuleType.NONE;
        }
        if (metrics == null) {
            metrics = ComplexityMetrics.empty();
        }
        if (functions == null) {
            functions = List.of();
        }
        if (variables == null) {
            variables = List.of();
        }
        if (classes == null) {
            classes = List.of();
        }
        if (imports == null) {
            imports = List.of();
        }
        if (exports == null) {
            exports = List.of();
        }
        if (dependencies == null) {
            dependencies = DependencySet.empty();
        }
        if (comments == null) {
            comments = List.of();
        }
        if (warnings == null) {
            warnings = List.of();
        }
        if (errors == null) {
            errors = List.of();
        }
    }

    public static JsReport failed(String source, List<String> errors) {
        return new JsReport(source, false, null, null, null, null, null, null, null, null, null, null, null, errors);
    }

    @Override
    @JsonProperty("language")
    public SourceLanguage language() {
        return SourceLanguage.JAVASCRIPT;
    }
}
