package com.syntaxlens.core.javascript;

import com.syntaxlens.core.model.ClassInfo;
import com.syntaxlens.core.model.ComplexityMetrics;
import com.syntaxlens.core.model.ExportInfo;
import com.syntaxlens.core.model.FunctionInfo;
import com.syntaxlens.core.model.ImportInfo;
import com.syntaxlens.core.model.VariableInfo;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Everything collected from one program in a single traversal.
 *
 * @param functions functions in pre-order
 * @param variables one entry per declarator, in pre-order
 * @param classes classes in pre-order
 * @param imports import declarations in pre-order
 * @param exports export declarations in pre-order
 * @param identifiers distinct identifier names
 * @param statements nodes whose type contains "Statement"
 * @param loops for, for-in, for-of, while and do-while statements
 * @param conditionals if statements, switch statements and conditional expressions
 * @param maxDepth deepest object nesting below the program node
 */
public record JsStructure(
    List<FunctionInfo> functions,
    List<VariableInfo> variables,
    List<ClassInfo> classes,
    List<ImportInfo> imports,
    List<ExportInfo> exports,
    Set<String> identifiers,
    int statements,
    int loops,
    int conditionals,
    int maxDepth
) {
    public JsStructure {
        functions = functions != null ? List.copyOf(functions) : List.of();
        variables = variables != null ? List.copyOf(variables) : List.of();
        classes = classes != null ? List.copyOf(classes) : List.of();
        imports = imports != null ? List.copyOf(imports) : List.of();
        exports = exports != null ? List.copyOf(exports) : List.of();
        identifiers = identifiers != null
            ? Collections.unmodifiableSet(new LinkedHashSet<>(identifiers))
            : Set.of();
    }

    /**
     * Combines the collected counts with the line count of the source.
     *
     * @param source source text, may be null
     * @return complexity metrics
     */
    public ComplexityMetrics toMetrics(String source) {
        return new ComplexityMetrics(
            functions.size(),
            variables.size(),
            classes.size(),
            countLines(source),
            statements,
            loops,
            conditionals,
            maxDepth);
    }

    /**
     * Newline count plus one; zero for empty or missing source.
     */
    static int countLines(String source) {
        if (source == null || source.isEmpty()) {
            return 0;
        }
        int lines = 1;
        for (int i = 0; i < source.length(); i++) {
            if (source.charAt(i) == '\n') {
                lines++;
            }
        }
        return lines;
    }
}
