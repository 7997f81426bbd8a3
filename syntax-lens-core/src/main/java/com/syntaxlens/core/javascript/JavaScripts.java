package com.syntaxlens.core.javascript;

import com.syntaxlens.core.model.DependencySet;
import com.syntaxlens.core.model.FunctionInfo;
import com.syntaxlens.core.model.ValidationResult;
import com.syntaxlens.core.model.VariableInfo;
import com.syntaxlens.core.syntax.SyntaxNode;

import java.util.List;

/**
 * One-shot helpers. Each call starts and closes its own engine, so prefer a
 * {@link JsTreeWalker} when analyzing more than one source.
 */
public final class JavaScripts {

    private JavaScripts() {
    }

    public static SyntaxNode parseJavaScript(String code, boolean jsx) {
        try (JsTreeWalker walker = new JsTreeWalker()) {
            return walker.parse(code, jsx, true).program();
        }
    }

    public static ValidationResult validateJavaScript(String code) {
        try (JsTreeWalker walker = new JsTreeWalker()) {
            return walker.validateSyntax(code);
        }
    }

    public static List<FunctionInfo> extractFunctions(String code) {
        try (JsTreeWalker walker = new JsTreeWalker()) {
            return walker.extractFunctions(code);
        }
    }

    public static List<VariableInfo> extractVariables(String code) {
        try (JsTreeWalker walker = new JsTreeWalker()) {
            return walker.extractVariables(code);
        }
    }

    public static DependencySet getDependencies(String code) {
        try (JsTreeWalker walker = new JsTreeWalker()) {
            return walker.findDependencies(code);
        }
    }
}
