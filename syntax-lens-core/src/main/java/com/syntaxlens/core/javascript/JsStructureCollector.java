package com.syntaxlens.core.javascript;

import com.syntaxlens.core.model.ClassInfo;
import com.syntaxlens.core.model.ClassKind;
import com.syntaxlens.core.model.DeclarationKind;
import com.syntaxlens.core.model.ExportInfo;
import com.syntaxlens.core.model.ExportKind;
import com.syntaxlens.core.model.FunctionInfo;
import com.syntaxlens.core.model.FunctionKind;
import com.syntaxlens.core.model.ImportInfo;
import com.syntaxlens.core.model.ImportSpecifier;
import com.syntaxlens.core.model.SpecifierKind;
import com.syntaxlens.core.model.VariableInfo;
import com.syntaxlens.core.syntax.SyntaxNode;
import com.syntaxlens.core.syntax.SyntaxTreeWalker;
import com.syntaxlens.core.syntax.SyntaxVisitor;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Visitor that gathers every extraction concern in one pre-order pass over an ESTree program.
 *
 * <p>Each concern appends in visit order, so the per-concern lists match what a
 * dedicated walk for that concern would produce. Instances are single-use.
 */
public class JsStructureCollector implements SyntaxVisitor {

    private static final Set<String> LOOP_TYPES = Set.of(
        "ForStatement", "ForInStatement", "ForOfStatement", "WhileStatement", "DoWhileStatement");

    private static final Set<String> CONDITIONAL_TYPES = Set.of(
        "IfStatement", "ConditionalExpression", "SwitchStatement");

    private final List<FunctionInfo> functions = new ArrayList<>();
    private final List<VariableInfo> variables = new ArrayList<>();
    private final List<ClassInfo> classes = new ArrayList<>();
    private final List<ImportInfo> imports = new ArrayList<>();
    private final List<ExportInfo> exports = new ArrayList<>();
    private final Set<String> identifiers = new LinkedHashSet<>();

    private int statements;
    private int loops;
    private int conditionals;
    private int maxDepth;

    /**
     * Walks a program and returns what was collected.
     *
     * @param program root node
     * @return collected structure
     */
    public static JsStructure collect(SyntaxNode program) {
        JsStructureCollector collector = new JsStructureCollector();
        SyntaxTreeWalker.walk(program, collector);
        return collector.result();
    }

    @Override
    public void visit(SyntaxNode node, int depth) {
        maxDepth = Math.max(maxDepth, depth);

        String type = node.type();
        if (type.contains("Statement")) {
            statements++;
        }
        if (LOOP_TYPES.contains(type)) {
            loops++;
        }
        if (CONDITIONAL_TYPES.contains(type)) {
            conditionals++;
        }

        switch (type) {
            case "FunctionDeclaration", "FunctionExpression", "ArrowFunctionExpression" ->
                functions.add(readFunction(node));
            case "VariableDeclaration" -> readVariables(node);
            case "ClassDeclaration", "ClassExpression" -> classes.add(readClass(node));
            case "ImportDeclaration" -> imports.add(readImport(node));
            case "ExportDefaultDeclaration", "ExportNamedDeclaration", "ExportAllDeclaration" ->
                exports.add(readExport(node));
            case "Identifier" -> {
                String name = node.string("name");
                if (name != null && !name.isEmpty()) {
                    identifiers.add(name);
                }
            }
            default -> {
                // not collected
            }
        }
    }

    /**
     * @return snapshot of everything visited so far
     */
    public JsStructure result() {
        return new JsStructure(functions, variables, classes, imports, exports, identifiers,
            statements, loops, conditionals, maxDepth);
    }

    private static FunctionInfo readFunction(SyntaxNode node) {
        List<String> params = new ArrayList<>();
        // Patterns, defaults and rest elements carry no direct name and are skipped.
        for (SyntaxNode param : node.nodes("params")) {
            String name = param.string("name");
            if (name != null && !name.isEmpty()) {
                params.add(name);
            }
        }
        return new FunctionInfo(
            FunctionKind.fromNodeType(node.type()),
            node.nestedName("id"),
            params,
            node.bool("async"),
            node.bool("generator"));
    }

    private void readVariables(SyntaxNode node) {
        DeclarationKind kind = DeclarationKind.fromKeyword(node.string("kind"));
        for (SyntaxNode declarator : node.nodes("declarations")) {
            variables.add(new VariableInfo(kind, declarator.nestedName("id")));
        }
    }

    private static ClassInfo readClass(SyntaxNode node) {
        SyntaxNode superClass = node.node("superClass");
        String superclassName = superClass != null && superClass.is("Identifier")
            ? superClass.string("name")
            : null;
        return new ClassInfo(ClassKind.fromNodeType(node.type()), node.nestedName("id"), superclassName);
    }

    private static ImportInfo readImport(SyntaxNode node) {
        List<ImportSpecifier> specifiers = new ArrayList<>();
        for (SyntaxNode specifier : node.nodes("specifiers")) {
            switch (specifier.type()) {
                case "ImportDefaultSpecifier" -> specifiers.add(
                    new ImportSpecifier(SpecifierKind.DEFAULT, null, specifier.nestedName("local")));
                case "ImportSpecifier" -> specifiers.add(
                    new ImportSpecifier(SpecifierKind.NAMED,
                        specifier.nestedName("imported"), specifier.nestedName("local")));
                case "ImportNamespaceSpecifier" -> specifiers.add(
                    new ImportSpecifier(SpecifierKind.NAMESPACE, null, specifier.nestedName("local")));
                default -> {
                    // unknown specifier shape
                }
            }
        }
        return new ImportInfo(sourceValue(node), specifiers);
    }

    private static ExportInfo readExport(SyntaxNode node) {
        return new ExportInfo(ExportKind.fromNodeType(node.type()), sourceValue(node));
    }

    private static String sourceValue(SyntaxNode node) {
        SyntaxNode source = node.node("source");
        return source != null ? source.string("value") : null;
    }
}
