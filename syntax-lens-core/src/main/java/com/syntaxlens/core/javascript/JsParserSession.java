package com.syntaxlens.core.javascript;

import com.syntaxlens.core.model.ClassInfo;
import com.syntaxlens.core.model.ComplexityMetrics;
import com.syntaxlens.core.model.DependencySet;
import com.syntaxlens.core.model.ExportInfo;
import com.syntaxlens.core.model.FunctionInfo;
import com.syntaxlens.core.model.ImportInfo;
import com.syntaxlens.core.model.JsComment;
import com.syntaxlens.core.model.JsToken;
import com.syntaxlens.core.model.ModuleType;
import com.syntaxlens.core.model.ValidationResult;
import com.syntaxlens.core.model.VariableInfo;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Stateful convenience wrapper around {@link JsTreeWalker} that remembers the last parse.
 *
 * <p>Extractors called without source text (or with an empty string) read the last
 * successful parse; before any parse they return empty results. Extractors given
 * source text parse it first and it becomes the last parse.
 *
 * <p>Not thread-safe: use one session per thread or guard it with an external lock.
 */
public class JsParserSession implements AutoCloseable {

    private final JsTreeWalker walker;
    private final boolean ownsWalker;
    private ParseResult last;

    /**
     * Creates a session with its own walker and engine.
     */
    public JsParserSession() {
        this(new JsTreeWalker(), true);
    }

    /**
     * Creates a session on a shared walker; {@link #close()} leaves it open.
     *
     * @param walker walker to delegate to
     */
    public JsParserSession(JsTreeWalker walker) {
        this(walker, false);
    }

    private JsParserSession(JsTreeWalker walker, boolean ownsWalker) {
        this.walker = Objects.requireNonNull(walker, "walker must not be null");
        this.ownsWalker = ownsWalker;
    }

    public ParseResult parse(String code) {
        return remember(walker.parse(code));
    }

    public ParseResult parse(String code, boolean jsx, boolean tolerant) {
        return remember(walker.parse(code, jsx, tolerant));
    }

    public ParseResult parseModule(String code, boolean jsx) {
        return remember(walker.parseModule(code, jsx));
    }

    /**
     * @return the last successful parse, if any
     */
    public Optional<ParseResult> lastResult() {
        return Optional.ofNullable(last);
    }

    /**
     * Forgets the last parse.
     */
    public void reset() {
        last = null;
    }

    public List<JsToken> tokenize(String code) {
        return walker.tokenize(code);
    }

    public List<FunctionInfo> extractFunctions() {
        return extractFunctions(null);
    }

    public List<FunctionInfo> extractFunctions(String code) {
        return withScriptTree(code, walker::extractFunctions, List.of());
    }

    public List<VariableInfo> extractVariables() {
        return extractVariables(null);
    }

    public List<VariableInfo> extractVariables(String code) {
        return withScriptTree(code, walker::extractVariables, List.of());
    }

    public List<ClassInfo> extractClasses() {
        return extractClasses(null);
    }

    public List<ClassInfo> extractClasses(String code) {
        return withScriptTree(code, walker::extractClasses, List.of());
    }

    public List<ImportInfo> extractImports() {
        return extractImports(null);
    }

    public List<ImportInfo> extractImports(String code) {
        return withModuleTree(code, walker::extractImports, List.of());
    }

    public List<ExportInfo> extractExports() {
        return extractExports(null);
    }

    public List<ExportInfo> extractExports(String code) {
        return withModuleTree(code, walker::extractExports, List.of());
    }

    public Set<String> getAllIdentifiers() {
        return getAllIdentifiers(null);
    }

    public Set<String> getAllIdentifiers(String code) {
        return withScriptTree(code, walker::getAllIdentifiers, Set.of());
    }

    public List<String> getFunctionNames(String code) {
        return withScriptTree(code, walker::getFunctionNames, List.of());
    }

    public List<String> getVariableNames(String code) {
        return withScriptTree(code, walker::getVariableNames, List.of());
    }

    public List<String> getClassNames(String code) {
        return withScriptTree(code, walker::getClassNames, List.of());
    }

    public ComplexityMetrics analyzeComplexity() {
        return analyzeComplexity(null);
    }

    /**
     * @param code source text, or null to reuse the last parse
     * @return metrics; all zero before any parse
     */
    public ComplexityMetrics analyzeComplexity(String code) {
        return withScriptTree(code, walker::analyzeComplexity, ComplexityMetrics.empty());
    }

    public ValidationResult validateSyntax(String code) {
        return walker.validateSyntax(code);
    }

    public ModuleType detectModuleType(String code) {
        return walker.detectModuleType(code);
    }

    public List<JsComment> extractComments(String code) {
        return walker.extractComments(code);
    }

    /**
     * Import sources come from a parse that becomes the last parse; require targets from tokens.
     */
    public DependencySet findDependencies(String code) {
        List<String> imports = extractImports(code).stream()
            .map(ImportInfo::source)
            .toList();
        return new DependencySet(imports, walker.findRequires(code));
    }

    public String toJson(int indent) {
        return toJson(null, indent);
    }

    /**
     * @param code source text, or null to reuse the last parse
     * @param indent spaces per level
     * @return ESTree JSON, or {@code "{}"} before any parse
     */
    public String toJson(String code, int indent) {
        return withScriptTree(code, result -> walker.toJson(result, indent), "{}");
    }

    /** {@inheritDoc} */
    @Override
    public void close() {
        if (ownsWalker) {
            walker.close();
        }
    }

    private ParseResult remember(ParseResult result) {
        last = result;
        return result;
    }

    private <T> T withScriptTree(String code, Function<ParseResult, T> extractor, T empty) {
        if (hasCode(code)) {
            parse(code);
        }
        return last != null ? extractor.apply(last) : empty;
    }

    private <T> T withModuleTree(String code, Function<ParseResult, T> extractor, T empty) {
        if (hasCode(code)) {
            remember(walker.parseForModuleSyntax(code));
        }
        return last != null ? extractor.apply(last) : empty;
    }

    private static boolean hasCode(String code) {
        return code != null && !code.isEmpty();
    }
}
