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
import com.syntaxlens.core.model.SourceLocation;
import com.syntaxlens.core.model.SourcePosition;
import com.syntaxlens.core.model.SourceRange;
import com.syntaxlens.core.model.ValidationResult;
import com.syntaxlens.core.model.VariableInfo;
import com.syntaxlens.core.syntax.SyntaxNode;
import com.syntaxlens.core.syntax.SyntaxNodeJson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Parses JavaScript and extracts structure from ESTree programs.
 *
 * <p>Every extractor comes in two forms: one taking a {@link ParseResult} from
 * {@link #parse(String)} or {@link #parseModule(String, boolean)}, and one taking
 * source text that is parsed on the spot. Import and export extraction from text
 * tries the module grammar first since those declarations only exist there.
 *
 * <p>The walker holds no parse state. It shares the thread-safety of its
 * {@link EsprimaEngine}: calls are serialized on the engine.
 */
public class JsTreeWalker implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(JsTreeWalker.class);

    private final EsprimaEngine engine;
    private final boolean ownsEngine;

    /**
     * Creates a walker with its own engine, closed by {@link #close()}.
     */
    public JsTreeWalker() {
        this(new EsprimaEngine(), true);
    }

    /**
     * Creates a walker on a shared engine; {@link #close()} leaves the engine open.
     *
     * @param engine grammar engine
     */
    public JsTreeWalker(EsprimaEngine engine) {
        this(engine, false);
    }

    private JsTreeWalker(EsprimaEngine engine, boolean ownsEngine) {
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
        this.ownsEngine = ownsEngine;
    }

    /**
     * Parses with default options: tolerant, no JSX.
     *
     * @see #parse(String, JsParseOptions)
     */
    public ParseResult parse(String code) {
        return parse(code, JsParseOptions.defaults());
    }

    /**
     * @see #parse(String, JsParseOptions)
     */
    public ParseResult parse(String code, boolean jsx, boolean tolerant) {
        return parse(code, JsParseOptions.defaults().withJsx(jsx).withTolerant(tolerant));
    }

    /**
     * Parses as a script, retrying as a module if the script grammar rejects the source.
     *
     * @param code source text
     * @param options grammar options
     * @return the accepted parse
     * @throws JsParseException if both grammars reject the source; the message carries the script error
     */
    public ParseResult parse(String code, JsParseOptions options) {
        Objects.requireNonNull(code, "code must not be null");
        try {
            return new ParseResult(engine.parse(code, JsGrammar.SCRIPT, options), code, JsGrammar.SCRIPT, options);
        } catch (JsParseException scriptError) {
            log.debug("Script grammar rejected source, retrying as module: {}", scriptError.getMessage());
            try {
                return new ParseResult(engine.parse(code, JsGrammar.MODULE, options), code, JsGrammar.MODULE, options);
            } catch (JsParseException moduleError) {
                log.debug("Module grammar rejected source: {}", moduleError.getMessage());
                throw new JsParseException("Failed to parse JavaScript: " + scriptError.getMessage(), scriptError);
            }
        }
    }

    /**
     * Parses with whichever grammar fits the source better. A tolerant script parse
     * accepts {@code import} and {@code export} as recovered errors, so when the script
     * parse recovers from errors the module grammar is tried too, and its result wins
     * if it recovers from fewer.
     *
     * @param code source text
     * @param options grammar options
     * @return the parse with the fewest recovered errors, script on a tie
     * @throws JsParseException if both grammars reject the source
     */
    public ParseResult parseBestGoal(String code, JsParseOptions options) {
        ParseResult script = parse(code, options);
        if (!script.hasRecoveredErrors() || script.grammar() != JsGrammar.SCRIPT) {
            return script;
        }
        try {
            ParseResult module = new ParseResult(engine.parse(code, JsGrammar.MODULE, options), code, JsGrammar.MODULE, options);
            if (module.recoveredErrors().size() < script.recoveredErrors().size()) {
                log.debug("Module grammar recovered from fewer errors than script grammar");
                return module;
            }
        } catch (JsParseException moduleError) {
            log.debug("Module grammar rejected source: {}", moduleError.getMessage());
        }
        return script;
    }

    /**
     * Parses as an ES module (strict mode, {@code import}/{@code export} allowed).
     *
     * @param code source text
     * @param jsx accept JSX
     * @return the module parse
     * @throws JsParseException if the module grammar rejects the source
     */
    public ParseResult parseModule(String code, boolean jsx) {
        Objects.requireNonNull(code, "code must not be null");
        JsParseOptions options = JsParseOptions.defaults().withJsx(jsx);
        return new ParseResult(engine.parse(code, JsGrammar.MODULE, options), code, JsGrammar.MODULE, options);
    }

    /**
     * @param code source text
     * @return tokens with type, raw value, range and location
     * @throws JsParseException if the source cannot be tokenized
     */
    public List<JsToken> tokenize(String code) {
        Objects.requireNonNull(code, "code must not be null");
        List<JsToken> tokens = new ArrayList<>();
        for (SyntaxNode token : engine.tokenize(code)) {
            tokens.add(new JsToken(token.type(), token.string("value"), readRange(token), readLocation(token)));
        }
        return tokens;
    }

    /**
     * Collects every extraction concern in a single traversal.
     *
     * @param result parsed program
     * @return functions, variables, classes, imports, exports, identifiers and counts
     */
    public JsStructure analyze(ParseResult result) {
        return JsStructureCollector.collect(result.program());
    }

    public List<FunctionInfo> extractFunctions(ParseResult result) {
        return analyze(result).functions();
    }

    public List<FunctionInfo> extractFunctions(String code) {
        return extractFunctions(parse(code));
    }

    public List<VariableInfo> extractVariables(ParseResult result) {
        return analyze(result).variables();
    }

    public List<VariableInfo> extractVariables(String code) {
        return extractVariables(parse(code));
    }

    public List<ClassInfo> extractClasses(ParseResult result) {
        return analyze(result).classes();
    }

    public List<ClassInfo> extractClasses(String code) {
        return extractClasses(parse(code));
    }

    public List<ImportInfo> extractImports(ParseResult result) {
        return analyze(result).imports();
    }

    public List<ImportInfo> extractImports(String code) {
        return extractImports(parseForModuleSyntax(code));
    }

    public List<ExportInfo> extractExports(ParseResult result) {
        return analyze(result).exports();
    }

    public List<ExportInfo> extractExports(String code) {
        return extractExports(parseForModuleSyntax(code));
    }

    public Set<String> getAllIdentifiers(ParseResult result) {
        return analyze(result).identifiers();
    }

    public Set<String> getAllIdentifiers(String code) {
        return getAllIdentifiers(parse(code));
    }

    /**
     * @param result parsed program
     * @return names of named functions, in order
     */
    public List<String> getFunctionNames(ParseResult result) {
        List<String> names = new ArrayList<>();
        for (FunctionInfo function : extractFunctions(result)) {
            if (function.hasName()) {
                names.add(function.name());
            }
        }
        return names;
    }

    /**
     * @param result parsed program
     * @return names of simply-bound variables, in order
     */
    public List<String> getVariableNames(ParseResult result) {
        List<String> names = new ArrayList<>();
        for (VariableInfo variable : extractVariables(result)) {
            if (variable.name() != null && !variable.name().isEmpty()) {
                names.add(variable.name());
            }
        }
        return names;
    }

    /**
     * @param result parsed program
     * @return names of named classes, in order
     */
    public List<String> getClassNames(ParseResult result) {
        List<String> names = new ArrayList<>();
        for (ClassInfo info : extractClasses(result)) {
            if (info.name() != null && !info.name().isEmpty()) {
                names.add(info.name());
            }
        }
        return names;
    }

    /**
     * Counts functions, variables, classes, lines, statements, loops, conditionals and nesting depth.
     *
     * @param result parsed program; lines are counted on its source
     * @return complexity metrics
     */
    public ComplexityMetrics analyzeComplexity(ParseResult result) {
        return analyze(result).toMetrics(result.source());
    }

    public ComplexityMetrics analyzeComplexity(String code) {
        return analyzeComplexity(parse(code));
    }

    /**
     * Strict script parse. Never throws.
     *
     * @param code source text
     * @return valid, or invalid with the grammar's message
     */
    public ValidationResult validateSyntax(String code) {
        if (code == null) {
            return ValidationResult.invalid("No source to validate");
        }
        try {
            engine.parse(code, JsGrammar.SCRIPT, JsParseOptions.strict());
            return ValidationResult.ok();
        } catch (JsParseException e) {
            return ValidationResult.invalid(e.getMessage());
        }
    }

    /**
     * @see ModuleTypeDetector#detect(String)
     */
    public ModuleType detectModuleType(String code) {
        return ModuleTypeDetector.detect(code);
    }

    /**
     * Strict script parse with comment capture.
     *
     * @param code source text
     * @return comments in source order; empty if the source does not parse
     */
    public List<JsComment> extractComments(String code) {
        if (code == null) {
            return List.of();
        }
        SyntaxNode program;
        try {
            program = engine.parse(code, JsGrammar.SCRIPT, JsParseOptions.strict().withComments(true).withRange(true));
        } catch (JsParseException e) {
            log.debug("Comment extraction skipped, source does not parse: {}", e.getMessage());
            return List.of();
        }

        List<JsComment> comments = new ArrayList<>();
        for (SyntaxNode comment : program.nodes("comments")) {
            comments.add(new JsComment(comment.type(), comment.string("value"), readRange(comment), readLocation(comment)));
        }
        return comments;
    }

    /**
     * Lists ES module import sources and CommonJS {@code require} targets.
     *
     * @param code source text
     * @return import sources from the tree, require targets from the token stream
     * @throws JsParseException if the source neither parses nor tokenizes
     */
    public DependencySet findDependencies(String code) {
        List<String> imports = new ArrayList<>();
        for (ImportInfo info : extractImports(code)) {
            imports.add(info.source());
        }
        return new DependencySet(imports, findRequires(code));
    }

    /**
     * @param code source text
     * @return {@code require} targets found in the token stream
     */
    public List<String> findRequires(String code) {
        return RequireScanner.scan(tokenize(code));
    }

    /**
     * @param result parsed program
     * @param indent spaces per level; zero or less gives a single line
     * @return the program as ESTree JSON
     */
    public String toJson(ParseResult result, int indent) {
        return SyntaxNodeJson.toJson(result.program(), indent);
    }

    public String toJson(String code, int indent) {
        return toJson(parse(code), indent);
    }

    /** {@inheritDoc} */
    @Override
    public void close() {
        if (ownsEngine) {
            engine.close();
        }
    }

    /**
     * Module grammar first, then the script/module fallback of {@link #parse(String)}.
     */
    ParseResult parseForModuleSyntax(String code) {
        try {
            return parseModule(code, false);
        } catch (JsParseException e) {
            log.debug("Module grammar rejected source, falling back: {}", e.getMessage());
            return parse(code);
        }
    }

    private static SourceRange readRange(SyntaxNode node) {
        List<Object> range = node.list("range");
        if (range.size() < 2 || !(range.get(0) instanceof Number start) || !(range.get(1) instanceof Number end)) {
            return null;
        }
        return new SourceRange(start.intValue(), end.intValue());
    }

    private static SourceLocation readLocation(SyntaxNode node) {
        SyntaxNode loc = node.node("loc");
        if (loc == null) {
            return null;
        }
        return new SourceLocation(readPosition(loc.node("start")), readPosition(loc.node("end")));
    }

    private static SourcePosition readPosition(SyntaxNode position) {
        if (position == null) {
            return null;
        }
        return new SourcePosition(intField(position, "line"), intField(position, "column"));
    }

    private static int intField(SyntaxNode node, String name) {
        return node.get(name) instanceof Number number ? number.intValue() : 0;
    }
}
