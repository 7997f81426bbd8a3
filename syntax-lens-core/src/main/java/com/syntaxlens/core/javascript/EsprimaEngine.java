package com.syntaxlens.core.javascript;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.syntaxlens.core.syntax.SyntaxNode;
import com.syntaxlens.core.syntax.SyntaxNodeJson;
import org.graalvm.polyglot.Context;
import org.graalvm.polyglot.PolyglotException;
import org.graalvm.polyglot.Source;
import org.graalvm.polyglot.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs the Esprima ECMAScript parser inside a GraalJS polyglot context.
 *
 * <p>Loads {@code esprima.js} from its WebJar on the classpath plus a small bridge
 * script, then exposes parsing and tokenization. Results cross the polyglot boundary
 * as JSON and come back as {@link SyntaxNode} trees in ESTree shape.
 *
 * <p>The context is created once and reused for every call until {@link #close()}.
 * A GraalJS context must not be entered by two threads at the same time, so the
 * public methods are synchronized; callers wanting parallelism should create one
 * engine per thread.
 */
public class EsprimaEngine implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(EsprimaEngine.class);

    /** Esprima distribution shipped by {@code org.webjars.npm:esprima}. */
    public static final String ESPRIMA_RESOURCE =
        "META-INF/resources/webjars/esprima/4.0.1/dist/esprima.js";

    private static final String BRIDGE_RESOURCE = "js/esprima-bridge.js";
    private static final String PARSE_FUNCTION = "syntaxLensParse";
    private static final String TOKENIZE_FUNCTION = "syntaxLensTokenize";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Context context;
    private final Value parseFunction;
    private final Value tokenizeFunction;

    /**
     * Creates an engine backed by the bundled Esprima distribution.
     *
     * @throws IllegalStateException if the parser cannot be loaded
     */
    public EsprimaEngine() {
        this(ESPRIMA_RESOURCE);
    }

    /**
     * Creates an engine loading Esprima from the given classpath resource.
     *
     * @param esprimaResource classpath location of {@code esprima.js}
     * @throws IllegalStateException if either script is missing or fails to evaluate
     */
    public EsprimaEngine(String esprimaResource) {
        String esprimaSource = loadResource(esprimaResource);
        String bridgeSource = loadResource(BRIDGE_RESOURCE);
        log.debug("Esprima loaded from {} ({} bytes)", esprimaResource, esprimaSource.length());

        this.context = createContext();

        try {
            context.eval(Source.newBuilder("js", esprimaSource, "esprima.js").buildLiteral());
            context.eval(Source.newBuilder("js", bridgeSource, "esprima-bridge.js").buildLiteral());

            Value bindings = context.getBindings("js");
            this.parseFunction = bindings.getMember(PARSE_FUNCTION);
            this.tokenizeFunction = bindings.getMember(TOKENIZE_FUNCTION);

            if (parseFunction == null || !parseFunction.canExecute()) {
                throw new IllegalStateException(PARSE_FUNCTION + " function not found in bridge script");
            }
            if (tokenizeFunction == null || !tokenizeFunction.canExecute()) {
                throw new IllegalStateException(TOKENIZE_FUNCTION + " function not found in bridge script");
            }
        } catch (RuntimeException e) {
            context.close();
            throw e instanceof IllegalStateException ? e : new IllegalStateException("Failed to initialize Esprima", e);
        }
        log.info("Esprima engine ready");
    }

    /**
     * Parses source text against one grammar goal.
     *
     * @param code source text
     * @param grammar script or module goal
     * @param options grammar options
     * @return the {@code Program} node
     * @throws JsParseException if the grammar rejects the source
     */
    public synchronized SyntaxNode parse(String code, JsGrammar grammar, JsParseOptions options) {
        JsonNode envelope = call(parseFunction, code, grammar.goal(), optionsJson(options));
        return SyntaxNodeJson.fromJson(envelope.get("program"));
    }

    /**
     * Splits source text into tokens with offsets and locations.
     *
     * @param code source text
     * @return token objects in source order, each typed by its token class
     * @throws JsParseException if the source cannot be tokenized
     */
    public synchronized List<SyntaxNode> tokenize(String code) {
        ObjectNode options = MAPPER.createObjectNode()
            .put("range", true)
            .put("loc", true);
        JsonNode envelope = call(tokenizeFunction, code, options.toString());

        List<SyntaxNode> tokens = new ArrayList<>();
        for (JsonNode token : envelope.path("tokens")) {
            tokens.add(SyntaxNodeJson.fromJson(token));
        }
        return tokens;
    }

    /** {@inheritDoc} */
    @Override
    public synchronized void close() {
        context.close();
    }

    private JsonNode call(Value function, Object... arguments) {
        String json;
        try {
            json = function.execute(arguments).asString();
        } catch (PolyglotException e) {
            throw new JsParseException(e.getMessage(), -1, -1, -1, e.getMessage());
        }

        JsonNode envelope;
        try {
            envelope = MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Grammar bridge returned malformed JSON", e);
        }

        if (envelope.path("error").asBoolean(false)) {
            throw new JsParseException(
                envelope.path("message").asText("Unknown syntax error"),
                envelope.path("index").asInt(-1),
                envelope.path("lineNumber").asInt(-1),
                envelope.path("column").asInt(-1),
                envelope.path("description").isNull() ? null : envelope.path("description").asText(null));
        }
        return envelope;
    }

    private static String optionsJson(JsParseOptions options) {
        return MAPPER.createObjectNode()
            .put("jsx", options.jsx())
            .put("tolerant", options.tolerant())
            .put("range", options.range())
            .put("loc", options.loc())
            .put("tokens", options.tokens())
            .put("comment", options.comment())
            .toString();
    }

    /**
     * Creates a GraalJS context with no host or I/O access.
     */
    private static Context createContext() {
        return Context.newBuilder("js")
            .allowExperimentalOptions(true)
            .option("js.ecmascript-version", "2022")
            .option("engine.WarnInterpreterOnly", "false")
            .build();
    }

    private static String loadResource(String resource) {
        try (InputStream is = EsprimaEngine.class.getClassLoader().getResourceAsStream(resource)) {
            if (is == null) {
                throw new IllegalStateException("Script not found on classpath: " + resource);
            }
            return new String(is.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read script: " + resource, e);
        }
    }
}
