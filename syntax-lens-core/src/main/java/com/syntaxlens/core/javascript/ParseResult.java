package com.syntaxlens.core.javascript;

import com.syntaxlens.core.syntax.SyntaxNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Immutable outcome of one successful JavaScript parse.
 *
 * @param program the ESTree {@code Program} node
 * @param source source text the program was parsed from
 * @param grammar grammar goal that accepted the source
 * @param options options the grammar ran with
 */
public record ParseResult(
    SyntaxNode program,
    String source,
    JsGrammar grammar,
    JsParseOptions options
) {
    public ParseResult {
        Objects.requireNonNull(program, "program must not be null");
        Objects.requireNonNull(grammar, "grammar must not be null");
        source = source != null ? source : "";
        options = options != null ? options : JsParseOptions.defaults();
    }

    /**
     * @return "script" or "module" as reported by the grammar
     */
    public String sourceType() {
        String sourceType = program.string("sourceType");
        return sourceType != null ? sourceType : grammar.goal();
    }

    /**
     * Errors the grammar recovered from in tolerant mode.
     *
     * @return error messages in source order; empty for a clean parse
     */
    public List<String> recoveredErrors() {
        List<String> errors = new ArrayList<>();
        for (SyntaxNode error : program.nodes("errors")) {
            String message = error.string("message");
            errors.add(message != null ? message : error.string("description"));
        }
        return errors;
    }

    /**
     * @return true if tolerant parsing skipped over at least one error
     */
    public boolean hasRecoveredErrors() {
        return !program.list("errors").isEmpty();
    }
}
