package com.syntaxlens.core.javascript;

/**
 * Top-level ECMAScript production a source is parsed against.
 */
public enum JsGrammar {
    /** Classic script: no {@code import}/{@code export} declarations. */
    SCRIPT("script"),
    /** ES module: strict mode, {@code import}/{@code export} allowed. */
    MODULE("module");

    private final String goal;

    JsGrammar(String goal) {
        this.goal = goal;
    }

    /**
     * @return goal name understood by the grammar bridge
     */
    public String goal() {
        return goal;
    }
}
