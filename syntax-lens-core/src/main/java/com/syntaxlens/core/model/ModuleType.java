package com.syntaxlens.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Module system a JavaScript source appears to use.
 */
public enum ModuleType {
    ES6("es6"),
    COMMONJS("commonjs"),
    NONE("none");

    private final String label;

    ModuleType(String label) {
        this.label = label;
    }

    /**
     * @return lower-case name, also used in JSON output
     */
    @JsonValue
    public String label() {
        return label;
    }
}
