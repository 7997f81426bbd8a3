package com.syntaxlens.core.model;

/**
 * Syntactic form of a JavaScript function.
 */
public enum FunctionKind {
    DECLARATION("FunctionDeclaration"),
    EXPRESSION("FunctionExpression"),
    ARROW("ArrowFunctionExpression");

    private final String nodeType;

    FunctionKind(String nodeType) {
        this.nodeType = nodeType;
    }

    /**
     * @return ESTree node type this kind is read from
     */
    public String nodeType() {
        return nodeType;
    }

    /**
     * Resolves a kind from an ESTree node type.
     *
     * @param nodeType node type discriminant
     * @return matching kind, or null if the node is not a function
     */
    public static FunctionKind fromNodeType(String nodeType) {
        for (FunctionKind kind : values()) {
            if (kind.nodeType.equals(nodeType)) {
                return kind;
            }
        }
        return null;
    }
}
