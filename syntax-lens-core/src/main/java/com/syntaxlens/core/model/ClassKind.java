package com.syntaxlens.core.model;

/**
 * Whether a class came from a statement or an expression.
 */
public enum ClassKind {
    DECLARATION("ClassDeclaration"),
    EXPRESSION("ClassExpression");

    private final String nodeType;

    ClassKind(String nodeType) {
        this.nodeType = nodeType;
    }

    public String nodeType() {
        return nodeType;
    }

    public static ClassKind fromNodeType(String nodeType) {
        for (ClassKind kind : values()) {
            if (kind.nodeType.equals(nodeType)) {
                return kind;
            }
        }
        return null;
    }
}
