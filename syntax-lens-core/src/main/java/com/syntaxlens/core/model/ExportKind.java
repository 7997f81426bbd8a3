package com.syntaxlens.core.model;

/**
 * ESTree export declaration forms.
 */
public enum ExportKind {
    DEFAULT("ExportDefaultDeclaration"),
    NAMED("ExportNamedDeclaration"),
    ALL("ExportAllDeclaration");

    private final String nodeType;

    ExportKind(String nodeType) {
        this.nodeType = nodeType;
    }

    public String nodeType() {
        return nodeType;
    }

    public static ExportKind fromNodeType(String nodeType) {
        for (ExportKind kind : values()) {
            if (kind.nodeType.equals(nodeType)) {
                return kind;
            }
        }
        return null;
    }
}
