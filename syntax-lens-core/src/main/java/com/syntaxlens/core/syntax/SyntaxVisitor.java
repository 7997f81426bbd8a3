package com.syntaxlens.core.syntax;

/**
 * Callback for {@link SyntaxTreeWalker}.
 */
@FunctionalInterface
public interface SyntaxVisitor {

    /**
     * Called once per object node, parents before children.
     *
     * @param node the node being visited
     * @param depth number of object descents from the root (root is 0)
     */
    void visit(SyntaxNode node, int depth);
}
