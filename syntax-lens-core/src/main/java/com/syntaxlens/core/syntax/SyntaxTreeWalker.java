package com.syntaxlens.core.syntax;

import java.util.List;

/**
 * Depth-first, pre-order traversal over a {@link SyntaxNode} tree.
 *
 * <p>Every object-valued field and every object inside a list field is visited, in
 * field order. Lists do not add depth: an element of {@code body} sits one level
 * below the node owning {@code body}, exactly like a directly nested object.
 *
 * <p>Several visitors can share one pass, so extractors that need the same tree do
 * not each re-walk it.
 */
public final class SyntaxTreeWalker {

    private SyntaxTreeWalker() {
        // Utility class
    }

    /**
     * Walks the tree once, calling every visitor on every node.
     *
     * @param root tree root; null is a no-op
     * @param visitors visitors called in the given order for each node
     */
    public static void walk(SyntaxNode root, SyntaxVisitor... visitors) {
        if (root == null || visitors.length == 0) {
            return;
        }
        walkNode(root, 0, visitors);
    }

    private static void walkNode(SyntaxNode node, int depth, SyntaxVisitor[] visitors) {
        for (SyntaxVisitor visitor : visitors) {
            visitor.visit(node, depth);
        }
        for (Object value : node.fields().values()) {
            walkValue(value, depth + 1, visitors);
        }
    }

    private static void walkValue(Object value, int depth, SyntaxVisitor[] visitors) {
        if (value instanceof SyntaxNode child) {
            walkNode(child, depth, visitors);
        } else if (value instanceof List<?> items) {
            for (Object item : items) {
                walkValue(item, depth, visitors);
            }
        }
    }
}
