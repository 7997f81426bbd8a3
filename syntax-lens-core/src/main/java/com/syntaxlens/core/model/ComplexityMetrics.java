package com.syntaxlens.core.model;

/**
 * Structural size and complexity counts for one JavaScript source.
 *
 * @param functions number of function declarations, expressions and arrows
 * @param variables number of variable declarators
 * @param classes number of class declarations and expressions
 * @param lines newline count plus one; 0 without source text
 * @param statements nodes whose type name contains "Statement"
 * @param loops for, for-in, for-of, while and do-while statements
 * @param conditionals if statements, conditional expressions and switch statements
 * @param maxDepth deepest object nesting of the tree, counting every object descent
 */
public record ComplexityMetrics(
    int functions,
    int variables,
    int classes,
    int lines,
    int statements,
    int loops,
    int conditionals,
    int maxDepth
) {
    /**
     * @return metrics with every count at zero
     */
    public static ComplexityMetrics empty() {
        return new ComplexityMetrics(0, 0, 0, 0, 0, 0, 0, 0);
    }
}
