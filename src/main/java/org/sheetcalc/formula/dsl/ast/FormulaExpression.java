package org.sheetcalc.formula.dsl.ast;

import org.sheetcalc.formula.dsl.SeparatorSettings;
import org.sheetcalc.formula.reference.Reference;

import java.util.List;
import java.util.function.Function;

/**
 * Sealed interface representing nodes of a parsed formula.
 *
 * Type hierarchy:
 * FormulaExpression
 * ├── LiteralExpression (1.5, "text", TRUE, #REF!)
 * ├── BinaryExpression (A1+B1, A1&"x", A1>=2)
 * ├── UnaryExpression (-A1, 50%)
 * ├── ParenthesizedExpression ((A1+B1))
 * ├── FunctionCallExpression (SUM(A1:A3))
 * ├── ReferenceExpression (A1, $B$2:C3, 2:4, B:D)
 * ├── ArrayConstantExpression ({1,2;3,4})
 * └── NameExpression (TaxRate)
 *
 * Nodes are immutable. Rewrites such as shifting references produce a new tree
 * that shares every unchanged subtree.
 */
public sealed interface FormulaExpression
        permits LiteralExpression, BinaryExpression, UnaryExpression,
        ParenthesizedExpression, FunctionCallExpression, ReferenceExpression,
        ArrayConstantExpression, NameExpression {

    /**
     * Accepts a visitor to process this expression.
     *
     * @param visitor The visitor
     * @param <T>     The return type
     * @return The result of visiting
     */
    <T> T accept(FormulaExpressionVisitor<T> visitor);

    /**
     * Canonical formula text of this node, written with the given separators.
     */
    String toExpressionText(SeparatorSettings separators);

    /**
     * Adds every reference in this subtree to {@code references}, in source order.
     * Names contribute their {@link org.sheetcalc.formula.reference.NamedReference}.
     */
    void collectReferences(List<Reference> references);

    /**
     * Rebuilds the tree, replacing every reference node with the result of {@code mapper}.
     * Returns {@code this} when the mapper leaves every reference node unchanged.
     */
    FormulaExpression mapReferences(Function<ReferenceExpression, FormulaExpression> mapper);
}
