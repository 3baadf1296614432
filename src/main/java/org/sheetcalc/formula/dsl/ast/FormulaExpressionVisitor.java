package org.sheetcalc.formula.dsl.ast;

/**
 * Visitor over formula expression nodes.
 *
 * @param <T> The result type
 */
public interface FormulaExpressionVisitor<T> {

    T visit(LiteralExpression literal);

    T visit(BinaryExpression binary);

    T visit(UnaryExpression unary);

    T visit(ParenthesizedExpression parenthesized);

    T visit(FunctionCallExpression functionCall);

    T visit(ReferenceExpression reference);

    T visit(ArrayConstantExpression arrayConstant);

    T visit(NameExpression name);
}
