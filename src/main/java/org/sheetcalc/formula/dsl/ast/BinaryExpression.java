package org.sheetcalc.formula.dsl.ast;

import org.sheetcalc.formula.dsl.SeparatorSettings;
import org.sheetcalc.formula.reference.Reference;

import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * A binary operation, e.g. {@code A1+B1} or {@code A1<>"x"}.
 *
 * @param operator The operator
 * @param left     The left operand
 * @param right    The right operand
 */
public record BinaryExpression(
        Operator operator,
        FormulaExpression left,
        FormulaExpression right) implements FormulaExpression {

    public enum Operator {
        ADD("+"),
        SUBTRACT("-"),
        MULTIPLY("*"),
        DIVIDE("/"),
        POWER("^"),
        CONCAT("&"),
        EQUAL("="),
        NOT_EQUAL("<>"),
        LESS_THAN("<"),
        LESS_THAN_EQ("<="),
        GREATER_THAN(">"),
        GREATER_THAN_EQ(">=");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }

        public boolean isComparison() {
            return ordinal() >= EQUAL.ordinal();
        }
    }

    public BinaryExpression {
        Objects.requireNonNull(operator, "Operator cannot be null");
        Objects.requireNonNull(left, "Left operand cannot be null");
        Objects.requireNonNull(right, "Right operand cannot be null");
    }

    @Override
    public <T> T accept(FormulaExpressionVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public String toExpressionText(SeparatorSettings separators) {
        return left.toExpressionText(separators) + operator.symbol() + right.toExpressionText(separators);
    }

    @Override
    public void collectReferences(List<Reference> references) {
        left.collectReferences(references);
        right.collectReferences(references);
    }

    @Override
    public FormulaExpression mapReferences(Function<ReferenceExpression, FormulaExpression> mapper) {
        FormulaExpression newLeft = left.mapReferences(mapper);
        FormulaExpression newRight = right.mapReferences(mapper);
        if (newLeft == left && newRight == right) {
            return this;
        }
        return new BinaryExpression(operator, newLeft, newRight);
    }
}
