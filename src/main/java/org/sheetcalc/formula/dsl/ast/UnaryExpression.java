package org.sheetcalc.formula.dsl.ast;

import org.sheetcalc.formula.dsl.SeparatorSettings;
import org.sheetcalc.formula.reference.Reference;

import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Prefix {@code +}/{@code -} or postfix {@code %}.
 *
 * @param operator The operator
 * @param operand  The operand
 */
public record UnaryExpression(
        Operator operator,
        FormulaExpression operand) implements FormulaExpression {

    public enum Operator {
        PLUS("+", false),
        NEGATE("-", false),
        PERCENT("%", true);

        private final String symbol;
        private final boolean postfix;

        Operator(String symbol, boolean postfix) {
            this.symbol = symbol;
            this.postfix = postfix;
        }

        public String symbol() {
            return symbol;
        }

        public boolean isPostfix() {
            return postfix;
        }
    }

    public UnaryExpression {
        Objects.requireNonNull(operator, "Operator cannot be null");
        Objects.requireNonNull(operand, "Operand cannot be null");
    }

    public boolean isPostfix() {
        return operator.isPostfix();
    }

    @Override
    public <T> T accept(FormulaExpressionVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public String toExpressionText(SeparatorSettings separators) {
        String operandText = operand.toExpressionText(separators);
        return operator.isPostfix() ? operandText + operator.symbol() : operator.symbol() + operandText;
    }

    @Override
    public void collectReferences(List<Reference> references) {
        operand.collectReferences(references);
    }

    @Override
    public FormulaExpression mapReferences(Function<ReferenceExpression, FormulaExpression> mapper) {
        FormulaExpression newOperand = operand.mapReferences(mapper);
        return newOperand == operand ? this : new UnaryExpression(operator, newOperand);
    }
}
