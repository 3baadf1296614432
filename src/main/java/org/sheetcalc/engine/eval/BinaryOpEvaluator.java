package org.sheetcalc.engine.eval;

import org.sheetcalc.engine.value.CellValue;
import org.sheetcalc.engine.value.CellValueType;
import org.sheetcalc.engine.value.ErrorType;
import org.sheetcalc.formula.dsl.ast.BinaryExpression.Operator;

import java.util.Objects;

/**
 * Applies binary operators to evaluated operands.
 * Errors in the left operand win over errors in the right one.
 */
public final class BinaryOpEvaluator {

    private final CellValueCoercer coercer;

    public BinaryOpEvaluator(CellValueCoercer coercer) {
        this.coercer = Objects.requireNonNull(coercer, "Coercer cannot be null");
    }

    public CellValue evaluate(Operator operator, CellValue left, CellValue right) {
        CellValue lhs = resolveOperand(left);
        if (lhs.isError()) {
            return lhs;
        }
        CellValue rhs = resolveOperand(right);
        if (rhs.isError()) {
            return rhs;
        }

        return switch (operator) {
            case ADD, SUBTRACT, MULTIPLY, DIVIDE, POWER -> arithmetic(operator, lhs, rhs);
            case CONCAT -> concat(lhs, rhs);
            case EQUAL -> CellValue.logical(lhs.isEqualTo(rhs));
            case NOT_EQUAL -> CellValue.logical(!lhs.isEqualTo(rhs));
            case LESS_THAN, LESS_THAN_EQ, GREATER_THAN, GREATER_THAN_EQ -> compare(operator, lhs, rhs);
        };
    }

    private CellValue resolveOperand(CellValue operand) {
        CellValue resolved = coercer.resolve(operand);
        if (resolved.type() == CellValueType.ARRAY || resolved.type() == CellValueType.SEQUENCE) {
            return CellValue.error(ErrorType.VALUE, "A range cannot be used as a single value");
        }
        return resolved;
    }

    private CellValue arithmetic(Operator operator, CellValue lhs, CellValue rhs) {
        CellValue a = coercer.toNumber(lhs);
        if (a.isError()) {
            return a;
        }
        CellValue b = coercer.toNumber(rhs);
        if (b.isError()) {
            return b;
        }
        double x = a.asNumber();
        double y = b.asNumber();
        if (operator == Operator.DIVIDE && y == 0) {
            return CellValue.error(ErrorType.DIV0, "Division by zero");
        }

        double result = switch (operator) {
            case ADD -> x + y;
            case SUBTRACT -> x - y;
            case MULTIPLY -> x * y;
            case DIVIDE -> x / y;
            case POWER -> Math.pow(x, y);
            default -> throw new IllegalArgumentException("Not an arithmetic operator: " + operator);
        };
        return number(result);
    }

    private CellValue concat(CellValue lhs, CellValue rhs) {
        CellValue a = coercer.toText(lhs);
        if (a.isError()) {
            return a;
        }
        CellValue b = coercer.toText(rhs);
        if (b.isError()) {
            return b;
        }
        return CellValue.text(a.asText() + b.asText());
    }

    private static CellValue compare(Operator operator, CellValue lhs, CellValue rhs) {
        if (!lhs.isComparableWith(rhs)) {
            return CellValue.error(ErrorType.VALUE, "Cannot compare " + lhs.type() + " with " + rhs.type());
        }
        int order = lhs.compareTo(rhs);
        boolean result = switch (operator) {
            case LESS_THAN -> order < 0;
            case LESS_THAN_EQ -> order <= 0;
            case GREATER_THAN -> order > 0;
            case GREATER_THAN_EQ -> order >= 0;
            default -> throw new IllegalArgumentException("Not a relational operator: " + operator);
        };
        return CellValue.logical(result);
    }

    /**
     * Wraps an arithmetic result, turning infinities and NaN into {@code #NUM!}.
     */
    static CellValue number(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return CellValue.error(ErrorType.NUM, "Result is not a finite number");
        }
        return CellValue.number(value);
    }
}
