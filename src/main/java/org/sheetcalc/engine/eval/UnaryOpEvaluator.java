package org.sheetcalc.engine.eval;

import org.sheetcalc.engine.value.CellValue;
import org.sheetcalc.engine.value.CellValueType;
import org.sheetcalc.engine.value.ErrorType;
import org.sheetcalc.formula.dsl.ast.UnaryExpression.Operator;

import java.util.Objects;

/**
 * Applies prefix {@code +}/{@code -} and postfix {@code %} to an evaluated operand.
 */
public final class UnaryOpEvaluator {

    private final CellValueCoercer coercer;

    public UnaryOpEvaluator(CellValueCoercer coercer) {
        this.coercer = Objects.requireNonNull(coercer, "Coercer cannot be null");
    }

    public CellValue evaluate(Operator operator, CellValue operand) {
        CellValue resolved = coercer.resolve(operand);
        if (resolved.type() == CellValueType.ARRAY || resolved.type() == CellValueType.SEQUENCE) {
            return CellValue.error(ErrorType.VALUE, "A range cannot be used as a single value");
        }
        CellValue number = coercer.toNumber(resolved);
        if (number.isError()) {
            return number;
        }
        return switch (operator) {
            case PLUS -> number;
            case NEGATE -> CellValue.number(-number.asNumber());
            case PERCENT -> CellValue.number(number.asNumber() / 100);
        };
    }
}
