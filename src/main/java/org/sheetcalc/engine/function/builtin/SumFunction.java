package org.sheetcalc.engine.function.builtin;

import org.sheetcalc.engine.function.ParameterDefinition;
import org.sheetcalc.engine.function.ParameterType;
import org.sheetcalc.engine.function.SheetFunction;
import org.sheetcalc.engine.value.CellValue;

import java.util.List;

/**
 * SUM(number1, [number2], ...): adds every number in the arguments; text and empty cells in ranges are ignored.
 */
public final class SumFunction implements SheetFunction {

    private static final List<ParameterDefinition> PARAMETERS = List.of(
            ParameterDefinition.repeating("number", ParameterType.NUMBER_SEQUENCE));

    @Override
    public List<ParameterDefinition> parameterDefinitions() {
        return PARAMETERS;
    }

    @Override
    public CellValue call(CellValue[] args) {
        double sum = 0;
        for (CellValue arg : args) {
            for (CellValue value : arg.asSequence()) {
                if (value.isError()) {
                    return value;
                }
                sum += value.asNumber();
            }
        }
        return CellValue.number(sum);
    }
}
