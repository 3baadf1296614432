package org.sheetcalc.engine.function.builtin;

import org.sheetcalc.engine.function.ParameterDefinition;
import org.sheetcalc.engine.function.ParameterType;
import org.sheetcalc.engine.function.SheetFunction;
import org.sheetcalc.engine.value.CellValue;
import org.sheetcalc.engine.value.ErrorType;

import java.util.List;

/**
 * AVERAGE(number1, [number2], ...): arithmetic mean of the numbers; {@code #DIV/0!} when there are none.
 */
public final class AverageFunction implements SheetFunction {

    private static final List<ParameterDefinition> PARAMETERS = List.of(
            ParameterDefinition.repeating("number", ParameterType.NUMBER_SEQUENCE));

    @Override
    public List<ParameterDefinition> parameterDefinitions() {
        return PARAMETERS;
    }

    @Override
    public CellValue call(CellValue[] args) {
        double sum = 0;
        int count = 0;
        for (CellValue arg : args) {
            for (CellValue value : arg.asSequence()) {
                if (value.isError()) {
                    return value;
                }
                sum += value.asNumber();
                count++;
            }
        }
        if (count == 0) {
            return CellValue.error(ErrorType.DIV0, "AVERAGE of no numbers");
        }
        return CellValue.number(sum / count);
    }
}
