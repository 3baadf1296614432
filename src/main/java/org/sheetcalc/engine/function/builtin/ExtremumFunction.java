package org.sheetcalc.engine.function.builtin;

import org.sheetcalc.engine.function.ParameterDefinition;
import org.sheetcalc.engine.function.ParameterType;
import org.sheetcalc.engine.function.SheetFunction;
import org.sheetcalc.engine.value.CellValue;

import java.util.List;

/**
 * MIN and MAX: the smallest or largest number in the arguments, 0 when there are none.
 */
public final class ExtremumFunction implements SheetFunction {

    private static final List<ParameterDefinition> PARAMETERS = List.of(
            ParameterDefinition.repeating("number", ParameterType.NUMBER_SEQUENCE));

    private final boolean max;

    private ExtremumFunction(boolean max) {
        this.max = max;
    }

    public static ExtremumFunction min() {
        return new ExtremumFunction(false);
    }

    public static ExtremumFunction max() {
        return new ExtremumFunction(true);
    }

    @Override
    public List<ParameterDefinition> parameterDefinitions() {
        return PARAMETERS;
    }

    @Override
    public CellValue call(CellValue[] args) {
        Double result = null;
        for (CellValue arg : args) {
            for (CellValue value : arg.asSequence()) {
                if (value.isError()) {
                    return value;
                }
                double number = value.asNumber();
                if (result == null || (max ? number > result : number < result)) {
                    result = number;
                }
            }
        }
        return CellValue.number(result == null ? 0 : result);
    }
}
