package org.sheetcalc.engine.function.builtin;

import org.sheetcalc.engine.function.ParameterDefinition;
import org.sheetcalc.engine.function.ParameterType;
import org.sheetcalc.engine.function.SheetFunction;
import org.sheetcalc.engine.value.CellValue;

import java.util.List;

/**
 * POWER(number, power)
 */
public final class PowerFunction implements SheetFunction {

    private static final List<ParameterDefinition> PARAMETERS = List.of(
            ParameterDefinition.required("number", ParameterType.NUMBER),
            ParameterDefinition.required("power", ParameterType.NUMBER));

    @Override
    public List<ParameterDefinition> parameterDefinitions() {
        return PARAMETERS;
    }

    @Override
    public CellValue call(CellValue[] args) {
        return CellValue.number(Math.pow(args[0].asNumber(), args[1].asNumber()));
    }
}
