package org.sheetcalc.engine.function.builtin;

import org.sheetcalc.engine.function.ParameterDefinition;
import org.sheetcalc.engine.function.ParameterType;
import org.sheetcalc.engine.function.SheetFunction;
import org.sheetcalc.engine.value.CellValue;

import java.util.List;

/**
 * IFERROR(value, value_if_error)
 */
public final class IfErrorFunction implements SheetFunction {

    private static final List<ParameterDefinition> PARAMETERS = List.of(
            ParameterDefinition.required("value", ParameterType.ANY),
            ParameterDefinition.required("value_if_error", ParameterType.ANY));

    @Override
    public List<ParameterDefinition> parameterDefinitions() {
        return PARAMETERS;
    }

    @Override
    public CellValue call(CellValue[] args) {
        return args[0].isError() ? args[1] : args[0];
    }

    @Override
    public boolean acceptsErrors() {
        return true;
    }
}
