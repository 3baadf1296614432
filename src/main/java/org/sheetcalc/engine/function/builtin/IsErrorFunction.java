package org.sheetcalc.engine.function.builtin;

import org.sheetcalc.engine.function.ParameterDefinition;
import org.sheetcalc.engine.function.ParameterType;
import org.sheetcalc.engine.function.SheetFunction;
import org.sheetcalc.engine.value.CellValue;

import java.util.List;

public final class IsErrorFunction implements SheetFunction {

    private static final List<ParameterDefinition> PARAMETERS = List.of(
            ParameterDefinition.required("value", ParameterType.ANY));

    @Override
    public List<ParameterDefinition> parameterDefinitions() {
        return PARAMETERS;
    }

    @Override
    public CellValue call(CellValue[] args) {
        return CellValue.logical(args[0].isError());
    }

    @Override
    public boolean acceptsErrors() {
        return true;
    }
}
