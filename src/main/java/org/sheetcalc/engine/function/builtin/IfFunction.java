package org.sheetcalc.engine.function.builtin;

import org.sheetcalc.engine.function.ParameterDefinition;
import org.sheetcalc.engine.function.ParameterType;
import org.sheetcalc.engine.function.SheetFunction;
import org.sheetcalc.engine.value.CellValue;

import java.util.List;

/**
 * IF(logical, [value_if_true], [value_if_false]).
 * Only an error in the condition or in the chosen branch reaches the result.
 */
public final class IfFunction implements SheetFunction {

    private static final List<ParameterDefinition> PARAMETERS = List.of(
            ParameterDefinition.required("logical", ParameterType.LOGICAL),
            ParameterDefinition.optional("value_if_true", ParameterType.ANY),
            ParameterDefinition.optional("value_if_false", ParameterType.ANY));

    @Override
    public List<ParameterDefinition> parameterDefinitions() {
        return PARAMETERS;
    }

    @Override
    public CellValue call(CellValue[] args) {
        CellValue condition = args[0];
        if (condition.isError()) {
            return condition;
        }
        boolean isTrue = condition.asLogical();
        if (isTrue) {
            return args.length > 1 ? args[1] : CellValue.logical(true);
        }
        return args.length > 2 ? args[2] : CellValue.logical(false);
    }

    @Override
    public boolean acceptsErrors() {
        return true;
    }
}
