package org.sheetcalc.engine.function.builtin;

import org.sheetcalc.engine.function.ParameterDefinition;
import org.sheetcalc.engine.function.ParameterType;
import org.sheetcalc.engine.function.SheetFunction;
import org.sheetcalc.engine.value.CellValue;
import org.sheetcalc.engine.value.ErrorType;

import java.util.List;

/**
 * AND and OR over logical values; {@code #VALUE!} when no logical value is supplied.
 */
public final class LogicalAggregateFunction implements SheetFunction {

    private static final List<ParameterDefinition> PARAMETERS = List.of(
            ParameterDefinition.repeating("logical", ParameterType.LOGICAL_SEQUENCE));

    private final boolean all;

    private LogicalAggregateFunction(boolean all) {
        this.all = all;
    }

    public static LogicalAggregateFunction and() {
        return new LogicalAggregateFunction(true);
    }

    public static LogicalAggregateFunction or() {
        return new LogicalAggregateFunction(false);
    }

    @Override
    public List<ParameterDefinition> parameterDefinitions() {
        return PARAMETERS;
    }

    @Override
    public CellValue call(CellValue[] args) {
        boolean any = false;
        boolean result = all;
        for (CellValue arg : args) {
            for (CellValue value : arg.asSequence()) {
                if (value.isError()) {
                    return value;
                }
                any = true;
                result = all ? result && value.asLogical() : result || value.asLogical();
            }
        }
        if (!any) {
            return CellValue.error(ErrorType.VALUE, "No logical values");
        }
        return CellValue.logical(result);
    }
}
