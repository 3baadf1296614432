package org.sheetcalc.engine.function.builtin;

import org.sheetcalc.engine.function.ParameterDefinition;
import org.sheetcalc.engine.function.ParameterType;
import org.sheetcalc.engine.function.SheetFunction;
import org.sheetcalc.engine.value.CellValue;

import java.util.List;
import java.util.function.ToDoubleFunction;

/**
 * SLOPE(known_y's, known_x's) and INTERCEPT(known_y's, known_x's).
 */
public final class RegressionFunction implements SheetFunction {

    private static final List<ParameterDefinition> PARAMETERS = List.of(
            ParameterDefinition.required("known_y's", ParameterType.ARRAY),
            ParameterDefinition.required("known_x's", ParameterType.ARRAY));

    private final ToDoubleFunction<LinearRegression> result;

    private RegressionFunction(ToDoubleFunction<LinearRegression> result) {
        this.result = result;
    }

    public static RegressionFunction slope() {
        return new RegressionFunction(LinearRegression::slope);
    }

    public static RegressionFunction intercept() {
        return new RegressionFunction(LinearRegression::intercept);
    }

    @Override
    public List<ParameterDefinition> parameterDefinitions() {
        return PARAMETERS;
    }

    @Override
    public CellValue call(CellValue[] args) {
        return LinearRegression.fit(args[0].asArray(), args[1].asArray(), result);
    }
}
