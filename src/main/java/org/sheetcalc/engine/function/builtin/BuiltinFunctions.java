package org.sheetcalc.engine.function.builtin;

import org.sheetcalc.engine.function.FunctionRegistry;

/**
 * The built-in function library.
 */
public final class BuiltinFunctions {

    private BuiltinFunctions() {
        // Static utility class
    }

    public static void registerAll(FunctionRegistry registry) {
        // Math
        registry.registerFunction("SUM", new SumFunction());
        registry.registerFunction("AVERAGE", new AverageFunction());
        registry.registerFunction("MIN", ExtremumFunction.min());
        registry.registerFunction("MAX", ExtremumFunction.max());
        registry.registerFunction("POWER", new PowerFunction());
        registry.registerFunction("SIN", new SinFunction());

        // Logical
        registry.registerFunction("IF", new IfFunction());
        registry.registerFunction("AND", LogicalAggregateFunction.and());
        registry.registerFunction("OR", LogicalAggregateFunction.or());
        registry.registerFunction("NOT", new NotFunction());
        registry.registerFunction("IFERROR", new IfErrorFunction());
        registry.registerFunction("ISERROR", new IsErrorFunction());

        // Lookup and statistics
        registry.registerFunction("VLOOKUP", new VLookupFunction());
        registry.registerFunction("SLOPE", RegressionFunction.slope());
        registry.registerFunction("INTERCEPT", RegressionFunction.intercept());
    }
}
