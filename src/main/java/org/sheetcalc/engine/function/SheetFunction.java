package org.sheetcalc.engine.function;

import org.sheetcalc.engine.value.CellValue;

import java.util.List;

/**
 * A function callable from formulas.
 *
 * Arguments arrive already converted to the declared parameter types. Unless
 * {@link #acceptsErrors()} is true, the call is skipped when any argument is an error
 * and that error becomes the result.
 */
public interface SheetFunction {

    List<ParameterDefinition> parameterDefinitions();

    /**
     * @param args One converted value per argument; arguments bound to a repeating
     *             parameter each occupy their own slot
     */
    CellValue call(CellValue[] args);

    default boolean acceptsErrors() {
        return false;
    }
}
