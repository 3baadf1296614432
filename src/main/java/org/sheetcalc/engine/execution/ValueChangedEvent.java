package org.sheetcalc.engine.execution;

import org.sheetcalc.engine.dependency.FormulaVertex;
import org.sheetcalc.engine.value.CellValue;

/**
 * A formula result that differs from the value stored before the calculation pass.
 *
 * @param vertex   The formula cell or named formula
 * @param oldValue The previous value
 * @param newValue The calculated value
 */
public record ValueChangedEvent(FormulaVertex vertex, CellValue oldValue, CellValue newValue) {
}
