package org.sheetcalc.engine.eval;

import org.sheetcalc.engine.function.SheetFunction;
import org.sheetcalc.engine.value.CellValue;
import org.sheetcalc.formula.reference.Reference;

/**
 * Everything a formula can see while it is evaluated: cell values, variables and functions.
 */
public interface Environment {

    // ==================== Cells ====================

    /**
     * @param sheetName The sheet to read, or null for the sheet the formula lives on
     * @return the stored value, {@code #REF!} when the sheet is unknown
     */
    CellValue getCellValue(int row, int col, String sheetName);

    /**
     * The values covered by a cell, range, row or column reference as an ARRAY value.
     * The array starts at the reference's top-left cell; whole-row and whole-column
     * references are clipped to the used part of the sheet.
     */
    CellValue getRangeValues(Reference reference);

    void setCellValue(int row, int col, String sheetName, CellValue value);

    // ==================== Functions ====================

    boolean functionExists(String name);

    /**
     * @return the function, or null when no function has this name
     */
    SheetFunction getFunction(String name);

    // ==================== Variables ====================

    boolean variableExists(String name);

    /**
     * @return the value bound to the name, or null when it is not defined
     */
    CellValue getVariable(String name);

    void setVariable(String name, CellValue value);

    void clearVariable(String name);
}
