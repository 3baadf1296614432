package org.sheetcalc.engine.store;

import org.sheetcalc.engine.value.CellValue;
import org.sheetcalc.formula.reference.Axis;
import org.sheetcalc.formula.reference.Region;

import java.util.List;

/**
 * The values of one sheet.
 * <p>
 * Every mutation returns a record that {@link #restore} undoes. Writes through {@link #set},
 * {@link #clear}, {@link #copy} and {@link #restore} notify the change listeners; row and column
 * shifts do not, because the formula engine is told about them directly.
 */
public interface CellStore {

    String sheetName();

    /**
     * @return the value, EMPTY for a cell never written
     */
    CellValue get(int row, int col);

    CellStoreRestoreData set(int row, int col, CellValue value);

    CellStoreRestoreData clear(Region region);

    /**
     * Copies the values of {@code source} so that its top-left cell lands on {@code (toRow, toCol)}.
     */
    CellStoreRestoreData copy(Region source, int toRow, int toCol);

    CellStoreRestoreData insertRowCol(Axis axis, int index, int count);

    CellStoreRestoreData removeRowCol(Axis axis, int index, int count);

    void restore(CellStoreRestoreData data);

    /**
     * Values of the region indexed {@code [row - top][col - left]}, EMPTY where nothing is stored.
     */
    CellValue[][] getRange(Region region);

    List<StoredCell> getNonEmpty(Region region);

    /**
     * The smallest region holding every non-empty cell, or null when the store is empty.
     */
    Region usedRegion();

    void addCellsChangedListener(CellsChangedListener listener);

    void removeCellsChangedListener(CellsChangedListener listener);
}
