package org.sheetcalc.engine.store;

import org.sheetcalc.engine.value.CellValue;

import java.util.Objects;

/**
 * A non-empty cell read from a store.
 */
public record StoredCell(int row, int col, CellValue value) {

    public StoredCell {
        Objects.requireNonNull(value, "Value cannot be null");
    }
}
