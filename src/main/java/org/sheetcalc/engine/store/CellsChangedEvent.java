package org.sheetcalc.engine.store;

import org.sheetcalc.formula.reference.Region;

import java.util.List;

/**
 * Cells of a store whose values were written.
 *
 * @param sheetName The store's sheet
 * @param regions   The written cells
 */
public record CellsChangedEvent(String sheetName, List<Region> regions) {

    public CellsChangedEvent {
        regions = List.copyOf(regions);
    }
}
