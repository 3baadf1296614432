package org.sheetcalc.engine.store;

@FunctionalInterface
public interface CellsChangedListener {

    void cellsChanged(CellsChangedEvent event);
}
