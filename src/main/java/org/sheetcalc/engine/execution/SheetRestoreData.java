package org.sheetcalc.engine.execution;

import org.sheetcalc.engine.dependency.DependencyRestoreData;
import org.sheetcalc.engine.store.CellStoreRestoreData;

import java.util.Objects;

/**
 * Everything needed to undo one sheet edit: the store's changes and the dependency graph's changes.
 */
public record SheetRestoreData(CellStoreRestoreData cells, DependencyRestoreData dependencies) {

    public SheetRestoreData {
        Objects.requireNonNull(cells, "Cell restore data cannot be null");
        Objects.requireNonNull(dependencies, "Dependency restore data cannot be null");
    }
}
