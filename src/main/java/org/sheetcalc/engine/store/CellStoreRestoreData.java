package org.sheetcalc.engine.store;

import org.eclipse.collections.api.factory.Lists;
import org.eclipse.collections.api.list.MutableList;
import org.sheetcalc.engine.value.CellValue;
import org.sheetcalc.formula.reference.Axis;

import java.util.List;
import java.util.Objects;

/**
 * Ordered record of the changes one store operation made; undone newest first.
 */
public final class CellStoreRestoreData {

    public sealed interface Change permits ValueChanged, Shifted {
    }

    public record ValueChanged(int row, int col, CellValue oldValue, CellValue newValue) implements Change {
    }

    /**
     * Rows or columns inserted or removed. Cells lost by a removal are recorded as
     * {@link ValueChanged} entries before the shift.
     */
    public record Shifted(Axis axis, int index, int count, boolean inserted) implements Change {
    }

    private final MutableList<Change> changes = Lists.mutable.empty();

    void record(Change change) {
        changes.add(Objects.requireNonNull(change, "Change cannot be null"));
    }

    public CellStoreRestoreData merge(CellStoreRestoreData later) {
        changes.addAll(later.changes);
        return this;
    }

    public List<Change> changes() {
        return changes.asUnmodifiable();
    }

    public boolean isEmpty() {
        return changes.isEmpty();
    }

    @Override
    public String toString() {
        return "CellStoreRestoreData" + changes;
    }
}
