package org.sheetcalc.engine.store;

import org.eclipse.collections.api.factory.Lists;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.map.mutable.primitive.LongObjectHashMap;
import org.sheetcalc.engine.store.CellStoreRestoreData.Change;
import org.sheetcalc.engine.store.CellStoreRestoreData.Shifted;
import org.sheetcalc.engine.store.CellStoreRestoreData.ValueChanged;
import org.sheetcalc.engine.value.CellValue;
import org.sheetcalc.formula.reference.Axis;
import org.sheetcalc.formula.reference.RangeText;
import org.sheetcalc.formula.reference.Region;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * In-memory store holding only non-empty cells, keyed by a packed row and column.
 */
public final class SparseCellStore implements CellStore {

    private static final int COLUMN_BITS = 14;
    private static final long COLUMN_MASK = (1L << COLUMN_BITS) - 1;

    private final String sheetName;
    private LongObjectHashMap<CellValue> cells = new LongObjectHashMap<>();
    private final MutableList<CellsChangedListener> listeners = Lists.mutable.empty();

    public SparseCellStore(String sheetName) {
        this.sheetName = sheetName;
    }

    @Override
    public String sheetName() {
        return sheetName;
    }

    // ==================== Reads ====================

    @Override
    public CellValue get(int row, int col) {
        CellValue value = cells.get(pack(row, col));
        return value == null ? CellValue.EMPTY : value;
    }

    @Override
    public CellValue[][] getRange(Region region) {
        CellValue[][] values = new CellValue[region.height()][region.width()];
        for (int r = 0; r < values.length; r++) {
            for (int c = 0; c < values[r].length; c++) {
                values[r][c] = get(region.top() + r, region.left() + c);
            }
        }
        return values;
    }

    @Override
    public List<StoredCell> getNonEmpty(Region region) {
        MutableList<StoredCell> result = Lists.mutable.empty();
        cells.forEachKeyValue((key, value) -> {
            if (region.contains(rowOf(key), colOf(key))) {
                result.add(new StoredCell(rowOf(key), colOf(key), value));
            }
        });
        return result.sortThis(Comparator.comparingInt(StoredCell::row).thenComparingInt(StoredCell::col));
    }

    @Override
    public Region usedRegion() {
        if (cells.isEmpty()) {
            return null;
        }
        int[] bounds = {Integer.MAX_VALUE, Integer.MAX_VALUE, -1, -1};
        cells.forEachKey(key -> {
            bounds[0] = Math.min(bounds[0], rowOf(key));
            bounds[1] = Math.min(bounds[1], colOf(key));
            bounds[2] = Math.max(bounds[2], rowOf(key));
            bounds[3] = Math.max(bounds[3], colOf(key));
        });
        return new Region(bounds[0], bounds[1], bounds[2], bounds[3]);
    }

    // ==================== Writes ====================

    @Override
    public CellStoreRestoreData set(int row, int col, CellValue value) {
        Objects.requireNonNull(value, "Value cannot be null");
        CellStoreRestoreData data = new CellStoreRestoreData();
        write(row, col, value, data);
        fireCellsChanged(List.of(Region.cell(row, col)));
        return data;
    }

    @Override
    public CellStoreRestoreData clear(Region region) {
        CellStoreRestoreData data = new CellStoreRestoreData();
        for (StoredCell cell : getNonEmpty(region)) {
            write(cell.row(), cell.col(), CellValue.EMPTY, data);
        }
        fireCellsChanged(List.of(region));
        return data;
    }

    @Override
    public CellStoreRestoreData copy(Region source, int toRow, int toCol) {
        Region target = new Region(toRow, toCol, toRow + source.height() - 1, toCol + source.width() - 1);
        if (target.bottom() >= RangeText.MAX_ROWS || target.right() >= RangeText.MAX_COLS) {
            throw new IllegalArgumentException("Copy target " + target + " lies outside the sheet");
        }

        CellValue[][] values = getRange(source);
        CellStoreRestoreData data = new CellStoreRestoreData();
        for (int r = 0; r < values.length; r++) {
            for (int c = 0; c < values[r].length; c++) {
                write(toRow + r, toCol + c, values[r][c], data);
            }
        }
        fireCellsChanged(List.of(target));
        return data;
    }

    private void write(int row, int col, CellValue value, CellStoreRestoreData data) {
        CellValue old = put(row, col, value);
        data.record(new ValueChanged(row, col, old, value));
    }

    private CellValue put(int row, int col, CellValue value) {
        CellValue old = value.isEmpty() ? cells.removeKey(pack(row, col)) : cells.put(pack(row, col), value);
        return old == null ? CellValue.EMPTY : old;
    }

    // ==================== Structural edits ====================

    @Override
    public CellStoreRestoreData insertRowCol(Axis axis, int index, int count) {
        validateEdit(index, count);
        CellStoreRestoreData data = new CellStoreRestoreData();
        int limit = axis == Axis.ROW ? RangeText.MAX_ROWS : RangeText.MAX_COLS;
        for (StoredCell cell : allCells()) {
            if (position(cell, axis) + count >= limit && position(cell, axis) >= index) {
                write(cell.row(), cell.col(), CellValue.EMPTY, data);
            }
        }
        shift(axis, index, count);
        data.record(new Shifted(axis, index, count, true));
        return data;
    }

    @Override
    public CellStoreRestoreData removeRowCol(Axis axis, int index, int count) {
        validateEdit(index, count);
        CellStoreRestoreData data = new CellStoreRestoreData();
        for (StoredCell cell : allCells()) {
            int position = position(cell, axis);
            if (position >= index && position < index + count) {
                write(cell.row(), cell.col(), CellValue.EMPTY, data);
            }
        }
        shift(axis, index + count, -count);
        data.record(new Shifted(axis, index, count, false));
        return data;
    }

    /**
     * Moves every cell at or after {@code from} along the axis by {@code delta}.
     */
    private void shift(Axis axis, int from, int delta) {
        LongObjectHashMap<CellValue> shifted = new LongObjectHashMap<>(cells.size());
        cells.forEachKeyValue((key, value) -> {
            int row = rowOf(key);
            int col = colOf(key);
            if (axis == Axis.ROW && row >= from) {
                row += delta;
            } else if (axis == Axis.COLUMN && col >= from) {
                col += delta;
            }
            shifted.put(pack(row, col), value);
        });
        cells = shifted;
    }

    private static void validateEdit(int index, int count) {
        if (index < 0) {
            throw new IllegalArgumentException("Index cannot be negative: " + index);
        }
        if (count <= 0) {
            throw new IllegalArgumentException("Count must be positive: " + count);
        }
    }

    private static int position(StoredCell cell, Axis axis) {
        return axis == Axis.ROW ? cell.row() : cell.col();
    }

    private List<StoredCell> allCells() {
        MutableList<StoredCell> result = Lists.mutable.empty();
        cells.forEachKeyValue((key, value) -> result.add(new StoredCell(rowOf(key), colOf(key), value)));
        return result;
    }

    // ==================== Restore ====================

    @Override
    public void restore(CellStoreRestoreData data) {
        MutableList<Region> changed = Lists.mutable.empty();
        List<Change> changes = data.changes();
        for (int i = changes.size() - 1; i >= 0; i--) {
            Change change = changes.get(i);
            if (change instanceof ValueChanged value) {
                put(value.row(), value.col(), value.oldValue());
                changed.add(Region.cell(value.row(), value.col()));
            } else if (change instanceof Shifted shifted) {
                if (shifted.inserted()) {
                    shift(shifted.axis(), shifted.index() + shifted.count(), -shifted.count());
                } else {
                    shift(shifted.axis(), shifted.index(), shifted.count());
                }
            }
        }
        if (changed.notEmpty()) {
            fireCellsChanged(changed);
        }
    }

    // ==================== Listeners ====================

    @Override
    public void addCellsChangedListener(CellsChangedListener listener) {
        listeners.add(Objects.requireNonNull(listener, "Listener cannot be null"));
    }

    @Override
    public void removeCellsChangedListener(CellsChangedListener listener) {
        listeners.remove(listener);
    }

    private void fireCellsChanged(List<Region> regions) {
        CellsChangedEvent event = new CellsChangedEvent(sheetName, regions);
        for (CellsChangedListener listener : Lists.mutable.withAll(listeners)) {
            listener.cellsChanged(event);
        }
    }

    // ==================== Keys ====================

    private static long pack(int row, int col) {
        return ((long) row << COLUMN_BITS) | col;
    }

    private static int rowOf(long key) {
        return (int) (key >>> COLUMN_BITS);
    }

    private static int colOf(long key) {
        return (int) (key & COLUMN_MASK);
    }
}
