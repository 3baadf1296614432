package org.sheetcalc.engine.execution;

import org.sheetcalc.engine.dependency.DependencyRestoreData;
import org.sheetcalc.engine.dependency.FormulaVertex;
import org.sheetcalc.engine.dependency.VertexKind;
import org.sheetcalc.engine.function.FunctionRegistry;
import org.sheetcalc.engine.store.CellStoreRestoreData;
import org.sheetcalc.engine.store.SparseCellStore;
import org.sheetcalc.engine.value.CellValue;
import org.sheetcalc.formula.dsl.CellFormula;
import org.sheetcalc.formula.reference.Axis;
import org.sheetcalc.formula.reference.CellReference;
import org.sheetcalc.formula.reference.RangeText;
import org.sheetcalc.formula.reference.Region;

import java.util.Objects;

/**
 * A calculating sheet: a cell store, an environment over it and a formula engine, wired so that
 * every write recalculates the formulas reading it.
 * <p>
 * Each edit returns a {@link SheetRestoreData} that {@link #undo} reverts.
 */
public final class FormulaSheet {

    private final SparseCellStore store;
    private final SheetEnvironment environment;
    private final FormulaEngine engine;

    public FormulaSheet() {
        this(FormulaOptions.defaults(), FunctionRegistry.withBuiltins());
    }

    public FormulaSheet(FormulaOptions options, FunctionRegistry functions) {
        this.store = new SparseCellStore(options.sheetName());
        this.environment = new SheetEnvironment(store, functions);
        this.engine = new FormulaEngine(environment, functions, options);
        store.addCellsChangedListener(event -> engine.cellsChanged(event.sheetName(), event.regions()));
    }

    // ==================== Cells ====================

    /**
     * Writes a cell. Strings starting with '=' are formulas; anything else is a value,
     * typed as by {@link CellValue#of(Object)}.
     */
    public SheetRestoreData setCellValue(int row, int col, Object value) {
        if (FormulaEngine.isFormula(value)) {
            return setFormula(row, col, engine.parse((String) value));
        }
        DependencyRestoreData dependencies = engine.clearFormula(row, col);
        CellStoreRestoreData cells = store.set(row, col, CellValue.of(value));
        return new SheetRestoreData(cells, dependencies);
    }

    private SheetRestoreData setFormula(int row, int col, CellFormula formula) {
        DependencyRestoreData dependencies = engine.setFormula(row, col, formula);
        CellStoreRestoreData cells = store.set(row, col, CellValue.EMPTY);
        return new SheetRestoreData(cells, dependencies);
    }

    /**
     * Convenience for A1-style addresses, e.g. {@code set("B2", "=A1*2")}.
     */
    public SheetRestoreData set(String address, Object value) {
        Region cell = parseAddress(address);
        return setCellValue(cell.top(), cell.left(), value);
    }

    public CellValue getCellValue(int row, int col) {
        return store.get(row, col);
    }

    public CellValue get(String address) {
        Region cell = parseAddress(address);
        return getCellValue(cell.top(), cell.left());
    }

    /**
     * @return the canonical formula text of a cell, or null when it holds no formula
     */
    public String getFormulaString(int row, int col) {
        CellFormula formula = engine.getFormula(row, col);
        return formula == null ? null : formula.toFormulaString();
    }

    public String getFormulaString(String address) {
        Region cell = parseAddress(address);
        return getFormulaString(cell.top(), cell.left());
    }

    public SheetRestoreData clearCells(Region region) {
        DependencyRestoreData dependencies = new DependencyRestoreData();
        for (FormulaVertex vertex : engine.dependencyManager().findDependents(region, null)) {
            if (vertex.kind() == VertexKind.CELL && vertex.hasFormula() && region.contains(vertex.row(), vertex.col())) {
                dependencies.merge(engine.clearFormula(vertex.row(), vertex.col()));
            }
        }
        CellStoreRestoreData cells = store.clear(region);
        return new SheetRestoreData(cells, dependencies);
    }

    /**
     * Copies values and formulas of {@code source} so its top-left cell lands on {@code (toRow, toCol)}.
     * Relative references in copied formulas move with them.
     */
    public SheetRestoreData copyRange(Region source, int toRow, int toCol) {
        int rowOffset = toRow - source.top();
        int colOffset = toCol - source.left();
        CellValue[][] values = store.getRange(source);
        CellFormula[][] formulas = new CellFormula[source.height()][source.width()];
        for (int r = 0; r < formulas.length; r++) {
            for (int c = 0; c < formulas[r].length; c++) {
                formulas[r][c] = engine.getFormula(source.top() + r, source.left() + c);
            }
        }

        CellStoreRestoreData cells = new CellStoreRestoreData();
        DependencyRestoreData dependencies = new DependencyRestoreData();
        for (int r = 0; r < values.length; r++) {
            for (int c = 0; c < values[r].length; c++) {
                SheetRestoreData step = formulas[r][c] != null
                        ? setFormula(toRow + r, toCol + c, formulas[r][c].offset(rowOffset, colOffset))
                        : setCellValue(toRow + r, toCol + c, values[r][c]);
                cells.merge(step.cells());
                dependencies.merge(step.dependencies());
            }
        }
        return new SheetRestoreData(cells, dependencies);
    }

    // ==================== Structural edits ====================

    public SheetRestoreData insertRows(int index, int count) {
        return insert(Axis.ROW, index, count);
    }

    public SheetRestoreData insertColumns(int index, int count) {
        return insert(Axis.COLUMN, index, count);
    }

    public SheetRestoreData removeRows(int index, int count) {
        return remove(Axis.ROW, index, count);
    }

    public SheetRestoreData removeColumns(int index, int count) {
        return remove(Axis.COLUMN, index, count);
    }

    private SheetRestoreData insert(Axis axis, int index, int count) {
        CellStoreRestoreData cells = store.insertRowCol(axis, index, count);
        DependencyRestoreData dependencies = engine.insertRowCol(axis, index, count);
        return new SheetRestoreData(cells, dependencies);
    }

    private SheetRestoreData remove(Axis axis, int index, int count) {
        CellStoreRestoreData cells = store.removeRowCol(axis, index, count);
        DependencyRestoreData dependencies = engine.removeRowCol(axis, index, count);
        return new SheetRestoreData(cells, dependencies);
    }

    // ==================== Undo ====================

    /**
     * Reverts an edit: the dependency graph first, so the store's change notifications
     * recalculate against the restored formulas, then the store, then a full pass.
     */
    public void undo(SheetRestoreData data) {
        Objects.requireNonNull(data, "Restore data cannot be null");
        engine.restore(data.dependencies());
        store.restore(data.cells());
        engine.calculate(true);
    }

    // ==================== Names ====================

    public DependencyRestoreData defineName(String name, Object value) {
        return engine.setVariable(name, value);
    }

    // ==================== Accessors ====================

    public FormulaEngine engine() {
        return engine;
    }

    public SparseCellStore store() {
        return store;
    }

    public SheetEnvironment environment() {
        return environment;
    }

    private static Region parseAddress(String address) {
        CellReference reference = RangeText.parseCell(address, null);
        if (reference == null) {
            throw new IllegalArgumentException("Not a cell address: " + address);
        }
        return reference.region();
    }
}
