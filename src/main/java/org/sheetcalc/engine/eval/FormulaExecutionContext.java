package org.sheetcalc.engine.eval;

import org.eclipse.collections.api.factory.Lists;
import org.eclipse.collections.api.factory.Maps;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.map.MutableMap;
import org.sheetcalc.engine.value.CellValue;
import org.sheetcalc.formula.dsl.CellFormula;
import org.sheetcalc.formula.reference.RangeText;
import org.sheetcalc.formula.reference.Region;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * State of one evaluation pass.
 * <p>
 * Tracks the formulas currently being evaluated (the re-entrancy guard), the values
 * already computed in this pass, and the members of the cycle group being calculated.
 * Formulas are tracked by identity. A context is never shared between passes.
 */
public final class FormulaExecutionContext {

    private final String localSheet;
    private final Set<CellFormula> executing = Collections.newSetFromMap(new IdentityHashMap<>());
    private final Map<CellFormula, CellValue> computed = new IdentityHashMap<>();
    private final MutableMap<String, CellFormula> groupCells = Maps.mutable.empty();
    private final MutableMap<String, CellFormula> groupNames = Maps.mutable.empty();
    private final MutableList<GroupCell> groupCellList = Lists.mutable.empty();

    /**
     * A formula cell of the current group.
     */
    public record GroupCell(int row, int col, CellFormula formula) {

        public GroupCell {
            Objects.requireNonNull(formula, "Formula cannot be null");
        }
    }

    public FormulaExecutionContext(String localSheet) {
        this.localSheet = localSheet;
    }

    /**
     * The name of the sheet the evaluated formulas live on; may be null.
     */
    public String localSheet() {
        return localSheet;
    }

    // ==================== Re-entrancy guard ====================

    /**
     * Marks a formula as executing.
     *
     * @return false when the formula was already executing, i.e. it depends on itself
     */
    boolean enter(CellFormula formula) {
        return executing.add(formula);
    }

    void exit(CellFormula formula) {
        executing.remove(formula);
    }

    public boolean isExecuting(CellFormula formula) {
        return executing.contains(formula);
    }

    // ==================== Computed values ====================

    CellValue computed(CellFormula formula) {
        return computed.get(formula);
    }

    void recordComputed(CellFormula formula, CellValue value) {
        computed.put(formula, value);
    }

    // ==================== Current group ====================

    /**
     * Starts a new cycle group, forgetting the members of the previous one.
     */
    public void beginGroup() {
        groupCells.clear();
        groupNames.clear();
        groupCellList.clear();
    }

    public void addGroupCell(int row, int col, CellFormula formula) {
        GroupCell cell = new GroupCell(row, col, formula);
        groupCells.put(RangeText.cellText(row, col), formula);
        groupCellList.add(cell);
    }

    public void addGroupName(String name, CellFormula formula) {
        groupNames.put(name.toUpperCase(Locale.ROOT), Objects.requireNonNull(formula, "Formula cannot be null"));
    }

    /**
     * @return the formula of a group member cell on the local sheet, or null
     */
    public CellFormula groupCellFormula(int row, int col) {
        return groupCellList.isEmpty() ? null : groupCells.get(RangeText.cellText(row, col));
    }

    /**
     * @return the formula of a group member name, or null
     */
    public CellFormula groupNameFormula(String name) {
        return groupNames.isEmpty() ? null : groupNames.get(name.toUpperCase(Locale.ROOT));
    }

    public List<GroupCell> groupCellsIn(Region region) {
        return groupCellList.select(cell -> region.contains(cell.row(), cell.col()));
    }
}
