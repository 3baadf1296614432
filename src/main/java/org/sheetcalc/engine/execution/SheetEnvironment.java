package org.sheetcalc.engine.execution;

import org.eclipse.collections.api.factory.Maps;
import org.eclipse.collections.api.map.MutableMap;
import org.sheetcalc.engine.eval.Environment;
import org.sheetcalc.engine.function.FunctionRegistry;
import org.sheetcalc.engine.function.SheetFunction;
import org.sheetcalc.engine.store.CellStore;
import org.sheetcalc.engine.value.CellValue;
import org.sheetcalc.engine.value.ErrorType;
import org.sheetcalc.formula.reference.Reference;
import org.sheetcalc.formula.reference.Region;

import java.util.Locale;
import java.util.Objects;

/**
 * Environment backed by cell stores, one per sheet, a variable table and a function registry.
 * Sheet and variable names are case-insensitive.
 */
public final class SheetEnvironment implements Environment {

    private final CellStore localStore;
    private final MutableMap<String, CellStore> sheets = Maps.mutable.empty();
    private final MutableMap<String, CellValue> variables = Maps.mutable.empty();
    private final FunctionRegistry functions;

    public SheetEnvironment(CellStore localStore, FunctionRegistry functions) {
        this.localStore = Objects.requireNonNull(localStore, "Local store cannot be null");
        this.functions = Objects.requireNonNull(functions, "Function registry cannot be null");
        addSheet(localStore);
    }

    /**
     * Makes another sheet visible to qualified references such as {@code Other!A1}.
     */
    public void addSheet(CellStore store) {
        sheets.put(normalize(store.sheetName()), store);
    }

    // ==================== Cells ====================

    @Override
    public CellValue getCellValue(int row, int col, String sheetName) {
        CellStore store = storeFor(sheetName);
        if (store == null) {
            return unknownSheet(sheetName);
        }
        return store.get(row, col);
    }

    @Override
    public CellValue getRangeValues(Reference reference) {
        CellStore store = storeFor(reference.sheetName());
        if (store == null) {
            return unknownSheet(reference.sheetName());
        }
        Region region = clip(reference.region(), store.usedRegion());
        return CellValue.array(region == null ? new CellValue[0][0] : store.getRange(region));
    }

    /**
     * Limits whole-row and whole-column regions to the used part of the sheet,
     * keeping their top-left corner. Returns null when nothing is left.
     */
    private static Region clip(Region region, Region used) {
        if (!region.isFullColumns() && !region.isFullRows()) {
            return region;
        }
        if (used == null) {
            return null;
        }
        int bottom = region.isFullColumns() ? Math.min(region.bottom(), used.bottom()) : region.bottom();
        int right = region.isFullRows() ? Math.min(region.right(), used.right()) : region.right();
        if (bottom < region.top() || right < region.left()) {
            return null;
        }
        return new Region(region.top(), region.left(), bottom, right);
    }

    @Override
    public void setCellValue(int row, int col, String sheetName, CellValue value) {
        CellStore store = storeFor(sheetName);
        if (store == null) {
            throw new IllegalArgumentException("Unknown sheet: " + sheetName);
        }
        store.set(row, col, value);
    }

    private CellStore storeFor(String sheetName) {
        return sheetName == null ? localStore : sheets.get(normalize(sheetName));
    }

    private static CellValue unknownSheet(String sheetName) {
        return CellValue.error(ErrorType.REF, "Unknown sheet " + sheetName);
    }

    // ==================== Functions ====================

    @Override
    public boolean functionExists(String name) {
        return functions.functionExists(name);
    }

    @Override
    public SheetFunction getFunction(String name) {
        return functions.getDefinition(name);
    }

    // ==================== Variables ====================

    @Override
    public boolean variableExists(String name) {
        return variables.containsKey(normalize(name));
    }

    @Override
    public CellValue getVariable(String name) {
        return variables.get(normalize(name));
    }

    @Override
    public void setVariable(String name, CellValue value) {
        variables.put(normalize(name), Objects.requireNonNull(value, "Value cannot be null"));
    }

    @Override
    public void clearVariable(String name) {
        variables.remove(normalize(name));
    }

    private static String normalize(String name) {
        return name.toUpperCase(Locale.ROOT);
    }
}
