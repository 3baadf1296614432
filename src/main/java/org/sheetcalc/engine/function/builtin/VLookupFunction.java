package org.sheetcalc.engine.function.builtin;

import org.sheetcalc.engine.function.ParameterDefinition;
import org.sheetcalc.engine.function.ParameterType;
import org.sheetcalc.engine.function.SheetFunction;
import org.sheetcalc.engine.value.CellValue;
import org.sheetcalc.engine.value.ErrorType;

import java.util.List;

/**
 * VLOOKUP(lookup_value, table_array, col_index_num, [range_lookup]).
 * <p>
 * With an exact match the first row whose first cell equals the lookup value wins.
 * With a range lookup (the default) the first column is assumed sorted ascending and
 * the last row whose first cell is not greater than the lookup value wins.
 */
public final class VLookupFunction implements SheetFunction {

    private static final List<ParameterDefinition> PARAMETERS = List.of(
            ParameterDefinition.required("lookup_value", ParameterType.ANY),
            ParameterDefinition.required("table_array", ParameterType.ARRAY),
            ParameterDefinition.required("col_index_num", ParameterType.NUMBER),
            ParameterDefinition.optional("range_lookup", ParameterType.LOGICAL));

    @Override
    public List<ParameterDefinition> parameterDefinitions() {
        return PARAMETERS;
    }

    @Override
    public CellValue call(CellValue[] args) {
        CellValue lookup = args[0];
        CellValue[][] table = args[1].asArray();
        int column = (int) args[2].asNumber();
        boolean rangeLookup = args.length < 4 || args[3].asLogical();

        if (table.length == 0) {
            return CellValue.error(ErrorType.NA, "Lookup table is empty");
        }
        if (column < 1 || column > table[0].length) {
            return CellValue.error(ErrorType.REF, "Column " + column + " is outside the lookup table");
        }

        int row = rangeLookup ? findApproximate(table, lookup) : findExact(table, lookup);
        if (row < 0) {
            return CellValue.error(ErrorType.NA, "Value not found: " + lookup.toDisplayText());
        }
        return table[row][column - 1];
    }

    private static int findExact(CellValue[][] table, CellValue lookup) {
        for (int row = 0; row < table.length; row++) {
            if (table[row][0].isEqualTo(lookup)) {
                return row;
            }
        }
        return -1;
    }

    /**
     * Binary search over the first column for the last row not greater than the lookup value.
     * Cells of another type than the lookup value are skipped over.
     */
    private static int findApproximate(CellValue[][] table, CellValue lookup) {
        int low = 0;
        int high = table.length - 1;
        int found = -1;
        while (low <= high) {
            int mid = (low + high) >>> 1;
            int probe = nearestComparable(table, lookup, mid, low, high);
            if (probe < 0) {
                break;
            }
            if (table[probe][0].compareTo(lookup) <= 0) {
                found = probe;
                low = Math.max(probe, mid) + 1;
            } else {
                high = Math.min(probe, mid) - 1;
            }
        }
        return found;
    }

    private static int nearestComparable(CellValue[][] table, CellValue lookup, int mid, int low, int high) {
        for (int offset = 0; mid - offset >= low || mid + offset <= high; offset++) {
            if (mid - offset >= low && table[mid - offset][0].isComparableWith(lookup)) {
                return mid - offset;
            }
            if (mid + offset <= high && table[mid + offset][0].isComparableWith(lookup)) {
                return mid + offset;
            }
        }
        return -1;
    }
}
