package org.sheetcalc.formula.reference;

/**
 * Reference to whole columns, e.g. {@code B:D} or {@code $A:$A}.
 *
 * @param startCol   First column (zero based)
 * @param endCol     Last column (zero based)
 * @param startFixed Whether the first column is absolute
 * @param endFixed   Whether the last column is absolute
 * @param sheetName  Explicit sheet, or null
 */
public record ColumnReference(
        int startCol,
        int endCol,
        boolean startFixed,
        boolean endFixed,
        String sheetName) implements Reference {

    public ColumnReference {
        if (startCol > endCol) {
            int col = startCol;
            startCol = endCol;
            endCol = col;
            boolean fixed = startFixed;
            startFixed = endFixed;
            endFixed = fixed;
        }
    }

    @Override
    public ReferenceKind kind() {
        return ReferenceKind.COLUMN;
    }

    @Override
    public Region region() {
        return Region.columns(startCol, endCol);
    }

    @Override
    public String toAddressText() {
        return RangeText.sheetPrefix(sheetName)
                + RangeText.fixed(startFixed) + RangeText.columnToLetters(startCol) + ":"
                + RangeText.fixed(endFixed) + RangeText.columnToLetters(endCol);
    }

    @Override
    public ColumnReference withSheetName(String sheetName) {
        return new ColumnReference(startCol, endCol, startFixed, endFixed, sheetName);
    }

    @Override
    public ColumnReference offset(int rowOffset, int colOffset) {
        int newStart = startFixed ? startCol : startCol + colOffset;
        int newEnd = endFixed ? endCol : endCol + colOffset;
        if (Math.min(newStart, newEnd) < 0 || Math.max(newStart, newEnd) >= RangeText.MAX_COLS) {
            return null;
        }
        return new ColumnReference(newStart, newEnd, startFixed, endFixed, sheetName);
    }

    @Override
    public ColumnReference afterInsert(Axis axis, int index, int count) {
        if (axis != Axis.COLUMN) {
            return this;
        }
        Region moved = region().afterInsert(axis, index, count);
        return moved == null ? null : new ColumnReference(moved.left(), moved.right(), startFixed, endFixed, sheetName);
    }

    @Override
    public ColumnReference afterRemove(Axis axis, int index, int count) {
        if (axis != Axis.COLUMN) {
            return this;
        }
        Region moved = region().afterRemove(axis, index, count);
        return moved == null ? null : new ColumnReference(moved.left(), moved.right(), startFixed, endFixed, sheetName);
    }

    @Override
    public String toString() {
        return toAddressText();
    }
}
