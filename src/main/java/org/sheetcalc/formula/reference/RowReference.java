package org.sheetcalc.formula.reference;

/**
 * Reference to whole rows, e.g. {@code 2:5} or {@code $3:$3}.
 *
 * @param startRow   First row (zero based)
 * @param endRow     Last row (zero based)
 * @param startFixed Whether the first row is absolute
 * @param endFixed   Whether the last row is absolute
 * @param sheetName  Explicit sheet, or null
 */
public record RowReference(
        int startRow,
        int endRow,
        boolean startFixed,
        boolean endFixed,
        String sheetName) implements Reference {

    public RowReference {
        if (startRow > endRow) {
            int row = startRow;
            startRow = endRow;
            endRow = row;
            boolean fixed = startFixed;
            startFixed = endFixed;
            endFixed = fixed;
        }
    }

    @Override
    public ReferenceKind kind() {
        return ReferenceKind.ROW;
    }

    @Override
    public Region region() {
        return Region.rows(startRow, endRow);
    }

    @Override
    public String toAddressText() {
        return RangeText.sheetPrefix(sheetName)
                + RangeText.fixed(startFixed) + (startRow + 1) + ":"
                + RangeText.fixed(endFixed) + (endRow + 1);
    }

    @Override
    public RowReference withSheetName(String sheetName) {
        return new RowReference(startRow, endRow, startFixed, endFixed, sheetName);
    }

    @Override
    public RowReference offset(int rowOffset, int colOffset) {
        int newStart = startFixed ? startRow : startRow + rowOffset;
        int newEnd = endFixed ? endRow : endRow + rowOffset;
        if (Math.min(newStart, newEnd) < 0 || Math.max(newStart, newEnd) >= RangeText.MAX_ROWS) {
            return null;
        }
        return new RowReference(newStart, newEnd, startFixed, endFixed, sheetName);
    }

    @Override
    public RowReference afterInsert(Axis axis, int index, int count) {
        if (axis != Axis.ROW) {
            return this;
        }
        Region moved = region().afterInsert(axis, index, count);
        return moved == null ? null : new RowReference(moved.top(), moved.bottom(), startFixed, endFixed, sheetName);
    }

    @Override
    public RowReference afterRemove(Axis axis, int index, int count) {
        if (axis != Axis.ROW) {
            return this;
        }
        Region moved = region().afterRemove(axis, index, count);
        return moved == null ? null : new RowReference(moved.top(), moved.bottom(), startFixed, endFixed, sheetName);
    }

    @Override
    public String toString() {
        return toAddressText();
    }
}
