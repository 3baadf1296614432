package org.sheetcalc.formula.reference;

/**
 * Reference to a single cell.
 *
 * @param row       Zero based row index
 * @param col       Zero based column index
 * @param rowFixed  Whether the row is absolute ($1)
 * @param colFixed  Whether the column is absolute ($A)
 * @param sheetName Explicit sheet, or null
 */
public record CellReference(
        int row,
        int col,
        boolean rowFixed,
        boolean colFixed,
        String sheetName) implements Reference {

    public CellReference(int row, int col) {
        this(row, col, false, false, null);
    }

    @Override
    public ReferenceKind kind() {
        return ReferenceKind.CELL;
    }

    @Override
    public Region region() {
        return Region.cell(row, col);
    }

    @Override
    public String toAddressText() {
        return RangeText.sheetPrefix(sheetName) + toLocalText();
    }

    /**
     * Address text without the sheet qualifier.
     */
    public String toLocalText() {
        return RangeText.fixed(colFixed) + RangeText.columnToLetters(col)
                + RangeText.fixed(rowFixed) + (row + 1);
    }

    @Override
    public CellReference withSheetName(String sheetName) {
        return new CellReference(row, col, rowFixed, colFixed, sheetName);
    }

    @Override
    public CellReference offset(int rowOffset, int colOffset) {
        int newRow = rowFixed ? row : row + rowOffset;
        int newCol = colFixed ? col : col + colOffset;
        if (newRow < 0 || newCol < 0 || newRow >= RangeText.MAX_ROWS || newCol >= RangeText.MAX_COLS) {
            return null;
        }
        return new CellReference(newRow, newCol, rowFixed, colFixed, sheetName);
    }

    @Override
    public CellReference afterInsert(Axis axis, int index, int count) {
        Region moved = region().afterInsert(axis, index, count);
        return moved == null ? null : moveTo(moved);
    }

    @Override
    public CellReference afterRemove(Axis axis, int index, int count) {
        Region moved = region().afterRemove(axis, index, count);
        return moved == null ? null : moveTo(moved);
    }

    CellReference moveTo(Region region) {
        return new CellReference(region.top(), region.left(), rowFixed, colFixed, sheetName);
    }

    @Override
    public String toString() {
        return toAddressText();
    }
}
