package org.sheetcalc.formula.reference;

import java.util.Objects;

/**
 * Reference to a rectangular block of cells, e.g. {@code A1:C3}.
 * The corners are normalised so that {@code start} is the top-left cell;
 * each corner keeps its own fixed flags.
 *
 * @param start     Top-left corner (without sheet qualifier)
 * @param end       Bottom-right corner (without sheet qualifier)
 * @param sheetName Explicit sheet, or null
 */
public record RangeReference(
        CellReference start,
        CellReference end,
        String sheetName) implements Reference {

    public RangeReference {
        Objects.requireNonNull(start, "Range start cannot be null");
        Objects.requireNonNull(end, "Range end cannot be null");

        int topRow = Math.min(start.row(), end.row());
        int bottomRow = Math.max(start.row(), end.row());
        boolean topFixed = start.row() <= end.row() ? start.rowFixed() : end.rowFixed();
        boolean bottomFixed = start.row() <= end.row() ? end.rowFixed() : start.rowFixed();

        int leftCol = Math.min(start.col(), end.col());
        int rightCol = Math.max(start.col(), end.col());
        boolean leftFixed = start.col() <= end.col() ? start.colFixed() : end.colFixed();
        boolean rightFixed = start.col() <= end.col() ? end.colFixed() : start.colFixed();

        start = new CellReference(topRow, leftCol, topFixed, leftFixed, null);
        end = new CellReference(bottomRow, rightCol, bottomFixed, rightFixed, null);
    }

    @Override
    public ReferenceKind kind() {
        return ReferenceKind.RANGE;
    }

    @Override
    public Region region() {
        return new Region(start.row(), start.col(), end.row(), end.col());
    }

    @Override
    public String toAddressText() {
        return RangeText.sheetPrefix(sheetName) + start.toLocalText() + ":" + end.toLocalText();
    }

    @Override
    public RangeReference withSheetName(String sheetName) {
        return new RangeReference(start, end, sheetName);
    }

    @Override
    public RangeReference offset(int rowOffset, int colOffset) {
        CellReference newStart = start.offset(rowOffset, colOffset);
        CellReference newEnd = end.offset(rowOffset, colOffset);
        if (newStart == null || newEnd == null) {
            return null;
        }
        return new RangeReference(newStart, newEnd, sheetName);
    }

    @Override
    public RangeReference afterInsert(Axis axis, int index, int count) {
        Region moved = region().afterInsert(axis, index, count);
        return moved == null ? null : moveTo(moved);
    }

    @Override
    public RangeReference afterRemove(Axis axis, int index, int count) {
        Region moved = region().afterRemove(axis, index, count);
        return moved == null ? null : moveTo(moved);
    }

    private RangeReference moveTo(Region region) {
        return new RangeReference(
                new CellReference(region.top(), region.left(), start.rowFixed(), start.colFixed(), null),
                new CellReference(region.bottom(), region.right(), end.rowFixed(), end.colFixed(), null),
                sheetName);
    }

    @Override
    public String toString() {
        return toAddressText();
    }
}
