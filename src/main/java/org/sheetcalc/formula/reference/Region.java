package org.sheetcalc.formula.reference;

/**
 * A rectangular block of cells, inclusive on all four sides.
 * Row and column indices are zero based.
 *
 * @param top    First row
 * @param left   First column
 * @param bottom Last row
 * @param right  Last column
 */
public record Region(int top, int left, int bottom, int right) {

    public Region {
        if (top < 0 || left < 0) {
            throw new IllegalArgumentException("Region cannot start at a negative index: " + top + "," + left);
        }
        if (bottom < top || right < left) {
            throw new IllegalArgumentException(
                    "Region end must not precede its start: (" + top + "," + left + ")-(" + bottom + "," + right + ")");
        }
    }

    public static Region cell(int row, int col) {
        return new Region(row, col, row, col);
    }

    public static Region rows(int startRow, int endRow) {
        return new Region(startRow, 0, endRow, RangeText.MAX_COLS - 1);
    }

    public static Region columns(int startCol, int endCol) {
        return new Region(0, startCol, RangeText.MAX_ROWS - 1, endCol);
    }

    public int height() {
        return bottom - top + 1;
    }

    public int width() {
        return right - left + 1;
    }

    public boolean isSingleCell() {
        return top == bottom && left == right;
    }

    public boolean isFullRows() {
        return left == 0 && right == RangeText.MAX_COLS - 1;
    }

    public boolean isFullColumns() {
        return top == 0 && bottom == RangeText.MAX_ROWS - 1;
    }

    public boolean contains(int row, int col) {
        return row >= top && row <= bottom && col >= left && col <= right;
    }

    public boolean contains(Region other) {
        return other.top >= top && other.bottom <= bottom && other.left >= left && other.right <= right;
    }

    public boolean intersects(Region other) {
        return other.left <= right && other.right >= left && other.top <= bottom && other.bottom >= top;
    }

    /**
     * Returns the overlapping part of both regions, or null when they do not intersect.
     */
    public Region intersection(Region other) {
        if (!intersects(other)) {
            return null;
        }
        return new Region(
                Math.max(top, other.top), Math.max(left, other.left),
                Math.min(bottom, other.bottom), Math.min(right, other.right));
    }

    public Region boundingRegion(Region other) {
        return new Region(
                Math.min(top, other.top), Math.min(left, other.left),
                Math.max(bottom, other.bottom), Math.max(right, other.right));
    }

    public Region offset(int rowOffset, int colOffset) {
        return new Region(top + rowOffset, left + colOffset, bottom + rowOffset, right + colOffset);
    }

    /**
     * The region after {@code count} rows or columns are inserted at {@code index}.
     * Regions at or after the index move; regions spanning it grow. The end is clamped to the sheet edge.
     *
     * @return the moved region, or null when the whole region is pushed off the sheet
     */
    public Region afterInsert(Axis axis, int index, int count) {
        if (axis == Axis.ROW) {
            if (isFullColumns()) {
                return this;
            }
            Span span = Span.afterInsert(top, bottom, index, count);
            if (span.start() >= RangeText.MAX_ROWS) {
                return null;
            }
            return new Region(span.start(), left, Math.min(span.end(), RangeText.MAX_ROWS - 1), right);
        }
        if (isFullRows()) {
            return this;
        }
        Span span = Span.afterInsert(this.left, this.right, index, count);
        if (span.start() >= RangeText.MAX_COLS) {
            return null;
        }
        return new Region(top, span.start(), bottom, Math.min(span.end(), RangeText.MAX_COLS - 1));
    }

    /**
     * The region after {@code count} rows or columns are removed starting at {@code index}.
     * Returns null when the whole region lies inside the removed band.
     */
    public Region afterRemove(Axis axis, int index, int count) {
        if (axis == Axis.ROW) {
            if (isFullColumns()) {
                return this;
            }
            Span span = Span.afterRemove(top, bottom, index, count);
            return span == null ? null : new Region(span.start(), left, span.end(), right);
        }
        if (isFullRows()) {
            return this;
        }
        Span span = Span.afterRemove(this.left, this.right, index, count);
        return span == null ? null : new Region(top, span.start(), bottom, span.end());
    }

    /**
     * Position of the region along {@code axis}: its first row or first column.
     */
    public int start(Axis axis) {
        return axis == Axis.ROW ? top : left;
    }

    public int end(Axis axis) {
        return axis == Axis.ROW ? bottom : right;
    }

    @Override
    public String toString() {
        return RangeText.regionToText(this);
    }

    /**
     * A one dimensional inclusive interval along an axis.
     */
    record Span(int start, int end) {

        static Span afterInsert(int start, int end, int index, int count) {
            if (start >= index) {
                return new Span(start + count, end + count);
            }
            if (end >= index) {
                return new Span(start, end + count);
            }
            return new Span(start, end);
        }

        static Span afterRemove(int start, int end, int index, int count) {
            int bandEnd = index + count - 1;
            if (end < index) {
                return new Span(start, end);
            }
            if (start > bandEnd) {
                return new Span(start - count, end - count);
            }
            if (start >= index && end <= bandEnd) {
                return null;
            }
            int newStart = Math.min(start, index);
            int newEnd = end > bandEnd ? end - count : index - 1;
            return new Span(newStart, newEnd);
        }
    }
}
