package org.sheetcalc.engine.value;

public enum CellValueType {
    EMPTY,
    TEXT,
    NUMBER,
    LOGICAL,
    DATE,
    ERROR,
    /** Two dimensional block of values, indexed [row][col]. */
    ARRAY,
    /** Flat list of values, produced when a range is passed to a sequence parameter. */
    SEQUENCE,
    /** An unresolved reference, resolved lazily by operators and functions. */
    REFERENCE
}
