package org.sheetcalc.formula.reference;

public enum ReferenceKind {
    CELL,
    RANGE,
    ROW,
    COLUMN,
    NAMED
}
