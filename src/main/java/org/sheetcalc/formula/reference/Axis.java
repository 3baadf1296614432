package org.sheetcalc.formula.reference;

/**
 * The axis along which rows or columns are inserted or removed.
 */
public enum Axis {
    ROW,
    COLUMN
}
