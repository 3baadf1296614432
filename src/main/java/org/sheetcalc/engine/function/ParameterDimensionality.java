package org.sheetcalc.engine.function;

/**
 * Whether a parameter takes a single value or a block of values.
 */
public enum ParameterDimensionality {
    /** A single value; a range argument collapses to its top-left cell */
    SCALAR,
    /** A range or array; a scalar argument stands in as a one-cell block */
    RANGE
}
