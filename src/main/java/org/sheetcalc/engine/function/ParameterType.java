package org.sheetcalc.engine.function;

/**
 * The type an argument is converted to before it reaches a function.
 */
public enum ParameterType {
    /** Passed through unconverted; cell references are resolved to their value */
    ANY(ParameterDimensionality.SCALAR),
    NUMBER(ParameterDimensionality.SCALAR),
    TEXT(ParameterDimensionality.SCALAR),
    LOGICAL(ParameterDimensionality.SCALAR),
    DATE(ParameterDimensionality.SCALAR),
    /** Numbers and errors gathered from ranges, arrays and scalars into a sequence */
    NUMBER_SEQUENCE(ParameterDimensionality.RANGE),
    /** Logicals and errors gathered from ranges, arrays and scalars into a sequence */
    LOGICAL_SEQUENCE(ParameterDimensionality.RANGE),
    /** A two dimensional array of values */
    ARRAY(ParameterDimensionality.RANGE);

    private final ParameterDimensionality dimensionality;

    ParameterType(ParameterDimensionality dimensionality) {
        this.dimensionality = dimensionality;
    }

    public ParameterDimensionality dimensionality() {
        return dimensionality;
    }
}
