package org.sheetcalc.engine.function;

public enum ParameterRequirement {
    REQUIRED,
    OPTIONAL
}
