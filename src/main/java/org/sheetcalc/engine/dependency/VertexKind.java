package org.sheetcalc.engine.dependency;

public enum VertexKind {
    /** A single cell, with or without a formula */
    CELL,
    /** A block of cells read by a range, row or column reference */
    REGION,
    /** A defined name, with or without a formula */
    NAMED
}
