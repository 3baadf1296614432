package org.sheetcalc.engine.value;

import java.util.Objects;

/**
 * An error value produced while evaluating a formula.
 *
 * @param type    The error kind
 * @param message Optional diagnostic text for tooling; not part of the displayed value
 */
public record FormulaError(ErrorType type, String message) {

    public FormulaError {
        Objects.requireNonNull(type, "Error type cannot be null");
    }

    public FormulaError(ErrorType type) {
        this(type, null);
    }

    @Override
    public String toString() {
        return type.text();
    }
}
