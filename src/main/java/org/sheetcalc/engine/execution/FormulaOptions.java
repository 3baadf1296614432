package org.sheetcalc.engine.execution;

import org.sheetcalc.engine.eval.Evaluator;
import org.sheetcalc.formula.dsl.SeparatorSettings;

import java.util.Objects;

/**
 * Engine configuration.
 *
 * @param separators            Separators used to read and write formula text
 * @param maxRepeatingArguments Most arguments a function with a repeating last parameter accepts
 * @param sheetName             Name of the sheet the engine calculates
 */
public record FormulaOptions(SeparatorSettings separators, int maxRepeatingArguments, String sheetName) {

    public static final String DEFAULT_SHEET_NAME = "Sheet1";

    public FormulaOptions {
        Objects.requireNonNull(separators, "Separators cannot be null");
        Objects.requireNonNull(sheetName, "Sheet name cannot be null");
        if (maxRepeatingArguments < 1) {
            throw new IllegalArgumentException("maxRepeatingArguments must be positive: " + maxRepeatingArguments);
        }
    }

    public static FormulaOptions defaults() {
        return new FormulaOptions(SeparatorSettings.defaults(), Evaluator.DEFAULT_MAX_REPEATING_ARGUMENTS, DEFAULT_SHEET_NAME);
    }

    public FormulaOptions withSeparators(SeparatorSettings newSeparators) {
        return new FormulaOptions(newSeparators, maxRepeatingArguments, sheetName);
    }

    public FormulaOptions withMaxRepeatingArguments(int newMaxRepeatingArguments) {
        return new FormulaOptions(separators, newMaxRepeatingArguments, sheetName);
    }

    public FormulaOptions withSheetName(String newSheetName) {
        return new FormulaOptions(separators, maxRepeatingArguments, newSheetName);
    }
}
