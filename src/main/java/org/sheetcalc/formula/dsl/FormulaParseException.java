package org.sheetcalc.formula.dsl;

/**
 * Raised inside the parser to abandon the current formula.
 * {@link FormulaParser#parse(String)} turns it into a diagnostic; it never escapes the parser.
 */
final class FormulaParseException extends RuntimeException {

    private final int position;

    FormulaParseException(String message, int position) {
        super(message);
        this.position = position;
    }

    /**
     * Index in the formula text of the token where parsing stopped.
     */
    int getPosition() {
        return position;
    }
}
