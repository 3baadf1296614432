package org.sheetcalc.engine.value;

/**
 * Formula error kinds and their canonical spreadsheet tokens.
 */
public enum ErrorType {
    NULL("#NULL!"),
    DIV0("#DIV/0!"),
    VALUE("#VALUE!"),
    REF("#REF!"),
    NAME("#NAME?"),
    NUM("#NUM!"),
    NA("#N/A"),
    CIRCULAR("#CIRCULAR");

    private final String text;

    ErrorType(String text) {
        this.text = text;
    }

    /**
     * The canonical token displayed in a cell, e.g. {@code #DIV/0!}.
     */
    public String text() {
        return text;
    }

    /**
     * Looks up an error by its canonical token (case-insensitive).
     *
     * @return the error type, or null if the text is not an error token
     */
    public static ErrorType fromText(String text) {
        for (ErrorType type : values()) {
            if (type.text.equalsIgnoreCase(text)) {
                return type;
            }
        }
        return null;
    }
}
