package org.sheetcalc.formula.dsl;

/**
 * A token produced by the formula lexer.
 *
 * @param type     The token type
 * @param value    The token text (unescaped for strings and quoted sheet names)
 * @param position The position in the formula text
 */
public record Token(TokenType type, String value, int position) {

    public enum TokenType {
        // Literals and names
        NUMBER, // 42, 1.5E3
        STRING, // "text"
        IDENTIFIER, // SUM, A1, $B$2, TaxRate
        SHEET_NAME, // 'My Sheet'
        ERROR_LITERAL, // #DIV/0!

        // Arithmetic and text operators
        PLUS, // +
        MINUS, // -
        STAR, // *
        SLASH, // /
        CARET, // ^
        AMPERSAND, // &
        PERCENT, // %

        // Comparison
        EQUALS, // =
        NOT_EQUALS, // <>
        LESS_THAN, // <
        LESS_THAN_EQ, // <=
        GREATER_THAN, // >
        GREATER_THAN_EQ, // >=

        // Delimiters
        COLON, // :
        BANG, // !
        LPAREN, // (
        RPAREN, // )
        LBRACE, // {
        RBRACE, // }
        SEPARATOR, // argument, array column or array row separator

        // Special
        BAD, // unrecognised input
        EOF, // End of input
    }

    public boolean is(TokenType expected) {
        return type == expected;
    }

    /**
     * Whether this is a separator token written with {@code c}.
     */
    public boolean isSeparator(char c) {
        return type == TokenType.SEPARATOR && value.length() == 1 && value.charAt(0) == c;
    }

    @Override
    public String toString() {
        return type + (value != null ? "(" + value + ")" : "") + "@" + position;
    }
}
