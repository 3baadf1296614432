package org.sheetcalc.formula.dsl;

import org.eclipse.collections.api.factory.Lists;
import org.eclipse.collections.api.list.MutableList;
import org.sheetcalc.engine.value.ErrorType;
import org.sheetcalc.formula.dsl.Token.TokenType;

/**
 * Lexer for spreadsheet formulas.
 * Converts formula text into a list of tokens. Never throws: unrecognised input
 * becomes a BAD token and an entry in the error list, and scanning continues.
 */
public final class FormulaLexer {

    private final String input;
    private final SeparatorSettings separators;
    private final MutableList<Token> tokens = Lists.mutable.empty();
    private final MutableList<String> errors = Lists.mutable.empty();
    private int position;

    public FormulaLexer(String input, SeparatorSettings separators) {
        this.input = input == null ? "" : input;
        this.separators = separators;
        this.position = 0;
    }

    public static LexResult lex(String input) {
        return new FormulaLexer(input, SeparatorSettings.defaults()).tokenize();
    }

    public static LexResult lex(String input, SeparatorSettings separators) {
        return new FormulaLexer(input, separators).tokenize();
    }

    /**
     * Tokenizes the entire input string.
     *
     * @return the tokens, terminated by EOF, and the lexical errors
     */
    public LexResult tokenize() {
        while (position < input.length()) {
            skipWhitespace();
            if (position >= input.length()) {
                break;
            }
            tokens.add(nextToken());
        }

        tokens.add(new Token(TokenType.EOF, null, position));
        return new LexResult(tokens, errors);
    }

    private void skipWhitespace() {
        while (position < input.length() && Character.isWhitespace(input.charAt(position))) {
            position++;
        }
    }

    private Token nextToken() {
        char c = input.charAt(position);
        int start = position;

        // Two-character operators
        if (position + 1 < input.length()) {
            String twoChar = input.substring(position, position + 2);
            TokenType twoCharType = switch (twoChar) {
                case "<>" -> TokenType.NOT_EQUALS;
                case "<=" -> TokenType.LESS_THAN_EQ;
                case ">=" -> TokenType.GREATER_THAN_EQ;
                default -> null;
            };
            if (twoCharType != null) {
                position += 2;
                return new Token(twoCharType, twoChar, start);
            }
        }

        if (isNumberStart(c)) {
            return readNumber();
        }

        if (separators.isSeparator(c)) {
            position++;
            return new Token(TokenType.SEPARATOR, String.valueOf(c), start);
        }

        TokenType singleCharType = switch (c) {
            case '+' -> TokenType.PLUS;
            case '-' -> TokenType.MINUS;
            case '*' -> TokenType.STAR;
            case '/' -> TokenType.SLASH;
            case '^' -> TokenType.CARET;
            case '&' -> TokenType.AMPERSAND;
            case '%' -> TokenType.PERCENT;
            case '=' -> TokenType.EQUALS;
            case '<' -> TokenType.LESS_THAN;
            case '>' -> TokenType.GREATER_THAN;
            case ':' -> TokenType.COLON;
            case '!' -> TokenType.BANG;
            case '(' -> TokenType.LPAREN;
            case ')' -> TokenType.RPAREN;
            case '{' -> TokenType.LBRACE;
            case '}' -> TokenType.RBRACE;
            default -> null;
        };
        if (singleCharType != null) {
            position++;
            return new Token(singleCharType, String.valueOf(c), start);
        }

        if (c == '"') {
            return readString();
        }

        if (c == '\'') {
            return readSheetName();
        }

        if (c == '#') {
            return readErrorLiteral();
        }

        if (isIdentifierStart(c)) {
            return readIdentifier();
        }

        position++;
        errors.add("Unexpected character '" + c + "' at position " + start);
        return new Token(TokenType.BAD, String.valueOf(c), start);
    }

    private boolean isNumberStart(char c) {
        if (Character.isDigit(c)) {
            return true;
        }
        return c == separators.decimalSeparator()
                && position + 1 < input.length()
                && Character.isDigit(input.charAt(position + 1));
    }

    /**
     * Reads digits with at most one decimal separator and an optional exponent.
     * The token value is normalised to use '.' as decimal point.
     */
    private Token readNumber() {
        int start = position;
        StringBuilder sb = new StringBuilder();

        boolean hasDecimal = false;
        while (position < input.length()) {
            char c = input.charAt(position);
            if (Character.isDigit(c)) {
                sb.append(c);
                position++;
            } else if (c == separators.decimalSeparator() && !hasDecimal) {
                hasDecimal = true;
                sb.append('.');
                position++;
            } else {
                break;
            }
        }

        if (position < input.length() && (input.charAt(position) == 'e' || input.charAt(position) == 'E')) {
            int exponentStart = position + 1;
            if (exponentStart < input.length()
                    && (input.charAt(exponentStart) == '+' || input.charAt(exponentStart) == '-')) {
                exponentStart++;
            }
            if (exponentStart < input.length() && Character.isDigit(input.charAt(exponentStart))) {
                sb.append(input, position, exponentStart);
                position = exponentStart;
                while (position < input.length() && Character.isDigit(input.charAt(position))) {
                    sb.append(input.charAt(position));
                    position++;
                }
            }
        }

        return new Token(TokenType.NUMBER, sb.toString(), start);
    }

    private Token readString() {
        int start = position;
        position++; // skip opening quote

        StringBuilder sb = new StringBuilder();
        while (position < input.length()) {
            char c = input.charAt(position);
            if (c == '"') {
                if (position + 1 < input.length() && input.charAt(position + 1) == '"') {
                    sb.append('"');
                    position += 2;
                    continue;
                }
                position++; // skip closing quote
                return new Token(TokenType.STRING, sb.toString(), start);
            }
            sb.append(c);
            position++;
        }

        errors.add("Unterminated string literal at position " + start);
        return new Token(TokenType.BAD, input.substring(start), start);
    }

    private Token readSheetName() {
        int start = position;
        position++; // skip opening quote

        StringBuilder sb = new StringBuilder();
        while (position < input.length()) {
            char c = input.charAt(position);
            if (c == '\'') {
                if (position + 1 < input.length() && input.charAt(position + 1) == '\'') {
                    sb.append('\'');
                    position += 2;
                    continue;
                }
                position++; // skip closing quote
                return new Token(TokenType.SHEET_NAME, sb.toString(), start);
            }
            sb.append(c);
            position++;
        }

        errors.add("Unterminated sheet name at position " + start);
        return new Token(TokenType.BAD, input.substring(start), start);
    }

    private Token readErrorLiteral() {
        int start = position;
        for (ErrorType type : ErrorType.values()) {
            String text = type.text();
            if (input.regionMatches(true, position, text, 0, text.length())) {
                position += text.length();
                return new Token(TokenType.ERROR_LITERAL, text, start);
            }
        }

        position++;
        errors.add("Unknown error literal at position " + start);
        return new Token(TokenType.BAD, "#", start);
    }

    private Token readIdentifier() {
        int start = position;
        position++;
        while (position < input.length() && isIdentifierPart(input.charAt(position))) {
            position++;
        }
        return new Token(TokenType.IDENTIFIER, input.substring(start, position), start);
    }

    private static boolean isIdentifierStart(char c) {
        return Character.isLetter(c) || c == '_' || c == '$';
    }

    private boolean isIdentifierPart(char c) {
        if (separators.isSeparator(c)) {
            return false;
        }
        return Character.isLetterOrDigit(c) || c == '_' || c == '$' || c == '.' || c == '?';
    }
}
