package org.sheetcalc.formula.dsl;

import org.eclipse.collections.api.factory.Lists;
import org.eclipse.collections.api.list.MutableList;
import org.sheetcalc.engine.function.FunctionRegistry;
import org.sheetcalc.engine.function.SheetFunction;
import org.sheetcalc.engine.value.ErrorType;
import org.sheetcalc.formula.dsl.Token.TokenType;
import org.sheetcalc.formula.dsl.ast.ArrayConstantExpression;
import org.sheetcalc.formula.dsl.ast.BinaryExpression;
import org.sheetcalc.formula.dsl.ast.FormulaExpression;
import org.sheetcalc.formula.dsl.ast.FunctionCallExpression;
import org.sheetcalc.formula.dsl.ast.LiteralExpression;
import org.sheetcalc.formula.dsl.ast.NameExpression;
import org.sheetcalc.formula.dsl.ast.ParenthesizedExpression;
import org.sheetcalc.formula.dsl.ast.ReferenceExpression;
import org.sheetcalc.formula.dsl.ast.UnaryExpression;
import org.sheetcalc.formula.reference.CellReference;
import org.sheetcalc.formula.reference.ColumnReference;
import org.sheetcalc.formula.reference.NamedReference;
import org.sheetcalc.formula.reference.RangeReference;
import org.sheetcalc.formula.reference.RangeText;
import org.sheetcalc.formula.reference.Reference;
import org.sheetcalc.formula.reference.RowReference;

import java.util.List;

/**
 * Precedence-climbing parser for spreadsheet formulas.
 *
 * Parses formulas like:
 * =SUM(A1:A3) * 2 + 'Other Sheet'!$B$1 &lt;= 10%
 *
 * Precedence, lowest first: comparison, {@code &}, {@code + -}, {@code * /}, {@code ^},
 * prefix {@code + -}, postfix {@code %}. Binary operators are left associative.
 *
 * The parser never throws: every problem becomes a diagnostic on the returned
 * {@link CellFormula}, and the tree evaluates to an error value.
 */
public final class FormulaParser {

    private final FunctionRegistry functions;
    private final SeparatorSettings separators;

    private List<Token> tokens;
    private MutableList<String> diagnostics;
    private LiteralExpression recovered;
    private int position;

    public FormulaParser() {
        this(null, SeparatorSettings.defaults());
    }

    /**
     * @param functions  Registry used to resolve function names, or null to leave every call unresolved
     * @param separators Separator characters of the formula text
     */
    public FormulaParser(FunctionRegistry functions, SeparatorSettings separators) {
        this.functions = functions;
        this.separators = separators;
    }

    /**
     * Parses formula text, which must begin with '='.
     *
     * @param text The formula text
     * @return The parsed formula; check {@link CellFormula#isValid()} for diagnostics
     */
    public CellFormula parse(String text) {
        LexResult lexed = FormulaLexer.lex(text, separators);
        tokens = lexed.tokens();
        diagnostics = Lists.mutable.withAll(lexed.errors());
        recovered = null;
        position = 0;

        FormulaExpression root;
        try {
            consume(TokenType.EQUALS, "Formula must start with '='");
            root = parseComparison();
            if (!check(TokenType.EOF)) {
                throw error("Unexpected '" + peek().value() + "'");
            }
            // A formula with diagnostics holds no references, so it never shifts or gains dependencies
            if (!diagnostics.isEmpty()) {
                root = recovered != null ? recovered : LiteralExpression.error(ErrorType.NA, diagnostics.get(0));
            }
        } catch (FormulaParseException e) {
            String message = e.getMessage() + " at position " + e.getPosition();
            diagnostics.add(message);
            root = LiteralExpression.error(ErrorType.NA, message);
        }

        return new CellFormula(text, root, diagnostics, separators);
    }

    // ==================== Binary operators ====================

    private FormulaExpression parseComparison() {
        FormulaExpression left = parseConcatenation();
        while (true) {
            BinaryExpression.Operator op = switch (peek().type()) {
                case EQUALS -> BinaryExpression.Operator.EQUAL;
                case NOT_EQUALS -> BinaryExpression.Operator.NOT_EQUAL;
                case LESS_THAN -> BinaryExpression.Operator.LESS_THAN;
                case LESS_THAN_EQ -> BinaryExpression.Operator.LESS_THAN_EQ;
                case GREATER_THAN -> BinaryExpression.Operator.GREATER_THAN;
                case GREATER_THAN_EQ -> BinaryExpression.Operator.GREATER_THAN_EQ;
                default -> null;
            };
            if (op == null) {
                return left;
            }
            advance();
            left = new BinaryExpression(op, left, parseConcatenation());
        }
    }

    private FormulaExpression parseConcatenation() {
        FormulaExpression left = parseAdditive();
        while (check(TokenType.AMPERSAND)) {
            advance();
            left = new BinaryExpression(BinaryExpression.Operator.CONCAT, left, parseAdditive());
        }
        return left;
    }

    private FormulaExpression parseAdditive() {
        FormulaExpression left = parseMultiplicative();
        while (check(TokenType.PLUS) || check(TokenType.MINUS)) {
            BinaryExpression.Operator op = advance().is(TokenType.PLUS)
                    ? BinaryExpression.Operator.ADD
                    : BinaryExpression.Operator.SUBTRACT;
            left = new BinaryExpression(op, left, parseMultiplicative());
        }
        return left;
    }

    private FormulaExpression parseMultiplicative() {
        FormulaExpression left = parsePower();
        while (check(TokenType.STAR) || check(TokenType.SLASH)) {
            BinaryExpression.Operator op = advance().is(TokenType.STAR)
                    ? BinaryExpression.Operator.MULTIPLY
                    : BinaryExpression.Operator.DIVIDE;
            left = new BinaryExpression(op, left, parsePower());
        }
        return left;
    }

    private FormulaExpression parsePower() {
        FormulaExpression left = parseUnary();
        while (check(TokenType.CARET)) {
            advance();
            left = new BinaryExpression(BinaryExpression.Operator.POWER, left, parseUnary());
        }
        return left;
    }

    // ==================== Unary operators ====================

    private FormulaExpression parseUnary() {
        if (check(TokenType.MINUS)) {
            advance();
            return new UnaryExpression(UnaryExpression.Operator.NEGATE, parseUnary());
        }
        if (check(TokenType.PLUS)) {
            advance();
            return new UnaryExpression(UnaryExpression.Operator.PLUS, parseUnary());
        }
        return parsePostfix();
    }

    private FormulaExpression parsePostfix() {
        FormulaExpression expr = parsePrimary();
        while (check(TokenType.PERCENT)) {
            advance();
            expr = new UnaryExpression(UnaryExpression.Operator.PERCENT, expr);
        }
        return expr;
    }

    // ==================== Primary expressions ====================

    private FormulaExpression parsePrimary() {
        Token token = peek();
        switch (token.type()) {
            case NUMBER -> {
                if (peekAhead(1).is(TokenType.COLON)) {
                    return parseReference(null);
                }
                advance();
                return number(token, false);
            }
            case STRING -> {
                advance();
                return LiteralExpression.text(token.value());
            }
            case ERROR_LITERAL -> {
                advance();
                return LiteralExpression.error(ErrorType.fromText(token.value()));
            }
            case LPAREN -> {
                advance();
                FormulaExpression inner = parseComparison();
                consume(TokenType.RPAREN, "Expected ')'");
                return new ParenthesizedExpression(inner);
            }
            case LBRACE -> {
                return parseArrayConstant();
            }
            case SHEET_NAME -> {
                return parseReference(parseSheetQualifier());
            }
            case IDENTIFIER -> {
                return parseIdentifier();
            }
            case EOF -> throw error("Unexpected end of formula");
            default -> throw error("Unexpected '" + token.value() + "'");
        }
    }

    /**
     * Disambiguates an identifier: function call, sheet qualifier, logical constant,
     * address, or name.
     */
    private FormulaExpression parseIdentifier() {
        Token token = peek();
        TokenType next = peekAhead(1).type();

        if (next == TokenType.LPAREN) {
            return parseFunctionCall();
        }
        if (next == TokenType.BANG) {
            return parseReference(parseSheetQualifier());
        }
        if (next != TokenType.COLON) {
            if ("TRUE".equalsIgnoreCase(token.value())) {
                advance();
                return LiteralExpression.logical(true);
            }
            if ("FALSE".equalsIgnoreCase(token.value())) {
                advance();
                return LiteralExpression.logical(false);
            }
        }
        return parseReference(null);
    }

    private String parseSheetQualifier() {
        Token sheet = advance();
        consume(TokenType.BANG, "Expected '!' after sheet name");
        return sheet.value();
    }

    private boolean atSheetQualifier() {
        return (check(TokenType.IDENTIFIER) || check(TokenType.SHEET_NAME)) && peekAhead(1).is(TokenType.BANG);
    }

    /**
     * Parses a cell address, a range, or a name. The current token is the first address part.
     */
    private FormulaExpression parseReference(String sheetName) {
        Token first = advance();
        if (!first.is(TokenType.IDENTIFIER) && !first.is(TokenType.NUMBER)) {
            throw error("Expected a cell address");
        }

        if (check(TokenType.COLON)) {
            advance();
            String rightSheet = atSheetQualifier() ? parseSheetQualifier() : null;
            Token second = advance();
            if (!second.is(TokenType.IDENTIFIER) && !second.is(TokenType.NUMBER)) {
                throw error("Expected an address after ':'");
            }
            return new ReferenceExpression(buildRange(first, second, sheetName != null ? sheetName : rightSheet));
        }

        if (first.is(TokenType.IDENTIFIER)) {
            CellReference cell = RangeText.parseCell(first.value(), sheetName);
            if (cell != null) {
                return new ReferenceExpression(cell);
            }
            if (sheetName != null) {
                throw error("'" + first.value() + "' is not a cell address on sheet '" + sheetName + "'");
            }
            return new NameExpression(new NamedReference(first.value()));
        }

        throw error("Unexpected number after sheet name");
    }

    private Reference buildRange(Token first, Token second, String sheetName) {
        CellReference startCell = RangeText.parseCell(first.value(), null);
        CellReference endCell = RangeText.parseCell(second.value(), null);
        if (startCell != null && endCell != null) {
            return new RangeReference(startCell, endCell, sheetName);
        }

        RangeText.AxisAddress startCol = RangeText.parseColumn(first.value());
        RangeText.AxisAddress endCol = RangeText.parseColumn(second.value());
        if (startCol != null && endCol != null) {
            return new ColumnReference(startCol.index(), endCol.index(), startCol.fixed(), endCol.fixed(), sheetName);
        }

        RangeText.AxisAddress startRow = RangeText.parseRow(first.value());
        RangeText.AxisAddress endRow = RangeText.parseRow(second.value());
        if (startRow != null && endRow != null) {
            return new RowReference(startRow.index(), endRow.index(), startRow.fixed(), endRow.fixed(), sheetName);
        }

        throw error("Invalid range '" + first.value() + ":" + second.value() + "'");
    }

    private FormulaExpression parseFunctionCall() {
        String name = advance().value();
        consume(TokenType.LPAREN, "Expected '(' after function name");

        MutableList<FormulaExpression> arguments = Lists.mutable.empty();
        if (!check(TokenType.RPAREN)) {
            arguments.add(parseComparison());
            while (peek().isSeparator(separators.argumentSeparator())) {
                advance();
                arguments.add(parseComparison());
            }
        }
        consume(TokenType.RPAREN, "Expected ')' to close " + name + "(");

        SheetFunction function = functions == null ? null : functions.getDefinition(name);
        return new FunctionCallExpression(name, arguments, function);
    }

    /**
     * Parses {@code {1,2;3,4}} using the configured column and row separators.
     * Rows of unequal length record a diagnostic and produce an error literal.
     */
    private FormulaExpression parseArrayConstant() {
        consume(TokenType.LBRACE, "Expected '{'");

        MutableList<List<LiteralExpression>> rows = Lists.mutable.empty();
        MutableList<LiteralExpression> row = Lists.mutable.empty();
        row.add(parseArrayElement());
        while (!check(TokenType.RBRACE)) {
            Token separator = advance();
            if (separator.isSeparator(separators.columnSeparator())) {
                row.add(parseArrayElement());
            } else if (separator.isSeparator(separators.rowSeparator())) {
                rows.add(row);
                row = Lists.mutable.empty();
                row.add(parseArrayElement());
            } else {
                throw error("Expected '" + separators.columnSeparator() + "', '"
                        + separators.rowSeparator() + "' or '}' in array constant");
            }
        }
        rows.add(row);
        consume(TokenType.RBRACE, "Expected '}'");

        int width = rows.get(0).size();
        if (rows.anySatisfy(r -> r.size() != width)) {
            return recover(ErrorType.VALUE, "Array constant rows must all have " + width + " values");
        }
        return new ArrayConstantExpression(rows);
    }

    private LiteralExpression parseArrayElement() {
        Token token = advance();
        return switch (token.type()) {
            case NUMBER -> number(token, false);
            case MINUS, PLUS -> number(consume(TokenType.NUMBER, "Expected a number in array constant"),
                    token.is(TokenType.MINUS));
            case STRING -> LiteralExpression.text(token.value());
            case ERROR_LITERAL -> LiteralExpression.error(ErrorType.fromText(token.value()));
            case IDENTIFIER -> {
                if ("TRUE".equalsIgnoreCase(token.value())) {
                    yield LiteralExpression.logical(true);
                }
                if ("FALSE".equalsIgnoreCase(token.value())) {
                    yield LiteralExpression.logical(false);
                }
                throw new FormulaParseException("Array constants may only contain literals", token.position());
            }
            default -> throw new FormulaParseException("Array constants may only contain literals", token.position());
        };
    }

    /**
     * A number literal. Values beyond the double range record a diagnostic and become {@code #NUM!}.
     */
    private LiteralExpression number(Token token, boolean negate) {
        double value = Double.parseDouble(token.value());
        if (Double.isInfinite(value)) {
            return recover(ErrorType.NUM, "Number " + token.value() + " is out of range at position " + token.position());
        }
        return LiteralExpression.number(negate ? -value : value);
    }

    private LiteralExpression recover(ErrorType type, String message) {
        diagnostics.add(message);
        LiteralExpression literal = LiteralExpression.error(type, message);
        if (recovered == null) {
            recovered = literal;
        }
        return literal;
    }

    // ==================== Token helpers ====================

    private Token peek() {
        return tokens.get(position);
    }

    private Token peekAhead(int offset) {
        int index = Math.min(position + offset, tokens.size() - 1);
        return tokens.get(index);
    }

    private boolean check(TokenType type) {
        return peek().is(type);
    }

    private Token advance() {
        Token token = peek();
        if (!token.is(TokenType.EOF)) {
            position++;
        }
        return token;
    }

    private Token consume(TokenType type, String message) {
        if (!check(type)) {
            throw error(message);
        }
        return advance();
    }

    private FormulaParseException error(String message) {
        return new FormulaParseException(message, peek().position());
    }
}
