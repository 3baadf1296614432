package org.sheetcalc.formula.dsl.ast;

import org.sheetcalc.engine.value.CellValue;
import org.sheetcalc.engine.value.ErrorType;
import org.sheetcalc.formula.dsl.SeparatorSettings;
import org.sheetcalc.formula.reference.Reference;

import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * A constant: number, text, logical or error.
 *
 * @param value The constant value
 */
public record LiteralExpression(CellValue value) implements FormulaExpression {

    public LiteralExpression {
        Objects.requireNonNull(value, "Literal value cannot be null");
        switch (value.type()) {
            case NUMBER, TEXT, LOGICAL, ERROR -> {
            }
            default -> throw new IllegalArgumentException("Unsupported literal type: " + value.type());
        }
    }

    public static LiteralExpression number(double value) {
        return new LiteralExpression(CellValue.number(value));
    }

    public static LiteralExpression text(String value) {
        return new LiteralExpression(CellValue.text(value));
    }

    public static LiteralExpression logical(boolean value) {
        return new LiteralExpression(CellValue.logical(value));
    }

    public static LiteralExpression error(ErrorType type) {
        return new LiteralExpression(CellValue.error(type));
    }

    public static LiteralExpression error(ErrorType type, String message) {
        return new LiteralExpression(CellValue.error(type, message));
    }

    @Override
    public <T> T accept(FormulaExpressionVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public String toExpressionText(SeparatorSettings separators) {
        return switch (value.type()) {
            case NUMBER -> {
                String text = CellValue.formatNumber(value.asNumber());
                yield separators.decimalSeparator() == '.'
                        ? text
                        : text.replace('.', separators.decimalSeparator());
            }
            case TEXT -> "\"" + value.asText().replace("\"", "\"\"") + "\"";
            case LOGICAL -> value.asLogical() ? "TRUE" : "FALSE";
            default -> value.asError().type().text();
        };
    }

    @Override
    public void collectReferences(List<Reference> references) {
        // constants hold no references
    }

    @Override
    public FormulaExpression mapReferences(Function<ReferenceExpression, FormulaExpression> mapper) {
        return this;
    }
}
