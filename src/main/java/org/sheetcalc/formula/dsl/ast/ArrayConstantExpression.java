package org.sheetcalc.formula.dsl.ast;

import org.sheetcalc.formula.dsl.SeparatorSettings;
import org.sheetcalc.formula.reference.Reference;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.function.Function;

/**
 * An array constant, e.g. {@code {1,2;3,4}}. Every row has the same length.
 *
 * @param rows The literal rows
 */
public record ArrayConstantExpression(List<List<LiteralExpression>> rows) implements FormulaExpression {

    public ArrayConstantExpression {
        Objects.requireNonNull(rows, "Rows cannot be null");
        rows = rows.stream().map(List::copyOf).collect(Collectors.toUnmodifiableList());
        if (!rows.isEmpty()) {
            int width = rows.get(0).size();
            for (List<LiteralExpression> row : rows) {
                if (row.size() != width) {
                    throw new IllegalArgumentException("Array constant rows must have equal length");
                }
            }
        }
    }

    public int height() {
        return rows.size();
    }

    public int width() {
        return rows.isEmpty() ? 0 : rows.get(0).size();
    }

    @Override
    public <T> T accept(FormulaExpressionVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public String toExpressionText(SeparatorSettings separators) {
        String columnSeparator = String.valueOf(separators.columnSeparator());
        return rows.stream()
                .map(row -> row.stream()
                        .map(literal -> literal.toExpressionText(separators))
                        .collect(Collectors.joining(columnSeparator)))
                .collect(Collectors.joining(String.valueOf(separators.rowSeparator()), "{", "}"));
    }

    @Override
    public void collectReferences(List<Reference> references) {
        // array constants hold literals only
    }

    @Override
    public FormulaExpression mapReferences(Function<ReferenceExpression, FormulaExpression> mapper) {
        return this;
    }
}
