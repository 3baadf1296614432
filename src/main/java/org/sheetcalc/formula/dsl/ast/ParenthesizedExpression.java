package org.sheetcalc.formula.dsl.ast;

import org.sheetcalc.formula.dsl.SeparatorSettings;
import org.sheetcalc.formula.reference.Reference;

import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * An expression in parentheses, kept so formatting reproduces the grouping.
 *
 * @param inner The grouped expression
 */
public record ParenthesizedExpression(FormulaExpression inner) implements FormulaExpression {

    public ParenthesizedExpression {
        Objects.requireNonNull(inner, "Inner expression cannot be null");
    }

    @Override
    public <T> T accept(FormulaExpressionVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public String toExpressionText(SeparatorSettings separators) {
        return "(" + inner.toExpressionText(separators) + ")";
    }

    @Override
    public void collectReferences(List<Reference> references) {
        inner.collectReferences(references);
    }

    @Override
    public FormulaExpression mapReferences(Function<ReferenceExpression, FormulaExpression> mapper) {
        FormulaExpression newInner = inner.mapReferences(mapper);
        return newInner == inner ? this : new ParenthesizedExpression(newInner);
    }
}
