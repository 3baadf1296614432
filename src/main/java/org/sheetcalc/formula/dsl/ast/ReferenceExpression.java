package org.sheetcalc.formula.dsl.ast;

import org.sheetcalc.formula.dsl.SeparatorSettings;
import org.sheetcalc.formula.reference.Reference;

import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * An address: cell, range, row span or column span.
 *
 * @param reference The address
 */
public record ReferenceExpression(Reference reference) implements FormulaExpression {

    public ReferenceExpression {
        Objects.requireNonNull(reference, "Reference cannot be null");
    }

    @Override
    public <T> T accept(FormulaExpressionVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public String toExpressionText(SeparatorSettings separators) {
        return reference.toAddressText();
    }

    @Override
    public void collectReferences(List<Reference> references) {
        references.add(reference);
    }

    @Override
    public FormulaExpression mapReferences(Function<ReferenceExpression, FormulaExpression> mapper) {
        FormulaExpression mapped = mapper.apply(this);
        return mapped.equals(this) ? this : mapped;
    }
}
