package org.sheetcalc.formula.dsl.ast;

import org.sheetcalc.formula.dsl.SeparatorSettings;
import org.sheetcalc.formula.reference.NamedReference;
import org.sheetcalc.formula.reference.Reference;

import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * A defined name or variable, e.g. {@code TaxRate}.
 *
 * @param reference The name, with its syntactic validity
 */
public record NameExpression(NamedReference reference) implements FormulaExpression {

    public NameExpression {
        Objects.requireNonNull(reference, "Name cannot be null");
    }

    public String name() {
        return reference.name();
    }

    @Override
    public <T> T accept(FormulaExpressionVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public String toExpressionText(SeparatorSettings separators) {
        return reference.name();
    }

    @Override
    public void collectReferences(List<Reference> references) {
        references.add(reference);
    }

    @Override
    public FormulaExpression mapReferences(Function<ReferenceExpression, FormulaExpression> mapper) {
        return this;
    }
}
