package org.sheetcalc.formula.dsl.ast;

import org.sheetcalc.engine.function.SheetFunction;
import org.sheetcalc.formula.dsl.SeparatorSettings;
import org.sheetcalc.formula.reference.Reference;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * A function call, e.g. {@code SUM(A1:A3, 2)}.
 *
 * @param name      The function name as written
 * @param arguments The argument expressions
 * @param function  The function resolved at parse time, or null when the name was unknown
 */
public record FunctionCallExpression(
        String name,
        List<FormulaExpression> arguments,
        SheetFunction function) implements FormulaExpression {

    public FunctionCallExpression {
        Objects.requireNonNull(name, "Function name cannot be null");
        arguments = List.copyOf(arguments);
    }

    public boolean isResolved() {
        return function != null;
    }

    @Override
    public <T> T accept(FormulaExpressionVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public String toExpressionText(SeparatorSettings separators) {
        return name + "(" + arguments.stream()
                .map(arg -> arg.toExpressionText(separators))
                .collect(Collectors.joining(String.valueOf(separators.argumentSeparator()))) + ")";
    }

    @Override
    public void collectReferences(List<Reference> references) {
        for (FormulaExpression argument : arguments) {
            argument.collectReferences(references);
        }
    }

    @Override
    public FormulaExpression mapReferences(Function<ReferenceExpression, FormulaExpression> mapper) {
        List<FormulaExpression> mapped = new ArrayList<>(arguments.size());
        boolean changed = false;
        for (FormulaExpression argument : arguments) {
            FormulaExpression newArgument = argument.mapReferences(mapper);
            changed |= newArgument != argument;
            mapped.add(newArgument);
        }
        return changed ? new FunctionCallExpression(name, mapped, function) : this;
    }
}
