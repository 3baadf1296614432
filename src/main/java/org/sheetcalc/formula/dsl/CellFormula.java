package org.sheetcalc.formula.dsl;

import org.sheetcalc.engine.value.ErrorType;
import org.sheetcalc.formula.dsl.ast.FormulaExpression;
import org.sheetcalc.formula.dsl.ast.LiteralExpression;
import org.sheetcalc.formula.dsl.ast.ReferenceExpression;
import org.sheetcalc.formula.reference.Axis;
import org.sheetcalc.formula.reference.Reference;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * A parsed formula: the expression tree, the references found in it, and the parse diagnostics.
 *
 * Instances are immutable. Structural edits and copies produce a new formula so that
 * formulas held by restore records stay valid.
 */
public final class CellFormula {

    private final String source;
    private final FormulaExpression expression;
    private final List<Reference> references;
    private final List<String> diagnostics;
    private final SeparatorSettings separators;

    CellFormula(String source, FormulaExpression expression, List<String> diagnostics, SeparatorSettings separators) {
        this.source = source;
        this.expression = Objects.requireNonNull(expression, "Expression cannot be null");
        this.diagnostics = List.copyOf(diagnostics);
        this.separators = Objects.requireNonNull(separators, "Separators cannot be null");

        List<Reference> found = new ArrayList<>();
        expression.collectReferences(found);
        this.references = List.copyOf(found);
    }

    /**
     * Builds a formula around an existing expression, e.g. one constructed programmatically.
     */
    public static CellFormula of(FormulaExpression expression, SeparatorSettings separators) {
        return new CellFormula(null, expression, List.of(), separators);
    }

    public FormulaExpression expression() {
        return expression;
    }

    /**
     * Every reference in the formula in source order, named references included.
     */
    public List<Reference> references() {
        return references;
    }

    public List<String> diagnostics() {
        return diagnostics;
    }

    public SeparatorSettings separators() {
        return separators;
    }

    public boolean isValid() {
        return diagnostics.isEmpty();
    }

    /**
     * Canonical formula text, starting with '='. Formulas that failed to parse return their source text,
     * which structural edits and copies leave untouched.
     */
    public String toFormulaString() {
        if (!isValid() && source != null) {
            return source;
        }
        return "=" + expression.toExpressionText(separators);
    }

    /**
     * The formula after {@code count} rows or columns are inserted at {@code index} on {@code localSheet}.
     * References to other sheets are left alone; references pushed off the sheet become {@code #REF!}.
     */
    public CellFormula afterInsert(Axis axis, int index, int count, String localSheet) {
        return rewrite(ref -> ref.isOnSheet(localSheet) ? ref.afterInsert(axis, index, count) : ref);
    }

    /**
     * The formula after {@code count} rows or columns are removed at {@code index} on {@code localSheet}.
     * References whose cells were all removed become {@code #REF!}.
     */
    public CellFormula afterRemove(Axis axis, int index, int count, String localSheet) {
        return rewrite(ref -> ref.isOnSheet(localSheet) ? ref.afterRemove(axis, index, count) : ref);
    }

    /**
     * The formula as it reads when copied {@code rowOffset} rows down and {@code colOffset} columns right.
     * Relative coordinates move, fixed ones stay; references pushed off the sheet become {@code #REF!}.
     */
    public CellFormula offset(int rowOffset, int colOffset) {
        return rewrite(ref -> ref.offset(rowOffset, colOffset));
    }

    private CellFormula rewrite(UnaryOperator<Reference> adjust) {
        if (!isValid()) {
            return this;
        }
        FormulaExpression rewritten = expression.mapReferences(node -> {
            Reference adjusted = adjust.apply(node.reference());
            if (adjusted == null) {
                return LiteralExpression.error(ErrorType.REF, "Reference " + node.reference().toAddressText() + " no longer exists");
            }
            return adjusted.equals(node.reference()) ? node : new ReferenceExpression(adjusted);
        });
        if (rewritten == expression) {
            return this;
        }
        return new CellFormula(null, rewritten, diagnostics, separators);
    }

    @Override
    public String toString() {
        return toFormulaString();
    }
}
