package org.sheetcalc.engine.eval;

import org.sheetcalc.engine.eval.FormulaExecutionContext.GroupCell;
import org.sheetcalc.engine.function.ParameterDefinition;
import org.sheetcalc.engine.function.SheetFunction;
import org.sheetcalc.engine.value.CellValue;
import org.sheetcalc.engine.value.CellValueType;
import org.sheetcalc.engine.value.ErrorType;
import org.sheetcalc.formula.dsl.CellFormula;
import org.sheetcalc.formula.dsl.ast.ArrayConstantExpression;
import org.sheetcalc.formula.dsl.ast.BinaryExpression;
import org.sheetcalc.formula.dsl.ast.FormulaExpression;
import org.sheetcalc.formula.dsl.ast.FormulaExpressionVisitor;
import org.sheetcalc.formula.dsl.ast.FunctionCallExpression;
import org.sheetcalc.formula.dsl.ast.LiteralExpression;
import org.sheetcalc.formula.dsl.ast.NameExpression;
import org.sheetcalc.formula.dsl.ast.ParenthesizedExpression;
import org.sheetcalc.formula.dsl.ast.ReferenceExpression;
import org.sheetcalc.formula.dsl.ast.UnaryExpression;
import org.sheetcalc.formula.reference.Reference;
import org.sheetcalc.formula.reference.ReferenceKind;
import org.sheetcalc.formula.reference.Region;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Tree-walking formula evaluator.
 * <p>
 * The evaluator holds no per-pass state: everything that changes during a pass lives in
 * the {@link FormulaExecutionContext} passed to each call. References are returned as
 * REFERENCE values and resolved lazily by operators and parameter conversion, except
 * references to cells of the current cycle group, whose formulas are evaluated in place.
 */
public final class Evaluator {

    private static final Logger LOGGER = LoggerFactory.getLogger(Evaluator.class);

    public static final int DEFAULT_MAX_REPEATING_ARGUMENTS = 128;

    private final Environment environment;
    private final CellValueCoercer coercer;
    private final ParameterConverter converter;
    private final BinaryOpEvaluator binaryOps;
    private final UnaryOpEvaluator unaryOps;
    private final int maxRepeatingArguments;

    public Evaluator(Environment environment) {
        this(environment, DEFAULT_MAX_REPEATING_ARGUMENTS);
    }

    public Evaluator(Environment environment, int maxRepeatingArguments) {
        this.environment = Objects.requireNonNull(environment, "Environment cannot be null");
        if (maxRepeatingArguments < 1) {
            throw new IllegalArgumentException("maxRepeatingArguments must be positive: " + maxRepeatingArguments);
        }
        this.coercer = new CellValueCoercer(environment);
        this.converter = new ParameterConverter(coercer);
        this.binaryOps = new BinaryOpEvaluator(coercer);
        this.unaryOps = new UnaryOpEvaluator(coercer);
        this.maxRepeatingArguments = maxRepeatingArguments;
    }

    public CellValueCoercer coercer() {
        return coercer;
    }

    /**
     * Evaluates a formula and resolves a reference result to the value it points to.
     */
    public CellValue evaluate(CellFormula formula, FormulaExecutionContext context) {
        return evaluate(formula, context, true);
    }

    /**
     * Evaluates a formula.
     *
     * @param resolveReferences when false a reference result is returned as is, which is how
     *                          named range definitions keep pointing at their cells
     */
    public CellValue evaluate(CellFormula formula, FormulaExecutionContext context, boolean resolveReferences) {
        Objects.requireNonNull(formula, "Formula cannot be null");
        Objects.requireNonNull(context, "Execution context cannot be null");

        CellValue value = doEvaluate(formula, context);
        return resolveReferences ? coercer.resolve(value) : value;
    }

    private CellValue doEvaluate(CellFormula formula, FormulaExecutionContext context) {
        CellValue known = context.computed(formula);
        if (known != null) {
            return known;
        }
        if (!context.enter(formula)) {
            return CellValue.error(ErrorType.CIRCULAR, "Circular reference");
        }

        CellValue value;
        try {
            value = formula.expression().accept(new ExpressionEvaluation(context));
        } finally {
            context.exit(formula);
        }
        context.recordComputed(formula, value);
        return value;
    }

    /**
     * Evaluation of one expression tree within a context.
     */
    private final class ExpressionEvaluation implements FormulaExpressionVisitor<CellValue> {

        private final FormulaExecutionContext context;

        ExpressionEvaluation(FormulaExecutionContext context) {
            this.context = context;
        }

        @Override
        public CellValue visit(LiteralExpression literal) {
            return literal.value();
        }

        @Override
        public CellValue visit(BinaryExpression binary) {
            CellValue left = binary.left().accept(this);
            CellValue right = binary.right().accept(this);
            return binaryOps.evaluate(binary.operator(), left, right);
        }

        @Override
        public CellValue visit(UnaryExpression unary) {
            return unaryOps.evaluate(unary.operator(), unary.operand().accept(this));
        }

        @Override
        public CellValue visit(ParenthesizedExpression parenthesized) {
            return parenthesized.inner().accept(this);
        }

        @Override
        public CellValue visit(ReferenceExpression referenceExpression) {
            Reference reference = referenceExpression.reference();
            if (!reference.isOnSheet(context.localSheet())) {
                return CellValue.reference(reference);
            }

            Region region = reference.region();
            if (reference.kind() == ReferenceKind.CELL) {
                CellFormula grouped = context.groupCellFormula(region.top(), region.left());
                return grouped == null
                        ? CellValue.reference(reference)
                        : coercer.resolve(doEvaluate(grouped, context));
            }

            List<GroupCell> groupCells = context.groupCellsIn(region);
            return groupCells.isEmpty()
                    ? CellValue.reference(reference)
                    : rangeWithGroupCells(reference, groupCells);
        }

        /**
         * The values of a range that contains members of the current group, with those members
         * evaluated in this context so a cycle through the range is detected.
         */
        private CellValue rangeWithGroupCells(Reference reference, List<GroupCell> groupCells) {
            CellValue stored = environment.getRangeValues(reference);
            if (stored.type() != CellValueType.ARRAY) {
                return stored;
            }

            CellValue[][] source = stored.asArray();
            CellValue[][] rows = new CellValue[source.length][];
            for (int r = 0; r < source.length; r++) {
                rows[r] = source[r].clone();
            }

            Region region = reference.region();
            for (GroupCell cell : groupCells) {
                int r = cell.row() - region.top();
                int c = cell.col() - region.left();
                if (r < rows.length && c < rows[r].length) {
                    rows[r][c] = coercer.resolveScalar(doEvaluate(cell.formula(), context));
                }
            }
            return CellValue.array(rows);
        }

        @Override
        public CellValue visit(NameExpression name) {
            CellFormula grouped = context.groupNameFormula(name.name());
            if (grouped != null) {
                return doEvaluate(grouped, context);
            }
            if (environment.variableExists(name.name())) {
                return environment.getVariable(name.name());
            }
            return CellValue.error(ErrorType.NAME, "Unknown name " + name.name());
        }

        @Override
        public CellValue visit(ArrayConstantExpression arrayConstant) {
            CellValue[][] rows = new CellValue[arrayConstant.height()][];
            for (int r = 0; r < rows.length; r++) {
                List<LiteralExpression> row = arrayConstant.rows().get(r);
                rows[r] = new CellValue[row.size()];
                for (int c = 0; c < row.size(); c++) {
                    rows[r][c] = row.get(c).value();
                }
            }
            return CellValue.array(rows);
        }

        @Override
        public CellValue visit(FunctionCallExpression call) {
            SheetFunction function = call.isResolved() ? call.function() : environment.getFunction(call.name());
            if (function == null) {
                return CellValue.error(ErrorType.NAME, "Unknown function " + call.name());
            }

            List<ParameterDefinition> parameters = function.parameterDefinitions();
            List<FormulaExpression> arguments = call.arguments();
            int min = (int) parameters.stream().filter(ParameterDefinition::isRequired).count();
            int max = maxArguments(parameters);
            if (arguments.size() < min || arguments.size() > max) {
                return CellValue.error(ErrorType.NA, call.name() + " expects "
                        + (min == max ? String.valueOf(min) : min + " to " + max)
                        + " arguments but got " + arguments.size());
            }

            CellValue[] args = new CellValue[arguments.size()];
            for (int i = 0; i < args.length; i++) {
                ParameterDefinition parameter = parameters.get(Math.min(i, parameters.size() - 1));
                CellValue argument = arguments.get(i).accept(this);
                if (argument.isError() && !function.acceptsErrors()) {
                    return argument;
                }
                CellValue converted = converter.convert(argument, parameter);
                if (converted.isError() && !function.acceptsErrors()) {
                    return converted;
                }
                args[i] = converted;
            }

            return call(call.name(), function, args);
        }

        private int maxArguments(List<ParameterDefinition> parameters) {
            if (parameters.isEmpty()) {
                return 0;
            }
            return parameters.get(parameters.size() - 1).repeating() ? maxRepeatingArguments : parameters.size();
        }
    }

    private static CellValue call(String name, SheetFunction function, CellValue[] args) {
        CellValue result;
        try {
            result = function.call(args);
        } catch (RuntimeException e) {
            LOGGER.warn("Function {} failed", name, e);
            return CellValue.error(ErrorType.NA, name + " failed: " + e.getMessage());
        }

        if (result == null) {
            return CellValue.error(ErrorType.NA, name + " returned no value");
        }
        if (result.type() == CellValueType.NUMBER) {
            return BinaryOpEvaluator.number(result.asNumber());
        }
        return result;
    }
}
