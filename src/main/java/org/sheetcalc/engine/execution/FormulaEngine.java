package org.sheetcalc.engine.execution;

import org.eclipse.collections.api.factory.Lists;
import org.eclipse.collections.api.factory.Sets;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.set.MutableSet;
import org.sheetcalc.engine.dependency.DependencyInfo;
import org.sheetcalc.engine.dependency.DependencyManager;
import org.sheetcalc.engine.dependency.DependencyRestoreData;
import org.sheetcalc.engine.dependency.FormulaVertex;
import org.sheetcalc.engine.dependency.VertexKind;
import org.sheetcalc.engine.eval.Environment;
import org.sheetcalc.engine.eval.Evaluator;
import org.sheetcalc.engine.eval.FormulaExecutionContext;
import org.sheetcalc.engine.function.FunctionRegistry;
import org.sheetcalc.engine.value.CellValue;
import org.sheetcalc.engine.value.ErrorType;
import org.sheetcalc.formula.dsl.CellFormula;
import org.sheetcalc.formula.dsl.FormulaParser;
import org.sheetcalc.formula.reference.Axis;
import org.sheetcalc.formula.reference.Region;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Recalculation orchestrator for one sheet.
 * <p>
 * Formulas are registered with the dependency graph and marked dirty. A calculation pass
 * evaluates the dirty vertices and everything depending on them (or every vertex in a full
 * pass) group by group in dependency order, writes each result back through the environment
 * and notifies listeners of results that changed. Cycle groups are evaluated with their
 * members visible to the evaluator, so every member of a cycle comes out {@code #CIRCULAR}.
 * <p>
 * Store writes made by a pass report back through {@link #cellsChanged}; they are ignored
 * while the pass runs.
 */
public final class FormulaEngine {

    private static final Logger LOGGER = LoggerFactory.getLogger(FormulaEngine.class);

    private final Environment environment;
    private final FormulaOptions options;
    private final FormulaParser parser;
    private final Evaluator evaluator;
    private final DependencyManager dependencies;
    private final MutableSet<String> dirty = Sets.mutable.empty();
    private final MutableList<ValueChangedListener> listeners = Lists.mutable.empty();
    private boolean calculating;

    public FormulaEngine(Environment environment, FunctionRegistry functions, FormulaOptions options) {
        this.environment = Objects.requireNonNull(environment, "Environment cannot be null");
        this.options = Objects.requireNonNull(options, "Options cannot be null");
        this.parser = new FormulaParser(functions, options.separators());
        this.evaluator = new Evaluator(environment, options.maxRepeatingArguments());
        this.dependencies = new DependencyManager(options.sheetName());
    }

    // ==================== Formulas ====================

    public CellFormula parse(String text) {
        return parser.parse(text);
    }

    /**
     * Whether a raw cell value is formula text: a string starting with '='.
     */
    public static boolean isFormula(Object value) {
        return value instanceof String text && text.startsWith("=");
    }

    /**
     * @return the formula of a cell, or null
     */
    public CellFormula getFormula(int row, int col) {
        return dependencies.getFormula(row, col);
    }

    public DependencyRestoreData setFormula(int row, int col, CellFormula formula) {
        DependencyRestoreData data = dependencies.setFormula(row, col, formula);
        dirty.add(FormulaVertex.cellKey(row, col, null));
        return data;
    }

    /**
     * Forgets a cell's formula. The caller writes the cell's new value, which recalculates its dependents.
     */
    public DependencyRestoreData clearFormula(int row, int col) {
        return dependencies.clearFormula(row, col);
    }

    /**
     * Evaluates a formula against the current values without storing the result.
     */
    public CellValue evaluate(CellFormula formula) {
        return evaluator.evaluate(formula, new FormulaExecutionContext(options.sheetName()));
    }

    // ==================== Named values ====================

    /**
     * Binds a name. Text starting with '=' defines a named formula, e.g. {@code =A1:A10};
     * anything else is stored as a plain value. Formulas reading the name are recalculated.
     */
    public DependencyRestoreData setVariable(String name, Object value) {
        Objects.requireNonNull(name, "Name cannot be null");
        DependencyRestoreData data;
        if (isFormula(value)) {
            data = dependencies.setFormula(name, parse((String) value));
        } else {
            data = dependencies.clearFormula(name);
            environment.setVariable(name, CellValue.of(value));
        }
        dirty.add(FormulaVertex.nameKey(name));
        calculate(false);
        return data;
    }

    public DependencyRestoreData clearVariable(String name) {
        DependencyRestoreData data = dependencies.clearFormula(name);
        environment.clearVariable(name);
        dirty.add(FormulaVertex.nameKey(name));
        calculate(false);
        return data;
    }

    // ==================== Calculation ====================

    /**
     * Runs a calculation pass.
     *
     * @param full true to evaluate every formula, false to evaluate only the dirty vertices and their dependents
     */
    public void calculate(boolean full) {
        if (calculating) {
            LOGGER.debug("Calculation already running, ignoring nested request");
            return;
        }

        calculating = true;
        try {
            List<FormulaVertex> start = null;
            if (!full) {
                start = Lists.mutable.withAll(dirty)
                        .collect(dependencies::getVertex)
                        .select(Objects::nonNull);
                if (start.isEmpty()) {
                    return;
                }
            }

            List<List<FormulaVertex>> groups = dependencies.getCalculationOrder(start);
            FormulaExecutionContext context = new FormulaExecutionContext(options.sheetName());
            int evaluated = 0;
            for (List<FormulaVertex> group : groups) {
                evaluated += calculateGroup(group, context);
            }
            LOGGER.debug("{} calculation evaluated {} formulas in {} groups",
                    full ? "Full" : "Incremental", evaluated, groups.size());
        } finally {
            dirty.clear();
            calculating = false;
        }
    }

    private int calculateGroup(List<FormulaVertex> group, FormulaExecutionContext context) {
        List<FormulaVertex> members = Lists.mutable.withAll(group).select(FormulaVertex::hasFormula);
        if (members.isEmpty()) {
            return 0;
        }

        context.beginGroup();
        boolean circular = dependencies.isCircular(group);
        if (circular) {
            for (FormulaVertex member : members) {
                if (member.kind() == VertexKind.NAMED) {
                    context.addGroupName(member.name(), member.formula());
                } else {
                    context.addGroupCell(member.row(), member.col(), member.formula());
                }
            }
        }

        boolean cycleFound = false;
        for (FormulaVertex member : members) {
            CellValue value = cycleFound
                    ? CellValue.error(ErrorType.CIRCULAR, "Circular reference")
                    : evaluate(member, context);
            if (circular && value.isError(ErrorType.CIRCULAR)) {
                cycleFound = true;
            }
            store(member, value);
        }
        return members.size();
    }

    private CellValue evaluate(FormulaVertex vertex, FormulaExecutionContext context) {
        if (vertex.kind() == VertexKind.NAMED) {
            return evaluator.evaluate(vertex.formula(), context, false);
        }
        return evaluator.coercer().resolveScalar(evaluator.evaluate(vertex.formula(), context));
    }

    private void store(FormulaVertex vertex, CellValue value) {
        CellValue old;
        if (vertex.kind() == VertexKind.NAMED) {
            old = environment.getVariable(vertex.name());
            environment.setVariable(vertex.name(), value);
        } else {
            old = environment.getCellValue(vertex.row(), vertex.col(), null);
            environment.setCellValue(vertex.row(), vertex.col(), null, value);
        }

        if (!value.equals(old)) {
            ValueChangedEvent event = new ValueChangedEvent(vertex, old == null ? CellValue.EMPTY : old, value);
            for (ValueChangedListener listener : listeners) {
                listener.valueChanged(event);
            }
        }
    }

    /**
     * Entry point for store change notifications: recalculates everything reading the changed cells.
     * Ignored while a pass is running, since the pass's own writes come back through here.
     */
    public void cellsChanged(String sheetName, List<Region> regions) {
        if (calculating) {
            return;
        }
        for (Region region : regions) {
            for (FormulaVertex vertex : dependencies.findDependents(region, sheetName)) {
                dirty.add(vertex.key());
            }
        }
        calculate(false);
    }

    public boolean isCalculating() {
        return calculating;
    }

    // ==================== Structural edits ====================

    /**
     * Shifts formulas and dependency keys for inserted rows or columns, then recalculates everything.
     * The store must already hold the shifted values.
     */
    public DependencyRestoreData insertRowCol(Axis axis, int index, int count) {
        DependencyRestoreData data = dependencies.insertRowCol(axis, index, count);
        calculate(true);
        return data;
    }

    /**
     * Drops formulas inside the removed band, shifts the rest and recalculates everything.
     * References into the band become {@code #REF!}.
     */
    public DependencyRestoreData removeRowCol(Axis axis, int index, int count) {
        DependencyRestoreData data = dependencies.removeRowCol(axis, index, count);
        calculate(true);
        return data;
    }

    /**
     * Undoes dependency changes. No calculation runs; the caller restores the store and then
     * calls {@code calculate(true)}.
     *
     * @throws IllegalStateException when called during a calculation pass
     */
    public void restore(DependencyRestoreData data) {
        if (calculating) {
            throw new IllegalStateException("Cannot restore dependencies while calculating");
        }
        dependencies.restore(data);
    }

    // ==================== Inspection and listeners ====================

    public List<DependencyInfo> getDependencies() {
        return dependencies.getDependencies();
    }

    public DependencyManager dependencyManager() {
        return dependencies;
    }

    public FormulaOptions options() {
        return options;
    }

    public void addValueChangedListener(ValueChangedListener listener) {
        listeners.add(Objects.requireNonNull(listener, "Listener cannot be null"));
    }

    public void removeValueChangedListener(ValueChangedListener listener) {
        listeners.remove(listener);
    }
}
