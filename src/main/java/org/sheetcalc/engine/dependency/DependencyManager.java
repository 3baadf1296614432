package org.sheetcalc.engine.dependency;

import org.eclipse.collections.api.factory.Lists;
import org.eclipse.collections.api.list.MutableList;
import org.sheetcalc.engine.dependency.DependencyRestoreData.Change;
import org.sheetcalc.engine.dependency.DependencyRestoreData.EdgeAdded;
import org.sheetcalc.engine.dependency.DependencyRestoreData.EdgeRemoved;
import org.sheetcalc.engine.dependency.DependencyRestoreData.VertexAdded;
import org.sheetcalc.engine.dependency.DependencyRestoreData.VertexRemoved;
import org.sheetcalc.engine.dependency.DependencyRestoreData.VertexSwapped;
import org.sheetcalc.engine.graph.DependencyGraph;
import org.sheetcalc.formula.dsl.CellFormula;
import org.sheetcalc.formula.reference.Axis;
import org.sheetcalc.formula.reference.NamedReference;
import org.sheetcalc.formula.reference.Reference;
import org.sheetcalc.formula.reference.ReferenceKind;
import org.sheetcalc.formula.reference.Region;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Maintains the dependency graph of one sheet's formulas.
 * <p>
 * Every formula cell and named formula is a vertex with an edge from each vertex it reads.
 * A range, row or column reference reads a region vertex, and every formula cell inside that
 * region has an edge to the region vertex, so a formula summing a range is ordered after the
 * formulas in the range. A cell has edges to region vertices exactly while it holds a formula.
 * <p>
 * Vertices nobody reads and that hold no formula are dropped as soon as their last dependent goes.
 * Every mutating operation returns the list of graph changes it made, which {@link #restore} undoes.
 */
public final class DependencyManager {

    private static final Logger LOGGER = LoggerFactory.getLogger(DependencyManager.class);

    private final DependencyGraph<FormulaVertex> graph = new DependencyGraph<>();
    private final String localSheet;

    /**
     * A vertex that a structural edit replaces by another.
     */
    private record Move(FormulaVertex from, FormulaVertex to) {
    }

    /**
     * @param localSheet Name of the sheet the formulas live on; references qualified with it count as local
     */
    public DependencyManager(String localSheet) {
        this.localSheet = localSheet;
    }

    // ==================== Formulas ====================

    public DependencyRestoreData setFormula(int row, int col, CellFormula formula) {
        Objects.requireNonNull(formula, "Formula cannot be null");
        DependencyRestoreData data = new DependencyRestoreData();
        FormulaVertex vertex = FormulaVertex.cell(row, col, null, formula);
        install(vertex, data);
        linkToContainingRegions(vertex, data);
        return data;
    }

    public DependencyRestoreData setFormula(String name, CellFormula formula) {
        Objects.requireNonNull(formula, "Formula cannot be null");
        DependencyRestoreData data = new DependencyRestoreData();
        install(FormulaVertex.named(name, formula), data);
        return data;
    }

    public DependencyRestoreData clearFormula(int row, int col) {
        DependencyRestoreData data = new DependencyRestoreData();
        uninstall(graph.getVertex(FormulaVertex.cellKey(row, col, null)), data);
        return data;
    }

    public DependencyRestoreData clearFormula(String name) {
        DependencyRestoreData data = new DependencyRestoreData();
        uninstall(graph.getVertex(FormulaVertex.nameKey(name)), data);
        return data;
    }

    /**
     * @return the formula of a cell on this sheet, or null
     */
    public CellFormula getFormula(int row, int col) {
        FormulaVertex vertex = graph.getVertex(FormulaVertex.cellKey(row, col, null));
        return vertex == null ? null : vertex.formula();
    }

    /**
     * @return the formula bound to a name, or null
     */
    public CellFormula getNamedFormula(String name) {
        FormulaVertex vertex = graph.getVertex(FormulaVertex.nameKey(name));
        return vertex == null ? null : vertex.formula();
    }

    private void install(FormulaVertex vertex, DependencyRestoreData data) {
        FormulaVertex existing = graph.getVertex(vertex.key());
        if (existing != null) {
            detachPrecedents(existing, data);
            swap(existing, vertex, data);
        } else {
            addVertex(vertex, data);
        }

        for (Reference reference : vertex.formula().references()) {
            FormulaVertex precedent = obtain(precedentFor(reference), data);
            addEdge(precedent, vertex, data);
        }
    }

    private void uninstall(FormulaVertex existing, DependencyRestoreData data) {
        if (existing == null || !existing.hasFormula()) {
            return;
        }
        detachPrecedents(existing, data);
        for (FormulaVertex dependent : graph.adj(existing)) {
            if (dependent.kind() == VertexKind.REGION) {
                removeEdge(existing, dependent, data);
            }
        }

        if (graph.adj(existing).isEmpty()) {
            removeVertex(existing, data);
        } else {
            swap(existing, existing.withFormula(null), data);
        }
    }

    private FormulaVertex precedentFor(Reference reference) {
        if (reference.kind() == ReferenceKind.NAMED) {
            return FormulaVertex.named(((NamedReference) reference).name(), null);
        }
        String sheet = reference.isOnSheet(localSheet) ? null : reference.sheetName();
        return FormulaVertex.region(reference.region(), sheet);
    }

    /**
     * Returns the graph's vertex for the candidate's key, adding the candidate if there is none.
     * A new local region vertex is linked from the formula cells it contains.
     */
    private FormulaVertex obtain(FormulaVertex candidate, DependencyRestoreData data) {
        FormulaVertex existing = graph.getVertex(candidate.key());
        if (existing != null) {
            return existing;
        }
        addVertex(candidate, data);
        if (candidate.kind() == VertexKind.REGION && candidate.isLocal()) {
            for (FormulaVertex cell : formulaCellsIn(candidate.region())) {
                addEdge(cell, candidate, data);
            }
        }
        return candidate;
    }

    private void detachPrecedents(FormulaVertex vertex, DependencyRestoreData data) {
        for (FormulaVertex precedent : graph.prec(vertex)) {
            removeEdge(precedent, vertex, data);
            if (precedent != vertex) {
                collectGarbage(precedent, data);
            }
        }
    }

    private void collectGarbage(FormulaVertex vertex, DependencyRestoreData data) {
        FormulaVertex current = graph.getVertex(vertex.key());
        if (current != null && !current.hasFormula() && graph.adj(current).isEmpty()) {
            removeVertex(current, data);
        }
    }

    private void linkToContainingRegions(FormulaVertex cell, DependencyRestoreData data) {
        for (FormulaVertex vertex : graph.getAll()) {
            if (vertex.kind() == VertexKind.REGION && vertex.isLocal() && vertex.region().contains(cell.row(), cell.col())) {
                addEdge(cell, vertex, data);
            }
        }
    }

    private List<FormulaVertex> formulaCellsIn(Region region) {
        return Lists.mutable.withAll(graph.getAll()).select(vertex -> vertex.kind() == VertexKind.CELL
                && vertex.isLocal()
                && vertex.hasFormula()
                && region.contains(vertex.row(), vertex.col()));
    }

    // ==================== Queries ====================

    public FormulaVertex getVertex(String key) {
        return graph.getVertex(key);
    }

    /**
     * Cell and region vertices on {@code sheet} whose cells intersect {@code region}.
     *
     * @param sheet The sheet that changed; null or the local sheet's name for this sheet
     */
    public List<FormulaVertex> findDependents(Region region, String sheet) {
        String normalized = sheet == null || sheet.equalsIgnoreCase(localSheet) ? null : sheet;
        return Lists.mutable.withAll(graph.getAll()).select(vertex -> vertex.kind() != VertexKind.NAMED
                && vertex.isOnSheet(normalized)
                && vertex.region().intersects(region));
    }

    /**
     * Vertex groups in calculation order.
     *
     * @param startVertices Restricts the order to these vertices and their dependents; null for all vertices
     */
    public List<List<FormulaVertex>> getCalculationOrder(Collection<FormulaVertex> startVertices) {
        return startVertices == null ? graph.topologicalSort() : graph.topologicalSort(startVertices);
    }

    public boolean isCircular(List<FormulaVertex> group) {
        return graph.isCircular(group);
    }

    public List<DependencyInfo> getDependencies() {
        MutableList<DependencyInfo> dependencies = Lists.mutable.empty();
        for (FormulaVertex precedent : graph.getAll()) {
            for (FormulaVertex dependent : graph.adj(precedent)) {
                dependencies.add(new DependencyInfo(precedent.key(), dependent.key()));
            }
        }
        return dependencies;
    }

    public List<FormulaVertex> getVertices() {
        return graph.getAll();
    }

    // ==================== Structural edits ====================

    /**
     * Re-keys vertices and rewrites formulas for {@code count} rows or columns inserted at {@code index}.
     */
    public DependencyRestoreData insertRowCol(Axis axis, int index, int count) {
        validateEdit(index, count);
        DependencyRestoreData data = new DependencyRestoreData();

        MutableList<FormulaVertex> removed = Lists.mutable.empty();
        MutableList<Move> moves = Lists.mutable.empty();
        for (FormulaVertex vertex : graph.getAll()) {
            FormulaVertex shifted = shift(vertex, axis, index, count, true);
            if (shifted == null) {
                removed.add(vertex);
            } else if (shifted != vertex) {
                moves.add(new Move(vertex, shifted));
            }
        }
        // Vertices pushed off the sheet go first; the store has already dropped their cells
        for (FormulaVertex vertex : removed) {
            removeVertex(graph.getVertex(vertex.key()), data);
        }
        // Move the vertices furthest along first so each target key is already vacated
        moves.sortThis(Comparator.<Move>comparingInt(move -> startOf(move.from(), axis))
                .thenComparingInt(move -> endOf(move.from(), axis))
                .reversed());
        applyMoves(moves, data);

        LOGGER.debug("Inserted {} {}(s) at {}: {} vertices pushed off, {} changed",
                count, axis, index, removed.size(), moves.size());
        return data;
    }

    /**
     * Removes the vertices inside the removed band, then re-keys the rest and rewrites formulas.
     * References into the band become {@code #REF!}.
     */
    public DependencyRestoreData removeRowCol(Axis axis, int index, int count) {
        validateEdit(index, count);
        DependencyRestoreData data = new DependencyRestoreData();

        MutableList<FormulaVertex> removed = Lists.mutable.empty();
        MutableList<Move> moves = Lists.mutable.empty();
        for (FormulaVertex vertex : graph.getAll()) {
            FormulaVertex shifted = shift(vertex, axis, index, count, false);
            if (shifted == null) {
                removed.add(vertex);
            } else if (shifted != vertex) {
                moves.add(new Move(vertex, shifted));
            }
        }
        for (FormulaVertex vertex : removed) {
            removeVertex(graph.getVertex(vertex.key()), data);
        }
        moves.sortThis(Comparator.<Move>comparingInt(move -> startOf(move.from(), axis))
                .thenComparingInt(move -> endOf(move.from(), axis)));
        applyMoves(moves, data);

        LOGGER.debug("Removed {} {}(s) at {}: {} vertices removed, {} changed",
                count, axis, index, removed.size(), moves.size());
        return data;
    }

    private static void validateEdit(int index, int count) {
        if (index < 0) {
            throw new IllegalArgumentException("Index cannot be negative: " + index);
        }
        if (count <= 0) {
            throw new IllegalArgumentException("Count must be positive: " + count);
        }
    }

    /**
     * The vertex after the edit: {@code vertex} itself when nothing changes, null when its cells were removed.
     */
    private FormulaVertex shift(FormulaVertex vertex, Axis axis, int index, int count, boolean inserting) {
        FormulaVertex result = vertex;
        if (vertex.isLocal()) {
            Region region = inserting
                    ? vertex.region().afterInsert(axis, index, count)
                    : vertex.region().afterRemove(axis, index, count);
            if (region == null) {
                return null;
            }
            if (!region.equals(vertex.region())) {
                result = result.withRegion(region);
            }
        }
        if (vertex.hasFormula()) {
            CellFormula formula = inserting
                    ? vertex.formula().afterInsert(axis, index, count, localSheet)
                    : vertex.formula().afterRemove(axis, index, count, localSheet);
            if (formula != vertex.formula()) {
                result = result.withFormula(formula);
            }
        }
        return result;
    }

    private void applyMoves(List<Move> moves, DependencyRestoreData data) {
        for (Move move : moves) {
            FormulaVertex current = graph.getVertex(move.from().key());
            FormulaVertex occupant = graph.getVertex(move.to().key());
            if (occupant == null || occupant == current) {
                swap(current, move.to(), data);
            } else {
                mergeInto(current, occupant, data);
            }
        }
    }

    /**
     * Folds a region vertex into the vertex that already has its new key.
     * A region collapsed onto a cell keeps only its readers, since the cell does not read itself.
     */
    private void mergeInto(FormulaVertex source, FormulaVertex target, DependencyRestoreData data) {
        if (target.kind() == VertexKind.REGION) {
            for (FormulaVertex precedent : graph.prec(source)) {
                addEdge(precedent, target, data);
            }
        }
        for (FormulaVertex dependent : graph.adj(source)) {
            addEdge(target, dependent, data);
        }
        removeVertex(source, data);
    }

    private static int startOf(FormulaVertex vertex, Axis axis) {
        return vertex.region() == null ? -1 : vertex.region().start(axis);
    }

    private static int endOf(FormulaVertex vertex, Axis axis) {
        return vertex.region() == null ? -1 : vertex.region().end(axis);
    }

    // ==================== Restore ====================

    /**
     * Undoes the changes recorded in {@code data}, newest first.
     */
    public void restore(DependencyRestoreData data) {
        List<Change> changes = data.changes();
        for (int i = changes.size() - 1; i >= 0; i--) {
            Change change = changes.get(i);
            if (change instanceof VertexAdded added) {
                graph.removeVertex(added.vertex());
            } else if (change instanceof VertexRemoved removed) {
                graph.addVertex(removed.vertex());
            } else if (change instanceof VertexSwapped swapped) {
                graph.swap(swapped.newVertex(), swapped.oldVertex());
            } else if (change instanceof EdgeAdded edge) {
                graph.removeEdge(edge.precedent(), edge.dependent());
            } else if (change instanceof EdgeRemoved edge) {
                graph.addEdge(edge.precedent(), edge.dependent());
            }
        }
        LOGGER.debug("Restored {} dependency changes", changes.size());
    }

    // ==================== Recorded graph primitives ====================

    private void addVertex(FormulaVertex vertex, DependencyRestoreData data) {
        if (graph.addVertex(vertex)) {
            data.record(new VertexAdded(vertex));
        }
    }

    private void removeVertex(FormulaVertex vertex, DependencyRestoreData data) {
        for (FormulaVertex precedent : graph.prec(vertex)) {
            removeEdge(precedent, vertex, data);
        }
        for (FormulaVertex dependent : graph.adj(vertex)) {
            removeEdge(vertex, dependent, data);
        }
        if (graph.removeVertex(vertex)) {
            data.record(new VertexRemoved(vertex));
        }
    }

    private void swap(FormulaVertex oldVertex, FormulaVertex newVertex, DependencyRestoreData data) {
        graph.swap(oldVertex, newVertex);
        data.record(new VertexSwapped(oldVertex, newVertex));
    }

    private void addEdge(FormulaVertex precedent, FormulaVertex dependent, DependencyRestoreData data) {
        if (graph.addEdge(precedent, dependent)) {
            data.record(new EdgeAdded(precedent, dependent));
        }
    }

    private void removeEdge(FormulaVertex precedent, FormulaVertex dependent, DependencyRestoreData data) {
        if (graph.removeEdge(precedent, dependent)) {
            data.record(new EdgeRemoved(precedent, dependent));
        }
    }
}
