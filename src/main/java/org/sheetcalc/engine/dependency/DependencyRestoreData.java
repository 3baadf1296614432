package org.sheetcalc.engine.dependency;

import org.eclipse.collections.api.factory.Lists;
import org.eclipse.collections.api.list.MutableList;

import java.util.List;
import java.util.Objects;

/**
 * Ordered record of the primitive graph changes made by one dependency operation.
 * Replaying the inverse of each change from last to first restores the graph exactly.
 *
 * Change hierarchy:
 * Change
 * ├── VertexAdded
 * ├── VertexRemoved
 * ├── VertexSwapped
 * ├── EdgeAdded
 * └── EdgeRemoved
 */
public final class DependencyRestoreData {

    public sealed interface Change permits VertexAdded, VertexRemoved, VertexSwapped, EdgeAdded, EdgeRemoved {
    }

    public record VertexAdded(FormulaVertex vertex) implements Change {
    }

    /**
     * Recorded after the removal of every incident edge, so only the bare vertex needs restoring.
     */
    public record VertexRemoved(FormulaVertex vertex) implements Change {
    }

    public record VertexSwapped(FormulaVertex oldVertex, FormulaVertex newVertex) implements Change {
    }

    public record EdgeAdded(FormulaVertex precedent, FormulaVertex dependent) implements Change {
    }

    public record EdgeRemoved(FormulaVertex precedent, FormulaVertex dependent) implements Change {
    }

    private final MutableList<Change> changes = Lists.mutable.empty();

    void record(Change change) {
        changes.add(Objects.requireNonNull(change, "Change cannot be null"));
    }

    /**
     * Appends the changes of a later operation, so both are undone together.
     */
    public DependencyRestoreData merge(DependencyRestoreData later) {
        changes.addAll(later.changes);
        return this;
    }

    public List<Change> changes() {
        return changes.asUnmodifiable();
    }

    public boolean isEmpty() {
        return changes.isEmpty();
    }

    @Override
    public String toString() {
        return "DependencyRestoreData" + changes;
    }
}
