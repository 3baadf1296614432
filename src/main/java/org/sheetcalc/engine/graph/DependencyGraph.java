package org.sheetcalc.engine.graph;

import org.eclipse.collections.api.factory.Lists;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.list.mutable.primitive.IntArrayList;
import org.eclipse.collections.impl.map.mutable.primitive.ObjectIntHashMap;
import org.eclipse.collections.impl.set.mutable.primitive.IntHashSet;

import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Directed graph of vertices stored in an arena.
 * <p>
 * Each vertex occupies an integer slot; edges are kept as sets of slot indices in both
 * directions, and a side map translates vertex keys to slots. An edge runs from a
 * precedent to the dependent that reads it. Duplicate edges are ignored; self edges are allowed.
 *
 * @param <T> The vertex type
 */
public final class DependencyGraph<T extends Vertex> {

    private static final int NO_INDEX = -1;

    private final MutableList<T> vertices = Lists.mutable.empty();
    private final MutableList<IntHashSet> dependents = Lists.mutable.empty();
    private final MutableList<IntHashSet> precedents = Lists.mutable.empty();
    private final ObjectIntHashMap<String> indexByKey = new ObjectIntHashMap<>();
    private final IntArrayList freeSlots = new IntArrayList();
    private int edgeCount;

    // ==================== Vertices ====================

    /**
     * Adds a vertex unless one with the same key exists.
     *
     * @return true if the vertex was added
     */
    public boolean addVertex(T vertex) {
        Objects.requireNonNull(vertex, "Vertex cannot be null");
        if (indexByKey.containsKey(vertex.key())) {
            return false;
        }

        int index;
        if (freeSlots.notEmpty()) {
            index = freeSlots.removeAtIndex(freeSlots.size() - 1);
            vertices.set(index, vertex);
        } else {
            index = vertices.size();
            vertices.add(vertex);
            dependents.add(new IntHashSet());
            precedents.add(new IntHashSet());
        }
        indexByKey.put(vertex.key(), index);
        return true;
    }

    /**
     * Removes a vertex together with its incident edges.
     *
     * @return true if the vertex was present
     */
    public boolean removeVertex(T vertex) {
        int index = indexOf(vertex.key());
        if (index == NO_INDEX) {
            return false;
        }

        IntHashSet outgoing = dependents.get(index);
        IntHashSet incoming = precedents.get(index);
        edgeCount -= outgoing.size() + incoming.size() - (outgoing.contains(index) ? 1 : 0);
        outgoing.each(dependent -> precedents.get(dependent).remove(index));
        incoming.each(precedent -> dependents.get(precedent).remove(index));
        outgoing.clear();
        incoming.clear();

        vertices.set(index, null);
        indexByKey.removeKey(vertex.key());
        freeSlots.add(index);
        return true;
    }

    /**
     * Replaces a vertex in place: the replacement takes over the slot and every edge.
     *
     * @throws IllegalArgumentException if {@code oldVertex} is not in the graph
     * @throws IllegalStateException    if another vertex already uses the replacement's key
     */
    public void swap(T oldVertex, T newVertex) {
        Objects.requireNonNull(newVertex, "Replacement vertex cannot be null");
        int index = indexOf(oldVertex.key());
        if (index == NO_INDEX) {
            throw new IllegalArgumentException("Vertex not in graph: " + oldVertex.key());
        }
        int existing = indexOf(newVertex.key());
        if (existing != NO_INDEX && existing != index) {
            throw new IllegalStateException("Key already in use: " + newVertex.key());
        }

        vertices.set(index, newVertex);
        indexByKey.removeKey(oldVertex.key());
        indexByKey.put(newVertex.key(), index);
    }

    public boolean hasVertex(String key) {
        return indexByKey.containsKey(key);
    }

    /**
     * @return the vertex with this key, or null
     */
    public T getVertex(String key) {
        int index = indexOf(key);
        return index == NO_INDEX ? null : vertices.get(index);
    }

    /**
     * All vertices in slot order.
     */
    public List<T> getAll() {
        return vertices.select(Objects::nonNull);
    }

    public int vertexCount() {
        return indexByKey.size();
    }

    public int edgeCount() {
        return edgeCount;
    }

    // ==================== Edges ====================

    /**
     * Adds an edge from {@code precedent} to {@code dependent}, adding missing vertices.
     *
     * @return true if the edge is new
     */
    public boolean addEdge(T precedent, T dependent) {
        addVertex(precedent);
        addVertex(dependent);
        int from = indexOf(precedent.key());
        int to = indexOf(dependent.key());
        if (!dependents.get(from).add(to)) {
            return false;
        }
        precedents.get(to).add(from);
        edgeCount++;
        return true;
    }

    /**
     * @return true if the edge was present
     */
    public boolean removeEdge(T precedent, T dependent) {
        int from = indexOf(precedent.key());
        int to = indexOf(dependent.key());
        if (from == NO_INDEX || to == NO_INDEX || !dependents.get(from).remove(to)) {
            return false;
        }
        precedents.get(to).remove(from);
        edgeCount--;
        return true;
    }

    public boolean hasEdge(T precedent, T dependent) {
        int from = indexOf(precedent.key());
        int to = indexOf(dependent.key());
        return from != NO_INDEX && to != NO_INDEX && dependents.get(from).contains(to);
    }

    /**
     * The vertices that read {@code vertex}.
     */
    public List<T> adj(T vertex) {
        return neighbours(dependents, vertex);
    }

    /**
     * The vertices {@code vertex} reads.
     */
    public List<T> prec(T vertex) {
        return neighbours(precedents, vertex);
    }

    private List<T> neighbours(MutableList<IntHashSet> edges, T vertex) {
        int index = indexOf(vertex.key());
        if (index == NO_INDEX) {
            return List.of();
        }
        MutableList<T> result = Lists.mutable.empty();
        for (int neighbour : edges.get(index).toSortedArray()) {
            result.add(vertices.get(neighbour));
        }
        return result;
    }

    // ==================== Ordering ====================

    /**
     * Strongly connected components of the whole graph in topological order:
     * every group comes after the groups it depends on.
     */
    public List<List<T>> topologicalSort() {
        IntArrayList starts = new IntArrayList();
        for (int i = 0; i < vertices.size(); i++) {
            if (vertices.get(i) != null) {
                starts.add(i);
            }
        }
        return new Tarjan().run(starts);
    }

    /**
     * Like {@link #topologicalSort()} but restricted to the start vertices and everything
     * that depends on them, directly or transitively. Unknown start vertices are ignored.
     */
    public List<List<T>> topologicalSort(Collection<T> startVertices) {
        IntHashSet starts = new IntHashSet();
        for (T vertex : startVertices) {
            int index = indexOf(vertex.key());
            if (index != NO_INDEX) {
                starts.add(index);
            }
        }
        return new Tarjan().run(IntArrayList.newListWith(starts.toSortedArray()));
    }

    /**
     * Whether a group is a cycle: more than one member, or a single member reading itself.
     */
    public boolean isCircular(List<T> group) {
        if (group.size() > 1) {
            return true;
        }
        return group.size() == 1 && hasEdge(group.get(0), group.get(0));
    }

    private int indexOf(String key) {
        return indexByKey.getIfAbsent(key, NO_INDEX);
    }

    /**
     * Iterative Tarjan so long dependency chains cannot overflow the call stack.
     */
    private final class Tarjan {

        private final int[] order = new int[vertices.size()];
        private final int[] low = new int[vertices.size()];
        private final int[] nextChild = new int[vertices.size()];
        private final int[][] children = new int[vertices.size()][];
        private final boolean[] onStack = new boolean[vertices.size()];
        private final IntArrayList stack = new IntArrayList();
        private final MutableList<List<T>> groups = Lists.mutable.empty();
        private int counter;

        Tarjan() {
            Arrays.fill(order, NO_INDEX);
        }

        List<List<T>> run(IntArrayList starts) {
            for (int i = 0; i < starts.size(); i++) {
                if (order[starts.get(i)] == NO_INDEX) {
                    strongConnect(starts.get(i));
                }
            }
            // Components complete sinks first
            return groups.reverseThis();
        }

        private void strongConnect(int root) {
            IntArrayList callStack = new IntArrayList();
            visit(root);
            callStack.add(root);

            while (callStack.notEmpty()) {
                int v = callStack.getLast();
                if (nextChild[v] < children[v].length) {
                    int w = children[v][nextChild[v]++];
                    if (order[w] == NO_INDEX) {
                        visit(w);
                        callStack.add(w);
                    } else if (onStack[w]) {
                        low[v] = Math.min(low[v], order[w]);
                    }
                    continue;
                }

                callStack.removeAtIndex(callStack.size() - 1);
                if (callStack.notEmpty()) {
                    int parent = callStack.getLast();
                    low[parent] = Math.min(low[parent], low[v]);
                }
                if (low[v] == order[v]) {
                    emitGroup(v);
                }
            }
        }

        private void visit(int v) {
            order[v] = counter;
            low[v] = counter;
            counter++;
            children[v] = dependents.get(v).toSortedArray();
            stack.add(v);
            onStack[v] = true;
        }

        private void emitGroup(int root) {
            MutableList<T> group = Lists.mutable.empty();
            int w;
            do {
                w = stack.removeAtIndex(stack.size() - 1);
                onStack[w] = false;
                group.add(vertices.get(w));
            } while (w != root);
            groups.add(group.reverseThis());
        }
    }
}
