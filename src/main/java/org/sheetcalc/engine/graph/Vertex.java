package org.sheetcalc.engine.graph;

/**
 * A node of a {@link DependencyGraph}, identified by a stable text key.
 */
public interface Vertex {

    String key();
}
