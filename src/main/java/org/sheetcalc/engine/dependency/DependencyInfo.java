package org.sheetcalc.engine.dependency;

/**
 * One edge of the dependency graph.
 *
 * @param precedentKey The key of the vertex being read
 * @param dependentKey The key of the vertex reading it
 */
public record DependencyInfo(String precedentKey, String dependentKey) {
}
