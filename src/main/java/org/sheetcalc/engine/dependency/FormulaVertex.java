package org.sheetcalc.engine.dependency;

import org.sheetcalc.engine.graph.Vertex;
import org.sheetcalc.formula.dsl.CellFormula;
import org.sheetcalc.formula.reference.RangeText;
import org.sheetcalc.formula.reference.Region;

import java.util.Locale;
import java.util.Objects;

/**
 * A node of the formula dependency graph.
 * <p>
 * Cell and region vertices carry the cells they stand for and, when they point into another
 * sheet, that sheet's name; named vertices carry the name. Cell and named vertices may hold
 * a formula. Vertices are immutable: changes produce a new vertex that is swapped into the graph.
 */
public final class FormulaVertex implements Vertex {

    private final VertexKind kind;
    private final Region region;
    private final String name;
    private final String sheetName;
    private final CellFormula formula;
    private final String key;

    private FormulaVertex(VertexKind kind, Region region, String name, String sheetName, CellFormula formula) {
        this.kind = kind;
        this.region = region;
        this.name = name;
        this.sheetName = sheetName;
        this.formula = formula;
        this.key = keyOf(kind, region, name, sheetName);
    }

    public static FormulaVertex cell(int row, int col, String sheetName, CellFormula formula) {
        return new FormulaVertex(VertexKind.CELL, Region.cell(row, col), null, sheetName, formula);
    }

    /**
     * A vertex for a block of cells. A single-cell block is a cell vertex.
     */
    public static FormulaVertex region(Region region, String sheetName) {
        Objects.requireNonNull(region, "Region cannot be null");
        if (region.isSingleCell()) {
            return cell(region.top(), region.left(), sheetName, null);
        }
        return new FormulaVertex(VertexKind.REGION, region, null, sheetName, null);
    }

    public static FormulaVertex named(String name, CellFormula formula) {
        Objects.requireNonNull(name, "Name cannot be null");
        return new FormulaVertex(VertexKind.NAMED, null, name, null, formula);
    }

    public static String cellKey(int row, int col, String sheetName) {
        return keyOf(VertexKind.CELL, Region.cell(row, col), null, sheetName);
    }

    public static String nameKey(String name) {
        return keyOf(VertexKind.NAMED, null, name, null);
    }

    private static String keyOf(VertexKind kind, Region region, String name, String sheetName) {
        if (kind == VertexKind.NAMED) {
            return name.toUpperCase(Locale.ROOT);
        }
        String prefix = sheetName == null ? "" : RangeText.sheetPrefix(sheetName.toUpperCase(Locale.ROOT));
        return prefix + RangeText.regionToText(region);
    }

    // ==================== Derived vertices ====================

    public FormulaVertex withFormula(CellFormula newFormula) {
        return new FormulaVertex(kind, region, name, sheetName, newFormula);
    }

    /**
     * The same vertex over other cells. A region shrunk to a single cell becomes a cell vertex.
     */
    public FormulaVertex withRegion(Region newRegion) {
        if (kind == VertexKind.REGION) {
            return region(newRegion, sheetName);
        }
        return new FormulaVertex(kind, newRegion, name, sheetName, formula);
    }

    // ==================== Accessors ====================

    @Override
    public String key() {
        return key;
    }

    public VertexKind kind() {
        return kind;
    }

    /**
     * @return the cells, or null for a named vertex
     */
    public Region region() {
        return region;
    }

    public String name() {
        return name;
    }

    /**
     * @return the sheet, or null when the vertex is on the engine's own sheet
     */
    public String sheetName() {
        return sheetName;
    }

    /**
     * @return the formula, or null when the vertex is only read by other formulas
     */
    public CellFormula formula() {
        return formula;
    }

    public boolean hasFormula() {
        return formula != null;
    }

    public boolean isLocal() {
        return sheetName == null && kind != VertexKind.NAMED;
    }

    public int row() {
        return region.top();
    }

    public int col() {
        return region.left();
    }

    public boolean isOnSheet(String sheet) {
        if (kind == VertexKind.NAMED) {
            return false;
        }
        if (sheet == null || sheetName == null) {
            return sheet == null && sheetName == null;
        }
        return sheetName.equalsIgnoreCase(sheet);
    }

    @Override
    public String toString() {
        return hasFormula() ? key + " " + formula.toFormulaString() : key;
    }
}
