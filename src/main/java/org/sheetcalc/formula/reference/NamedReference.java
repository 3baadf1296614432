package org.sheetcalc.formula.reference;

/**
 * Reference to a defined name (named range or variable).
 *
 * @param name        The name as written in the formula
 * @param validSyntax Whether the name follows the defined-name rules
 */
public record NamedReference(String name, boolean validSyntax) implements Reference {

    public NamedReference(String name) {
        this(name, RangeText.isValidName(name));
    }

    @Override
    public ReferenceKind kind() {
        return ReferenceKind.NAMED;
    }

    @Override
    public String sheetName() {
        return null;
    }

    @Override
    public Region region() {
        return null;
    }

    @Override
    public String toAddressText() {
        return name;
    }

    @Override
    public NamedReference withSheetName(String sheetName) {
        return this;
    }

    @Override
    public NamedReference offset(int rowOffset, int colOffset) {
        return this;
    }

    @Override
    public NamedReference afterInsert(Axis axis, int index, int count) {
        return this;
    }

    @Override
    public NamedReference afterRemove(Axis axis, int index, int count) {
        return this;
    }

    @Override
    public String toString() {
        return name;
    }
}
