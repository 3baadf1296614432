package org.sheetcalc.formula.reference;

/**
 * Sealed interface representing an address found in a formula.
 *
 * Type hierarchy:
 * Reference
 * ├── CellReference (A1, $B$2)
 * ├── RangeReference (A1:C3)
 * ├── RowReference (2:5)
 * ├── ColumnReference (B:D)
 * └── NamedReference (TaxRate)
 *
 * References are immutable: every adjustment returns a new reference.
 */
public sealed interface Reference
        permits CellReference, RangeReference, RowReference, ColumnReference, NamedReference {

    ReferenceKind kind();

    /**
     * The explicit sheet qualifier, or null when the reference is local to the calling sheet.
     */
    String sheetName();

    /**
     * The cells covered by this reference, or null for named references.
     */
    Region region();

    /**
     * Canonical address text including the sheet qualifier, e.g. {@code 'My Sheet'!$A$1:B2}.
     */
    String toAddressText();

    Reference withSheetName(String sheetName);

    /**
     * Moves the non-fixed parts of the reference, as when a formula is copied to another cell.
     *
     * @return the moved reference, or null if it would leave the sheet
     */
    Reference offset(int rowOffset, int colOffset);

    /**
     * Adjusts the reference for rows or columns inserted at {@code index}.
     * Fixed and relative coordinates move alike.
     *
     * @return the adjusted reference, or null when every cell it covered was pushed off the sheet
     */
    Reference afterInsert(Axis axis, int index, int count);

    /**
     * Adjusts the reference for rows or columns removed at {@code index}.
     *
     * @return the adjusted reference, or null when every cell it covered was removed
     */
    Reference afterRemove(Axis axis, int index, int count);

    /**
     * Whether the reference points into {@code localSheet}: either it has no qualifier,
     * or its qualifier names the local sheet (case-insensitively).
     */
    default boolean isOnSheet(String localSheet) {
        return sheetName() == null || (localSheet != null && sheetName().equalsIgnoreCase(localSheet));
    }
}
