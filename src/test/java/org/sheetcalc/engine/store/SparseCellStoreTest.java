package org.sheetcalc.engine.store;

import org.sheetcalc.engine.value.CellValue;
import org.sheetcalc.formula.reference.Axis;
import org.sheetcalc.formula.reference.RangeText;
import org.sheetcalc.formula.reference.Region;
import org.junit.jupiter.api.*;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Sparse Cell Store Tests")
class SparseCellStoreTest {

    private SparseCellStore store;
    private List<CellsChangedEvent> events;

    @BeforeEach
    void setUp() {
        store = new SparseCellStore("Sheet1");
        events = new ArrayList<>();
        store.addCellsChangedListener(events::add);
    }

    // ==================== Reads and writes ====================

    @Test
    @DisplayName("Unwritten cells are empty")
    void testEmpty() {
        assertEquals(CellValue.EMPTY, store.get(5, 5));
        assertNull(store.usedRegion());
        assertEquals("Sheet1", store.sheetName());
    }

    @Test
    @DisplayName("Writing a value notifies listeners with the cell")
    void testSet() {
        store.set(2, 3, CellValue.number(7));

        assertEquals(CellValue.number(7), store.get(2, 3));
        assertEquals(1, events.size());
        assertEquals("Sheet1", events.get(0).sheetName());
        assertEquals(List.of(Region.cell(2, 3)), events.get(0).regions());
    }

    @Test
    @DisplayName("Writing EMPTY removes the cell")
    void testSetEmpty() {
        store.set(0, 0, CellValue.text("a"));

        store.set(0, 0, CellValue.EMPTY);

        assertNull(store.usedRegion());
        assertTrue(store.getNonEmpty(Region.rows(0, 10)).isEmpty());
    }

    @Test
    @DisplayName("Null values are rejected")
    void testSetNull() {
        assertThrows(NullPointerException.class, () -> store.set(0, 0, null));
    }

    @Test
    @DisplayName("Range reads fill gaps with EMPTY and non-empty reads are sorted")
    void testRangeReads() {
        store.set(1, 1, CellValue.number(4));
        store.set(0, 0, CellValue.number(1));
        store.set(0, 1, CellValue.number(2));

        CellValue[][] values = store.getRange(new Region(0, 0, 1, 1));
        assertEquals(CellValue.number(1), values[0][0]);
        assertEquals(CellValue.EMPTY, values[1][0]);
        assertEquals(CellValue.number(4), values[1][1]);

        List<StoredCell> cells = store.getNonEmpty(new Region(0, 0, 1, 1));
        assertEquals(List.of(
                new StoredCell(0, 0, CellValue.number(1)),
                new StoredCell(0, 1, CellValue.number(2)),
                new StoredCell(1, 1, CellValue.number(4))), cells);
        assertEquals(new Region(0, 0, 1, 1), store.usedRegion());
    }

    @Test
    @DisplayName("Clearing a region empties it and reports the region")
    void testClear() {
        store.set(0, 0, CellValue.number(1));
        store.set(5, 5, CellValue.number(2));
        events.clear();

        CellStoreRestoreData data = store.clear(new Region(0, 0, 2, 2));

        assertEquals(CellValue.EMPTY, store.get(0, 0));
        assertEquals(CellValue.number(2), store.get(5, 5));
        assertEquals(List.of(new Region(0, 0, 2, 2)), events.get(0).regions());

        store.restore(data);
        assertEquals(CellValue.number(1), store.get(0, 0));
    }

    @Test
    @DisplayName("Copying values to another place")
    void testCopy() {
        store.set(0, 0, CellValue.number(1));
        store.set(1, 0, CellValue.text("b"));

        store.copy(new Region(0, 0, 1, 0), 4, 2);

        assertEquals(CellValue.number(1), store.get(4, 2));
        assertEquals(CellValue.text("b"), store.get(5, 2));
        assertThrows(IllegalArgumentException.class,
                () -> store.copy(new Region(0, 0, 1, 0), RangeText.MAX_ROWS - 1, 0));
    }

    // ==================== Structural edits ====================

    @Nested
    @DisplayName("Structural edits")
    class StructuralEdits {

        @BeforeEach
        void fill() {
            // A1=1, A2=2, A3=3, C2=20
            store.set(0, 0, CellValue.number(1));
            store.set(1, 0, CellValue.number(2));
            store.set(2, 0, CellValue.number(3));
            store.set(1, 2, CellValue.number(20));
            events.clear();
        }

        @Test
        @DisplayName("Inserting rows moves cells down without events")
        void testInsertRows() {
            store.insertRowCol(Axis.ROW, 1, 2);

            assertEquals(CellValue.number(1), store.get(0, 0));
            assertEquals(CellValue.EMPTY, store.get(1, 0));
            assertEquals(CellValue.number(2), store.get(3, 0));
            assertEquals(CellValue.number(3), store.get(4, 0));
            assertEquals(CellValue.number(20), store.get(3, 2));
            assertTrue(events.isEmpty());
        }

        @Test
        @DisplayName("Removing columns drops their cells and moves the rest left")
        void testRemoveColumns() {
            store.removeRowCol(Axis.COLUMN, 0, 1);

            assertEquals(CellValue.number(20), store.get(1, 1));
            assertEquals(new Region(1, 1, 1, 1), store.usedRegion());
        }

        @Test
        @DisplayName("Restoring an insert moves the cells back")
        void testRestoreInsert() {
            CellStoreRestoreData data = store.insertRowCol(Axis.ROW, 0, 3);

            store.restore(data);

            assertEquals(CellValue.number(1), store.get(0, 0));
            assertEquals(CellValue.number(3), store.get(2, 0));
            assertEquals(new Region(0, 0, 2, 2), store.usedRegion());
        }

        @Test
        @DisplayName("Restoring a removal brings back the removed cells")
        void testRestoreRemove() {
            CellStoreRestoreData data = store.removeRowCol(Axis.ROW, 1, 1);
            assertEquals(CellValue.number(3), store.get(1, 0));

            store.restore(data);

            assertEquals(CellValue.number(2), store.get(1, 0));
            assertEquals(CellValue.number(3), store.get(2, 0));
            assertEquals(CellValue.number(20), store.get(1, 2));
            assertEquals(1, events.size());
        }

        @Test
        @DisplayName("Cells pushed off the sheet are dropped and restored")
        void testInsertPushesOffSheet() {
            store.set(RangeText.MAX_ROWS - 1, 0, CellValue.text("last"));

            CellStoreRestoreData data = store.insertRowCol(Axis.ROW, 0, 1);
            assertEquals(CellValue.EMPTY, store.get(RangeText.MAX_ROWS - 1, 0));

            store.restore(data);
            assertEquals(CellValue.text("last"), store.get(RangeText.MAX_ROWS - 1, 0));
        }

        @Test
        @DisplayName("Invalid edits are rejected")
        void testInvalidEdits() {
            assertThrows(IllegalArgumentException.class, () -> store.insertRowCol(Axis.ROW, -1, 1));
            assertThrows(IllegalArgumentException.class, () -> store.removeRowCol(Axis.ROW, 0, 0));
        }
    }

    @Test
    @DisplayName("Restoring merged writes undoes them newest first")
    void testRestoreMerged() {
        CellStoreRestoreData data = store.set(0, 0, CellValue.number(1));
        data.merge(store.set(0, 0, CellValue.number(2)));
        events.clear();

        store.restore(data);

        assertEquals(CellValue.EMPTY, store.get(0, 0));
        assertEquals(1, events.size());
        assertEquals(2, events.get(0).regions().size());
    }

    @Test
    @DisplayName("Removed listeners are not notified")
    void testRemoveListener() {
        CellsChangedListener listener = events::add;
        store.addCellsChangedListener(listener);
        store.removeCellsChangedListener(listener);

        store.set(0, 0, CellValue.number(1));

        assertEquals(1, events.size());
    }
}
