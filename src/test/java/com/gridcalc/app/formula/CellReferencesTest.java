package com.gridcalc.app.formula;

import com.gridcalc.app.models.CellCoordinate;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CellReferencesTest {

    @Test
    void testColumnLabels() {
        assertEquals("A", CellReferences.columnLabel(0));
        assertEquals("B", CellReferences.columnLabel(1));
        assertEquals("Z", CellReferences.columnLabel(25));
        assertEquals("AA", CellReferences.columnLabel(26));
        assertEquals("ZZ", CellReferences.columnLabel(701));
        assertEquals("AAA", CellReferences.columnLabel(702));
        assertEquals("AAB", CellReferences.columnLabel(703));
    }

    @Test
    void testColumnLabelIsBijective() {
        for (int i = 0; i < 20000; i++) {
            assertEquals(i, CellReferences.columnIndex(CellReferences.columnLabel(i)), "index " + i);
        }
    }

    @Test
    void testColumnIndexRejectsGarbage() {
        assertEquals(-1, CellReferences.columnIndex(""));
        assertEquals(-1, CellReferences.columnIndex("a"));
        assertEquals(-1, CellReferences.columnIndex("A1"));
        assertThrows(IllegalArgumentException.class, () -> CellReferences.columnLabel(-1));
    }

    @Test
    void testIdentifierToCoordinates() {
        assertEquals(new CellCoordinate(0, 0), CellReferences.toCoordinate("A1").orElseThrow());
        assertEquals(new CellCoordinate(4, 1), CellReferences.toCoordinate("B5").orElseThrow());
        assertEquals(new CellCoordinate(98, 25), CellReferences.toCoordinate("Z99").orElseThrow());
    }

    @Test
    void testCoordinatesToIdentifier() {
        assertEquals("A1", CellReferences.toIdentifier(0, 0));
        assertEquals("B5", CellReferences.toIdentifier(4, 1));
        assertEquals("Z99", CellReferences.toIdentifier(98, 25));
        assertEquals("AA3", CellReferences.toIdentifier(2, 26));
    }

    @Test
    void testIdentifierRoundTrip() {
        for (String id : new String[]{"A1", "C12", "M7", "Z1000"}) {
            CellCoordinate at = CellReferences.toCoordinate(id).orElseThrow();
            assertEquals(id, CellReferences.toIdentifier(at));
        }
    }

    @Test
    void testInvalidIdentifiers() {
        assertTrue(CellReferences.toCoordinate("A").isEmpty());
        assertTrue(CellReferences.toCoordinate("1A").isEmpty());
        assertTrue(CellReferences.toCoordinate("a1").isEmpty());
        assertTrue(CellReferences.toCoordinate("A0").isEmpty());
        assertTrue(CellReferences.toCoordinate("A-1").isEmpty());
        assertTrue(CellReferences.toCoordinate("A1x").isEmpty());
        assertTrue(CellReferences.toCoordinate("A99999999999").isEmpty());
        assertTrue(CellReferences.toCoordinate(null).isEmpty());
    }

    /**
     * Only a single leading column letter is decoded.
     */
    @Test
    void testMultiLetterColumnsAreNotDecoded() {
        assertTrue(CellReferences.toCoordinate("AA1").isEmpty());
    }
}
