package com.maxdemarzi.minimizer.kmap;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class KMapLayoutTest {

    @Test
    void shouldProduceGraySequences() {
        assertArrayEquals(new int[]{0}, GrayCode.sequence(0));
        assertArrayEquals(new int[]{0, 1}, GrayCode.sequence(1));
        assertArrayEquals(new int[]{0, 1, 3, 2}, GrayCode.sequence(2));
        assertThrows(IllegalArgumentException.class, () -> GrayCode.sequence(3));
    }

    @Test
    void shouldDetectBrokenGraySequence() {
        assertTrue(GrayCode.isCyclic(GrayCode.sequence(2)));
        assertFalse(GrayCode.isCyclic(new int[]{0, 1, 2, 3}));
    }

    @Test
    void shouldHaveNoLayoutOutsideOneToFourVariables() {
        assertThat(KMapLayout.of(0)).isEmpty();
        assertThat(KMapLayout.of(5)).isEmpty();
        assertThat(KMapLayout.forVariables(Arrays.asList("A", "B", "C", "D", "E"))).isEmpty();
    }

    @Test
    void shouldPlaceThreeVariableMinterms() {
        KMapLayout layout = KMapLayout.of(3).get();

        assertEquals(2, layout.rowCount());
        assertEquals(4, layout.columnCount());
        assertArrayEquals(new int[]{0, 1}, layout.getRows());
        assertEquals(7, layout.index(1, 2));
        assertEquals(2, layout.index(0, 3));
        assertEquals("A", layout.rowLabel());
        assertEquals("BC", layout.columnLabel());
    }

    @Test
    void shouldPlaceFourVariableMinterms() {
        KMapLayout layout = KMapLayout.of(4).get();

        assertArrayEquals(new int[]{0, 1, 3, 2}, layout.getRows());
        assertArrayEquals(new int[]{0, 1, 3, 2}, layout.getColumns());
        assertEquals(0, layout.index(0, 0));
        assertEquals(14, layout.index(2, 3));
        assertEquals(9, layout.index(3, 1));
        assertEquals("AB", layout.rowLabel());
        assertEquals("CD", layout.columnLabel());
    }

    @Test
    void shouldUseSingleColumnForOneVariable() {
        KMapLayout layout = KMapLayout.forVariables(Arrays.asList("X")).get();

        assertEquals(2, layout.rowCount());
        assertEquals(1, layout.columnCount());
        assertEquals(1, layout.index(1, 0));
        assertEquals("X", layout.rowLabel());
        assertEquals("—", layout.columnLabel());
        assertThat(layout.getColumnVariables()).isEmpty();
    }

    @Test
    void shouldRejectPositionsOffTheGrid() {
        KMapLayout layout = KMapLayout.of(2).get();

        assertThrows(IllegalArgumentException.class, () -> layout.index(2, 0));
        assertThrows(IllegalArgumentException.class, () -> layout.index(0, -1));
        assertThrows(IllegalArgumentException.class, () -> layout.position(4));
    }

    @Test
    void shouldMapEveryMintermToExactlyOneCell() {
        for (int n = 1; n <= KMapLayout.MAX_VARIABLES; n++) {
            KMapLayout layout = KMapLayout.of(n).get();
            List<KMapCell> cells = layout.cells();
            Set<Integer> seen = new HashSet<>();
            for (KMapCell cell : cells) {
                seen.add(cell.getMinterm());
                assertEquals(cell, layout.position(cell.getMinterm()));
            }
            assertEquals(1 << n, cells.size());
            assertEquals(1 << n, seen.size());
        }
    }

    @Test
    void shouldKeepNeighboursOneVariableApart() {
        for (int n = 1; n <= KMapLayout.MAX_VARIABLES; n++) {
            KMapLayout layout = KMapLayout.of(n).get();
            int rows = layout.rowCount();
            int columns = layout.columnCount();
            for (int r = 0; r < rows; r++) {
                for (int c = 0; c < columns; c++) {
                    int here = layout.index(r, c);
                    if (rows > 1) {
                        assertEquals(1, Integer.bitCount(here ^ layout.index((r + 1) % rows, c)),
                                "n=" + n + " below " + here);
                    }
                    if (columns > 1) {
                        assertEquals(1, Integer.bitCount(here ^ layout.index(r, (c + 1) % columns)),
                                "n=" + n + " right of " + here);
                    }
                }
            }
        }
    }
}
