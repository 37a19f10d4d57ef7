package com.maxdemarzi.minimizer.quine;

import org.eclipse.collections.impl.factory.primitive.IntLists;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.roaringbitmap.RoaringBitmap;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class PrimeImplicantChartTest {

    private PrimeImplicantChart chart;

    @BeforeEach
    void setUp() {
        // 0-- and --1 over minterms 0,1,5,7
        Implicant low = new Implicant(0, 3).combine(new Implicant(1, 3))
                .combine(new Implicant(2, 3).combine(new Implicant(3, 3)));
        Implicant odd = new Implicant(1, 3).combine(new Implicant(3, 3))
                .combine(new Implicant(5, 3).combine(new Implicant(7, 3)));
        chart = new PrimeImplicantChart(Arrays.asList(low, odd), IntLists.immutable.of(0, 1, 5, 7));
    }

    @Test
    void shouldListCoverersInPrimeOrder() {
        assertEquals("0--", chart.getPrimes().get(0).getPattern());
        assertEquals(IntLists.immutable.of(0), chart.coverersOf(0));
        assertEquals(IntLists.immutable.of(0, 1), chart.coverersOf(1));
        assertEquals(IntLists.immutable.of(1), chart.coverersOf(7));
    }

    @Test
    void shouldHaveNoRowForUnlistedMinterm() {
        assertTrue(chart.coverersOf(2).isEmpty());
    }

    @Test
    void shouldReportRequiredCoverageOnly() {
        assertEquals(RoaringBitmap.bitmapOf(0, 1), chart.coverageOf(0));
        assertEquals(RoaringBitmap.bitmapOf(1, 5, 7), chart.coverageOf(1));
    }

    @Test
    void shouldHandOutCopiesOfCoverage() {
        chart.coverageOf(0).add(4);

        assertEquals(RoaringBitmap.bitmapOf(0, 1), chart.coverageOf(0));
    }

    @Test
    void shouldFindEssentialsAndCover() {
        assertEquals(IntLists.immutable.of(0, 1), chart.essentialImplicants());
        assertEquals(IntLists.immutable.of(0, 1), QuineMcCluskey.selectCover(chart));
    }
}
