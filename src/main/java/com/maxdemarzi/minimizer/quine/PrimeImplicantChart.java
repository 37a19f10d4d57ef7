package com.maxdemarzi.minimizer.quine;

import org.eclipse.collections.api.list.primitive.IntList;
import org.eclipse.collections.api.list.primitive.MutableIntList;
import org.eclipse.collections.api.map.primitive.MutableIntObjectMap;
import org.eclipse.collections.impl.factory.primitive.IntLists;
import org.eclipse.collections.impl.factory.primitive.IntObjectMaps;
import org.roaringbitmap.RoaringBitmap;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Which prime implicants cover which required minterms. Don't-cares never
 * appear as rows.
 */
public class PrimeImplicantChart {

    private final List<Implicant> primes;
    private final IntList minterms;
    private final MutableIntObjectMap<MutableIntList> coverers = IntObjectMaps.mutable.empty();
    private final List<RoaringBitmap> coverage;

    public PrimeImplicantChart(List<Implicant> primes, IntList minterms) {
        this.primes = Collections.unmodifiableList(new ArrayList<>(primes));
        this.minterms = minterms.toImmutable();
        this.coverage = new ArrayList<>(primes.size());

        for (int j = 0; j < primes.size(); j++) {
            coverage.add(new RoaringBitmap());
        }
        minterms.forEach(minterm -> {
            MutableIntList row = IntLists.mutable.empty();
            for (int j = 0; j < this.primes.size(); j++) {
                if (this.primes.get(j).covers(minterm)) {
                    row.add(j);
                    coverage.get(j).add(minterm);
                }
            }
            coverers.put(minterm, row);
        });
    }

    public List<Implicant> getPrimes() {
        return primes;
    }

    public IntList getMinterms() {
        return minterms;
    }

    /**
     * Indices of the prime implicants covering a minterm, in prime order.
     */
    public IntList coverersOf(int minterm) {
        MutableIntList row = coverers.get(minterm);
        return row == null ? IntLists.immutable.empty() : row.toImmutable();
    }

    /**
     * Required minterms covered by the prime implicant at {@code index}.
     */
    public RoaringBitmap coverageOf(int index) {
        return coverage.get(index).clone();
    }

    /**
     * Prime implicants that are the only cover of some minterm, in the order
     * those minterms are listed, each index at most once.
     */
    public IntList essentialImplicants() {
        MutableIntList essentials = IntLists.mutable.empty();
        minterms.forEach(minterm -> {
            MutableIntList row = coverers.get(minterm);
            if (row.size() == 1 && !essentials.contains(row.get(0))) {
                essentials.add(row.get(0));
            }
        });
        return essentials.toImmutable();
    }

    int uncoveredCount(int index, RoaringBitmap covered) {
        return RoaringBitmap.andNotCardinality(coverage.get(index), covered);
    }

    RoaringBitmap coverageView(int index) {
        return coverage.get(index);
    }
}
