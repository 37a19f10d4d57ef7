package com.maxdemarzi.minimizer.quine;

import org.apache.commons.lang3.Validate;
import org.eclipse.collections.api.IntIterable;
import org.eclipse.collections.api.list.primitive.IntList;
import org.eclipse.collections.api.list.primitive.MutableIntList;
import org.eclipse.collections.api.set.primitive.MutableIntSet;
import org.eclipse.collections.impl.factory.primitive.IntLists;
import org.eclipse.collections.impl.factory.primitive.IntSets;
import org.roaringbitmap.RoaringBitmap;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Two-level minimization: prime implicant generation by repeated merging of
 * cubes that differ in one position, then essential implicants, then a
 * greedy cover of whatever is left.
 * <p>
 * The greedy step takes the implicant covering the most uncovered minterms
 * and settles ties on the lowest prime index, so results are reproducible
 * but not always of minimum size. Work grows as O(3^n n^2) in the number of
 * variables and nothing here bounds n.
 */
public final class QuineMcCluskey {

    private QuineMcCluskey() {
    }

    public static Minimization minimize(IntIterable minterms, IntIterable dontcares, List<String> variables, Mode mode) {
        Validate.notNull(minterms, "minterms");
        Validate.notNull(dontcares, "dontcares");
        Validate.notNull(variables, "variables");
        Validate.notNull(mode, "mode");

        IntList required = IntLists.immutable.with(minterms.toSortedArray()).distinct();
        MutableIntSet requiredSet = IntSets.mutable.withAll(required);
        IntList optional = IntLists.immutable.with(dontcares.toSortedArray()).distinct()
                .reject(requiredSet::contains);

        if (required.isEmpty() && optional.isEmpty()) {
            return Minimization.constant(mode, mode.emptyText());
        }

        int numVars = variables.size();
        List<Implicant> primes = primeImplicants(required, optional, numVars);
        PrimeImplicantChart chart = new PrimeImplicantChart(primes, required);
        IntList chosen = selectCover(chart);

        List<Implicant> implicants = new ArrayList<>(chosen.size());
        chosen.forEach(index -> implicants.add(primes.get(index)));
        return new Minimization(mode, primes, implicants, mode.render(implicants, variables));
    }

    /**
     * Merges cubes level by level until nothing combines. The result keeps
     * the order in which each pattern was first found to be prime.
     */
    public static List<Implicant> primeImplicants(IntList minterms, IntList dontcares, int numVars) {
        List<List<Implicant>> initial = emptyGroups(numVars);
        minterms.forEach(minterm -> add(initial, new Implicant(minterm, numVars)));
        dontcares.forEach(dontcare -> add(initial, new Implicant(dontcare, numVars)));

        List<List<Implicant>> groups = initial;
        Map<String, Implicant> primes = new LinkedHashMap<>();
        boolean combined = true;
        while (combined) {
            combined = false;
            List<List<Implicant>> next = emptyGroups(numVars);
            Set<Implicant> seen = new HashSet<>();
            Set<Implicant> used = new HashSet<>();

            for (int k = 0; k < numVars; k++) {
                for (Implicant a : groups.get(k)) {
                    for (Implicant b : groups.get(k + 1)) {
                        if (a.canCombine(b)) {
                            Implicant merged = a.combine(b);
                            if (seen.add(merged)) {
                                add(next, merged);
                            }
                            used.add(a);
                            used.add(b);
                            combined = true;
                        }
                    }
                }
            }

            for (List<Implicant> group : groups) {
                for (Implicant implicant : group) {
                    if (!used.contains(implicant)) {
                        primes.putIfAbsent(implicant.getPattern(), implicant);
                    }
                }
            }
            groups = next;
        }

        // whatever is still grouped after the last pass is prime as well
        for (List<Implicant> group : groups) {
            for (Implicant implicant : group) {
                primes.putIfAbsent(implicant.getPattern(), implicant);
            }
        }
        return new ArrayList<>(primes.values());
    }

    /**
     * Essential implicants first, then greedy picks, as indices into the
     * chart's prime list in the order they were chosen.
     */
    public static IntList selectCover(PrimeImplicantChart chart) {
        IntList minterms = chart.getMinterms();
        int primeCount = chart.getPrimes().size();

        MutableIntList chosen = IntLists.mutable.withAll(chart.essentialImplicants());
        RoaringBitmap covered = new RoaringBitmap();
        chosen.forEach(index -> covered.or(chart.coverageView(index)));

        while (covered.getCardinality() < minterms.size()) {
            int best = -1;
            int bestCount = 0;
            for (int j = 0; j < primeCount; j++) {
                if (chosen.contains(j)) {
                    continue;
                }
                int count = chart.uncoveredCount(j, covered);
                if (count > bestCount) {
                    best = j;
                    bestCount = count;
                }
            }
            if (best == -1) {
                break;
            }
            chosen.add(best);
            covered.or(chart.coverageView(best));
        }
        return chosen.toImmutable();
    }

    private static List<List<Implicant>> emptyGroups(int numVars) {
        List<List<Implicant>> groups = new ArrayList<>(numVars + 1);
        for (int k = 0; k <= numVars; k++) {
            groups.add(new ArrayList<>());
        }
        return groups;
    }

    private static void add(List<List<Implicant>> groups, Implicant implicant) {
        groups.get(implicant.ones()).add(implicant);
    }
}
