package com.maxdemarzi.minimizer.quine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

public class Minimization {

    private final Mode mode;
    private final List<Implicant> primeImplicants;
    private final List<Implicant> implicants;
    private final String expression;

    public Minimization(Mode mode, List<Implicant> primeImplicants, List<Implicant> implicants, String expression) {
        this.mode = mode;
        this.primeImplicants = Collections.unmodifiableList(new ArrayList<>(primeImplicants));
        this.implicants = Collections.unmodifiableList(new ArrayList<>(implicants));
        this.expression = expression;
    }

    public static Minimization constant(Mode mode, String expression) {
        return new Minimization(mode, Collections.emptyList(), Collections.emptyList(), expression);
    }

    public Mode getMode() {
        return mode;
    }

    public List<Implicant> getPrimeImplicants() {
        return primeImplicants;
    }

    /**
     * The chosen cover: essential implicants first, then greedy picks.
     */
    public List<Implicant> getImplicants() {
        return implicants;
    }

    public List<String> getPatterns() {
        return implicants.stream().map(Implicant::getPattern).collect(Collectors.toList());
    }

    public String getExpression() {
        return expression;
    }

    @Override
    public String toString() {
        return expression;
    }
}
