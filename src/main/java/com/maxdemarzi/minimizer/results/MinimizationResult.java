package com.maxdemarzi.minimizer.results;

import java.util.List;

public class MinimizationResult {
    public final List<String> variables;
    public final List<Long> minterms;
    public final List<Long> dontcares;
    public final List<String> implicants;
    public final String expression;

    public MinimizationResult(List<String> variables, List<Long> minterms, List<Long> dontcares,
                              List<String> implicants, String expression) {
        this.variables = variables;
        this.minterms = minterms;
        this.dontcares = dontcares;
        this.implicants = implicants;
        this.expression = expression;
    }
}
