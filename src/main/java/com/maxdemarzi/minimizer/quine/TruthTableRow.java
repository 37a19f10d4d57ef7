package com.maxdemarzi.minimizer.quine;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public class TruthTableRow {

    private final int minterm;
    private final Map<String, Boolean> assignment;
    private final boolean output;

    public TruthTableRow(int minterm, Map<String, Boolean> assignment, boolean output) {
        this.minterm = minterm;
        this.assignment = Collections.unmodifiableMap(new LinkedHashMap<>(assignment));
        this.output = output;
    }

    public int getMinterm() {
        return minterm;
    }

    /**
     * Variable values in variable order.
     */
    public Map<String, Boolean> getAssignment() {
        return assignment;
    }

    public boolean isTrue() {
        return output;
    }

    public int getOutput() {
        return output ? 1 : 0;
    }

    @Override
    public String toString() {
        StringBuilder row = new StringBuilder();
        for (Boolean value : assignment.values()) {
            row.append(value ? '1' : '0');
        }
        return row.append(" | ").append(getOutput()).append(" (m").append(minterm).append(')').toString();
    }
}
