package com.maxdemarzi.minimizer.results;

import java.util.Map;

public class TruthTableRowResult {
    public final Long minterm;
    public final Map<String, Object> assignment;
    public final Long output;

    public TruthTableRowResult(Long minterm, Map<String, Object> assignment, Long output) {
        this.minterm = minterm;
        this.assignment = assignment;
        this.output = output;
    }
}
