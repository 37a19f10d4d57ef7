package com.maxdemarzi.minimizer.quine;

import com.maxdemarzi.minimizer.expression.EvalException;
import com.maxdemarzi.minimizer.expression.LexException;
import com.maxdemarzi.minimizer.expression.ParseException;
import com.maxdemarzi.minimizer.expression.PostfixExpression;
import com.maxdemarzi.minimizer.expression.Variables;
import org.apache.commons.lang3.Validate;
import org.eclipse.collections.api.list.primitive.IntList;
import org.eclipse.collections.api.list.primitive.MutableIntList;
import org.eclipse.collections.impl.factory.primitive.IntLists;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Every assignment of the variables, in minterm order. Row {@code m} gives
 * the i-th variable the value of bit (n-1-i) of {@code m}, so the first
 * variable is the most significant.
 */
public class TruthTable {

    public static final int MAX_VARIABLES = 8;

    private final List<String> variables;
    private final PostfixExpression expression;
    private final int numRows;
    private final List<TruthTableRow> rows;

    public TruthTable(List<String> variables, PostfixExpression expression) {
        Validate.notNull(variables, "variables");
        Validate.isTrue(variables.size() <= MAX_VARIABLES,
                "Truth tables are limited to %d variables, got %d", MAX_VARIABLES, variables.size());
        Validate.isTrue(new HashSet<>(variables).size() == variables.size(), "Duplicate variables in %s", variables);
        this.variables = Collections.unmodifiableList(new ArrayList<>(variables));
        this.expression = expression;
        this.numRows = 1 << variables.size();
        this.rows = new ArrayList<>(numRows);
    }

    /**
     * Builds the full table. Without an expression every output is 0.
     */
    public static TruthTable build(List<String> variables, PostfixExpression expression) throws EvalException {
        TruthTable table = new TruthTable(variables, expression);
        table.compute();
        return table;
    }

    public static TruthTable of(String expression) throws LexException, ParseException, EvalException {
        return build(Variables.extract(expression), PostfixExpression.compile(expression));
    }

    public void compute() throws EvalException {
        rows.clear();
        int n = variables.size();
        for (int m = 0; m < numRows; m++) {
            Map<String, Boolean> environment = new LinkedHashMap<>();
            for (int i = 0; i < n; i++) {
                environment.put(variables.get(i), ((m >> (n - 1 - i)) & 1) == 1);
            }
            boolean output = expression != null && expression.evaluate(environment);
            rows.add(new TruthTableRow(m, environment, output));
        }
    }

    public List<TruthTableRow> getRows() {
        return Collections.unmodifiableList(rows);
    }

    public IntList minTerms() {
        MutableIntList terms = IntLists.mutable.empty();
        for (TruthTableRow row : rows) {
            if (row.isTrue()) {
                terms.add(row.getMinterm());
            }
        }
        return terms.toImmutable();
    }

    public IntList maxTerms() {
        MutableIntList terms = IntLists.mutable.empty();
        for (TruthTableRow row : rows) {
            if (!row.isTrue()) {
                terms.add(row.getMinterm());
            }
        }
        return terms.toImmutable();
    }

    public List<String> variables() {
        return variables;
    }

    public int size() {
        return numRows;
    }
}
