package com.maxdemarzi.minimizer.kmap;

import org.apache.commons.lang3.Validate;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Grid placement of minterms for a Karnaugh map of one to four variables.
 * Rows and columns follow Gray order, so cells that touch (wrapping around
 * the edges) hold minterms that differ in exactly one variable.
 * <p>
 * With one variable the grid is a single column and there are no column
 * variables.
 */
public class KMapLayout {

    public static final int MAX_VARIABLES = 4;

    private static final List<String> DEFAULT_NAMES = Arrays.asList("A", "B", "C", "D");

    private final int numVars;
    private final int[] rows;
    private final int[] columns;
    private final List<String> rowVariables;
    private final List<String> columnVariables;

    private KMapLayout(int numVars, int[] rows, int[] columns, List<String> rowVariables, List<String> columnVariables) {
        this.numVars = numVars;
        this.rows = rows;
        this.columns = columns;
        this.rowVariables = Collections.unmodifiableList(new ArrayList<>(rowVariables));
        this.columnVariables = Collections.unmodifiableList(new ArrayList<>(columnVariables));
    }

    /**
     * Layout for {@code n} variables named A, B, C, D; empty when {@code n}
     * is outside 1..4.
     */
    public static Optional<KMapLayout> of(int n) {
        if (n < 1 || n > MAX_VARIABLES) {
            return Optional.empty();
        }
        return forVariables(DEFAULT_NAMES.subList(0, n));
    }

    public static Optional<KMapLayout> forVariables(List<String> variables) {
        Validate.notNull(variables, "variables");
        int n = variables.size();
        switch (n) {
            case 1:
                return Optional.of(new KMapLayout(n, GrayCode.sequence(1), GrayCode.sequence(0),
                        variables, Collections.emptyList()));
            case 2:
                return Optional.of(new KMapLayout(n, GrayCode.sequence(1), GrayCode.sequence(1),
                        variables.subList(0, 1), variables.subList(1, 2)));
            case 3:
                return Optional.of(new KMapLayout(n, GrayCode.sequence(1), GrayCode.sequence(2),
                        variables.subList(0, 1), variables.subList(1, 3)));
            case 4:
                return Optional.of(new KMapLayout(n, GrayCode.sequence(2), GrayCode.sequence(2),
                        variables.subList(0, 2), variables.subList(2, 4)));
            default:
                return Optional.empty();
        }
    }

    /**
     * The minterm shown at a grid position.
     */
    public int index(int row, int column) {
        Validate.inclusiveBetween(0, rows.length - 1, row, "Row %d outside a %d-row map", row, rows.length);
        Validate.inclusiveBetween(0, columns.length - 1, column,
                "Column %d outside a %d-column map", column, columns.length);

        switch (numVars) {
            case 1:
                return rows[row];
            case 2:
                return (rows[row] << 1) | columns[column];
            case 3: {
                int a = rows[row];
                int b = (columns[column] >> 1) & 1;
                int c = columns[column] & 1;
                return (a << 2) | (b << 1) | c;
            }
            default: {
                int a = (rows[row] >> 1) & 1;
                int b = rows[row] & 1;
                int c = (columns[column] >> 1) & 1;
                int d = columns[column] & 1;
                return (a << 3) | (b << 2) | (c << 1) | d;
            }
        }
    }

    /**
     * Grid position of a minterm, the inverse of {@link #index(int, int)}.
     */
    public KMapCell position(int minterm) {
        Validate.inclusiveBetween(0, size() - 1, minterm, "Minterm %d outside a %d-cell map", minterm, size());
        for (int r = 0; r < rows.length; r++) {
            for (int c = 0; c < columns.length; c++) {
                if (index(r, c) == minterm) {
                    return new KMapCell(r, c, minterm);
                }
            }
        }
        throw new IllegalStateException("Minterm " + minterm + " missing from layout");
    }

    /**
     * Every cell, row by row.
     */
    public List<KMapCell> cells() {
        List<KMapCell> cells = new ArrayList<>(size());
        for (int r = 0; r < rows.length; r++) {
            for (int c = 0; c < columns.length; c++) {
                cells.add(new KMapCell(r, c, index(r, c)));
            }
        }
        return cells;
    }

    public int getNumVars() {
        return numVars;
    }

    public int[] getRows() {
        return rows.clone();
    }

    public int[] getColumns() {
        return columns.clone();
    }

    public int rowCount() {
        return rows.length;
    }

    public int columnCount() {
        return columns.length;
    }

    public int size() {
        return rows.length * columns.length;
    }

    public List<String> getRowVariables() {
        return rowVariables;
    }

    public List<String> getColumnVariables() {
        return columnVariables;
    }

    public String rowLabel() {
        return label(rowVariables);
    }

    public String columnLabel() {
        return label(columnVariables);
    }

    private static String label(List<String> variables) {
        return variables.isEmpty() ? "—" : String.join("", variables);
    }
}
