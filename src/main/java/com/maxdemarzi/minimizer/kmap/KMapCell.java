package com.maxdemarzi.minimizer.kmap;

import java.util.Objects;

public class KMapCell {

    private final int row;
    private final int column;
    private final int minterm;

    public KMapCell(int row, int column, int minterm) {
        this.row = row;
        this.column = column;
        this.minterm = minterm;
    }

    public int getRow() {
        return row;
    }

    public int getColumn() {
        return column;
    }

    public int getMinterm() {
        return minterm;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof KMapCell)) return false;
        KMapCell cell = (KMapCell) o;
        return row == cell.row && column == cell.column && minterm == cell.minterm;
    }

    @Override
    public int hashCode() {
        return Objects.hash(row, column, minterm);
    }

    @Override
    public String toString() {
        return "(" + row + "," + column + ")=m" + minterm;
    }
}
