package com.maxdemarzi.minimizer.results;

public class KMapCellResult {
    public final Long row;
    public final Long column;
    public final Long minterm;
    public final String rowLabel;
    public final String columnLabel;

    public KMapCellResult(Long row, Long column, Long minterm, String rowLabel, String columnLabel) {
        this.row = row;
        this.column = column;
        this.minterm = minterm;
        this.rowLabel = rowLabel;
        this.columnLabel = columnLabel;
    }
}
