package com.maxdemarzi.minimizer.kmap;

public enum CellState {
    ZERO("0"),
    ONE("1"),
    DONT_CARE("d");

    private final String symbol;

    CellState(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    // 0 -> 1 -> d -> 0
    public CellState next() {
        switch (this) {
            case ZERO:
                return ONE;
            case ONE:
                return DONT_CARE;
            default:
                return ZERO;
        }
    }
}
