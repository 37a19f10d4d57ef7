package com.maxdemarzi.minimizer.expression;

/**
 * Boolean operators in increasing binding strength: OR < XOR < AND < NOT.
 */
public enum Operator {
    OR(1, Associativity.LEFT),
    XOR(2, Associativity.LEFT),
    AND(3, Associativity.LEFT),
    NOT(4, Associativity.RIGHT);

    private final int precedence;
    private final Associativity associativity;

    Operator(int precedence, Associativity associativity) {
        this.precedence = precedence;
        this.associativity = associativity;
    }

    public int getPrecedence() {
        return precedence;
    }

    public Associativity getAssociativity() {
        return associativity;
    }

    public boolean isUnary() {
        return this == NOT;
    }
}
