package com.maxdemarzi.minimizer.expression;

public enum Associativity {
    LEFT,
    RIGHT
}
