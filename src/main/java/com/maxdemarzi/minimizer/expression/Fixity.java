package com.maxdemarzi.minimizer.expression;

public enum Fixity {
    PREFIX,
    POSTFIX,
    INFIX
}
