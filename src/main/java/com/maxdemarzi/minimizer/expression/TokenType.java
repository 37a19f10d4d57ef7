package com.maxdemarzi.minimizer.expression;

public enum TokenType {
    NUMBER,
    VARIABLE,
    OPERATOR,
    LEFT_PAREN,
    RIGHT_PAREN
}
