package com.maxdemarzi.minimizer.expression;

/**
 * Base type for everything that can go wrong turning text into a value.
 */
public abstract class ExpressionException extends Exception {

    protected ExpressionException(String message) {
        super(message);
    }
}
