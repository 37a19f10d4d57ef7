package com.maxdemarzi.minimizer.expression;

public class EvalException extends ExpressionException {

    public enum Kind {
        UNDEFINED_VARIABLE,
        INSUFFICIENT_OPERANDS,
        INVALID_EXPRESSION,
        UNKNOWN_OPERATOR
    }

    private final Kind kind;

    public EvalException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }
}
