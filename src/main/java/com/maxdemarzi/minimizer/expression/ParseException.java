package com.maxdemarzi.minimizer.expression;

public class ParseException extends ExpressionException {

    public enum Reason {
        UNMATCHED_RIGHT_PAREN,
        UNCLOSED_PAREN
    }

    private final Reason reason;

    public ParseException(Reason reason) {
        super(reason == Reason.UNMATCHED_RIGHT_PAREN
                ? "Unbalanced parentheses: ')' without a matching '('"
                : "Unbalanced parentheses: '(' is never closed");
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
