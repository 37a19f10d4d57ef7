package com.maxdemarzi.minimizer.results;

import java.util.List;

public class ValidationResult {
    public final Boolean valid;
    public final Long tokens;
    public final List<String> variables;
    public final String postfix;
    public final String error;

    public ValidationResult(Boolean valid, Long tokens, List<String> variables, String postfix, String error) {
        this.valid = valid;
        this.tokens = tokens;
        this.variables = variables;
        this.postfix = postfix;
        this.error = error;
    }
}
