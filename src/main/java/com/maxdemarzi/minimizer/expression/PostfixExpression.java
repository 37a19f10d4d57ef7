package com.maxdemarzi.minimizer.expression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Tokens in postfix (RPN) order, as produced by {@link Parser}.
 */
public final class PostfixExpression implements Iterable<Token> {

    private final List<Token> tokens;

    public PostfixExpression(List<Token> tokens) {
        this.tokens = Collections.unmodifiableList(new ArrayList<>(tokens));
    }

    public static PostfixExpression compile(String expression) throws LexException, ParseException {
        return Parser.parse(expression);
    }

    public List<Token> getTokens() {
        return tokens;
    }

    public int size() {
        return tokens.size();
    }

    public Set<String> variables() {
        Set<String> names = new TreeSet<>();
        for (Token token : tokens) {
            if (token.getType() == TokenType.VARIABLE) {
                names.add(token.getVariable());
            }
        }
        return names;
    }

    public boolean evaluate(Map<String, Boolean> environment) throws EvalException {
        return Evaluator.evaluate(this, environment);
    }

    @Override
    public Iterator<Token> iterator() {
        return tokens.iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PostfixExpression)) return false;
        return tokens.equals(((PostfixExpression) o).tokens);
    }

    @Override
    public int hashCode() {
        return tokens.hashCode();
    }

    @Override
    public String toString() {
        return tokens.stream().map(Token::toString).collect(Collectors.joining(" "));
    }
}
