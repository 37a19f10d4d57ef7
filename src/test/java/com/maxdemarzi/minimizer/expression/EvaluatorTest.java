package com.maxdemarzi.minimizer.expression;

import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class EvaluatorTest {

    private static Map<String, Boolean> env(String names, int... bits) {
        Map<String, Boolean> environment = new HashMap<>();
        for (int i = 0; i < names.length(); i++) {
            environment.put(String.valueOf(names.charAt(i)), bits[i] == 1);
        }
        return environment;
    }

    private static int eval(String expression, Map<String, Boolean> environment) throws Exception {
        return Evaluator.evaluateBit(PostfixExpression.compile(expression), environment);
    }

    @Test
    void shouldEvaluateImplicitConjunctionWithNegation() throws Exception {
        assertEquals(1, eval("AB'+C", env("ABC", 1, 0, 0)));
        assertEquals(0, eval("AB'+C", env("ABC", 1, 1, 0)));
    }

    @Test
    void shouldEvaluatePrefixNegationFirst() throws Exception {
        assertEquals(1, eval("!A & B | C", env("ABC", 0, 1, 0)));
        assertEquals(0, eval("!A & B | C", env("ABC", 1, 1, 0)));
    }

    @Test
    void shouldEvaluateXor() throws Exception {
        assertEquals(0, eval("A^B", env("AB", 1, 1)));
        assertEquals(1, eval("A^B", env("AB", 0, 1)));
        assertEquals(1, eval("A^B^C", env("ABC", 1, 1, 1)));
    }

    @Test
    void shouldEvaluateConstants() throws Exception {
        assertTrue(PostfixExpression.compile("1").evaluate(Collections.emptyMap()));
        assertFalse(PostfixExpression.compile("0").evaluate(Collections.emptyMap()));
        assertEquals(1, eval("0+1", Collections.emptyMap()));
        assertEquals(0, eval("10", Collections.emptyMap()));
    }

    @Test
    void shouldFailOnUndefinedVariable() {
        EvalException e = catchThrowableOfType(() -> eval("A+B", env("A", 1)), EvalException.class);
        assertEquals(EvalException.Kind.UNDEFINED_VARIABLE, e.getKind());
    }

    @Test
    void shouldFailOnMissingOperands() {
        EvalException binary = catchThrowableOfType(() -> eval("A+", env("A", 1)), EvalException.class);
        assertEquals(EvalException.Kind.INSUFFICIENT_OPERANDS, binary.getKind());

        EvalException unary = catchThrowableOfType(() -> eval("!", Collections.emptyMap()), EvalException.class);
        assertEquals(EvalException.Kind.INSUFFICIENT_OPERANDS, unary.getKind());
    }

    @Test
    void shouldFailWhenStackDoesNotReduceToOneValue() {
        EvalException empty = catchThrowableOfType(() -> eval("", Collections.emptyMap()), EvalException.class);
        assertEquals(EvalException.Kind.INVALID_EXPRESSION, empty.getKind());

        PostfixExpression twoValues = new PostfixExpression(java.util.Arrays.asList(Token.variable('A'), Token.variable('B')));
        EvalException leftover = catchThrowableOfType(() -> Evaluator.evaluate(twoValues, env("AB", 1, 1)), EvalException.class);
        assertEquals(EvalException.Kind.INVALID_EXPRESSION, leftover.getKind());
    }

    @Test
    void shouldRejectParensInPostfix() {
        PostfixExpression withParen = new PostfixExpression(Collections.singletonList(Token.leftParen()));
        EvalException e = catchThrowableOfType(() -> Evaluator.evaluate(withParen, Collections.emptyMap()), EvalException.class);
        assertEquals(EvalException.Kind.INVALID_EXPRESSION, e.getKind());
    }
}
