package com.maxdemarzi.minimizer.expression;

import org.apache.commons.lang3.Validate;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;

public final class Evaluator {

    private Evaluator() {
    }

    /**
     * Runs the postfix tokens on a boolean stack. Binary operators pop their
     * right operand first so that {@code a op b} keeps source order.
     */
    public static boolean evaluate(PostfixExpression expression, Map<String, Boolean> environment) throws EvalException {
        Validate.notNull(expression, "expression");
        Validate.notNull(environment, "environment");
        Deque<Boolean> stack = new ArrayDeque<>();

        for (Token token : expression) {
            switch (token.getType()) {
                case NUMBER:
                    stack.push(token.getBit());
                    break;
                case VARIABLE:
                    Boolean value = environment.get(token.getVariable());
                    if (value == null) {
                        throw new EvalException(EvalException.Kind.UNDEFINED_VARIABLE,
                                "Variable " + token.getVariable() + " is not defined");
                    }
                    stack.push(value);
                    break;
                case OPERATOR:
                    apply(token.getOperator(), stack);
                    break;
                default:
                    throw new EvalException(EvalException.Kind.INVALID_EXPRESSION,
                            "Unexpected " + token + " in postfix expression");
            }
        }

        if (stack.size() != 1) {
            throw new EvalException(EvalException.Kind.INVALID_EXPRESSION,
                    "Expression leaves " + stack.size() + " values instead of 1");
        }
        return stack.pop();
    }

    public static int evaluateBit(PostfixExpression expression, Map<String, Boolean> environment) throws EvalException {
        return evaluate(expression, environment) ? 1 : 0;
    }

    private static void apply(Operator operator, Deque<Boolean> stack) throws EvalException {
        if (operator == Operator.NOT) {
            if (stack.isEmpty()) {
                throw new EvalException(EvalException.Kind.INSUFFICIENT_OPERANDS, "NOT needs 1 operand");
            }
            stack.push(!stack.pop());
            return;
        }

        if (stack.size() < 2) {
            throw new EvalException(EvalException.Kind.INSUFFICIENT_OPERANDS, operator + " needs 2 operands");
        }
        boolean b = stack.pop();
        boolean a = stack.pop();
        switch (operator) {
            case AND:
                stack.push(a && b);
                break;
            case OR:
                stack.push(a || b);
                break;
            case XOR:
                stack.push(a ^ b);
                break;
            default:
                throw new EvalException(EvalException.Kind.UNKNOWN_OPERATOR, "Unknown operator " + operator);
        }
    }
}
