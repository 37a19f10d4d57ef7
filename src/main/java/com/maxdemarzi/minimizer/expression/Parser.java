package com.maxdemarzi.minimizer.expression;

import org.apache.commons.lang3.Validate;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Shunting-yard conversion from infix tokens to postfix order. Adjacent
 * operands such as {@code AB} or {@code A(B+C)} are joined by an implicit
 * AND before the conversion runs.
 * <p>
 * Only parenthesis balance is checked here; a missing operand shows up when
 * the expression is evaluated.
 */
public final class Parser {

    private Parser() {
    }

    public static PostfixExpression parse(List<Token> tokens) throws ParseException {
        Validate.notNull(tokens, "tokens");
        List<Token> output = new ArrayList<>();
        Deque<Token> stack = new ArrayDeque<>();

        for (Token token : insertImplicitAnd(tokens)) {
            switch (token.getType()) {
                case NUMBER:
                case VARIABLE:
                    output.add(token);
                    break;
                case OPERATOR:
                    switch (token.getFixity()) {
                        case POSTFIX:
                            output.add(token);
                            break;
                        case PREFIX:
                            stack.push(token);
                            break;
                        case INFIX:
                            while (!stack.isEmpty() && yieldsTo(stack.peek(), token)) {
                                output.add(stack.pop());
                            }
                            stack.push(token);
                            break;
                    }
                    break;
                case LEFT_PAREN:
                    stack.push(token);
                    break;
                case RIGHT_PAREN:
                    while (!stack.isEmpty() && stack.peek().getType() != TokenType.LEFT_PAREN) {
                        output.add(stack.pop());
                    }
                    if (stack.isEmpty()) {
                        throw new ParseException(ParseException.Reason.UNMATCHED_RIGHT_PAREN);
                    }
                    stack.pop();
                    break;
            }
        }

        while (!stack.isEmpty()) {
            Token token = stack.pop();
            if (token.isParen()) {
                throw new ParseException(ParseException.Reason.UNCLOSED_PAREN);
            }
            output.add(token);
        }
        return new PostfixExpression(output);
    }

    public static PostfixExpression parse(String expression) throws LexException, ParseException {
        return parse(Tokenizer.tokenize(expression));
    }

    /**
     * Copies the tokens, adding an AND wherever one operand ends and the next
     * begins without an operator in between.
     */
    public static List<Token> insertImplicitAnd(List<Token> tokens) {
        List<Token> expanded = new ArrayList<>(tokens.size() * 2);
        for (int i = 0; i < tokens.size(); i++) {
            Token current = tokens.get(i);
            expanded.add(current);
            if (i + 1 < tokens.size() && current.endsOperand() && tokens.get(i + 1).beginsOperand()) {
                expanded.add(Token.implicitAnd());
            }
        }
        return expanded;
    }

    private static boolean yieldsTo(Token top, Token incoming) {
        if (!top.isOperator()) {
            return false;
        }
        return top.getPrecedence() > incoming.getPrecedence()
                || (top.getPrecedence() == incoming.getPrecedence()
                    && incoming.getAssociativity() == Associativity.LEFT);
    }
}
