package com.maxdemarzi.minimizer.expression;

import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class Tokenizer {

    private static final char APOSTROPHE = '\'';

    private Tokenizer() {
    }

    /**
     * Splits an expression into tokens. Whitespace is dropped before
     * scanning, so error positions refer to the compacted text.
     */
    public static List<Token> tokenize(String expression) throws LexException {
        Validate.notNull(expression, "expression");
        String source = StringUtils.deleteWhitespace(expression);
        List<Token> tokens = new ArrayList<>();

        int i = 0;
        while (i < source.length()) {
            char ch = source.charAt(i);

            if (ch == '0' || ch == '1') {
                tokens.add(Token.number(ch == '1'));
                i++;
                continue;
            }

            if (isLetter(ch)) {
                tokens.add(Token.variable(ch));
                i++;

                // A'' is A, A''' is A'
                int negations = 0;
                while (i < source.length() && source.charAt(i) == APOSTROPHE) {
                    negations++;
                    i++;
                }
                if (negations % 2 == 1) {
                    tokens.add(Token.postfixNot());
                }
                continue;
            }

            switch (ch) {
                case '(':
                    tokens.add(Token.leftParen());
                    break;
                case ')':
                    tokens.add(Token.rightParen());
                    break;
                case '!':
                case '~':
                    tokens.add(Token.prefixNot());
                    break;
                case '&':
                case '*':
                    tokens.add(Token.infix(Operator.AND));
                    break;
                case '+':
                case '|':
                    tokens.add(Token.infix(Operator.OR));
                    break;
                case '^':
                    tokens.add(Token.infix(Operator.XOR));
                    break;
                default:
                    throw new LexException(ch, i);
            }
            i++;
        }
        return Collections.unmodifiableList(tokens);
    }

    // ASCII only, the same letters Variables.extract picks up
    static boolean isLetter(char ch) {
        return (ch >= 'A' && ch <= 'Z') || (ch >= 'a' && ch <= 'z');
    }
}
