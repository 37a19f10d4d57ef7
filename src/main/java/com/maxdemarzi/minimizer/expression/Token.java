package com.maxdemarzi.minimizer.expression;

import org.apache.commons.lang3.Validate;

import java.util.Objects;

/**
 * A single lexical unit of a boolean expression. Operator tokens take their
 * precedence and associativity from their {@link Operator}, so the pair can
 * never disagree with the kind.
 */
public final class Token {

    private static final Token LEFT_PAREN = new Token(TokenType.LEFT_PAREN, false, null, null, null, false);
    private static final Token RIGHT_PAREN = new Token(TokenType.RIGHT_PAREN, false, null, null, null, false);

    private final TokenType type;
    private final boolean bit;
    private final String variable;
    private final Operator operator;
    private final Fixity fixity;
    private final boolean implicit;

    private Token(TokenType type, boolean bit, String variable, Operator operator, Fixity fixity, boolean implicit) {
        this.type = type;
        this.bit = bit;
        this.variable = variable;
        this.operator = operator;
        this.fixity = fixity;
        this.implicit = implicit;
    }

    public static Token number(boolean bit) {
        return new Token(TokenType.NUMBER, bit, null, null, null, false);
    }

    public static Token variable(char letter) {
        Validate.isTrue(Character.isLetter(letter), "Not a letter: '%s'", letter);
        return new Token(TokenType.VARIABLE, false, String.valueOf(Character.toUpperCase(letter)), null, null, false);
    }

    public static Token operator(Operator operator, Fixity fixity) {
        Validate.notNull(operator, "operator");
        Validate.notNull(fixity, "fixity");
        Validate.isTrue(operator.isUnary() == (fixity != Fixity.INFIX),
                "%s cannot be used as a %s operator", operator, fixity);
        return new Token(TokenType.OPERATOR, false, null, operator, fixity, false);
    }

    public static Token prefixNot() {
        return operator(Operator.NOT, Fixity.PREFIX);
    }

    public static Token postfixNot() {
        return operator(Operator.NOT, Fixity.POSTFIX);
    }

    public static Token infix(Operator operator) {
        return operator(operator, Fixity.INFIX);
    }

    /**
     * The conjunction the parser places between two adjacent operands.
     */
    public static Token implicitAnd() {
        return new Token(TokenType.OPERATOR, false, null, Operator.AND, Fixity.INFIX, true);
    }

    public static Token leftParen() {
        return LEFT_PAREN;
    }

    public static Token rightParen() {
        return RIGHT_PAREN;
    }

    public TokenType getType() {
        return type;
    }

    public boolean getBit() {
        return bit;
    }

    public String getVariable() {
        return variable;
    }

    public Operator getOperator() {
        return operator;
    }

    public Fixity getFixity() {
        return fixity;
    }

    public int getPrecedence() {
        return operator == null ? 0 : operator.getPrecedence();
    }

    public Associativity getAssociativity() {
        return operator == null ? null : operator.getAssociativity();
    }

    public boolean isImplicit() {
        return implicit;
    }

    public boolean isOperator() {
        return type == TokenType.OPERATOR;
    }

    public boolean isParen() {
        return type == TokenType.LEFT_PAREN || type == TokenType.RIGHT_PAREN;
    }

    /**
     * True for tokens after which an operand is complete: a constant, a
     * variable, a closing paren or a postfix NOT.
     */
    public boolean endsOperand() {
        switch (type) {
            case NUMBER:
            case VARIABLE:
            case RIGHT_PAREN:
                return true;
            case OPERATOR:
                return fixity == Fixity.POSTFIX;
            default:
                return false;
        }
    }

    /**
     * True for tokens that can start an operand: a constant, a variable, an
     * opening paren or a prefix NOT.
     */
    public boolean beginsOperand() {
        switch (type) {
            case NUMBER:
            case VARIABLE:
            case LEFT_PAREN:
                return true;
            case OPERATOR:
                return fixity == Fixity.PREFIX;
            default:
                return false;
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Token)) return false;
        Token token = (Token) o;
        return type == token.type &&
                bit == token.bit &&
                Objects.equals(variable, token.variable) &&
                operator == token.operator &&
                fixity == token.fixity;
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, bit, variable, operator, fixity);
    }

    @Override
    public String toString() {
        switch (type) {
            case NUMBER:
                return bit ? "1" : "0";
            case VARIABLE:
                return variable;
            case OPERATOR:
                return operator.name();
            case LEFT_PAREN:
                return "(";
            case RIGHT_PAREN:
                return ")";
            default:
                throw new IllegalStateException("Unhandled token type " + type);
        }
    }
}
