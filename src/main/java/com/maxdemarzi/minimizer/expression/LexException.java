package com.maxdemarzi.minimizer.expression;

public class LexException extends ExpressionException {

    private final char character;
    private final int position;

    public LexException(char character, int position) {
        super("Unrecognized character '" + character + "' at position " + position);
        this.character = character;
        this.position = position;
    }

    public char getCharacter() {
        return character;
    }

    /**
     * 0-based offset into the expression with whitespace removed.
     */
    public int getPosition() {
        return position;
    }
}
