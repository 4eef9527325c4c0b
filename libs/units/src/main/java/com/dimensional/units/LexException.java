package com.dimensional.units;

/** A character that cannot start any token. */
public class LexException extends FormulaException {

    private final char character;

    public LexException(char character, String formula, int position) {
        super("Illegal character '%s'".formatted(character), formula, position);
        this.character = character;
    }

    public char character() {
        return character;
    }
}
