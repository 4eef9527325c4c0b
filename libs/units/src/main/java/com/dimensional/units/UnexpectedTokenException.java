package com.dimensional.units;

/** The parser met a token the grammar does not allow at that point. */
public class UnexpectedTokenException extends UnitSyntaxException {

    private final String token;

    public UnexpectedTokenException(String token, String expected, String formula, int position) {
        super("Unexpected token '%s', expected %s".formatted(token, expected), formula, position);
        this.token = token;
    }

    /** The offending token text. */
    public String token() {
        return token;
    }
}
