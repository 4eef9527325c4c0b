package com.dimensional.units;

/**
 * One lexical token of a unit formula.
 *
 * @param type the token kind
 * @param text the source text of the token ("" for {@link Type#END})
 * @param position zero-based offset of the first character in the formula
 */
public record UnitToken(Type type, String text, int position) {

    /** Token kinds. {@code **} and {@code ^} both lex as {@link #POWER}. */
    public enum Type {
        IDENT,
        NUMBER,
        STAR,
        SLASH,
        POWER,
        PLUS,
        MINUS,
        LPAREN,
        RPAREN,
        LBRACKET,
        RBRACKET,
        EQUALS,
        END
    }

    public boolean is(Type other) {
        return type == other;
    }

    /** Text used in diagnostics. */
    public String describe() {
        return type == Type.END ? "end of formula" : text;
    }
}
