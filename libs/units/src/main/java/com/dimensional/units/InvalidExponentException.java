package com.dimensional.units;

import java.util.OptionalInt;

/**
 * An exponent that is not an integer literal, is missing, or falls outside the {@code int}
 * range once applied.
 */
public class InvalidExponentException extends UnitException {

    private final int position;

    public InvalidExponentException(String message) {
        super(message);
        this.position = -1;
    }

    public InvalidExponentException(String message, String formula, int position) {
        super("%s at position %d in '%s'".formatted(message, position, formula));
        this.position = position;
    }

    /** Position in the formula, when the exponent came from parsed text. */
    public OptionalInt position() {
        return position < 0 ? OptionalInt.empty() : OptionalInt.of(position);
    }
}
