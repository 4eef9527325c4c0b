package com.dimensional.units;

/**
 * A formula could not be read. Carries the formula text and the zero-based character position
 * of the offending input.
 */
public class FormulaException extends UnitException {

    private final String formula;
    private final int position;

    public FormulaException(String message, String formula, int position) {
        super("%s at position %d in '%s'".formatted(message, position, formula));
        this.formula = formula;
        this.position = position;
    }

    public String formula() {
        return formula;
    }

    public int position() {
        return position;
    }
}
