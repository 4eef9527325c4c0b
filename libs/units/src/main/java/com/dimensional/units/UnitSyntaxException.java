package com.dimensional.units;

/** A grammar violation: missing operand, unterminated group or trailing input. */
public class UnitSyntaxException extends FormulaException {

    public UnitSyntaxException(String message, String formula, int position) {
        super(message, formula, position);
    }
}
