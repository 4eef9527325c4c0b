package com.dimensional.units;

/**
 * A symbol that, with or without a prefix, is neither a fundamental unit nor a registered alias.
 */
public class UnknownUnitSymbolException extends FormulaException {

    private final String symbol;

    public UnknownUnitSymbolException(String symbol, String formula, int position) {
        super("Unknown unit symbol '%s'".formatted(symbol), formula, position);
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }
}
