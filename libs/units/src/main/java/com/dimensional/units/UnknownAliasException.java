package com.dimensional.units;

/** Direct lookup of an alias that was never registered. */
public class UnknownAliasException extends UnitException {

    private final String alias;

    public UnknownAliasException(String alias) {
        super("Unknown unit alias '%s'".formatted(alias));
        this.alias = alias;
    }

    public String alias() {
        return alias;
    }
}
