package com.dimensional.units;

/**
 * An alias is already bound to a different unit, or the name would shadow a fundamental unit
 * symbol.
 */
public class AliasConflictException extends UnitException {

    private final String alias;
    private final String existing;
    private final String attempted;

    public AliasConflictException(String alias, String existing, String attempted) {
        super("Alias '%s' is already defined as '%s', cannot redefine it as '%s'"
                .formatted(alias, existing, attempted));
        this.alias = alias;
        this.existing = existing;
        this.attempted = attempted;
    }

    public String alias() {
        return alias;
    }

    /** Rendering of the current definition. */
    public String existing() {
        return existing;
    }

    /** Rendering of the rejected definition. */
    public String attempted() {
        return attempted;
    }
}
