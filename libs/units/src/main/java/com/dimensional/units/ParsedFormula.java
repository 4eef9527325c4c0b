package com.dimensional.units;

import java.util.Optional;

/**
 * Outcome of {@link UnitParser#parseFormula(String)}.
 *
 * @param expression the formula text right of any {@code =}, trimmed
 * @param unit the resolved unit
 * @param alias the alias defined by the formula, or the alias it consists of; null when neither
 * @param definition true when the formula had the form {@code ALIAS = expr}
 */
public record ParsedFormula(String expression, PrefixedUnit unit, String alias, boolean definition) {

    public Optional<String> aliasName() {
        return Optional.ofNullable(alias);
    }
}
