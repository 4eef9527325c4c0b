package com.dimensional.units;

import java.math.BigDecimal;

/**
 * Result of {@link PrefixedUnit#bestPrefix()}.
 *
 * @param symbol prefix symbol to display, empty for no prefix
 * @param residual scale left after applying the prefix; 1 when the prefix accounts for all of it
 */
public record PrefixChoice(String symbol, BigDecimal residual) {

    /** True when no explicit coefficient is needed. */
    public boolean isExact() {
        return residual.compareTo(BigDecimal.ONE) == 0;
    }
}
