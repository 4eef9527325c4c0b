package com.dimensional.units;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * The SI base dimensions plus the dimensionless unit.
 *
 * <p>Each constant carries the symbol used in formulas and canonical renderings. The declaration
 * order is also the display order ({@link #UNIT_ORDER}): mass first, dimensionless last.
 */
public enum FundamentalUnit {

    MASS("kg"),
    ANGLE("rad"),
    LENGTH("m"),
    TIME("s"),
    LUMINOUS_INTENSITY("cd"),
    TEMPERATURE("K"),
    CURRENT("A"),
    AMOUNT_OF_SUBSTANCE("mol"),
    DIMENSIONLESS("1");

    /** Fixed display order used by every canonical rendering. */
    public static final List<FundamentalUnit> UNIT_ORDER = List.of(values());

    /** Orders units by their position in {@link #UNIT_ORDER}. */
    public static final Comparator<FundamentalUnit> DISPLAY_ORDER =
            Comparator.comparingInt(FundamentalUnit::order);

    private final String symbol;

    FundamentalUnit(String symbol) {
        this.symbol = symbol;
    }

    /** The formula symbol (e.g. "kg"). */
    public String symbol() {
        return symbol;
    }

    /** Position of this unit in {@link #UNIT_ORDER}. */
    public int order() {
        return ordinal();
    }

    /**
     * Looks up a fundamental unit by its formula symbol.
     *
     * @param symbol the symbol to match (e.g. "mol")
     * @return the matching unit, or empty if not found
     */
    public static Optional<FundamentalUnit> fromSymbol(String symbol) {
        for (FundamentalUnit unit : values()) {
            if (unit.symbol.equals(symbol)) {
                return Optional.of(unit);
            }
        }
        return Optional.empty();
    }

    /** Checks whether a string is the symbol of a fundamental unit. */
    public static boolean isSymbol(String symbol) {
        return fromSymbol(symbol).isPresent();
    }
}
