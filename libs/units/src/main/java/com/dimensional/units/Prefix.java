package com.dimensional.units;

import java.math.BigDecimal;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * SI decimal prefixes.
 *
 * <p>{@code MICRO_ASCII} ("u") is accepted when parsing but never chosen for display; {@link
 * #forExponent(int)} always returns the canonical symbol.
 */
public enum Prefix {

    YOTTA("Y", 24),
    ZETTA("Z", 21),
    EXA("E", 18),
    PETA("P", 15),
    TERA("T", 12),
    GIGA("G", 9),
    MEGA("M", 6),
    KILO("k", 3),
    HECTO("h", 2),
    DECA("da", 1),
    DECI("d", -1),
    CENTI("c", -2),
    MILLI("m", -3),
    MICRO("µ", -6),
    MICRO_ASCII("u", -6),
    NANO("n", -9),
    PICO("p", -12),
    FEMTO("f", -15),
    ATTO("a", -18),
    ZEPTO("z", -21),
    YOCTO("y", -24);

    /** Prefixes in the order the parser tries them: longest symbol first. */
    static final List<Prefix> LONGEST_FIRST = Stream.of(values())
            .sorted(Comparator.comparingInt((Prefix p) -> p.symbol.length()).reversed())
            .toList();

    private final String symbol;
    private final int exponent;

    Prefix(String symbol, int exponent) {
        this.symbol = symbol;
        this.exponent = exponent;
    }

    public String symbol() {
        return symbol;
    }

    /** The power of ten this prefix stands for. */
    public int exponent() {
        return exponent;
    }

    /** The multiplier as an exact decimal (e.g. 1000 for kilo). */
    public BigDecimal factor() {
        return BigDecimal.ONE.scaleByPowerOfTen(exponent);
    }

    /**
     * Looks up a prefix by its symbol.
     *
     * @param symbol the symbol to match (e.g. "da")
     * @return the matching prefix, or empty if not found
     */
    public static Optional<Prefix> fromSymbol(String symbol) {
        for (Prefix prefix : values()) {
            if (prefix.symbol.equals(symbol)) {
                return Optional.of(prefix);
            }
        }
        return Optional.empty();
    }

    /**
     * Returns the display prefix for a power of ten, if the table has one.
     *
     * @param exponent the power of ten (e.g. -6)
     * @return the canonical prefix (µ rather than u), or empty for unsupported powers and for 0
     */
    public static Optional<Prefix> forExponent(int exponent) {
        for (Prefix prefix : values()) {
            if (prefix.exponent == exponent) {
                return Optional.of(prefix);
            }
        }
        return Optional.empty();
    }
}
