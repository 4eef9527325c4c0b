package com.dimensional.units;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * The dimension of a unit: an integer exponent for each {@link FundamentalUnit}.
 *
 * <p>Instances are immutable and normalized. No entry is kept for a zero exponent and {@link
 * FundamentalUnit#DIMENSIONLESS} is never a key, since it is the identity of the algebra. The
 * empty composition is the dimensionless unit {@code 1}.
 *
 * <p>Example: kg·m/s² is {@code {MASS=1, LENGTH=1, TIME=-2}} and renders as {@code "kg*m/s^2"}.
 */
public final class UnitComposition {

    private static final UnitComposition DIMENSIONLESS = new UnitComposition(new EnumMap<>(FundamentalUnit.class));

    private final Map<FundamentalUnit, Integer> exponents;

    private UnitComposition(EnumMap<FundamentalUnit, Integer> normalized) {
        this.exponents = Collections.unmodifiableMap(normalized);
    }

    /** The empty composition. */
    public static UnitComposition dimensionless() {
        return DIMENSIONLESS;
    }

    /** A single fundamental unit with exponent 1. */
    public static UnitComposition of(FundamentalUnit unit) {
        return of(unit, 1);
    }

    /** A single fundamental unit raised to {@code exponent}. */
    public static UnitComposition of(FundamentalUnit unit, int exponent) {
        Objects.requireNonNull(unit, "unit must not be null");
        return of(Map.of(unit, exponent));
    }

    /**
     * Builds a composition from an exponent map. Zero exponents and dimensionless entries are
     * dropped.
     */
    public static UnitComposition of(Map<FundamentalUnit, Integer> exponents) {
        Objects.requireNonNull(exponents, "exponents must not be null");
        EnumMap<FundamentalUnit, Integer> normalized = new EnumMap<>(FundamentalUnit.class);
        exponents.forEach((unit, exponent) -> put(normalized, unit, exponent));
        return normalized.isEmpty() ? DIMENSIONLESS : new UnitComposition(normalized);
    }

    /** Exponents in {@link FundamentalUnit#UNIT_ORDER}, without zero entries. */
    public Map<FundamentalUnit, Integer> exponents() {
        return exponents;
    }

    /** The exponent of {@code unit}, 0 when absent. */
    public int exponentOf(FundamentalUnit unit) {
        return exponents.getOrDefault(unit, 0);
    }

    public boolean isDimensionless() {
        return exponents.isEmpty();
    }

    /** Adds exponents dimension by dimension. */
    public UnitComposition multiply(UnitComposition other) {
        return combine(other, 1);
    }

    /** Subtracts the exponents of {@code other}. */
    public UnitComposition divide(UnitComposition other) {
        return combine(other, -1);
    }

    /**
     * Scales every exponent by {@code n}. A power of 0 is always dimensionless.
     *
     * @throws InvalidExponentException if a resulting exponent does not fit in an {@code int}
     */
    public UnitComposition power(int n) {
        if (n == 0) {
            return DIMENSIONLESS;
        }
        EnumMap<FundamentalUnit, Integer> result = new EnumMap<>(FundamentalUnit.class);
        exponents.forEach((unit, exponent) -> put(result, unit, checkedMultiply(exponent, n)));
        return of(result);
    }

    /**
     * Canonical form: numerator symbols joined by {@code *}, then each denominator symbol after
     * its own {@code /}, all in {@link FundamentalUnit#UNIT_ORDER}. Exponent 1 is omitted.
     */
    public String render() {
        return render("");
    }

    /**
     * Canonical form with {@code prefix} attached to the first numerator symbol. Callers make sure
     * a numerator exists when the prefix is not empty.
     */
    String render(String prefix) {
        if (exponents.isEmpty()) {
            return FundamentalUnit.DIMENSIONLESS.symbol();
        }
        StringBuilder numerator = new StringBuilder();
        StringBuilder denominator = new StringBuilder();
        for (Map.Entry<FundamentalUnit, Integer> entry : exponents.entrySet()) {
            int exponent = entry.getValue();
            if (exponent > 0) {
                if (numerator.length() > 0) {
                    numerator.append('*');
                } else {
                    numerator.append(prefix);
                }
                appendTerm(numerator, entry.getKey(), exponent);
            } else {
                denominator.append('/');
                appendTerm(denominator, entry.getKey(), -exponent);
            }
        }
        if (numerator.length() == 0) {
            numerator.append(FundamentalUnit.DIMENSIONLESS.symbol());
        }
        return numerator.append(denominator).toString();
    }

    /** The first dimension with a positive exponent, in display order. */
    Optional<Map.Entry<FundamentalUnit, Integer>> leadingNumerator() {
        return exponents.entrySet().stream().filter(e -> e.getValue() > 0).findFirst();
    }

    private UnitComposition combine(UnitComposition other, int sign) {
        Objects.requireNonNull(other, "other must not be null");
        EnumMap<FundamentalUnit, Integer> result = new EnumMap<>(FundamentalUnit.class);
        result.putAll(exponents);
        other.exponents.forEach((unit, exponent) ->
                put(result, unit, checkedAdd(result.getOrDefault(unit, 0), checkedMultiply(exponent, sign))));
        return of(result);
    }

    private static void put(EnumMap<FundamentalUnit, Integer> target, FundamentalUnit unit, Integer exponent) {
        Objects.requireNonNull(unit, "unit must not be null");
        Objects.requireNonNull(exponent, "exponent must not be null");
        if (unit == FundamentalUnit.DIMENSIONLESS || exponent == 0) {
            target.remove(unit);
        } else {
            target.put(unit, exponent);
        }
    }

    private static void appendTerm(StringBuilder out, FundamentalUnit unit, int exponent) {
        out.append(unit.symbol());
        if (exponent != 1) {
            out.append('^').append(exponent);
        }
    }

    private static int checkedAdd(int a, int b) {
        try {
            return Math.addExact(a, b);
        } catch (ArithmeticException e) {
            throw new InvalidExponentException("Exponent overflow: %d + %d".formatted(a, b));
        }
    }

    static int checkedMultiply(int a, int b) {
        try {
            return Math.multiplyExact(a, b);
        } catch (ArithmeticException e) {
            throw new InvalidExponentException("Exponent overflow: %d * %d".formatted(a, b));
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof UnitComposition other && exponents.equals(other.exponents);
    }

    @Override
    public int hashCode() {
        return exponents.hashCode();
    }

    @Override
    public String toString() {
        return render();
    }
}
