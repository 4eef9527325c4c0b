package com.dimensional.units;

import java.math.BigDecimal;
import java.util.Objects;
import java.util.Optional;

/**
 * A physical unit: the public entry point of the library.
 *
 * <p>A unit is the formula it was read from, the {@link PrefixedUnit} that formula resolves to
 * and, optionally, the alias it was registered under or referenced by. Units are immutable;
 * arithmetic returns new instances with a canonical formula and no alias.
 *
 * <pre>{@code
 * UnitAliasManager registry = new UnitAliasManager();
 * Unit newton = Unit.parse("N = kg*m/s**2", registry);   // registers N
 * Unit force = Unit.parse("kg*m/s^2", registry);
 * newton.equals(force);                                  // true
 * newton.render();                                       // "N"
 * force.render();                                        // "kg*m/s^2"
 * }</pre>
 *
 * <p>Equality follows {@link PrefixedUnit#equals(Object)}: {@code m} and {@code km} are
 * different units of the same dimension. Use {@link #isCompatibleWith(Unit)} to compare
 * dimensions only.
 */
public final class Unit {

    private final String formula;
    private final PrefixedUnit prefixedUnit;
    private final String alias;

    private Unit(String formula, PrefixedUnit prefixedUnit, String alias) {
        this.formula = formula;
        this.prefixedUnit = prefixedUnit;
        this.alias = alias;
    }

    /**
     * Parses a formula such as {@code "kg*m/s**2"} or {@code "N = kg*m/s**2"}. The second form
     * registers {@code N} in {@code registry} and the returned unit carries that alias.
     *
     * @throws UnitException subclasses describing why the formula was rejected
     */
    public static Unit parse(String text, UnitAliasManager registry) {
        ParsedFormula parsed = new UnitParser(registry).parseFormula(text);
        return new Unit(parsed.expression(), parsed.unit(), parsed.alias());
    }

    /** An unprefixed unit with a canonical formula. */
    public static Unit fromComposition(UnitComposition composition) {
        return fromPrefixedUnit(PrefixedUnit.of(composition));
    }

    /** A unit with a canonical formula and no alias. */
    public static Unit fromPrefixedUnit(PrefixedUnit prefixedUnit) {
        Objects.requireNonNull(prefixedUnit, "prefixedUnit must not be null");
        return new Unit(prefixedUnit.render(), prefixedUnit, null);
    }

    /** The dimensionless unit {@code 1}. */
    public static Unit dimensionless() {
        return fromPrefixedUnit(PrefixedUnit.dimensionless());
    }

    /** The formula this unit was parsed from, or its canonical form if it was computed. */
    public String formula() {
        return formula;
    }

    public PrefixedUnit prefixedUnit() {
        return prefixedUnit;
    }

    public UnitComposition composition() {
        return prefixedUnit.composition();
    }

    public BigDecimal scale() {
        return prefixedUnit.scale();
    }

    public Optional<String> alias() {
        return Optional.ofNullable(alias);
    }

    public boolean isDimensionless() {
        return prefixedUnit.isDimensionless();
    }

    /** True when both units have the same dimension, whatever their prefixes. */
    public boolean isCompatibleWith(Unit other) {
        return prefixedUnit.sameDimensionAs(other.prefixedUnit);
    }

    public Unit multiply(Unit other) {
        return fromPrefixedUnit(prefixedUnit.multiply(other.prefixedUnit));
    }

    public Unit divide(Unit other) {
        return fromPrefixedUnit(prefixedUnit.divide(other.prefixedUnit));
    }

    /**
     * @throws InvalidExponentException if an exponent overflows
     */
    public Unit power(int n) {
        return fromPrefixedUnit(prefixedUnit.power(n));
    }

    /**
     * The unit of a sum of quantities expressed in this unit and {@code other}. Both must have
     * the same dimension; the result is this unit, since converting scales is the caller's job.
     *
     * @throws DimensionMismatchException if the dimensions differ (e.g. mass + length)
     */
    public Unit plus(Unit other) {
        if (!isCompatibleWith(other)) {
            throw new DimensionMismatchException(composition(), other.composition());
        }
        return this;
    }

    /**
     * Returns this unit labelled with the first alias of {@code registry} that equals it, or this
     * unit unchanged when none does.
     */
    public Unit withRegisteredAlias(UnitAliasManager registry) {
        return registry.findAlias(prefixedUnit)
                .map(name -> new Unit(formula, prefixedUnit, name))
                .orElse(this);
    }

    /**
     * Display form: the alias when there is one, otherwise the canonical rendering with the best
     * prefix (or an explicit coefficient). Always parses back to an equal unit against the
     * registry that knows the alias.
     */
    public String render() {
        return alias != null ? alias : prefixedUnit.render();
    }

    /** Rendering in the given style; aliases are kept as they are. */
    public String render(UnitRenderer.Style style) {
        return alias != null ? alias : UnitRenderer.render(prefixedUnit, style);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof Unit other && prefixedUnit.equals(other.prefixedUnit);
    }

    @Override
    public int hashCode() {
        return prefixedUnit.hashCode();
    }

    @Override
    public String toString() {
        return render();
    }
}
