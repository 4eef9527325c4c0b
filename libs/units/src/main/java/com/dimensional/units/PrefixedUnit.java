package com.dimensional.units;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * A {@link UnitComposition} together with a strictly positive scale factor.
 *
 * <p>A scale of 1 means "no prefix": {@code km} is {@code (LENGTH, 1000)} and {@code min} is
 * {@code (TIME, 60)}. Two prefixed units with the same composition but different scales are
 * different values; {@link #sameDimensionAs(PrefixedUnit)} compares dimensions only.
 *
 * <p>Scales are exact decimals. Products and integer powers stay exact; a quotient that does
 * not terminate is rounded with {@link MathContext#DECIMAL128}. Scales compare exactly first and
 * then within {@link #RELATIVE_TOLERANCE}, so rounded quotients and irrational factors (the
 * degree) still compare equal to their intended value. A scale that is an exact power of ten is
 * only ever equal to the same power of ten.
 *
 * <p>Scales are kept within {@code 10^±}{@link #MAX_SCALE_EXPONENT} and at most {@link
 * #MAX_SCALE_PRECISION} significant digits. Anything larger is rejected with {@link
 * InvalidExponentException} before it is computed.
 */
public final class PrefixedUnit {

    /**
     * Relative tolerance for scale equality when two scales are not exactly equal. Distinct
     * powers of ten differ by at least a factor of ten and never fall within it.
     */
    public static final BigDecimal RELATIVE_TOLERANCE = new BigDecimal("1e-12");

    /** Largest decimal exponent, positive or negative, a scale may have. */
    public static final int MAX_SCALE_EXPONENT = 1000;

    /** Largest number of significant digits a scale may have. */
    public static final int MAX_SCALE_PRECISION = 1000;

    private static final PrefixedUnit DIMENSIONLESS =
            new PrefixedUnit(UnitComposition.dimensionless(), BigDecimal.ONE);

    private final UnitComposition composition;
    private final BigDecimal scale;

    private PrefixedUnit(UnitComposition composition, BigDecimal scale) {
        this.composition = composition;
        this.scale = scale;
    }

    /**
     * Creates a prefixed unit.
     *
     * @throws IllegalArgumentException if {@code scale} is not strictly positive
     * @throws InvalidExponentException if {@code scale} is outside the supported range
     */
    public static PrefixedUnit of(UnitComposition composition, BigDecimal scale) {
        Objects.requireNonNull(composition, "composition must not be null");
        Objects.requireNonNull(scale, "scale must not be null");
        if (scale.signum() <= 0) {
            throw new IllegalArgumentException("scale must be strictly positive, was " + scale);
        }
        return new PrefixedUnit(composition, checkRange(scale.stripTrailingZeros()));
    }

    /** Convenience overload; the double is converted through its decimal string form. */
    public static PrefixedUnit of(UnitComposition composition, double scale) {
        if (!Double.isFinite(scale)) {
            throw new IllegalArgumentException("scale must be finite, was " + scale);
        }
        return of(composition, BigDecimal.valueOf(scale));
    }

    /** An unprefixed unit. */
    public static PrefixedUnit of(UnitComposition composition) {
        return of(composition, BigDecimal.ONE);
    }

    /** The dimensionless unit {@code 1} with scale 1. */
    public static PrefixedUnit dimensionless() {
        return DIMENSIONLESS;
    }

    public UnitComposition composition() {
        return composition;
    }

    public BigDecimal scale() {
        return scale;
    }

    public boolean isDimensionless() {
        return composition.isDimensionless();
    }

    /** True when both units measure the same dimension, whatever their scales. */
    public boolean sameDimensionAs(PrefixedUnit other) {
        return composition.equals(other.composition);
    }

    public PrefixedUnit multiply(PrefixedUnit other) {
        Objects.requireNonNull(other, "other must not be null");
        return of(composition.multiply(other.composition), scale.multiply(other.scale));
    }

    public PrefixedUnit divide(PrefixedUnit other) {
        Objects.requireNonNull(other, "other must not be null");
        return of(composition.divide(other.composition), quotient(scale, other.scale));
    }

    /**
     * Raises both the composition and the scale to {@code n}.
     *
     * @throws InvalidExponentException if an exponent overflows or the scale would leave the
     *     supported range
     */
    public PrefixedUnit power(int n) {
        UnitComposition powered = composition.power(n);
        checkPowerRange(n);
        try {
            BigDecimal magnitude = scale.pow(Math.absExact(n));
            return of(powered, n < 0 ? quotient(BigDecimal.ONE, magnitude) : magnitude);
        } catch (ArithmeticException e) {
            throw new InvalidExponentException("Scale %s cannot be raised to %d".formatted(scale.round(MathContext.DECIMAL32), n));
        }
    }

    /**
     * Picks the display prefix for the current scale.
     *
     * <p>When the scale is exactly a power of ten with an entry in the {@link Prefix} table, that
     * prefix is returned with residual 1. Otherwise no prefix is used and the whole scale is the
     * residual, to be shown as an explicit coefficient.
     */
    public PrefixChoice bestPrefix() {
        OptionalInt power = powerOfTen(scale);
        if (power.isPresent()) {
            if (power.getAsInt() == 0) {
                return new PrefixChoice("", BigDecimal.ONE);
            }
            Optional<Prefix> prefix = Prefix.forExponent(power.getAsInt());
            if (prefix.isPresent()) {
                return new PrefixChoice(prefix.get().symbol(), BigDecimal.ONE);
            }
        }
        return new PrefixChoice("", scale);
    }

    /**
     * Canonical text that parses back to an equal unit.
     *
     * <p>The prefix is attached to the first numerator symbol. If that symbol carries exponent
     * {@code e}, a prefix {@code p} is only used when {@code p^e} equals the scale ({@code km^2}
     * is 10⁶ m²). Any other scale is written as a leading coefficient: {@code 3600*s}, {@code 1000/s}.
     */
    public String render() {
        return leadingPrefix().map(composition::render).orElseGet(this::withCoefficient);
    }

    /**
     * The prefix to attach to the first numerator symbol under the rule described in {@link
     * #render()}: "" for scale 1, empty when the scale needs an explicit coefficient.
     */
    Optional<String> leadingPrefix() {
        if (scale.compareTo(BigDecimal.ONE) == 0) {
            return Optional.of("");
        }
        Optional<Map.Entry<FundamentalUnit, Integer>> leading = composition.leadingNumerator();
        OptionalInt power = powerOfTen(scale);
        if (leading.isEmpty() || power.isEmpty()) {
            return Optional.empty();
        }
        int exponent = leading.get().getValue();
        if (power.getAsInt() % exponent != 0) {
            return Optional.empty();
        }
        return Prefix.forExponent(power.getAsInt() / exponent).map(Prefix::symbol);
    }

    private String withCoefficient() {
        String body = composition.render();
        if (scale.compareTo(BigDecimal.ONE) == 0) {
            return body;
        }
        String coefficient = scale.toPlainString();
        if (composition.leadingNumerator().isEmpty()) {
            // body is "1" or "1/..."
            return coefficient + body.substring(1);
        }
        return coefficient + "*" + body;
    }

    static OptionalInt powerOfTen(BigDecimal value) {
        BigDecimal stripped = value.stripTrailingZeros();
        if (!stripped.unscaledValue().equals(BigInteger.ONE)) {
            return OptionalInt.empty();
        }
        return OptionalInt.of(-stripped.scale());
    }

    /** Floor of the base-ten logarithm of a positive, stripped scale. */
    private static int magnitude(BigDecimal value) {
        return value.precision() - value.scale() - 1;
    }

    private static BigDecimal checkRange(BigDecimal value) {
        int magnitude = magnitude(value);
        if (Math.abs(magnitude) > MAX_SCALE_EXPONENT || value.precision() > MAX_SCALE_PRECISION) {
            throw new InvalidExponentException("Scale %s is outside 10^±%d with at most %d digits"
                    .formatted(value.round(MathContext.DECIMAL32), MAX_SCALE_EXPONENT, MAX_SCALE_PRECISION));
        }
        return value;
    }

    /**
     * Estimates the size of {@code scale^n} from logarithms and fails before the power is
     * computed when it cannot fit. The exact result is checked again by {@link #of}.
     */
    private void checkPowerRange(int n) {
        int magnitude = magnitude(scale);
        double log10 = magnitude + Math.log10(scale.movePointLeft(magnitude).doubleValue());
        double times = Math.abs((double) n);
        double resultMagnitude = log10 * times;
        double resultDigits = (log10 + scale.scale()) * times;
        if (resultMagnitude > MAX_SCALE_EXPONENT + 1 || resultMagnitude < -MAX_SCALE_EXPONENT - 1
                || resultDigits > MAX_SCALE_PRECISION + 1) {
            throw new InvalidExponentException("Scale %s cannot be raised to %d: result outside 10^±%d"
                    .formatted(scale.round(MathContext.DECIMAL32), n, MAX_SCALE_EXPONENT));
        }
    }

    private static BigDecimal quotient(BigDecimal dividend, BigDecimal divisor) {
        try {
            return dividend.divide(divisor);
        } catch (ArithmeticException nonTerminating) {
            return dividend.divide(divisor, MathContext.DECIMAL128);
        }
    }

    static boolean scalesEqual(BigDecimal a, BigDecimal b) {
        if (a.compareTo(b) == 0) {
            return true;
        }
        if (powerOfTen(a).isPresent() || powerOfTen(b).isPresent()) {
            return false;
        }
        BigDecimal difference = a.subtract(b).abs();
        return difference.compareTo(a.max(b).multiply(RELATIVE_TOLERANCE)) <= 0;
    }

    /** Composition equality and scale equality (exact, else within {@link #RELATIVE_TOLERANCE}). */
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof PrefixedUnit other
                && composition.equals(other.composition)
                && scalesEqual(scale, other.scale);
    }

    /** Hashes the composition only, which keeps it consistent with tolerant scale equality. */
    @Override
    public int hashCode() {
        return composition.hashCode();
    }

    @Override
    public String toString() {
        return render();
    }
}
