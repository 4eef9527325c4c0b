package com.dimensional.units;

import java.util.Map;
import java.util.Optional;

/**
 * Renders units for display.
 *
 * <p>{@link Style#PLAIN} is the canonical, parseable form. The other styles are for humans and
 * documents only: every exponent is written inline (negative ones included) in {@link
 * FundamentalUnit#UNIT_ORDER}.
 */
public final class UnitRenderer {

    /** Output styles. */
    public enum Style {
        /** {@code kg*m/s^2} */
        PLAIN,
        /** {@code kg·m·s⁻²} */
        UNICODE,
        /** {@code \text{kg}\cdot\text{m}\cdot\text{s}^{-2}} */
        LATEX
    }

    private static final String SUPERSCRIPT_DIGITS = "⁰¹²³⁴⁵⁶⁷⁸⁹";

    private UnitRenderer() {
        // utility class
    }

    public static String render(PrefixedUnit unit, Style style) {
        return switch (style) {
            case PLAIN -> unit.render();
            case UNICODE, LATEX -> inline(unit, style);
        };
    }

    public static String render(UnitComposition composition, Style style) {
        return render(PrefixedUnit.of(composition), style);
    }

    private static String inline(PrefixedUnit unit, Style style) {
        UnitComposition composition = unit.composition();
        Optional<String> prefix = unit.leadingPrefix();
        Optional<FundamentalUnit> prefixed = composition.leadingNumerator().map(Map.Entry::getKey);

        StringBuilder out = new StringBuilder();
        if (prefix.isEmpty()) {
            out.append(unit.scale().toPlainString());
            if (composition.isDimensionless()) {
                return out.toString();
            }
            out.append(style == Style.LATEX ? "\\," : " ");
        } else if (composition.isDimensionless()) {
            return FundamentalUnit.DIMENSIONLESS.symbol();
        }

        boolean first = true;
        for (Map.Entry<FundamentalUnit, Integer> entry : composition.exponents().entrySet()) {
            if (!first) {
                out.append(style == Style.LATEX ? "\\cdot" : "·");
            }
            first = false;
            String symbol = entry.getKey().symbol();
            if (prefix.isPresent() && prefixed.isPresent() && prefixed.get() == entry.getKey()) {
                symbol = prefix.get() + symbol;
            }
            int exponent = entry.getValue();
            if (style == Style.LATEX) {
                out.append("\\text{").append(symbol).append('}');
                if (exponent != 1) {
                    out.append("^{").append(exponent).append('}');
                }
            } else {
                out.append(symbol);
                if (exponent != 1) {
                    out.append(superscript(exponent));
                }
            }
        }
        return out.toString();
    }

    static String superscript(int exponent) {
        StringBuilder out = new StringBuilder();
        for (char c : Integer.toString(exponent).toCharArray()) {
            out.append(c == '-' ? '⁻' : SUPERSCRIPT_DIGITS.charAt(c - '0'));
        }
        return out.toString();
    }
}
