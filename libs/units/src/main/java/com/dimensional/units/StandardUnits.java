package com.dimensional.units;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;

/**
 * Catalogue of common named units: the SI derived units plus everyday multiples of the base
 * units (minute, litre, gram, ...).
 *
 * <p>Offset scales such as degrees Celsius are not multiplicative and are left out.
 */
public final class StandardUnits {

    private static final Logger log = LoggerFactory.getLogger(StandardUnits.class);

    /** Elementary charge in coulombs, the joule scale of one electronvolt. */
    static final BigDecimal ELECTRONVOLT_IN_JOULES = new BigDecimal("1.60217662e-19");

    /** One degree of arc in radians. */
    static final BigDecimal DEGREE_IN_RADIANS = BigDecimal.valueOf(Math.PI / 180);

    private StandardUnits() {
        // utility class
    }

    /**
     * Registers the whole catalogue. Definitions later in the list build on earlier ones, so the
     * registry must not already hold a conflicting definition for any of these names.
     *
     * @throws AliasConflictException if one of the names is already bound differently
     */
    public static void registerAll(UnitAliasManager registry) {
        int before = registry.size();

        // ---- SI derived units ----
        registry.register("N", "kg*m/s**2");
        registry.register("J", "N*m");
        registry.register("W", "J/s");
        registry.register("C", "A*s");
        registry.register("V", "W/A");
        registry.register("Ohm", "V/A");
        registry.register("ohm", "Ohm");
        registry.register("Ω", "Ohm");
        registry.register("Hz", "1/s");
        registry.register("Pa", "N/m**2");
        registry.register("T", "kg/s**2/A");
        registry.register("F", "C/V");
        registry.register("Wb", "V*s");
        registry.register("H", "Wb/A");

        // ---- Mass, volume ----
        registry.register("g", "0.001*kg");
        registry.register("ton", "1000*kg");
        registry.register("L", "0.001*m**3");

        // ---- Time ----
        registry.register("min", "60*s");
        registry.register("h", "3600*s");
        registry.register("day", "86400*s");
        registry.register("week", "604800*s");
        registry.register("month", "2629800*s");
        registry.register("year", "31557600*s");

        // ---- Pressure, energy, angle ----
        registry.register("atm", "101325*Pa");
        registry.register("bar", "100000*Pa");
        registry.register("eV", registry.resolve("J").multiply(
                PrefixedUnit.of(UnitComposition.dimensionless(), ELECTRONVOLT_IN_JOULES)));
        registry.register("cal", "4.184*J");
        registry.register("°", PrefixedUnit.of(UnitComposition.of(FundamentalUnit.ANGLE), DEGREE_IN_RADIANS));

        log.info("Registered {} standard unit aliases", registry.size() - before);
    }
}
