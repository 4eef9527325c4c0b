package com.dimensional.units;

import static com.dimensional.units.FundamentalUnit.LENGTH;
import static com.dimensional.units.FundamentalUnit.MASS;
import static com.dimensional.units.FundamentalUnit.TIME;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigDecimal;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

/**
 * Tests for {@link Unit}: parsing, aliases, the render/parse round trip, arithmetic and
 * dimension checks.
 */
@DisplayName("Unit")
class UnitTest {

    private UnitAliasManager registry;

    @BeforeEach
    void setUp() {
        registry = new UnitAliasManager();
    }

    @Nested
    @DisplayName("parse()")
    class Parse {

        @Test
        @DisplayName("a fundamental symbol")
        void fundamental() {
            var unit = Unit.parse("kg", registry);
            assertThat(unit.composition()).isEqualTo(UnitComposition.of(MASS));
            assertThat(unit.scale()).isEqualByComparingTo(BigDecimal.ONE);
            assertThat(unit.formula()).isEqualTo("kg");
            assertThat(unit.alias()).isEmpty();
            assertThat(unit.render()).isEqualTo("kg");
        }

        @Test
        @DisplayName("a compound formula renders canonically")
        void compound() {
            var unit = Unit.parse("kg*m/s**2", registry);
            assertThat(unit.composition().exponents())
                    .containsExactlyInAnyOrderEntriesOf(Map.of(MASS, 1, LENGTH, 1, TIME, -2));
            assertThat(unit.formula()).isEqualTo("kg*m/s**2");
            assertThat(unit.render()).isEqualTo("kg*m/s^2");
        }

        @Test
        @DisplayName("a definition registers the alias and the unit renders by it")
        void definition() {
            var newton = Unit.parse("N = kg*m/s**2", registry);
            assertThat(registry.isRegistered("N")).isTrue();
            assertThat(newton.alias()).contains("N");
            assertThat(newton.formula()).isEqualTo("kg*m/s**2");
            assertThat(newton.render()).isEqualTo("N");
            assertThat(newton).isEqualTo(Unit.parse("kg*m/s**2", registry));
        }

        @Test
        @DisplayName("a bare alias reference carries the alias")
        void aliasReference() {
            Unit.parse("N = kg*m/s**2", registry);
            var unit = Unit.parse("N", registry);
            assertThat(unit.alias()).contains("N");
            assertThat(unit.render()).isEqualTo("N");
        }

        @Test
        @DisplayName("a prefixed unit renders with its prefix")
        void prefixed() {
            var km = Unit.parse("km", registry);
            assertThat(km.scale()).isEqualByComparingTo(new BigDecimal("1000"));
            assertThat(km.render()).isEqualTo("km");
        }

        @Test
        @DisplayName("a product of two symbols")
        void product() {
            assertThat(Unit.parse("m*s", registry).render()).isEqualTo("m*s");
        }

        @Test
        @DisplayName("a dangling operator is a syntax error")
        void danglingOperator() {
            assertThatThrownBy(() -> Unit.parse("kg +", registry)).isInstanceOf(UnitSyntaxException.class);
        }
    }

    @Nested
    @DisplayName("render() round trip")
    class RoundTrip {

        private UnitAliasManager standard;

        @BeforeEach
        void setUp() {
            standard = UnitAliasManager.withStandardUnits();
        }

        @ParameterizedTest(name = "{0}")
        @ValueSource(strings = {
                "kg", "km", "km**2", "0.001*m**2", "1/s", "ms", "mol/L", "min", "°", "km/h", "kg**-1",
                "1000", "µs", "dam", "kN", "Hz", "kg*m**2/(s**3*A)", "3*cm/ms", "[m/s]**-2", "mg"
        })
        @DisplayName("the rendering parses back to an equal unit")
        void roundTrips(String formula) {
            var unit = Unit.parse(formula, standard);
            var reparsed = Unit.parse(unit.render(), standard);
            assertThat(reparsed).isEqualTo(unit);
            assertThat(reparsed.render()).isEqualTo(unit.render());
        }

        @Test
        @DisplayName("prefix choice and coefficients")
        void renderings() {
            assertThat(Unit.parse("km**2", standard).render()).isEqualTo("km^2");
            assertThat(Unit.parse("0.001*m**2", standard).render()).isEqualTo("0.001*m^2");
            assertThat(Unit.parse("mol/L", standard).render()).isEqualTo("kmol/m^3");
            assertThat(Unit.parse("min", standard).render()).isEqualTo("min");
            assertThat(Unit.parse("2*min", standard).render()).isEqualTo("120*s");
            assertThat(Unit.parse("kN", standard).render()).isEqualTo("kkg*m/s^2");
            assertThat(Unit.parse("µs", standard).render()).isEqualTo("µs");
            assertThat(Unit.parse("us", standard).render()).isEqualTo("µs");
            assertThat(Unit.parse("1000", standard).render()).isEqualTo("1000");
            assertThat(Unit.parse("kg**-1", standard).render()).isEqualTo("1/kg");
        }
    }

    @Nested
    @DisplayName("arithmetic")
    class Arithmetic {

        @Test
        @DisplayName("results carry a canonical formula and no alias")
        void clearsAlias() {
            var newton = Unit.parse("N = kg*m/s**2", registry);
            var metre = Unit.parse("m", registry);
            var joule = newton.multiply(metre);
            assertThat(joule.alias()).isEmpty();
            assertThat(joule.formula()).isEqualTo("kg*m^2/s^2");
            assertThat(joule.render()).isEqualTo("kg*m^2/s^2");
        }

        @Test
        @DisplayName("division and powers combine scales")
        void divideAndPower() {
            var km = Unit.parse("km", registry);
            var hour = Unit.parse("3600*s", registry);
            assertThat(km.divide(hour).composition()).isEqualTo(UnitComposition.of(Map.of(LENGTH, 1, TIME, -1)));
            assertThat(km.power(2)).isEqualTo(Unit.parse("km**2", registry));
            assertThat(km.power(-1).render()).isEqualTo("0.001/m");
            assertThat(km.power(0)).isEqualTo(Unit.dimensionless());
        }

        @Test
        @DisplayName("powers that leave the scale range are rejected")
        void powerOutOfRange() {
            var km = Unit.parse("km", registry);
            assertThatThrownBy(() -> km.power(400)).isInstanceOf(InvalidExponentException.class);
            assertThatThrownBy(() -> Unit.parse("10**-999999999", registry)).isInstanceOf(InvalidExponentException.class);
        }

        @Test
        @DisplayName("fromComposition builds an unprefixed unit")
        void fromComposition() {
            var unit = Unit.fromComposition(UnitComposition.of(TIME, -1));
            assertThat(unit.formula()).isEqualTo("1/s");
            assertThat(unit.scale()).isEqualByComparingTo(BigDecimal.ONE);
            assertThat(Unit.dimensionless().isDimensionless()).isTrue();
            assertThat(Unit.dimensionless().render()).isEqualTo("1");
        }
    }

    @Nested
    @DisplayName("dimensions")
    class Dimensions {

        @Test
        @DisplayName("units of the same dimension are compatible but not equal")
        void compatible() {
            var metre = Unit.parse("m", registry);
            var km = Unit.parse("km", registry);
            assertThat(metre.isCompatibleWith(km)).isTrue();
            assertThat(metre).isNotEqualTo(km);
            assertThat(metre.isCompatibleWith(Unit.parse("s", registry))).isFalse();
        }

        @Test
        @DisplayName("plus keeps the left unit when dimensions agree")
        void plus() {
            var metre = Unit.parse("m", registry);
            assertThat(metre.plus(Unit.parse("km", registry))).isSameAs(metre);
        }

        @Test
        @DisplayName("plus rejects different dimensions")
        void plusMismatch() {
            var kg = Unit.parse("kg", registry);
            var metre = Unit.parse("m", registry);
            assertThatThrownBy(() -> kg.plus(metre))
                    .isInstanceOf(DimensionMismatchException.class)
                    .hasMessageContaining("'kg'")
                    .hasMessageContaining("'m'");
        }

        @Test
        @DisplayName("withRegisteredAlias labels a computed unit")
        void withRegisteredAlias() {
            var standard = UnitAliasManager.withStandardUnits();
            var computed = Unit.parse("kg*m/s**2", standard);
            var labelled = computed.withRegisteredAlias(standard);
            assertThat(labelled.alias()).contains("N");
            assertThat(labelled.render()).isEqualTo("N");
            assertThat(labelled.formula()).isEqualTo("kg*m/s**2");
            assertThat(labelled).isEqualTo(computed);

            var unnamed = Unit.parse("kg*m", standard);
            assertThat(unnamed.withRegisteredAlias(standard)).isSameAs(unnamed);
        }
    }
}
