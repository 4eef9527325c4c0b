package com.dimensional.units;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.dimensional.units.UnitToken.Type;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Tests for {@link UnitLexer}.
 */
@DisplayName("UnitLexer")
class UnitLexerTest {

    private static List<Type> types(String text) {
        return new UnitLexer(text).tokenize().stream().map(UnitToken::type).toList();
    }

    @Nested
    @DisplayName("tokens")
    class Tokens {

        @Test
        @DisplayName("identifiers, operators and numbers")
        void formula() {
            assertThat(types("kg*m/s**2"))
                    .containsExactly(Type.IDENT, Type.STAR, Type.IDENT, Type.SLASH, Type.IDENT, Type.POWER,
                            Type.NUMBER, Type.END);
        }

        @Test
        @DisplayName("'^' is a power operator like '**'")
        void caret() {
            var tokens = new UnitLexer("s^-2").tokenize();
            assertThat(tokens).extracting(UnitToken::type)
                    .containsExactly(Type.IDENT, Type.POWER, Type.MINUS, Type.NUMBER, Type.END);
            assertThat(tokens.get(1).text()).isEqualTo("^");
        }

        @Test
        @DisplayName("alias definition, groups and brackets")
        void definition() {
            assertThat(types("N = [kg*m]/(s)"))
                    .containsExactly(Type.IDENT, Type.EQUALS, Type.LBRACKET, Type.IDENT, Type.STAR, Type.IDENT,
                            Type.RBRACKET, Type.SLASH, Type.LPAREN, Type.IDENT, Type.RPAREN, Type.END);
        }

        @Test
        @DisplayName("whitespace is skipped and positions point into the original text")
        void positions() {
            var tokens = new UnitLexer("  kg *\tm ").tokenize();
            assertThat(tokens).extracting(UnitToken::position).containsExactly(2, 5, 7, 9);
            assertThat(tokens.get(0).text()).isEqualTo("kg");
        }

        @Test
        @DisplayName("micro sign, Greek letters and degree sign are identifier characters")
        void unicodeIdentifiers() {
            var tokens = new UnitLexer("µs*Ω*°").tokenize();
            assertThat(tokens).extracting(UnitToken::text).containsExactly("µs", "*", "Ω", "*", "°", "");
        }

        @Test
        @DisplayName("decimal numbers")
        void decimals() {
            var tokens = new UnitLexer("0.001*.5").tokenize();
            assertThat(tokens).extracting(UnitToken::text).containsExactly("0.001", "*", ".5", "");
        }

        @Test
        @DisplayName("empty input is just END")
        void empty() {
            assertThat(types("   ")).containsExactly(Type.END);
        }
    }

    @Nested
    @DisplayName("errors")
    class Errors {

        @Test
        @DisplayName("illegal character fails with LexException at its position")
        void illegalCharacter() {
            assertThatThrownBy(() -> new UnitLexer("kg * @@").tokenize())
                    .isInstanceOf(LexException.class)
                    .hasMessageContaining("'@'")
                    .hasMessageContaining("position 5");
        }

        @Test
        @DisplayName("LexException carries the character and position")
        void lexExceptionDetails() {
            assertThatThrownBy(() -> new UnitLexer("m$").tokenize())
                    .isInstanceOfSatisfying(LexException.class, e -> {
                        assertThat(e.character()).isEqualTo('$');
                        assertThat(e.position()).isEqualTo(1);
                        assertThat(e.formula()).isEqualTo("m$");
                    });
        }

        @Test
        @DisplayName("number with two decimal points is malformed")
        void twoDots() {
            assertThatThrownBy(() -> new UnitLexer("1.2.3").tokenize())
                    .isInstanceOf(UnitSyntaxException.class)
                    .hasMessageContaining("Malformed number");
        }

        @Test
        @DisplayName("a lone dot is malformed")
        void loneDot() {
            assertThatThrownBy(() -> new UnitLexer("m*.").tokenize()).isInstanceOf(UnitSyntaxException.class);
        }
    }
}
