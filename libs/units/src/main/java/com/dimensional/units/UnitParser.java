package com.dimensional.units;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Recursive-descent parser for unit formulas.
 *
 * <pre>
 * formula  := [ alias "=" ] expr
 * expr     := term { ("*" | "/") term }
 * term     := factor [ ("**" | "^") exponent ]
 * factor   := "(" expr ")" | "[" expr "]" | symbol | number
 * exponent := [ "+" | "-" ] integer
 * symbol   := [ prefix ] base_symbol
 * </pre>
 *
 * <p>Operators are left-associative, so {@code a/b/c} is {@code (a/b)/c}. A symbol is first
 * looked up whole, against the fundamental units and then the alias registry. Failing that, SI
 * prefixes are stripped longest-first and the remainder looked up the same way.
 *
 * <p>Instances hold no per-parse state and may be shared; concurrent use is as safe as the
 * underlying {@link UnitAliasManager}.
 */
public final class UnitParser {

    private final UnitAliasManager registry;

    public UnitParser(UnitAliasManager registry) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
    }

    /**
     * Parses a formula and returns its resolved unit. An {@code ALIAS = expr} formula also
     * registers the alias.
     */
    public PrefixedUnit parse(String text) {
        return parseFormula(text).unit();
    }

    /**
     * Parses a formula and reports what it defines or references.
     *
     * @throws LexException on an illegal character
     * @throws UnitSyntaxException on a grammar violation (including {@link UnexpectedTokenException})
     * @throws UnknownUnitSymbolException on a symbol that cannot be resolved
     * @throws InvalidExponentException on a missing, fractional or out-of-range exponent
     * @throws AliasConflictException if the formula redefines an alias differently
     */
    public ParsedFormula parseFormula(String text) {
        return parseFormula(text, true);
    }

    /**
     * Parses a plain expression. A formula of the form {@code ALIAS = expr} is rejected before
     * anything is registered.
     *
     * @throws UnexpectedTokenException if the formula contains {@code '='}
     */
    public PrefixedUnit parseExpression(String text) {
        return parseFormula(text, false).unit();
    }

    private ParsedFormula parseFormula(String text, boolean allowDefinition) {
        Objects.requireNonNull(text, "text must not be null");
        List<UnitToken> tokens = new UnitLexer(text).tokenize();

        String definedAlias = null;
        int start = 0;
        int equalsAt = indexOf(tokens, UnitToken.Type.EQUALS);
        if (equalsAt >= 0) {
            if (!allowDefinition) {
                UnitToken equals = tokens.get(equalsAt);
                throw new UnexpectedTokenException(equals.describe(), "an expression without '='", text, equals.position());
            }
            if (equalsAt != 1 || !tokens.get(0).is(UnitToken.Type.IDENT)) {
                UnitToken bad = equalsAt == 0 ? tokens.get(0) : tokens.get(equalsAt);
                throw new UnexpectedTokenException(bad.describe(), "a single alias name before '='", text, bad.position());
            }
            definedAlias = tokens.get(0).text();
            start = 2;
        }

        Run run = new Run(text, tokens, start);
        PrefixedUnit unit = run.expr();
        run.expectEnd();

        String expression = definedAlias == null
                ? text.strip()
                : text.substring(tokens.get(1).position() + 1).strip();
        if (definedAlias != null) {
            registry.register(definedAlias, unit);
            return new ParsedFormula(expression, unit, definedAlias, true);
        }
        return new ParsedFormula(expression, unit, referencedAlias(tokens), false);
    }

    /** The alias named by a formula that is exactly one registered, unprefixed symbol. */
    private String referencedAlias(List<UnitToken> tokens) {
        if (tokens.size() == 2 && tokens.get(0).is(UnitToken.Type.IDENT)) {
            String name = tokens.get(0).text();
            if (!FundamentalUnit.isSymbol(name) && registry.isRegistered(name)) {
                return name;
            }
        }
        return null;
    }

    private static int indexOf(List<UnitToken> tokens, UnitToken.Type type) {
        for (int i = 0; i < tokens.size(); i++) {
            if (tokens.get(i).is(type)) {
                return i;
            }
        }
        return -1;
    }

    private Optional<PrefixedUnit> lookup(String symbol) {
        Optional<FundamentalUnit> fundamental = FundamentalUnit.fromSymbol(symbol);
        if (fundamental.isPresent()) {
            return Optional.of(PrefixedUnit.of(UnitComposition.of(fundamental.get())));
        }
        return registry.find(symbol);
    }

    /** Cursor over the tokens of one formula. */
    private final class Run {

        private final String text;
        private final List<UnitToken> tokens;
        private int index;

        Run(String text, List<UnitToken> tokens, int index) {
            this.text = text;
            this.tokens = tokens;
            this.index = index;
        }

        PrefixedUnit expr() {
            PrefixedUnit result = term();
            while (peek().is(UnitToken.Type.STAR) || peek().is(UnitToken.Type.SLASH)) {
                boolean multiply = advance().is(UnitToken.Type.STAR);
                PrefixedUnit next = term();
                result = multiply ? result.multiply(next) : result.divide(next);
            }
            return result;
        }

        private PrefixedUnit term() {
            PrefixedUnit base = factor();
            if (peek().is(UnitToken.Type.POWER)) {
                advance();
                int position = peek().position();
                int exponent = exponent();
                try {
                    return base.power(exponent);
                } catch (InvalidExponentException e) {
                    throw new InvalidExponentException(e.getMessage(), text, position);
                }
            }
            return base;
        }

        private PrefixedUnit factor() {
            UnitToken token = peek();
            return switch (token.type()) {
                case LPAREN -> group(UnitToken.Type.RPAREN);
                case LBRACKET -> group(UnitToken.Type.RBRACKET);
                case IDENT -> {
                    advance();
                    yield resolve(token);
                }
                case NUMBER -> {
                    advance();
                    yield number(token);
                }
                case END -> throw new UnitSyntaxException("Missing operand", text, token.position());
                default -> throw new UnexpectedTokenException(
                        token.describe(), "a unit, number or '('", text, token.position());
            };
        }

        private PrefixedUnit group(UnitToken.Type closing) {
            UnitToken open = advance();
            PrefixedUnit inner = expr();
            UnitToken close = peek();
            if (close.is(closing)) {
                advance();
                return inner;
            }
            if (close.is(UnitToken.Type.END)) {
                throw new UnitSyntaxException("Unterminated group opened at position " + open.position(), text, close.position());
            }
            String expected = closing == UnitToken.Type.RPAREN ? "')'" : "']'";
            throw new UnexpectedTokenException(close.describe(), expected, text, close.position());
        }

        private int exponent() {
            UnitToken token = peek();
            String sign = "";
            if (token.is(UnitToken.Type.PLUS) || token.is(UnitToken.Type.MINUS)) {
                sign = token.is(UnitToken.Type.MINUS) ? "-" : "";
                advance();
                token = peek();
            }
            if (!token.is(UnitToken.Type.NUMBER)) {
                throw new InvalidExponentException("Missing integer exponent before '" + token.describe() + "'", text, token.position());
            }
            advance();
            if (token.text().indexOf('.') >= 0) {
                throw new InvalidExponentException("Exponent must be an integer, was " + token.text(), text, token.position());
            }
            try {
                return Integer.parseInt(sign + token.text());
            } catch (NumberFormatException e) {
                throw new InvalidExponentException("Exponent out of range: " + sign + token.text(), text, token.position());
            }
        }

        private PrefixedUnit resolve(UnitToken token) {
            String symbol = token.text();
            Optional<PrefixedUnit> whole = lookup(symbol);
            if (whole.isPresent()) {
                return whole.get();
            }
            for (Prefix prefix : Prefix.LONGEST_FIRST) {
                if (symbol.length() > prefix.symbol().length() && symbol.startsWith(prefix.symbol())) {
                    Optional<PrefixedUnit> base = lookup(symbol.substring(prefix.symbol().length()));
                    if (base.isPresent()) {
                        return base.get().multiply(PrefixedUnit.of(UnitComposition.dimensionless(), prefix.factor()));
                    }
                }
            }
            throw new UnknownUnitSymbolException(symbol, text, token.position());
        }

        private PrefixedUnit number(UnitToken token) {
            BigDecimal value = new BigDecimal(token.text());
            if (value.signum() <= 0) {
                throw new UnitSyntaxException("Numeric factor must be positive", text, token.position());
            }
            try {
                return PrefixedUnit.of(UnitComposition.dimensionless(), value);
            } catch (InvalidExponentException e) {
                throw new InvalidExponentException(e.getMessage(), text, token.position());
            }
        }

        void expectEnd() {
            UnitToken token = peek();
            if (!token.is(UnitToken.Type.END)) {
                throw new UnexpectedTokenException(token.describe(), "'*', '/' or end of formula", text, token.position());
            }
        }

        private UnitToken peek() {
            return tokens.get(index);
        }

        private UnitToken advance() {
            UnitToken token = tokens.get(index);
            if (!token.is(UnitToken.Type.END)) {
                index++;
            }
            return token;
        }
    }
}
