package com.dimensional.units;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Splits a unit formula into {@link UnitToken}s. Whitespace between tokens is ignored.
 *
 * <p>Identifiers are runs of letters, {@code _} and {@code °}; numbers are runs of digits with
 * at most one decimal point.
 */
public final class UnitLexer {

    private final String text;
    private int pos;

    public UnitLexer(String text) {
        this.text = Objects.requireNonNull(text, "text must not be null");
    }

    /**
     * Tokenizes the whole formula. The returned list always ends with an {@link
     * UnitToken.Type#END} token.
     *
     * @throws LexException on a character that cannot start a token
     * @throws UnitSyntaxException on a malformed number such as "1.2.3"
     */
    public List<UnitToken> tokenize() {
        List<UnitToken> tokens = new ArrayList<>();
        pos = 0;
        while (true) {
            skipWhitespace();
            if (pos >= text.length()) {
                tokens.add(new UnitToken(UnitToken.Type.END, "", pos));
                return tokens;
            }
            tokens.add(next());
        }
    }

    private UnitToken next() {
        int start = pos;
        char ch = text.charAt(pos);
        if (Character.isDigit(ch) || ch == '.') {
            return number(start);
        }
        if (isIdentifierChar(ch)) {
            while (pos < text.length() && isIdentifierChar(text.charAt(pos))) {
                pos++;
            }
            return new UnitToken(UnitToken.Type.IDENT, text.substring(start, pos), start);
        }
        pos++;
        return switch (ch) {
            case '*' -> {
                if (pos < text.length() && text.charAt(pos) == '*') {
                    pos++;
                    yield new UnitToken(UnitToken.Type.POWER, "**", start);
                }
                yield new UnitToken(UnitToken.Type.STAR, "*", start);
            }
            case '^' -> new UnitToken(UnitToken.Type.POWER, "^", start);
            case '/' -> new UnitToken(UnitToken.Type.SLASH, "/", start);
            case '+' -> new UnitToken(UnitToken.Type.PLUS, "+", start);
            case '-' -> new UnitToken(UnitToken.Type.MINUS, "-", start);
            case '(' -> new UnitToken(UnitToken.Type.LPAREN, "(", start);
            case ')' -> new UnitToken(UnitToken.Type.RPAREN, ")", start);
            case '[' -> new UnitToken(UnitToken.Type.LBRACKET, "[", start);
            case ']' -> new UnitToken(UnitToken.Type.RBRACKET, "]", start);
            case '=' -> new UnitToken(UnitToken.Type.EQUALS, "=", start);
            default -> throw new LexException(ch, text, start);
        };
    }

    private UnitToken number(int start) {
        boolean dot = false;
        boolean digit = false;
        while (pos < text.length()) {
            char c = text.charAt(pos);
            if (Character.isDigit(c)) {
                digit = true;
            } else if (c == '.') {
                if (dot) {
                    throw new UnitSyntaxException("Malformed number", text, start);
                }
                dot = true;
            } else {
                break;
            }
            pos++;
        }
        if (!digit) {
            throw new UnitSyntaxException("Malformed number", text, start);
        }
        return new UnitToken(UnitToken.Type.NUMBER, text.substring(start, pos), start);
    }

    private void skipWhitespace() {
        while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) {
            pos++;
        }
    }

    /** Characters allowed in unit symbols and alias names. */
    static boolean isIdentifierChar(char ch) {
        return Character.isLetter(ch) || ch == '_' || ch == '°';
    }

    /** True when {@code name} lexes as exactly one identifier. */
    static boolean isIdentifier(String name) {
        if (name == null || name.isEmpty()) {
            return false;
        }
        for (int i = 0; i < name.length(); i++) {
            if (!isIdentifierChar(name.charAt(i))) {
                return false;
            }
        }
        return true;
    }
}
