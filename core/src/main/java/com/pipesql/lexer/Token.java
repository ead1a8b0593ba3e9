package com.pipesql.lexer;

import com.pipesql.diagnostic.Span;

import java.util.List;
import java.util.Objects;

/**
 * A lexical unit with the exact span of the source text it was read from.
 *
 * <p>The {@code value} holds the decoded payload: the identifier name, the
 * unescaped string contents, the normalized number text, the date or time text
 * after {@code @}, the parameter name, or the interpolation prefix character.
 */
public final class Token {

    private final TokenKind kind;
    private final String value;
    private final Span span;
    private final String unit;
    private final boolean bindLeft;
    private final boolean bindRight;
    private final List<InterpolationPart> parts;

    private Token(TokenKind kind, String value, Span span, String unit,
                  boolean bindLeft, boolean bindRight, List<InterpolationPart> parts) {
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.value = value;
        this.span = Objects.requireNonNull(span, "span must not be null");
        this.unit = unit;
        this.bindLeft = bindLeft;
        this.bindRight = bindRight;
        this.parts = parts;
    }

    public static Token of(TokenKind kind, String value, Span span) {
        return new Token(kind, value, span, null, false, false, null);
    }

    public static Token control(TokenKind kind, Span span) {
        return new Token(kind, kind.description(), span, null, false, false, null);
    }

    public static Token valueAndUnit(String number, String unit, Span span) {
        return new Token(TokenKind.VALUE_AND_UNIT, number, span, unit, false, false, null);
    }

    public static Token range(boolean bindLeft, boolean bindRight, Span span) {
        return new Token(TokenKind.RANGE, "..", span, null, bindLeft, bindRight, null);
    }

    public static Token interpolation(char prefix, List<InterpolationPart> parts, Span span) {
        return new Token(TokenKind.INTERPOLATION, String.valueOf(prefix), span, null,
            false, false, List.copyOf(parts));
    }

    public TokenKind kind() {
        return kind;
    }

    public String value() {
        return value;
    }

    public Span span() {
        return span;
    }

    /** Unit of a {@link TokenKind#VALUE_AND_UNIT} token. */
    public String unit() {
        return unit;
    }

    public boolean bindLeft() {
        return bindLeft;
    }

    public boolean bindRight() {
        return bindRight;
    }

    /** Body of an {@link TokenKind#INTERPOLATION} token. */
    public List<InterpolationPart> parts() {
        return parts == null ? List.of() : parts;
    }

    @Override
    public String toString() {
        return switch (kind) {
            case VALUE_AND_UNIT -> kind + "(" + value + unit + ")@" + span;
            case RANGE -> kind + "(" + bindLeft + "," + bindRight + ")@" + span;
            default -> kind + "(" + value + ")@" + span;
        };
    }
}
