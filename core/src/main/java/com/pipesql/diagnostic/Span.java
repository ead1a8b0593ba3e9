package com.pipesql.diagnostic;

/**
 * Half-open range {@code [start, end)} of character offsets into the source text.
 *
 * <p>Spans originate in the lexer and are carried by every AST and IR node so
 * that errors raised in later stages can point back at the original source.
 */
public record Span(int start, int end) {

    public Span {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException(
                "Invalid span [%d, %d)".formatted(start, end));
        }
    }

    public static Span of(int start, int end) {
        return new Span(start, end);
    }

    /**
     * Returns the smallest span covering both spans. Either argument may be null.
     */
    public static Span merge(Span a, Span b) {
        if (a == null) {
            return b;
        }
        if (b == null) {
            return a;
        }
        return new Span(Math.min(a.start, b.start), Math.max(a.end, b.end));
    }

    /**
     * Shifts this span by a fixed offset, used for sub-lexed interpolation bodies.
     */
    public Span shift(int offset) {
        return new Span(start + offset, end + offset);
    }

    public int length() {
        return end - start;
    }

    @Override
    public String toString() {
        return start + ".." + end;
    }
}
