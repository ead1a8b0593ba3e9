package com.pipesql.ast;

/**
 * Unary operators of the source language.
 */
public enum UnOp {
    NEG("-"),
    NOT("!"),
    ADD("+"),
    /** {@code ==col}, shorthand for comparing a column of both sides of a join. */
    EQ_SELF("==");

    private final String symbol;

    UnOp(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }
}
