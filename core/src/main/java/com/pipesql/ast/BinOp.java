package com.pipesql.ast;

/**
 * Binary operators of the source language and the standard library functions
 * they stand for.
 */
public enum BinOp {
    MUL("*", "mul"),
    DIV_INT("//", "div_i"),
    DIV_FLOAT("/", "div_f"),
    MOD("%", "mod"),
    POW("**", "pow"),
    ADD("+", "add"),
    SUB("-", "sub"),
    EQ("==", "eq"),
    NE("!=", "ne"),
    GT(">", "gt"),
    LT("<", "lt"),
    GTE(">=", "gte"),
    LTE("<=", "lte"),
    REGEX_SEARCH("~=", "regex_search"),
    AND("&&", "and"),
    OR("||", "or"),
    COALESCE("??", "coalesce");

    private final String symbol;
    private final String stdName;

    BinOp(String symbol, String stdName) {
        this.symbol = symbol;
        this.stdName = stdName;
    }

    public String symbol() {
        return symbol;
    }

    /** Name of the implementing function in the {@code std} module. */
    public String stdName() {
        return stdName;
    }
}
