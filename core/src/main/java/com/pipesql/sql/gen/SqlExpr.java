package com.pipesql.sql.gen;

/**
 * A rendered SQL expression with the information needed to nest it in another one.
 *
 * @param text the SQL text
 * @param strength binding strength of the top-level operator; higher binds tighter
 * @param associativity associativity of the top-level operator
 * @param windowFrame whether a window frame may follow this expression in an OVER clause
 * @param identName unquoted column name when the expression is a plain identifier, otherwise null
 */
public record SqlExpr(String text, int strength, Associativity associativity, boolean windowFrame,
                      String identName) {

    /** Strength of function calls, literals and identifiers. */
    public static final int ATOM = 20;
    /** Strength of text inserted as is, such as s-strings. */
    public static final int SOURCE = 100;

    public enum Associativity {
        LEFT,
        BOTH,
        RIGHT
    }

    public static SqlExpr atom(String text) {
        return new SqlExpr(text, ATOM, Associativity.BOTH, true, null);
    }

    public static SqlExpr source(String text) {
        return new SqlExpr(text, SOURCE, Associativity.BOTH, true, null);
    }

    public static SqlExpr of(String text, int strength) {
        return new SqlExpr(text, strength, Associativity.BOTH, true, null);
    }

    public static SqlExpr ident(String text, String name) {
        return new SqlExpr(text, ATOM, Associativity.BOTH, true, name);
    }

    public SqlExpr withWindowFrame(boolean allowed) {
        return new SqlExpr(text, strength, associativity, allowed, identName);
    }

    @Override
    public String toString() {
        return text;
    }
}
