package com.pipesql.ast;

import com.pipesql.diagnostic.Span;

import java.util.Objects;

/**
 * A node of the parser representation.
 *
 * @param id unique id within one parse
 * @param kind what the node is
 * @param span source range of the node
 * @param alias name given with {@code name = expr}, or null
 */
public record Expr(int id, ExprKind kind, Span span, String alias) {

    public Expr {
        Objects.requireNonNull(kind, "kind must not be null");
    }

    public Expr withAlias(String newAlias) {
        return new Expr(id, kind, span, newAlias);
    }

    @Override
    public String toString() {
        return alias == null ? kind.toString() : alias + " = " + kind;
    }
}
