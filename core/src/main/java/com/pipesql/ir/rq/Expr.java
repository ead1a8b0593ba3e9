package com.pipesql.ir.rq;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.pipesql.diagnostic.Span;

import java.util.Objects;

/**
 * A scalar expression of the relational query.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Expr(ExprKind kind, Span span) {

    public Expr {
        Objects.requireNonNull(kind, "kind must not be null");
    }

    public static Expr of(ExprKind kind) {
        return new Expr(kind, null);
    }

    public static Expr columnRef(int cid) {
        return new Expr(new ExprKind.ColumnRef(cid), null);
    }

    public Expr withKind(ExprKind newKind) {
        return new Expr(newKind, span);
    }

    @Override
    public String toString() {
        return kind.toString();
    }
}
