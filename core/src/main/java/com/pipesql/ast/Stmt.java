package com.pipesql.ast;

import com.pipesql.diagnostic.Span;
import com.pipesql.ir.QueryDef;

import java.util.List;
import java.util.Objects;

/**
 * A top-level or module-level statement of the parser representation.
 */
public record Stmt(StmtKind kind, Span span, List<Expr> annotations) {

    public Stmt {
        Objects.requireNonNull(kind, "kind must not be null");
        annotations = annotations == null ? List.of() : List.copyOf(annotations);
    }

    public sealed interface StmtKind {
        /** {@code let}, {@code into} or the main pipeline. */
        record VarDef(VarDefKind kind, String name, Expr value) implements StmtKind {}

        record ModuleDef(String name, List<Stmt> stmts) implements StmtKind {
            public ModuleDef {
                stmts = List.copyOf(stmts);
            }
        }

        record Header(QueryDef def) implements StmtKind {}
    }

    public enum VarDefKind {
        LET,
        INTO,
        MAIN
    }
}
