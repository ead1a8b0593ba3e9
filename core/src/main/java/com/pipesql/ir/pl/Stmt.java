package com.pipesql.ir.pl;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.pipesql.diagnostic.Span;
import com.pipesql.ir.QueryDef;

import java.util.List;
import java.util.Objects;

/**
 * A statement of the pipelined language.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record Stmt(StmtKind kind, Span span, List<Expr> annotations) {

    public Stmt {
        Objects.requireNonNull(kind, "kind must not be null");
        annotations = annotations == null ? List.of() : List.copyOf(annotations);
    }

    @JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.WRAPPER_OBJECT)
    @JsonSubTypes({
        @JsonSubTypes.Type(value = StmtKind.VarDef.class, name = "VarDef"),
        @JsonSubTypes.Type(value = StmtKind.ModuleDef.class, name = "ModuleDef"),
        @JsonSubTypes.Type(value = StmtKind.QueryDefStmt.class, name = "QueryDef")
    })
    public sealed interface StmtKind {

        record VarDef(VarDefKind kind, String name, Expr value) implements StmtKind {}

        record ModuleDef(String name, List<Stmt> stmts) implements StmtKind {
            public ModuleDef {
                stmts = List.copyOf(stmts);
            }
        }

        record QueryDefStmt(QueryDef def) implements StmtKind {}
    }

    public enum VarDefKind {
        LET,
        INTO,
        MAIN
    }
}
