package com.pipesql.ir.pl;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.pipesql.diagnostic.Span;

import java.util.Objects;

/**
 * A node of the pipelined language.
 *
 * <p>The kind, span and alias come from the source. The remaining fields are
 * filled in by the resolver: the node id, the id of the declaration an identifier
 * points to, the lineage of relation-valued nodes, and whether a function call
 * has to be evaluated over a window.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class Expr {

    @JsonProperty("kind")
    private final ExprKind kind;

    @JsonProperty("span")
    private Span span;

    @JsonProperty("alias")
    private String alias;

    @JsonProperty("id")
    private Integer id;

    @JsonProperty("target_id")
    private Integer targetId;

    @JsonProperty("lineage")
    private Lineage lineage;

    @JsonProperty("needs_window")
    @JsonInclude(JsonInclude.Include.NON_DEFAULT)
    private boolean needsWindow;

    @JsonCreator
    public Expr(@JsonProperty("kind") ExprKind kind) {
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
    }

    public Expr(ExprKind kind, Span span) {
        this(kind);
        this.span = span;
    }

    /**
     * Returns a copy with another kind, keeping span, alias and resolver annotations.
     */
    public Expr withKind(ExprKind newKind) {
        Expr copy = new Expr(newKind, span);
        copy.alias = alias;
        copy.id = id;
        copy.targetId = targetId;
        copy.lineage = lineage;
        copy.needsWindow = needsWindow;
        return copy;
    }

    public Expr copy() {
        Expr copy = withKind(kind);
        copy.lineage = lineage == null ? null : lineage.copy();
        return copy;
    }

    public ExprKind kind() {
        return kind;
    }

    public Span span() {
        return span;
    }

    public Expr span(Span newSpan) {
        this.span = newSpan;
        return this;
    }

    public String alias() {
        return alias;
    }

    public Expr alias(String newAlias) {
        this.alias = newAlias;
        return this;
    }

    public Integer id() {
        return id;
    }

    public Expr id(Integer newId) {
        this.id = newId;
        return this;
    }

    public Integer targetId() {
        return targetId;
    }

    public Expr targetId(Integer newTargetId) {
        this.targetId = newTargetId;
        return this;
    }

    public Lineage lineage() {
        return lineage;
    }

    public Expr lineage(Lineage newLineage) {
        this.lineage = newLineage;
        return this;
    }

    /**
     * Returns true when this node evaluates to a relation.
     */
    @JsonIgnore
    public boolean isRelation() {
        return lineage != null;
    }

    public boolean needsWindow() {
        return needsWindow;
    }

    public Expr needsWindow(boolean value) {
        this.needsWindow = value;
        return this;
    }

    @Override
    public String toString() {
        return alias == null ? kind.toString() : alias + " = " + kind;
    }
}
