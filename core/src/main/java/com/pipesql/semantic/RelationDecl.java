package com.pipesql.semantic;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.pipesql.ir.Literal;
import com.pipesql.ir.pl.Expr;
import com.pipesql.ir.pl.Lineage;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A relation a query reads from: a database table, a relation declared with
 * {@code let}, rows written inline or an s-string.
 *
 * <p>Database tables and s-strings have unknown columns; every name inferred
 * against their wildcard is recorded so the backend can list it.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public final class RelationDecl {

    public enum Kind {
        /** A database table. */
        EXTERN,
        /** A resolved pipeline. */
        RELATION,
        /** Rows written in the query. */
        LITERAL,
        /** A verbatim SQL query. */
        SSTRING
    }

    @JsonProperty("key")
    private final String key;

    @JsonProperty("kind")
    private final Kind kind;

    @JsonProperty("name")
    private final String name;

    @JsonProperty("expr")
    private final Expr expr;

    @JsonProperty("inferred")
    private final Set<String> inferred = new LinkedHashSet<>();

    @JsonProperty("columns")
    private final List<String> columns;

    @JsonProperty("rows")
    private final List<List<Literal>> rows;

    private RelationDecl(String key, Kind kind, String name, Expr expr,
                         List<String> columns, List<List<Literal>> rows) {
        this.key = Objects.requireNonNull(key, "key must not be null");
        this.kind = kind;
        this.name = name;
        this.expr = expr;
        this.columns = columns == null ? List.of() : List.copyOf(columns);
        this.rows = rows == null ? List.of() : rows;
    }

    public static RelationDecl extern(String key) {
        return new RelationDecl(key, Kind.EXTERN, null, null, null, null);
    }

    /**
     * @param name name the relation was declared with, or null for inline pipelines
     */
    public static RelationDecl relation(String key, String name, Expr expr) {
        return new RelationDecl(key, Kind.RELATION, name, expr, null, null);
    }

    public static RelationDecl literal(String key, List<String> columns, List<List<Literal>> rows) {
        return new RelationDecl(key, Kind.LITERAL, null, null, columns, new ArrayList<>(rows));
    }

    public static RelationDecl sstring(String key, Expr expr) {
        return new RelationDecl(key, Kind.SSTRING, null, expr, null, null);
    }

    public String key() {
        return key;
    }

    public Kind kind() {
        return kind;
    }

    public String name() {
        return name;
    }

    /** The resolved pipeline of a relation, or the s-string of an s-string relation. */
    public Expr expr() {
        return expr;
    }

    /** Parts of the database table name, without the {@code default_db} prefix. */
    public List<String> externParts() {
        List<String> parts = List.of(key.split("\\."));
        return parts.get(0).equals(Module.DEFAULT_DB) ? parts.subList(1, parts.size()) : parts;
    }

    public Lineage lineage() {
        return expr == null ? null : expr.lineage();
    }

    public Set<String> inferred() {
        return inferred;
    }

    public List<String> columns() {
        return columns;
    }

    public List<List<Literal>> rows() {
        return rows;
    }

    @Override
    public String toString() {
        return kind.name().toLowerCase() + " " + key;
    }
}
