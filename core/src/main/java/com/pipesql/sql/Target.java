package com.pipesql.sql;

import com.pipesql.exception.CodegenException;
import com.pipesql.ir.QueryDef;

import java.util.ArrayList;
import java.util.List;

/**
 * A compilation target: one SQL dialect, or {@code sql.any} which defers to the
 * target declared in the query header.
 */
public final class Target {

    public static final String PREFIX = "sql.";
    public static final String ANY_NAME = "sql.any";

    public static final Target ANY = new Target(null);

    private final Dialect dialect;

    private Target(Dialect dialect) {
        this.dialect = dialect;
    }

    public static Target of(Dialect dialect) {
        return new Target(dialect);
    }

    /**
     * Parses a target name such as {@code sql.postgres}.
     *
     * @throws IllegalArgumentException if the name is not a known target
     */
    public static Target parse(String value) {
        if (value == null) {
            return ANY;
        }
        return switch (value.trim().toLowerCase()) {
            case "sql.any" -> ANY;
            case "sql.generic" -> of(Dialect.GENERIC);
            case "sql.ansi" -> of(Dialect.ANSI);
            case "sql.bigquery" -> of(Dialect.BIGQUERY);
            case "sql.clickhouse" -> of(Dialect.CLICKHOUSE);
            case "sql.duckdb" -> of(Dialect.DUCKDB);
            case "sql.glaredb" -> of(Dialect.GLAREDB);
            case "sql.mssql" -> of(Dialect.MSSQL);
            case "sql.mysql" -> of(Dialect.MYSQL);
            case "sql.postgres" -> of(Dialect.POSTGRES);
            case "sql.sqlite" -> of(Dialect.SQLITE);
            case "sql.snowflake" -> of(Dialect.SNOWFLAKE);
            default -> throw new IllegalArgumentException(
                "Unknown target: '%s'. Valid values: %s".formatted(value, String.join(", ", names())));
        };
    }

    /** Returns every accepted target name. */
    public static List<String> names() {
        List<String> names = new ArrayList<>();
        names.add(ANY_NAME);
        for (Dialect d : Dialect.values()) {
            names.add(d.targetName());
        }
        return names;
    }

    public boolean isAny() {
        return dialect == null;
    }

    /** Returns the dialect, or null for {@code sql.any}. */
    public Dialect dialect() {
        return dialect;
    }

    /**
     * Picks the dialect to generate: this target unless it is {@code sql.any},
     * then the target of the query header, then {@link Dialect#GENERIC}.
     *
     * @throws CodegenException if the header names an unknown target
     */
    public Dialect resolve(QueryDef def) {
        if (dialect != null) {
            return dialect;
        }
        if (def != null && def.target() != null) {
            try {
                Target declared = parse(def.target());
                if (!declared.isAny()) {
                    return declared.dialect;
                }
            } catch (IllegalArgumentException e) {
                throw new CodegenException(e.getMessage(), e);
            }
        }
        return Dialect.GENERIC;
    }

    public String name() {
        return dialect == null ? ANY_NAME : dialect.targetName();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Target other && other.dialect == dialect;
    }

    @Override
    public int hashCode() {
        return dialect == null ? 0 : dialect.hashCode();
    }

    @Override
    public String toString() {
        return name();
    }
}
