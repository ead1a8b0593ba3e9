package com.pipesql.sql;

/**
 * SQL dialects the compiler can generate, with the syntax each one supports.
 *
 * <p>{@link #GENERIC} and {@link #ANSI} share the default behaviour; the other
 * dialects override single capabilities.
 */
public enum Dialect {
    GENERIC("generic"),
    ANSI("ansi"),
    BIGQUERY("bigquery"),
    CLICKHOUSE("clickhouse"),
    DUCKDB("duckdb"),
    GLAREDB("glaredb"),
    MSSQL("mssql"),
    MYSQL("mysql"),
    POSTGRES("postgres"),
    SQLITE("sqlite"),
    SNOWFLAKE("snowflake");

    /** Syntax for selecting all columns but some. */
    public enum ColumnExclude { EXCLUDE, EXCEPT }

    private final String shortName;

    Dialect(String shortName) {
        this.shortName = shortName;
    }

    public String shortName() {
        return shortName;
    }

    /** Returns the target name, such as {@code sql.postgres}. */
    public String targetName() {
        return Target.PREFIX + shortName;
    }

    // ==================== Limits ====================

    /** Whether a bare limit is written as {@code SELECT TOP (n)}. */
    public boolean useTop() {
        return this == MSSQL;
    }

    /** Whether an offset is written as {@code OFFSET m ROWS FETCH NEXT n ROWS ONLY}. */
    public boolean useFetch() {
        return this == MSSQL;
    }

    // ==================== Identifiers ====================

    public char identQuote() {
        return switch (this) {
            case MYSQL, BIGQUERY, CLICKHOUSE -> '`';
            default -> '"';
        };
    }

    /**
     * Returns the syntax for excluding columns from a wildcard, or null when the
     * dialect has none.
     */
    public ColumnExclude columnExclude() {
        return switch (this) {
            case DUCKDB, SNOWFLAKE -> ColumnExclude.EXCLUDE;
            case BIGQUERY -> ColumnExclude.EXCEPT;
            default -> null;
        };
    }

    // ==================== Set operations ====================

    /** Whether {@code UNION DISTINCT} is accepted, rather than a bare {@code UNION}. */
    public boolean setOpsDistinct() {
        return switch (this) {
            case SQLITE, MSSQL, SNOWFLAKE -> false;
            default -> true;
        };
    }

    public boolean exceptAll() {
        return switch (this) {
            case SQLITE, MSSQL, DUCKDB -> false;
            default -> true;
        };
    }

    public boolean intersectAll() {
        return exceptAll();
    }

    // ==================== Expressions ====================

    /** Whether strings are joined with {@code CONCAT(..)} rather than {@code ||}. */
    public boolean hasConcatFunction() {
        return this != SQLITE;
    }

    /** Whether intervals are written as {@code INTERVAL '1 DAY'}. */
    public boolean requiresQuotedIntervals() {
        return this == POSTGRES || this == GLAREDB;
    }

    /** Whether date and time literals are written with {@code DATE(..)} style functions. */
    public boolean usesDateFunctions() {
        return this == SQLITE;
    }

    // ==================== Projection ====================

    /** Whether {@code GROUP BY} may refer to {@code table.*}. */
    public boolean starsInGroup() {
        return this != SQLITE;
    }

    public boolean supportsDistinctOn() {
        return switch (this) {
            case POSTGRES, DUCKDB -> true;
            default -> false;
        };
    }

    /** Whether a SELECT may have an empty projection. */
    public boolean supportsZeroColumns() {
        return this == POSTGRES;
    }
}
