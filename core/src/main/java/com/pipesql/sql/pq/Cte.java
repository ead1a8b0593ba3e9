package com.pipesql.sql.pq;

/**
 * A common table expression of the final query.
 */
public record Cte(int tid, Kind kind) {

    public sealed interface Kind {}

    public record Normal(SqlRelation relation) implements Kind {}

    /** {@code WITH RECURSIVE}: the initial rows, then the step applied until no new rows appear. */
    public record Loop(SqlRelation initial, SqlRelation step) implements Kind {}
}
