package com.pipesql.sql.pq;

import java.util.List;

/**
 * A partitioned query: the CTEs in definition order and the main relation.
 */
public record SqlQuery(List<Cte> ctes, SqlRelation main) {
    public SqlQuery {
        ctes = List.copyOf(ctes);
    }
}
