package com.pipesql.sql.pq;

/**
 * What a relation instance reads: a table or CTE by id, or an inline sub-query.
 */
public sealed interface RelationExpr {

    record Ref(int tid) implements RelationExpr {}

    record SubQuery(SqlRelation relation) implements RelationExpr {}
}
