package com.pipesql.sql.pq;

import com.pipesql.ir.rq.RelationColumn;
import com.pipesql.ir.rq.Transform;

/**
 * Where a column id is defined: a column of a relation instance or a compute.
 */
public sealed interface ColumnDecl {

    record OfRelation(int riid, int cid, RelationColumn column) implements ColumnDecl {
        public boolean isWildcard() {
            return column instanceof RelationColumn.Wildcard;
        }
    }

    record OfCompute(Transform.Compute compute) implements ColumnDecl {}
}
