package com.pipesql.sql.pq;

import com.pipesql.ir.rq.InterpolateItem;
import com.pipesql.ir.rq.RelationKind;

import java.util.List;

/**
 * Body of one SQL query: a pipeline that fits a single SELECT, rows written in
 * the query, or a raw SQL string.
 */
public sealed interface SqlRelation {

    record AtomicPipeline(List<SqlTransform> transforms) implements SqlRelation {
        public AtomicPipeline {
            transforms = List.copyOf(transforms);
        }
    }

    record Literal(RelationKind.Literal data) implements SqlRelation {}

    record SString(List<InterpolateItem> items) implements SqlRelation {
        public SString {
            items = List.copyOf(items);
        }
    }
}
