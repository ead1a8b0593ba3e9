package com.pipesql.sql.pq;

import com.pipesql.ir.rq.Relation;
import com.pipesql.ir.rq.RelationColumn;

import java.util.List;

/**
 * A relation that still has to be compiled, at one of the stages it may be in.
 */
public sealed interface RelationAdapter {

    record Rq(Relation relation) implements RelationAdapter {}

    /** Pipeline split off another pipeline, already preprocessed. */
    record Preprocessed(List<SqlTransform> pipeline, List<RelationColumn> columns) implements RelationAdapter {
        public Preprocessed {
            pipeline = List.copyOf(pipeline);
            columns = List.copyOf(columns);
        }
    }

    record Pq(SqlRelation relation) implements RelationAdapter {}
}
