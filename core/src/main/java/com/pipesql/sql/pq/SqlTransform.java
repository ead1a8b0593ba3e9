package com.pipesql.sql.pq;

import com.pipesql.ir.ColumnSort;
import com.pipesql.ir.JoinSide;
import com.pipesql.ir.rq.Expr;
import com.pipesql.ir.rq.Transform;

import java.util.List;

/**
 * A transform of a partitioned query, close to one SQL clause.
 *
 * <p>Relations are referenced by relation instance id. While a pipeline is being
 * compiled, relational transforms are carried as {@link Super}; once a pipeline
 * fits a single SELECT they are converted to the clause forms and the rest is
 * dropped.
 */
public sealed interface SqlTransform {

    /** Transform not converted yet. */
    record Super(Transform transform) implements SqlTransform {}

    record From(int riid) implements SqlTransform {}

    record Join(JoinSide side, int riid, Expr filter) implements SqlTransform {}

    record Select(List<Integer> columns) implements SqlTransform {
        public Select {
            columns = List.copyOf(columns);
        }
    }

    record Filter(Expr condition) implements SqlTransform {}

    record Aggregate(List<Integer> partition, List<Integer> compute) implements SqlTransform {
        public Aggregate {
            partition = List.copyOf(partition);
            compute = List.copyOf(compute);
        }
    }

    record Sort(List<ColumnSort<Integer>> by) implements SqlTransform {
        public Sort {
            by = List.copyOf(by);
        }
    }

    record Take(Transform.Take take) implements SqlTransform {}

    record Distinct() implements SqlTransform {}

    record DistinctOn(List<Integer> columns) implements SqlTransform {
        public DistinctOn {
            columns = List.copyOf(columns);
        }
    }

    record Union(int bottom, boolean distinct) implements SqlTransform {}

    record Except(int bottom, boolean distinct) implements SqlTransform {}

    record Intersect(int bottom, boolean distinct) implements SqlTransform {}

    /**
     * Returns the kind name used by the splitting rules: the relational transform's
     * name for {@link Super}, the clause name otherwise.
     */
    public static String kindName(SqlTransform t) {
        if (t instanceof Super s) {
            return s.transform().getClass().getSimpleName();
        }
        return t.getClass().getSimpleName();
    }

    /** Returns the relational transform of a {@link Super}, or null. */
    static Transform superOf(SqlTransform t) {
        return t instanceof Super s ? s.transform() : null;
    }
}
