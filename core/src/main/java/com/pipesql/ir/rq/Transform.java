package com.pipesql.ir.rq;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.pipesql.ir.ColumnSort;
import com.pipesql.ir.JoinSide;

import java.util.List;
import java.util.Objects;

/**
 * The fixed vocabulary of relational transforms. Columns are referenced by id.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.WRAPPER_OBJECT)
@JsonSubTypes({
    @JsonSubTypes.Type(value = Transform.From.class, name = "From"),
    @JsonSubTypes.Type(value = Transform.Compute.class, name = "Compute"),
    @JsonSubTypes.Type(value = Transform.Select.class, name = "Select"),
    @JsonSubTypes.Type(value = Transform.Filter.class, name = "Filter"),
    @JsonSubTypes.Type(value = Transform.Aggregate.class, name = "Aggregate"),
    @JsonSubTypes.Type(value = Transform.Sort.class, name = "Sort"),
    @JsonSubTypes.Type(value = Transform.Take.class, name = "Take"),
    @JsonSubTypes.Type(value = Transform.Join.class, name = "Join"),
    @JsonSubTypes.Type(value = Transform.Append.class, name = "Append"),
    @JsonSubTypes.Type(value = Transform.Loop.class, name = "Loop")
})
public sealed interface Transform {

    record From(TableRef table) implements Transform {}

    /**
     * Defines column {@code id}. A window makes it a window function; aggregation
     * computes are only valid inside an {@link Aggregate}.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    record Compute(int id, Expr expr, Window window,
                   @JsonProperty("is_aggregation") boolean isAggregation) implements Transform {
        public Compute {
            Objects.requireNonNull(expr, "expr must not be null");
        }
    }

    record Select(List<Integer> columns) implements Transform {
        public Select {
            columns = List.copyOf(columns);
        }
    }

    record Filter(Expr condition) implements Transform {}

    record Aggregate(List<Integer> partition, List<Integer> compute) implements Transform {
        public Aggregate {
            partition = List.copyOf(partition);
            compute = List.copyOf(compute);
        }
    }

    record Sort(List<ColumnSort<Integer>> by) implements Transform {
        public Sort {
            by = List.copyOf(by);
        }
    }

    record Take(Range range, List<Integer> partition, List<ColumnSort<Integer>> sort) implements Transform {
        public Take {
            Objects.requireNonNull(range, "range must not be null");
            partition = partition == null ? List.of() : List.copyOf(partition);
            sort = sort == null ? List.of() : List.copyOf(sort);
        }
    }

    record Join(JoinSide side, TableRef with, Expr filter) implements Transform {}

    record Append(TableRef bottom) implements Transform {}

    /** Recursive union: the initial rows, then {@code pipeline} applied until no new rows appear. */
    record Loop(List<Transform> pipeline) implements Transform {
        public Loop {
            pipeline = List.copyOf(pipeline);
        }
    }
}
