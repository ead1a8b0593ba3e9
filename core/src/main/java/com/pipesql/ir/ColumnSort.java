package com.pipesql.ir;

import java.util.Objects;

/**
 * A sort key: the column (an expression or a column id) and its direction.
 */
public record ColumnSort<T>(SortDirection direction, T column) {

    public ColumnSort {
        Objects.requireNonNull(direction, "direction must not be null");
        Objects.requireNonNull(column, "column must not be null");
    }

    public static <T> ColumnSort<T> asc(T column) {
        return new ColumnSort<>(SortDirection.ASC, column);
    }

    public <U> ColumnSort<U> withColumn(U other) {
        return new ColumnSort<>(direction, other);
    }
}
