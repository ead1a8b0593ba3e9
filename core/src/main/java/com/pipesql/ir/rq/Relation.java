package com.pipesql.ir.rq;

import java.util.List;
import java.util.Objects;

/**
 * Rows produced by a source, with the columns they expose.
 */
public record Relation(RelationKind kind, List<RelationColumn> columns) {

    public Relation {
        Objects.requireNonNull(kind, "kind must not be null");
        columns = columns == null ? List.of() : List.copyOf(columns);
    }
}
