package com.pipesql.ir.rq;

import com.pipesql.ir.QueryDef;

import java.util.List;
import java.util.Objects;

/**
 * The resolved query: declarations of every table it reads and the main relation.
 *
 * <p>Tables are ordered so that each one only refers to tables declared before it.
 */
public record RelationalQuery(QueryDef def, List<TableDecl> tables, Relation relation) {

    public RelationalQuery {
        def = def == null ? QueryDef.EMPTY : def;
        tables = tables == null ? List.of() : List.copyOf(tables);
        Objects.requireNonNull(relation, "relation must not be null");
    }

    public TableDecl table(int id) {
        for (TableDecl table : tables) {
            if (table.id() == id) {
                return table;
            }
        }
        throw new IllegalArgumentException("Unknown table id " + id);
    }
}
