package com.pipesql.ir.rq;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * An instance of a table within a pipeline, with a fresh column id for each of
 * the table's columns.
 *
 * @param source id of the referenced table
 * @param columns table columns and the ids they have in this instance
 * @param name local name of the instance, or null
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TableRef(int source, List<TableColumn> columns, String name) {

    public TableRef {
        columns = List.copyOf(columns);
    }

    public record TableColumn(RelationColumn column, int cid) {}
}
