package com.pipesql.ir.rq;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * A table of the query: an external table, a named relation or an inline one.
 *
 * @param id table id, unique within the query
 * @param name name of the relation when it was declared with {@code let}, or null
 * @param relation how the rows are produced
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TableDecl(int id, String name, Relation relation) {
}
