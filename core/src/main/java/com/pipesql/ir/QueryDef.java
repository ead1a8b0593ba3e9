package com.pipesql.ir;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Contents of the {@code prql} header of a query.
 *
 * @param version required compiler version, or null
 * @param target dialect declared in the source, such as {@code sql.postgres}, or null
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record QueryDef(String version, String target) {

    public static final QueryDef EMPTY = new QueryDef(null, null);
}
