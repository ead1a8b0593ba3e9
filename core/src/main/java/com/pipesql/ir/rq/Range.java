package com.pipesql.ir.rq;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Range with optional bounds; null bounds are open.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Range(Expr start, Expr end) {

    public static final Range UNBOUNDED = new Range(null, null);

    @JsonIgnore
    public boolean isUnbounded() {
        return start == null && end == null;
    }
}
