package com.pipesql.ir.rq;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.WRAPPER_OBJECT)
@JsonSubTypes({
    @JsonSubTypes.Type(value = InterpolateItem.Text.class, name = "String"),
    @JsonSubTypes.Type(value = InterpolateItem.Expression.class, name = "Expr")
})
public sealed interface InterpolateItem {

    record Text(String text) implements InterpolateItem {}

    record Expression(Expr expr) implements InterpolateItem {}
}
