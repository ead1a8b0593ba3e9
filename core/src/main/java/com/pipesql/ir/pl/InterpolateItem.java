package com.pipesql.ir.pl;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.List;

/**
 * A piece of an s-string or f-string.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.WRAPPER_OBJECT)
@JsonSubTypes({
    @JsonSubTypes.Type(value = InterpolateItem.Text.class, name = "String"),
    @JsonSubTypes.Type(value = InterpolateItem.Expression.class, name = "Expr")
})
public sealed interface InterpolateItem {

    record Text(String text) implements InterpolateItem {}

    record Expression(Expr expr, String format) implements InterpolateItem {}

    static String display(List<InterpolateItem> items) {
        StringBuilder sb = new StringBuilder();
        for (InterpolateItem item : items) {
            if (item instanceof Text text) {
                sb.append(text.text().replace("{", "{{").replace("}", "}}"));
            } else {
                Expression expression = (Expression) item;
                sb.append('{').append(expression.expr());
                if (expression.format() != null) {
                    sb.append(':').append(expression.format());
                }
                sb.append('}');
            }
        }
        return sb.toString();
    }
}
