package com.pipesql.ir.rq;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.pipesql.ir.Literal;

import java.util.List;
import java.util.stream.Collectors;

@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.WRAPPER_OBJECT)
@JsonSubTypes({
    @JsonSubTypes.Type(value = ExprKind.ColumnRef.class, name = "ColumnRef"),
    @JsonSubTypes.Type(value = ExprKind.Lit.class, name = "Literal"),
    @JsonSubTypes.Type(value = ExprKind.SString.class, name = "SString"),
    @JsonSubTypes.Type(value = ExprKind.Case.class, name = "Case"),
    @JsonSubTypes.Type(value = ExprKind.Operator.class, name = "Operator"),
    @JsonSubTypes.Type(value = ExprKind.Param.class, name = "Param"),
    @JsonSubTypes.Type(value = ExprKind.Array.class, name = "Array")
})
public sealed interface ExprKind {

    record ColumnRef(int cid) implements ExprKind {
        @Override
        public String toString() {
            return "col" + cid;
        }
    }

    record Lit(Literal value) implements ExprKind {
        @Override
        public String toString() {
            return value.toString();
        }
    }

    record SString(List<InterpolateItem> items) implements ExprKind {
        public SString {
            items = List.copyOf(items);
        }

        public static SString raw(String text) {
            return new SString(List.of(new InterpolateItem.Text(text)));
        }
    }

    record Case(List<SwitchCase> cases) implements ExprKind {
        public Case {
            cases = List.copyOf(cases);
        }
    }

    /** Call of a standard library function such as {@code std.add}. */
    record Operator(String name, List<Expr> args) implements ExprKind {
        public Operator {
            args = List.copyOf(args);
        }

        @Override
        public String toString() {
            return name + args.stream().map(Expr::toString).collect(Collectors.joining(", ", "(", ")"));
        }
    }

    record Param(String name) implements ExprKind {}

    record Array(List<Expr> items) implements ExprKind {
        public Array {
            items = List.copyOf(items);
        }
    }

    record SwitchCase(Expr condition, Expr value) {}
}
