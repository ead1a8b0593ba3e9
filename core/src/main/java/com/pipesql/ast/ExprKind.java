package com.pipesql.ast;

import com.pipesql.ir.Literal;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Variants of parser representation nodes.
 */
public sealed interface ExprKind {

    /** Dotted identifier such as {@code employees.salary} or {@code e.*}. */
    record Ident(List<String> parts) implements ExprKind {
        public Ident {
            parts = List.copyOf(parts);
        }

        @Override
        public String toString() {
            return String.join(".", parts);
        }
    }

    record Lit(Literal value) implements ExprKind {
        @Override
        public String toString() {
            return value.toString();
        }
    }

    record Tuple(List<Expr> fields) implements ExprKind {
        public Tuple {
            fields = List.copyOf(fields);
        }

        @Override
        public String toString() {
            return fields.stream().map(Expr::toString).collect(Collectors.joining(", ", "{", "}"));
        }
    }

    record Array(List<Expr> items) implements ExprKind {
        public Array {
            items = List.copyOf(items);
        }

        @Override
        public String toString() {
            return items.stream().map(Expr::toString).collect(Collectors.joining(", ", "[", "]"));
        }
    }

    /** Range with optional bounds; null bounds are open. */
    record Range(Expr start, Expr end) implements ExprKind {
        @Override
        public String toString() {
            return (start == null ? "" : start.toString()) + ".." + (end == null ? "" : end.toString());
        }
    }

    record Pipeline(List<Expr> exprs) implements ExprKind {
        public Pipeline {
            exprs = List.copyOf(exprs);
        }

        @Override
        public String toString() {
            return exprs.stream().map(Expr::toString).collect(Collectors.joining(" | ", "(", ")"));
        }
    }

    record FuncCall(Expr name, List<Expr> args, Map<String, Expr> namedArgs) implements ExprKind {
        public FuncCall {
            args = List.copyOf(args);
            namedArgs = Collections.unmodifiableMap(new LinkedHashMap<>(namedArgs));
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder(name.toString());
            namedArgs.forEach((k, v) -> sb.append(' ').append(k).append(':').append(v));
            args.forEach(a -> sb.append(' ').append(a));
            return sb.toString();
        }
    }

    record Func(List<FuncParam> params, List<FuncParam> namedParams, Expr body) implements ExprKind {
        public Func {
            params = List.copyOf(params);
            namedParams = List.copyOf(namedParams);
        }

        @Override
        public String toString() {
            return "func -> " + body;
        }
    }

    record Binary(Expr left, BinOp op, Expr right) implements ExprKind {
        @Override
        public String toString() {
            return "(" + left + " " + op.symbol() + " " + right + ")";
        }
    }

    record Unary(UnOp op, Expr expr) implements ExprKind {
        @Override
        public String toString() {
            return op.symbol() + expr;
        }
    }

    record SString(List<InterpolateItem> items) implements ExprKind {
        public SString {
            items = List.copyOf(items);
        }
    }

    record FString(List<InterpolateItem> items) implements ExprKind {
        public FString {
            items = List.copyOf(items);
        }
    }

    record Case(List<SwitchCase> cases) implements ExprKind {
        public Case {
            cases = List.copyOf(cases);
        }
    }

    record Param(String name) implements ExprKind {
        @Override
        public String toString() {
            return "$" + name;
        }
    }

    /** Parameter of a function definition; {@code defaultValue} is set for named parameters. */
    record FuncParam(String name, Expr defaultValue) {}

    record SwitchCase(Expr condition, Expr value) {}

    sealed interface InterpolateItem {
        record Text(String text) implements InterpolateItem {}

        record Expression(Expr expr, String format) implements InterpolateItem {}
    }
}
