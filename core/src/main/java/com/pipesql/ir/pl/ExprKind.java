package com.pipesql.ir.pl;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.pipesql.ir.ColumnSort;
import com.pipesql.ir.Literal;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Variants of pipelined language nodes.
 *
 * <p>The first group is produced by the expander; {@link All}, {@link RqOperator}
 * and {@link TransformCall} only appear after resolution.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.WRAPPER_OBJECT)
@JsonSubTypes({
    @JsonSubTypes.Type(value = ExprKind.Ident.class, name = "Ident"),
    @JsonSubTypes.Type(value = ExprKind.Lit.class, name = "Literal"),
    @JsonSubTypes.Type(value = ExprKind.Tuple.class, name = "Tuple"),
    @JsonSubTypes.Type(value = ExprKind.Array.class, name = "Array"),
    @JsonSubTypes.Type(value = ExprKind.Range.class, name = "Range"),
    @JsonSubTypes.Type(value = ExprKind.Pipeline.class, name = "Pipeline"),
    @JsonSubTypes.Type(value = ExprKind.FuncCall.class, name = "FuncCall"),
    @JsonSubTypes.Type(value = ExprKind.Func.class, name = "Func"),
    @JsonSubTypes.Type(value = ExprKind.SString.class, name = "SString"),
    @JsonSubTypes.Type(value = ExprKind.FString.class, name = "FString"),
    @JsonSubTypes.Type(value = ExprKind.Case.class, name = "Case"),
    @JsonSubTypes.Type(value = ExprKind.Param.class, name = "Param"),
    @JsonSubTypes.Type(value = ExprKind.All.class, name = "All"),
    @JsonSubTypes.Type(value = ExprKind.RqOperator.class, name = "RqOperator"),
    @JsonSubTypes.Type(value = ExprKind.TransformCall.class, name = "TransformCall")
})
public sealed interface ExprKind {

    record Ident(List<String> parts) implements ExprKind {
        public Ident {
            parts = List.copyOf(parts);
        }

        public static Ident of(String... parts) {
            return new Ident(List.of(parts));
        }

        public String name() {
            return parts.get(parts.size() - 1);
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
        public static final Range UNBOUNDED = new Range(null, null);

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
            namedArgs = namedArgs == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(namedArgs));
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
            namedParams = namedParams == null ? List.of() : List.copyOf(namedParams);
        }

        @Override
        public String toString() {
            return params.stream().map(FuncParam::name).collect(Collectors.joining(" ", "func ", " -> "))
                + body;
        }
    }

    record SString(List<InterpolateItem> items) implements ExprKind {
        public SString {
            items = List.copyOf(items);
        }

        @Override
        public String toString() {
            return "s\"" + InterpolateItem.display(items) + "\"";
        }
    }

    record FString(List<InterpolateItem> items) implements ExprKind {
        public FString {
            items = List.copyOf(items);
        }

        @Override
        public String toString() {
            return "f\"" + InterpolateItem.display(items) + "\"";
        }
    }

    record Case(List<SwitchCase> cases) implements ExprKind {
        public Case {
            cases = List.copyOf(cases);
        }

        @Override
        public String toString() {
            return cases.stream()
                .map(c -> c.condition() + " => " + c.value())
                .collect(Collectors.joining(", ", "case [", "]"));
        }
    }

    record Param(String name) implements ExprKind {
        @Override
        public String toString() {
            return "$" + name;
        }
    }

    /**
     * All columns of one input, or of the whole frame when {@code input} is null,
     * minus the excluded names.
     */
    record All(String input, List<String> except) implements ExprKind {
        public All {
            except = except == null ? List.of() : List.copyOf(except);
        }

        @Override
        public String toString() {
            return (input == null ? "this" : input) + ".*";
        }
    }

    /** A resolved call of a standard library function, rendered by the backend. */
    record RqOperator(String name, List<Expr> args) implements ExprKind {
        public RqOperator {
            args = List.copyOf(args);
        }

        @Override
        public String toString() {
            return name + args.stream().map(Expr::toString).collect(Collectors.joining(", ", "(", ")"));
        }
    }

    /**
     * A resolved transform applied to its input relation.
     *
     * <p>{@code partition}, {@code frame} and {@code sort} are empty until the
     * group and window pipelines are flattened.
     */
    record TransformCall(Expr input, TransformKind kind, List<Expr> partition,
                         WindowFrame frame, List<ColumnSort<Expr>> sort) implements ExprKind {
        public TransformCall {
            partition = partition == null ? List.of() : List.copyOf(partition);
            frame = frame == null ? WindowFrame.DEFAULT : frame;
            sort = sort == null ? List.of() : List.copyOf(sort);
        }

        public TransformCall(Expr input, TransformKind kind) {
            this(input, kind, List.of(), WindowFrame.DEFAULT, List.of());
        }

        @Override
        public String toString() {
            return input + " | " + kind;
        }
    }

    /** Parameter of a function; {@code defaultValue} is set for named parameters. */
    record FuncParam(String name, Expr defaultValue) {}

    record SwitchCase(Expr condition, Expr value) {}
}
