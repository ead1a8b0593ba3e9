package com.pipesql.semantic;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The standard library: transforms, aggregate and window functions, operators
 * and the {@code math} and {@code text} helper modules.
 *
 * <p>Built once when the class is loaded and never modified afterwards, so it is
 * shared by every compilation.
 *
 * <p>Function categories:
 * <ul>
 *   <li>Transforms: from, select, derive, filter, sort, take, join, group, ...</li>
 *   <li>Aggregations: sum, average, min, max, count, ...</li>
 *   <li>Window functions: row_number, rank, lag, lead, ...</li>
 *   <li>Operators: add, eq, and, coalesce, ...</li>
 *   <li>Scalar helpers: {@code math.*}, {@code text.*}, {@code as}</li>
 * </ul>
 */
public final class StdLib {

    public static final String NS_STD = "std";
    public static final String NS_MATH = "math";
    public static final String NS_TEXT = "text";

    private static final Map<String, StdFunction> FUNCTIONS;

    static {
        Map<String, StdFunction> functions = new HashMap<>();
        initializeTransforms(functions);
        initializeAggregations(functions);
        initializeWindowFunctions(functions);
        initializeOperators(functions);
        initializeMath(functions);
        initializeText(functions);
        FUNCTIONS = Collections.unmodifiableMap(functions);
    }

    private StdLib() {
    }

    /**
     * Looks up a function by the parts of an identifier, with or without the
     * {@code std} prefix: {@code sum}, {@code std.sum}, {@code math.abs}.
     */
    public static Optional<StdFunction> lookup(List<String> parts) {
        if (parts.isEmpty()) {
            return Optional.empty();
        }
        List<String> rest = parts.get(0).equals(NS_STD) ? parts.subList(1, parts.size()) : parts;
        if (rest.isEmpty()) {
            return Optional.empty();
        }
        return Optional.ofNullable(FUNCTIONS.get(String.join(".", rest)));
    }

    public static Optional<StdFunction> lookup(String name) {
        return lookup(List.of(name.split("\\.")));
    }

    /** Returns true when the name is one of the standard library's module names. */
    public static boolean isModuleName(String name) {
        return NS_STD.equals(name) || NS_MATH.equals(name) || NS_TEXT.equals(name);
    }

    public static int size() {
        return FUNCTIONS.size();
    }

    // ==================== Transforms ====================

    private static void initializeTransforms(Map<String, StdFunction> f) {
        transform(f, "from", List.of("source"));
        transform(f, "select", List.of("columns", "rel"));
        transform(f, "derive", List.of("columns", "rel"));
        transform(f, "filter", List.of("condition", "rel"));
        transform(f, "aggregate", List.of("columns", "rel"));
        transform(f, "sort", List.of("by", "rel"));
        transform(f, "take", List.of("expr", "rel"));
        transform(f, "join", List.of("with", "condition", "rel"), "side");
        transform(f, "group", List.of("by", "pipeline", "rel"));
        transform(f, "window", List.of("pipeline", "rel"), "rows", "range", "expanding", "rolling");
        transform(f, "append", List.of("bottom", "top"));
        transform(f, "union", List.of("bottom", "top"));
        transform(f, "distinct", List.of("rel"));
        transform(f, "loop", List.of("pipeline", "rel"));
        transform(f, "from_text", List.of("text"), "format");
    }

    // ==================== Aggregations ====================

    private static void initializeAggregations(Map<String, StdFunction> f) {
        for (String name : List.of("sum", "average", "min", "max", "count", "count_distinct",
                                   "stddev", "every", "any", "concat_array")) {
            register(f, name, FunctionKind.AGGREGATION, List.of("column"));
        }
        f.put("avg", f.get("average"));
    }

    // ==================== Window Functions ====================

    private static void initializeWindowFunctions(Map<String, StdFunction> f) {
        register(f, "row_number", FunctionKind.WINDOW, List.of("rel"));
        register(f, "rank", FunctionKind.WINDOW, List.of("rel"));
        register(f, "rank_dense", FunctionKind.WINDOW, List.of("rel"));
        register(f, "lag", FunctionKind.WINDOW, List.of("offset", "column"));
        register(f, "lead", FunctionKind.WINDOW, List.of("offset", "column"));
        register(f, "first", FunctionKind.WINDOW, List.of("column"));
        register(f, "last", FunctionKind.WINDOW, List.of("column"));
    }

    // ==================== Operators ====================

    private static void initializeOperators(Map<String, StdFunction> f) {
        for (String name : List.of("add", "sub", "mul", "div_f", "div_i", "mod", "pow",
                                   "eq", "ne", "gt", "lt", "gte", "lte",
                                   "and", "or", "coalesce", "regex_search", "concat")) {
            register(f, name, FunctionKind.SCALAR, List.of("left", "right"));
        }
        register(f, "neg", FunctionKind.SCALAR, List.of("expr"));
        register(f, "not", FunctionKind.SCALAR, List.of("expr"));
        register(f, "in", FunctionKind.SCALAR, List.of("pattern", "value"));
        register(f, "array_in", FunctionKind.SCALAR, List.of("value", "array"));
        register(f, "as", FunctionKind.SCALAR, List.of("type", "value"));
    }

    // ==================== Math ====================

    private static void initializeMath(Map<String, StdFunction> f) {
        for (String name : List.of("abs", "floor", "ceil", "exp", "ln", "log10", "sqrt",
                                   "degrees", "radians", "cos", "acos", "sin", "asin", "tan", "atan")) {
            register(f, NS_MATH + "." + name, FunctionKind.SCALAR, List.of("column"));
        }
        register(f, NS_MATH + ".pi", FunctionKind.SCALAR, List.of());
        register(f, NS_MATH + ".log", FunctionKind.SCALAR, List.of("base", "column"));
        register(f, NS_MATH + ".pow", FunctionKind.SCALAR, List.of("exponent", "column"));
        register(f, NS_MATH + ".round", FunctionKind.SCALAR, List.of("n_digits", "column"));
    }

    // ==================== Text ====================

    private static void initializeText(Map<String, StdFunction> f) {
        for (String name : List.of("lower", "upper", "ltrim", "rtrim", "trim", "length")) {
            register(f, NS_TEXT + "." + name, FunctionKind.SCALAR, List.of("column"));
        }
        register(f, NS_TEXT + ".extract", FunctionKind.SCALAR, List.of("offset", "length", "column"));
        register(f, NS_TEXT + ".replace", FunctionKind.SCALAR, List.of("pattern", "replacement", "column"));
        register(f, NS_TEXT + ".starts_with", FunctionKind.SCALAR, List.of("prefix", "column"));
        register(f, NS_TEXT + ".contains", FunctionKind.SCALAR, List.of("substr", "column"));
        register(f, NS_TEXT + ".ends_with", FunctionKind.SCALAR, List.of("suffix", "column"));
    }

    private static void transform(Map<String, StdFunction> f, String name, List<String> params,
                                  String... namedParams) {
        f.put(name, new StdFunction(NS_STD + "." + name, FunctionKind.TRANSFORM, params, List.of(namedParams)));
    }

    private static void register(Map<String, StdFunction> f, String name, FunctionKind kind, List<String> params) {
        f.put(name, new StdFunction(NS_STD + "." + name, kind, params, List.of()));
    }
}
