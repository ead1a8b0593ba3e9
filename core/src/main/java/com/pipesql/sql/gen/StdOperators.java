package com.pipesql.sql.gen;

import com.pipesql.diagnostic.Span;
import com.pipesql.exception.CodegenException;
import com.pipesql.sql.Dialect;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Registry of SQL templates for standard library functions.
 *
 * <p>Each function has a generic template and optional per-dialect overrides.
 * A dialect that cannot express a function registers an explicit
 * {@link #UNSUPPORTED} marker. Arguments are numbered in the order of the
 * function's parameters, so {@code std.math.round} (n_digits, column) renders
 * as {@code ROUND({1:0}, {0:0})}.
 *
 * <p>The registry is filled once at class initialization and read-only afterwards.
 */
public final class StdOperators {

    private static final OperatorTemplate UNSUPPORTED = new OperatorTemplate(List.of(), null, false, null);

    private static final Map<String, OperatorTemplate> GENERIC = new HashMap<>();
    private static final Map<Dialect, Map<String, OperatorTemplate>> OVERRIDES = new EnumMap<>(Dialect.class);

    static {
        initializeAggregations();
        initializeWindowFunctions();
        initializeOperators();
        initializeMath();
        initializeText();
    }

    private StdOperators() {}

    /**
     * Finds the template of {@code name} for a dialect.
     *
     * @return the template, or empty when the function has no SQL template at all
     * @throws CodegenException if the dialect cannot express the function
     */
    public static Optional<OperatorTemplate> find(String name, Dialect dialect) {
        Map<String, OperatorTemplate> overrides = OVERRIDES.get(dialect);
        OperatorTemplate template = overrides != null ? overrides.get(name) : null;
        if (template == null) {
            template = GENERIC.get(name);
        }
        if (template == UNSUPPORTED) {
            throw new CodegenException("operator " + name + " is not supported for dialect " + dialect, (Span) null);
        }
        return Optional.ofNullable(template);
    }

    public static boolean isRegistered(String name) {
        return GENERIC.containsKey(name);
    }

    // ==================== Aggregations ====================

    private static void initializeAggregations() {
        aggregate("min", "MIN({0:0})");
        aggregate("max", "MAX({0:0})");
        GENERIC.put("std.sum", OperatorTemplate.of("SUM({0:0})").withWindowFrame().withCoalesce("0"));
        aggregate("average", "AVG({0:0})");
        aggregate("avg", "AVG({0:0})");
        aggregate("stddev", "STDDEV({0:0})");
        aggregate("every", "BOOL_AND({0:0})");
        aggregate("any", "BOOL_OR({0:0})");
        GENERIC.put("std.concat_array",
            OperatorTemplate.of("STRING_AGG({0:0}, '')").withWindowFrame().withCoalesce("''"));
        aggregate("count", "COUNT(*)");
        aggregate("count_distinct", "COUNT(DISTINCT {0:0})");

        override(Dialect.MSSQL, "std.stddev", OperatorTemplate.of("STDEV({0:0})").withWindowFrame());
        override(Dialect.SQLITE, "std.every", OperatorTemplate.of("MIN({0:0})").withWindowFrame());
        override(Dialect.SQLITE, "std.any", OperatorTemplate.of("MAX({0:0})").withWindowFrame());
        override(Dialect.SQLITE, "std.concat_array",
            OperatorTemplate.of("GROUP_CONCAT({0:0}, '')").withWindowFrame().withCoalesce("''"));
        override(Dialect.MYSQL, "std.concat_array",
            OperatorTemplate.of("GROUP_CONCAT({0:0} SEPARATOR '')").withWindowFrame().withCoalesce("''"));
        override(Dialect.MSSQL, "std.every", UNSUPPORTED);
        override(Dialect.MSSQL, "std.any", UNSUPPORTED);
    }

    // ==================== Window Functions ====================

    private static void initializeWindowFunctions() {
        GENERIC.put("std.lag", OperatorTemplate.of("LAG({1:0}, {0:0})").withWindowFrame());
        GENERIC.put("std.lead", OperatorTemplate.of("LEAD({1:0}, {0:0})").withWindowFrame());
        GENERIC.put("std.first", OperatorTemplate.of("FIRST_VALUE({0:0})").withWindowFrame());
        GENERIC.put("std.last", OperatorTemplate.of("LAST_VALUE({0:0})").withWindowFrame());
        GENERIC.put("std.rank", OperatorTemplate.of("RANK()"));
        GENERIC.put("std.rank_dense", OperatorTemplate.of("DENSE_RANK()"));
        GENERIC.put("std.row_number", OperatorTemplate.of("ROW_NUMBER()"));
    }

    // ==================== Operators ====================

    private static void initializeOperators() {
        GENERIC.put("std.neg", OperatorTemplate.of("-{0:13}").withStrength(13));
        GENERIC.put("std.not", OperatorTemplate.of("NOT {0:4}").withStrength(4));
        GENERIC.put("std.mul", OperatorTemplate.of("{0:11} * {1:11}").withStrength(11));
        GENERIC.put("std.div_f", OperatorTemplate.of("{0:11} / {1:12}").withStrength(11));
        GENERIC.put("std.mod", OperatorTemplate.of("{0:11} % {1:12}").withStrength(11));
        GENERIC.put("std.add", OperatorTemplate.of("{0:10} + {1:10}").withStrength(10));
        GENERIC.put("std.sub", OperatorTemplate.of("{0:10} - {1:11}").withStrength(10));
        GENERIC.put("std.eq", OperatorTemplate.of("{0:6} = {1:6}").withStrength(6));
        GENERIC.put("std.ne", OperatorTemplate.of("{0:6} <> {1:6}").withStrength(6));
        GENERIC.put("std.gt", OperatorTemplate.of("{0:6} > {1:6}").withStrength(6));
        GENERIC.put("std.lt", OperatorTemplate.of("{0:6} < {1:6}").withStrength(6));
        GENERIC.put("std.gte", OperatorTemplate.of("{0:6} >= {1:6}").withStrength(6));
        GENERIC.put("std.lte", OperatorTemplate.of("{0:6} <= {1:6}").withStrength(6));
        GENERIC.put("std.and", OperatorTemplate.of("{0:3} AND {1:3}").withStrength(3));
        GENERIC.put("std.or", OperatorTemplate.of("{0:2} OR {1:2}").withStrength(2));
        GENERIC.put("std.coalesce", OperatorTemplate.of("COALESCE({0:0}, {1:0})"));
        GENERIC.put("std.pow", OperatorTemplate.of("POW({0:0}, {1:0})"));
        GENERIC.put("std.as", OperatorTemplate.of("CAST({1:0} AS {0:0})"));

        GENERIC.put("std.div_i", OperatorTemplate.of("FLOOR({0:11} / {1:12})"));
        override(Dialect.DUCKDB, "std.div_i", OperatorTemplate.of("TRUNC({0:11} // {1:12})"));
        override(Dialect.MSSQL, "std.div_i",
            OperatorTemplate.of("ROUND(ABS({0:11} / {1:12}), 0, 1) * SIGN({0:0}) * SIGN({1:0})").withStrength(11));
        override(Dialect.MYSQL, "std.div_i", OperatorTemplate.of("{0:11} DIV {1:12}").withStrength(11));
        override(Dialect.POSTGRES, "std.div_i", OperatorTemplate.of("TRUNC({0:11} / {1:12})"));

        GENERIC.put("std.regex_search", OperatorTemplate.of("REGEXP({0:0}, {1:0})"));
        override(Dialect.POSTGRES, "std.regex_search", OperatorTemplate.of("{0:9} ~ {1:9}").withStrength(9));
        override(Dialect.DUCKDB, "std.regex_search", OperatorTemplate.of("REGEXP_MATCHES({0:0}, {1:0})"));
        override(Dialect.MYSQL, "std.regex_search", OperatorTemplate.of("REGEXP_LIKE({0:0}, {1:0}, 'c')"));
        override(Dialect.MSSQL, "std.regex_search", UNSUPPORTED);
        override(Dialect.MSSQL, "std.pow", OperatorTemplate.of("POWER({0:0}, {1:0})"));
    }

    // ==================== Math ====================

    private static void initializeMath() {
        for (String name : new String[] {"abs", "floor", "exp", "ln", "log10", "sqrt",
                                          "degrees", "radians", "cos", "acos", "sin", "asin", "tan", "atan"}) {
            GENERIC.put("std.math." + name, OperatorTemplate.of(name.toUpperCase() + "({0:0})"));
        }
        GENERIC.put("std.math.ceil", OperatorTemplate.of("CEIL({0:0})"));
        GENERIC.put("std.math.pi", OperatorTemplate.of("PI()"));
        GENERIC.put("std.math.log", OperatorTemplate.of("LOG10({1:0}) / LOG10({0:0})").withStrength(11));
        GENERIC.put("std.math.pow", OperatorTemplate.of("POW({1:0}, {0:0})"));
        GENERIC.put("std.math.round", OperatorTemplate.of("ROUND({1:0}, {0:0})"));

        override(Dialect.MSSQL, "std.math.ceil", OperatorTemplate.of("CEILING({0:0})"));
        override(Dialect.MSSQL, "std.math.ln", OperatorTemplate.of("LOG({0:0})"));
        override(Dialect.MSSQL, "std.math.pow", OperatorTemplate.of("POWER({1:0}, {0:0})"));
        override(Dialect.MSSQL, "std.math.log", OperatorTemplate.of("LOG({1:0}, {0:0})"));
        override(Dialect.POSTGRES, "std.math.log", OperatorTemplate.of("LOG({0:0}, {1:0})"));
    }

    // ==================== Text ====================

    private static void initializeText() {
        for (String name : new String[] {"lower", "upper", "ltrim", "rtrim", "trim"}) {
            GENERIC.put("std.text." + name, OperatorTemplate.of(name.toUpperCase() + "({0:0})"));
        }
        GENERIC.put("std.text.length", OperatorTemplate.of("CHAR_LENGTH({0:0})"));
        GENERIC.put("std.text.extract", OperatorTemplate.of("SUBSTRING({2:0}, {0:0}, {1:0})"));
        GENERIC.put("std.text.replace", OperatorTemplate.of("REPLACE({2:0}, {0:0}, {1:0})"));
        GENERIC.put("std.text.starts_with",
            OperatorTemplate.of("{1:7} LIKE CONCAT({0:0}, '%')").withStrength(7));
        GENERIC.put("std.text.contains",
            OperatorTemplate.of("{1:7} LIKE CONCAT('%', {0:0}, '%')").withStrength(7));
        GENERIC.put("std.text.ends_with",
            OperatorTemplate.of("{1:7} LIKE CONCAT('%', {0:0})").withStrength(7));

        override(Dialect.MSSQL, "std.text.length", OperatorTemplate.of("LEN({0:0})"));
        override(Dialect.SQLITE, "std.text.length", OperatorTemplate.of("LENGTH({0:0})"));
        override(Dialect.SQLITE, "std.text.extract", OperatorTemplate.of("SUBSTR({2:0}, {0:0}, {1:0})"));
        override(Dialect.SQLITE, "std.text.starts_with",
            OperatorTemplate.of("{1:7} LIKE {0:9} || '%'").withStrength(7));
        override(Dialect.SQLITE, "std.text.contains",
            OperatorTemplate.of("{1:7} LIKE '%' || {0:9} || '%'").withStrength(7));
        override(Dialect.SQLITE, "std.text.ends_with",
            OperatorTemplate.of("{1:7} LIKE '%' || {0:9}").withStrength(7));
    }

    private static void aggregate(String name, String template) {
        GENERIC.put("std." + name, OperatorTemplate.of(template).withWindowFrame());
    }

    private static void override(Dialect dialect, String name, OperatorTemplate template) {
        OVERRIDES.computeIfAbsent(dialect, d -> new HashMap<>()).put(name, template);
    }
}
