package com.pipesql.sql;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Quoting of SQL identifiers and string literals.
 *
 * <p>Identifiers stay bare when they are lower case words that are not reserved,
 * and are quoted with the dialect's quote character otherwise:
 * <pre>
 *   SqlQuoting.quoteIdentifier("salary", Dialect.GENERIC);     // salary
 *   SqlQuoting.quoteIdentifier("Salary", Dialect.GENERIC);     // "Salary"
 *   SqlQuoting.quoteIdentifier("from", Dialect.MYSQL);         // `from`
 *   SqlQuoting.quoteLiteral("O'Reilly");                       // 'O''Reilly'
 * </pre>
 */
public final class SqlQuoting {

    private static final Pattern BARE_IDENT = Pattern.compile("^(\\*|[a-z_$][a-z0-9_$]*)$");

    /** Words that cannot be used as a bare column or table alias. */
    private static final Set<String> RESERVED = Set.of(
        "ANALYZE", "CLUSTER", "CONNECT", "CROSS", "DISTRIBUTE", "END", "EXCEPT", "EXPLAIN",
        "FETCH", "FOR", "FORMAT", "FROM", "FULL", "GROUP", "HAVING", "INNER", "INTERSECT",
        "INTO", "JOIN", "LATERAL", "LEFT", "LIMIT", "MATCH_RECOGNIZE", "NATURAL", "OFFSET",
        "ON", "ORDER", "OUTER", "PARTITION", "PIVOT", "PREWHERE", "QUALIFY", "RETURNING",
        "RIGHT", "SAMPLE", "SELECT", "SET", "SETTINGS", "SORT", "START", "TABLESAMPLE",
        "TOP", "UNION", "UNPIVOT", "USING", "VIEW", "WHERE", "WINDOW", "WITH");

    private SqlQuoting() {}

    public static boolean isReserved(String word) {
        return RESERVED.contains(word.toUpperCase(Locale.ROOT));
    }

    /**
     * Quotes one part of an identifier when it is not a valid bare identifier.
     *
     * @throws IllegalArgumentException if identifier is null or empty
     */
    public static String quoteIdentifier(String identifier, Dialect dialect) {
        if (identifier == null || identifier.isEmpty()) {
            throw new IllegalArgumentException("Identifier cannot be null or empty");
        }
        boolean jinja = identifier.startsWith("{{") && identifier.endsWith("}}");
        if (jinja || BARE_IDENT.matcher(identifier).matches() && !isReserved(identifier)) {
            return identifier;
        }
        String quote = String.valueOf(dialect.identQuote());
        return quote + identifier.replace(quote, quote + quote) + quote;
    }

    /**
     * Quotes a string literal, doubling single quotes.
     */
    public static String quoteLiteral(String value) {
        if (value == null) {
            return "NULL";
        }
        return "'" + value.replace("'", "''") + "'";
    }
}
