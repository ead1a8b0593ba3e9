package com.pipesql.sql.gen;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Syntax tree of the generated SQL. Each node renders itself on a single line;
 * layout is left to {@link SqlFormatter}.
 */
public final class SqlAst {

    private SqlAst() {}

    public record Query(List<Cte> ctes, boolean recursive, SetExpr body, List<String> orderBy,
                        Long limit, Long offset, boolean fetch) {

        public Query {
            ctes = List.copyOf(ctes);
            orderBy = List.copyOf(orderBy);
        }

        public static Query of(SetExpr body) {
            return new Query(List.of(), false, body, List.of(), null, null, false);
        }

        public Query withCtes(List<Cte> newCtes, boolean isRecursive) {
            List<Cte> all = new ArrayList<>(newCtes);
            all.addAll(ctes);
            return new Query(all, recursive || isRecursive, body, orderBy, limit, offset, fetch);
        }

        /** A query that can be used as an operand of a set operation without parentheses. */
        public boolean isSimple() {
            return ctes.isEmpty() && orderBy.isEmpty() && limit == null && offset == null;
        }

        public String toSql() {
            StringBuilder sb = new StringBuilder();
            if (!ctes.isEmpty()) {
                sb.append(recursive ? "WITH RECURSIVE " : "WITH ");
                sb.append(ctes.stream().map(Cte::toSql).collect(Collectors.joining(", ")));
                sb.append(' ');
            }
            sb.append(body.toSql());
            if (!orderBy.isEmpty()) {
                sb.append(" ORDER BY ").append(String.join(", ", orderBy));
            }
            if (fetch) {
                sb.append(" OFFSET ").append(offset == null ? 0 : offset).append(" ROWS");
                if (limit != null) {
                    sb.append(" FETCH NEXT ").append(limit).append(" ROWS ONLY");
                }
            } else {
                if (limit != null) {
                    sb.append(" LIMIT ").append(limit);
                }
                if (offset != null) {
                    sb.append(" OFFSET ").append(offset);
                }
            }
            return sb.toString();
        }

        @Override
        public String toString() {
            return toSql();
        }
    }

    public record Cte(String name, Query query) {
        public String toSql() {
            return name + " AS (" + query.toSql() + ")";
        }
    }

    public sealed interface SetExpr {
        String toSql();
    }

    /**
     * One SELECT. {@code distinct} holds the whole quantifier, such as
     * {@code DISTINCT ON (a)}, or is null.
     */
    public record Select(String distinct, Long top, List<String> projection, List<TableWithJoins> from,
                         String where, List<String> groupBy, String having) implements SetExpr {

        public Select {
            projection = List.copyOf(projection);
            from = List.copyOf(from);
            groupBy = List.copyOf(groupBy);
        }

        public static Select star(TableFactor from) {
            return new Select(null, null, List.of("*"), List.of(new TableWithJoins(from, List.of())),
                              null, List.of(), null);
        }

        @Override
        public String toSql() {
            StringBuilder sb = new StringBuilder("SELECT ");
            if (distinct != null) {
                sb.append(distinct).append(' ');
            }
            if (top != null) {
                sb.append("TOP (").append(top).append(") ");
            }
            sb.append(String.join(", ", projection));
            if (!from.isEmpty()) {
                sb.append(" FROM ")
                  .append(from.stream().map(TableWithJoins::toSql).collect(Collectors.joining(", ")));
            }
            if (where != null) {
                sb.append(" WHERE ").append(where);
            }
            if (!groupBy.isEmpty()) {
                sb.append(" GROUP BY ").append(String.join(", ", groupBy));
            }
            if (having != null) {
                sb.append(" HAVING ").append(having);
            }
            return sb.toString();
        }
    }

    /** {@code left UNION ALL right}; the quantifier is ALL, DISTINCT or null. */
    public record SetOperation(String operator, String quantifier, SetExpr left, SetExpr right) implements SetExpr {
        @Override
        public String toSql() {
            String op = quantifier == null ? operator : operator + " " + quantifier;
            return left.toSql() + " " + op + " " + right.toSql();
        }
    }

    /** SQL written by the user and passed through verbatim. */
    public record Raw(String sql) implements SetExpr {
        @Override
        public String toSql() {
            return sql;
        }
    }

    public record TableWithJoins(TableFactor relation, List<Join> joins) {
        public TableWithJoins {
            joins = List.copyOf(joins);
        }

        public String toSql() {
            StringBuilder sb = new StringBuilder(relation.toSql());
            for (Join join : joins) {
                sb.append(' ').append(join.toSql());
            }
            return sb.toString();
        }
    }

    public sealed interface TableFactor {
        String toSql();
    }

    public record Table(String name, String alias) implements TableFactor {
        @Override
        public String toSql() {
            return alias == null ? name : name + " AS " + alias;
        }
    }

    public record Derived(Query subquery, String alias) implements TableFactor {
        @Override
        public String toSql() {
            String sql = "(" + subquery.toSql() + ")";
            return alias == null ? sql : sql + " AS " + alias;
        }
    }

    public record Join(String operator, TableFactor relation, String constraint) {
        public String toSql() {
            return operator + " " + relation.toSql() + " ON " + constraint;
        }
    }
}
