package com.pipesql.sql.gen;

import com.pipesql.diagnostic.Span;
import com.pipesql.exception.CodegenException;
import com.pipesql.ir.ColumnSort;
import com.pipesql.ir.Literal;
import com.pipesql.ir.rq.Expr;
import com.pipesql.ir.rq.ExprKind;
import com.pipesql.ir.rq.InterpolateItem;
import com.pipesql.ir.rq.Range;
import com.pipesql.ir.rq.RelationKind;
import com.pipesql.sql.Dialect;
import com.pipesql.sql.pq.AnchorContext;
import com.pipesql.sql.pq.Cte;
import com.pipesql.sql.pq.RelationExpr;
import com.pipesql.sql.pq.RelationInstance;
import com.pipesql.sql.pq.SqlContext;
import com.pipesql.sql.pq.SqlQuery;
import com.pipesql.sql.pq.SqlRelation;
import com.pipesql.sql.pq.SqlTransform;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Translates a partitioned query into the SQL syntax tree.
 *
 * <p>Each atomic pipeline becomes one SELECT, followed by the set operations
 * that close it. CTEs are attached to the main query in definition order.
 */
public final class QueryGenerator {

    private static final Logger logger = LoggerFactory.getLogger(QueryGenerator.class);

    private final SqlContext ctx;
    private final AnchorContext anchor;
    private final Dialect dialect;
    private final ExprGenerator exprs;
    private final ProjectionGenerator projections;

    public QueryGenerator(SqlContext ctx) {
        this.ctx = ctx;
        this.anchor = ctx.anchor();
        this.dialect = ctx.dialect();
        this.exprs = new ExprGenerator(ctx);
        this.projections = new ProjectionGenerator(ctx, exprs);
    }

    public SqlAst.Query generate(SqlQuery query) {
        List<SqlAst.Cte> ctes = new ArrayList<>();
        boolean recursive = false;
        for (Cte cte : query.ctes()) {
            ctes.add(translateCte(cte));
            recursive |= cte.kind() instanceof Cte.Loop;
        }
        SqlAst.Query main = translateRelation(query.main());
        return ctes.isEmpty() ? main : main.withCtes(ctes, recursive);
    }

    private SqlAst.Cte translateCte(Cte cte) {
        List<String> name = anchor.lookupTableDecl(cte.tid()).name();
        String alias = exprs.translateIdentPart(name.get(name.size() - 1));
        if (cte.kind() instanceof Cte.Normal normal) {
            return new SqlAst.Cte(alias, translateRelation(normal.relation()));
        }
        Cte.Loop loop = (Cte.Loop) cte.kind();
        SqlAst.SetExpr initial = toSetExpr(translateRelation(loop.initial()));
        SqlAst.SetExpr step = toSetExpr(translateRelation(loop.step()));
        return new SqlAst.Cte(alias, SqlAst.Query.of(new SqlAst.SetOperation("UNION", "ALL", initial, step)));
    }

    private SqlAst.Query translateRelation(SqlRelation relation) {
        if (relation instanceof SqlRelation.AtomicPipeline pipeline) {
            return translatePipeline(pipeline.transforms());
        }
        if (relation instanceof SqlRelation.Literal literal) {
            return translateRelationLiteral(literal.data());
        }
        return translateQuerySString(((SqlRelation.SString) relation).items());
    }

    // ==================== Pipelines ====================

    private SqlAst.Query translatePipeline(List<SqlTransform> pipeline) {
        int split = 0;
        while (split < pipeline.size() && !isSetOperation(pipeline.get(split))) {
            split++;
        }
        SqlAst.Query select = translateSelectPipeline(pipeline.subList(0, split));

        List<SqlTransform> operations = new ArrayList<>();
        List<ColumnSort<Integer>> sorting = List.of();
        for (SqlTransform t : pipeline.subList(split, pipeline.size())) {
            if (isSetOperation(t)) {
                operations.add(t);
            } else if (t instanceof SqlTransform.Sort sort) {
                sorting = sort.by();
            } else {
                throw new CodegenException(
                    "invalid query: " + SqlTransform.kindName(t) + " after a set operation", (Span) null);
            }
        }
        if (operations.isEmpty()) {
            return select;
        }
        SqlAst.Query query = translateSetOperations(select, operations);
        return sorting.isEmpty() ? query : orderSetOperation(query, sorting);
    }

    /** Sorts the result of a set operation; the sort columns are referenced by their output names. */
    private SqlAst.Query orderSetOperation(SqlAst.Query query, List<ColumnSort<Integer>> sorting) {
        ctx.pushQuery();
        ctx.query().omitIdentPrefix(true);
        ctx.query().preProjection(false);
        List<String> orderBy = sorting.stream().map(exprs::translateColumnSort).collect(Collectors.toList());
        ctx.popQuery();
        return new SqlAst.Query(query.ctes(), query.recursive(), query.body(), orderBy,
                                query.limit(), query.offset(), query.fetch());
    }

    private static boolean isSetOperation(SqlTransform t) {
        return t instanceof SqlTransform.Union || t instanceof SqlTransform.Except
            || t instanceof SqlTransform.Intersect;
    }

    private SqlAst.Query translateSelectPipeline(List<SqlTransform> pipeline) {
        long tableCount = pipeline.stream()
            .filter(t -> t instanceof SqlTransform.From || t instanceof SqlTransform.Join)
            .count();
        logger.debug("atomic query contains {} tables", tableCount);

        ctx.pushQuery();
        ctx.query().omitIdentPrefix(tableCount == 1);
        ctx.query().preProjection(true);

        List<SqlAst.TableWithJoins> from = new ArrayList<>();
        List<SqlAst.Join> joins = new ArrayList<>();
        List<Integer> selectColumns = null;
        List<List<ColumnSort<Integer>>> sorts = new ArrayList<>();
        List<Range> takes = new ArrayList<>();
        String distinct = null;
        List<Expr> where = new ArrayList<>();
        List<Expr> having = new ArrayList<>();
        List<Integer> groupBy = List.of();
        boolean afterAggregate = false;

        for (SqlTransform t : pipeline) {
            if (t instanceof SqlTransform.From f) {
                from.add(new SqlAst.TableWithJoins(translateRelationExpr(f.riid()), List.of()));
            } else if (t instanceof SqlTransform.Join j) {
                joins.add(translateJoin(j));
            } else if (t instanceof SqlTransform.Select s) {
                selectColumns = s.columns();
            } else if (t instanceof SqlTransform.Sort s) {
                sorts.add(s.by());
            } else if (t instanceof SqlTransform.Take take) {
                takes.add(take.take().range());
            } else if (t instanceof SqlTransform.Distinct) {
                distinct = "DISTINCT";
            } else if (t instanceof SqlTransform.DistinctOn on) {
                distinct = "DISTINCT ON (" + String.join(", ", projections.tryIntoExprs(on.columns(), null)) + ")";
            } else if (t instanceof SqlTransform.Filter filter) {
                (afterAggregate ? having : where).add(filter.condition());
            } else if (t instanceof SqlTransform.Aggregate aggregate) {
                afterAggregate = true;
                groupBy = aggregate.partition();
            }
        }
        if (!joins.isEmpty()) {
            if (from.isEmpty()) {
                throw new CodegenException("Cannot use `join` without `from`", (Span) null);
            }
            SqlAst.TableWithJoins last = from.remove(from.size() - 1);
            from.add(new SqlAst.TableWithJoins(last.relation(), joins));
        }
        if (selectColumns == null) {
            throw new CodegenException("invalid query: a pipeline without a projection", (Span) null);
        }

        List<String> projection = projections.translateSelectItems(projections.translateWildcards(selectColumns));
        if (projection.isEmpty() && !dialect.supportsZeroColumns()) {
            projection = List.of("NULL");
        }

        String whereSql = conjunction(where);
        String havingSql = conjunction(having);

        ctx.query().allowStars(dialect.starsInGroup());
        List<String> groupBySql = projections.tryIntoExprs(groupBy, null);
        ctx.query().allowStars(true);

        ctx.query().preProjection(false);

        ExprGenerator.IntRange range = ExprGenerator.rangeOfRanges(takes);
        long offset = range.start() == null ? 0 : range.start() - 1;
        Long limit = range.end() == null ? null : range.end() - offset;

        List<String> orderBy = sorts.isEmpty()
            ? new ArrayList<>()
            : sorts.get(sorts.size() - 1).stream().map(exprs::translateColumnSort).collect(Collectors.toList());

        ctx.popQuery();

        Long top = null;
        boolean fetch = false;
        if (dialect.useTop() && offset == 0) {
            top = limit;
            limit = null;
        } else if (dialect.useFetch() && (limit != null || offset > 0)) {
            fetch = true;
            if (orderBy.isEmpty()) {
                orderBy.add("(SELECT NULL)");
            }
        }

        SqlAst.Select select = new SqlAst.Select(distinct, top, projection, from, whereSql, groupBySql, havingSql);
        return new SqlAst.Query(List.of(), false, select, orderBy, limit, offset == 0 ? null : offset, fetch);
    }

    /** Joins conditions with AND, nesting from the right. */
    private String conjunction(List<Expr> conditions) {
        if (conditions.isEmpty()) {
            return null;
        }
        Expr condition = conditions.get(conditions.size() - 1);
        for (int i = conditions.size() - 2; i >= 0; i--) {
            condition = Expr.of(new ExprKind.Operator("std.and", List.of(conditions.get(i), condition)));
        }
        return exprs.translate(condition).text();
    }

    private SqlAst.Query translateSetOperations(SqlAst.Query top, List<SqlTransform> operations) {
        for (SqlTransform t : operations) {
            String operator;
            int bottom;
            boolean distinct;
            if (t instanceof SqlTransform.Union u) {
                operator = "UNION";
                bottom = u.bottom();
                distinct = u.distinct();
            } else if (t instanceof SqlTransform.Except e) {
                operator = "EXCEPT";
                bottom = e.bottom();
                distinct = e.distinct();
            } else {
                SqlTransform.Intersect i = (SqlTransform.Intersect) t;
                operator = "INTERSECT";
                bottom = i.bottom();
                distinct = i.distinct();
            }
            String quantifier = !distinct ? "ALL" : dialect.setOpsDistinct() ? "DISTINCT" : null;
            SqlAst.SetExpr right = SqlAst.Select.star(translateRelationExpr(bottom));
            top = SqlAst.Query.of(new SqlAst.SetOperation(operator, quantifier, toSetExpr(top), right));
        }
        return top;
    }

    /** Returns the body of a simple query, or wraps the query as {@code SELECT * FROM (query)}. */
    private SqlAst.SetExpr toSetExpr(SqlAst.Query query) {
        if (query.isSimple()) {
            return query.body();
        }
        return SqlAst.Select.star(new SqlAst.Derived(query, anchor.nextTableName()));
    }

    // ==================== Relations ====================

    private SqlAst.TableFactor translateRelationExpr(int riid) {
        RelationInstance instance = anchor.relationInstance(riid);
        RelationExpr expr = ctx.relationExpr(riid);
        String alias = instance.name();
        if (expr instanceof RelationExpr.SubQuery subQuery) {
            SqlAst.Query query = translateRelation(subQuery.relation());
            return new SqlAst.Derived(query, alias == null ? null : exprs.translateIdentPart(alias));
        }
        List<String> name = anchor.lookupTableDecl(((RelationExpr.Ref) expr).tid()).name();
        String table = name.stream().map(exprs::translateIdentPart).collect(Collectors.joining("."));
        if (alias == null || alias.equals(name.get(name.size() - 1))) {
            return new SqlAst.Table(table, null);
        }
        return new SqlAst.Table(table, exprs.translateIdentPart(alias));
    }

    private SqlAst.Join translateJoin(SqlTransform.Join join) {
        SqlAst.TableFactor relation = translateRelationExpr(join.riid());
        String constraint = exprs.translate(join.filter()).text();
        String operator = switch (join.side()) {
            case INNER -> "JOIN";
            case LEFT -> "LEFT JOIN";
            case RIGHT -> "RIGHT JOIN";
            case FULL -> "FULL JOIN";
        };
        return new SqlAst.Join(operator, relation, constraint);
    }

    private SqlAst.Query translateRelationLiteral(RelationKind.Literal data) {
        if (data.rows().isEmpty()) {
            throw new CodegenException("relation literal must have at least one row", (Span) null)
                .withHint("add a row, or filter out all rows of a relation that has one");
        }
        SqlAst.SetExpr body = null;
        for (List<Literal> row : data.rows()) {
            List<String> items = new ArrayList<>();
            for (int i = 0; i < Math.min(row.size(), data.columns().size()); i++) {
                items.add(exprs.translateLiteral(row.get(i), null) + " AS "
                    + exprs.translateIdentPart(data.columns().get(i)));
            }
            SqlAst.Select select = new SqlAst.Select(null, null, items, List.of(), null, List.of(), null);
            body = body == null ? select : new SqlAst.SetOperation("UNION", "ALL", body, select);
        }
        return SqlAst.Query.of(body);
    }

    private SqlAst.Query translateQuerySString(List<InterpolateItem> items) {
        String sql = exprs.translateSString(items);
        String head = sql.stripLeading().toUpperCase(Locale.ROOT);
        if (head.startsWith("SELECT ") || head.startsWith("WITH ")
            || head.startsWith("SELECT\n") || head.startsWith("WITH\n")) {
            return SqlAst.Query.of(new SqlAst.Raw(sql));
        }
        throw new CodegenException("s-strings representing a table must start with `SELECT `", (Span) null)
            .withHint("this is a limitation by current compiler implementation");
    }
}
