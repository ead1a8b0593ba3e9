package com.pipesql.sql.pq;

import com.pipesql.ir.ColumnSort;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Final passes over a partitioned query.
 *
 * <p>SQL does not keep the order of rows through joins or from CTEs, so the
 * sorting established in each pipeline is tracked and re-emitted where it is
 * needed: before every take and at the end of the main query. Tables and
 * relation instances are then given unique names.
 */
final class Postprocessor {

    private final SqlContext ctx;
    private final AnchorContext anchorContext;
    private final Anchor anchor;
    private final Map<Integer, List<ColumnSort<Integer>>> sortings = new HashMap<>();
    private List<ColumnSort<Integer>> lastSorting = List.of();

    Postprocessor(SqlContext ctx, Anchor anchor) {
        this.ctx = ctx;
        this.anchorContext = ctx.anchor();
        this.anchor = anchor;
    }

    SqlQuery process(SqlQuery query) {
        SqlQuery sorted = inferSorts(query);
        assignNames(sorted);
        return sorted;
    }

    // ==================== Sorting ====================

    private SqlQuery inferSorts(SqlQuery query) {
        List<Cte> ctes = new ArrayList<>();
        for (Cte cte : query.ctes()) {
            Cte.Kind kind;
            if (cte.kind() instanceof Cte.Normal normal) {
                kind = new Cte.Normal(foldRelation(normal.relation(), false));
                sortings.put(cte.tid(), lastSorting);
            } else {
                Cte.Loop loop = (Cte.Loop) cte.kind();
                SqlRelation initial = foldRelation(loop.initial(), false);
                SqlRelation step = foldRelation(loop.step(), false);
                kind = new Cte.Loop(initial, step);
                sortings.put(cte.tid(), List.of());
            }
            ctes.add(new Cte(cte.tid(), kind));
        }
        return new SqlQuery(ctes, foldRelation(query.main(), true));
    }

    private SqlRelation foldRelation(SqlRelation relation, boolean main) {
        if (!(relation instanceof SqlRelation.AtomicPipeline pipeline)) {
            lastSorting = List.of();
            return relation;
        }
        List<ColumnSort<Integer>> sorting = List.of();
        List<SqlTransform> result = new ArrayList<>();
        for (SqlTransform t : pipeline.transforms()) {
            if (t instanceof SqlTransform.From from) {
                RelationExpr expr = ctx.relationExpr(from.riid());
                if (expr instanceof RelationExpr.SubQuery subQuery) {
                    ctx.relationExpr(from.riid(), new RelationExpr.SubQuery(foldRelation(subQuery.relation(), false)));
                    sorting = lastSorting;
                } else {
                    sorting = sortings.getOrDefault(((RelationExpr.Ref) expr).tid(), List.of());
                }
                sorting = anchor.redirectSorts(sorting, from.riid());
            } else if (t instanceof SqlTransform.Sort sort) {
                sorting = sort.by();
                continue;
            } else if (t instanceof SqlTransform.Distinct || t instanceof SqlTransform.Aggregate) {
                sorting = List.of();
            } else if (t instanceof SqlTransform.Take || t instanceof SqlTransform.DistinctOn) {
                result.add(new SqlTransform.Sort(sorting));
            }
            result.add(t);
        }

        if (main) {
            result.add(new SqlTransform.Sort(sorting));
        } else {
            includeSortColumns(result, sorting);
        }
        lastSorting = sorting;
        return new SqlRelation.AtomicPipeline(result);
    }

    /** Adds the sort columns to the projection so that readers of a CTE can sort by them. */
    private static void includeSortColumns(List<SqlTransform> pipeline, List<ColumnSort<Integer>> sorting) {
        for (int i = pipeline.size() - 1; i >= 0; i--) {
            if (pipeline.get(i) instanceof SqlTransform.Select select) {
                List<Integer> columns = new ArrayList<>(select.columns());
                for (ColumnSort<Integer> sort : sorting) {
                    if (!columns.contains(sort.column())) {
                        columns.add(sort.column());
                    }
                }
                pipeline.set(i, new SqlTransform.Select(columns));
                return;
            }
        }
    }

    // ==================== Names ====================

    private void assignNames(SqlQuery query) {
        Set<String> tableNames = new HashSet<>();
        List<SqlTableDecl> decls = new ArrayList<>(anchorContext.tableDecls().values());
        decls.sort(Comparator.comparingInt(SqlTableDecl::id));
        for (SqlTableDecl decl : decls) {
            if (decl.redirectTo() != null) {
                continue;
            }
            while (decl.name() == null || tableNames.contains(String.join(".", decl.name()))) {
                decl.name(List.of(anchorContext.nextTableName()));
            }
            tableNames.add(String.join(".", decl.name()));
        }

        for (Cte cte : query.ctes()) {
            if (cte.kind() instanceof Cte.Normal normal) {
                nameInstances(normal.relation());
            } else {
                Cte.Loop loop = (Cte.Loop) cte.kind();
                nameInstances(loop.initial());
                nameInstances(loop.step());
            }
        }
        nameInstances(query.main());
    }

    private void nameInstances(SqlRelation relation) {
        if (!(relation instanceof SqlRelation.AtomicPipeline pipeline)) {
            return;
        }
        Set<String> scope = new HashSet<>();
        for (SqlTransform t : pipeline.transforms()) {
            int riid;
            if (t instanceof SqlTransform.From from) {
                riid = from.riid();
            } else if (t instanceof SqlTransform.Join join) {
                riid = join.riid();
            } else {
                continue;
            }
            RelationInstance instance = anchorContext.relationInstance(riid);
            RelationExpr expr = ctx.relationExpr(riid);
            if (expr instanceof RelationExpr.SubQuery subQuery) {
                nameInstances(subQuery.relation());
            }
            if (instance.name() == null && expr instanceof RelationExpr.Ref ref) {
                List<String> tableName = anchorContext.lookupTableDecl(ref.tid()).name();
                instance.name(tableName.get(tableName.size() - 1));
            }
            while (instance.name() == null || scope.contains(instance.name())) {
                instance.name(anchorContext.nextTableName());
            }
            scope.add(instance.name());
        }
    }
}
