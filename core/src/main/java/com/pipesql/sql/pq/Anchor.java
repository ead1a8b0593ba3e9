package com.pipesql.sql.pq;

import com.pipesql.ir.ColumnSort;
import com.pipesql.ir.rq.Expr;
import com.pipesql.ir.rq.ExprKind;
import com.pipesql.ir.rq.RelationColumn;
import com.pipesql.ir.rq.TableRef;
import com.pipesql.ir.rq.Transform;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.IntUnaryOperator;

/**
 * Splits pipelines into parts that each fit a single SELECT statement.
 *
 * <p>A pipeline is traversed from its end. Transforms are added to the current
 * statement until one of them must be evaluated after a transform that is
 * already in it ({@link SplitRules}), or a column cannot be computed here
 * because of its complexity. The remaining preceding transforms become a new
 * table; the statement reads from it through fresh column ids.
 */
public final class Anchor {

    private static final Logger logger = LoggerFactory.getLogger(Anchor.class);

    /** How complex an expression is, and thus in which clauses it may appear. */
    public enum Complexity {
        /** Simple expressions, usable anywhere. */
        PLAIN,
        /** Expressions that cannot be used in GROUP BY, such as CASE. */
        NON_GROUP,
        /** Window functions. */
        WINDOWED,
        /** Aggregations. */
        AGGREGATION
    }

    /**
     * A column a transform needs.
     *
     * @param column the column id
     * @param maxComplexity highest complexity the column may have to be used in place
     * @param selected whether the column has to be in the projection to be referenced
     */
    record Requirement(int column, Complexity maxComplexity, boolean selected) {}

    /** Result of a split: the preceding part (null when nothing remains) and the statement. */
    record Split(List<SqlTransform> preceding, List<SqlTransform> atomic) {}

    private final AnchorContext ctx;

    public Anchor(AnchorContext ctx) {
        this.ctx = ctx;
    }

    /**
     * Extracts the last part of a pipeline that fits a single SELECT. The preceding
     * part is declared as a new table, not yet compiled, in the context.
     */
    public List<SqlTransform> extractAtomic(List<SqlTransform> pipeline) {
        List<Integer> output = ctx.determineSelectColumns(pipeline);
        Split split = splitOffBack(pipeline, output);

        List<SqlTransform> atomic = split.atomic();
        if (split.preceding() != null) {
            logger.debug("Pipeline split after {}",
                         SqlTransform.kindName(split.preceding().get(split.preceding().size() - 2)));
            atomic = anchorSplit(split.preceding(), atomic);
        }

        // the projection may contain columns that are only needed by other clauses
        List<Integer> finalOutput = redirectCids(output, atomic);
        List<Integer> selectCols = null;
        for (SqlTransform t : atomic) {
            if (SqlTransform.superOf(t) instanceof Transform.Select select) {
                selectCols = select.columns();
                break;
            }
        }
        if (selectCols != null && !finalOutput.containsAll(selectCols)) {
            logger.debug("Appending a projection, previous one contained columns that were not requested");
            List<SqlTransform> withSelect = new ArrayList<>(atomic);
            withSelect.add(new SqlTransform.Super(new Transform.Select(selectCols)));
            return anchorSplit(withSelect, List.of(new SqlTransform.Super(new Transform.Select(finalOutput))));
        }
        return atomic;
    }

    /**
     * Splits a pipeline so that the second part contains as many transforms as
     * possible while fitting into one SELECT.
     */
    Split splitOffBack(List<SqlTransform> pipeline, List<Integer> output) {
        if (pipeline.isEmpty()) {
            return new Split(null, List.of());
        }
        List<SqlTransform> remaining = new ArrayList<>(pipeline);
        Set<String> following = new HashSet<>();
        List<Requirement> required = new ArrayList<>(requirements(output, Complexity.AGGREGATION, true));
        Set<Integer> available = new HashSet<>();
        List<SqlTransform> current = new ArrayList<>();

        traversal:
        while (!remaining.isEmpty()) {
            SqlTransform t = remaining.remove(remaining.size() - 1);
            if (isSplitRequired(t, following)) {
                logger.debug("Split required before {}, following: {}", SqlTransform.kindName(t), following);
                remaining.add(t);
                break;
            }
            required.addAll(getRequirements(t, following));

            Transform sup = SqlTransform.superOf(t);
            if (sup instanceof Transform.Compute compute) {
                if (!canMaterialize(compute, required)) {
                    remaining.add(t);
                    break;
                }
                available.add(compute.id());
            } else if (sup instanceof Transform.Aggregate aggregate) {
                for (int cid : aggregate.compute()) {
                    if (ctx.columnDecl(cid) instanceof ColumnDecl.OfCompute decl
                        && !canMaterialize(decl.compute(), required)) {
                        remaining.add(t);
                        break traversal;
                    }
                }
            } else if (t instanceof SqlTransform.From from) {
                available.addAll(ctx.relationInstance(from.riid()).cids());
            } else if (t instanceof SqlTransform.Join join) {
                available.addAll(ctx.relationInstance(join.riid()).cids());
            }

            if (!(sup instanceof Transform.Select)) {
                current.add(t);
            }
        }

        // output keeps its duplicates, selected inputs do not
        List<Integer> columns = new ArrayList<>(output);
        for (Requirement r : required) {
            if (r.selected() && !columns.contains(r.column())) {
                columns.add(r.column());
            }
        }
        if (columns.isEmpty()) {
            // s-strings may leave a statement without requirements
            for (SqlTransform t : current) {
                if (t instanceof SqlTransform.From from) {
                    columns.add(ctx.registerWildcard(from.riid()));
                } else if (t instanceof SqlTransform.Join join) {
                    columns.add(ctx.registerWildcard(join.riid()));
                }
            }
        }
        current.add(new SqlTransform.Super(new Transform.Select(columns)));
        Collections.reverse(current);

        if (remaining.isEmpty()) {
            return new Split(null, current);
        }
        Set<Integer> missing = new LinkedHashSet<>();
        for (Requirement r : required) {
            if (!available.contains(r.column())) {
                missing.add(r.column());
            }
        }
        logger.debug("Statement complete; available {}, missing {}", available, missing);
        remaining.add(new SqlTransform.Super(new Transform.Select(new ArrayList<>(missing))));
        return new Split(remaining, current);
    }

    private boolean canMaterialize(Transform.Compute compute, List<Requirement> required) {
        Complexity complexity = inferComplexity(compute);
        Complexity max = Complexity.AGGREGATION;
        for (Requirement r : required) {
            if (r.column() == compute.id() && r.maxComplexity().compareTo(max) < 0) {
                max = r.maxComplexity();
            }
        }
        boolean can = complexity.compareTo(max) <= 0;
        if (!can) {
            logger.debug("Column {} has complexity {}, but is required to have at most {}",
                         compute.id(), complexity, max);
        }
        return can;
    }

    /**
     * Decides whether the pipeline must be split before {@code t}. When it need
     * not, the kind of {@code t} is added to {@code following}.
     */
    static boolean isSplitRequired(SqlTransform t, Set<String> following) {
        // aggregated computes are evaluated by their aggregate
        if (SqlTransform.superOf(t) instanceof Transform.Compute compute && compute.isAggregation()) {
            return false;
        }
        String kind = SqlTransform.kindName(t);
        boolean split = SplitRules.splitRequired(kind, following);
        if (!split) {
            following.add(kind);
        }
        return split;
    }

    static List<Requirement> getRequirements(SqlTransform t, Set<String> following) {
        Transform sup = SqlTransform.superOf(t);
        if (sup instanceof Transform.Aggregate aggregate) {
            List<Requirement> r = new ArrayList<>(requirements(aggregate.partition(), Complexity.PLAIN, false));
            r.addAll(requirements(aggregate.compute(), Complexity.AGGREGATION, false));
            return r;
        }
        if (sup instanceof Transform.Compute compute) {
            Complexity max = inferComplexity(compute) == Complexity.PLAIN ? Complexity.AGGREGATION : Complexity.PLAIN;
            List<Requirement> r = new ArrayList<>(requirements(Cids.collect(compute.expr()), max, false));
            if (compute.window() != null) {
                r.addAll(requirements(compute.window().partition(), Complexity.PLAIN, false));
                r.addAll(requirements(compute.window().sort().stream().map(ColumnSort::column).toList(),
                                      Complexity.PLAIN, false));
            }
            return r;
        }
        if (sup instanceof Transform.Filter filter) {
            Complexity max = following.contains("Aggregate") ? Complexity.PLAIN : Complexity.AGGREGATION;
            return requirements(Cids.collect(filter.condition()), max, false);
        }
        if (sup instanceof Transform.Sort sort) {
            // ORDER BY refers to aliases, so the columns may be of any complexity
            return requirements(sort.by().stream().map(ColumnSort::column).toList(), Complexity.AGGREGATION, true);
        }
        if (sup instanceof Transform.Take take) {
            List<Integer> cids = new ArrayList<>(Cids.collect(take.range().start()));
            cids.addAll(Cids.collect(take.range().end()));
            return requirements(cids, Complexity.PLAIN, false);
        }
        if (t instanceof SqlTransform.Join join) {
            return requirements(Cids.collect(join.filter()), Complexity.PLAIN, false);
        }
        return List.of();
    }

    private static List<Requirement> requirements(List<Integer> cids, Complexity max, boolean selected) {
        return cids.stream().map(cid -> new Requirement(cid, max, selected)).toList();
    }

    public static Complexity inferComplexity(Transform.Compute compute) {
        if (compute.window() != null) {
            return Complexity.WINDOWED;
        }
        if (compute.isAggregation()) {
            return Complexity.AGGREGATION;
        }
        return inferComplexity(compute.expr());
    }

    static Complexity inferComplexity(Expr expr) {
        ExprKind kind = expr.kind();
        if (kind instanceof ExprKind.Case) {
            return Complexity.NON_GROUP;
        }
        List<Expr> args = kind instanceof ExprKind.Operator op ? op.args()
            : kind instanceof ExprKind.Array array ? array.items()
            : List.of();
        Complexity result = Complexity.PLAIN;
        for (Expr arg : args) {
            Complexity c = inferComplexity(arg);
            if (c.compareTo(result) > 0) {
                result = c;
            }
        }
        return result;
    }

    // ==================== Splitting ====================

    /**
     * Declares {@code preceding} as a new table and makes {@code atomic} read from
     * it: a From is prepended and every reference to a column of the preceding
     * part is redirected to the new table's column.
     */
    public List<SqlTransform> anchorSplit(List<SqlTransform> preceding, List<SqlTransform> atomic) {
        Transform.Select select = (Transform.Select) SqlTransform.superOf(preceding.get(preceding.size() - 1));
        List<Integer> colsAtSplit = select.columns();
        logger.debug("Split pipeline, first part outputs {}", colsAtSplit);

        Map<Integer, Integer> redirects = new HashMap<>();
        Map<String, Integer> usedNames = new HashMap<>();
        List<TableRef.TableColumn> newColumns = new ArrayList<>();
        List<RelationColumn> declColumns = new ArrayList<>();
        for (int oldCid : colsAtSplit) {
            int newCid = ctx.nextCid();
            String name = ctx.ensureColumnName(oldCid);
            if (name != null) {
                Integer owner = usedNames.get(name);
                if (owner != null && owner != oldCid) {
                    name = ctx.nextColumnName();
                    ctx.columnName(oldCid, name);
                }
                usedNames.put(name, oldCid);
                ctx.columnName(newCid, name);
            }
            RelationColumn column = ctx.isWildcard(oldCid) ? RelationColumn.WILDCARD : new RelationColumn.Single(name);
            newColumns.add(new TableRef.TableColumn(column, newCid));
            declColumns.add(new RelationColumn.Single(null));
            redirects.put(oldCid, newCid);
        }

        SqlTableDecl decl = ctx.declareTable(null, new RelationAdapter.Preprocessed(preceding, declColumns));
        int riid = ctx.createRelationInstance(new TableRef(decl.id(), newColumns, null), redirects);

        List<SqlTransform> second = new ArrayList<>();
        second.add(new SqlTransform.From(riid));
        second.addAll(atomic);
        return redirectPipeline(second);
    }

    // ==================== Redirects ====================

    /** Rewrites a pipeline to use the columns of its first From instead of the ones they replaced. */
    public List<SqlTransform> redirectPipeline(List<SqlTransform> pipeline) {
        Map<Integer, Integer> redirects = firstFromRedirects(pipeline);
        if (redirects == null) {
            return pipeline;
        }
        IntUnaryOperator f = cid -> redirects.getOrDefault(cid, cid);
        List<SqlTransform> result = new ArrayList<>();
        for (SqlTransform t : pipeline) {
            result.add(redirect(t, f));
        }
        return result;
    }

    private SqlTransform redirect(SqlTransform t, IntUnaryOperator f) {
        if (t instanceof SqlTransform.Super sup) {
            Transform mapped = Cids.map(sup.transform(), f);
            if (mapped instanceof Transform.Compute compute) {
                ctx.registerCompute(compute);
            }
            return new SqlTransform.Super(mapped);
        }
        if (t instanceof SqlTransform.Join join) {
            return new SqlTransform.Join(join.side(), join.riid(), Cids.map(join.filter(), f));
        }
        if (t instanceof SqlTransform.Select select) {
            return new SqlTransform.Select(Cids.map(select.columns(), f));
        }
        if (t instanceof SqlTransform.Filter filter) {
            return new SqlTransform.Filter(Cids.map(filter.condition(), f));
        }
        if (t instanceof SqlTransform.Aggregate aggregate) {
            return new SqlTransform.Aggregate(Cids.map(aggregate.partition(), f), Cids.map(aggregate.compute(), f));
        }
        if (t instanceof SqlTransform.Sort sort) {
            return new SqlTransform.Sort(Cids.mapSorts(sort.by(), f));
        }
        if (t instanceof SqlTransform.Take take) {
            return new SqlTransform.Take(Cids.mapTake(take.take(), f));
        }
        if (t instanceof SqlTransform.DistinctOn distinctOn) {
            return new SqlTransform.DistinctOn(Cids.map(distinctOn.columns(), f));
        }
        return t;
    }

    /** Redirects column ids within the context of a pipeline, by the redirects of its first From. */
    public List<Integer> redirectCids(List<Integer> cids, List<SqlTransform> pipeline) {
        Map<Integer, Integer> redirects = firstFromRedirects(pipeline);
        if (redirects == null) {
            return cids;
        }
        return Cids.map(cids, cid -> redirects.getOrDefault(cid, cid));
    }

    public List<ColumnSort<Integer>> redirectSorts(List<ColumnSort<Integer>> sorts, int riid) {
        Map<Integer, Integer> redirects = ctx.relationInstance(riid).cidRedirects();
        return Cids.mapSorts(sorts, cid -> redirects.getOrDefault(cid, cid));
    }

    private Map<Integer, Integer> firstFromRedirects(List<SqlTransform> pipeline) {
        if (pipeline.isEmpty() || !(pipeline.get(0) instanceof SqlTransform.From from)) {
            return null;
        }
        return ctx.relationInstance(from.riid()).cidRedirects();
    }
}
