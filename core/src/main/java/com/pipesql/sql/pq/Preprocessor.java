package com.pipesql.sql.pq;

import com.pipesql.exception.CodegenException;
import com.pipesql.ir.ColumnSort;
import com.pipesql.ir.JoinSide;
import com.pipesql.ir.Literal;
import com.pipesql.ir.WindowKind;
import com.pipesql.ir.rq.Expr;
import com.pipesql.ir.rq.ExprKind;
import com.pipesql.ir.rq.Range;
import com.pipesql.ir.rq.Transform;
import com.pipesql.ir.rq.Window;
import com.pipesql.ir.rq.WindowFrame;
import com.pipesql.sql.Dialect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Converts a relational pipeline into SQL transforms and rewrites the patterns
 * that have a direct SQL spelling: DISTINCT, DISTINCT ON, UNION, EXCEPT and
 * INTERSECT.
 *
 * <p>Splitting relies on the final reordering step, which moves computes in
 * front of sorts and takes.
 */
public final class Preprocessor {

    private static final Logger logger = LoggerFactory.getLogger(Preprocessor.class);

    private final AnchorContext ctx;
    private final Dialect dialect;

    public Preprocessor(AnchorContext ctx) {
        this.ctx = ctx;
        this.dialect = ctx.dialect();
    }

    public List<SqlTransform> preprocess(List<Transform> pipeline) {
        List<SqlTransform> result = wrap(normalize(pipeline));
        result = pruneInputs(result);
        result = distinct(result);
        result = union(result);
        result = except(result);
        result = intersect(result);
        result = reorder(result);
        logger.debug("Preprocessed pipeline of {} transforms into {}", pipeline.size(), result.size());
        return result;
    }

    // ==================== Normalize ====================

    /** Moves null to the right side of equality checks. */
    static List<Transform> normalize(List<Transform> pipeline) {
        List<Transform> result = new ArrayList<>();
        for (Transform t : pipeline) {
            result.add(normalize(t));
        }
        return result;
    }

    private static Transform normalize(Transform t) {
        if (t instanceof Transform.Filter filter) {
            return new Transform.Filter(normalize(filter.condition()));
        }
        if (t instanceof Transform.Compute c) {
            return new Transform.Compute(c.id(), normalize(c.expr()), c.window(), c.isAggregation());
        }
        if (t instanceof Transform.Join join) {
            return new Transform.Join(join.side(), join.with(), normalize(join.filter()));
        }
        if (t instanceof Transform.Loop loop) {
            return new Transform.Loop(normalize(loop.pipeline()));
        }
        return t;
    }

    static Expr normalize(Expr expr) {
        if (expr == null) {
            return null;
        }
        ExprKind kind = expr.kind();
        if (kind instanceof ExprKind.Operator op) {
            List<Expr> args = op.args().stream().map(Preprocessor::normalize).toList();
            if ((op.name().equals("std.eq") || op.name().equals("std.ne"))
                && args.size() == 2 && isNull(args.get(0))) {
                args = List.of(args.get(1), args.get(0));
            }
            return expr.withKind(new ExprKind.Operator(op.name(), args));
        }
        if (kind instanceof ExprKind.Case c) {
            List<ExprKind.SwitchCase> cases = c.cases().stream()
                .map(sc -> new ExprKind.SwitchCase(normalize(sc.condition()), normalize(sc.value())))
                .toList();
            return expr.withKind(new ExprKind.Case(cases));
        }
        return expr;
    }

    static boolean isNull(Expr expr) {
        return expr.kind() instanceof ExprKind.Lit lit && lit.value() instanceof Literal.Null;
    }

    // ==================== Wrap & Prune ====================

    private List<SqlTransform> wrap(List<Transform> pipeline) {
        List<SqlTransform> result = new ArrayList<>();
        for (Transform t : pipeline) {
            if (t instanceof Transform.From from) {
                result.add(new SqlTransform.From(ctx.riidOf(from.table())));
            } else if (t instanceof Transform.Join join) {
                result.add(new SqlTransform.Join(join.side(), ctx.riidOf(join.with()), join.filter()));
            } else {
                result.add(new SqlTransform.Super(t));
            }
        }
        return result;
    }

    /** Removes the columns of relation instances that nothing after them uses. */
    private List<SqlTransform> pruneInputs(List<SqlTransform> pipeline) {
        Set<Integer> used = new HashSet<>();
        for (int i = pipeline.size() - 1; i >= 0; i--) {
            SqlTransform t = pipeline.get(i);
            if (t instanceof SqlTransform.Join join) {
                used.addAll(Cids.collect(join.filter()));
                prune(join.riid(), used);
            } else if (t instanceof SqlTransform.From from) {
                prune(from.riid(), used);
            } else if (t instanceof SqlTransform.Super sup) {
                used.addAll(Cids.collect(sup.transform()));
            }
        }
        return pipeline;
    }

    private void prune(int riid, Set<Integer> used) {
        ctx.relationInstance(riid).columns().removeIf(c -> !used.contains(c.cid()));
    }

    // ==================== Distinct ====================

    /** Rewrites a take within groups as DISTINCT, DISTINCT ON or a row number filter. */
    private List<SqlTransform> distinct(List<SqlTransform> pipeline) {
        List<SqlTransform> result = new ArrayList<>();
        for (SqlTransform t : pipeline) {
            if (!(SqlTransform.superOf(t) instanceof Transform.Take take) || take.partition().isEmpty()) {
                result.add(t);
                continue;
            }
            Long start = asInt(take.range().start());
            Long end = asInt(take.range().end());
            boolean takeOnlyFirst = (start == null || start == 1) && end != null && end == 1;

            Set<Integer> columns = new HashSet<>(ctx.determineSelectColumns(pipeline));
            boolean matchingColumns = columns.equals(new HashSet<>(take.partition()));

            if (takeOnlyFirst && take.sort().isEmpty() && matchingColumns) {
                result.add(new SqlTransform.Distinct());
            } else if (takeOnlyFirst && dialect.supportsDistinctOn()) {
                List<ColumnSort<Integer>> sort = new ArrayList<>();
                if (!take.sort().isEmpty()) {
                    take.partition().forEach(cid -> sort.add(ColumnSort.asc(cid)));
                    sort.addAll(take.sort());
                }
                result.add(new SqlTransform.Super(new Transform.Sort(sort)));
                result.add(new SqlTransform.DistinctOn(take.partition()));
            } else {
                result.addAll(filterByRowNumber(start, end, take));
            }
        }
        return result;
    }

    private List<SqlTransform> filterByRowNumber(Long start, Long end, Transform.Take take) {
        WindowFrame frame = take.sort().isEmpty()
            ? WindowFrame.DEFAULT
            : new WindowFrame(WindowKind.RANGE, new Range(null, intExpr(0)));
        Window window = new Window(frame, take.partition(), take.sort());
        Transform.Compute compute =
            new Transform.Compute(ctx.nextCid(), Expr.of(ExprKind.SString.raw("ROW_NUMBER()")), window, false);
        ctx.registerCompute(compute);

        Expr column = Expr.columnRef(compute.id());
        Expr condition;
        if (start != null && start.equals(end)) {
            condition = binary(column, "std.eq", intExpr(start));
        } else {
            Expr lower = start == null ? null : binary(column, "std.gte", intExpr(start));
            Expr upper = end == null ? null : binary(column, "std.lte", intExpr(end));
            if (lower != null && upper != null) {
                condition = binary(lower, "std.and", upper);
            } else if (lower != null || upper != null) {
                condition = lower != null ? lower : upper;
            } else {
                condition = Expr.of(new ExprKind.Lit(new Literal.Bool(true)));
            }
        }
        return List.of(new SqlTransform.Super(compute), new SqlTransform.Super(new Transform.Filter(condition)));
    }

    private static Long asInt(Expr expr) {
        if (expr == null) {
            return null;
        }
        if (expr.kind() instanceof ExprKind.Lit lit && lit.value() instanceof Literal.Int i) {
            return i.value();
        }
        throw new CodegenException("Invalid take arguments", expr.span());
    }

    private static Expr intExpr(long value) {
        return Expr.of(new ExprKind.Lit(new Literal.Int(value)));
    }

    private static Expr binary(Expr left, String op, Expr right) {
        return Expr.of(new ExprKind.Operator(op, List.of(left, right)));
    }

    // ==================== Set Operations ====================

    private List<SqlTransform> union(List<SqlTransform> pipeline) {
        List<SqlTransform> result = new ArrayList<>();
        for (int i = 0; i < pipeline.size(); i++) {
            SqlTransform t = pipeline.get(i);
            if (!(SqlTransform.superOf(t) instanceof Transform.Append append)) {
                result.add(t);
                continue;
            }
            boolean distinct = i + 1 < pipeline.size() && pipeline.get(i + 1) instanceof SqlTransform.Distinct;
            if (distinct) {
                i++;
            }
            result.add(new SqlTransform.Union(ctx.riidOf(append.bottom()), distinct));
        }
        return result;
    }

    /** Recognizes an anti-join over all columns followed by a null check as EXCEPT. */
    private List<SqlTransform> except(List<SqlTransform> pipeline) {
        Set<Integer> output = new HashSet<>(ctx.determineSelectColumns(pipeline));
        List<SqlTransform> res = new ArrayList<>();
        for (SqlTransform t : pipeline) {
            res.add(t);
            if (res.size() < 2) {
                continue;
            }
            if (!(res.get(res.size() - 2) instanceof SqlTransform.Join join) || join.side() != JoinSide.LEFT) {
                continue;
            }
            if (!(SqlTransform.superOf(res.get(res.size() - 1)) instanceof Transform.Filter filter)) {
                continue;
            }
            List<Integer> top = ctx.determineSelectColumns(res.subList(0, res.size() - 2));
            List<Integer> bottom = ctx.relationInstance(join.riid()).cids();

            List<Expr> joinLeft = new ArrayList<>();
            List<Expr> joinRight = new ArrayList<>();
            collectEquals(join.filter(), joinLeft, joinRight);
            if (!allIn(top, joinLeft) || !allIn(bottom, joinRight)) {
                continue;
            }
            List<Expr> filterLeft = new ArrayList<>();
            List<Expr> filterRight = new ArrayList<>();
            collectEquals(filter.condition(), filterLeft, filterRight);
            if (!allIn(bottom, filterLeft) || !filterRight.stream().allMatch(Preprocessor::isNull)) {
                continue;
            }
            if (bottom.stream().anyMatch(output::contains)
                || !keepsTopColumnsOnly(res.subList(0, res.size() - 2), top, join.riid(), output)) {
                continue;
            }

            boolean distinct = res.size() >= 3 && res.get(res.size() - 3) instanceof SqlTransform.Distinct;
            if (!distinct && !dialect.exceptAll()) {
                continue;
            }

            res.remove(res.size() - 1);
            res.remove(res.size() - 1);
            if (distinct && !res.isEmpty() && res.get(res.size() - 1) instanceof SqlTransform.Distinct) {
                res.remove(res.size() - 1);
            }
            res.add(new SqlTransform.Except(join.riid(), distinct));
        }
        return res;
    }

    /** Recognizes an inner join over all columns that keeps only the top columns as INTERSECT. */
    private List<SqlTransform> intersect(List<SqlTransform> pipeline) {
        Set<Integer> output = new HashSet<>(ctx.determineSelectColumns(pipeline));
        List<SqlTransform> res = new ArrayList<>();
        for (int i = 0; i < pipeline.size(); i++) {
            res.add(pipeline.get(i));
            if (!(res.get(res.size() - 1) instanceof SqlTransform.Join join) || join.side() != JoinSide.INNER) {
                continue;
            }
            List<Integer> top = ctx.determineSelectColumns(res.subList(0, res.size() - 1));
            List<Integer> bottom = ctx.relationInstance(join.riid()).cids();

            List<Expr> left = new ArrayList<>();
            List<Expr> right = new ArrayList<>();
            collectEquals(join.filter(), left, right);
            if (!allIn(top, left) || !allIn(bottom, right)) {
                continue;
            }
            if (bottom.stream().anyMatch(output::contains)
                || !keepsTopColumnsOnly(res.subList(0, res.size() - 1), top, join.riid(), output)) {
                continue;
            }

            boolean nextDistinct = i + 1 < pipeline.size() && pipeline.get(i + 1) instanceof SqlTransform.Distinct;
            boolean distinct = (res.size() > 1 && res.get(res.size() - 2) instanceof SqlTransform.Distinct)
                || nextDistinct;
            if (!distinct && !dialect.intersectAll()) {
                continue;
            }

            res.remove(res.size() - 1);
            if (distinct) {
                if (!res.isEmpty() && res.get(res.size() - 1) instanceof SqlTransform.Distinct) {
                    res.remove(res.size() - 1);
                }
                if (nextDistinct) {
                    i++;
                }
            }
            res.add(new SqlTransform.Intersect(join.riid(), distinct));
        }
        return res;
    }

    /**
     * Whether a join can be read as a set operation: the output consists of top
     * columns only, and neither side reads a table whose columns are unknown.
     * Inputs are pruned to the columns they use, so a wildcard hides the other
     * columns of its table.
     */
    private boolean keepsTopColumnsOnly(List<SqlTransform> preceding, List<Integer> top, int bottomRiid,
                                        Set<Integer> output) {
        if (!top.containsAll(output)) {
            return false;
        }
        if (ctx.containsWildcard(ctx.relationInstance(bottomRiid).originalCids())) {
            return false;
        }
        for (SqlTransform t : preceding) {
            int riid;
            if (t instanceof SqlTransform.From from) {
                riid = from.riid();
            } else if (t instanceof SqlTransform.Join join) {
                riid = join.riid();
            } else {
                continue;
            }
            if (ctx.containsWildcard(ctx.relationInstance(riid).originalCids())) {
                return false;
            }
        }
        return true;
    }

    /** Splits {@code (a == b) && (c == d)} into {@code [a, c]} and {@code [b, d]}. */
    private static void collectEquals(Expr expr, List<Expr> lefts, List<Expr> rights) {
        if (expr != null && expr.kind() instanceof ExprKind.Operator op && op.args().size() == 2) {
            if (op.name().equals("std.eq")) {
                lefts.add(op.args().get(0));
                rights.add(op.args().get(1));
            } else if (op.name().equals("std.and")) {
                collectEquals(op.args().get(0), lefts, rights);
                collectEquals(op.args().get(1), lefts, rights);
            }
        }
    }

    private static boolean allIn(List<Integer> cids, List<Expr> exprs) {
        Set<Integer> refs = new HashSet<>();
        for (Expr e : exprs) {
            if (e.kind() instanceof ExprKind.ColumnRef ref) {
                refs.add(ref.cid());
            }
        }
        return refs.containsAll(cids);
    }

    // ==================== Reorder ====================

    /**
     * Moves computes in front of sorts, and plain computes in front of takes.
     * Stable; other transforms keep their relative order.
     */
    static List<SqlTransform> reorder(List<SqlTransform> pipeline) {
        List<SqlTransform> result = new ArrayList<>(pipeline);
        for (int i = 1; i < result.size(); i++) {
            int j = i;
            while (j > 0 && mustPrecede(result.get(j), result.get(j - 1))) {
                Collections.swap(result, j, j - 1);
                j--;
            }
        }
        return result;
    }

    private static boolean mustPrecede(SqlTransform a, SqlTransform b) {
        if (!(SqlTransform.superOf(a) instanceof Transform.Compute compute)) {
            return false;
        }
        Transform other = SqlTransform.superOf(b);
        if (other instanceof Transform.Sort) {
            return true;
        }
        return other instanceof Transform.Take && Anchor.inferComplexity(compute) == Anchor.Complexity.PLAIN;
    }
}
