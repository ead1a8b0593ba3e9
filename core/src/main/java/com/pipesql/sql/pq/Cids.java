package com.pipesql.sql.pq;

import com.pipesql.ir.ColumnSort;
import com.pipesql.ir.rq.Expr;
import com.pipesql.ir.rq.ExprKind;
import com.pipesql.ir.rq.InterpolateItem;
import com.pipesql.ir.rq.Range;
import com.pipesql.ir.rq.TableRef;
import com.pipesql.ir.rq.Transform;
import com.pipesql.ir.rq.Window;

import java.util.ArrayList;
import java.util.List;
import java.util.function.IntUnaryOperator;

/**
 * Collects and rewrites column ids within expressions and transforms.
 *
 * <p>Collection preserves order and duplicates so downstream output stays
 * deterministic.
 */
public final class Cids {

    private Cids() {}

    // ==================== Collect ====================

    public static List<Integer> collect(Expr expr) {
        List<Integer> cids = new ArrayList<>();
        collect(expr, cids);
        return cids;
    }

    public static List<Integer> collect(Transform transform) {
        List<Integer> cids = new ArrayList<>();
        collect(transform, cids);
        return cids;
    }

    private static void collect(Expr expr, List<Integer> out) {
        if (expr == null) {
            return;
        }
        ExprKind kind = expr.kind();
        if (kind instanceof ExprKind.ColumnRef ref) {
            out.add(ref.cid());
        } else if (kind instanceof ExprKind.Operator op) {
            op.args().forEach(a -> collect(a, out));
        } else if (kind instanceof ExprKind.Array array) {
            array.items().forEach(a -> collect(a, out));
        } else if (kind instanceof ExprKind.Case c) {
            for (ExprKind.SwitchCase sc : c.cases()) {
                collect(sc.condition(), out);
                collect(sc.value(), out);
            }
        } else if (kind instanceof ExprKind.SString s) {
            for (InterpolateItem item : s.items()) {
                if (item instanceof InterpolateItem.Expression e) {
                    collect(e.expr(), out);
                }
            }
        }
    }

    private static void collect(Transform t, List<Integer> out) {
        if (t instanceof Transform.From from) {
            from.table().columns().forEach(c -> out.add(c.cid()));
        } else if (t instanceof Transform.Compute compute) {
            out.add(compute.id());
            collect(compute.expr(), out);
            if (compute.window() != null) {
                out.addAll(compute.window().partition());
                compute.window().sort().forEach(s -> out.add(s.column()));
                collect(compute.window().frame().range().start(), out);
                collect(compute.window().frame().range().end(), out);
            }
        } else if (t instanceof Transform.Select select) {
            out.addAll(select.columns());
        } else if (t instanceof Transform.Filter filter) {
            collect(filter.condition(), out);
        } else if (t instanceof Transform.Aggregate aggregate) {
            out.addAll(aggregate.partition());
            out.addAll(aggregate.compute());
        } else if (t instanceof Transform.Sort sort) {
            sort.by().forEach(s -> out.add(s.column()));
        } else if (t instanceof Transform.Take take) {
            collect(take.range().start(), out);
            collect(take.range().end(), out);
            out.addAll(take.partition());
            take.sort().forEach(s -> out.add(s.column()));
        } else if (t instanceof Transform.Join join) {
            join.with().columns().forEach(c -> out.add(c.cid()));
            collect(join.filter(), out);
        } else if (t instanceof Transform.Append append) {
            append.bottom().columns().forEach(c -> out.add(c.cid()));
        } else if (t instanceof Transform.Loop loop) {
            loop.pipeline().forEach(inner -> collect(inner, out));
        }
    }

    // ==================== Map ====================

    public static Expr map(Expr expr, IntUnaryOperator f) {
        if (expr == null) {
            return null;
        }
        ExprKind kind = expr.kind();
        if (kind instanceof ExprKind.ColumnRef ref) {
            return expr.withKind(new ExprKind.ColumnRef(f.applyAsInt(ref.cid())));
        }
        if (kind instanceof ExprKind.Operator op) {
            return expr.withKind(new ExprKind.Operator(op.name(), mapExprs(op.args(), f)));
        }
        if (kind instanceof ExprKind.Array array) {
            return expr.withKind(new ExprKind.Array(mapExprs(array.items(), f)));
        }
        if (kind instanceof ExprKind.Case c) {
            List<ExprKind.SwitchCase> cases = new ArrayList<>();
            for (ExprKind.SwitchCase sc : c.cases()) {
                cases.add(new ExprKind.SwitchCase(map(sc.condition(), f), map(sc.value(), f)));
            }
            return expr.withKind(new ExprKind.Case(cases));
        }
        if (kind instanceof ExprKind.SString s) {
            List<InterpolateItem> items = new ArrayList<>();
            for (InterpolateItem item : s.items()) {
                items.add(item instanceof InterpolateItem.Expression e
                    ? new InterpolateItem.Expression(map(e.expr(), f))
                    : item);
            }
            return expr.withKind(new ExprKind.SString(items));
        }
        return expr;
    }

    public static List<Integer> map(List<Integer> cids, IntUnaryOperator f) {
        return cids.stream().map(f::applyAsInt).toList();
    }

    public static List<ColumnSort<Integer>> mapSorts(List<ColumnSort<Integer>> sorts, IntUnaryOperator f) {
        return sorts.stream().map(s -> s.withColumn(f.applyAsInt(s.column()))).toList();
    }

    public static Transform map(Transform t, IntUnaryOperator f) {
        if (t instanceof Transform.Compute c) {
            Window window = c.window() == null ? null : new Window(
                c.window().frame(), map(c.window().partition(), f), mapSorts(c.window().sort(), f));
            return new Transform.Compute(f.applyAsInt(c.id()), map(c.expr(), f), window, c.isAggregation());
        }
        if (t instanceof Transform.Select s) {
            return new Transform.Select(map(s.columns(), f));
        }
        if (t instanceof Transform.Filter filter) {
            return new Transform.Filter(map(filter.condition(), f));
        }
        if (t instanceof Transform.Aggregate a) {
            return new Transform.Aggregate(map(a.partition(), f), map(a.compute(), f));
        }
        if (t instanceof Transform.Sort s) {
            return new Transform.Sort(mapSorts(s.by(), f));
        }
        if (t instanceof Transform.Take take) {
            return mapTake(take, f);
        }
        if (t instanceof Transform.Join join) {
            return new Transform.Join(join.side(), mapTableRef(join.with(), f), map(join.filter(), f));
        }
        if (t instanceof Transform.From from) {
            return new Transform.From(mapTableRef(from.table(), f));
        }
        if (t instanceof Transform.Append append) {
            return new Transform.Append(mapTableRef(append.bottom(), f));
        }
        if (t instanceof Transform.Loop loop) {
            return new Transform.Loop(loop.pipeline().stream().map(inner -> map(inner, f)).toList());
        }
        return t;
    }

    static Transform.Take mapTake(Transform.Take take, IntUnaryOperator f) {
        Range range = new Range(map(take.range().start(), f), map(take.range().end(), f));
        return new Transform.Take(range, map(take.partition(), f), mapSorts(take.sort(), f));
    }

    private static TableRef mapTableRef(TableRef ref, IntUnaryOperator f) {
        List<TableRef.TableColumn> columns = ref.columns().stream()
            .map(c -> new TableRef.TableColumn(c.column(), f.applyAsInt(c.cid())))
            .toList();
        return new TableRef(ref.source(), columns, ref.name());
    }

    private static List<Expr> mapExprs(List<Expr> exprs, IntUnaryOperator f) {
        return exprs.stream().map(e -> map(e, f)).toList();
    }
}
