package com.pipesql.lowering;

import com.pipesql.diagnostic.Span;
import com.pipesql.exception.LoweringException;
import com.pipesql.ir.ColumnSort;
import com.pipesql.ir.Literal;
import com.pipesql.ir.pl.Expr;
import com.pipesql.ir.pl.ExprKind;
import com.pipesql.ir.pl.InterpolateItem;
import com.pipesql.ir.pl.Lineage;
import com.pipesql.ir.pl.TransformKind;
import com.pipesql.ir.rq.Range;
import com.pipesql.ir.rq.Relation;
import com.pipesql.ir.rq.RelationColumn;
import com.pipesql.ir.rq.RelationKind;
import com.pipesql.ir.rq.RelationalQuery;
import com.pipesql.ir.rq.TableDecl;
import com.pipesql.ir.rq.TableRef;
import com.pipesql.ir.rq.Transform;
import com.pipesql.ir.rq.Window;
import com.pipesql.ir.rq.WindowFrame;
import com.pipesql.semantic.RelationDecl;
import com.pipesql.semantic.ResolvedQuery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Lowers a resolved query into the relational query.
 *
 * <p>Names disappear: every column gets an integer id, and every relation the
 * main pipeline reads becomes a table declaration. Relations are lowered when
 * first referenced, so a table is always declared before the tables using it and
 * unreferenced relations are dropped.
 */
public final class Lowerer {

    private static final Logger logger = LoggerFactory.getLogger(Lowerer.class);

    private final ResolvedQuery query;
    private final List<TableDecl> tables = new ArrayList<>();
    private final Map<String, Integer> tableIds = new HashMap<>();
    private final Map<Integer, List<RelationColumn>> tableColumns = new HashMap<>();

    /** Column id of each lowered expression. */
    private final Map<Integer, Integer> columnMapping = new HashMap<>();

    /** Columns of each table instance, by the id of the input that declared it. */
    private final Map<Integer, List<TableRef.TableColumn>> inputMapping = new HashMap<>();

    private final Set<Integer> loopParams = new HashSet<>();
    private int nextCid;
    private int nextTid;

    private List<Transform> pipeline = new ArrayList<>();
    private Window window;

    private Lowerer(ResolvedQuery query) {
        this.query = query;
    }

    public static RelationalQuery lower(ResolvedQuery query) {
        Lowerer lowerer = new Lowerer(query);
        Relation main = lowerer.lowerRelation(query.main());
        logger.debug("Lowered main relation with {} table(s) and {} column id(s)",
            lowerer.tables.size(), lowerer.nextCid);
        return new RelationalQuery(query.def(), lowerer.tables, main);
    }

    // ==================== Relations ====================

    private Relation lowerRelation(Expr expr) {
        Expr flat = Flattener.flatten(expr);
        List<Transform> savedPipeline = pipeline;
        Window savedWindow = window;
        pipeline = new ArrayList<>();
        try {
            lowerPipeline(flat);
            List<Selected> selected = expand(flat.lineage(), flat.span());
            List<Integer> cids = new ArrayList<>();
            List<RelationColumn> columns = new ArrayList<>();
            for (Selected s : selected) {
                cids.add(s.cid());
                columns.add(s.column());
            }
            pipeline.add(new Transform.Select(cids));
            return new Relation(new RelationKind.Pipeline(pipeline), columns);
        } finally {
            pipeline = savedPipeline;
            window = savedWindow;
        }
    }

    private void lowerPipeline(Expr e) {
        if (e.kind() instanceof ExprKind.TransformCall call) {
            lowerPipeline(call.input());
            lowerTransform(call, e);
            return;
        }
        if (e.id() != null && loopParams.contains(e.id())) {
            return;
        }
        if (e.kind() instanceof ExprKind.Ident && e.isRelation()) {
            pipeline.add(new Transform.From(lowerTableRef(e)));
            return;
        }
        throw new LoweringException("Expected a relation, found `" + e.kind() + "`", e.span());
    }

    private TableRef lowerTableRef(Expr ref) {
        ExprKind.Ident ident = (ExprKind.Ident) ref.kind();
        int tid = ensureTable(String.join(".", ident.parts()));
        List<TableRef.TableColumn> columns = new ArrayList<>();
        for (RelationColumn column : tableColumns.get(tid)) {
            columns.add(new TableRef.TableColumn(column, nextCid++));
        }
        inputMapping.put(ref.id(), columns);
        String name = ref.lineage().inputs().get(0).name();
        return new TableRef(tid, columns, name.startsWith("_") ? null : name);
    }

    private int ensureTable(String key) {
        Integer existing = tableIds.get(key);
        if (existing != null) {
            return existing;
        }
        RelationDecl decl = query.relation(key);
        Relation relation;
        switch (decl.kind()) {
            case EXTERN:
                relation = new Relation(new RelationKind.ExternRef(decl.externParts()), inferredColumns(decl));
                break;
            case LITERAL: {
                List<RelationColumn> columns = new ArrayList<>();
                for (String name : decl.columns()) {
                    columns.add(new RelationColumn.Single(name));
                }
                relation = new Relation(new RelationKind.Literal(decl.columns(), decl.rows()), columns);
                break;
            }
            case SSTRING: {
                ExprKind.SString s = (ExprKind.SString) decl.expr().kind();
                relation = new Relation(new RelationKind.SString(lowerItems(s.items())), inferredColumns(decl));
                break;
            }
            default:
                relation = lowerRelation(decl.expr());
                break;
        }
        int tid = nextTid++;
        tables.add(new TableDecl(tid, decl.name(), relation));
        tableIds.put(key, tid);
        tableColumns.put(tid, relation.columns());
        logger.debug("Declared table {} for {}", tid, decl);
        return tid;
    }

    private static List<RelationColumn> inferredColumns(RelationDecl decl) {
        List<RelationColumn> columns = new ArrayList<>();
        for (String name : decl.inferred()) {
            columns.add(new RelationColumn.Single(name));
        }
        columns.add(RelationColumn.WILDCARD);
        return columns;
    }

    /**
     * Column ids of a frame, with each wildcard expanded to the columns of its
     * table instance.
     */
    private List<Selected> expand(Lineage lineage, Span span) {
        List<Selected> result = new ArrayList<>();
        for (Lineage.Column column : lineage.columns()) {
            if (column instanceof Lineage.Column.Single single) {
                result.add(new Selected(new RelationColumn.Single(single.name()), cidOf(single, span)));
            } else {
                Lineage.Column.All all = (Lineage.Column.All) column;
                Lineage.Input input = lineage.findInput(all.inputName());
                List<TableRef.TableColumn> instance = input == null ? null : inputMapping.get(input.id());
                if (instance == null) {
                    throw new LoweringException("Columns of `" + all.inputName() + "` are not available here", span);
                }
                for (TableRef.TableColumn tc : instance) {
                    if (tc.column() instanceof RelationColumn.Single s && all.except().contains(s.name())) {
                        continue;
                    }
                    result.add(new Selected(tc.column(), tc.cid()));
                }
            }
        }
        return result;
    }

    private int cidOf(Lineage.Column.Single single, Span span) {
        Integer cid = columnMapping.get(single.targetId());
        if (cid != null) {
            return cid;
        }
        List<TableRef.TableColumn> instance = inputMapping.get(single.targetId());
        if (instance != null) {
            String name = single.targetName() != null ? single.targetName() : single.name();
            Integer found = findColumn(instance, name);
            if (found != null) {
                return found;
            }
        }
        throw new LoweringException("Column `" + single + "` is not available here", span);
    }

    private static Integer findColumn(List<TableRef.TableColumn> instance, String name) {
        for (TableRef.TableColumn tc : instance) {
            if (tc.column() instanceof RelationColumn.Single s && name.equals(s.name())) {
                return tc.cid();
            }
        }
        return null;
    }

    // ==================== Transforms ====================

    private void lowerTransform(ExprKind.TransformCall call, Expr e) {
        window = new Window(
            lowerFrame(call.frame(), e.span()),
            declarePartition(call.partition(), call.input().lineage(), e.span()),
            lowerSorts(call.sort()));

        TransformKind kind = call.kind();
        if (kind instanceof TransformKind.Derive derive) {
            declareAll(derive.assigns());
        } else if (kind instanceof TransformKind.Select select) {
            declareAll(select.assigns());
            List<Integer> cids = new ArrayList<>();
            for (Selected s : expand(e.lineage(), e.span())) {
                cids.add(s.cid());
            }
            pipeline.add(new Transform.Select(cids));
        } else if (kind instanceof TransformKind.Filter filter) {
            pipeline.add(new Transform.Filter(lowerExpr(filter.filter())));
        } else if (kind instanceof TransformKind.Aggregate aggregate) {
            List<Integer> compute = new ArrayList<>();
            for (Expr assign : aggregate.assigns()) {
                compute.add(declareAsColumn(assign, true));
            }
            pipeline.add(new Transform.Aggregate(window.partition(), compute));
        } else if (kind instanceof TransformKind.Sort sort) {
            pipeline.add(new Transform.Sort(lowerSorts(sort.by())));
        } else if (kind instanceof TransformKind.Take take) {
            pipeline.add(new Transform.Take(lowerTakeRange(take.range(), e.span()),
                window.partition(), window.sort()));
        } else if (kind instanceof TransformKind.Join join) {
            TableRef with = lowerTableRef(join.with());
            pipeline.add(new Transform.Join(join.side(), with, lowerExpr(join.filter())));
        } else if (kind instanceof TransformKind.Append append) {
            pipeline.add(new Transform.Append(lowerTableRef(append.bottom())));
        } else if (kind instanceof TransformKind.Loop loop) {
            loopParams.add(loop.param());
            Relation step = lowerRelation(loop.pipeline());
            pipeline.add(new Transform.Loop(((RelationKind.Pipeline) step.kind()).transforms()));
        } else {
            throw new LoweringException("`" + Flattener.transformName(kind) + "` cannot be lowered", e.span());
        }
        window = null;
    }

    private void declareAll(List<Expr> assigns) {
        for (Expr assign : assigns) {
            if (!(assign.kind() instanceof ExprKind.All)) {
                declareAsColumn(assign, false);
            }
        }
    }

    private List<Integer> declarePartition(List<Expr> partition, Lineage input, Span span) {
        List<Integer> cids = new ArrayList<>();
        for (Expr expr : partition) {
            if (expr.kind() instanceof ExprKind.All) {
                for (Selected s : expand(input, span)) {
                    cids.add(s.cid());
                }
            } else {
                cids.add(declareAsColumn(expr, false));
            }
        }
        return cids;
    }

    private List<ColumnSort<Integer>> lowerSorts(List<ColumnSort<Expr>> sorts) {
        List<ColumnSort<Integer>> result = new ArrayList<>();
        for (ColumnSort<Expr> sort : sorts) {
            result.add(sort.withColumn(declareAsColumn(sort.column(), false)));
        }
        return result;
    }

    /**
     * Makes an expression available as a column. Plain references to a column
     * reuse its id; anything else becomes a {@code Compute}.
     */
    private int declareAsColumn(Expr e, boolean isAggregation) {
        Integer existing = columnMapping.get(e.id());
        if (existing != null) {
            return existing;
        }
        boolean needsWindow = e.needsWindow();
        String alias = e.alias();
        String aliasFor = alias != null && e.kind() instanceof ExprKind.Ident ident ? ident.name() : null;
        Expr inner = needsWindow ? e.withKind(e.kind()).needsWindow(false) : e;
        com.pipesql.ir.rq.Expr expr = lowerExpr(inner);

        if (expr.kind() instanceof com.pipesql.ir.rq.ExprKind.ColumnRef ref
            && !needsWindow && (alias == null || alias.equals(aliasFor))) {
            columnMapping.put(e.id(), ref.cid());
            return ref.cid();
        }
        Window computeWindow = null;
        if (needsWindow) {
            computeWindow = window != null ? window : new Window(WindowFrame.DEFAULT, List.of(), List.of());
        }
        int cid = nextCid++;
        pipeline.add(new Transform.Compute(cid, expr, computeWindow, isAggregation));
        columnMapping.put(e.id(), cid);
        return cid;
    }

    // ==================== Expressions ====================

    private com.pipesql.ir.rq.Expr lowerExpr(Expr e) {
        if (e.needsWindow()) {
            return new com.pipesql.ir.rq.Expr(
                new com.pipesql.ir.rq.ExprKind.ColumnRef(declareAsColumn(e, false)), e.span());
        }
        ExprKind kind = e.kind();
        if (kind instanceof ExprKind.Ident ident) {
            return lowerIdent(e, ident);
        }
        if (kind instanceof ExprKind.Lit lit) {
            return rq(new com.pipesql.ir.rq.ExprKind.Lit(lit.value()), e);
        }
        if (kind instanceof ExprKind.RqOperator op) {
            List<com.pipesql.ir.rq.Expr> args = new ArrayList<>();
            for (Expr arg : op.args()) {
                args.add(lowerExpr(arg));
            }
            return rq(new com.pipesql.ir.rq.ExprKind.Operator(op.name(), args), e);
        }
        if (kind instanceof ExprKind.SString s) {
            return rq(new com.pipesql.ir.rq.ExprKind.SString(lowerItems(s.items())), e);
        }
        if (kind instanceof ExprKind.FString f) {
            return lowerFString(f, e);
        }
        if (kind instanceof ExprKind.Case c) {
            List<com.pipesql.ir.rq.ExprKind.SwitchCase> cases = new ArrayList<>();
            for (ExprKind.SwitchCase sc : c.cases()) {
                cases.add(new com.pipesql.ir.rq.ExprKind.SwitchCase(lowerExpr(sc.condition()), lowerExpr(sc.value())));
            }
            return rq(new com.pipesql.ir.rq.ExprKind.Case(cases), e);
        }
        if (kind instanceof ExprKind.Param param) {
            return rq(new com.pipesql.ir.rq.ExprKind.Param(param.name()), e);
        }
        if (kind instanceof ExprKind.Array array) {
            List<com.pipesql.ir.rq.Expr> items = new ArrayList<>();
            for (Expr item : array.items()) {
                items.add(lowerExpr(item));
            }
            return rq(new com.pipesql.ir.rq.ExprKind.Array(items), e);
        }
        if (kind instanceof ExprKind.Func) {
            throw (LoweringException) new LoweringException("A function cannot be used as a column", e.span())
                .withHint("call it with all of its arguments");
        }
        if (kind instanceof ExprKind.TransformCall) {
            throw new LoweringException("A relation cannot be used as a column", e.span());
        }
        if (kind instanceof ExprKind.All) {
            throw new LoweringException("`" + kind + "` cannot be used as a value", e.span());
        }
        if (kind instanceof ExprKind.Range) {
            throw new LoweringException("A range cannot be used as a column", e.span());
        }
        if (kind instanceof ExprKind.Tuple) {
            throw new LoweringException("A tuple cannot be used as a column", e.span());
        }
        throw new LoweringException("Unresolved expression `" + kind + "`", e.span());
    }

    private com.pipesql.ir.rq.Expr lowerIdent(Expr e, ExprKind.Ident ident) {
        if (e.isRelation()) {
            throw new LoweringException("A relation cannot be used as a column", e.span());
        }
        if (e.targetId() == null) {
            // bound to more than one wildcard, left to the database
            return rq(com.pipesql.ir.rq.ExprKind.SString.raw(ident.name()), e);
        }
        Integer cid = columnMapping.get(e.targetId());
        if (cid == null) {
            List<TableRef.TableColumn> instance = inputMapping.get(e.targetId());
            cid = instance == null ? null : findColumn(instance, ident.name());
        }
        if (cid == null) {
            throw new LoweringException("Column `" + ident + "` is not available here", e.span());
        }
        return rq(new com.pipesql.ir.rq.ExprKind.ColumnRef(cid), e);
    }

    private com.pipesql.ir.rq.Expr lowerFString(ExprKind.FString f, Expr e) {
        com.pipesql.ir.rq.Expr result = null;
        for (InterpolateItem item : f.items()) {
            com.pipesql.ir.rq.Expr part;
            if (item instanceof InterpolateItem.Text text) {
                part = rq(new com.pipesql.ir.rq.ExprKind.Lit(new Literal.Str(text.text())), e);
            } else {
                part = lowerExpr(((InterpolateItem.Expression) item).expr());
            }
            result = result == null
                ? part
                : rq(new com.pipesql.ir.rq.ExprKind.Operator("std.concat", List.of(result, part)), e);
        }
        return result != null ? result : rq(new com.pipesql.ir.rq.ExprKind.Lit(new Literal.Str("")), e);
    }

    private List<com.pipesql.ir.rq.InterpolateItem> lowerItems(List<InterpolateItem> items) {
        List<com.pipesql.ir.rq.InterpolateItem> result = new ArrayList<>();
        for (InterpolateItem item : items) {
            if (item instanceof InterpolateItem.Text text) {
                result.add(new com.pipesql.ir.rq.InterpolateItem.Text(text.text()));
            } else {
                result.add(new com.pipesql.ir.rq.InterpolateItem.Expression(
                    lowerExpr(((InterpolateItem.Expression) item).expr())));
            }
        }
        return result;
    }

    private static com.pipesql.ir.rq.Expr rq(com.pipesql.ir.rq.ExprKind kind, Expr source) {
        return new com.pipesql.ir.rq.Expr(kind, source.span());
    }

    // ==================== Ranges ====================

    private Range lowerTakeRange(ExprKind.Range range, Span span) {
        Long start = takeBound(range.start(), span);
        Long end = takeBound(range.end(), span);
        long first = start == null ? 1 : start;
        if (first < 1 || (end != null && end < first - 1)) {
            throw new LoweringException("`take` expected a positive int range, but found "
                + (start == null ? "" : start) + ".." + (end == null ? "" : end), span);
        }
        return new Range(
            start == null ? null : intExpr(start),
            end == null ? null : intExpr(end));
    }

    private static Long takeBound(Expr bound, Span span) {
        if (bound == null) {
            return null;
        }
        Long value = constantInt(bound);
        if (value == null) {
            throw (LoweringException) new LoweringException("`take` bounds must be integer literals",
                bound.span() != null ? bound.span() : span)
                .withHint("use a constant such as `take 10` or `take 5..10`");
        }
        return value;
    }

    private WindowFrame lowerFrame(com.pipesql.ir.pl.WindowFrame frame, Span span) {
        ExprKind.Range range = frame.range();
        return new WindowFrame(frame.kind(), new Range(frameBound(range.start(), span), frameBound(range.end(), span)));
    }

    private static com.pipesql.ir.rq.Expr frameBound(Expr bound, Span span) {
        if (bound == null) {
            return null;
        }
        Long value = constantInt(bound);
        if (value == null) {
            throw new LoweringException("Window frame bounds must be integer literals",
                bound.span() != null ? bound.span() : span);
        }
        return intExpr(value);
    }

    private static Long constantInt(Expr e) {
        if (e.kind() instanceof ExprKind.Lit lit && lit.value() instanceof Literal.Int i) {
            return i.value();
        }
        if (e.kind() instanceof ExprKind.RqOperator op && op.name().equals("std.neg") && op.args().size() == 1) {
            Long inner = constantInt(op.args().get(0));
            return inner == null ? null : -inner;
        }
        return null;
    }

    private static com.pipesql.ir.rq.Expr intExpr(long value) {
        return com.pipesql.ir.rq.Expr.of(new com.pipesql.ir.rq.ExprKind.Lit(new Literal.Int(value)));
    }

    private record Selected(RelationColumn column, int cid) {
    }
}
