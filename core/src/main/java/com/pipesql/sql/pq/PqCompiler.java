package com.pipesql.sql.pq;

import com.pipesql.diagnostic.Span;
import com.pipesql.exception.CodegenException;
import com.pipesql.ir.rq.Relation;
import com.pipesql.ir.rq.RelationKind;
import com.pipesql.ir.rq.RelationalQuery;
import com.pipesql.ir.rq.Transform;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;

/**
 * Compiles a relational query into a partitioned query: a list of CTEs and a
 * main relation, each of which fits a single SELECT statement.
 */
public final class PqCompiler {

    private static final Logger logger = LoggerFactory.getLogger(PqCompiler.class);

    private final SqlContext ctx;
    private final AnchorContext anchorContext;
    private final Preprocessor preprocessor;
    private final Anchor anchor;

    public PqCompiler(SqlContext ctx) {
        this.ctx = ctx;
        this.anchorContext = ctx.anchor();
        this.preprocessor = new Preprocessor(anchorContext);
        this.anchor = new Anchor(anchorContext);
    }

    public SqlQuery compileQuery(RelationalQuery query) {
        SqlRelation main = compileRelation(new RelationAdapter.Rq(query.relation()));
        SqlQuery result = new SqlQuery(new ArrayList<>(ctx.ctes()), main);
        ctx.ctes().clear();
        logger.debug("Partitioned query has {} CTEs", result.ctes().size());
        return new Postprocessor(ctx, anchor).process(result);
    }

    SqlRelation compileRelation(RelationAdapter adapter) {
        if (adapter instanceof RelationAdapter.Rq rq) {
            Relation relation = rq.relation();
            RelationKind kind = relation.kind();
            if (kind instanceof RelationKind.Pipeline pipeline) {
                List<SqlTransform> transforms = preprocessor.preprocess(pipeline.transforms());
                anchorContext.loadNames(transforms, relation.columns());
                return compilePipeline(transforms);
            }
            if (kind instanceof RelationKind.Literal literal) {
                return new SqlRelation.Literal(literal);
            }
            if (kind instanceof RelationKind.SString sString) {
                return new SqlRelation.SString(sString.items());
            }
            throw new CodegenException("invalid RQ: a table reference cannot be compiled as a query", (Span) null);
        }
        if (adapter instanceof RelationAdapter.Preprocessed preprocessed) {
            anchorContext.loadNames(preprocessed.pipeline(), preprocessed.columns());
            return compilePipeline(preprocessed.pipeline());
        }
        return ((RelationAdapter.Pq) adapter).relation();
    }

    private SqlRelation compilePipeline(List<SqlTransform> pipeline) {
        if (pipeline.stream().anyMatch(t -> SqlTransform.superOf(t) instanceof Transform.Loop)) {
            pipeline = compileLoop(pipeline);
        }

        List<SqlTransform> atomic = anchor.extractAtomic(pipeline);
        ensureNames(atomic);

        List<SqlTransform> result = new ArrayList<>();
        for (SqlTransform t : atomic) {
            SqlTransform converted = convert(t);
            if (converted != null) {
                result.add(converted);
            }
        }
        return new SqlRelation.AtomicPipeline(result);
    }

    /** Converts a transform of a pipeline fitting one SELECT to its clause form; null drops it. */
    private SqlTransform convert(SqlTransform t) {
        if (t instanceof SqlTransform.From from) {
            compileRelationInstance(from.riid());
            return t;
        }
        if (t instanceof SqlTransform.Join join) {
            compileRelationInstance(join.riid());
            return t;
        }
        if (t instanceof SqlTransform.Union union) {
            compileRelationInstance(union.bottom());
            return t;
        }
        if (t instanceof SqlTransform.Except except) {
            compileRelationInstance(except.bottom());
            return t;
        }
        if (t instanceof SqlTransform.Intersect intersect) {
            compileRelationInstance(intersect.bottom());
            return t;
        }
        if (!(t instanceof SqlTransform.Super sup)) {
            return t;
        }
        Transform transform = sup.transform();
        if (transform instanceof Transform.Select select) {
            return new SqlTransform.Select(select.columns());
        }
        if (transform instanceof Transform.Filter filter) {
            return new SqlTransform.Filter(filter.condition());
        }
        if (transform instanceof Transform.Aggregate aggregate) {
            return new SqlTransform.Aggregate(aggregate.partition(), aggregate.compute());
        }
        if (transform instanceof Transform.Sort sort) {
            return new SqlTransform.Sort(sort.by());
        }
        if (transform instanceof Transform.Take take) {
            return new SqlTransform.Take(take);
        }
        if (transform instanceof Transform.Compute || transform instanceof Transform.Append
            || transform instanceof Transform.Loop) {
            return null;
        }
        throw new CodegenException("invalid RQ: unexpected " + SqlTransform.kindName(t), (Span) null);
    }

    /** Makes sure the table a relation instance reads is defined, as a CTE or a sub-query. */
    private void compileRelationInstance(int riid) {
        int tid = anchorContext.relationInstance(riid).source();
        SqlTableDecl decl = anchorContext.tableDecl(tid);
        RelationAdapter pending = decl.takeToDefine();
        if (pending != null) {
            if (!ctx.query().allowCtes()) {
                // other references need the definition too
                decl.pending(pending);
                ctx.relationExpr(riid, new RelationExpr.SubQuery(compileRelation(pending)));
                return;
            }
            SqlRelation relation = compileRelation(pending);
            ctx.ctes().add(new Cte(tid, new Cte.Normal(relation)));
        }
        ctx.relationExpr(riid, new RelationExpr.Ref(tid));
    }

    /**
     * Compiles a loop into a recursive CTE and returns the pipeline that follows
     * it, reading from that CTE.
     */
    private List<SqlTransform> compileLoop(List<SqlTransform> pipeline) {
        int index = 0;
        while (!(SqlTransform.superOf(pipeline.get(index)) instanceof Transform.Loop)) {
            index++;
        }
        Transform.Loop loop = (Transform.Loop) SqlTransform.superOf(pipeline.get(index));
        List<SqlTransform> initial = new ArrayList<>(pipeline.subList(0, index));
        List<SqlTransform> following = new ArrayList<>(pipeline.subList(index + 1, pipeline.size()));

        List<SqlTransform> step = preprocessor.preprocess(loop.pipeline());

        // the step reads the rows of the previous iteration, as a new table
        SqlTransform recursive = new SqlTransform.Super(
            new Transform.Select(anchorContext.determineSelectColumns(initial)));
        initial.add(recursive);
        step = anchor.anchorSplit(initial, step);

        int initialTid = anchorContext.relationInstance(((SqlTransform.From) step.get(0)).riid()).source();
        SqlTableDecl initialDecl = anchorContext.tableDecl(initialTid);
        SqlRelation initialRelation = compileRelation(initialDecl.takeToDefine());

        ctx.pushQuery();
        ctx.query().allowCtes(false);
        SqlRelation stepRelation = compilePipeline(step);
        ctx.popQuery();

        List<SqlTransform> rest = anchor.anchorSplit(List.of(recursive), following);
        int restTid = anchorContext.relationInstance(((SqlTransform.From) rest.get(0)).riid()).source();
        SqlTableDecl restDecl = anchorContext.tableDecl(restTid);
        restDecl.redirectTo(initialTid);
        restDecl.takeToDefine();

        ctx.ctes().add(new Cte(initialTid, new Cte.Loop(initialRelation, stepRelation)));
        logger.debug("Compiled loop into recursive table {}", initialTid);
        return rest;
    }

    private void ensureNames(List<SqlTransform> atomic) {
        for (SqlTransform t : atomic) {
            if (SqlTransform.superOf(t) instanceof Transform.Sort) {
                for (Anchor.Requirement r : Anchor.getRequirements(t, new HashSet<>())) {
                    anchorContext.ensureColumnName(r.column());
                }
            }
        }
    }
}
