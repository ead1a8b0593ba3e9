package com.pipesql.sql.pq;

import com.pipesql.CompilerConfig;
import com.pipesql.diagnostic.Span;
import com.pipesql.exception.CodegenException;
import com.pipesql.ir.rq.Relation;
import com.pipesql.ir.rq.RelationColumn;
import com.pipesql.ir.rq.RelationKind;
import com.pipesql.ir.rq.RelationalQuery;
import com.pipesql.ir.rq.TableDecl;
import com.pipesql.ir.rq.TableRef;
import com.pipesql.ir.rq.Transform;
import com.pipesql.sql.Dialect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Declarations shared by the stages that split a relational query into SQL
 * statements: where each column and table is defined, what it is called and
 * every table instance referenced by a pipeline.
 *
 * <p>One context belongs to one compilation.
 */
public final class AnchorContext {

    private static final Logger logger = LoggerFactory.getLogger(AnchorContext.class);

    private final Dialect dialect;
    private final Map<Integer, ColumnDecl> columnDecls = new HashMap<>();
    private final Map<Integer, String> columnNames = new HashMap<>();
    private final Map<Integer, SqlTableDecl> tableDecls = new HashMap<>();
    private final Map<Integer, RelationInstance> relationInstances = new HashMap<>();

    private final NameGenerator columnNameGen = new NameGenerator(CompilerConfig.EXPR_PREFIX);
    private final NameGenerator tableNameGen = new NameGenerator(CompilerConfig.TABLE_PREFIX);
    private final IdGenerator cidGen;
    private final IdGenerator tidGen;
    private final IdGenerator riidGen = new IdGenerator(0);

    private AnchorContext(Dialect dialect, int nextCid, int nextTid) {
        this.dialect = dialect;
        this.cidGen = new IdGenerator(nextCid);
        this.tidGen = new IdGenerator(nextTid);
    }

    /**
     * Creates the context of a query: registers its tables, its computed columns and
     * an instance for every table reference.
     */
    public static AnchorContext of(RelationalQuery query, Dialect dialect) {
        int[] max = {-1, -1};
        for (TableDecl table : query.tables()) {
            max[1] = Math.max(max[1], table.id());
            maxCid(table.relation(), max);
        }
        maxCid(query.relation(), max);

        AnchorContext ctx = new AnchorContext(dialect, max[0] + 1, max[1] + 1);
        for (TableDecl table : query.tables()) {
            SqlTableDecl decl;
            if (table.relation().kind() instanceof RelationKind.ExternRef ref) {
                decl = new SqlTableDecl(table.id(), ref.parts(), null);
            } else {
                List<String> name = table.name() == null ? null : List.of(table.name());
                decl = new SqlTableDecl(table.id(), name, new RelationAdapter.Rq(table.relation()));
            }
            ctx.tableDecls.put(table.id(), decl);
            ctx.load(table.relation());
        }
        ctx.load(query.relation());
        logger.debug("Anchor context: {} tables, {} relation instances",
                     ctx.tableDecls.size(), ctx.relationInstances.size());
        return ctx;
    }

    private static void maxCid(Relation relation, int[] max) {
        if (relation.kind() instanceof RelationKind.Pipeline pipeline) {
            for (int cid : Cids.collect(new Transform.Loop(pipeline.transforms()))) {
                max[0] = Math.max(max[0], cid);
            }
        }
    }

    private void load(Relation relation) {
        if (relation.kind() instanceof RelationKind.Pipeline pipeline) {
            loadTransforms(pipeline.transforms());
        }
    }

    private void loadTransforms(List<Transform> transforms) {
        for (Transform t : transforms) {
            if (t instanceof Transform.Compute compute) {
                registerCompute(compute);
            } else if (t instanceof Transform.From from) {
                createRelationInstance(from.table(), new HashMap<>());
            } else if (t instanceof Transform.Join join) {
                createRelationInstance(join.with(), new HashMap<>());
            } else if (t instanceof Transform.Append append) {
                createRelationInstance(append.bottom(), new HashMap<>());
            } else if (t instanceof Transform.Loop loop) {
                loadTransforms(loop.pipeline());
            }
        }
    }

    // ==================== Declarations ====================

    public Dialect dialect() {
        return dialect;
    }

    public void registerCompute(Transform.Compute compute) {
        columnDecls.put(compute.id(), new ColumnDecl.OfCompute(compute));
    }

    /** Registers a wildcard standing for every column of a relation instance. */
    int registerWildcard(int riid) {
        int cid = cidGen.next();
        columnDecls.put(cid, new ColumnDecl.OfRelation(riid, cid, RelationColumn.WILDCARD));
        return cid;
    }

    int createRelationInstance(TableRef ref, Map<Integer, Integer> cidRedirects) {
        int riid = riidGen.next();
        for (TableRef.TableColumn column : ref.columns()) {
            columnDecls.put(column.cid(), new ColumnDecl.OfRelation(riid, column.cid(), column.column()));
        }
        relationInstances.put(riid, new RelationInstance(riid, ref, cidRedirects));
        return riid;
    }

    public ColumnDecl columnDecl(int cid) {
        ColumnDecl decl = columnDecls.get(cid);
        if (decl == null) {
            throw new CodegenException("column " + cid + " is not declared", (Span) null);
        }
        return decl;
    }

    public boolean isWildcard(int cid) {
        return columnDecls.get(cid) instanceof ColumnDecl.OfRelation rel && rel.isWildcard();
    }

    public boolean containsWildcard(List<Integer> cids) {
        return cids.stream().anyMatch(this::isWildcard);
    }

    public RelationInstance relationInstance(int riid) {
        return relationInstances.get(riid);
    }

    /** Returns the relation instance a column of a table reference belongs to. */
    int riidOf(TableRef ref) {
        if (ref.columns().isEmpty()) {
            throw new CodegenException("invalid RQ: table ref without columns", (Span) null);
        }
        return ((ColumnDecl.OfRelation) columnDecl(ref.columns().get(0).cid())).riid();
    }

    public SqlTableDecl tableDecl(int tid) {
        return tableDecls.get(tid);
    }

    /** Returns the declaration of a table, following redirects. */
    public SqlTableDecl lookupTableDecl(int tid) {
        SqlTableDecl decl = tableDecls.get(tid);
        while (decl != null && decl.redirectTo() != null) {
            decl = tableDecls.get(decl.redirectTo());
        }
        return decl;
    }

    Map<Integer, SqlTableDecl> tableDecls() {
        return tableDecls;
    }

    Map<Integer, RelationInstance> relationInstances() {
        return relationInstances;
    }

    SqlTableDecl declareTable(List<String> name, RelationAdapter relation) {
        int tid = tidGen.next();
        SqlTableDecl decl = new SqlTableDecl(tid, name, relation);
        tableDecls.put(tid, decl);
        return decl;
    }

    // ==================== Names ====================

    /** Name of a column, or null when none has been assigned. */
    public String columnName(int cid) {
        return columnNames.get(cid);
    }

    public void columnName(int cid, String name) {
        columnNames.put(cid, name);
    }

    /**
     * Returns the name of a column, assigning a generated one when the column has
     * none. Wildcards have no name.
     */
    public String ensureColumnName(int cid) {
        ColumnDecl decl = columnDecls.get(cid);
        if (decl instanceof ColumnDecl.OfRelation rel) {
            if (rel.column() instanceof RelationColumn.Single single && single.name() != null) {
                return columnNames.computeIfAbsent(cid, k -> single.name());
            }
            if (rel.isWildcard()) {
                return null;
            }
        }
        return columnNames.computeIfAbsent(cid, k -> columnNameGen.next());
    }

    public String nextColumnName() {
        return columnNameGen.next();
    }

    public String nextTableName() {
        return tableNameGen.next();
    }

    int nextCid() {
        return cidGen.next();
    }

    /** Names the output columns of a pipeline after the columns of its relation. */
    void loadNames(List<SqlTransform> pipeline, List<RelationColumn> columns) {
        List<Integer> output = determineSelectColumns(pipeline);
        for (int i = 0; i < Math.min(output.size(), columns.size()); i++) {
            if (columns.get(i) instanceof RelationColumn.Single single && single.name() != null) {
                columnNames.put(output.get(i), single.name());
            }
        }
    }

    /** Returns the columns a pipeline outputs. */
    public List<Integer> determineSelectColumns(List<SqlTransform> pipeline) {
        if (pipeline.isEmpty()) {
            return List.of();
        }
        SqlTransform last = pipeline.get(pipeline.size() - 1);
        List<SqlTransform> rest = pipeline.subList(0, pipeline.size() - 1);
        if (last instanceof SqlTransform.From from) {
            return relationInstances.get(from.riid()).cids();
        }
        if (last instanceof SqlTransform.Join join) {
            List<Integer> cids = new ArrayList<>(determineSelectColumns(rest));
            cids.addAll(relationInstances.get(join.riid()).cids());
            return cids;
        }
        if (last instanceof SqlTransform.Select select) {
            return select.columns();
        }
        if (last instanceof SqlTransform.Aggregate aggregate) {
            List<Integer> cids = new ArrayList<>(aggregate.partition());
            cids.addAll(aggregate.compute());
            return cids;
        }
        Transform t = SqlTransform.superOf(last);
        if (t instanceof Transform.Select select) {
            return select.columns();
        }
        if (t instanceof Transform.Aggregate aggregate) {
            List<Integer> cids = new ArrayList<>(aggregate.partition());
            cids.addAll(aggregate.compute());
            return cids;
        }
        return determineSelectColumns(rest);
    }

    // ==================== Generators ====================

    static final class IdGenerator {
        private int next;

        IdGenerator(int start) {
            this.next = start;
        }

        int next() {
            return next++;
        }
    }

    static final class NameGenerator {
        private final String prefix;
        private int next;

        NameGenerator(String prefix) {
            this.prefix = prefix;
        }

        String next() {
            return prefix + next++;
        }
    }
}
