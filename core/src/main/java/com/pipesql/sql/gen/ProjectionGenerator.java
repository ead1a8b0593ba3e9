package com.pipesql.sql.gen;

import com.pipesql.diagnostic.Span;
import com.pipesql.exception.CodegenException;
import com.pipesql.ir.rq.RelationColumn;
import com.pipesql.ir.rq.TableRef;
import com.pipesql.sql.Dialect;
import com.pipesql.sql.pq.AnchorContext;
import com.pipesql.sql.pq.ColumnDecl;
import com.pipesql.sql.pq.RelationInstance;
import com.pipesql.sql.pq.SqlContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Renders projections: select items with their aliases and wildcards as stars.
 *
 * <p>A wildcard and a star differ: a wildcard stands for the columns of a table
 * that are not otherwise known, while a star selects all of them. Known columns
 * a star already includes are dropped from the projection, and columns a star
 * would include without being requested are excluded where the dialect can
 * express it.
 */
public final class ProjectionGenerator {

    private static final Logger logger = LoggerFactory.getLogger(ProjectionGenerator.class);

    /** Columns to select, and for each star the columns it must not include. */
    public record Projection(List<Integer> columns, Map<Integer, Set<Integer>> excluded) {}

    private final SqlContext ctx;
    private final AnchorContext anchor;
    private final ExprGenerator exprs;

    public ProjectionGenerator(SqlContext ctx, ExprGenerator exprs) {
        this.ctx = ctx;
        this.anchor = ctx.anchor();
        this.exprs = exprs;
    }

    public Projection translateWildcards(List<Integer> columns) {
        List<Integer> output = new ArrayList<>();
        Map<Integer, Set<Integer>> excluded = new HashMap<>();
        Integer starCid = null;
        Set<Integer> inStar = new LinkedHashSet<>();

        for (int cid : columns) {
            if (anchor.columnDecl(cid) instanceof ColumnDecl.OfRelation rel && rel.isWildcard()) {
                exclude(starCid, inStar, excluded);

                starCid = cid;
                inStar = new LinkedHashSet<>();
                for (TableRef.TableColumn column : anchor.relationInstance(rel.riid()).columns()) {
                    if (!(column.column() instanceof RelationColumn.Wildcard)) {
                        inStar.add(column.cid());
                    }
                }
                // preceding columns are selected by this star
                while (!output.isEmpty() && inStar.remove(output.get(output.size() - 1))) {
                    output.remove(output.size() - 1);
                }
            }
            if (!inStar.remove(cid)) {
                output.add(cid);
            }
        }
        exclude(starCid, inStar, excluded);
        return new Projection(output, excluded);
    }

    private static void exclude(Integer starCid, Set<Integer> inStar, Map<Integer, Set<Integer>> excluded) {
        if (starCid != null && !inStar.isEmpty()) {
            excluded.put(starCid, inStar);
        }
    }

    public List<String> translateSelectItems(Projection projection) {
        List<String> items = new ArrayList<>();
        for (int cid : projection.columns()) {
            if (anchor.columnDecl(cid) instanceof ColumnDecl.OfRelation rel && rel.isWildcard()) {
                RelationInstance instance = anchor.relationInstance(rel.riid());
                String star = exprs.translateIdent(instance.name(), "*").text();
                Set<Integer> excluded = projection.excluded().get(cid);
                items.add(excluded == null ? star : star + translateExclude(excluded));
            } else {
                items.add(translateSelectItem(cid));
            }
        }
        return items;
    }

    private String translateExclude(Set<Integer> excluded) {
        List<String> names = excluded.stream()
            .sorted()
            .map(anchor::ensureColumnName)
            .map(name -> name == null ? "<unnamed>" : name)
            .collect(Collectors.toList());
        Dialect.ColumnExclude syntax = ctx.dialect().columnExclude();
        if (syntax == null) {
            logger.warn("Columns {} will be included with *, but were not requested.", String.join(", ", names));
            return "";
        }
        String list = names.stream().map(exprs::translateIdentPart).collect(Collectors.joining(", "));
        return (syntax == Dialect.ColumnExclude.EXCLUDE ? " EXCLUDE (" : " EXCEPT (") + list + ")";
    }

    /** Renders one column, aliased when the expression would not carry the column's name. */
    private String translateSelectItem(int cid) {
        SqlExpr expr = exprs.translateCid(cid);
        String inferred = "*".equals(expr.identName()) ? null : expr.identName();

        String expected = anchor.columnName(cid);
        if (expected == null && anchor.columnDecl(cid) instanceof ColumnDecl.OfRelation) {
            expected = anchor.ensureColumnName(cid);
        }
        if (Objects.equals(expected, inferred)) {
            return expr.text();
        }
        if (expected == null) {
            expected = anchor.nextColumnName();
            anchor.columnName(cid, expected);
        }
        return expr.text() + " AS " + exprs.translateIdentPart(expected);
    }

    /** Renders columns outside of the projection, such as in GROUP BY. */
    public List<String> tryIntoExprs(List<Integer> cids, Span span) {
        Projection projection = translateWildcards(cids);
        List<String> result = new ArrayList<>();
        for (int cid : projection.columns()) {
            if (anchor.columnDecl(cid) instanceof ColumnDecl.OfRelation rel && rel.isWildcard()) {
                String star = exprs.translateStar(span);
                if (projection.excluded().containsKey(cid)) {
                    throw new CodegenException("Excluding columns not supported as this position", span);
                }
                result.add(exprs.translateIdent(anchor.relationInstance(rel.riid()).name(), star).text());
            } else {
                result.add(exprs.translateCid(cid).text());
            }
        }
        return result;
    }
}
