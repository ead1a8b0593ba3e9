package com.pipesql.sql;

import com.pipesql.CompilerConfig;
import com.pipesql.ir.rq.RelationalQuery;
import com.pipesql.sql.gen.QueryGenerator;
import com.pipesql.sql.gen.SqlAst;
import com.pipesql.sql.gen.SqlFormatter;
import com.pipesql.sql.pq.AnchorContext;
import com.pipesql.sql.pq.PqCompiler;
import com.pipesql.sql.pq.SqlContext;
import com.pipesql.sql.pq.SqlQuery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Translates a relational query into SQL text for one dialect.
 *
 * <p>The query is first partitioned into statements that each fit one SELECT,
 * then rendered, optionally formatted and signed.
 */
public final class SqlCompiler {

    private static final Logger logger = LoggerFactory.getLogger(SqlCompiler.class);

    private SqlCompiler() {}

    /**
     * Compiles a relational query.
     *
     * @param query the query to render
     * @param target the requested target; {@code sql.any} defers to the query header
     * @param format whether to pretty-print the SQL
     * @param signatureComment whether to append the compiler signature comment
     * @return the SQL text
     * @throws com.pipesql.exception.CodegenException if the query cannot be expressed in the dialect
     */
    public static String compile(RelationalQuery query, Target target, boolean format, boolean signatureComment) {
        Dialect dialect = target.resolve(query.def());
        logger.debug("Generating SQL for dialect {}", dialect.shortName());

        SqlContext ctx = new SqlContext(dialect, AnchorContext.of(query, dialect));
        SqlQuery partitioned = new PqCompiler(ctx).compileQuery(query);
        SqlAst.Query ast = new QueryGenerator(ctx).generate(partitioned);

        String sql = ast.toSql();
        if (format) {
            sql = SqlFormatter.format(sql);
        }
        if (!signatureComment) {
            return sql;
        }
        String signature = CompilerConfig.signature(dialect.targetName());
        return format ? sql + "\n" + signature + "\n" : sql + " " + signature;
    }
}
