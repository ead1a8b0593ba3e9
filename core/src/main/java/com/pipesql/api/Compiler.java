package com.pipesql.api;

import com.pipesql.diagnostic.Diagnostics;
import com.pipesql.exception.CodegenException;
import com.pipesql.ir.pl.Stmt;
import com.pipesql.ir.rq.RelationalQuery;
import com.pipesql.json.IrJson;
import com.pipesql.lexer.Lexer;
import com.pipesql.lexer.Token;
import com.pipesql.lowering.Lowerer;
import com.pipesql.parser.QueryParser;
import com.pipesql.semantic.AstExpander;
import com.pipesql.semantic.ResolvedQuery;
import com.pipesql.semantic.Resolver;
import com.pipesql.sql.SqlCompiler;
import com.pipesql.sql.Target;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.function.Supplier;

/**
 * Entry points of the compiler.
 *
 * <p>{@link #compile} runs the whole pipeline. The other entry points run one
 * part of it each, exchanging the intermediate representations as JSON, so that
 * {@code compile(q)} produces the same SQL as
 * {@code renderSql(lowerToRelational(parseToIntermediate(q)))}.
 *
 * <p>Errors never escape: every entry point reports them as diagnostics of the
 * returned {@link CompileResult}. Instances hold no state and may be shared
 * between threads.
 */
public final class Compiler {

    private static final Logger logger = LoggerFactory.getLogger(Compiler.class);

    /**
     * Compiles a query to SQL.
     */
    public CompileResult compile(String source, CompileOptions options) {
        return run("compile", source, () -> {
            Target target = target(options);
            RelationalQuery rq = Lowerer.lower(Resolver.resolve(parse(source)));
            return SqlCompiler.compile(rq, target, options.format(), options.signatureComment());
        });
    }

    /**
     * Parses a query into PL, encoded as JSON.
     */
    public CompileResult parseToIntermediate(String source) {
        return run("parseToIntermediate", source, () -> IrJson.plToJson(parse(source)));
    }

    /**
     * Resolves and lowers PL JSON into RQ JSON.
     */
    public CompileResult lowerToRelational(String plJson) {
        return run("lowerToRelational", null, () -> {
            List<Stmt> pl = IrJson.plFromJson(plJson);
            return IrJson.rqToJson(Lowerer.lower(Resolver.resolve(pl)));
        });
    }

    /**
     * Renders RQ JSON as SQL.
     */
    public CompileResult renderSql(String rqJson, CompileOptions options) {
        return run("renderSql", null, () -> {
            Target target = target(options);
            RelationalQuery rq = IrJson.rqFromJson(rqJson);
            return SqlCompiler.compile(rq, target, options.format(), options.signatureComment());
        });
    }

    /**
     * Resolves a query and returns the resolved PL, with the lineage of every
     * relation, encoded as JSON.
     */
    public CompileResult resolveToPl(String source) {
        return run("resolveToPl", source, () -> {
            ResolvedQuery resolved = Resolver.resolve(parse(source));
            return IrJson.write(resolved);
        });
    }

    /**
     * Splits a query into tokens.
     *
     * @throws com.pipesql.exception.CompilationFailedException if any token is malformed
     */
    public List<Token> tokenize(String source) {
        return Lexer.tokenize(source);
    }

    private static List<Stmt> parse(String source) {
        return AstExpander.expand(QueryParser.parse(source));
    }

    private static Target target(CompileOptions options) {
        try {
            return Target.parse(options.target());
        } catch (IllegalArgumentException e) {
            throw new CodegenException(e.getMessage(), e);
        }
    }

    private static CompileResult run(String entryPoint, String source, Supplier<String> stage) {
        logger.debug("{} started", entryPoint);
        try {
            String output = stage.get();
            logger.debug("{} succeeded", entryPoint);
            return CompileResult.success(output);
        } catch (RuntimeException e) {
            CompileResult result = CompileResult.failure(Diagnostics.from(e, source));
            logger.debug("{} failed with {} diagnostic(s)", entryPoint, result.diagnostics().size());
            return result;
        }
    }
}
