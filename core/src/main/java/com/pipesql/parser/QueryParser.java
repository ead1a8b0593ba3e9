package com.pipesql.parser;

import com.pipesql.ast.Expr;
import com.pipesql.ast.Stmt;
import com.pipesql.exception.CompilationFailedException;
import com.pipesql.exception.CompilerException;
import com.pipesql.lexer.Lexer;
import com.pipesql.lexer.Token;
import com.pipesql.lexer.TokenKind;
import org.antlr.v4.runtime.BailErrorStrategy;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.DefaultErrorStrategy;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.atn.PredictionMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Entry point for parsing query text into the parser representation.
 *
 * <p>Wraps the ANTLR4-generated parser with:
 * <ul>
 *   <li>the hand-written {@link Lexer}, adapted to an ANTLR token source</li>
 *   <li>SLL-first, LL-fallback two-phase parsing</li>
 *   <li>error collection via {@link ParseErrorListener}</li>
 * </ul>
 *
 * <p>Usage:
 * <pre>
 *   List&lt;Stmt&gt; stmts = QueryParser.parse("from employees | select {name}");
 * </pre>
 */
public final class QueryParser {

    private static final Logger logger = LoggerFactory.getLogger(QueryParser.class);

    private QueryParser() {
    }

    /**
     * Lexes and parses a whole query.
     *
     * @param source the query text
     * @return the statements of the query, the header first when present
     * @throws CompilationFailedException with every lex or syntax error found
     */
    public static List<Stmt> parse(String source) {
        logger.debug("Parsing query of {} characters", source.length());
        List<Token> tokens = Lexer.tokenize(source);
        return parseTokens(tokens, source);
    }

    /**
     * Parses already lexed tokens.
     */
    public static List<Stmt> parseTokens(List<Token> tokens, String source) {
        PipeBaseParser.SourceContext tree;
        try {
            tree = runParser(tokens, source, PipeBaseParser::source);
        } catch (CompilationFailedException e) {
            throw resynchronize(tokens, source, e);
        }
        try {
            List<Stmt> stmts = new QueryAstBuilder(source).buildSource(tree);
            logger.debug("Parsed {} statement(s)", stmts.size());
            return stmts;
        } catch (CompilerException e) {
            throw CompilationFailedException.of(e);
        }
    }

    /**
     * Parses every statement on its own after a failed parse, so that errors of the
     * statements following the first broken one are reported too.
     */
    private static CompilationFailedException resynchronize(
            List<Token> tokens, String source, CompilationFailedException failure) {
        List<List<Token>> statements = splitStatements(tokens);
        if (statements.size() < 2) {
            return failure;
        }
        List<CompilerException> errors = new ArrayList<>();
        for (List<Token> statement : statements) {
            try {
                runParser(statement, source, PipeBaseParser::source);
            } catch (CompilationFailedException e) {
                errors.addAll(e.errors());
            }
        }
        logger.debug("Resynchronized parse over {} statement(s) found {} error(s)",
            statements.size(), errors.size());
        return errors.isEmpty() ? failure : new CompilationFailedException(errors);
    }

    /**
     * Splits tokens at the new lines that end a statement: a new line outside of any
     * brackets that is followed by {@code let}, {@code module} or an annotation, or that
     * ends a header, {@code let} or {@code module} statement. Annotations stay with the
     * statement they annotate.
     */
    static List<List<Token>> splitStatements(List<Token> tokens) {
        List<List<Token>> statements = new ArrayList<>();
        List<Token> current = new ArrayList<>();
        TokenKind first = null;
        boolean afterAnnotate = false;
        int depth = 0;
        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            TokenKind kind = token.kind();
            if (depth == 0 && kind == TokenKind.NEW_LINE) {
                TokenKind next = nextKind(tokens, i);
                boolean endsStatement = first == TokenKind.PRQL || first == TokenKind.LET
                    || first == TokenKind.MODULE;
                boolean startsStatement = next == TokenKind.LET || next == TokenKind.MODULE
                    || next == TokenKind.ANNOTATE;
                if (first != null && next != null && (endsStatement || startsStatement)) {
                    statements.add(current);
                    current = new ArrayList<>();
                    first = null;
                    continue;
                }
            } else if (depth == 0 && kind == TokenKind.ANNOTATE) {
                afterAnnotate = true;
            } else if (depth == 0 && kind == TokenKind.LBRACE && afterAnnotate) {
                afterAnnotate = false;
            } else if (depth == 0 && first == null && kind != TokenKind.NEW_LINE) {
                first = kind;
            }
            switch (kind) {
                case LPAREN, LBRACKET, LBRACE -> depth++;
                case RPAREN, RBRACKET, RBRACE -> depth = Math.max(0, depth - 1);
                default -> {
                }
            }
            current.add(token);
        }
        if (!current.isEmpty()) {
            statements.add(current);
        }
        return statements;
    }

    private static TokenKind nextKind(List<Token> tokens, int from) {
        for (int i = from + 1; i < tokens.size(); i++) {
            if (tokens.get(i).kind() != TokenKind.NEW_LINE) {
                return tokens.get(i).kind();
            }
        }
        return null;
    }

    /**
     * Parses the tokens of one interpolated {@code {...}} expression.
     */
    static PipeBaseParser.InterpolatedExprContext parseInterpolated(List<Token> tokens, String source) {
        return runParser(tokens, source, PipeBaseParser::interpolatedExpr);
    }

    private static <T extends ParserRuleContext> T runParser(
            List<Token> tokens, String source, Function<PipeBaseParser, T> rule) {
        CommonTokenStream stream = new CommonTokenStream(TokenAdapter.adapt(tokens, source));
        PipeBaseParser parser = new PipeBaseParser(stream);

        // Phase 1: SLL with bail-out
        parser.getInterpreter().setPredictionMode(PredictionMode.SLL);
        parser.removeErrorListeners();
        parser.setErrorHandler(new BailErrorStrategy());

        T tree;
        try {
            tree = rule.apply(parser);
        } catch (RuntimeException e) {
            // Phase 2: full LL with error reporting
            logger.debug("SLL parse failed, falling back to LL mode: {}", e.getMessage());
            ParseErrorListener errorListener = new ParseErrorListener(source.length());
            stream.seek(0);
            parser.reset();
            parser.getInterpreter().setPredictionMode(PredictionMode.LL);
            parser.removeErrorListeners();
            parser.addErrorListener(errorListener);
            parser.setErrorHandler(new DefaultErrorStrategy());

            tree = rule.apply(parser);
            if (errorListener.hasErrors()) {
                throw new CompilationFailedException(errorListener.errors());
            }
        }
        return tree;
    }

    /**
     * Parses a single expression, such as a function argument given on the command line.
     */
    public static Expr parseExpression(String source) {
        List<Token> tokens = Lexer.tokenize(source);
        PipeBaseParser.InterpolatedExprContext tree = parseInterpolated(tokens, source);
        try {
            return new QueryAstBuilder(source).buildExpression(tree);
        } catch (CompilerException e) {
            throw CompilationFailedException.of(e);
        }
    }
}
