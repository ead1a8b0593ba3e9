package com.pipesql.parser;

import com.pipesql.ast.BinOp;
import com.pipesql.ast.Expr;
import com.pipesql.ast.ExprKind;
import com.pipesql.ast.Stmt;
import com.pipesql.ast.UnOp;
import com.pipesql.diagnostic.Span;
import com.pipesql.exception.ParseException;
import com.pipesql.ir.Literal;
import com.pipesql.ir.QueryDef;
import com.pipesql.lexer.InterpolationPart;
import com.pipesql.lexer.Token;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.tree.TerminalNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * ANTLR visitor that builds the parser representation ({@link Stmt} and {@link Expr})
 * from the parse tree.
 *
 * <p>Node ids are assigned in visiting order and are unique within one builder.
 */
final class QueryAstBuilder extends PipeBaseParserBaseVisitor<Object> {

    private static final Logger logger = LoggerFactory.getLogger(QueryAstBuilder.class);

    private final String source;
    private int nextId;

    QueryAstBuilder(String source) {
        this.source = source;
    }

    // ==================== Entry Points ====================

    List<Stmt> buildSource(PipeBaseParser.SourceContext ctx) {
        List<Stmt> stmts = new ArrayList<>();
        if (ctx.header() != null) {
            stmts.add(buildHeader(ctx.header()));
        }
        if (ctx.moduleBody() != null) {
            stmts.addAll(buildModuleBody(ctx.moduleBody()));
        }
        return stmts;
    }

    Expr buildExpression(PipeBaseParser.InterpolatedExprContext ctx) {
        return (Expr) visit(ctx.call());
    }

    // ==================== Statements ====================

    private Stmt buildHeader(PipeBaseParser.HeaderContext ctx) {
        String version = null;
        String target = null;
        for (PipeBaseParser.HeaderArgContext arg : ctx.headerArg()) {
            String key = arg.IDENT().getText();
            Expr value = (Expr) visit(arg.expr());
            switch (key) {
                case "target" -> target = headerValue(value);
                case "version" -> version = headerValue(value);
                default -> throw (ParseException) new ParseException(
                    "Unknown query definition argument `" + key + "`", span(arg))
                    .withHint("valid arguments are `target` and `version`");
            }
        }
        return new Stmt(new Stmt.StmtKind.Header(new QueryDef(version, target)), span(ctx), List.of());
    }

    private static String headerValue(Expr value) {
        if (value.kind() instanceof ExprKind.Ident ident) {
            return ident.toString();
        }
        if (value.kind() instanceof ExprKind.Lit lit && lit.value() instanceof Literal.Str str) {
            return str.value();
        }
        throw new ParseException("Expected a name or a string", value.span());
    }

    private List<Stmt> buildModuleBody(PipeBaseParser.ModuleBodyContext ctx) {
        List<Stmt> stmts = new ArrayList<>();
        for (PipeBaseParser.StmtContext stmt : ctx.stmt()) {
            stmts.add(visitStmt(stmt));
        }
        return stmts;
    }

    @Override
    public Stmt visitStmt(PipeBaseParser.StmtContext ctx) {
        List<Expr> annotations = new ArrayList<>();
        for (PipeBaseParser.AnnotationContext annotation : ctx.annotation()) {
            annotations.add(visitTuple(annotation.tuple()));
        }
        Stmt.StmtKind kind = (Stmt.StmtKind) visit(ctx.stmtKind());
        return new Stmt(kind, span(ctx.stmtKind()), annotations);
    }

    @Override
    public Stmt.StmtKind visitLetStmt(PipeBaseParser.LetStmtContext ctx) {
        Expr value = (Expr) visit(ctx.callOrLambda());
        return new Stmt.StmtKind.VarDef(Stmt.VarDefKind.LET, ctx.IDENT().getText(), value);
    }

    @Override
    public Stmt.StmtKind visitModuleStmt(PipeBaseParser.ModuleStmtContext ctx) {
        return new Stmt.StmtKind.ModuleDef(ctx.IDENT().getText(), buildModuleBody(ctx.moduleBody()));
    }

    @Override
    public Stmt.StmtKind visitMainStmt(PipeBaseParser.MainStmtContext ctx) {
        Expr value = visitPipeline(ctx.pipeline());
        if (ctx.INTO() != null) {
            return new Stmt.StmtKind.VarDef(Stmt.VarDefKind.INTO, ctx.IDENT().getText(), value);
        }
        return new Stmt.StmtKind.VarDef(Stmt.VarDefKind.MAIN, "main", value);
    }

    // ==================== Pipelines and calls ====================

    @Override
    public Expr visitPipeline(PipeBaseParser.PipelineContext ctx) {
        return pipelineOf(ctx.pipeStep(), ctx);
    }

    @Override
    public Expr visitInlinePipeline(PipeBaseParser.InlinePipelineContext ctx) {
        return pipelineOf(ctx.pipeStep(), ctx);
    }

    private Expr pipelineOf(List<PipeBaseParser.PipeStepContext> steps, ParserRuleContext ctx) {
        List<Expr> exprs = new ArrayList<>(steps.size());
        for (PipeBaseParser.PipeStepContext step : steps) {
            exprs.add(visitPipeStep(step));
        }
        if (exprs.size() == 1) {
            return exprs.get(0);
        }
        return expr(new ExprKind.Pipeline(exprs), ctx);
    }

    @Override
    public Expr visitPipeStep(PipeBaseParser.PipeStepContext ctx) {
        Expr value = (Expr) visit(ctx.callOrLambda());
        return ctx.alias != null ? value.withAlias(ctx.alias.getText()) : value;
    }

    @Override
    public Expr visitCallOrLambda(PipeBaseParser.CallOrLambdaContext ctx) {
        return ctx.lambda() != null ? visitLambda(ctx.lambda()) : (Expr) visit(ctx.call());
    }

    @Override
    public Expr visitLambda(PipeBaseParser.LambdaContext ctx) {
        List<ExprKind.FuncParam> params = new ArrayList<>();
        List<ExprKind.FuncParam> namedParams = new ArrayList<>();
        for (PipeBaseParser.LambdaParamContext param : ctx.lambdaParam()) {
            String name = param.IDENT().getText();
            if (param.expr() != null) {
                namedParams.add(new ExprKind.FuncParam(name, (Expr) visit(param.expr())));
            } else {
                params.add(new ExprKind.FuncParam(name, null));
            }
        }
        Expr body = (Expr) visit(ctx.call());
        return expr(new ExprKind.Func(params, namedParams, body), ctx);
    }

    @Override
    public Expr visitPlainCall(PipeBaseParser.PlainCallContext ctx) {
        return (Expr) visit(ctx.expr());
    }

    @Override
    public Expr visitFuncCall(PipeBaseParser.FuncCallContext ctx) {
        Expr name = visitIdent(ctx.ident());
        List<Expr> args = new ArrayList<>();
        Map<String, Expr> namedArgs = new LinkedHashMap<>();
        for (PipeBaseParser.CallArgContext arg : ctx.callArg()) {
            if (arg instanceof PipeBaseParser.NamedArgContext named) {
                String key = named.IDENT().getText();
                if (namedArgs.containsKey(key)) {
                    throw new ParseException("Duplicate named argument `" + key + "`", span(named));
                }
                namedArgs.put(key, (Expr) visit(named.expr()));
            } else {
                PipeBaseParser.PositionalArgContext positional = (PipeBaseParser.PositionalArgContext) arg;
                Expr value = (Expr) visit(positional.expr());
                args.add(positional.alias != null ? value.withAlias(positional.alias.getText()) : value);
            }
        }
        return expr(new ExprKind.FuncCall(name, args, namedArgs), ctx);
    }

    // ==================== Expressions ====================

    @Override
    public Expr visitTermExpr(PipeBaseParser.TermExprContext ctx) {
        return visitRangeExpr(ctx.rangeExpr());
    }

    @Override
    public Expr visitBinaryExpr(PipeBaseParser.BinaryExprContext ctx) {
        Expr left = (Expr) visit(ctx.left);
        Expr right = (Expr) visit(ctx.right);
        return expr(new ExprKind.Binary(left, binOp(ctx.op), right), ctx);
    }

    private static BinOp binOp(org.antlr.v4.runtime.Token op) {
        Token lexed = ((LexedToken) op).lexed();
        return switch (lexed.kind()) {
            case POW -> BinOp.POW;
            case STAR -> BinOp.MUL;
            case SLASH -> BinOp.DIV_FLOAT;
            case DIV_INT -> BinOp.DIV_INT;
            case PERCENT -> BinOp.MOD;
            case PLUS -> BinOp.ADD;
            case MINUS -> BinOp.SUB;
            case EQ -> BinOp.EQ;
            case NE -> BinOp.NE;
            case LT -> BinOp.LT;
            case GT -> BinOp.GT;
            case LTE -> BinOp.LTE;
            case GTE -> BinOp.GTE;
            case REGEX_SEARCH -> BinOp.REGEX_SEARCH;
            case COALESCE -> BinOp.COALESCE;
            case AND -> BinOp.AND;
            case OR -> BinOp.OR;
            default -> throw new IllegalStateException("Not a binary operator: " + lexed);
        };
    }

    @Override
    public Expr visitRangeExpr(PipeBaseParser.RangeExprContext ctx) {
        if (ctx.RANGE() == null) {
            return visitUnaryExpr(ctx.low);
        }
        Expr low = ctx.low != null ? visitUnaryExpr(ctx.low) : null;
        Expr high = ctx.high != null ? visitUnaryExpr(ctx.high) : null;
        return expr(new ExprKind.Range(low, high), ctx);
    }

    @Override
    public Expr visitUnaryExpr(PipeBaseParser.UnaryExprContext ctx) {
        Expr operand = (Expr) visit(ctx.term());
        if (ctx.op == null) {
            return operand;
        }
        UnOp op = switch (((LexedToken) ctx.op).lexed().kind()) {
            case MINUS -> UnOp.NEG;
            case PLUS -> UnOp.ADD;
            case BANG -> UnOp.NOT;
            case EQ -> UnOp.EQ_SELF;
            default -> throw new IllegalStateException("Not a unary operator: " + ctx.op.getText());
        };
        return expr(new ExprKind.Unary(op, operand), ctx);
    }

    // ==================== Terms ====================

    @Override
    public Expr visitLiteralTerm(PipeBaseParser.LiteralTermContext ctx) {
        Token token = ((LexedToken) ctx.literal().getStart()).lexed();
        Literal value = switch (token.kind()) {
            case NULL -> Literal.NULL;
            case BOOLEAN -> new Literal.Bool(Boolean.parseBoolean(token.value()));
            case INTEGER -> new Literal.Int(Long.parseLong(token.value()));
            case FLOAT -> new Literal.Real(Double.parseDouble(token.value()));
            case STRING -> new Literal.Str(token.value());
            case DATE -> new Literal.Date(token.value());
            case TIME -> new Literal.Time(token.value());
            case TIMESTAMP -> new Literal.Timestamp(token.value());
            case VALUE_AND_UNIT -> new Literal.ValueAndUnit(Long.parseLong(token.value()), token.unit());
            default -> throw new IllegalStateException("Not a literal: " + token);
        };
        return expr(new ExprKind.Lit(value), ctx);
    }

    @Override
    public Expr visitIdentTerm(PipeBaseParser.IdentTermContext ctx) {
        return visitIdent(ctx.ident());
    }

    @Override
    public Expr visitIdent(PipeBaseParser.IdentContext ctx) {
        List<String> parts = new ArrayList<>();
        for (TerminalNode part : ctx.IDENT()) {
            parts.add(((LexedToken) part.getSymbol()).lexed().value());
        }
        if (ctx.STAR() != null) {
            parts.add("*");
        }
        return expr(new ExprKind.Ident(parts), ctx);
    }

    @Override
    public Expr visitTupleTerm(PipeBaseParser.TupleTermContext ctx) {
        return visitTuple(ctx.tuple());
    }

    @Override
    public Expr visitTuple(PipeBaseParser.TupleContext ctx) {
        List<Expr> fields = new ArrayList<>();
        for (PipeBaseParser.TupleItemContext item : ctx.tupleItem()) {
            Expr value = visitInlinePipeline(item.inlinePipeline());
            fields.add(item.alias != null ? value.withAlias(item.alias.getText()) : value);
        }
        return expr(new ExprKind.Tuple(fields), ctx);
    }

    @Override
    public Expr visitArrayTerm(PipeBaseParser.ArrayTermContext ctx) {
        List<Expr> items = new ArrayList<>();
        for (PipeBaseParser.InlinePipelineContext item : ctx.array().inlinePipeline()) {
            items.add(visitInlinePipeline(item));
        }
        return expr(new ExprKind.Array(items), ctx);
    }

    @Override
    public Expr visitParenTerm(PipeBaseParser.ParenTermContext ctx) {
        return visitPipeline(ctx.pipeline());
    }

    @Override
    public Expr visitInterpolationTerm(PipeBaseParser.InterpolationTermContext ctx) {
        Token token = ((LexedToken) ctx.INTERPOLATION().getSymbol()).lexed();
        List<ExprKind.InterpolateItem> items = new ArrayList<>();
        for (InterpolationPart part : token.parts()) {
            if (part instanceof InterpolationPart.Text text) {
                items.add(new ExprKind.InterpolateItem.Text(text.text()));
            } else {
                InterpolationPart.Expression expression = (InterpolationPart.Expression) part;
                if (expression.tokens().isEmpty()) {
                    throw new ParseException("Empty interpolated expression", expression.span());
                }
                Expr inner = (Expr) visit(QueryParser.parseInterpolated(expression.tokens(), source).call());
                items.add(new ExprKind.InterpolateItem.Expression(inner, expression.format()));
            }
        }
        ExprKind kind = "f".equals(token.value())
            ? new ExprKind.FString(items)
            : new ExprKind.SString(items);
        return expr(kind, ctx);
    }

    @Override
    public Expr visitCaseTerm(PipeBaseParser.CaseTermContext ctx) {
        List<ExprKind.SwitchCase> cases = new ArrayList<>();
        for (PipeBaseParser.CaseArmContext arm : ctx.caseArm()) {
            cases.add(new ExprKind.SwitchCase((Expr) visit(arm.condition), (Expr) visit(arm.value)));
        }
        return expr(new ExprKind.Case(cases), ctx);
    }

    @Override
    public Expr visitParamTerm(PipeBaseParser.ParamTermContext ctx) {
        Token token = ((LexedToken) ctx.PARAM().getSymbol()).lexed();
        return expr(new ExprKind.Param(token.value()), ctx);
    }

    // ==================== Helpers ====================

    private Expr expr(ExprKind kind, ParserRuleContext ctx) {
        Expr expr = new Expr(nextId++, kind, span(ctx), null);
        if (logger.isTraceEnabled()) {
            logger.trace("Built {} at {}", expr, expr.span());
        }
        return expr;
    }

    private static Span span(ParserRuleContext ctx) {
        int start = Math.max(ctx.getStart().getStartIndex(), 0);
        if (ctx.getStop() == null || ctx.getStop().getType() == org.antlr.v4.runtime.Token.EOF) {
            return new Span(start, start);
        }
        return new Span(start, Math.max(start, ctx.getStop().getStopIndex() + 1));
    }
}
