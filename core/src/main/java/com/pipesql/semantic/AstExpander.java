package com.pipesql.semantic;

import com.pipesql.ast.BinOp;
import com.pipesql.ast.UnOp;
import com.pipesql.exception.NameResolutionException;
import com.pipesql.ir.pl.Expr;
import com.pipesql.ir.pl.ExprKind;
import com.pipesql.ir.pl.InterpolateItem;
import com.pipesql.ir.pl.Stmt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts the parser representation into the pipelined language.
 *
 * <p>Operators become calls of the {@code std} functions implementing them, and
 * {@code ==col} becomes {@code this.col == that.col}.
 */
public final class AstExpander {

    private static final Logger logger = LoggerFactory.getLogger(AstExpander.class);

    private AstExpander() {
    }

    public static List<Stmt> expand(List<com.pipesql.ast.Stmt> stmts) {
        List<Stmt> result = new ArrayList<>(stmts.size());
        for (com.pipesql.ast.Stmt stmt : stmts) {
            result.add(expandStmt(stmt));
        }
        logger.debug("Expanded {} statement(s)", result.size());
        return result;
    }

    private static Stmt expandStmt(com.pipesql.ast.Stmt stmt) {
        Stmt.StmtKind kind;
        if (stmt.kind() instanceof com.pipesql.ast.Stmt.StmtKind.VarDef def) {
            kind = new Stmt.StmtKind.VarDef(
                Stmt.VarDefKind.valueOf(def.kind().name()), def.name(), expandExpr(def.value()));
        } else if (stmt.kind() instanceof com.pipesql.ast.Stmt.StmtKind.ModuleDef module) {
            List<Stmt> inner = new ArrayList<>();
            for (com.pipesql.ast.Stmt s : module.stmts()) {
                inner.add(expandStmt(s));
            }
            kind = new Stmt.StmtKind.ModuleDef(module.name(), inner);
        } else {
            com.pipesql.ast.Stmt.StmtKind.Header header = (com.pipesql.ast.Stmt.StmtKind.Header) stmt.kind();
            kind = new Stmt.StmtKind.QueryDefStmt(header.def());
        }
        return new Stmt(kind, stmt.span(), expandAll(stmt.annotations()));
    }

    public static Expr expandExpr(com.pipesql.ast.Expr expr) {
        if (expr == null) {
            return null;
        }
        ExprKind kind = expandKind(expr);
        Expr result = new Expr(kind, expr.span());
        if (expr.alias() != null) {
            result.alias(expr.alias());
        }
        return result;
    }

    private static ExprKind expandKind(com.pipesql.ast.Expr expr) {
        com.pipesql.ast.ExprKind kind = expr.kind();
        if (kind instanceof com.pipesql.ast.ExprKind.Ident ident) {
            return new ExprKind.Ident(ident.parts());
        }
        if (kind instanceof com.pipesql.ast.ExprKind.Lit lit) {
            return new ExprKind.Lit(lit.value());
        }
        if (kind instanceof com.pipesql.ast.ExprKind.Tuple tuple) {
            return new ExprKind.Tuple(expandAll(tuple.fields()));
        }
        if (kind instanceof com.pipesql.ast.ExprKind.Array array) {
            return new ExprKind.Array(expandAll(array.items()));
        }
        if (kind instanceof com.pipesql.ast.ExprKind.Range range) {
            return new ExprKind.Range(expandExpr(range.start()), expandExpr(range.end()));
        }
        if (kind instanceof com.pipesql.ast.ExprKind.Pipeline pipeline) {
            return new ExprKind.Pipeline(expandAll(pipeline.exprs()));
        }
        if (kind instanceof com.pipesql.ast.ExprKind.FuncCall call) {
            Map<String, Expr> named = new LinkedHashMap<>();
            call.namedArgs().forEach((k, v) -> named.put(k, expandExpr(v)));
            return new ExprKind.FuncCall(expandExpr(call.name()), expandAll(call.args()), named);
        }
        if (kind instanceof com.pipesql.ast.ExprKind.Func func) {
            return new ExprKind.Func(expandParams(func.params()), expandParams(func.namedParams()),
                expandExpr(func.body()));
        }
        if (kind instanceof com.pipesql.ast.ExprKind.Binary binary) {
            return stdCall(binary.op().stdName(), expr,
                expandExpr(binary.left()), expandExpr(binary.right()));
        }
        if (kind instanceof com.pipesql.ast.ExprKind.Unary unary) {
            return expandUnary(unary, expr);
        }
        if (kind instanceof com.pipesql.ast.ExprKind.SString s) {
            return new ExprKind.SString(expandItems(s.items()));
        }
        if (kind instanceof com.pipesql.ast.ExprKind.FString f) {
            return new ExprKind.FString(expandItems(f.items()));
        }
        if (kind instanceof com.pipesql.ast.ExprKind.Case c) {
            List<ExprKind.SwitchCase> cases = new ArrayList<>();
            for (com.pipesql.ast.ExprKind.SwitchCase sc : c.cases()) {
                cases.add(new ExprKind.SwitchCase(expandExpr(sc.condition()), expandExpr(sc.value())));
            }
            return new ExprKind.Case(cases);
        }
        com.pipesql.ast.ExprKind.Param param = (com.pipesql.ast.ExprKind.Param) kind;
        return new ExprKind.Param(param.name());
    }

    private static ExprKind expandUnary(com.pipesql.ast.ExprKind.Unary unary, com.pipesql.ast.Expr expr) {
        Expr operand = expandExpr(unary.expr());
        UnOp op = unary.op();
        switch (op) {
            case NEG:
                return stdCall("neg", expr, operand);
            case NOT:
                return stdCall("not", expr, operand);
            case ADD:
                return operand.kind();
            default:
                break;
        }
        // ==col
        if (!(operand.kind() instanceof ExprKind.Ident ident)) {
            throw (NameResolutionException) new NameResolutionException(
                "Self-equality `==` requires a column name", expr.span())
                .withHint("write `==column` or `this.a == that.b`");
        }
        List<String> left = new ArrayList<>();
        left.add(NameLookup.THIS);
        left.addAll(ident.parts());
        List<String> right = new ArrayList<>();
        right.add(NameLookup.THAT);
        right.addAll(ident.parts());
        return stdCall(BinOp.EQ.stdName(), expr,
            new Expr(new ExprKind.Ident(left), operand.span()),
            new Expr(new ExprKind.Ident(right), operand.span()));
    }

    private static ExprKind stdCall(String name, com.pipesql.ast.Expr at, Expr... args) {
        Expr callee = new Expr(ExprKind.Ident.of(StdLib.NS_STD, name), at.span());
        return new ExprKind.FuncCall(callee, List.of(args), Map.of());
    }

    private static List<Expr> expandAll(List<com.pipesql.ast.Expr> exprs) {
        List<Expr> result = new ArrayList<>(exprs.size());
        for (com.pipesql.ast.Expr e : exprs) {
            result.add(expandExpr(e));
        }
        return result;
    }

    private static List<ExprKind.FuncParam> expandParams(List<com.pipesql.ast.ExprKind.FuncParam> params) {
        List<ExprKind.FuncParam> result = new ArrayList<>(params.size());
        for (com.pipesql.ast.ExprKind.FuncParam p : params) {
            result.add(new ExprKind.FuncParam(p.name(), expandExpr(p.defaultValue())));
        }
        return result;
    }

    private static List<InterpolateItem> expandItems(List<com.pipesql.ast.ExprKind.InterpolateItem> items) {
        List<InterpolateItem> result = new ArrayList<>(items.size());
        for (com.pipesql.ast.ExprKind.InterpolateItem item : items) {
            if (item instanceof com.pipesql.ast.ExprKind.InterpolateItem.Text text) {
                result.add(new InterpolateItem.Text(text.text()));
            } else {
                com.pipesql.ast.ExprKind.InterpolateItem.Expression e =
                    (com.pipesql.ast.ExprKind.InterpolateItem.Expression) item;
                result.add(new InterpolateItem.Expression(expandExpr(e.expr()), e.format()));
            }
        }
        return result;
    }
}
