package com.pipesql.sql.gen;

import com.pipesql.diagnostic.Span;
import com.pipesql.exception.CodegenException;
import com.pipesql.ir.ColumnSort;
import com.pipesql.ir.Literal;
import com.pipesql.ir.SortDirection;
import com.pipesql.ir.WindowKind;
import com.pipesql.ir.rq.Expr;
import com.pipesql.ir.rq.ExprKind;
import com.pipesql.ir.rq.InterpolateItem;
import com.pipesql.ir.rq.Range;
import com.pipesql.ir.rq.RelationColumn;
import com.pipesql.ir.rq.Transform;
import com.pipesql.ir.rq.Window;
import com.pipesql.ir.rq.WindowFrame;
import com.pipesql.sql.Dialect;
import com.pipesql.sql.SqlQuoting;
import com.pipesql.sql.pq.AnchorContext;
import com.pipesql.sql.pq.ColumnDecl;
import com.pipesql.sql.pq.RelationInstance;
import com.pipesql.sql.pq.SqlContext;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Renders relational expressions as SQL text.
 *
 * <p>Every rendered expression carries its binding strength, so operands are
 * only parenthesized where SQL precedence requires it.
 */
public final class ExprGenerator {

    private static final Pattern TIMEZONE = Pattern.compile("([+-]\\d{2}):?(\\d{2})$");

    private static final Map<String, String> INTERVAL_UNITS = Map.of(
        "years", "YEAR",
        "months", "MONTH",
        "weeks", "WEEK",
        "days", "DAY",
        "hours", "HOUR",
        "minutes", "MINUTE",
        "seconds", "SECOND",
        "milliseconds", "MILLISECOND",
        "microseconds", "MICROSECOND");

    /** Infix operators rendered directly: symbol, strength and associativity. */
    private record BinaryOp(String symbol, int strength, SqlExpr.Associativity associativity) {}

    private static final Map<String, BinaryOp> BINARY_OPS = Map.ofEntries(
        Map.entry("std.mul", new BinaryOp("*", 11, SqlExpr.Associativity.BOTH)),
        Map.entry("std.mod", new BinaryOp("%", 11, SqlExpr.Associativity.LEFT)),
        Map.entry("std.add", new BinaryOp("+", 10, SqlExpr.Associativity.BOTH)),
        Map.entry("std.sub", new BinaryOp("-", 10, SqlExpr.Associativity.LEFT)),
        Map.entry("std.eq", new BinaryOp("=", 6, SqlExpr.Associativity.BOTH)),
        Map.entry("std.ne", new BinaryOp("<>", 6, SqlExpr.Associativity.BOTH)),
        Map.entry("std.gt", new BinaryOp(">", 6, SqlExpr.Associativity.BOTH)),
        Map.entry("std.lt", new BinaryOp("<", 6, SqlExpr.Associativity.BOTH)),
        Map.entry("std.gte", new BinaryOp(">=", 6, SqlExpr.Associativity.BOTH)),
        Map.entry("std.lte", new BinaryOp("<=", 6, SqlExpr.Associativity.BOTH)),
        Map.entry("std.and", new BinaryOp("AND", 3, SqlExpr.Associativity.BOTH)),
        Map.entry("std.or", new BinaryOp("OR", 2, SqlExpr.Associativity.BOTH)));

    private static final int IS_NULL = 5;
    private static final int IN_LIST = 20;
    private static final int CONCAT_OP = 9;

    private final SqlContext ctx;
    private final AnchorContext anchor;
    private final Dialect dialect;

    public ExprGenerator(SqlContext ctx) {
        this.ctx = ctx;
        this.anchor = ctx.anchor();
        this.dialect = ctx.dialect();
    }

    public SqlExpr translate(Expr expr) {
        ExprKind kind = expr.kind();
        if (kind instanceof ExprKind.ColumnRef ref) {
            return translateCid(ref.cid());
        }
        if (kind instanceof ExprKind.Lit lit) {
            return SqlExpr.atom(translateLiteral(lit.value(), expr.span()));
        }
        if (kind instanceof ExprKind.SString s) {
            return SqlExpr.source(translateSString(s.items()));
        }
        if (kind instanceof ExprKind.Param param) {
            return SqlExpr.source("$" + param.name());
        }
        if (kind instanceof ExprKind.Case c) {
            return translateCase(c);
        }
        if (kind instanceof ExprKind.Operator op) {
            return translateOperator(op, expr.span());
        }
        throw new CodegenException("Unexpected array of values (not supported here)", expr.span());
    }

    // ==================== Operators ====================

    private SqlExpr translateOperator(ExprKind.Operator op, Span span) {
        String name = op.name();
        List<Expr> args = op.args();

        if ((name.equals("std.eq") || name.equals("std.ne")) && args.size() == 2
            && (isNull(args.get(0)) || isNull(args.get(1)))) {
            Expr operand = isNull(args.get(0)) ? args.get(1) : args.get(0);
            String text = translateOperand(operand, IS_NULL, false);
            return SqlExpr.of(text + (name.equals("std.eq") ? " IS NULL" : " IS NOT NULL"), IS_NULL);
        }
        if (name.equals("std.concat")) {
            return translateConcat(args);
        }
        if (name.equals("std.array_in") && args.size() == 2) {
            return translateIn(args.get(0), args.get(1), span);
        }
        SqlExpr between = tryIntoBetween(name, args);
        if (between != null) {
            return between;
        }
        BinaryOp binary = BINARY_OPS.get(name);
        if (binary != null && args.size() == 2) {
            boolean left = binary.associativity() != SqlExpr.Associativity.RIGHT;
            boolean right = binary.associativity() != SqlExpr.Associativity.LEFT;
            String l = translateOperand(args.get(0), binary.strength(), !left);
            String r = translateOperand(args.get(1), binary.strength(), !right);
            return new SqlExpr(l + " " + binary.symbol() + " " + r, binary.strength(), binary.associativity(),
                               true, null);
        }
        OperatorTemplate template = StdOperators.find(name, dialect)
            .orElseThrow(() -> new CodegenException("unknown function " + name, span));
        return translateTemplate(name, template, args, span);
    }

    private SqlExpr translateTemplate(String name, OperatorTemplate template, List<Expr> args, Span span) {
        int defaultStrength = template.bindingStrength() != null ? template.bindingStrength() : SqlExpr.SOURCE;
        StringBuilder sb = new StringBuilder();
        for (OperatorTemplate.Part part : template.parts()) {
            if (part instanceof OperatorTemplate.Text text) {
                sb.append(text.text());
                continue;
            }
            OperatorTemplate.Arg arg = (OperatorTemplate.Arg) part;
            if (arg.index() >= args.size()) {
                throw new CodegenException("function %s expects at least %d arguments, got %d"
                    .formatted(name, arg.index() + 1, args.size()), span);
            }
            int required = arg.strength() != null ? arg.strength() : defaultStrength;
            String operand = translateOperand(args.get(arg.index()), required, false);
            // avoid `--x`, which SQL reads as a comment
            if (sb.length() > 0 && sb.charAt(sb.length() - 1) == '-' && operand.startsWith("-")) {
                operand = "(" + operand + ")";
            }
            sb.append(operand);
        }
        if (template.coalesce() != null && !ctx.query().windowFunction()) {
            return SqlExpr.source("COALESCE(" + sb + ", " + template.coalesce() + ")")
                .withWindowFrame(template.windowFrame());
        }
        return new SqlExpr(sb.toString(), defaultStrength, SqlExpr.Associativity.BOTH, template.windowFrame(), null);
    }

    private SqlExpr translateConcat(List<Expr> args) {
        List<Expr> parts = new ArrayList<>();
        for (Expr arg : args) {
            collectConcatArgs(arg, parts);
        }
        if (dialect.hasConcatFunction()) {
            String joined = parts.stream().map(p -> translate(p).text()).collect(Collectors.joining(", "));
            return SqlExpr.atom("CONCAT(" + joined + ")");
        }
        String current = translateOperand(parts.get(0), CONCAT_OP, false);
        for (int i = 1; i < parts.size(); i++) {
            current = current + " || " + translateOperand(parts.get(i), CONCAT_OP, true);
        }
        return SqlExpr.of(current, CONCAT_OP);
    }

    private static void collectConcatArgs(Expr expr, List<Expr> out) {
        if (expr.kind() instanceof ExprKind.Operator op && op.name().equals("std.concat")) {
            op.args().forEach(a -> collectConcatArgs(a, out));
        } else {
            out.add(expr);
        }
    }

    private SqlExpr translateIn(Expr value, Expr array, Span span) {
        if (!(array.kind() instanceof ExprKind.Array items)) {
            throw new CodegenException("`in` expects an array of values", span);
        }
        if (items.items().isEmpty()) {
            return SqlExpr.atom("false");
        }
        String list = items.items().stream().map(i -> translate(i).text()).collect(Collectors.joining(", "));
        return SqlExpr.of(translateOperand(value, IN_LIST, false) + " IN (" + list + ")", IN_LIST);
    }

    /** Renders {@code x >= a && x <= b} as {@code x BETWEEN a AND b}. */
    private SqlExpr tryIntoBetween(String name, List<Expr> args) {
        if (!name.equals("std.and") || args.size() != 2) {
            return null;
        }
        if (args.get(0).kind() instanceof ExprKind.Operator a && a.name().equals("std.gte") && a.args().size() == 2
            && args.get(1).kind() instanceof ExprKind.Operator b && b.name().equals("std.lte")
            && b.args().size() == 2 && a.args().get(0).kind().equals(b.args().get(0).kind())) {
            String expr = translateOperand(a.args().get(0), 0, false);
            String low = translateOperand(a.args().get(1), 0, false);
            String high = translateOperand(b.args().get(1), 0, false);
            return SqlExpr.of(expr + " BETWEEN " + low + " AND " + high, SqlExpr.ATOM);
        }
        return null;
    }

    /**
     * Translates an operand, wrapping it in parentheses when it binds weaker than
     * its parent, or equally and on the side its operator does not associate to.
     */
    public String translateOperand(Expr expr, int parentStrength, boolean fixAssociativity) {
        SqlExpr e = translate(expr);
        boolean nest = e.strength() < parentStrength || (e.strength() == parentStrength && fixAssociativity);
        return nest ? "(" + e.text() + ")" : e.text();
    }

    private static boolean isNull(Expr expr) {
        return expr.kind() instanceof ExprKind.Lit lit && lit.value() instanceof Literal.Null;
    }

    private SqlExpr translateCase(ExprKind.Case c) {
        List<ExprKind.SwitchCase> cases = new ArrayList<>(c.cases());
        String otherwise = "NULL";
        if (!cases.isEmpty()) {
            ExprKind.SwitchCase last = cases.get(cases.size() - 1);
            if (last.condition().kind() instanceof ExprKind.Lit lit
                && lit.value() instanceof Literal.Bool b && b.value()) {
                otherwise = translate(last.value()).text();
                cases.remove(cases.size() - 1);
            }
        }
        StringBuilder sb = new StringBuilder("CASE");
        for (ExprKind.SwitchCase sc : cases) {
            sb.append(" WHEN ").append(translate(sc.condition()).text())
              .append(" THEN ").append(translate(sc.value()).text());
        }
        sb.append(" ELSE ").append(otherwise).append(" END");
        return SqlExpr.atom(sb.toString());
    }

    public String translateSString(List<InterpolateItem> items) {
        StringBuilder sb = new StringBuilder();
        for (InterpolateItem item : items) {
            if (item instanceof InterpolateItem.Text text) {
                sb.append(text.text());
            } else {
                sb.append(translate(((InterpolateItem.Expression) item).expr()).text());
            }
        }
        return sb.toString();
    }

    // ==================== Columns ====================

    /**
     * Translates a column reference. Before the projection, computed columns are
     * expanded to their expressions; after it, every column is referenced by name.
     */
    public SqlExpr translateCid(int cid) {
        ColumnDecl decl = anchor.columnDecl(cid);
        if (ctx.query().preProjection()) {
            if (decl instanceof ColumnDecl.OfCompute c) {
                Transform.Compute compute = c.compute();
                if (compute.window() == null) {
                    return translate(compute.expr());
                }
                boolean saved = ctx.query().windowFunction();
                ctx.query().windowFunction(true);
                SqlExpr expr = translate(compute.expr());
                ctx.query().windowFunction(saved);
                return translateWindowed(expr, compute.window());
            }
            ColumnDecl.OfRelation rel = (ColumnDecl.OfRelation) decl;
            RelationInstance instance = anchor.relationInstance(rel.riid());
            String column;
            if (rel.isWildcard()) {
                column = translateStar(null);
            } else {
                String name = ((RelationColumn.Single) rel.column()).name();
                column = name != null ? name : anchor.ensureColumnName(cid);
            }
            return translateIdent(instance.name(), column);
        }

        String table = null;
        String column;
        if (decl instanceof ColumnDecl.OfRelation rel) {
            table = anchor.relationInstance(rel.riid()).name();
            column = rel.isWildcard() ? translateStar(null) : anchor.ensureColumnName(cid);
        } else {
            column = anchor.ensureColumnName(cid);
        }
        return translateIdent(table, column);
    }

    public String translateStar(Span span) {
        if (!ctx.query().allowStars()) {
            throw new CodegenException("Target dialect does not support * in this position.", span);
        }
        return "*";
    }

    /** Renders a possibly qualified identifier; the table is left out when only one relation is in scope. */
    public SqlExpr translateIdent(String table, String column) {
        List<String> parts = new ArrayList<>();
        if (table != null && (!ctx.query().omitIdentPrefix() || column == null)) {
            if (dialect == Dialect.BIGQUERY || table.contains("*")) {
                parts.add(table);
            } else {
                parts.addAll(List.of(table.split("\\.")));
            }
        }
        if (column != null) {
            parts.add(column);
        }
        String text = parts.stream()
            .map(p -> SqlQuoting.quoteIdentifier(p, dialect))
            .collect(Collectors.joining("."));
        return SqlExpr.ident(text, column);
    }

    public String translateIdentPart(String name) {
        return SqlQuoting.quoteIdentifier(name, dialect);
    }

    public String translateColumnSort(ColumnSort<Integer> sort) {
        String expr = translateCid(sort.column()).text();
        return sort.direction() == SortDirection.DESC ? expr + " DESC" : expr;
    }

    // ==================== Windows ====================

    private SqlExpr translateWindowed(SqlExpr expr, Window window) {
        List<String> spec = new ArrayList<>();
        if (!window.partition().isEmpty()) {
            spec.add("PARTITION BY " + window.partition().stream()
                .map(cid -> translateCid(cid).text())
                .collect(Collectors.joining(", ")));
        }
        if (!window.sort().isEmpty()) {
            spec.add("ORDER BY " + window.sort().stream()
                .map(this::translateColumnSort)
                .collect(Collectors.joining(", ")));
        }
        WindowFrame defaultFrame = window.sort().isEmpty()
            ? WindowFrame.DEFAULT
            : new WindowFrame(WindowKind.RANGE, new Range(null, Expr.of(new ExprKind.Lit(new Literal.Int(0)))));
        if (expr.windowFrame() && !sameFrame(window.frame(), defaultFrame)) {
            spec.add(translateFrame(window.frame()));
        }
        return SqlExpr.source(expr.text() + " OVER (" + String.join(" ", spec) + ")");
    }

    private static boolean sameFrame(WindowFrame a, WindowFrame b) {
        return a.kind() == b.kind()
            && sameBound(a.range().start(), b.range().start())
            && sameBound(a.range().end(), b.range().end());
    }

    private static boolean sameBound(Expr a, Expr b) {
        return a == null ? b == null : b != null && a.kind().equals(b.kind());
    }

    private String translateFrame(WindowFrame frame) {
        String units = frame.kind() == WindowKind.ROWS ? "ROWS" : "RANGE";
        String start = frame.range().start() == null ? "UNBOUNDED PRECEDING" : frameBound(frame.range().start());
        String end = frame.range().end() == null ? "UNBOUNDED FOLLOWING" : frameBound(frame.range().end());
        return units + " BETWEEN " + start + " AND " + end;
    }

    private static String frameBound(Expr bound) {
        long n = asInt(bound, "window frame bounds must be integer literals");
        if (n == 0) {
            return "CURRENT ROW";
        }
        return n > 0 ? n + " FOLLOWING" : (-n) + " PRECEDING";
    }

    // ==================== Ranges ====================

    /** A range of row numbers, 1-based and inclusive; null bounds are open. */
    public record IntRange(Long start, Long end) {}

    /**
     * Intersects consecutive takes into one range. The second range is relative
     * to the rows selected by the first.
     */
    public static IntRange rangeOfRanges(List<Range> ranges) {
        Long currentStart = null;
        Long currentEnd = null;
        for (Range range : ranges) {
            Long start = range.start() == null ? null : asInt(range.start(), "expected an integer literal");
            Long end = range.end() == null ? null : asInt(range.end(), "expected an integer literal");

            if (start == null) {
                start = currentStart;
            } else if (currentStart != null) {
                start = start + currentStart - 1;
            }
            if (end != null) {
                end = (currentStart == null ? 1 : currentStart) + end - 1;
            }
            if (currentEnd != null) {
                end = end == null ? currentEnd : Math.min(currentEnd, end);
            }
            currentStart = start;
            currentEnd = end;
        }
        if (currentStart != null && currentEnd != null && currentEnd < currentStart) {
            return new IntRange(null, 0L);
        }
        return new IntRange(currentStart, currentEnd);
    }

    private static long asInt(Expr expr, String message) {
        if (expr.kind() instanceof ExprKind.Lit lit && lit.value() instanceof Literal.Int i) {
            return i.value();
        }
        throw new CodegenException(message, expr.span());
    }

    // ==================== Literals ====================

    public String translateLiteral(Literal literal, Span span) {
        if (literal instanceof Literal.Null) {
            return "NULL";
        }
        if (literal instanceof Literal.Str s) {
            return SqlQuoting.quoteLiteral(s.value());
        }
        if (literal instanceof Literal.Bool b) {
            return Boolean.toString(b.value());
        }
        if (literal instanceof Literal.Int i) {
            return Long.toString(i.value());
        }
        if (literal instanceof Literal.Real r) {
            return formatReal(r.value());
        }
        if (literal instanceof Literal.Date d) {
            return datetime("DATE", "DATE", d.value());
        }
        if (literal instanceof Literal.Time t) {
            return datetime("TIME", "TIME", t.value());
        }
        if (literal instanceof Literal.Timestamp ts) {
            return datetime("TIMESTAMP", "DATETIME", ts.value());
        }
        Literal.ValueAndUnit interval = (Literal.ValueAndUnit) literal;
        String unit = INTERVAL_UNITS.get(interval.unit());
        if (unit == null) {
            throw new CodegenException("Unsupported interval unit: " + interval.unit(), span);
        }
        String value = dialect.requiresQuotedIntervals()
            ? SqlQuoting.quoteLiteral(interval.n() + " " + unit)
            : interval.n() + " " + unit;
        return "INTERVAL " + value;
    }

    private String datetime(String type, String sqliteFunction, String value) {
        if (!dialect.usesDateFunctions()) {
            return type + " " + SqlQuoting.quoteLiteral(value);
        }
        Matcher m = TIMEZONE.matcher(value);
        String normalized = m.find() ? m.replaceFirst(m.group(1) + ":" + m.group(2)) : value;
        return sqliteFunction + "(" + SqlQuoting.quoteLiteral(normalized) + ")";
    }

    /** Formats a float the shortest way that reads back as the same value, always with a fraction. */
    static String formatReal(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return Double.toString(value);
        }
        String text = Double.toString(value);
        if (text.contains("E")) {
            text = new BigDecimal(text).toPlainString();
        }
        return text.contains(".") ? text : text + ".0";
    }
}
