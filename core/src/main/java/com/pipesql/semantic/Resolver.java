package com.pipesql.semantic;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.pipesql.diagnostic.Span;
import com.pipesql.exception.CompilationFailedException;
import com.pipesql.exception.CompilerException;
import com.pipesql.exception.ErrorCodes;
import com.pipesql.exception.FrameException;
import com.pipesql.exception.LoweringException;
import com.pipesql.exception.NameResolutionException;
import com.pipesql.ir.ColumnSort;
import com.pipesql.ir.JoinSide;
import com.pipesql.ir.Literal;
import com.pipesql.ir.QueryDef;
import com.pipesql.ir.SortDirection;
import com.pipesql.ir.WindowKind;
import com.pipesql.ir.pl.Expr;
import com.pipesql.ir.pl.ExprKind;
import com.pipesql.ir.pl.InterpolateItem;
import com.pipesql.ir.pl.Lineage;
import com.pipesql.ir.pl.Stmt;
import com.pipesql.ir.pl.TransformKind;
import com.pipesql.json.IrJson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Resolves names of the pipelined language.
 *
 * <p>Every identifier is bound to a column of the current frame, a declaration
 * or a standard library function. Calls of user functions are inlined, calls of
 * standard transforms become {@link ExprKind.TransformCall} nodes carrying the
 * lineage of their output, and other standard functions become
 * {@link ExprKind.RqOperator} nodes.
 *
 * <p>Resolution never modifies its input; resolved nodes are new objects with an
 * id. Independent errors of different declarations are collected and reported
 * together.
 */
public final class Resolver {

    private static final Logger logger = LoggerFactory.getLogger(Resolver.class);

    private static final String PLACEHOLDER = "_param";

    private final Module root = Module.root();
    private final Map<String, RelationDecl> relations = new LinkedHashMap<>();
    private final List<CompilerException> errors = new ArrayList<>();
    private int nextId;

    private QueryDef def = QueryDef.EMPTY;
    private Expr mainValue;

    private Module module = root;
    private Lineage frame;
    private Lineage thisFrame;
    private Lineage thatFrame;
    private Map<String, Expr> params = Map.of();
    private boolean inAggregate;
    private List<Expr> groupBy;

    private Resolver() {
    }

    /**
     * Resolves a whole query.
     *
     * @throws CompilationFailedException listing every error found
     */
    public static ResolvedQuery resolve(List<Stmt> stmts) {
        return new Resolver().run(stmts);
    }

    private ResolvedQuery run(List<Stmt> stmts) {
        declareAll(stmts, root);
        resolveLets(root);

        Expr main = null;
        if (mainValue == null) {
            if (errors.isEmpty()) {
                throw CompilationFailedException.of(new LoweringException("Missing main pipeline", (Span) null));
            }
        } else {
            try {
                main = resolveExpr(mainValue);
                if (!main.isRelation()) {
                    throw (FrameException) new FrameException(
                        "Main pipeline must produce a relation, found `" + mainValue.kind() + "`", mainValue.span())
                        .withHint("start the pipeline with `from`");
                }
            } catch (CompilerException e) {
                report(e);
            }
        }
        if (!errors.isEmpty()) {
            throw new CompilationFailedException(errors);
        }
        logger.debug("Resolved query with {} relation(s)", relations.size());
        return new ResolvedQuery(def, main, relations);
    }

    private void report(CompilerException e) {
        // a failed declaration rethrows the same error wherever it is used
        if (!errors.contains(e)) {
            errors.add(e);
        }
    }

    // ==================== Declarations ====================

    private void declareAll(List<Stmt> stmts, Module scope) {
        for (Stmt stmt : stmts) {
            try {
                if (stmt.kind() instanceof Stmt.StmtKind.VarDef var) {
                    if (var.kind() == Stmt.VarDefKind.MAIN) {
                        if (scope != root) {
                            throw new NameResolutionException("A main pipeline is only allowed at the top level",
                                stmt.span());
                        }
                        if (mainValue != null) {
                            throw (NameResolutionException) new NameResolutionException(
                                "More than one main pipeline", stmt.span())
                                .withHint("declare the other pipelines with `let`");
                        }
                        mainValue = var.value();
                    } else {
                        scope.declare(var.name(), var.value(), stmt.span());
                    }
                } else if (stmt.kind() instanceof Stmt.StmtKind.ModuleDef moduleDef) {
                    declareAll(moduleDef.stmts(), scope.submodule(moduleDef.name(), stmt.span()));
                } else {
                    def = ((Stmt.StmtKind.QueryDefStmt) stmt.kind()).def();
                }
            } catch (CompilerException e) {
                report(e);
            }
        }
    }

    private void resolveLets(Module scope) {
        for (Object member : scope.members()) {
            if (member instanceof Module.Let let) {
                try {
                    ensureResolved(let, let.span);
                } catch (CompilerException e) {
                    report(e);
                }
            } else {
                resolveLets((Module) member);
            }
        }
    }

    /**
     * Finds out what a declaration is. Functions are inlined at each call and
     * constants are resolved again at each use; relations are resolved once.
     */
    private void ensureResolved(Module.Let let, Span usedAt) {
        switch (let.state) {
            case FAILED:
                throw let.error;
            case RESOLVING:
                throw new NameResolutionException("`" + let.path + "` refers to itself", usedAt);
            case UNRESOLVED:
                break;
            default:
                return;
        }
        if (let.value.kind() instanceof ExprKind.Func) {
            let.state = Module.Let.State.FUNCTION;
            return;
        }
        let.state = Module.Let.State.RESOLVING;
        Scope saved = saveScope();
        try {
            clearFrames();
            params = Map.of();
            module = let.scope;
            Expr value = resolveExpr(let.value);
            if (value.isRelation()) {
                RelationDecl decl = RelationDecl.relation(let.path, let.name, value);
                relations.put(let.path, decl);
                let.relation = decl;
                let.state = Module.Let.State.RELATION;
            } else {
                let.state = Module.Let.State.CONSTANT;
            }
            logger.debug("Declaration {} is a {}", let.path, let.state);
        } catch (CompilerException e) {
            let.state = Module.Let.State.FAILED;
            let.error = e;
            throw e;
        } finally {
            restoreScope(saved);
        }
    }

    // ==================== Expressions ====================

    private Expr resolveExpr(Expr e) {
        if (e.id() != null) {
            return e;
        }
        ExprKind kind = e.kind();
        if (kind instanceof ExprKind.Ident) {
            return resolveIdent(e, false);
        }
        if (kind instanceof ExprKind.FuncCall call) {
            return resolveCall(e, call);
        }
        if (kind instanceof ExprKind.Pipeline pipeline) {
            return resolvePipeline(e, pipeline);
        }
        if (kind instanceof ExprKind.Tuple tuple) {
            return fresh(e, new ExprKind.Tuple(resolveAll(tuple.fields())));
        }
        if (kind instanceof ExprKind.Array array) {
            return fresh(e, new ExprKind.Array(resolveAll(array.items())));
        }
        if (kind instanceof ExprKind.Range range) {
            return fresh(e, new ExprKind.Range(resolveNullable(range.start()), resolveNullable(range.end())));
        }
        if (kind instanceof ExprKind.SString s) {
            return fresh(e, new ExprKind.SString(resolveItems(s.items())));
        }
        if (kind instanceof ExprKind.FString f) {
            return fresh(e, new ExprKind.FString(resolveItems(f.items())));
        }
        if (kind instanceof ExprKind.Case c) {
            List<ExprKind.SwitchCase> cases = new ArrayList<>();
            for (ExprKind.SwitchCase sc : c.cases()) {
                cases.add(new ExprKind.SwitchCase(resolveExpr(sc.condition()), resolveExpr(sc.value())));
            }
            return fresh(e, new ExprKind.Case(cases));
        }
        return fresh(e, kind);
    }

    private List<Expr> resolveAll(List<Expr> exprs) {
        List<Expr> result = new ArrayList<>(exprs.size());
        for (Expr expr : exprs) {
            result.add(resolveExpr(expr));
        }
        return result;
    }

    private Expr resolveNullable(Expr e) {
        return e == null ? null : resolveExpr(e);
    }

    private List<InterpolateItem> resolveItems(List<InterpolateItem> items) {
        List<InterpolateItem> result = new ArrayList<>(items.size());
        for (InterpolateItem item : items) {
            if (item instanceof InterpolateItem.Expression expression) {
                result.add(new InterpolateItem.Expression(resolveExpr(expression.expr()), expression.format()));
            } else {
                result.add(item);
            }
        }
        return result;
    }

    private Expr fresh(Expr e, ExprKind kind) {
        return e.withKind(kind).id(nextId++);
    }

    private Expr node(ExprKind kind, Span span) {
        return new Expr(kind, span).id(nextId++);
    }

    private Expr resolvePipeline(Expr e, ExprKind.Pipeline pipeline) {
        List<Expr> steps = pipeline.exprs();
        Expr value = resolveExpr(steps.get(0));
        for (int i = 1; i < steps.size(); i++) {
            value = applyStep(steps.get(i), value);
        }
        if (e.alias() != null) {
            value.alias(e.alias());
        }
        return value;
    }

    /**
     * Calls a pipeline step with the value of the previous steps as its last argument.
     */
    private Expr applyStep(Expr step, Expr input) {
        ExprKind kind = step.kind();
        ExprKind.FuncCall call;
        if (kind instanceof ExprKind.FuncCall fc) {
            List<Expr> args = new ArrayList<>(fc.args());
            args.add(input);
            call = new ExprKind.FuncCall(fc.name(), args, fc.namedArgs());
        } else if (kind instanceof ExprKind.Ident || kind instanceof ExprKind.Func) {
            call = new ExprKind.FuncCall(new Expr(kind, step.span()), List.of(input), Map.of());
        } else {
            throw new FrameException("Expected a function in the pipeline, found `" + kind + "`", step.span());
        }
        return resolveExpr(step.withKind(call));
    }

    private Expr applyPipeline(Expr pipeline, Expr input) {
        if (pipeline.kind() instanceof ExprKind.Pipeline p) {
            Expr value = input;
            for (Expr step : p.exprs()) {
                value = applyStep(step, value);
            }
            return value;
        }
        return applyStep(pipeline, input);
    }

    // ==================== Identifiers ====================

    private Expr resolveIdent(Expr e, boolean relationPosition) {
        ExprKind.Ident ident = (ExprKind.Ident) e.kind();
        List<String> parts = ident.parts();
        String first = parts.get(0);

        if (parts.size() == 1 && params.containsKey(first)) {
            return bound(params.get(first), e);
        }
        if (first.equals(NameLookup.THIS) || first.equals(NameLookup.THAT)) {
            Lineage target = first.equals(NameLookup.THIS) ? thisFrame : thatFrame;
            if (target == null) {
                throw unknownName(e, ident);
            }
            List<String> rest = parts.subList(1, parts.size());
            if (rest.isEmpty() || rest.equals(List.of("*"))) {
                return fresh(e, new ExprKind.All(null, List.of()));
            }
            Expr column = lookupColumn(target, rest, e);
            if (column == null) {
                column = inferColumn(target, rest, e);
            }
            if (column == null) {
                throw unknownName(e, ident);
            }
            return column;
        }
        if (frame != null) {
            Expr column = lookupColumn(frame, parts, e);
            if (column != null) {
                return column;
            }
        }
        Module.Let let = module.lookup(parts);
        if (let != null) {
            return resolveDeclRef(let, e, ident);
        }
        StdFunction fn = StdLib.lookup(parts).orElse(null);
        if (fn != null) {
            if (fn.arity() == 0 && !fn.isTransform()) {
                return fresh(e, new ExprKind.RqOperator(fn.name(), List.of()));
            }
            throw (FrameException) new FrameException(
                "`" + ident + "` is a function and cannot be used as a value", e.span())
                .withHint("call it with its arguments, as in `" + fn.shortName() + " x`");
        }
        if (frame != null) {
            Expr inferred = inferColumn(frame, parts, e);
            if (inferred != null) {
                return inferred;
            }
        }
        if (relationPosition) {
            return externRef(e, parts);
        }
        throw unknownName(e, ident);
    }

    private Expr bound(Expr binding, Expr e) {
        if (binding.isRelation()) {
            return binding;
        }
        Expr copy = binding.copy().id(nextId++);
        if (e.alias() != null) {
            copy.alias(e.alias());
        }
        return copy;
    }

    private CompilerException unknownName(Expr e, ExprKind.Ident ident) {
        CompilerException error = new NameResolutionException(
            ErrorCodes.UNKNOWN_NAME, "Unknown name `" + ident + "`", e.span());
        if (frame != null) {
            String available = NameLookup.available(frame);
            if (!available.isEmpty()) {
                error.withHint("available columns: " + available);
            }
        }
        return error;
    }

    /**
     * Looks up a known column. A qualified name of a known input that matches
     * nothing is inferred against the input's wildcard or rejected.
     */
    private Expr lookupColumn(Lineage target, List<String> parts, Expr e) {
        Lineage.Column.Single single = NameLookup.findExact(target, parts, e.span());
        if (single != null) {
            List<String> qualified = single.namespace() == null
                ? List.of(single.name())
                : List.of(single.namespace(), single.name());
            return e.withKind(new ExprKind.Ident(qualified)).id(nextId++).targetId(single.targetId());
        }
        if (parts.size() == 2 && target.findInput(parts.get(0)) != null) {
            if (parts.get(1).equals("*")) {
                return fresh(e, new ExprKind.All(parts.get(0), List.of()));
            }
            Expr inferred = inferColumn(target, parts, e);
            if (inferred != null) {
                return inferred;
            }
            throw (FrameException) new FrameException(
                "Unknown column `" + parts.get(1) + "` of `" + parts.get(0) + "`", e.span())
                .withHint("available columns: " + NameLookup.available(target));
        }
        return null;
    }

    /**
     * Binds a name to the only wildcard that may contain it. With several
     * candidate wildcards the name is passed through to SQL as written.
     */
    private Expr inferColumn(Lineage target, List<String> parts, Expr e) {
        List<Lineage.Column.All> wildcards = NameLookup.wildcards(target, parts);
        if (wildcards.isEmpty()) {
            return null;
        }
        String name = parts.get(parts.size() - 1);
        if (wildcards.size() == 1) {
            Lineage.Column.All all = wildcards.get(0);
            Lineage.Input input = target.findInput(all.inputName());
            if (input != null && infer(input.table(), name)) {
                return e.withKind(ExprKind.Ident.of(all.inputName(), name)).id(nextId++).targetId(input.id());
            }
        }
        logger.debug("Passing `{}` through, it may belong to {}", name, wildcards);
        return fresh(e, ExprKind.Ident.of(name));
    }

    /**
     * Records that a relation has a column of the given name.
     *
     * @return false when the relation cannot have unknown columns
     */
    private boolean infer(String key, String name) {
        RelationDecl decl = relations.get(key);
        if (decl == null) {
            return false;
        }
        switch (decl.kind()) {
            case EXTERN:
            case SSTRING:
                decl.inferred().add(name);
                return true;
            case RELATION:
                Lineage lineage = decl.lineage();
                List<Lineage.Column.All> wildcards = new ArrayList<>();
                for (Lineage.Column column : lineage.columns()) {
                    if (column instanceof Lineage.Column.All all) {
                        wildcards.add(all);
                    }
                }
                if (wildcards.size() != 1) {
                    return false;
                }
                Lineage.Input input = lineage.findInput(wildcards.get(0).inputName());
                return input != null && infer(input.table(), name);
            default:
                return false;
        }
    }

    private Expr resolveDeclRef(Module.Let let, Expr e, ExprKind.Ident ident) {
        ensureResolved(let, e.span());
        switch (let.state) {
            case FUNCTION: {
                ExprKind.Func func = (ExprKind.Func) let.value.kind();
                if (func.params().isEmpty()) {
                    return inlineFunction(func, let.scope, List.of(), Map.of(), e);
                }
                throw (FrameException) new FrameException(
                    "`" + ident + "` is a function and cannot be used as a value", e.span())
                    .withHint("call it with its arguments");
            }
            case RELATION:
                return tableRef(let.relation, ident.name(), e.span());
            default: {
                Scope saved = saveScope();
                Expr value;
                try {
                    module = let.scope;
                    params = Map.of();
                    value = resolveExpr(let.value);
                } finally {
                    restoreScope(saved);
                }
                if (e.alias() != null) {
                    value.alias(e.alias());
                }
                return value;
            }
        }
    }

    // ==================== Relations ====================

    /**
     * Resolves an argument that has to be a relation. Names that are not declared
     * refer to database tables. A source that is not a table by itself becomes a
     * separate relation read as a single input.
     */
    private Expr resolveRelation(Expr arg, boolean asSource) {
        Expr result;
        if (arg.id() != null) {
            result = arg;
        } else {
            Scope saved = saveScope();
            try {
                clearFrames();
                ExprKind kind = arg.kind();
                if (kind instanceof ExprKind.Ident) {
                    result = resolveIdent(arg, true);
                } else if (kind instanceof ExprKind.Array array && isRelationLiteral(array)) {
                    result = relationLiteral(arg, array);
                } else if (kind instanceof ExprKind.SString s) {
                    result = sstringRelation(arg, s);
                } else {
                    result = resolveExpr(arg);
                }
            } finally {
                restoreScope(saved);
            }
        }
        if (!result.isRelation()) {
            throw new FrameException("Expected a relation, found `" + arg.kind() + "`", arg.span());
        }
        if (!asSource) {
            return result;
        }
        if (!(result.kind() instanceof ExprKind.Ident)) {
            return asInput(result, arg.alias());
        }
        if (arg.alias() != null) {
            result = result.copy();
            result.lineage().rename(arg.alias());
        }
        return result;
    }

    private Expr asInput(Expr relation, String alias) {
        String key = "_rel_" + relation.id();
        RelationDecl decl = RelationDecl.relation(key, null, relation);
        relations.put(key, decl);
        String name = alias;
        if (name == null) {
            List<Lineage.Input> inputs = relation.lineage().inputs();
            name = inputs.size() == 1 ? inputs.get(0).name() : key;
        }
        return tableRef(decl, name, relation.span());
    }

    private Expr externRef(Expr e, List<String> parts) {
        String key = parts.get(0).equals(Module.DEFAULT_DB)
            ? String.join(".", parts)
            : Module.DEFAULT_DB + "." + String.join(".", parts);
        RelationDecl decl = relations.computeIfAbsent(key, RelationDecl::extern);
        return tableRef(decl, parts.get(parts.size() - 1), e.span());
    }

    /**
     * Creates a reference to a relation, with its own input id.
     */
    private Expr tableRef(RelationDecl decl, String inputName, Span span) {
        int id = nextId++;
        Lineage lineage = new Lineage();
        lineage.inputs().add(new Lineage.Input(id, inputName, decl.key()));
        switch (decl.kind()) {
            case EXTERN:
            case SSTRING:
                lineage.columns().add(new Lineage.Column.All(inputName, Set.of()));
                break;
            case LITERAL:
                for (String column : decl.columns()) {
                    lineage.columns().add(new Lineage.Column.Single(inputName, column, id, column));
                }
                break;
            default:
                boolean wildcard = false;
                for (Lineage.Column column : decl.lineage().columns()) {
                    if (column instanceof Lineage.Column.Single single) {
                        if (single.name() != null) {
                            lineage.columns().add(
                                new Lineage.Column.Single(inputName, single.name(), id, single.name()));
                        }
                    } else if (!wildcard) {
                        lineage.columns().add(new Lineage.Column.All(inputName, Set.of()));
                        wildcard = true;
                    }
                }
                break;
        }
        return new Expr(new ExprKind.Ident(List.of(decl.key().split("\\."))), span).id(id).lineage(lineage);
    }

    private static boolean isRelationLiteral(ExprKind.Array array) {
        if (array.items().isEmpty()) {
            return false;
        }
        for (Expr item : array.items()) {
            if (!(item.kind() instanceof ExprKind.Tuple)) {
                return false;
            }
        }
        return true;
    }

    private Expr relationLiteral(Expr e, ExprKind.Array array) {
        List<String> columns = new ArrayList<>();
        for (Expr field : ((ExprKind.Tuple) array.items().get(0).kind()).fields()) {
            if (field.alias() != null) {
                columns.add(field.alias());
            } else if (field.kind() instanceof ExprKind.Ident ident) {
                columns.add(ident.name());
            } else {
                throw (FrameException) new FrameException("Column of a relation literal has no name", field.span())
                    .withHint("name it, as in `{a = 1}`");
            }
        }
        List<List<Literal>> rows = new ArrayList<>();
        for (Expr item : array.items()) {
            List<Expr> fields = ((ExprKind.Tuple) item.kind()).fields();
            if (fields.size() != columns.size()) {
                throw new FrameException("Rows of a relation literal must have " + columns.size() + " columns",
                    item.span());
            }
            List<Literal> row = new ArrayList<>();
            for (Expr field : fields) {
                row.add(constant(field));
            }
            rows.add(row);
        }
        int id = nextId++;
        String key = "_literal_" + id;
        RelationDecl decl = RelationDecl.literal(key, columns, rows);
        relations.put(key, decl);
        return tableRef(decl, key, e.span());
    }

    private static Literal constant(Expr field) {
        if (field.kind() instanceof ExprKind.Lit lit) {
            return lit.value();
        }
        if (field.kind() instanceof ExprKind.FuncCall call
            && call.name().kind() instanceof ExprKind.Ident name
            && name.name().equals("neg")
            && call.args().size() == 1
            && call.args().get(0).kind() instanceof ExprKind.Lit lit) {
            if (lit.value() instanceof Literal.Int i) {
                return new Literal.Int(-i.value());
            }
            if (lit.value() instanceof Literal.Real r) {
                return new Literal.Real(-r.value());
            }
        }
        throw new FrameException("Values of a relation literal must be constants", field.span());
    }

    private Expr sstringRelation(Expr e, ExprKind.SString s) {
        Expr resolved = fresh(e, new ExprKind.SString(resolveItems(s.items())));
        String key = "_sstring_" + resolved.id();
        RelationDecl decl = RelationDecl.sstring(key, resolved);
        relations.put(key, decl);
        return tableRef(decl, key, e.span());
    }

    // ==================== Calls ====================

    private Expr resolveCall(Expr e, ExprKind.FuncCall call) {
        Expr callee = call.name();
        if (callee.kind() instanceof ExprKind.Func func) {
            return inlineFunction(func, module, call.args(), call.namedArgs(), e);
        }
        if (!(callee.kind() instanceof ExprKind.Ident ident)) {
            throw new FrameException("Expected a function, found `" + callee.kind() + "`", callee.span());
        }
        List<String> parts = ident.parts();
        if (parts.size() == 1 && params.containsKey(parts.get(0))) {
            Expr binding = params.get(parts.get(0));
            if (binding.kind() instanceof ExprKind.Func func) {
                return inlineFunction(func, module, call.args(), call.namedArgs(), e);
            }
            throw new FrameException("`" + ident + "` is not a function", callee.span());
        }
        Module.Let let = module.lookup(parts);
        if (let != null) {
            ensureResolved(let, callee.span());
            if (let.state == Module.Let.State.FUNCTION) {
                return inlineFunction((ExprKind.Func) let.value.kind(), let.scope, call.args(), call.namedArgs(), e);
            }
            throw new FrameException("`" + ident + "` is not a function", callee.span());
        }
        StdFunction fn = StdLib.lookup(parts).orElseThrow(() -> new NameResolutionException(
            ErrorCodes.UNKNOWN_NAME, "Unknown function `" + ident + "`", callee.span()));
        return resolveStdCall(fn, call, e);
    }

    private Expr inlineFunction(ExprKind.Func func, Module scope, List<Expr> args,
                                Map<String, Expr> namedArgs, Expr e) {
        if (args.size() > func.params().size()) {
            throw new NameResolutionException("Too many arguments to function `" + describeCallee(e) + "`", e.span());
        }
        if (args.size() < func.params().size()) {
            throw new NameResolutionException("Missing argument `" + func.params().get(args.size()).name()
                + "` of function `" + describeCallee(e) + "`", e.span());
        }
        Map<String, Expr> bindings = new HashMap<>();
        for (int i = 0; i < args.size(); i++) {
            bindings.put(func.params().get(i).name(), resolveArgument(args.get(i)));
        }
        Set<String> namedParams = new HashSet<>();
        for (ExprKind.FuncParam param : func.namedParams()) {
            namedParams.add(param.name());
            Expr value = namedArgs.getOrDefault(param.name(), param.defaultValue());
            bindings.put(param.name(), resolveArgument(value));
        }
        for (Map.Entry<String, Expr> entry : namedArgs.entrySet()) {
            if (!namedParams.contains(entry.getKey())) {
                throw new NameResolutionException("Unknown named argument `" + entry.getKey() + "`",
                    entry.getValue().span());
            }
        }
        Scope saved = saveScope();
        Expr body;
        try {
            module = scope;
            params = bindings;
            body = resolveExpr(func.body());
        } finally {
            restoreScope(saved);
        }
        if (e.alias() != null) {
            body.alias(e.alias());
        }
        return body;
    }

    private Expr resolveArgument(Expr arg) {
        if (arg.id() == null && frame == null && arg.kind() instanceof ExprKind.Ident) {
            return resolveIdent(arg, true);
        }
        return resolveExpr(arg);
    }

    private static String describeCallee(Expr e) {
        if (e.kind() instanceof ExprKind.FuncCall call && call.name().kind() instanceof ExprKind.Ident ident) {
            return ident.toString();
        }
        return "<anonymous>";
    }

    private Expr resolveStdCall(StdFunction fn, ExprKind.FuncCall call, Expr e) {
        List<Expr> args = call.args();
        for (Map.Entry<String, Expr> entry : call.namedArgs().entrySet()) {
            if (!fn.namedParams().contains(entry.getKey())) {
                throw new NameResolutionException(
                    "Unknown named argument `" + entry.getKey() + "` of `" + fn.shortName() + "`",
                    entry.getValue().span());
            }
        }
        if (args.size() > fn.arity()) {
            throw new NameResolutionException("Too many arguments to `" + fn.shortName() + "`", e.span());
        }
        if (args.size() < fn.arity()) {
            throw new NameResolutionException("Missing argument `" + fn.params().get(args.size())
                + "` of `" + fn.shortName() + "`", e.span());
        }
        if (fn.isTransform()) {
            return resolveTransform(fn, args, call.namedArgs(), e);
        }
        List<Expr> resolved;
        switch (fn.shortName()) {
            case "in":
                return resolveIn(args, e);
            case "row_number":
            case "rank":
            case "rank_dense":
                return fresh(e, new ExprKind.RqOperator(fn.name(), List.of())).needsWindow(true);
            case "as":
                resolved = List.of(typeName(args.get(0)), resolveExpr(args.get(1)));
                break;
            case "count":
                Expr column = resolveExpr(args.get(0));
                if (column.kind() instanceof ExprKind.All) {
                    column = column.withKind(new ExprKind.SString(List.of(new InterpolateItem.Text("*"))));
                }
                resolved = List.of(column);
                break;
            default:
                resolved = resolveAll(args);
                break;
        }
        Expr result = fresh(e, new ExprKind.RqOperator(fn.name(), resolved));
        if (fn.kind() == FunctionKind.WINDOW || (fn.kind() == FunctionKind.AGGREGATION && !inAggregate)) {
            result.needsWindow(true);
        }
        return result;
    }

    private Expr typeName(Expr type) {
        if (!(type.kind() instanceof ExprKind.Ident ident)) {
            throw new FrameException("Expected a type name, found `" + type.kind() + "`", type.span());
        }
        return node(new ExprKind.SString(List.of(new InterpolateItem.Text(ident.toString()))), type.span());
    }

    private Expr resolveIn(List<Expr> args, Expr e) {
        Expr pattern = resolveExpr(args.get(0));
        Expr value = resolveExpr(args.get(1));
        Expr result;
        if (pattern.kind() instanceof ExprKind.Range range) {
            Expr lower = range.start() == null ? null : operator("std.gte", e.span(), value, range.start());
            Expr upper = range.end() == null ? null : operator("std.lte", e.span(), value, range.end());
            if (lower == null && upper == null) {
                result = node(new ExprKind.Lit(new Literal.Bool(true)), e.span());
            } else if (lower == null) {
                result = upper;
            } else if (upper == null) {
                result = lower;
            } else {
                result = operator("std.and", e.span(), lower, upper);
            }
        } else if (pattern.kind() instanceof ExprKind.Array) {
            result = operator("std.array_in", e.span(), value, pattern);
        } else {
            throw new FrameException("`in` expects a range or an array, found `" + pattern.kind() + "`",
                pattern.span());
        }
        return result.alias(e.alias());
    }

    private Expr operator(String name, Span span, Expr... args) {
        return node(new ExprKind.RqOperator(name, List.of(args)), span);
    }

    // ==================== Transforms ====================

    private Expr resolveTransform(StdFunction fn, List<Expr> args, Map<String, Expr> named, Expr e) {
        switch (fn.shortName()) {
            case "from":
                return resolveRelation(args.get(0), true);
            case "from_text":
                return resolveFromText(args.get(0), named.get("format"), e);
            case "select":
                return resolveSelect(args, e);
            case "derive":
                return resolveDerive(args, e);
            case "filter":
                return resolveFilter(args, e);
            case "aggregate":
                return resolveAggregate(args, e);
            case "sort":
                return resolveSort(args, e);
            case "take":
                return resolveTake(args, e);
            case "join":
                return resolveJoin(args, named.get("side"), e);
            case "group":
                return resolveGroup(args, e);
            case "window":
                return resolveWindow(args, named, e);
            case "append":
                return resolveAppend(args, e, false);
            case "union":
                return resolveAppend(args, e, true);
            case "distinct":
                return distinct(resolveRelation(args.get(0), false), e);
            case "loop":
                return resolveLoop(args, e);
            default:
                throw new IllegalStateException("Unhandled transform " + fn.name());
        }
    }

    private Expr transform(Expr input, TransformKind kind, Lineage lineage, Expr e) {
        return node(new ExprKind.TransformCall(input, kind), e.span()).lineage(lineage);
    }

    private Expr resolveSelect(List<Expr> args, Expr e) {
        Expr rel = resolveRelation(args.get(1), false);
        List<Expr> assigns = withFrame(rel.lineage(), () -> resolveColumns(args.get(0)));
        Lineage lineage = new Lineage(columnsOf(assigns, rel.lineage()), rel.lineage().inputs());
        return transform(rel, new TransformKind.Select(assigns), lineage, e);
    }

    private Expr resolveDerive(List<Expr> args, Expr e) {
        Expr rel = resolveRelation(args.get(1), false);
        List<Expr> assigns = withFrame(rel.lineage(), () -> resolveColumns(args.get(0)));
        List<Lineage.Column> added = columnsOf(assigns, rel.lineage());
        Set<String> names = new HashSet<>();
        for (Lineage.Column column : added) {
            if (column instanceof Lineage.Column.Single single && single.name() != null) {
                names.add(single.name());
            }
        }
        List<Lineage.Column> columns = new ArrayList<>();
        for (Lineage.Column column : rel.lineage().columns()) {
            if (!(column instanceof Lineage.Column.Single single && names.contains(single.name()))) {
                columns.add(column);
            }
        }
        columns.addAll(added);
        return transform(rel, new TransformKind.Derive(assigns), new Lineage(columns, rel.lineage().inputs()), e);
    }

    private Expr resolveFilter(List<Expr> args, Expr e) {
        Expr rel = resolveRelation(args.get(1), false);
        Expr condition = withFrame(rel.lineage(), () -> resolveExpr(args.get(0)));
        return transform(rel, new TransformKind.Filter(condition), rel.lineage().copy(), e);
    }

    private Expr resolveAggregate(List<Expr> args, Expr e) {
        Expr rel = resolveRelation(args.get(1), false);
        List<Expr> assigns = withFrame(rel.lineage(), () -> {
            inAggregate = true;
            return resolveColumns(args.get(0));
        });
        List<Lineage.Column> columns = new ArrayList<>();
        if (groupBy != null) {
            columns.addAll(columnsOf(groupBy, rel.lineage()));
        }
        columns.addAll(columnsOf(assigns, rel.lineage()));
        return transform(rel, new TransformKind.Aggregate(assigns), new Lineage(columns, rel.lineage().inputs()), e);
    }

    private Expr resolveSort(List<Expr> args, Expr e) {
        Expr rel = resolveRelation(args.get(1), false);
        List<Expr> fields = withFrame(rel.lineage(), () -> resolveColumns(args.get(0)));
        List<ColumnSort<Expr>> by = new ArrayList<>();
        for (Expr field : fields) {
            if (field.kind() instanceof ExprKind.RqOperator op
                && op.name().equals("std.neg") && op.args().size() == 1) {
                by.add(new ColumnSort<>(SortDirection.DESC, op.args().get(0)));
            } else {
                by.add(ColumnSort.asc(field));
            }
        }
        return transform(rel, new TransformKind.Sort(by), rel.lineage().copy(), e);
    }

    private Expr resolveTake(List<Expr> args, Expr e) {
        Expr rel = resolveRelation(args.get(1), false);
        Expr expr = withFrame(rel.lineage(), () -> resolveExpr(args.get(0)));
        ExprKind.Range range;
        if (expr.kind() instanceof ExprKind.Range r) {
            range = r;
        } else if (expr.kind() instanceof ExprKind.Lit lit && lit.value() instanceof Literal.Int) {
            range = new ExprKind.Range(null, expr);
        } else {
            throw (FrameException) new FrameException(
                "`take` expects an integer or a range, found `" + expr.kind() + "`", expr.span())
                .withHint("use `take 10` or `take 5..10`");
        }
        return transform(rel, new TransformKind.Take(range), rel.lineage().copy(), e);
    }

    private Expr resolveJoin(List<Expr> args, Expr sideArg, Expr e) {
        Expr rel = resolveRelation(args.get(2), false);
        Expr with = resolveRelation(args.get(0), true);
        JoinSide side = JoinSide.INNER;
        if (sideArg != null) {
            String name = null;
            if (sideArg.kind() instanceof ExprKind.Ident ident) {
                name = ident.toString();
            } else if (sideArg.kind() instanceof ExprKind.Lit lit && lit.value() instanceof Literal.Str s) {
                name = s.value();
            }
            side = name == null ? null : JoinSide.parse(name);
            if (side == null) {
                throw (FrameException) new FrameException(
                    "Invalid join side `" + sideArg.kind() + "`", sideArg.span())
                    .withHint("expected one of inner, left, right, full");
            }
        }
        Lineage left = rel.lineage();
        Lineage right = with.lineage();
        for (Lineage.Input input : right.inputs()) {
            if (left.findInput(input.name()) != null) {
                throw (FrameException) new FrameException(
                    "`" + input.name() + "` is already an input of this relation", args.get(0).span())
                    .withHint("give it another name, as in `join other = " + input.name() + "`");
            }
        }
        List<Lineage.Column> columns = new ArrayList<>(left.columns());
        columns.addAll(right.columns());
        List<Lineage.Input> inputs = new ArrayList<>(left.inputs());
        inputs.addAll(right.inputs());
        Lineage joined = new Lineage(columns, inputs);

        Scope saved = saveScope();
        Expr condition;
        try {
            frame = joined;
            thisFrame = left;
            thatFrame = right;
            condition = resolveExpr(args.get(1));
        } finally {
            restoreScope(saved);
        }
        return transform(rel, new TransformKind.Join(side, with, condition), joined, e);
    }

    private Expr resolveGroup(List<Expr> args, Expr e) {
        Expr rel = resolveRelation(args.get(2), false);
        List<Expr> by = withFrame(rel.lineage(), () -> resolveColumns(args.get(0)));
        Expr param = placeholder(rel);
        Scope saved = saveScope();
        Expr inner;
        try {
            groupBy = by;
            inner = applyPipeline(args.get(1), param);
        } finally {
            restoreScope(saved);
        }
        requireRelation(inner, args.get(1));
        return transform(rel, new TransformKind.Group(by, inner, param.id()), inner.lineage().copy(), e);
    }

    private Expr resolveWindow(List<Expr> args, Map<String, Expr> named, Expr e) {
        Expr rel = resolveRelation(args.get(1), false);
        WindowKind kind = WindowKind.ROWS;
        ExprKind.Range range = ExprKind.Range.UNBOUNDED;
        for (Map.Entry<String, Expr> entry : named.entrySet()) {
            Expr value = resolveExpr(entry.getValue());
            switch (entry.getKey()) {
                case "rows":
                case "range":
                    if (!(value.kind() instanceof ExprKind.Range r)) {
                        throw new FrameException("`" + entry.getKey() + "` expects a range", value.span());
                    }
                    kind = entry.getKey().equals("rows") ? WindowKind.ROWS : WindowKind.RANGE;
                    range = r;
                    break;
                case "expanding":
                    if (value.kind() instanceof ExprKind.Lit lit && lit.value() instanceof Literal.Bool b) {
                        if (b.value()) {
                            kind = WindowKind.ROWS;
                            range = new ExprKind.Range(null, intLiteral(0, value.span()));
                        }
                    } else {
                        throw new FrameException("`expanding` expects true or false", value.span());
                    }
                    break;
                default:
                    if (value.kind() instanceof ExprKind.Lit lit && lit.value() instanceof Literal.Int n
                        && n.value() > 0) {
                        kind = WindowKind.ROWS;
                        range = new ExprKind.Range(intLiteral(1 - n.value(), value.span()),
                            intLiteral(0, value.span()));
                    } else {
                        throw new FrameException("`rolling` expects a positive integer", value.span());
                    }
                    break;
            }
        }
        Expr param = placeholder(rel);
        Expr inner = applyPipeline(args.get(0), param);
        requireRelation(inner, args.get(0));
        return transform(rel, new TransformKind.Window(kind, range, inner, param.id()), inner.lineage().copy(), e);
    }

    private Expr resolveAppend(List<Expr> args, Expr e, boolean distinct) {
        Expr top = resolveRelation(args.get(1), false);
        Expr bottom = resolveRelation(args.get(0), true);
        if (!hasWildcard(top.lineage()) && !hasWildcard(bottom.lineage())
            && top.lineage().columns().size() != bottom.lineage().columns().size()) {
            throw (FrameException) new FrameException(
                "Cannot append relations with different numbers of columns ("
                    + top.lineage().columns().size() + " and " + bottom.lineage().columns().size() + ")",
                args.get(0).span())
                .withHint("select the same columns on both sides");
        }
        Expr appended = transform(top, new TransformKind.Append(bottom), top.lineage().copy(), e);
        return distinct ? distinct(appended, e) : appended;
    }

    /**
     * {@code distinct} is a group by every column that keeps the first row.
     */
    private Expr distinct(Expr rel, Expr e) {
        Expr param = placeholder(rel);
        Expr all = node(new ExprKind.All(null, List.of()), e.span());
        ExprKind.Range first = new ExprKind.Range(null, intLiteral(1, e.span()));
        Expr take = transform(param, new TransformKind.Take(first), param.lineage().copy(), e);
        return transform(rel, new TransformKind.Group(List.of(all), take, param.id()), rel.lineage().copy(), e);
    }

    private Expr resolveLoop(List<Expr> args, Expr e) {
        Expr rel = resolveRelation(args.get(1), false);
        Expr param = placeholder(rel);
        Expr inner = applyPipeline(args.get(0), param);
        requireRelation(inner, args.get(0));
        return transform(rel, new TransformKind.Loop(inner, param.id()), rel.lineage().copy(), e);
    }

    private Expr resolveFromText(Expr text, Expr formatArg, Expr e) {
        if (!(text.kind() instanceof ExprKind.Lit lit && lit.value() instanceof Literal.Str str)) {
            throw new FrameException("`from_text` expects a string literal", text.span());
        }
        String format = "csv";
        if (formatArg != null) {
            if (!(formatArg.kind() instanceof ExprKind.Ident ident)
                || !(ident.toString().equals("csv") || ident.toString().equals("json"))) {
                throw (FrameException) new FrameException("Unknown text format `" + formatArg.kind() + "`",
                    formatArg.span())
                    .withHint("expected csv or json");
            }
            format = ident.toString();
        }
        List<String> columns = new ArrayList<>();
        List<List<Literal>> rows = new ArrayList<>();
        if (format.equals("csv")) {
            parseCsv(str.value(), columns, rows, text.span());
        } else {
            parseJson(str.value(), columns, rows, text.span());
        }
        String key = "_literal_" + nextId++;
        RelationDecl decl = RelationDecl.literal(key, columns, rows);
        relations.put(key, decl);
        return tableRef(decl, key, e.span());
    }

    private static void parseCsv(String text, List<String> columns, List<List<Literal>> rows, Span span) {
        String[] lines = text.strip().split("\\R");
        for (String name : lines[0].split(",", -1)) {
            columns.add(name.trim());
        }
        for (int i = 1; i < lines.length; i++) {
            if (lines[i].isBlank()) {
                continue;
            }
            String[] values = lines[i].split(",", -1);
            if (values.length != columns.size()) {
                throw new FrameException("Line " + (i + 1) + " of the CSV text has " + values.length
                    + " values, expected " + columns.size(), span);
            }
            List<Literal> row = new ArrayList<>();
            for (String value : values) {
                row.add(new Literal.Str(value.trim()));
            }
            rows.add(row);
        }
    }

    private static void parseJson(String text, List<String> columns, List<List<Literal>> rows, Span span) {
        JsonNode root;
        try {
            root = IrJson.mapper().readTree(text);
        } catch (JsonProcessingException ex) {
            throw new FrameException("Invalid JSON text: " + ex.getOriginalMessage(), span);
        }
        JsonNode names = root.path("columns");
        JsonNode data = root.path("data");
        if (!names.isArray() || !data.isArray()) {
            throw (FrameException) new FrameException("JSON text must have `columns` and `data` arrays", span)
                .withHint("as in {\"columns\": [\"a\"], \"data\": [[1], [2]]}");
        }
        for (JsonNode name : names) {
            columns.add(name.asText());
        }
        for (JsonNode record : data) {
            if (!record.isArray() || record.size() != columns.size()) {
                throw new FrameException("Each JSON row must be an array of " + columns.size() + " values", span);
            }
            List<Literal> row = new ArrayList<>();
            for (JsonNode value : record) {
                row.add(jsonLiteral(value));
            }
            rows.add(row);
        }
    }

    private static Literal jsonLiteral(JsonNode value) {
        if (value.isNull()) {
            return Literal.NULL;
        }
        if (value.isIntegralNumber()) {
            return new Literal.Int(value.asLong());
        }
        if (value.isNumber()) {
            return new Literal.Real(value.asDouble());
        }
        if (value.isBoolean()) {
            return new Literal.Bool(value.asBoolean());
        }
        return new Literal.Str(value.asText());
    }

    // ==================== Frames ====================

    private List<Expr> resolveColumns(Expr arg) {
        List<Expr> fields = arg.kind() instanceof ExprKind.Tuple tuple ? tuple.fields() : List.of(arg);
        List<Expr> result = new ArrayList<>(fields.size());
        for (Expr field : fields) {
            Expr resolved = resolveExpr(field);
            if (resolved.isRelation()) {
                throw new FrameException("Expected a column, found a relation", field.span());
            }
            result.add(resolved);
        }
        return result;
    }

    /**
     * Columns produced by a list of assignments evaluated in {@code frame}.
     */
    private static List<Lineage.Column> columnsOf(List<Expr> assigns, Lineage frame) {
        List<Lineage.Column> columns = new ArrayList<>();
        for (Expr assign : assigns) {
            if (assign.kind() instanceof ExprKind.All all) {
                for (Lineage.Column column : frame.columns()) {
                    if (all.input() == null || belongsTo(column, all.input())) {
                        columns.add(column);
                    }
                }
            } else if (assign.alias() == null && assign.targetId() != null
                && assign.kind() instanceof ExprKind.Ident ident) {
                String namespace = ident.parts().size() > 1 ? ident.parts().get(0) : null;
                columns.add(new Lineage.Column.Single(namespace, ident.name(), assign.targetId(), ident.name()));
            } else {
                String name = assign.alias();
                if (name == null && assign.kind() instanceof ExprKind.Ident ident) {
                    name = ident.name();
                }
                columns.add(new Lineage.Column.Single(null, name, assign.id(), null));
            }
        }
        return columns;
    }

    private static boolean belongsTo(Lineage.Column column, String input) {
        if (column instanceof Lineage.Column.All all) {
            return input.equals(all.inputName());
        }
        return input.equals(((Lineage.Column.Single) column).namespace());
    }

    private static boolean hasWildcard(Lineage lineage) {
        for (Lineage.Column column : lineage.columns()) {
            if (column instanceof Lineage.Column.All) {
                return true;
            }
        }
        return false;
    }

    private static void requireRelation(Expr value, Expr source) {
        if (!value.isRelation()) {
            throw new FrameException("Expected a pipeline of transforms, found `" + source.kind() + "`",
                source.span());
        }
    }

    /**
     * Stand-in for the input of a nested pipeline; flattening substitutes the real input.
     */
    private Expr placeholder(Expr rel) {
        return node(ExprKind.Ident.of(PLACEHOLDER), rel.span()).lineage(rel.lineage().copy());
    }

    private Expr intLiteral(long value, Span span) {
        return node(new ExprKind.Lit(new Literal.Int(value)), span);
    }

    private <T> T withFrame(Lineage lineage, Supplier<T> body) {
        Scope saved = saveScope();
        try {
            frame = lineage;
            thisFrame = lineage;
            thatFrame = null;
            return body.get();
        } finally {
            restoreScope(saved);
        }
    }

    private void clearFrames() {
        frame = null;
        thisFrame = null;
        thatFrame = null;
        inAggregate = false;
        groupBy = null;
    }

    private Scope saveScope() {
        return new Scope(module, frame, thisFrame, thatFrame, params, inAggregate, groupBy);
    }

    private void restoreScope(Scope scope) {
        module = scope.module;
        frame = scope.frame;
        thisFrame = scope.thisFrame;
        thatFrame = scope.thatFrame;
        params = scope.params;
        inAggregate = scope.inAggregate;
        groupBy = scope.groupBy;
    }

    private record Scope(Module module, Lineage frame, Lineage thisFrame, Lineage thatFrame,
                         Map<String, Expr> params, boolean inAggregate, List<Expr> groupBy) {
    }
}
