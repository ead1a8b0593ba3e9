package com.pipesql.lowering;

import com.pipesql.exception.LoweringException;
import com.pipesql.ir.ColumnSort;
import com.pipesql.ir.pl.Expr;
import com.pipesql.ir.pl.ExprKind;
import com.pipesql.ir.pl.TransformKind;
import com.pipesql.ir.pl.WindowFrame;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Removes {@code group} and {@code window} from a resolved pipeline.
 *
 * <p>The inner pipeline takes the place of the transform, with its input
 * substituted for the placeholder. Each remaining transform records the partition,
 * window frame and sort it is evaluated under.
 */
final class Flattener {

    private final Map<Integer, Expr> replacements = new HashMap<>();
    private List<Expr> partition;
    private WindowFrame frame = WindowFrame.DEFAULT;
    private List<ColumnSort<Expr>> sort = List.of();
    private boolean sortUndone;
    private boolean inWindow;

    private Flattener() {
    }

    static Expr flatten(Expr relation) {
        return new Flattener().fold(relation);
    }

    private Expr fold(Expr e) {
        Expr replacement = replacements.get(e.id());
        if (replacement != null) {
            return replacement;
        }
        if (!(e.kind() instanceof ExprKind.TransformCall call)) {
            return e;
        }
        TransformKind kind = call.kind();
        if (kind instanceof TransformKind.Group group) {
            return foldGroup(e, call, group);
        }
        if (kind instanceof TransformKind.Window window) {
            return foldWindow(e, call, window);
        }
        if (partition != null && !allowedInGroup(kind)) {
            throw new LoweringException("`" + transformName(kind) + "` is not supported inside `group`", e.span());
        }
        if (inWindow && !allowedInWindow(kind)) {
            throw new LoweringException("`" + transformName(kind) + "` is not supported inside `window`", e.span());
        }

        Expr input = fold(call.input());
        if (kind instanceof TransformKind.Sort s) {
            sort = s.by();
            if (sortUndone) {
                return input;
            }
        }
        if (kind instanceof TransformKind.Loop loop) {
            kind = new TransformKind.Loop(new Flattener().fold(loop.pipeline()), loop.param());
        }
        ExprKind.TransformCall flat = new ExprKind.TransformCall(
            input, kind, partition == null ? List.of() : partition, frame, sort);
        return e.withKind(flat);
    }

    private Expr foldGroup(Expr e, ExprKind.TransformCall call, TransformKind.Group group) {
        if (partition != null) {
            throw new LoweringException("`group` is not supported inside `group`", e.span());
        }
        boolean wasUndone = sortUndone;
        sortUndone = true;
        Expr input = fold(call.input());
        replacements.put(group.param(), input);
        partition = group.by();
        sort = List.of();
        Expr pipeline = fold(group.pipeline());
        replacements.remove(group.param());
        partition = null;
        sort = List.of();
        sortUndone = wasUndone;
        return pipeline.withKind(pipeline.kind()).lineage(e.lineage());
    }

    private Expr foldWindow(Expr e, ExprKind.TransformCall call, TransformKind.Window window) {
        Expr input = fold(call.input());
        replacements.put(window.param(), input);
        frame = new WindowFrame(window.kind(), window.range());
        inWindow = true;
        Expr pipeline = fold(window.pipeline());
        inWindow = false;
        frame = WindowFrame.DEFAULT;
        replacements.remove(window.param());
        return pipeline.withKind(pipeline.kind()).lineage(e.lineage());
    }

    private static boolean allowedInGroup(TransformKind kind) {
        return kind instanceof TransformKind.Aggregate
            || kind instanceof TransformKind.Take
            || kind instanceof TransformKind.Sort
            || kind instanceof TransformKind.Derive
            || kind instanceof TransformKind.Select;
    }

    private static boolean allowedInWindow(TransformKind kind) {
        return kind instanceof TransformKind.Derive || kind instanceof TransformKind.Select;
    }

    static String transformName(TransformKind kind) {
        String name = kind.getClass().getSimpleName();
        return Character.toLowerCase(name.charAt(0)) + name.substring(1);
    }
}
