package com.pipesql.ir.pl;

import com.pipesql.ir.WindowKind;

/**
 * Frame of a window: rows or range, with optional bounds relative to the current row.
 */
public record WindowFrame(WindowKind kind, ExprKind.Range range) {

    public static final WindowFrame DEFAULT = new WindowFrame(WindowKind.ROWS, ExprKind.Range.UNBOUNDED);

    public WindowFrame {
        kind = kind == null ? WindowKind.ROWS : kind;
        range = range == null ? ExprKind.Range.UNBOUNDED : range;
    }
}
