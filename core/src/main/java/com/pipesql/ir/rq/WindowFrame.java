package com.pipesql.ir.rq;

import com.pipesql.ir.WindowKind;

public record WindowFrame(WindowKind kind, Range range) {

    public static final WindowFrame DEFAULT = new WindowFrame(WindowKind.ROWS, Range.UNBOUNDED);

    public WindowFrame {
        kind = kind == null ? WindowKind.ROWS : kind;
        range = range == null ? Range.UNBOUNDED : range;
    }
}
