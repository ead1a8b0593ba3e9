package com.pipesql.exception;

import com.pipesql.diagnostic.Span;

/**
 * Transform applied to an incompatible frame, such as a column missing from the current relation.
 */
public class FrameException extends CompilerException {

    public FrameException(String reason, Span span) {
        super(ErrorKind.FRAME, ErrorCodes.FRAME_MISMATCH, reason, span);
    }

    public FrameException(String code, String reason, Span span) {
        super(ErrorKind.FRAME, code, reason, span);
    }
}
