package com.pipesql.exception;

import com.pipesql.diagnostic.Span;

/**
 * Construct that cannot be represented in the relational query.
 */
public class LoweringException extends CompilerException {

    public LoweringException(String reason, Span span) {
        super(ErrorKind.LOWERING, ErrorCodes.NOT_LOWERABLE, reason, span);
    }

    public LoweringException(String code, String reason, Span span) {
        super(ErrorKind.LOWERING, code, reason, span);
    }

    public LoweringException(String reason, Throwable cause) {
        super(ErrorKind.LOWERING, ErrorCodes.NOT_LOWERABLE, reason, null, cause);
    }
}
