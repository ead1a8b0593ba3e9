package com.pipesql.exception;

import com.pipesql.diagnostic.Span;

/**
 * Malformed token in the source text.
 */
public class LexException extends CompilerException {

    public LexException(String reason, Span span) {
        super(ErrorKind.LEX, ErrorCodes.UNEXPECTED_TOKEN, reason, span);
    }

    public LexException(String code, String reason, Span span) {
        super(ErrorKind.LEX, code, reason, span);
    }
}
