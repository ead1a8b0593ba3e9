package com.pipesql.exception;

import com.pipesql.diagnostic.Span;

/**
 * Construct the selected SQL dialect cannot express, or a broken internal invariant.
 */
public class CodegenException extends CompilerException {

    public CodegenException(String reason, Span span) {
        super(ErrorKind.CODEGEN, ErrorCodes.NOT_RENDERABLE, reason, span);
    }

    public CodegenException(String code, String reason, Span span) {
        super(ErrorKind.CODEGEN, code, reason, span);
    }

    public CodegenException(String reason, Throwable cause) {
        super(ErrorKind.CODEGEN, ErrorCodes.NOT_RENDERABLE, reason, null, cause);
    }
}
