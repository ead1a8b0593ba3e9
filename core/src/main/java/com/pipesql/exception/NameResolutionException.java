package com.pipesql.exception;

import com.pipesql.diagnostic.Span;

/**
 * Unknown or ambiguous identifier.
 */
public class NameResolutionException extends CompilerException {

    public NameResolutionException(String reason, Span span) {
        super(ErrorKind.NAME_RESOLUTION, ErrorCodes.UNKNOWN_NAME, reason, span);
    }

    public NameResolutionException(String code, String reason, Span span) {
        super(ErrorKind.NAME_RESOLUTION, code, reason, span);
    }
}
