package com.pipesql.exception;

import com.pipesql.diagnostic.Span;

/**
 * Grammar violation detected by the parser.
 */
public class ParseException extends CompilerException {

    public ParseException(String reason, Span span) {
        super(ErrorKind.PARSE, ErrorCodes.SYNTAX, reason, span);
    }

    public ParseException(String code, String reason, Span span) {
        super(ErrorKind.PARSE, code, reason, span);
    }
}
