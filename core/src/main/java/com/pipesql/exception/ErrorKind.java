package com.pipesql.exception;

/**
 * Compilation stage an error belongs to.
 */
public enum ErrorKind {
    LEX("LexError"),
    PARSE("ParseError"),
    NAME_RESOLUTION("NameResolutionError"),
    FRAME("FrameError"),
    LOWERING("LoweringError"),
    CODEGEN("CodegenError");

    private final String displayName;

    ErrorKind(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }
}
