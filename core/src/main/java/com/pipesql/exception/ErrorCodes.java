package com.pipesql.exception;

/**
 * Machine readable diagnostic codes.
 */
public final class ErrorCodes {

    public static final String UNKNOWN_NAME = "E0001";
    public static final String AMBIGUOUS_NAME = "E0002";
    public static final String UNEXPECTED_TOKEN = "E0003";
    public static final String SYNTAX = "E0004";
    public static final String FRAME_MISMATCH = "E0005";
    public static final String NOT_LOWERABLE = "E0006";
    public static final String NOT_RENDERABLE = "E0007";

    private ErrorCodes() {}
}
