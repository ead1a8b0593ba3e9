package com.pipesql.semantic;

/**
 * Category of a standard library function, which decides how a call is resolved.
 */
public enum FunctionKind {
    /** Relational operation applied to a frame. */
    TRANSFORM,
    /** Aggregate over a group, or over a window when used outside {@code aggregate}. */
    AGGREGATION,
    /** Function that is only valid over a window. */
    WINDOW,
    /** Row-level function or operator. */
    SCALAR
}
