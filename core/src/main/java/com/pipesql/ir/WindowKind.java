package com.pipesql.ir;

/**
 * Unit a window frame is measured in.
 */
public enum WindowKind {
    ROWS,
    RANGE
}
