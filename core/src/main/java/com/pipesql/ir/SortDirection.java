package com.pipesql.ir;

/**
 * Sort direction of a column sort.
 */
public enum SortDirection {
    ASC,
    DESC
}
