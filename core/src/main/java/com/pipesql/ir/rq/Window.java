package com.pipesql.ir.rq;

import com.pipesql.ir.ColumnSort;

import java.util.List;

/**
 * Window a computed column is evaluated over.
 */
public record Window(WindowFrame frame, List<Integer> partition, List<ColumnSort<Integer>> sort) {

    public Window {
        frame = frame == null ? WindowFrame.DEFAULT : frame;
        partition = partition == null ? List.of() : List.copyOf(partition);
        sort = sort == null ? List.of() : List.copyOf(sort);
    }
}
