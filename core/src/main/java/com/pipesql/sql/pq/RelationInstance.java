package com.pipesql.sql.pq;

import com.pipesql.ir.rq.TableRef;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * One use of a table within a pipeline.
 *
 * <p>{@code cidRedirects} maps the ids a split pipeline used before the split to
 * the ids of this instance's columns.
 */
public final class RelationInstance {

    private final int riid;
    private final int source;
    private final List<TableRef.TableColumn> columns;
    private final Map<Integer, Integer> cidRedirects;
    private final List<Integer> originalCids;
    private String name;

    RelationInstance(int riid, TableRef tableRef, Map<Integer, Integer> cidRedirects) {
        this.riid = riid;
        this.source = tableRef.source();
        this.columns = new ArrayList<>(tableRef.columns());
        this.name = tableRef.name();
        this.cidRedirects = cidRedirects;
        this.originalCids = tableRef.columns().stream().map(TableRef.TableColumn::cid).toList();
    }

    public int riid() {
        return riid;
    }

    /** Id of the referenced table. */
    public int source() {
        return source;
    }

    /** Columns still read from the table; unused ones are pruned. */
    public List<TableRef.TableColumn> columns() {
        return columns;
    }

    public List<Integer> cids() {
        return columns.stream().map(TableRef.TableColumn::cid).toList();
    }

    public Map<Integer, Integer> cidRedirects() {
        return cidRedirects;
    }

    /** Every column of the table, including pruned ones; a star selects all of them. */
    public List<Integer> originalCids() {
        return originalCids;
    }

    /** Alias of the instance, or null until one is assigned. */
    public String name() {
        return name;
    }

    void name(String name) {
        this.name = name;
    }
}
