package com.pipesql.sql.pq;

import java.util.List;

/**
 * A table known to the SQL backend: a database table, a CTE, or a relation
 * that has not been defined yet.
 */
public final class SqlTableDecl {

    private final int id;
    private List<String> name;
    private Integer redirectTo;
    private RelationAdapter pending;

    SqlTableDecl(int id, List<String> name, RelationAdapter pending) {
        this.id = id;
        this.name = name;
        this.pending = pending;
    }

    public int id() {
        return id;
    }

    /** Name parts of the table, or null until one is assigned. */
    public List<String> name() {
        return name;
    }

    void name(List<String> name) {
        this.name = name;
    }

    /** Table every reference to this one is redirected to, or null. */
    public Integer redirectTo() {
        return redirectTo;
    }

    void redirectTo(Integer tid) {
        this.redirectTo = tid;
    }

    public boolean isDefined() {
        return pending == null;
    }

    RelationAdapter pending() {
        return pending;
    }

    void pending(RelationAdapter relation) {
        this.pending = relation;
    }

    /**
     * Marks the table as defined and returns the relation that defines it, or null
     * when it was defined already.
     */
    RelationAdapter takeToDefine() {
        RelationAdapter relation = pending;
        pending = null;
        return relation;
    }
}
