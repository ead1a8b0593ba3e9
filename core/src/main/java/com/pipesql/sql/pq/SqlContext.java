package com.pipesql.sql.pq;

import com.pipesql.sql.Dialect;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * State of one SQL compilation: the dialect, the anchor context, the CTEs
 * produced so far and the options of the query currently being generated.
 */
public final class SqlContext {

    private final Dialect dialect;
    private final AnchorContext anchor;
    private final List<Cte> ctes = new ArrayList<>();
    private final Map<Integer, RelationExpr> relationExprs = new HashMap<>();
    private final Deque<QueryOpts> queryStack = new ArrayDeque<>();
    private QueryOpts query = new QueryOpts();

    public SqlContext(Dialect dialect, AnchorContext anchor) {
        this.dialect = dialect;
        this.anchor = anchor;
    }

    public Dialect dialect() {
        return dialect;
    }

    public AnchorContext anchor() {
        return anchor;
    }

    public QueryOpts query() {
        return query;
    }

    /** Starts a nested query with a copy of the current options. */
    public void pushQuery() {
        queryStack.push(query);
        query = query.copy();
    }

    public void popQuery() {
        query = queryStack.pop();
    }

    List<Cte> ctes() {
        return ctes;
    }

    /** What a relation instance reads, once it has been compiled. */
    public RelationExpr relationExpr(int riid) {
        return relationExprs.get(riid);
    }

    void relationExpr(int riid, RelationExpr expr) {
        relationExprs.put(riid, expr);
    }

    /**
     * Options of the query being generated.
     */
    public static final class QueryOpts {
        private boolean omitIdentPrefix;
        private boolean preProjection;
        private boolean allowCtes = true;
        private boolean allowStars = true;
        private boolean windowFunction;

        QueryOpts copy() {
            QueryOpts copy = new QueryOpts();
            copy.omitIdentPrefix = omitIdentPrefix;
            copy.preProjection = preProjection;
            copy.allowCtes = allowCtes;
            copy.allowStars = allowStars;
            copy.windowFunction = windowFunction;
            return copy;
        }

        /** True when a single relation is in scope, so columns need no table qualifier. */
        public boolean omitIdentPrefix() {
            return omitIdentPrefix;
        }

        public void omitIdentPrefix(boolean value) {
            this.omitIdentPrefix = value;
        }

        /** True while generating clauses evaluated before the projection. */
        public boolean preProjection() {
            return preProjection;
        }

        public void preProjection(boolean value) {
            this.preProjection = value;
        }

        /** False within a recursive CTE, where nested tables become sub-queries. */
        public boolean allowCtes() {
            return allowCtes;
        }

        public void allowCtes(boolean value) {
            this.allowCtes = value;
        }

        public boolean allowStars() {
            return allowStars;
        }

        public void allowStars(boolean value) {
            this.allowStars = value;
        }

        /** True while generating the expression of a window function. */
        public boolean windowFunction() {
            return windowFunction;
        }

        public void windowFunction(boolean value) {
            this.windowFunction = value;
        }
    }
}
