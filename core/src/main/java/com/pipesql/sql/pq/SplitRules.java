package com.pipesql.sql.pq;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Which transforms cannot follow a transform within one SELECT statement.
 *
 * <p>A SELECT evaluates its clauses in a fixed order: FROM, JOIN, WHERE,
 * GROUP BY, HAVING, window functions, ORDER BY, LIMIT, DISTINCT and set
 * operations. When a pipeline has a transform followed by one that SQL
 * would evaluate earlier, the pipeline is split in between.
 */
public final class SplitRules {

    private static final Map<String, Set<String>> MUST_NOT_FOLLOW = new HashMap<>();

    static {
        initializeRules();
    }

    private SplitRules() {}

    private static void initializeRules() {
        Set<String> take = Set.of("From", "Join", "Compute", "Filter", "Aggregate", "Sort");
        Set<String> distinct = Set.of("From", "Join", "Compute", "Filter", "Aggregate", "Sort", "Take");
        Set<String> setOperation = Set.of("From", "Join", "Compute", "Filter", "Aggregate", "Sort", "Take",
                                          "Distinct");

        MUST_NOT_FOLLOW.put("From", Set.of("From"));
        MUST_NOT_FOLLOW.put("Join", Set.of("From"));
        MUST_NOT_FOLLOW.put("Aggregate", Set.of("From", "Join", "Aggregate", "Compute"));
        MUST_NOT_FOLLOW.put("Filter", Set.of("From", "Join"));
        MUST_NOT_FOLLOW.put("Compute", Set.of("From", "Join", "Filter"));
        MUST_NOT_FOLLOW.put("Sort", Set.of("From", "Join", "Compute", "Aggregate"));
        MUST_NOT_FOLLOW.put("Take", take);
        MUST_NOT_FOLLOW.put("DistinctOn", Set.of("From", "Join", "Compute", "Filter", "Aggregate", "Sort",
                                                 "Take", "DistinctOn"));
        MUST_NOT_FOLLOW.put("Distinct", distinct);
        MUST_NOT_FOLLOW.put("Union", setOperation);
        MUST_NOT_FOLLOW.put("Except", setOperation);
        MUST_NOT_FOLLOW.put("Intersect", setOperation);
    }

    /**
     * Returns true when a transform of kind {@code kind} cannot share a SELECT with
     * the transforms of the kinds in {@code following}. A loop must be the last
     * transform of its statement.
     */
    public static boolean splitRequired(String kind, Set<String> following) {
        if (kind.equals("Loop")) {
            return !following.isEmpty();
        }
        Set<String> forbidden = MUST_NOT_FOLLOW.get(kind);
        if (forbidden == null) {
            return false;
        }
        for (String f : following) {
            if (forbidden.contains(f)) {
                return true;
            }
        }
        return false;
    }
}
