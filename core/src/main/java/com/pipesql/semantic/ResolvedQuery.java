package com.pipesql.semantic;

import com.pipesql.ir.QueryDef;
import com.pipesql.ir.pl.Expr;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Output of name resolution: the resolved main pipeline and every relation it
 * may read, keyed by their fully qualified names.
 */
public record ResolvedQuery(QueryDef def, Expr main, Map<String, RelationDecl> relations) {

    public ResolvedQuery {
        def = def == null ? QueryDef.EMPTY : def;
        Objects.requireNonNull(main, "main must not be null");
        relations = Collections.unmodifiableMap(new LinkedHashMap<>(relations));
    }

    public RelationDecl relation(String key) {
        RelationDecl decl = relations.get(key);
        if (decl == null) {
            throw new IllegalArgumentException("Unknown relation " + key);
        }
        return decl;
    }
}
