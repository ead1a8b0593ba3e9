package com.pipesql.semantic;

import com.pipesql.diagnostic.Span;
import com.pipesql.exception.CompilerException;
import com.pipesql.exception.NameResolutionException;
import com.pipesql.ir.pl.Expr;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A named scope of declarations. Modules nest; names are looked up in the
 * current module first and then in each enclosing one.
 */
final class Module {

    /** Namespace of database tables. */
    static final String DEFAULT_DB = "default_db";

    private final String path;
    private final Module parent;
    private final Map<String, Object> members = new LinkedHashMap<>();

    Module(String path, Module parent) {
        this.path = path;
        this.parent = parent;
    }

    static Module root() {
        return new Module("", null);
    }

    String path() {
        return path;
    }

    Module parent() {
        return parent;
    }

    String qualify(String name) {
        return path.isEmpty() ? name : path + "." + name;
    }

    Module submodule(String name, Span span) {
        Object existing = members.get(name);
        if (existing instanceof Module module) {
            return module;
        }
        if (existing != null) {
            throw new NameResolutionException("`" + name + "` is already declared", span);
        }
        Module module = new Module(qualify(name), this);
        members.put(name, module);
        return module;
    }

    Let declare(String name, Expr value, Span span) {
        if (members.containsKey(name)) {
            throw new NameResolutionException("`" + name + "` is already declared", span);
        }
        Let let = new Let(name, qualify(name), value, this, span);
        members.put(name, let);
        return let;
    }

    Iterable<Object> members() {
        return members.values();
    }

    /**
     * Finds the declaration an identifier refers to, searching enclosing modules.
     *
     * @return the declaration, or null when there is none
     */
    Let lookup(List<String> parts) {
        for (Module scope = this; scope != null; scope = scope.parent) {
            Object found = scope.members.get(parts.get(0));
            int consumed = 1;
            while (consumed < parts.size() && found instanceof Module module) {
                found = module.members.get(parts.get(consumed++));
            }
            if (found instanceof Let let && consumed == parts.size()) {
                return let;
            }
        }
        return null;
    }

    /**
     * A {@code let} declaration. Its kind is only known once the value has been
     * looked at: a function, a relation or a constant.
     */
    static final class Let {

        enum State { UNRESOLVED, RESOLVING, FUNCTION, RELATION, CONSTANT, FAILED }

        final String name;
        final String path;
        final Expr value;
        final Module scope;
        final Span span;
        State state = State.UNRESOLVED;
        RelationDecl relation;
        CompilerException error;

        Let(String name, String path, Expr value, Module scope, Span span) {
            this.name = name;
            this.path = path;
            this.value = value;
            this.scope = scope;
            this.span = span;
        }

        @Override
        public String toString() {
            return "let " + path + " (" + state + ")";
        }
    }
}
