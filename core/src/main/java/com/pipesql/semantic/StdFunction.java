package com.pipesql.semantic;

import java.util.List;
import java.util.Objects;

/**
 * Declaration of a standard library function.
 *
 * @param name fully qualified name, such as {@code std.sum} or {@code std.math.abs}
 * @param kind how calls are resolved
 * @param params positional parameters; for transforms the last one is the input relation
 * @param namedParams accepted named parameters
 */
public record StdFunction(String name, FunctionKind kind, List<String> params, List<String> namedParams) {

    public StdFunction {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        params = List.copyOf(params);
        namedParams = List.copyOf(namedParams);
    }

    public int arity() {
        return params.size();
    }

    public boolean isTransform() {
        return kind == FunctionKind.TRANSFORM;
    }

    /** Name without the {@code std.} prefix. */
    public String shortName() {
        return name.substring(StdLib.NS_STD.length() + 1);
    }
}
