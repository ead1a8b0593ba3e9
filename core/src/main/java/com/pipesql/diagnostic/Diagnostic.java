package com.pipesql.diagnostic;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.pipesql.exception.ErrorKind;

import java.util.List;
import java.util.Objects;

/**
 * A compilation problem reported back to the caller.
 *
 * @param kind the stage that raised the problem
 * @param code machine readable code, may be null
 * @param reason human readable description
 * @param hints follow-up suggestions, possibly empty
 * @param span offending source range, may be null
 * @param display pre-rendered source excerpt, may be null
 * @param location line and column form of the span, may be null
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Diagnostic(
    ErrorKind kind,
    String code,
    String reason,
    List<String> hints,
    Span span,
    String display,
    SourceLocation location
) {

    public Diagnostic {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(reason, "reason must not be null");
        hints = hints == null ? List.of() : List.copyOf(hints);
    }

    @Override
    public String toString() {
        return display != null ? display : kind.displayName() + ": " + reason;
    }
}
