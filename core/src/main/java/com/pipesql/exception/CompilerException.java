package com.pipesql.exception;

import com.pipesql.diagnostic.Span;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Base class of every error raised while compiling a query.
 *
 * <p>Each error carries the stage it was raised in, an optional machine readable
 * code, the source span it refers to and a list of hints. Spans may be attached
 * after construction by a stage that knows more about the position than the code
 * that detected the problem.
 *
 * <p>Example usage:
 * <pre>
 *   try {
 *       resolver.resolve(stmts);
 *   } catch (CompilerException e) {
 *       System.err.println(e.getUserMessage());
 *   }
 * </pre>
 */
public abstract class CompilerException extends RuntimeException {

    private final ErrorKind kind;
    private final String code;
    private final List<String> hints = new ArrayList<>();
    private Span span;

    protected CompilerException(ErrorKind kind, String code, String reason, Span span) {
        super(reason);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.code = code;
        this.span = span;
    }

    protected CompilerException(ErrorKind kind, String code, String reason, Span span, Throwable cause) {
        super(reason, cause);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.code = code;
        this.span = span;
    }

    public ErrorKind kind() {
        return kind;
    }

    /**
     * Returns the machine readable error code, or null when the error has none.
     */
    public String code() {
        return code;
    }

    public String reason() {
        return getMessage();
    }

    public Span span() {
        return span;
    }

    public List<String> hints() {
        return Collections.unmodifiableList(hints);
    }

    /**
     * Attaches a hint shown below the reason.
     *
     * @return this exception, for chaining
     */
    public CompilerException withHint(String hint) {
        hints.add(Objects.requireNonNull(hint, "hint must not be null"));
        return this;
    }

    /**
     * Attaches a span unless one is already present.
     *
     * @return this exception, for chaining
     */
    public CompilerException withSpanIfAbsent(Span span) {
        if (this.span == null) {
            this.span = span;
        }
        return this;
    }

    /**
     * Returns the reason followed by any hints, suitable for end users.
     */
    public String getUserMessage() {
        StringBuilder sb = new StringBuilder(getMessage());
        for (String hint : hints) {
            sb.append("\n  hint: ").append(hint);
        }
        return sb.toString();
    }

    /**
     * Returns a detailed message including stage, code, span and cause.
     */
    public String getTechnicalMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append(kind.displayName());
        if (code != null) {
            sb.append('[').append(code).append(']');
        }
        sb.append(": ").append(getMessage());
        if (span != null) {
            sb.append(" at ").append(span);
        }
        if (getCause() != null) {
            sb.append("\nCause: ")
              .append(getCause().getClass().getSimpleName())
              .append(": ")
              .append(getCause().getMessage());
        }
        return sb.toString();
    }
}
