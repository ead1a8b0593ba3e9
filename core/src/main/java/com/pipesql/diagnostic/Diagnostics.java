package com.pipesql.diagnostic;

import com.pipesql.exception.CodegenException;
import com.pipesql.exception.CompilationFailedException;
import com.pipesql.exception.CompilerException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts compiler errors into {@link Diagnostic}s with rendered source excerpts.
 */
public final class Diagnostics {

    private static final Logger logger = LoggerFactory.getLogger(Diagnostics.class);

    private Diagnostics() {}

    /**
     * Converts any throwable escaping a compilation into diagnostics.
     *
     * <p>Errors that are not {@link CompilerException}s are reported as internal
     * codegen errors so that nothing is dropped silently.
     *
     * @param error the failure
     * @param source the source text, or null when the input was not source text
     * @return one diagnostic per reported problem
     */
    public static List<Diagnostic> from(Throwable error, String source) {
        List<Diagnostic> result = new ArrayList<>();
        if (error instanceof CompilationFailedException failed) {
            for (CompilerException e : failed.errors()) {
                result.add(toDiagnostic(e, source));
            }
        } else if (error instanceof CompilerException e) {
            result.add(toDiagnostic(e, source));
        } else {
            logger.warn("Internal error during compilation", error);
            result.add(toDiagnostic(new CodegenException("internal compiler error: " + error.getMessage(), error),
                                    source));
        }
        return result;
    }

    /**
     * Converts one compiler error. An error without a position in the source is
     * attributed to the whole source.
     */
    public static Diagnostic toDiagnostic(CompilerException e, String source) {
        Span span = e.span();
        SourceLocation location = null;
        if (source != null) {
            if (span == null) {
                span = new Span(0, source.length());
            }
            location = SourceLocation.of(source, span);
        }
        String display = render(e, source, location);
        return new Diagnostic(e.kind(), e.code(), e.reason(), e.hints(), span, display, location);
    }

    /**
     * Renders an excerpt of the source with the span underlined.
     *
     * <pre>
     * Error: Unknown name `x`
     *  --&gt; 1:1
     *   |
     * 1 | x
     *   | ^
     *   = hint: ...
     * </pre>
     */
    static String render(CompilerException e, String source, SourceLocation location) {
        StringBuilder sb = new StringBuilder();
        sb.append("Error");
        if (e.code() != null) {
            sb.append('[').append(e.code()).append(']');
        }
        sb.append(": ").append(e.reason()).append('\n');

        if (location != null) {
            String[] lines = source.split("\n", -1);
            int width = String.valueOf(location.endLine() + 1).length();
            String pad = " ".repeat(width);
            sb.append(pad).append("--> ")
              .append(location.startLine() + 1).append(':').append(location.startColumn() + 1)
              .append('\n');
            sb.append(pad).append(" |\n");
            for (int line = location.startLine(); line <= location.endLine() && line < lines.length; line++) {
                String text = lines[line];
                sb.append(String.format("%" + width + "d", line + 1)).append(" | ").append(text).append('\n');

                int from = line == location.startLine() ? location.startColumn() : 0;
                int to = line == location.endLine() ? location.endColumn() : text.length();
                int carets = Math.max(1, to - from);
                sb.append(pad).append(" | ")
                  .append(" ".repeat(from))
                  .append("^".repeat(carets))
                  .append('\n');
            }
        }
        for (String hint : e.hints()) {
            sb.append(" = hint: ").append(hint).append('\n');
        }
        return sb.toString();
    }
}
