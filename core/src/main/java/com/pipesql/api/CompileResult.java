package com.pipesql.api;

import com.pipesql.diagnostic.Diagnostic;

import java.util.List;

/**
 * Output of one entry point together with its diagnostics.
 *
 * <p>The output is empty whenever a diagnostic was reported. A result owns its
 * output until it is closed; any access afterwards fails:
 * <pre>{@code
 * try (CompileResult result = compiler.compile(source, CompileOptions.defaults())) {
 *     if (result.isSuccess()) {
 *         run(result.output());
 *     }
 * }
 * }</pre>
 */
public final class CompileResult implements AutoCloseable {

    private String output;
    private List<Diagnostic> diagnostics;
    private boolean closed = false;

    CompileResult(String output, List<Diagnostic> diagnostics) {
        this.output = output;
        this.diagnostics = List.copyOf(diagnostics);
    }

    static CompileResult success(String output) {
        return new CompileResult(output, List.of());
    }

    static CompileResult failure(List<Diagnostic> diagnostics) {
        return new CompileResult("", diagnostics);
    }

    public String output() {
        ensureOpen();
        return output;
    }

    public List<Diagnostic> diagnostics() {
        ensureOpen();
        return diagnostics;
    }

    public boolean isSuccess() {
        ensureOpen();
        return diagnostics.isEmpty();
    }

    public boolean isClosed() {
        return closed;
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("CompileResult is closed");
        }
    }

    /** Releases the output and diagnostics. Closing twice has no effect. */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        output = null;
        diagnostics = null;
    }
}
