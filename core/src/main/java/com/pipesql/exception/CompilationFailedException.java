package com.pipesql.exception;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Thrown by a stage that accumulated one or more errors before giving up.
 *
 * <p>Lexing, parsing and resolution collect every independent problem they find
 * so a single compile call can report all of them.
 */
public class CompilationFailedException extends RuntimeException {

    private final List<CompilerException> errors;

    public CompilationFailedException(List<? extends CompilerException> errors) {
        super(summarize(errors));
        if (errors.isEmpty()) {
            throw new IllegalArgumentException("errors must not be empty");
        }
        this.errors = List.copyOf(errors);
    }

    public static CompilationFailedException of(CompilerException error) {
        CompilationFailedException failure = new CompilationFailedException(List.of(error));
        failure.initCause(error);
        return failure;
    }

    public List<CompilerException> errors() {
        return errors;
    }

    private static String summarize(List<? extends CompilerException> errors) {
        Objects.requireNonNull(errors, "errors must not be null");
        return errors.stream()
            .map(CompilerException::getTechnicalMessage)
            .collect(Collectors.joining("\n"));
    }
}
