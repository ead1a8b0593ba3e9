package com.pipesql.test;

import com.pipesql.api.CompileOptions;
import com.pipesql.api.CompileResult;
import com.pipesql.api.Compiler;
import com.pipesql.diagnostic.Diagnostic;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.TestInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Base class of the test classes: logs each test and offers compile helpers.
 */
public abstract class TestBase {

    protected final Logger logger = LoggerFactory.getLogger(getClass());

    protected static final Compiler COMPILER = new Compiler();

    /** Options producing unsigned, formatted SQL for the generic dialect. */
    protected static final CompileOptions PLAIN = CompileOptions.builder()
        .signatureComment(false)
        .build();

    @BeforeEach
    void logTestStart(TestInfo info) {
        logger.debug("Starting {}", info.getDisplayName());
    }

    @AfterEach
    void logTestEnd(TestInfo info) {
        logger.debug("Finished {}", info.getDisplayName());
    }

    /**
     * Compiles a query without signature comment and fails the test when the
     * compilation reports diagnostics.
     */
    protected String compile(String source) {
        return compile(source, PLAIN);
    }

    protected String compile(String source, CompileOptions options) {
        try (CompileResult result = COMPILER.compile(source, options)) {
            assertThat(result.diagnostics())
                .as("diagnostics of %s", source)
                .isEmpty();
            return result.output();
        }
    }

    /** Compiles a query for a target, unsigned. */
    protected String compile(String source, String target) {
        return compile(source, PLAIN.toBuilder().target(target).build());
    }

    /** Compiles a query expected to fail and returns its diagnostics. */
    protected List<Diagnostic> compileErrors(String source) {
        try (CompileResult result = COMPILER.compile(source, PLAIN)) {
            assertThat(result.output()).isEmpty();
            assertThat(result.diagnostics()).isNotEmpty();
            return result.diagnostics();
        }
    }

    /** Compares SQL ignoring differences in whitespace. */
    protected static void assertSqlEquals(String actual, String expected) {
        assertThat(normalize(actual)).isEqualTo(normalize(expected));
    }

    protected static void assertSqlContains(String actual, String fragment) {
        assertThat(normalize(actual)).contains(normalize(fragment));
    }

    protected static String normalize(String sql) {
        return List.of(sql.trim().split("\\s+")).stream()
            .collect(Collectors.joining(" "))
            .replace("( ", "(")
            .replace(" )", ")");
    }
}
