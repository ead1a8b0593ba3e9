package com.pipesql.diagnostic;

import com.pipesql.exception.CodegenException;
import com.pipesql.exception.CompilationFailedException;
import com.pipesql.exception.ErrorKind;
import com.pipesql.exception.LoweringException;
import com.pipesql.exception.NameResolutionException;
import com.pipesql.test.TestBase;
import com.pipesql.test.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Diagnostics")
@TestCategories.Unit
public class DiagnosticsTest extends TestBase {

    private static final String SOURCE = "from employees\nselect foo";

    @Nested
    @DisplayName("Conversion")
    class Conversion {

        @Test
        @DisplayName("a compiler error keeps its kind, code and span")
        void compilerError() {
            // Given an unknown name on the second line
            NameResolutionException error = new NameResolutionException("Unknown name `foo`", new Span(22, 25));

            // When
            List<Diagnostic> diagnostics = Diagnostics.from(error, SOURCE);

            // Then
            assertThat(diagnostics).hasSize(1);
            Diagnostic diagnostic = diagnostics.get(0);
            assertThat(diagnostic.kind()).isEqualTo(ErrorKind.NAME_RESOLUTION);
            assertThat(diagnostic.code()).isEqualTo("E0001");
            assertThat(diagnostic.reason()).isEqualTo("Unknown name `foo`");
            assertThat(diagnostic.location()).isEqualTo(new SourceLocation(1, 7, 1, 10));
        }

        @Test
        @DisplayName("accumulated errors become one diagnostic each")
        void accumulated() {
            CompilationFailedException failure = new CompilationFailedException(List.of(
                new NameResolutionException("Unknown name `a`", new Span(0, 1)),
                new NameResolutionException("Unknown name `b`", new Span(2, 3))));

            List<Diagnostic> diagnostics = Diagnostics.from(failure, "a b");

            assertThat(diagnostics).extracting(Diagnostic::reason)
                .containsExactly("Unknown name `a`", "Unknown name `b`");
        }

        @Test
        @DisplayName("unexpected exceptions are reported as internal codegen errors")
        void internalError() {
            List<Diagnostic> diagnostics = Diagnostics.from(new IllegalStateException("broken"), SOURCE);

            assertThat(diagnostics).singleElement().satisfies(d -> {
                assertThat(d.kind()).isEqualTo(ErrorKind.CODEGEN);
                assertThat(d.code()).isEqualTo("E0007");
                assertThat(d.reason()).isEqualTo("internal compiler error: broken");
                assertThat(d.span()).isEqualTo(new Span(0, SOURCE.length()));
                assertThat(d.location()).isEqualTo(new SourceLocation(0, 0, 1, 10));
            });
        }

        @Test
        @DisplayName("an error without a position covers the whole source")
        void errorWithoutSpan() {
            // Given an error raised where no source position is known
            LoweringException error = new LoweringException("Missing main pipeline", (Span) null);

            // When
            Diagnostic diagnostic = Diagnostics.toDiagnostic(error, SOURCE);

            // Then
            assertThat(diagnostic.span()).isEqualTo(new Span(0, 25));
            assertThat(diagnostic.location()).isEqualTo(new SourceLocation(0, 0, 1, 10));
            assertThat(diagnostic.display()).contains("1 | from employees", "2 | select foo");
        }

        @Test
        @DisplayName("without source text there is no location")
        void noSource() {
            CodegenException error = new CodegenException("unknown function std.nope", new Span(0, 4));

            Diagnostic diagnostic = Diagnostics.toDiagnostic(error, null);

            assertThat(diagnostic.location()).isNull();
            assertThat(diagnostic.display()).isEqualTo("Error[E0007]: unknown function std.nope\n");
        }
    }

    @Nested
    @DisplayName("Rendering")
    class Rendering {

        @Test
        @DisplayName("the excerpt underlines the span")
        void excerpt() {
            NameResolutionException error = new NameResolutionException("Unknown name `foo`", new Span(22, 25));
            error.withHint("did you mean `for`?");

            String display = Diagnostics.toDiagnostic(error, SOURCE).display();

            assertThat(display).isEqualTo(
                "Error[E0001]: Unknown name `foo`\n"
                    + " --> 2:8\n"
                    + "  |\n"
                    + "2 | select foo\n"
                    + "  |        ^^^\n"
                    + " = hint: did you mean `for`?\n");
        }

        @Test
        @DisplayName("an empty span still gets one caret")
        void emptySpan() {
            NameResolutionException error = new NameResolutionException("Unexpected end of input", new Span(4, 4));

            String display = Diagnostics.toDiagnostic(error, "from").display();

            assertThat(display).endsWith("1 | from\n  |     ^\n");
        }
    }

    @Nested
    @DisplayName("Spans")
    class Spans {

        @Test
        void merge() {
            assertThat(Span.merge(new Span(3, 5), new Span(1, 4))).isEqualTo(new Span(1, 5));
            assertThat(Span.merge(null, new Span(1, 2))).isEqualTo(new Span(1, 2));
        }

        @Test
        void invalid() {
            assertThatThrownBy(() -> new Span(5, 2)).isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("locations count lines and columns from zero")
        void location() {
            assertThat(SourceLocation.of("ab\ncd", new Span(3, 5))).isEqualTo(new SourceLocation(1, 0, 1, 2));
        }
    }
}
