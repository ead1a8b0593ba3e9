package com.pipesql.semantic;

import com.pipesql.diagnostic.Diagnostic;
import com.pipesql.exception.ErrorKind;
import com.pipesql.test.TestBase;
import com.pipesql.test.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Name resolution")
@Tag("resolver")
@TestCategories.Integration
public class ResolverTest extends TestBase {

    @Nested
    @DisplayName("Declarations")
    class Declarations {

        @Test
        @DisplayName("a relation declared with let becomes a CTE")
        void letRelation() {
            String sql = compile("""
                let recent = (from employees | sort {-hired} | take 5)

                from recent
                select {name}
                """);

            assertSqlContains(sql, "WITH recent AS (");
            assertSqlContains(sql, "FROM recent");
        }

        @Test
        @DisplayName("user functions are inlined at each call")
        void functions() {
            String sql = compile("""
                let double = x -> x * 2

                from t
                derive {y = double a, z = double b}
                """);

            assertSqlContains(sql, "a * 2 AS y");
            assertSqlContains(sql, "b * 2 AS z");
        }

        @Test
        @DisplayName("a declaration referring to itself is reported")
        void selfReference() {
            List<Diagnostic> errors = compileErrors("let a = (from a)\n\nfrom a");

            assertThat(errors).anySatisfy(d -> assertThat(d.reason()).contains("refers to itself"));
        }
    }

    @Nested
    @DisplayName("Unknown names")
    class UnknownNames {

        @Test
        @DisplayName("a bare unknown word spans exactly the word")
        void bareWord() {
            List<Diagnostic> errors = compileErrors("\n  foo");

            assertThat(errors).singleElement().satisfies(d -> {
                assertThat(d.kind()).isEqualTo(ErrorKind.NAME_RESOLUTION);
                assertThat(d.reason()).isEqualTo("Unknown name `foo`");
                assertThat(d.location().startLine()).isEqualTo(1);
                assertThat(d.location().startColumn()).isEqualTo(2);
            });
        }

        @Test
        @DisplayName("an unknown function is a name resolution error")
        void unknownFunction() {
            List<Diagnostic> errors = compileErrors("from t | derive {x = frobnicate a}");

            assertThat(errors).singleElement().satisfies(d -> {
                assertThat(d.kind()).isEqualTo(ErrorKind.NAME_RESOLUTION);
                assertThat(d.code()).isEqualTo("E0001");
                assertThat(d.reason()).isEqualTo("Unknown function `frobnicate`");
            });
        }

        @Test
        @DisplayName("independent failing declarations are all reported")
        void accumulates() {
            List<Diagnostic> errors = compileErrors("""
                let a = (from t | derive {x = nope1 y})
                let b = (from t | derive {x = nope2 y})

                from a
                join b (==x)
                """);

            assertThat(errors).extracting(Diagnostic::reason)
                .contains("Unknown function `nope1`", "Unknown function `nope2`");
        }
    }
}
