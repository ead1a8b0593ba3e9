package com.pipesql.api;

import com.pipesql.diagnostic.Diagnostic;
import com.pipesql.exception.ErrorKind;
import com.pipesql.lexer.Token;
import com.pipesql.lexer.TokenKind;
import com.pipesql.test.TestBase;
import com.pipesql.test.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Compiler entry points")
@Tag("api")
@TestCategories.Integration
public class CompilerTest extends TestBase {

    @Nested
    @DisplayName("Scenarios")
    class Scenarios {

        @Test
        @DisplayName("filter and select compile to one formatted SELECT")
        void filterAndSelect() {
            String sql = compile("from employees | filter has_dog | select salary");

            assertThat(sql).isEqualTo("""
                SELECT
                  salary
                FROM
                  employees
                WHERE
                  has_dog
                """);
        }

        @Test
        @DisplayName("take on MSSQL uses TOP instead of LIMIT")
        void takeOnMssql() {
            String sql = compile("from test | take 10", "sql.mssql");

            assertSqlEquals(sql, "SELECT TOP (10) * FROM test");
            assertThat(sql).doesNotContain("LIMIT");
        }

        @Test
        @DisplayName("an unknown word yields no output and one name resolution error")
        void unknownWord() {
            try (CompileResult result = COMPILER.compile("foo", PLAIN)) {
                assertThat(result.output()).isEmpty();
                assertThat(result.diagnostics()).hasSize(1);

                Diagnostic diagnostic = result.diagnostics().get(0);
                assertThat(diagnostic.kind()).isEqualTo(ErrorKind.NAME_RESOLUTION);
                assertThat(diagnostic.code()).isEqualTo("E0001");
                assertThat(diagnostic.span().start()).isZero();
                assertThat(diagnostic.span().end()).isEqualTo(3);
                assertThat(diagnostic.location().startLine()).isZero();
                assertThat(diagnostic.display()).contains("foo");
            }
        }
    }

    @Nested
    @DisplayName("Round trip")
    class RoundTrip {

        @ParameterizedTest(name = "{0}")
        @ValueSource(strings = {
            "from employees | filter has_dog | select salary",
            "from employees | group department (aggregate {total = sum salary}) | filter total > 100",
            "from employees | sort age | join departments (==dept_id) | select {employees.name, departments.title}",
            "from employees | derive {rank = row_number this} | filter rank < 3",
            "prql target:sql.postgres\nfrom orders | take 5..10"
        })
        @DisplayName("compile equals render of lowered intermediate")
        void composedStagesMatchCompile(String source) {
            String direct = compile(source);

            String pl;
            try (CompileResult result = COMPILER.parseToIntermediate(source)) {
                assertThat(result.diagnostics()).isEmpty();
                pl = result.output();
            }
            String rq;
            try (CompileResult result = COMPILER.lowerToRelational(pl)) {
                assertThat(result.diagnostics()).isEmpty();
                rq = result.output();
            }
            try (CompileResult result = COMPILER.renderSql(rq, PLAIN)) {
                assertThat(result.diagnostics()).isEmpty();
                assertThat(result.output()).isEqualTo(direct);
            }
        }
    }

    @Nested
    @DisplayName("Options")
    class Options {

        @Test
        @DisplayName("signature comment follows formatted SQL after a blank line")
        void signatureFormatted() {
            String sql = compile("from t", CompileOptions.defaults());

            assertThat(sql).startsWith("SELECT\n  *\nFROM\n  t\n\n-- Generated by pipesql compiler version:");
            assertThat(sql).contains("target:sql.generic");
            assertThat(sql).endsWith("(https://prql-lang.org)\n");
        }

        @Test
        @DisplayName("signature comment follows unformatted SQL after a space")
        void signatureUnformatted() {
            String sql = compile("from t", CompileOptions.builder().format(false).build());

            assertThat(sql).startsWith("SELECT * FROM t -- Generated by pipesql");
            assertThat(sql).doesNotContain("\n");
        }

        @Test
        @DisplayName("the target of the header applies when the option is sql.any")
        void headerTarget() {
            String sql = compile("prql target:sql.mssql\nfrom t | take 3", CompileOptions.defaults());

            assertSqlContains(sql, "SELECT TOP (3) *");
            assertThat(sql).contains("target:sql.mssql");
        }

        @Test
        @DisplayName("an explicit target wins over the header")
        void explicitTargetWins() {
            String sql = compile("prql target:sql.mssql\nfrom t | take 3", "sql.postgres");

            assertSqlContains(sql, "LIMIT 3");
        }

        @Test
        @DisplayName("an unknown target is rejected with the valid names")
        void unknownTarget() {
            assertThatThrownBy(() -> CompileOptions.builder().target("sql.nope"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Valid values")
                .hasMessageContaining("sql.postgres");
        }
    }

    @Nested
    @DisplayName("Other entry points")
    class OtherEntryPoints {

        @Test
        @DisplayName("tokenize returns the tokens of the query")
        void tokenize() {
            List<Token> tokens = COMPILER.tokenize("from t | take 1");

            assertThat(tokens).extracting(Token::kind)
                .startsWith(TokenKind.IDENT, TokenKind.IDENT, TokenKind.PIPE, TokenKind.IDENT, TokenKind.INTEGER);
            assertThat(tokens.get(0).value()).isEqualTo("from");
        }

        @Test
        @DisplayName("resolveToPl reports the lineage of the main relation")
        void resolveToPl() {
            try (CompileResult result = COMPILER.resolveToPl("from employees | select {name, age}")) {
                assertThat(result.isSuccess()).isTrue();
                assertThat(result.output()).contains("employees").contains("name").contains("age");
            }
        }

        @Test
        @DisplayName("invalid RQ JSON is reported, not thrown")
        void invalidRqJson() {
            try (CompileResult result = COMPILER.renderSql("not json", PLAIN)) {
                assertThat(result.output()).isEmpty();
                assertThat(result.diagnostics()).hasSize(1);
            }
        }

        @Test
        @DisplayName("several independent errors are reported together")
        void accumulatesErrors() {
            List<Diagnostic> diagnostics = compileErrors("""
                let a = (from x | select {missing_fn 1})
                let b = (from y | select {other_fn 2})
                from a
                """);

            assertThat(diagnostics).hasSizeGreaterThanOrEqualTo(2);
        }

        @Test
        @DisplayName("a query without main pipeline reports an error located at the source")
        void missingMainPipeline() {
            List<Diagnostic> diagnostics = compileErrors("");

            assertThat(diagnostics).singleElement().satisfies(d -> {
                assertThat(d.kind()).isEqualTo(ErrorKind.LOWERING);
                assertThat(d.reason()).isEqualTo("Missing main pipeline");
                assertThat(d.span()).isNotNull();
                assertThat(d.location()).isNotNull();
            });
        }
    }
}
