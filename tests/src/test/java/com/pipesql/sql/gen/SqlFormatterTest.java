package com.pipesql.sql.gen;

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

@DisplayName("SqlFormatter")
@Tag("formatter")
@TestCategories.Unit
public class SqlFormatterTest extends TestBase {

    @Nested
    @DisplayName("Layout")
    class Layout {

        @Test
        @DisplayName("each clause keyword starts a line with its content indented")
        void clauses() {
            String sql = SqlFormatter.format("SELECT salary FROM employees WHERE has_dog");

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
        @DisplayName("list items go on their own lines")
        void lists() {
            String sql = SqlFormatter.format("SELECT a, b FROM t ORDER BY a, b DESC");

            assertThat(sql).isEqualTo("""
                SELECT
                  a,
                  b
                FROM
                  t
                ORDER BY
                  a,
                  b DESC
                """);
        }

        @Test
        @DisplayName("TOP and DISTINCT stay on the SELECT line")
        void modifiers() {
            assertThat(SqlFormatter.format("SELECT TOP (10) * FROM test")).isEqualTo("""
                SELECT TOP (10)
                  *
                FROM
                  test
                """);
            assertThat(SqlFormatter.format("SELECT DISTINCT ON (a) a, b FROM t")).isEqualTo("""
                SELECT DISTINCT ON (a)
                  a,
                  b
                FROM
                  t
                """);
        }

        @Test
        @DisplayName("CTEs are laid out as indented blocks")
        void ctes() {
            String sql = SqlFormatter.format(
                "WITH table_0 AS (SELECT a, ROW_NUMBER() OVER () AS r FROM t) SELECT a FROM table_0 WHERE r < 3");

            assertThat(sql).isEqualTo("""
                WITH table_0 AS (
                  SELECT
                    a,
                    ROW_NUMBER() OVER () AS r
                  FROM
                    t
                )
                SELECT
                  a
                FROM
                  table_0
                WHERE
                  r < 3
                """);
        }

        @Test
        @DisplayName("short sub-queries stay inline")
        void inlineSubquery() {
            String sql = SqlFormatter.format(
                "SELECT a FROM t ORDER BY (SELECT NULL) OFFSET 0 ROWS FETCH NEXT 5 ROWS ONLY");

            assertThat(sql).isEqualTo("""
                SELECT
                  a
                FROM
                  t
                ORDER BY
                  (SELECT NULL)
                OFFSET
                  0 ROWS
                FETCH NEXT
                  5 ROWS ONLY
                """);
        }

        @Test
        @DisplayName("joins are indented under FROM")
        void joins() {
            String sql = SqlFormatter.format("SELECT e.a FROM e LEFT JOIN d ON e.x = d.x");

            assertThat(sql).isEqualTo("""
                SELECT
                  e.a
                FROM
                  e
                  LEFT JOIN d ON e.x = d.x
                """);
        }

        @Test
        @DisplayName("comments go on their own line after a blank line")
        void comments() {
            assertThat(SqlFormatter.format("SELECT * FROM t -- generated")).isEqualTo("""
                SELECT
                  *
                FROM
                  t

                -- generated
                """);
        }

        @Test
        void emptyInput() {
            assertThat(SqlFormatter.format("")).isEmpty();
            assertThat(SqlFormatter.format("  \n ")).isEmpty();
        }
    }

    @Nested
    @DisplayName("Tokens")
    class Tokens {

        @Test
        @DisplayName("quoted sections are single tokens")
        void quoted() {
            List<SqlFormatter.Token> tokens = SqlFormatter.tokenize("SELECT 'a ( b', \"x y\" FROM t");

            assertThat(tokens).extracting(SqlFormatter.Token::text)
                .containsExactly("SELECT", "'a ( b'", ",", "\"x y\"", "FROM", "t");
        }

        @Test
        @DisplayName("doubled quotes do not end a string")
        void escapedQuotes() {
            List<SqlFormatter.Token> tokens = SqlFormatter.tokenize("'it''s' x");

            assertThat(tokens).extracting(SqlFormatter.Token::text).containsExactly("'it''s'", "x");
        }

        @Test
        @DisplayName("spacing before each token is recorded")
        void spacing() {
            List<SqlFormatter.Token> tokens = SqlFormatter.tokenize("f(a) b");

            assertThat(tokens).extracting(SqlFormatter.Token::spaceBefore)
                .containsExactly(false, false, false, false, true);
        }
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "SELECT salary FROM employees WHERE has_dog",
        "WITH table_0 AS (SELECT a, ROW_NUMBER() OVER () AS r FROM t) SELECT a FROM table_0 WHERE r < 3",
        "SELECT * FROM (SELECT a, b FROM t WHERE a > 1) AS table_1 UNION ALL SELECT * FROM u",
        "SELECT TOP (3) a FROM t ORDER BY a -- Generated by pipesql",
        "SELECT e.a, d.b FROM e INNER JOIN d ON e.x = d.x GROUP BY e.a, d.b HAVING COUNT(*) > 1"
    })
    @DisplayName("formatting is idempotent")
    void idempotent(String sql) {
        String once = SqlFormatter.format(sql);

        assertThat(SqlFormatter.format(once)).isEqualTo(once);
    }
}
