package com.pipesql.sql;

import com.pipesql.test.TestBase;
import com.pipesql.test.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * End-to-end SQL generation: each test compiles a query and checks the
 * clauses of the generated statement.
 */
@DisplayName("SQL generation")
@Tag("codegen")
@TestCategories.Integration
public class SqlGenerationTest extends TestBase {

    @Nested
    @DisplayName("Clauses")
    class Clauses {

        @Test
        @DisplayName("sort at the end becomes ORDER BY")
        void orderBy() {
            String sql = compile("from employees | filter age > 30 | sort {-salary}");

            assertSqlContains(sql, "WHERE age > 30");
            assertSqlContains(sql, "ORDER BY salary DESC");
        }

        @Test
        @DisplayName("take with a range becomes LIMIT and OFFSET")
        void limitOffset() {
            String sql = compile("from employees | take 11..20");

            assertSqlContains(sql, "LIMIT 10 OFFSET 10");
        }

        @Test
        @DisplayName("filter after aggregate becomes HAVING")
        void having() {
            String sql = compile(
                "from employees | group department (aggregate {total = sum salary}) | filter total > 100");

            assertSqlContains(sql, "GROUP BY department");
            assertSqlContains(sql, "HAVING");
            assertThat(sql).doesNotContain("WHERE").doesNotContain("WITH");
        }

        @Test
        @DisplayName("filters before and after aggregate go to WHERE and HAVING")
        void whereAndHaving() {
            String sql = compile("""
                from employees
                filter age > 30
                group department (aggregate {n = count this})
                filter n > 3
                """);

            assertSqlContains(sql, "WHERE age > 30");
            assertSqlContains(sql, "HAVING COUNT(*) > 3");
        }

        @Test
        @DisplayName("operands are parenthesized by binding strength")
        void parentheses() {
            String sql = compile("from t | derive {x = (a + b) * 2, y = a + b * 2}");

            assertSqlContains(sql, "(a + b) * 2 AS x");
            assertSqlContains(sql, "a + b * 2 AS y");
        }

        @Test
        @DisplayName("comparison with null becomes IS NULL")
        void isNull() {
            assertSqlContains(compile("from t | filter a == null"), "WHERE a IS NULL");
            assertSqlContains(compile("from t | filter a != null"), "WHERE a IS NOT NULL");
        }

        @Test
        @DisplayName("coalesce operator")
        void coalesce() {
            assertSqlContains(compile("from t | derive {x = a ?? 0}"), "COALESCE(a, 0) AS x");
        }

        @Test
        @DisplayName("s-strings are inlined with their interpolations translated")
        void sString() {
            assertSqlContains(compile("from t | derive {x = s\"UPPER({a})\"}"), "UPPER(a) AS x");
        }
    }

    @Nested
    @DisplayName("Splitting into CTEs")
    class Splitting {

        @Test
        @DisplayName("filter on a window function moves the window into a CTE")
        void windowThenFilter() {
            String sql = compile("from employees | derive {r = row_number this} | filter r < 3");

            assertThat(sql).startsWith("WITH");
            assertSqlContains(sql, "ROW_NUMBER() OVER ()");
            assertSqlContains(sql, "WHERE r < 3");
        }

        @Test
        @DisplayName("filter after take filters the limited rows")
        void takeThenFilter() {
            String sql = compile("from employees | take 10 | filter age > 30");

            assertThat(sql).startsWith("WITH");
            assertSqlContains(sql, "LIMIT 10");
            assertSqlContains(sql, "WHERE age > 30");
            assertThat(normalize(sql).indexOf("LIMIT 10"))
                .isLessThan(normalize(sql).indexOf("WHERE age > 30"));
        }

        @Test
        @DisplayName("a sort before a join still orders the final result")
        void sortBeforeJoin() {
            String sql = compile("from employees | sort age | join departments (==dept_id)");
            String normalized = normalize(sql);

            assertThat(normalized).contains("JOIN");
            assertThat(normalized.split("ORDER BY", -1)).hasSize(2);
            assertThat(normalized.indexOf("ORDER BY")).isGreaterThan(normalized.indexOf("JOIN"));
        }
    }

    @Nested
    @DisplayName("Column qualifiers")
    class Qualifiers {

        @Test
        @DisplayName("a single table needs no qualifiers")
        void singleTable() {
            String sql = compile("from employees | select {name, salary}");

            assertThat(sql).doesNotContain("employees.");
        }

        @Test
        @DisplayName("columns are qualified when a join brings in a second table")
        void joinedTables() {
            String sql = compile(
                "from employees | join departments (==dept_id) | select {employees.name, departments.title}");

            assertSqlContains(sql, "employees.name");
            assertSqlContains(sql, "departments.title");
            assertSqlContains(sql, "JOIN departments ON employees.dept_id = departments.dept_id");
        }
    }

    @Nested
    @DisplayName("Set operations")
    class SetOperations {

        @Test
        @DisplayName("append becomes UNION ALL")
        void append() {
            String sql = compile("from employees | append managers");

            assertSqlEquals(sql, "SELECT * FROM employees UNION ALL SELECT * FROM managers");
        }

        @Test
        @DisplayName("a sort before append orders the whole union")
        void sortBeforeAppend() {
            // Given: the top relation is sorted before the rows of the bottom one are appended
            String sql = compile("from employees | sort name | append managers");
            String normalized = normalize(sql);

            // Then: the union is ordered once, after both sides
            assertSqlContains(sql, "UNION ALL SELECT * FROM managers");
            assertThat(normalized).endsWith("ORDER BY name");
            assertThat(normalized.split("ORDER BY", -1)).hasSize(2);
        }

        @Test
        @DisplayName("an inner join over every column of known relations becomes INTERSECT ALL")
        void intersect() {
            String sql = compile("""
                let a = (from x | select {id})
                let b = (from y | select {id})
                from a
                join b (==id)
                select {a.id}
                """);

            assertSqlContains(sql, "INTERSECT ALL SELECT * FROM b");
            assertThat(sql).doesNotContain("JOIN");
        }

        @Test
        @DisplayName("an anti-join with a null check becomes EXCEPT ALL")
        void except() {
            String sql = compile("""
                let a = (from x | select {id})
                let b = (from y | select {id})
                from a
                join side:left b (==id)
                filter b.id == null
                select {a.id}
                """);

            assertSqlContains(sql, "EXCEPT ALL SELECT * FROM b");
            assertThat(sql).doesNotContain("JOIN");
        }

        @Test
        @DisplayName("dialects without EXCEPT ALL keep the anti-join")
        void exceptWithoutAll() {
            String sql = compile("""
                let a = (from x | select {id})
                let b = (from y | select {id})
                from a
                join side:left b (==id)
                filter b.id == null
                select {a.id}
                """, "sql.duckdb");

            assertSqlContains(sql, "LEFT JOIN b ON a.id = b.id");
            assertThat(sql).doesNotContain("EXCEPT");
        }
    }

    @Nested
    @DisplayName("Join qualification")
    class JoinQualification {

        @Test
        @DisplayName("a join of tables with unknown columns stays a join")
        void ambiguousBareName() {
            // Given: `name` could come from either table
            String sql = compile("from e | join d (==id) | select {e.id, name}");

            // Then: the join is kept and the bare name is left for the database to resolve
            assertSqlEquals(sql, "SELECT e.id, name FROM e JOIN d ON e.id = d.id");
        }

        @Test
        @DisplayName("an inner join of wildcard tables never becomes INTERSECT")
        void wildcardJoin() {
            String sql = compile("from employees | join managers (==id) | select {employees.id}");

            assertSqlContains(sql, "JOIN managers ON employees.id = managers.id");
            assertThat(sql).doesNotContain("INTERSECT");
        }
    }

    @Nested
    @DisplayName("Dialects")
    class Dialects {

        @Test
        @DisplayName("MSSQL pages with OFFSET and FETCH")
        void mssqlFetch() {
            String sql = compile("from employees | take 11..20", "sql.mssql");

            assertSqlContains(sql, "ORDER BY (SELECT NULL) OFFSET 10 ROWS FETCH NEXT 10 ROWS ONLY");
            assertThat(sql).doesNotContain("LIMIT").doesNotContain("TOP");
        }

        @Test
        @DisplayName("MSSQL keeps the sort when paging")
        void mssqlFetchSorted() {
            String sql = compile("from employees | sort name | take 11..20", "sql.mssql");

            assertSqlContains(sql, "ORDER BY name OFFSET 10 ROWS FETCH NEXT 10 ROWS ONLY");
        }

        @Test
        @DisplayName("SQLite writes dates with functions")
        void sqliteDates() {
            assertSqlContains(compile("from t | filter d > @2024-01-01", "sql.sqlite"), "d > DATE('2024-01-01')");
            assertSqlContains(compile("from t | filter d > @2024-01-01"), "d > DATE '2024-01-01'");
        }

        @Test
        @DisplayName("Postgres quotes intervals")
        void postgresIntervals() {
            assertSqlContains(compile("from t | derive {x = d + 10days}", "sql.postgres"),
                "d + INTERVAL '10 DAY' AS x");
            assertSqlContains(compile("from t | derive {x = d + 10days}"), "d + INTERVAL 10 DAY AS x");
        }

        @Test
        @DisplayName("MySQL quotes reserved words with backticks")
        void mysqlQuotes() {
            String sql = compile("from employees | derive {`from` = a}", "sql.mysql");

            assertSqlContains(sql, "a AS `from`");
        }
    }
}
